package io.fairlens.drift;

/*
 * Copyright (c) fairlens
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/// The outcome of one detection method for one metric series.
///
/// @param systemId the monitored system
/// @param metric the series name
/// @param timestamp when the check ran
/// @param method the detection method
/// @param baselineValue baseline mean (control chart: the center line)
/// @param currentValue current mean (control chart: the most recent value)
/// @param change signed `currentValue − baselineValue`
/// @param percentChange change relative to the baseline in percent; empty for a zero baseline
/// @param severity the severity this method reports
/// @param flagged whether the method's own test fired
/// @param pValue t-test p-value, statistical method only
/// @param sigmaDistance `(value − mean) / σ`, control chart only; infinite for σ = 0 with a nonzero change
/// @param outOfControlCount current-window points outside the control limits, control chart only
public record DriftEvent(
    String systemId,
    String metric,
    Instant timestamp,
    DetectionMethod method,
    double baselineValue,
    double currentValue,
    double change,
    OptionalDouble percentChange,
    DriftSeverity severity,
    boolean flagged,
    OptionalDouble pValue,
    OptionalDouble sigmaDistance,
    int outOfControlCount
) {
    public DriftEvent {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(metric, "metric cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        Objects.requireNonNull(percentChange, "percentChange cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(pValue, "pValue cannot be null");
        Objects.requireNonNull(sigmaDistance, "sigmaDistance cannot be null");
    }

    public double absoluteChange() {
        return Math.abs(change);
    }

    /// Percent change of a value against a baseline; empty when the baseline is 0.
    static OptionalDouble percentChange(double baseline, double current) {
        return baseline == 0.0
            ? OptionalDouble.empty()
            : OptionalDouble.of((current - baseline) / baseline * 100.0);
    }
}
