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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Drift verdicts for one system check.
///
/// The overall severity is the maximum over the evaluated verdicts. The
/// status is [DriftStatus#INSUFFICIENT_DATA] only when no verdict could be
/// evaluated, including when no metric was checked at all.
///
/// @param systemId the monitored system
/// @param timestamp when the check ran
/// @param status overall status
/// @param overallSeverity maximum severity across metrics
/// @param verdicts one verdict per checked metric, in request order
public record DriftReport(
    String systemId,
    Instant timestamp,
    DriftStatus status,
    DriftSeverity overallSeverity,
    List<MetricDriftVerdict> verdicts
) {
    public DriftReport {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(overallSeverity, "overallSeverity cannot be null");
        verdicts = List.copyOf(verdicts);
    }

    /// Builds a report, deriving status and overall severity from the verdicts.
    public static DriftReport of(String systemId, Instant timestamp, List<MetricDriftVerdict> verdicts) {
        DriftSeverity overall = DriftSeverity.NONE;
        boolean anyEvaluated = false;
        for (MetricDriftVerdict verdict : verdicts) {
            if (verdict.status() == DriftStatus.EVALUATED) {
                anyEvaluated = true;
                overall = overall.max(verdict.severity());
            }
        }
        DriftStatus status = anyEvaluated ? DriftStatus.EVALUATED : DriftStatus.INSUFFICIENT_DATA;
        return new DriftReport(systemId, timestamp, status, overall, verdicts);
    }

    public boolean driftDetected() {
        return overallSeverity != DriftSeverity.NONE;
    }

    public Optional<MetricDriftVerdict> verdict(String metric) {
        return verdicts.stream().filter(v -> v.metric().equals(metric)).findFirst();
    }

    /// Recommendations of the verdicts above [DriftSeverity#NONE].
    public List<String> recommendations() {
        List<String> out = new ArrayList<>();
        for (MetricDriftVerdict verdict : verdicts) {
            if (verdict.driftDetected()) {
                out.add(verdict.recommendation());
            }
        }
        return out;
    }

    /// Signed delta-method change per evaluated metric.
    public Map<String, Double> metricChanges() {
        Map<String, Double> changes = new LinkedHashMap<>();
        for (MetricDriftVerdict verdict : verdicts) {
            verdict.event(DetectionMethod.DELTA).ifPresent(e -> changes.put(verdict.metric(), e.change()));
        }
        return Collections.unmodifiableMap(changes);
    }
}
