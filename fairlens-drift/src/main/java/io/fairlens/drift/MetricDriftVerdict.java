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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Reconciled drift verdict for one metric series.
///
/// An [DriftStatus#INSUFFICIENT_DATA] verdict has no events and severity
/// [DriftSeverity#NONE]; callers should read [#status()] before [#severity()].
///
/// @param metric the series name
/// @param status whether the series had enough points
/// @param severity the maximum severity over the events
/// @param events one event per detection method that ran
/// @param recommendation fixed-template advice for the severity
/// @param availablePoints points found in the history
/// @param requiredPoints points a full check needs
public record MetricDriftVerdict(
    String metric,
    DriftStatus status,
    DriftSeverity severity,
    List<DriftEvent> events,
    String recommendation,
    int availablePoints,
    int requiredPoints
) {
    public MetricDriftVerdict {
        Objects.requireNonNull(metric, "metric cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(recommendation, "recommendation cannot be null");
        events = List.copyOf(events);
    }

    static MetricDriftVerdict insufficient(String metric, int available, int required) {
        return new MetricDriftVerdict(metric, DriftStatus.INSUFFICIENT_DATA, DriftSeverity.NONE, List.of(),
            DriftRecommendations.insufficientData(metric, available, required), available, required);
    }

    /// Reconciles method events: the verdict takes the most severe event.
    static MetricDriftVerdict reconcile(String metric, List<DriftEvent> events, int available, int required) {
        DriftSeverity severity = DriftSeverity.NONE;
        DriftEvent delta = null;
        for (DriftEvent event : events) {
            severity = severity.max(event.severity());
            if (event.method() == DetectionMethod.DELTA) {
                delta = event;
            }
        }
        if (delta == null) {
            throw new IllegalArgumentException("a verdict needs a delta event");
        }
        String recommendation = DriftRecommendations.forSeverity(metric, severity, delta.change(), delta.percentChange());
        return new MetricDriftVerdict(metric, DriftStatus.EVALUATED, severity, events, recommendation,
            available, required);
    }

    public boolean driftDetected() {
        return severity != DriftSeverity.NONE;
    }

    public Optional<DriftEvent> event(DetectionMethod method) {
        return events.stream().filter(e -> e.method() == method).findFirst();
    }
}
