package io.fairlens.metrics.aggregate;

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

import io.fairlens.metrics.compute.GroupPair;
import io.fairlens.metrics.compute.MetricName;

import java.util.Objects;
import java.util.Optional;

/// A metric whose score fell below the critical threshold.
///
/// @param metric the failing metric
/// @param value its gap or ratio
/// @param score its normalized score
/// @param drivingPair the group pair behind the largest component of the value
/// @param description one-line human-readable summary
/// @param mitigationHint fixed hint for this metric type
/// @param reliabilityCaveat set when the metric rests on groups below the minimum size
public record CriticalIssue(
    MetricName metric,
    double value,
    double score,
    GroupPair drivingPair,
    String description,
    String mitigationHint,
    String reliabilityCaveat
) {
    public CriticalIssue {
        Objects.requireNonNull(metric, "metric cannot be null");
        Objects.requireNonNull(drivingPair, "drivingPair cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(mitigationHint, "mitigationHint cannot be null");
    }

    public Optional<String> caveat() {
        return Optional.ofNullable(reliabilityCaveat);
    }

    /// Description, caveat and hint on one line.
    public String text() {
        StringBuilder sb = new StringBuilder(description);
        if (reliabilityCaveat != null) {
            sb.append(" [").append(reliabilityCaveat).append(']');
        }
        return sb.append(". Mitigation: ").append(mitigationHint).toString();
    }
}
