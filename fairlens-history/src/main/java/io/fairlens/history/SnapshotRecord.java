package io.fairlens.history;

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

import io.fairlens.metrics.FairnessSnapshot;
import io.fairlens.metrics.aggregate.CriticalIssue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/// Flattened, persistable form of a [FairnessSnapshot].
///
/// Keeps what later reporting and drift checks read: identity, timestamp,
/// the scalar values and scores per metric id, and the critical issue texts.
///
/// @param systemId the evaluated system
/// @param modelVersion the evaluated model version
/// @param timestamp evaluation time
/// @param categoryScore mean of the defined scores, null when no metric was defined
/// @param metricValues defined metric values by metric id, plus `category_score`
/// @param metricScores defined metric scores by metric id
/// @param criticalIssues one line per critical issue
public record SnapshotRecord(
    String systemId,
    String modelVersion,
    Instant timestamp,
    Double categoryScore,
    Map<String, Double> metricValues,
    Map<String, Double> metricScores,
    List<String> criticalIssues
) {
    public SnapshotRecord {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(modelVersion, "modelVersion cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        metricValues = metricValues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metricValues));
        metricScores = metricScores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metricScores));
        criticalIssues = criticalIssues == null ? List.of() : List.copyOf(criticalIssues);
    }

    /// Flattens a snapshot.
    public static SnapshotRecord of(FairnessSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        OptionalDouble category = snapshot.categoryScore();
        return new SnapshotRecord(
            snapshot.systemId(),
            snapshot.modelVersion(),
            snapshot.timestamp(),
            category.isPresent() ? category.getAsDouble() : null,
            snapshot.metricValues(),
            snapshot.metricScores(),
            snapshot.summary().criticalIssues().stream().map(CriticalIssue::text).toList());
    }

    public OptionalDouble category() {
        return categoryScore == null ? OptionalDouble.empty() : OptionalDouble.of(categoryScore);
    }
}
