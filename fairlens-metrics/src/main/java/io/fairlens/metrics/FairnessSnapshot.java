package io.fairlens.metrics;

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

import io.fairlens.metrics.aggregate.BiasSummary;
import io.fairlens.metrics.compute.FairnessMetrics;
import io.fairlens.metrics.compute.MetricName;
import io.fairlens.metrics.compute.MetricResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/// Immutable, timestamped result of one fairness evaluation.
///
/// A snapshot is created once per evaluation and never changes afterwards.
/// [#metricValues()] flattens it into the scalar series that drift
/// monitoring tracks: one value per defined metric, keyed by
/// [MetricName#id()], plus the category score under [#CATEGORY_SCORE_SERIES].
public final class FairnessSnapshot {

    /// Series name of the category score in metric histories
    public static final String CATEGORY_SCORE_SERIES = "category_score";

    private final String systemId;
    private final String modelVersion;
    private final Instant timestamp;
    private final FairnessMetrics metrics;
    private final BiasSummary summary;

    public FairnessSnapshot(String systemId, String modelVersion, Instant timestamp,
                            FairnessMetrics metrics, BiasSummary summary) {
        this.systemId = Objects.requireNonNull(systemId, "systemId cannot be null");
        this.modelVersion = Objects.requireNonNull(modelVersion, "modelVersion cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.summary = Objects.requireNonNull(summary, "summary cannot be null");
    }

    public String systemId() {
        return systemId;
    }

    public String modelVersion() {
        return modelVersion;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public FairnessMetrics metrics() {
        return metrics;
    }

    public BiasSummary summary() {
        return summary;
    }

    public MetricResult result(MetricName name) {
        return metrics.result(name);
    }

    public OptionalDouble categoryScore() {
        return summary.categoryScore();
    }

    /// Scalar values to append to metric histories, in metric order.
    public Map<String, Double> metricValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (MetricResult result : metrics.results().values()) {
            result.value().ifPresent(v -> values.put(result.metric().id(), v));
        }
        summary.categoryScore().ifPresent(v -> values.put(CATEGORY_SCORE_SERIES, v));
        return Collections.unmodifiableMap(values);
    }

    /// Normalized scores of the defined metrics, in metric order.
    public Map<String, Double> metricScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (MetricResult result : metrics.results().values()) {
            result.score().ifPresent(s -> scores.put(result.metric().id(), s));
        }
        return Collections.unmodifiableMap(scores);
    }

    public List<String> explanations() {
        return metrics.explanations();
    }

    @Override
    public String toString() {
        return "FairnessSnapshot{" + systemId + "@" + modelVersion + ", " + timestamp
            + ", categoryScore=" + summary.categoryScore()
            + ", criticalIssues=" + summary.criticalIssues().size() + "}";
    }
}
