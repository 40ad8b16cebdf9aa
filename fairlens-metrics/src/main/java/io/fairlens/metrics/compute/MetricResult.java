package io.fairlens.metrics.compute;

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

import io.fairlens.metrics.model.SubgroupKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/// The outcome of one fairness metric for one batch.
///
/// ## Contents
///
/// | Field | Meaning |
/// |-------|---------|
/// | value | gap (≥ 0) for gap metrics, min/max ratio for subgroup performance |
/// | score | one of 1.0, 0.7, 0.5, 0.2 from the metric's [ScoreLadder] |
/// | groupValues | the per-group rate each defined group contributed |
/// | excludedGroups | groups whose rate was undefined |
/// | drivingPair | the two groups at the extremes of the largest component |
/// | components | sub-gaps (equalized odds: `tpr_gap`, `fpr_gap`; gap metrics: per attribute) |
/// | unreliable | some contributing group is smaller than the minimum group size |
///
/// An [MetricStatus#UNDEFINED] result has no value, no score and no driving
/// pair; [#reason()] says why.
///
/// Instances are immutable and compare by value, so two computations over
/// the same batch produce equal results.
public final class MetricResult {

    private final MetricName metric;
    private final MetricStatus status;
    private final double value;
    private final double score;
    private final Map<SubgroupKey, Double> groupValues;
    private final List<SubgroupKey> excludedGroups;
    private final GroupPair drivingPair;
    private final Map<String, Double> components;
    private final boolean unreliable;
    private final List<String> warnings;
    private final String reason;
    private final String explanation;

    private MetricResult(Builder builder) {
        this.metric = Objects.requireNonNull(builder.metric, "metric cannot be null");
        this.status = builder.status;
        this.value = builder.value;
        this.score = builder.score;
        this.groupValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.groupValues));
        this.excludedGroups = List.copyOf(builder.excludedGroups);
        this.drivingPair = builder.drivingPair;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(builder.components));
        this.unreliable = builder.unreliable;
        this.warnings = List.copyOf(builder.warnings);
        this.reason = builder.reason;
        this.explanation = builder.explanation;
    }

    public MetricName metric() {
        return metric;
    }

    public MetricStatus status() {
        return status;
    }

    public boolean isDefined() {
        return status == MetricStatus.DEFINED;
    }

    /// Gap or ratio; empty when undefined.
    public OptionalDouble value() {
        return isDefined() ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /// Normalized score; empty when undefined.
    public OptionalDouble score() {
        return isDefined() ? OptionalDouble.of(score) : OptionalDouble.empty();
    }

    public Map<SubgroupKey, Double> groupValues() {
        return groupValues;
    }

    public List<SubgroupKey> excludedGroups() {
        return excludedGroups;
    }

    public Optional<GroupPair> drivingPair() {
        return Optional.ofNullable(drivingPair);
    }

    public Map<String, Double> components() {
        return components;
    }

    public boolean unreliable() {
        return unreliable;
    }

    public List<String> warnings() {
        return warnings;
    }

    /// Why the metric is undefined; empty for defined metrics.
    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    public String explanation() {
        return explanation;
    }

    public static Builder builder(MetricName metric) {
        return new Builder(metric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricResult that)) return false;
        return metric == that.metric
            && status == that.status
            && Double.compare(value, that.value) == 0
            && Double.compare(score, that.score) == 0
            && unreliable == that.unreliable
            && groupValues.equals(that.groupValues)
            && excludedGroups.equals(that.excludedGroups)
            && Objects.equals(drivingPair, that.drivingPair)
            && components.equals(that.components)
            && warnings.equals(that.warnings)
            && Objects.equals(reason, that.reason)
            && Objects.equals(explanation, that.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, status, value, score, groupValues, excludedGroups,
            drivingPair, components, unreliable, warnings, reason, explanation);
    }

    @Override
    public String toString() {
        return "MetricResult{" + metric.id() + ", " + status
            + (isDefined() ? ", value=" + value + ", score=" + score : ", reason=" + reason)
            + (unreliable ? ", unreliable" : "") + "}";
    }

    /// Assembles a result. [MetricComputer] is the main producer.
    public static final class Builder {
        private final MetricName metric;
        private MetricStatus status = MetricStatus.UNDEFINED;
        private double value = Double.NaN;
        private double score = Double.NaN;
        private final Map<SubgroupKey, Double> groupValues = new LinkedHashMap<>();
        private final List<SubgroupKey> excludedGroups = new ArrayList<>();
        private GroupPair drivingPair;
        private final Map<String, Double> components = new LinkedHashMap<>();
        private boolean unreliable;
        private final List<String> warnings = new ArrayList<>();
        private String reason;
        private String explanation = "";

        private Builder(MetricName metric) {
            this.metric = metric;
        }

        public Builder defined(double value, double score) {
            this.status = MetricStatus.DEFINED;
            this.value = value;
            this.score = score;
            this.reason = null;
            return this;
        }

        public Builder undefined(String reason) {
            this.status = MetricStatus.UNDEFINED;
            this.value = Double.NaN;
            this.score = Double.NaN;
            this.drivingPair = null;
            this.reason = reason;
            return this;
        }

        public Builder groupValue(SubgroupKey key, double value) {
            groupValues.put(key, value);
            return this;
        }

        public Builder excluded(SubgroupKey key) {
            excludedGroups.add(key);
            return this;
        }

        public Builder drivingPair(GroupPair pair) {
            this.drivingPair = pair;
            return this;
        }

        public Builder component(String name, double value) {
            components.put(name, value);
            return this;
        }

        public Builder warning(String warning) {
            this.unreliable = true;
            warnings.add(warning);
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public MetricResult build() {
            return new MetricResult(this);
        }
    }
}
