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

import io.fairlens.metrics.model.GroupStats;
import io.fairlens.metrics.model.SubgroupKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// All metric results computed for one batch, with the statistics behind them.
///
/// Results iterate in [MetricName] declaration order.
public final class FairnessMetrics {

    private final Map<MetricName, MetricResult> results;
    private final Map<SubgroupKey, GroupStats> groupStats;
    private final List<SubgroupPerformance> subgroups;

    /// Creates a result bundle.
    ///
    /// @param results one result per metric
    /// @param groupStats per-attribute group statistics used by the gap metrics
    /// @param subgroups subgroups analyzed by the subgroup-performance metric
    public FairnessMetrics(Map<MetricName, MetricResult> results,
                           Map<SubgroupKey, GroupStats> groupStats,
                           List<SubgroupPerformance> subgroups) {
        Objects.requireNonNull(results, "results cannot be null");
        for (MetricName name : MetricName.values()) {
            if (!results.containsKey(name)) {
                throw new IllegalArgumentException("missing result for " + name.id());
            }
        }
        this.results = Collections.unmodifiableMap(new EnumMap<>(results));
        this.groupStats = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(groupStats, "groupStats cannot be null")));
        this.subgroups = List.copyOf(Objects.requireNonNull(subgroups, "subgroups cannot be null"));
    }

    public MetricResult result(MetricName name) {
        return results.get(name);
    }

    public Map<MetricName, MetricResult> results() {
        return results;
    }

    /// Results whose status is [MetricStatus#DEFINED], in declaration order.
    public List<MetricResult> definedResults() {
        List<MetricResult> defined = new ArrayList<>();
        for (MetricResult result : results.values()) {
            if (result.isDefined()) {
                defined.add(result);
            }
        }
        return defined;
    }

    public Map<SubgroupKey, GroupStats> groupStats() {
        return groupStats;
    }

    public List<SubgroupPerformance> subgroups() {
        return subgroups;
    }

    /// Per-metric explanations in declaration order.
    public List<String> explanations() {
        List<String> lines = new ArrayList<>();
        for (MetricResult result : results.values()) {
            lines.add(result.explanation());
        }
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FairnessMetrics that)) return false;
        return results.equals(that.results)
            && groupStats.equals(that.groupStats)
            && subgroups.equals(that.subgroups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(results, groupStats, subgroups);
    }
}
