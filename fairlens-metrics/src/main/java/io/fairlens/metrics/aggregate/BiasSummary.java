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

import io.fairlens.metrics.compute.SubgroupPerformance;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Aggregated view over the metric results of one batch.
///
/// @param categoryScore mean of defined metric scores; empty when none is defined
/// @param definedMetricCount how many metrics entered the mean
/// @param criticalIssues metrics scoring below 0.5, in metric order
/// @param worstPerformingGroups lowest-accuracy subgroups, worst first
/// @param largestGaps gap metrics by descending gap
/// @param lowAccuracySubgroups subgroups below the low-accuracy threshold, worst first
public record BiasSummary(
    OptionalDouble categoryScore,
    int definedMetricCount,
    List<CriticalIssue> criticalIssues,
    List<SubgroupPerformance> worstPerformingGroups,
    List<GapEntry> largestGaps,
    List<SubgroupPerformance> lowAccuracySubgroups
) {
    public BiasSummary {
        Objects.requireNonNull(categoryScore, "categoryScore cannot be null");
        criticalIssues = List.copyOf(criticalIssues);
        worstPerformingGroups = List.copyOf(worstPerformingGroups);
        largestGaps = List.copyOf(largestGaps);
        lowAccuracySubgroups = List.copyOf(lowAccuracySubgroups);
    }

    public boolean hasCriticalIssues() {
        return !criticalIssues.isEmpty();
    }
}
