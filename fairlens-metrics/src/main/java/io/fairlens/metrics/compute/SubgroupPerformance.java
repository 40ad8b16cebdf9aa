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

import java.util.Objects;
import java.util.OptionalDouble;

/// Performance detail for one subgroup of the subgroup-performance analysis.
///
/// @param key the subgroup, single-attribute or intersectional
/// @param size number of samples in the subgroup
/// @param accuracy (TP + TN) / n
/// @param sensitivity TPR; empty without positive ground truth
/// @param specificity TNR; empty without negative ground truth
/// @param auc ROC AUC; empty without probabilities or with a single class
public record SubgroupPerformance(
    SubgroupKey key,
    long size,
    double accuracy,
    OptionalDouble sensitivity,
    OptionalDouble specificity,
    OptionalDouble auc
) {
    public SubgroupPerformance {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(sensitivity, "sensitivity cannot be null");
        Objects.requireNonNull(specificity, "specificity cannot be null");
        Objects.requireNonNull(auc, "auc cannot be null");
    }

    /// Derives the performance detail from group statistics.
    public static SubgroupPerformance of(GroupStats stats) {
        return new SubgroupPerformance(
            stats.key(),
            stats.count(),
            stats.accuracy().orElseThrow(),
            stats.truePositiveRate(),
            stats.trueNegativeRate(),
            stats.auc());
    }
}
