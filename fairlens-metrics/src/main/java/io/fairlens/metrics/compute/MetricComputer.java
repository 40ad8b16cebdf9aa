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
import io.fairlens.metrics.model.SampleBatch;
import io.fairlens.metrics.model.SubgroupKey;
import io.fairlens.metrics.model.SubgroupScheme;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;

/// Computes the six fairness metrics for a sample batch.
///
/// ## Pipeline
///
/// ```text
/// ┌─────────────┐   perAttribute()    ┌────────────┐   gap per attribute   ┌──────────────┐
/// │ SampleBatch │ ──────────────────► │ GroupStats │ ────────────────────► │ 5 gap metrics│
/// └─────────────┘                     └────────────┘                       └──────────────┘
///        │          intersectional(d) ┌────────────┐   min/max accuracy    ┌──────────────┐
///        └──────────────────────────► │ GroupStats │ ────────────────────► │ subgroup perf│
///                                     └────────────┘                       └──────────────┘
/// ```
///
/// ## Gap Metrics
///
/// Groups are compared only with groups of the same attribute. For each
/// attribute the gap is `max(rate) − min(rate)` over groups whose rate is
/// defined; the metric value is the largest attribute gap.
///
/// | Metric | Rate per group |
/// |--------|----------------|
/// | demographic parity | P(pred = 1) |
/// | equal opportunity | TPR |
/// | equalized odds | max(TPR gap, FPR gap) |
/// | predictive parity | precision |
/// | calibration | expected calibration error |
///
/// An attribute with fewer than two defined groups contributes no gap, unless
/// the whole attribute is a single group, which contributes a gap of 0. When
/// no attribute contributes, the metric is [MetricStatus#UNDEFINED].
///
/// ## Subgroup Performance
///
/// The ratio `min(accuracy) / max(accuracy)` over every subgroup of up to
/// `max_intersection_depth` attributes with at least `min_subgroup_size`
/// samples. A maximum accuracy of 0 means every subgroup is equally wrong and
/// yields a ratio of 1.
///
/// ## Thread Safety
///
/// Stateless apart from immutable configuration; safe for concurrent use.
/// Repeated calls on the same batch return equal [FairnessMetrics].
public final class MetricComputer {

    private static final Logger logger = LogManager.getLogger(MetricComputer.class);

    private final int minGroupSize;
    private final int maxIntersectionDepth;
    private final int minSubgroupSize;
    private final GroupStatsBuilder statsBuilder;

    /// Creates a computer with default settings.
    public MetricComputer() {
        this(MetricsConfig.defaults());
    }

    /// Creates a computer from a configuration. Values are copied.
    ///
    /// @param config the configuration
    /// @throws IllegalArgumentException if the configuration is invalid
    public MetricComputer(MetricsConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        this.minGroupSize = config.getMinGroupSize();
        this.maxIntersectionDepth = config.getMaxIntersectionDepth();
        this.minSubgroupSize = config.getMinSubgroupSize();
        this.statsBuilder = new GroupStatsBuilder(config.getCalibrationBins());
    }

    /// Computes every metric for the batch.
    ///
    /// @param batch a validated batch
    /// @return the results, one per [MetricName]
    public FairnessMetrics compute(SampleBatch batch) {
        Objects.requireNonNull(batch, "batch cannot be null");

        Map<SubgroupKey, GroupStats> groups = statsBuilder.build(batch, SubgroupScheme.perAttribute());
        Map<SubgroupKey, GroupStats> subgroupStats =
            statsBuilder.build(batch, SubgroupScheme.intersectional(maxIntersectionDepth));

        Map<MetricName, MetricResult> results = new EnumMap<>(MetricName.class);
        results.put(MetricName.DEMOGRAPHIC_PARITY,
            gapMetric(MetricName.DEMOGRAPHIC_PARITY, groups, GroupStats::positiveRate));
        results.put(MetricName.EQUAL_OPPORTUNITY,
            gapMetric(MetricName.EQUAL_OPPORTUNITY, groups, GroupStats::truePositiveRate));
        results.put(MetricName.EQUALIZED_ODDS, equalizedOdds(groups));
        results.put(MetricName.PREDICTIVE_PARITY,
            gapMetric(MetricName.PREDICTIVE_PARITY, groups, GroupStats::precision));
        if (batch.hasProbabilities()) {
            results.put(MetricName.CALIBRATION,
                gapMetric(MetricName.CALIBRATION, groups, GroupStats::expectedCalibrationError));
        } else {
            results.put(MetricName.CALIBRATION, undefinedResult(MetricName.CALIBRATION,
                "batch has no predicted probabilities"));
        }

        List<SubgroupPerformance> subgroups = new ArrayList<>();
        for (GroupStats stats : subgroupStats.values()) {
            if (stats.count() >= minSubgroupSize) {
                subgroups.add(SubgroupPerformance.of(stats));
            }
        }
        results.put(MetricName.SUBGROUP_PERFORMANCE, subgroupPerformance(subgroups));

        for (MetricResult result : results.values()) {
            if (result.unreliable()) {
                logger.warn("{} is unreliable: {}", result.metric().id(), result.warnings());
            }
            logger.debug(result.explanation());
        }
        return new FairnessMetrics(results, groups, subgroups);
    }

    private MetricResult gapMetric(MetricName metric, Map<SubgroupKey, GroupStats> groups,
                                   Function<GroupStats, OptionalDouble> rate) {
        GapComputation gap = GapComputation.compute(groups, rate);
        MetricResult.Builder builder = MetricResult.builder(metric);
        gap.definedValues.forEach(builder::groupValue);
        gap.excluded.forEach(builder::excluded);
        gap.attributeGaps.forEach(builder::component);

        if (!gap.isDefined()) {
            String reason = "fewer than two groups with a defined rate in every attribute";
            return builder.undefined(reason)
                .explanation(metric.displayName() + ": undefined (" + reason + ")")
                .build();
        }

        double score = metric.ladder().score(gap.gap);
        builder.defined(gap.gap, score).drivingPair(gap.pair);
        addReliabilityWarnings(builder, gap.contributors);
        return builder.explanation(explain(metric, gap.attributeLabel, gap.gap, gap.pair, score)).build();
    }

    private MetricResult equalizedOdds(Map<SubgroupKey, GroupStats> groups) {
        MetricName metric = MetricName.EQUALIZED_ODDS;
        GapComputation tpr = GapComputation.compute(groups, GroupStats::truePositiveRate);
        GapComputation fpr = GapComputation.compute(groups, GroupStats::falsePositiveRate);
        MetricResult.Builder builder = MetricResult.builder(metric);

        if (!tpr.isDefined() && !fpr.isDefined()) {
            String reason = "neither TPR nor FPR is defined for two groups of any attribute";
            tpr.excluded.forEach(builder::excluded);
            return builder.undefined(reason)
                .explanation(metric.displayName() + ": undefined (" + reason + ")")
                .build();
        }

        if (tpr.isDefined()) {
            builder.component("tpr_gap", tpr.gap);
        }
        if (fpr.isDefined()) {
            builder.component("fpr_gap", fpr.gap);
        }

        // the larger component drives the metric; TPR wins ties
        GapComputation driving = !fpr.isDefined() || (tpr.isDefined() && tpr.gap >= fpr.gap) ? tpr : fpr;
        driving.definedValues.forEach(builder::groupValue);
        driving.excluded.forEach(builder::excluded);

        double score = metric.ladder().score(driving.gap);
        builder.defined(driving.gap, score).drivingPair(driving.pair);

        Map<SubgroupKey, GroupStats> contributors = new LinkedHashMap<>(tpr.contributors);
        contributors.putAll(fpr.contributors);
        addReliabilityWarnings(builder, contributors);

        String explanation = String.format(Locale.ROOT,
            "%s: TPR gap %s, FPR gap %s, combined %.4f (%s) -> %s",
            metric.displayName(),
            tpr.isDefined() ? String.format(Locale.ROOT, "%.4f", tpr.gap) : "undefined",
            fpr.isDefined() ? String.format(Locale.ROOT, "%.4f", fpr.gap) : "undefined",
            driving.gap, driving.pair, formatScore(score));
        return builder.explanation(explanation).build();
    }

    private MetricResult subgroupPerformance(List<SubgroupPerformance> subgroups) {
        MetricName metric = MetricName.SUBGROUP_PERFORMANCE;
        MetricResult.Builder builder = MetricResult.builder(metric);
        if (subgroups.isEmpty()) {
            String reason = "no subgroup has at least " + minSubgroupSize + " samples";
            return builder.undefined(reason)
                .explanation(metric.displayName() + ": undefined (" + reason + ")")
                .build();
        }

        SubgroupPerformance best = subgroups.get(0);
        SubgroupPerformance worst = subgroups.get(0);
        for (SubgroupPerformance subgroup : subgroups) {
            builder.groupValue(subgroup.key(), subgroup.accuracy());
            if (subgroup.accuracy() > best.accuracy()) {
                best = subgroup;
            }
            if (subgroup.accuracy() < worst.accuracy()) {
                worst = subgroup;
            }
        }

        double ratio = best.accuracy() == 0.0 ? 1.0 : worst.accuracy() / best.accuracy();
        double score = metric.ladder().score(ratio);
        builder.defined(ratio, score)
            .drivingPair(new GroupPair(best.key(), best.accuracy(), worst.key(), worst.accuracy()))
            .component("min_accuracy", worst.accuracy())
            .component("max_accuracy", best.accuracy());

        for (SubgroupPerformance subgroup : subgroups) {
            if (subgroup.size() < minGroupSize) {
                builder.warning(smallGroupWarning(subgroup.key(), subgroup.size()));
            }
        }

        String explanation = String.format(Locale.ROOT,
            "%s: min accuracy %.4f (%s), max %.4f (%s), ratio %.4f -> %s",
            metric.displayName(), worst.accuracy(), worst.key(), best.accuracy(), best.key(),
            ratio, formatScore(score));
        return builder.explanation(explanation).build();
    }

    private void addReliabilityWarnings(MetricResult.Builder builder, Map<SubgroupKey, GroupStats> contributors) {
        for (GroupStats stats : contributors.values()) {
            if (stats.count() < minGroupSize) {
                builder.warning(smallGroupWarning(stats.key(), stats.count()));
            }
        }
    }

    private String smallGroupWarning(SubgroupKey key, long size) {
        return "group " + key + " has n=" + size + " < " + minGroupSize;
    }

    private static MetricResult undefinedResult(MetricName metric, String reason) {
        return MetricResult.builder(metric)
            .undefined(reason)
            .explanation(metric.displayName() + ": undefined (" + reason + ")")
            .build();
    }

    private static String explain(MetricName metric, String attribute, double gap, GroupPair pair, double score) {
        return String.format(Locale.ROOT, "%s for %s: %.4f (max %s %.4f, min %s %.4f) -> %s",
            metric.displayName(), attribute, gap,
            pair.high(), pair.highValue(), pair.low(), pair.lowValue(), formatScore(score));
    }

    private static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }

    /// Within-attribute gap of one rate across groups.
    private static final class GapComputation {
        private final Map<SubgroupKey, Double> definedValues = new LinkedHashMap<>();
        private final List<SubgroupKey> excluded = new ArrayList<>();
        private final Map<String, Double> attributeGaps = new LinkedHashMap<>();
        private final Map<SubgroupKey, GroupStats> contributors = new LinkedHashMap<>();
        private double gap = Double.NaN;
        private GroupPair pair;
        private String attributeLabel;

        boolean isDefined() {
            return !Double.isNaN(gap);
        }

        static GapComputation compute(Map<SubgroupKey, GroupStats> groups,
                                      Function<GroupStats, OptionalDouble> rate) {
            Map<List<String>, List<GroupStats>> partitions = new LinkedHashMap<>();
            for (GroupStats stats : groups.values()) {
                partitions.computeIfAbsent(stats.key().attributes(), k -> new ArrayList<>()).add(stats);
            }

            GapComputation result = new GapComputation();
            for (Map.Entry<List<String>, List<GroupStats>> partition : partitions.entrySet()) {
                List<GroupStats> members = partition.getValue();
                List<GroupStats> defined = new ArrayList<>();
                GroupStats high = null;
                GroupStats low = null;
                double highValue = Double.NEGATIVE_INFINITY;
                double lowValue = Double.POSITIVE_INFINITY;

                for (GroupStats stats : members) {
                    OptionalDouble value = rate.apply(stats);
                    if (value.isEmpty()) {
                        result.excluded.add(stats.key());
                        continue;
                    }
                    double v = value.getAsDouble();
                    result.definedValues.put(stats.key(), v);
                    defined.add(stats);
                    if (v > highValue) {
                        highValue = v;
                        high = stats;
                    }
                    if (v < lowValue) {
                        lowValue = v;
                        low = stats;
                    }
                }

                boolean singleGroup = members.size() == 1 && defined.size() == 1;
                if (defined.size() < 2 && !singleGroup) {
                    continue;
                }

                String label = String.join("&", partition.getKey());
                double attributeGap = highValue - lowValue;
                result.attributeGaps.put(label, attributeGap);
                for (GroupStats stats : defined) {
                    result.contributors.put(stats.key(), stats);
                }
                if (!result.isDefined() || attributeGap > result.gap) {
                    result.gap = attributeGap;
                    result.pair = new GroupPair(high.key(), highValue, low.key(), lowValue);
                    result.attributeLabel = label;
                }
            }
            return result;
        }
    }
}
