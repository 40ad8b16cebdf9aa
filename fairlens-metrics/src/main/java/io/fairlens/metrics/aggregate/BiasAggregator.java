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

import io.fairlens.metrics.compute.FairnessMetrics;
import io.fairlens.metrics.compute.GroupPair;
import io.fairlens.metrics.compute.MetricName;
import io.fairlens.metrics.compute.MetricResult;
import io.fairlens.metrics.compute.MetricsConfig;
import io.fairlens.metrics.compute.SubgroupPerformance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/// Reduces metric results to one category score and ranked findings.
///
/// ## Rules
///
/// - **Category score**: arithmetic mean of the defined metric scores. Undefined
///   metrics shrink the denominator instead of counting as zero.
/// - **Critical issues**: one per defined metric scoring below 0.5.
/// - **Worst groups**: subgroups by ascending accuracy; on equal accuracy the
///   larger subgroup ranks worse, then key text decides.
/// - **Largest gaps**: defined gap metrics by descending gap; equal gaps keep
///   metric declaration order.
///
/// Stateless; safe for concurrent use.
public final class BiasAggregator {

    private static final Logger logger = LogManager.getLogger(BiasAggregator.class);

    /// Scores strictly below this raise a critical issue
    public static final double CRITICAL_SCORE = 0.5;

    private static final Comparator<SubgroupPerformance> WORST_FIRST =
        Comparator.comparingDouble(SubgroupPerformance::accuracy)
            .thenComparing(Comparator.comparingLong(SubgroupPerformance::size).reversed())
            .thenComparing(p -> p.key().toString());

    private final int topN;
    private final double lowAccuracyThreshold;

    /// Creates an aggregator with default settings.
    public BiasAggregator() {
        this(MetricsConfig.defaults());
    }

    /// Creates an aggregator reading `top_n` and `low_accuracy_threshold`.
    public BiasAggregator(MetricsConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        this.topN = config.getTopN();
        this.lowAccuracyThreshold = config.getLowAccuracyThreshold();
    }

    /// Aggregates the metric results of one batch.
    ///
    /// @param metrics results from [io.fairlens.metrics.compute.MetricComputer]
    /// @return the summary
    public BiasSummary aggregate(FairnessMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics cannot be null");

        List<MetricResult> defined = metrics.definedResults();
        OptionalDouble categoryScore = defined.stream()
            .mapToDouble(r -> r.score().getAsDouble())
            .average();

        List<CriticalIssue> issues = new ArrayList<>();
        for (MetricResult result : defined) {
            if (result.score().getAsDouble() < CRITICAL_SCORE) {
                issues.add(toIssue(result));
            }
        }

        List<SubgroupPerformance> ranked = new ArrayList<>(metrics.subgroups());
        ranked.sort(WORST_FIRST);
        List<SubgroupPerformance> worst = ranked.subList(0, Math.min(topN, ranked.size()));
        List<SubgroupPerformance> lowAccuracy = ranked.stream()
            .filter(p -> p.accuracy() < lowAccuracyThreshold)
            .toList();

        List<GapEntry> gaps = new ArrayList<>();
        for (MetricResult result : defined) {
            if (result.metric().isGapMetric()) {
                gaps.add(new GapEntry(result.metric(), result.value().getAsDouble(), result.drivingPair().orElseThrow()));
            }
        }
        // List.sort is stable, so equal gaps stay in declaration order
        gaps.sort(Comparator.comparingDouble(GapEntry::gap).reversed());
        List<GapEntry> largest = gaps.subList(0, Math.min(topN, gaps.size()));

        if (!issues.isEmpty()) {
            logger.info("{} critical fairness issue(s): {}", issues.size(),
                issues.stream().map(i -> i.metric().id()).toList());
        }
        return new BiasSummary(categoryScore, defined.size(), issues, worst, largest, lowAccuracy);
    }

    private static CriticalIssue toIssue(MetricResult result) {
        MetricName metric = result.metric();
        GroupPair pair = result.drivingPair().orElseThrow();
        double value = result.value().getAsDouble();
        double score = result.score().getAsDouble();

        String measure = metric.isGapMetric() ? "gap" : "accuracy ratio";
        String description = String.format(Locale.ROOT, "%s violation: %s %.4f between %s, score %.1f",
            metric.displayName(), measure, value, pair, score);

        String caveat = null;
        if (result.unreliable()) {
            caveat = "estimate unreliable: " + String.join("; ", result.warnings());
        }
        return new CriticalIssue(metric, value, score, pair, description, metric.mitigationHint(), caveat);
    }
}
