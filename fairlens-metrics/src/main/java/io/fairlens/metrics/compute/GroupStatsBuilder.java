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

import io.fairlens.metrics.model.CalibrationBin;
import io.fairlens.metrics.model.GroupStats;
import io.fairlens.metrics.model.InvalidInputException;
import io.fairlens.metrics.model.SampleBatch;
import io.fairlens.metrics.model.SubgroupKey;
import io.fairlens.metrics.model.SubgroupScheme;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Builds per-subgroup confusion-matrix statistics from a sample batch.
///
/// ## Algorithm
///
/// One pass over the samples per attribute set of the scheme:
///
/// ```text
///   for each attribute set S in scheme.attributeSets(batch):
///     for each sample i:
///       key = (S[0]=value_i, S[1]=value_i, ...)
///       acc[key].accept(label_i, prediction_i, probability_i)
///
///   acc.accept:
///     TP/FP/TN/FN += 1 by (label, prediction)
///     bin = min(floor(p * bins), bins - 1)
///     bin.count += 1, bin.probabilitySum += p, bin.positives += label
/// ```
///
/// Keys are created only when a sample carries them, so empty groups never
/// appear in the result. The map iterates in scheme order, then in order of
/// first appearance within the batch.
///
/// ## Thread Safety
///
/// Instances hold only configuration and may be shared. Each call works on
/// private accumulators and returns an unmodifiable map of immutable stats.
public final class GroupStatsBuilder {

    private static final Logger logger = LogManager.getLogger(GroupStatsBuilder.class);

    /// Default number of equal-width calibration bins
    public static final int DEFAULT_CALIBRATION_BINS = 10;

    private final int calibrationBins;

    /// Creates a builder with 10 calibration bins.
    public GroupStatsBuilder() {
        this(DEFAULT_CALIBRATION_BINS);
    }

    /// Creates a builder with the given number of calibration bins.
    ///
    /// @param calibrationBins number of bins, at least 1
    public GroupStatsBuilder(int calibrationBins) {
        if (calibrationBins < 1) {
            throw new IllegalArgumentException("calibrationBins must be at least 1, got: " + calibrationBins);
        }
        this.calibrationBins = calibrationBins;
    }

    /// Computes statistics for every non-empty subgroup of the scheme.
    ///
    /// @param batch the validated batch
    /// @param scheme the subgroup extraction scheme
    /// @return unmodifiable map from subgroup key to statistics
    /// @throws InvalidInputException if the scheme names attributes the batch lacks
    public Map<SubgroupKey, GroupStats> build(SampleBatch batch, SubgroupScheme scheme) {
        Objects.requireNonNull(batch, "batch cannot be null");
        Objects.requireNonNull(scheme, "scheme cannot be null");

        Map<SubgroupKey, Accumulator> accumulators = new LinkedHashMap<>();
        boolean withProbabilities = batch.hasProbabilities();

        for (List<String> attributeSet : scheme.attributeSets(batch)) {
            for (String attribute : attributeSet) {
                if (!batch.hasAttribute(attribute)) {
                    throw new InvalidInputException("batch has no attribute '" + attribute + "'");
                }
            }
            for (int i = 0; i < batch.size(); i++) {
                SubgroupKey key = keyOf(batch, attributeSet, i);
                Accumulator acc = accumulators.computeIfAbsent(key,
                    k -> new Accumulator(k, withProbabilities ? calibrationBins : 0));
                acc.accept(batch.label(i), batch.prediction(i),
                    withProbabilities ? batch.probability(i) : Double.NaN);
            }
        }

        Map<SubgroupKey, GroupStats> result = new LinkedHashMap<>();
        for (Map.Entry<SubgroupKey, Accumulator> entry : accumulators.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toStats());
        }
        logger.debug("Built statistics for {} subgroups from {} samples", result.size(), batch.size());
        return Collections.unmodifiableMap(result);
    }

    private static SubgroupKey keyOf(SampleBatch batch, List<String> attributeSet, int index) {
        List<SubgroupKey.Member> members = new ArrayList<>(attributeSet.size());
        for (String attribute : attributeSet) {
            members.add(new SubgroupKey.Member(attribute, batch.attributeValue(attribute, index)));
        }
        return new SubgroupKey(members);
    }

    /// Computes ROC AUC as the Mann-Whitney U statistic normalized by the
    /// number of positive/negative pairs. Tied scores receive averaged ranks.
    ///
    /// @param scores predicted probabilities
    /// @param labels ground-truth labels, parallel to scores
    /// @param count number of valid entries
    /// @return AUC in `[0, 1]`, or `NaN` when only one class is present
    static double rocAuc(double[] scores, int[] labels, int count) {
        long positives = 0;
        for (int i = 0; i < count; i++) {
            positives += labels[i];
        }
        long negatives = count - positives;
        if (positives == 0 || negatives == 0) {
            return Double.NaN;
        }

        Integer[] order = new Integer[count];
        for (int i = 0; i < count; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(scores[a], scores[b]));

        double positiveRankSum = 0.0;
        int i = 0;
        while (i < count) {
            int j = i;
            while (j + 1 < count && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            // ranks are 1-based; a tie run i..j shares the mean rank
            double averageRank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                if (labels[order[k]] == 1) {
                    positiveRankSum += averageRank;
                }
            }
            i = j + 1;
        }

        double u = positiveRankSum - positives * (positives + 1) / 2.0;
        return u / ((double) positives * negatives);
    }

    /// Mutable per-key accumulator, private to one build call.
    private static final class Accumulator {
        private final SubgroupKey key;
        private long tp;
        private long fp;
        private long tn;
        private long fn;
        private final long[] binCounts;
        private final double[] binProbabilitySums;
        private final long[] binPositives;
        private double[] scores;
        private int[] labels;
        private int scored;

        Accumulator(SubgroupKey key, int bins) {
            this.key = key;
            this.binCounts = new long[bins];
            this.binProbabilitySums = new double[bins];
            this.binPositives = new long[bins];
            if (bins > 0) {
                this.scores = new double[16];
                this.labels = new int[16];
            }
        }

        void accept(int label, int prediction, double probability) {
            if (label == 1) {
                if (prediction == 1) tp++; else fn++;
            } else {
                if (prediction == 1) fp++; else tn++;
            }

            if (binCounts.length > 0) {
                int bin = CalibrationBin.binIndex(probability, binCounts.length);
                binCounts[bin]++;
                binProbabilitySums[bin] += probability;
                binPositives[bin] += label;

                if (scored == scores.length) {
                    scores = Arrays.copyOf(scores, scored * 2);
                    labels = Arrays.copyOf(labels, scored * 2);
                }
                scores[scored] = probability;
                labels[scored] = label;
                scored++;
            }
        }

        GroupStats toStats() {
            if (binCounts.length == 0) {
                return new GroupStats(key, tp, fp, tn, fn);
            }
            int bins = binCounts.length;
            double width = 1.0 / bins;
            List<CalibrationBin> calibration = new ArrayList<>(bins);
            for (int b = 0; b < bins; b++) {
                calibration.add(new CalibrationBin(b, b * width, (b + 1) * width,
                    binCounts[b], binProbabilitySums[b], binPositives[b]));
            }
            return new GroupStats(key, tp, fp, tn, fn, calibration, rocAuc(scores, labels, scored));
        }
    }
}
