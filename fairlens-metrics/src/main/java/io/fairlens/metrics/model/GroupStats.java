package io.fairlens.metrics.model;

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

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Confusion-matrix counts and derived rates for one subgroup.
 *
 * <h2>Purpose</h2>
 *
 * <p>Every fairness metric is a comparison of one rate across groups. This
 * class holds the counts those rates are derived from, plus calibration bins
 * and ROC AUC when the batch carried predicted probabilities.
 *
 * <h2>Undefined Rates</h2>
 *
 * <p>A rate whose denominator is zero is undefined, not zero. A group with no
 * positive ground truth has no true positive rate; a group that never
 * predicted positive has no precision. Such rates are returned as an empty
 * {@link OptionalDouble}, and callers must exclude the group rather than
 * substitute a value.
 *
 * <table>
 *   <tr><th>Rate</th><th>Formula</th><th>Undefined when</th></tr>
 *   <tr><td>positive rate</td><td>(TP+FP)/n</td><td>never (n &gt; 0)</td></tr>
 *   <tr><td>TPR</td><td>TP/(TP+FN)</td><td>no positives</td></tr>
 *   <tr><td>FPR</td><td>FP/(FP+TN)</td><td>no negatives</td></tr>
 *   <tr><td>TNR</td><td>TN/(FP+TN)</td><td>no negatives</td></tr>
 *   <tr><td>precision</td><td>TP/(TP+FP)</td><td>no predicted positives</td></tr>
 *   <tr><td>accuracy</td><td>(TP+TN)/n</td><td>never (n &gt; 0)</td></tr>
 * </table>
 *
 * <p>Instances are immutable once built by {@code GroupStatsBuilder}.
 */
public final class GroupStats {

    private final SubgroupKey key;
    private final long truePositives;
    private final long falsePositives;
    private final long trueNegatives;
    private final long falseNegatives;
    private final List<CalibrationBin> calibrationBins;
    private final double auc;

    /**
     * Creates group statistics.
     *
     * @param key the subgroup key
     * @param truePositives TP count
     * @param falsePositives FP count
     * @param trueNegatives TN count
     * @param falseNegatives FN count
     * @param calibrationBins per-bin counts, empty when the batch had no probabilities
     * @param auc ROC AUC, or {@code NaN} when undefined
     */
    public GroupStats(SubgroupKey key, long truePositives, long falsePositives,
                      long trueNegatives, long falseNegatives,
                      List<CalibrationBin> calibrationBins, double auc) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        if (truePositives < 0 || falsePositives < 0 || trueNegatives < 0 || falseNegatives < 0) {
            throw new IllegalArgumentException("confusion matrix counts cannot be negative");
        }
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.trueNegatives = trueNegatives;
        this.falseNegatives = falseNegatives;
        this.calibrationBins = List.copyOf(calibrationBins);
        this.auc = auc;
    }

    /**
     * Creates group statistics without probability information.
     */
    public GroupStats(SubgroupKey key, long truePositives, long falsePositives,
                      long trueNegatives, long falseNegatives) {
        this(key, truePositives, falsePositives, trueNegatives, falseNegatives, List.of(), Double.NaN);
    }

    public SubgroupKey key() {
        return key;
    }

    public long truePositives() {
        return truePositives;
    }

    public long falsePositives() {
        return falsePositives;
    }

    public long trueNegatives() {
        return trueNegatives;
    }

    public long falseNegatives() {
        return falseNegatives;
    }

    /** Total number of samples in the group. */
    public long count() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }

    /** Samples whose ground truth is 1. */
    public long actualPositives() {
        return truePositives + falseNegatives;
    }

    /** Samples whose ground truth is 0. */
    public long actualNegatives() {
        return falsePositives + trueNegatives;
    }

    /** Samples predicted as 1. */
    public long predictedPositives() {
        return truePositives + falsePositives;
    }

    /** P(pred = 1) within the group. */
    public OptionalDouble positiveRate() {
        return ratio(predictedPositives(), count());
    }

    /** TP / (TP + FN); empty when the group has no positive ground truth. */
    public OptionalDouble truePositiveRate() {
        return ratio(truePositives, actualPositives());
    }

    /** FP / (FP + TN); empty when the group has no negative ground truth. */
    public OptionalDouble falsePositiveRate() {
        return ratio(falsePositives, actualNegatives());
    }

    /** TN / (FP + TN); empty when the group has no negative ground truth. */
    public OptionalDouble trueNegativeRate() {
        return ratio(trueNegatives, actualNegatives());
    }

    /** TP / (TP + FP); empty when the group never predicted positive. */
    public OptionalDouble precision() {
        return ratio(truePositives, predictedPositives());
    }

    /** (TP + TN) / n. */
    public OptionalDouble accuracy() {
        return ratio(truePositives + trueNegatives, count());
    }

    /** Returns true if calibration bins are available. */
    public boolean hasCalibration() {
        return !calibrationBins.isEmpty();
    }

    /** Per-bin calibration counts; empty when the batch had no probabilities. */
    public List<CalibrationBin> calibrationBins() {
        return calibrationBins;
    }

    /**
     * Expected calibration error: the sample-weighted mean over bins of
     * {@code |mean predicted probability - empirical positive rate|}.
     *
     * @return the ECE, empty when the batch had no probabilities
     */
    public OptionalDouble expectedCalibrationError() {
        if (calibrationBins.isEmpty()) {
            return OptionalDouble.empty();
        }
        long total = 0;
        double weighted = 0.0;
        for (CalibrationBin bin : calibrationBins) {
            if (bin.count() > 0) {
                weighted += bin.count() * bin.calibrationGap();
                total += bin.count();
            }
        }
        return total == 0 ? OptionalDouble.empty() : OptionalDouble.of(weighted / total);
    }

    /** ROC AUC; empty without probabilities or when only one class is present. */
    public OptionalDouble auc() {
        return Double.isNaN(auc) ? OptionalDouble.empty() : OptionalDouble.of(auc);
    }

    private static OptionalDouble ratio(long numerator, long denominator) {
        return denominator == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) numerator / denominator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupStats that)) return false;
        return truePositives == that.truePositives
            && falsePositives == that.falsePositives
            && trueNegatives == that.trueNegatives
            && falseNegatives == that.falseNegatives
            && Double.compare(auc, that.auc) == 0
            && key.equals(that.key)
            && calibrationBins.equals(that.calibrationBins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, truePositives, falsePositives, trueNegatives, falseNegatives, calibrationBins, auc);
    }

    @Override
    public String toString() {
        return "GroupStats{" + key
            + ", TP=" + truePositives
            + ", FP=" + falsePositives
            + ", TN=" + trueNegatives
            + ", FN=" + falseNegatives + "}";
    }
}
