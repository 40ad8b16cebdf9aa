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

/// Counts for one equal-width probability bin of one group.
///
/// @param index bin index, 0-based
/// @param lower inclusive lower edge
/// @param upper upper edge, exclusive except for the last bin
/// @param count samples whose probability fell in this bin
/// @param probabilitySum sum of those samples' predicted probabilities
/// @param positives samples in this bin whose ground truth is 1
public record CalibrationBin(int index, double lower, double upper, long count,
                             double probabilitySum, long positives) {

    /// Returns the bin index for a probability in `[0, 1]`; 1.0 lands in the last bin.
    public static int binIndex(double probability, int binCount) {
        int index = (int) Math.floor(probability * binCount);
        return Math.min(Math.max(index, 0), binCount - 1);
    }

    /// Mean predicted probability of the bin, 0 for an empty bin.
    public double meanProbability() {
        return count == 0 ? 0.0 : probabilitySum / count;
    }

    /// Empirical positive rate of the bin, 0 for an empty bin.
    public double positiveRate() {
        return count == 0 ? 0.0 : (double) positives / count;
    }

    /// Absolute gap between mean predicted probability and empirical rate.
    public double calibrationGap() {
        return Math.abs(meanProbability() - positiveRate());
    }
}
