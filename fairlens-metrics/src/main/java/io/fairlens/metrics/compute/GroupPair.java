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

import java.util.Locale;
import java.util.Objects;

/// The two groups at the extremes of a metric's value.
///
/// For gap metrics `high` holds the largest rate and `low` the smallest. For
/// the subgroup ratio `high` is the most accurate subgroup and `low` the
/// least accurate.
///
/// @param high group with the highest value
/// @param highValue its value
/// @param low group with the lowest value
/// @param lowValue its value
public record GroupPair(SubgroupKey high, double highValue, SubgroupKey low, double lowValue) {

    public GroupPair {
        Objects.requireNonNull(high, "high cannot be null");
        Objects.requireNonNull(low, "low cannot be null");
    }

    /// highValue − lowValue
    public double difference() {
        return highValue - lowValue;
    }

    @Override
    public String toString() {
        return high + " (" + String.format(Locale.ROOT, "%.4f", highValue) + ") vs "
            + low + " (" + String.format(Locale.ROOT, "%.4f", lowValue) + ")";
    }
}
