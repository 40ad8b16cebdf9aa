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

import io.fairlens.metrics.compute.GroupPair;
import io.fairlens.metrics.compute.MetricName;

import java.util.Objects;

/// One entry of the largest-gap ranking.
///
/// @param metric a gap metric
/// @param gap its value
/// @param drivingPair the groups at the extremes
public record GapEntry(MetricName metric, double gap, GroupPair drivingPair) {
    public GapEntry {
        Objects.requireNonNull(metric, "metric cannot be null");
        Objects.requireNonNull(drivingPair, "drivingPair cannot be null");
    }
}
