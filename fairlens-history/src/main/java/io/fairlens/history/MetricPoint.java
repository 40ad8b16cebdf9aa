package io.fairlens.history;

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

import java.time.Instant;
import java.util.Objects;

/// One timestamped value of a metric series.
///
/// @param timestamp when the value was observed
/// @param value the metric value
public record MetricPoint(Instant timestamp, double value) {
    public MetricPoint {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
