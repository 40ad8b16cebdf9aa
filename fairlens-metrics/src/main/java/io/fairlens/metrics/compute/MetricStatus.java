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

/// Whether a metric could be computed for a batch.
public enum MetricStatus {
    /// The metric has a value and a score.
    DEFINED,
    /// Fewer than two groups had a defined rate (or the batch lacked the
    /// inputs the metric needs); the metric is excluded from averages.
    UNDEFINED
}
