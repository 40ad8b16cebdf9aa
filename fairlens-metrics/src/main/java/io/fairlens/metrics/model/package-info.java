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

/// # Sample Batches and Subgroups
///
/// Input types for fairness evaluation. A [SampleBatch] holds parallel
/// columns of binary labels, binary predictions, optional probabilities and
/// one or more categorical attribute columns:
///
/// ```text
///  index │ label │ prediction │ probability │ gender │ age
/// ───────┼───────┼────────────┼─────────────┼────────┼──────
///    0   │   1   │     1      │    0.91     │   F    │ <30
///    1   │   0   │     0      │    0.12     │   M    │ 30+
///   ...
/// ```
///
/// A [SubgroupScheme] picks the attribute combinations; each observed value
/// combination becomes a [SubgroupKey], and [GroupStats] carries that
/// subgroup's confusion matrix, calibration bins and AUC.
///
/// Batches are validated once at build time and are immutable afterwards;
/// malformed input fails with [InvalidInputException].
package io.fairlens.metrics.model;
