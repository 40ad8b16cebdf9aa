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

/// # Fairness Drift Detection
///
/// [DriftMonitor] compares a baseline window of a metric series with the
/// window that follows it, using three methods, and reconciles them into one
/// [DriftSeverity] per metric:
///
/// ```text
///   HistoryReader ──► DriftMonitor ──┬─ delta ──────────┐
///                                    ├─ statistical ────┼─► MetricDriftVerdict ──► DriftReport
///                                    └─ control chart ──┘
/// ```
///
/// [FairnessMonitor] ties evaluation, recording and drift checks together
/// and hands each [DriftReport] to its [DriftListener]s.
package io.fairlens.drift;
