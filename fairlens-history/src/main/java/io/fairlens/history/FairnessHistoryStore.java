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

import io.fairlens.metrics.FairnessSnapshot;

import java.time.Instant;
import java.util.List;

/// Append-only, per-system log of fairness snapshots and metric series.
///
/// ## Contract
///
/// - Series are keyed by [MetricSeriesKey]. Writes to one system are
///   serialized; writes to different systems may run concurrently.
/// - [#recordSnapshot(FairnessSnapshot)] is all or nothing: the snapshot and
///   every series are checked before anything is written.
/// - Timestamps within a series never decrease. An append older than the
///   newest point is rejected with [IllegalArgumentException]; equal
///   timestamps are accepted.
/// - Reads return immutable copies taken under the series lock, oldest first.
/// - I/O failures surface as [HistoryStoreException].
public interface FairnessHistoryStore extends HistoryReader {

    /// Stores the flattened snapshot.
    void appendSnapshot(FairnessSnapshot snapshot);

    /// Appends one point to a metric series.
    ///
    /// @throws IllegalArgumentException if the timestamp precedes the newest point of the series
    void appendMetricValue(String systemId, String metric, Instant timestamp, double value);

    /// Returns up to `window` of the most recent points of a series, oldest first.
    List<MetricPoint> getHistory(String systemId, String metric, int window);

    /// Returns up to `limit` of the most recent snapshot records of a system, oldest first.
    List<SnapshotRecord> snapshots(String systemId, int limit);

    /// Names of the system's recorded series, in the order they were first appended.
    List<String> metrics(String systemId);

    @Override
    default List<MetricPoint> getWindow(String systemId, String metric, int count) {
        return getHistory(systemId, metric, count);
    }

    /// Stores the snapshot and appends each of its metric values to the
    /// matching series at the snapshot timestamp, as one write.
    ///
    /// @throws IllegalArgumentException if the snapshot or any of its values
    ///     is older than what the system already holds; nothing is written then
    void recordSnapshot(FairnessSnapshot snapshot);
}
