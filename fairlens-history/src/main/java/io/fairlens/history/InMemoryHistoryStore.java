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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/// Heap-backed [FairnessHistoryStore].
///
/// ## Locking
///
/// ```text
///   series map (ConcurrentHashMap)        snapshot map (ConcurrentHashMap)
///   ┌──────────────────────────────┐      ┌──────────────────────────┐
///   │ credit/demographic_parity ─► │ Log  │ credit ─► Log            │
///   │ credit/category_score     ─► │ Log  │ loans  ─► Log            │
///   └──────────────────────────────┘      └──────────────────────────┘
///   each Log = ReentrantLock + ArrayList, appended and copied under its lock
/// ```
///
/// Every write also holds the write lock of its system, so a
/// [#recordSnapshot(FairnessSnapshot)] is checked and applied as one unit and
/// never interleaves with another write to the same system. Writers to
/// different systems never contend. Nothing is ever removed.
public class InMemoryHistoryStore implements FairnessHistoryStore {

    private static final Logger logger = LogManager.getLogger(InMemoryHistoryStore.class);

    private final ConcurrentMap<MetricSeriesKey, Log<MetricPoint>> series = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Log<SnapshotRecord>> snapshots = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> seriesNames = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    @Override
    public void recordSnapshot(FairnessSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        SnapshotRecord record = SnapshotRecord.of(snapshot);
        ReentrantLock lock = writeLock(record.systemId());
        lock.lock();
        try {
            checkRecordable(record);
            appendRecord(record);
            for (Map.Entry<String, Double> entry : record.metricValues().entrySet()) {
                appendMetricValue(record.systemId(), entry.getKey(), record.timestamp(), entry.getValue());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendSnapshot(FairnessSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        appendRecord(SnapshotRecord.of(snapshot));
    }

    /// Appends an already flattened snapshot record.
    ///
    /// @throws IllegalArgumentException if the record is older than the newest record of its system
    public void appendRecord(SnapshotRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        ReentrantLock lock = writeLock(record.systemId());
        lock.lock();
        try {
            snapshots.computeIfAbsent(record.systemId(), k -> new Log<>(SnapshotRecord::timestamp))
                .append(record, "snapshots of " + record.systemId());
        } finally {
            lock.unlock();
        }
        logger.debug("Stored snapshot of {} model {} at {}",
            record.systemId(), record.modelVersion(), record.timestamp());
    }

    @Override
    public void appendMetricValue(String systemId, String metric, Instant timestamp, double value) {
        MetricSeriesKey key = new MetricSeriesKey(systemId, metric);
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        requireFinite(key, value);
        ReentrantLock lock = writeLock(systemId);
        lock.lock();
        try {
            logFor(key).append(new MetricPoint(timestamp, value), key.toString());
        } finally {
            lock.unlock();
        }
        logger.debug("Appended {}={} at {}", key, value, timestamp);
    }

    @Override
    public List<MetricPoint> getHistory(String systemId, String metric, int window) {
        requirePositive(window);
        Log<MetricPoint> log = series.get(new MetricSeriesKey(systemId, metric));
        return log == null ? List.of() : log.tail(window);
    }

    @Override
    public List<SnapshotRecord> snapshots(String systemId, int limit) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        requirePositive(limit);
        Log<SnapshotRecord> log = snapshots.get(systemId);
        return log == null ? List.of() : log.tail(limit);
    }

    @Override
    public List<String> metrics(String systemId) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        List<String> names = seriesNames.get(systemId);
        return names == null ? List.of() : List.copyOf(names);
    }

    /// Number of points in a series.
    public int size(String systemId, String metric) {
        Log<MetricPoint> log = series.get(new MetricSeriesKey(systemId, metric));
        return log == null ? 0 : log.size();
    }

    /// Fails if a point at this timestamp could not be appended to the series.
    void checkAppendable(MetricSeriesKey key, Instant timestamp) {
        Log<MetricPoint> log = series.get(key);
        if (log != null) {
            log.checkOrder(timestamp, key.toString());
        }
    }

    /// Fails if a record at this timestamp could not be appended for the system.
    void checkAppendable(SnapshotRecord record) {
        Log<SnapshotRecord> log = snapshots.get(record.systemId());
        if (log != null) {
            log.checkOrder(record.timestamp(), "snapshots of " + record.systemId());
        }
    }

    /// Fails if the record or any of its metric values could not be appended.
    ///
    /// Callers hold the system's write lock, so a record that passes is
    /// appended in full.
    void checkRecordable(SnapshotRecord record) {
        checkAppendable(record);
        for (Map.Entry<String, Double> entry : record.metricValues().entrySet()) {
            MetricSeriesKey key = new MetricSeriesKey(record.systemId(), entry.getKey());
            requireFinite(key, entry.getValue());
            checkAppendable(key, record.timestamp());
        }
    }

    /// The lock serializing all writes of one system.
    ReentrantLock writeLock(String systemId) {
        return writeLocks.computeIfAbsent(systemId, k -> new ReentrantLock());
    }

    static void requireFinite(MetricSeriesKey key, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value of " + key + " must be finite, got: " + value);
        }
    }

    private Log<MetricPoint> logFor(MetricSeriesKey key) {
        return series.computeIfAbsent(key, k -> {
            seriesNames.computeIfAbsent(k.systemId(), s -> new CopyOnWriteArrayList<>()).add(k.metric());
            return new Log<>(MetricPoint::timestamp);
        });
    }

    private static void requirePositive(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("window must be at least 1, got: " + count);
        }
    }

    /// Append-only list guarded by its own lock.
    private static final class Log<T> {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<T> entries = new ArrayList<>();
        private final Function<T, Instant> timestampOf;

        Log(Function<T, Instant> timestampOf) {
            this.timestampOf = timestampOf;
        }

        void append(T entry, String name) {
            lock.lock();
            try {
                checkOrder(timestampOf.apply(entry), name);
                entries.add(entry);
            } finally {
                lock.unlock();
            }
        }

        void checkOrder(Instant timestamp, String name) {
            lock.lock();
            try {
                if (!entries.isEmpty()) {
                    Instant newest = timestampOf.apply(entries.get(entries.size() - 1));
                    if (timestamp.isBefore(newest)) {
                        throw new IllegalArgumentException("out-of-order append to " + name + ": "
                            + timestamp + " is before " + newest);
                    }
                }
            } finally {
                lock.unlock();
            }
        }

        List<T> tail(int count) {
            lock.lock();
            try {
                int from = Math.max(0, entries.size() - count);
                return List.copyOf(entries.subList(from, entries.size()));
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return entries.size();
            } finally {
                lock.unlock();
            }
        }
    }
}
