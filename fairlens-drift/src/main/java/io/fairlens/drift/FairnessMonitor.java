package io.fairlens.drift;

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

import io.fairlens.history.FairnessHistoryStore;
import io.fairlens.metrics.FairnessEvaluator;
import io.fairlens.metrics.FairnessSnapshot;
import io.fairlens.metrics.compute.MetricsConfig;
import io.fairlens.metrics.model.SampleBatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/// Evaluates batches, records them, and checks the recorded series for drift.
///
/// ## Flow
///
/// ```text
///   evaluate(system, version, batch)
///     FairnessEvaluator ──► FairnessSnapshot ──► FairnessHistoryStore.recordSnapshot
///
///   checkDrift(system)
///     recorded series names ──► DriftMonitor.checkSystem ──► DriftListeners
/// ```
///
/// ## Usage
///
/// ```java
/// FairnessMonitor monitor = new FairnessMonitor(new InMemoryHistoryStore());
/// monitor.addListener(new LoggingDriftListener());
/// monitor.evaluate("credit", "2.1.0", batch);
/// DriftReport report = monitor.checkDrift("credit");
/// ```
public final class FairnessMonitor {

    private static final Logger logger = LogManager.getLogger(FairnessMonitor.class);

    private final FairnessEvaluator evaluator;
    private final FairnessHistoryStore store;
    private final DriftMonitor driftMonitor;
    private final List<DriftListener> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, ReentrantLock> systemLocks = new ConcurrentHashMap<>();

    public FairnessMonitor(FairnessHistoryStore store) {
        this(MetricsConfig.defaults(), DriftConfig.defaults(), store, Clock.systemUTC());
    }

    /// @param metricsConfig metric and aggregation settings
    /// @param driftConfig drift detection settings
    /// @param store where snapshots and series are recorded
    /// @param clock source of snapshot and check timestamps
    public FairnessMonitor(MetricsConfig metricsConfig, DriftConfig driftConfig, FairnessHistoryStore store, Clock clock) {
        this(new FairnessEvaluator(metricsConfig, clock), store, new DriftMonitor(store, driftConfig, clock));
    }

    public FairnessMonitor(FairnessEvaluator evaluator, FairnessHistoryStore store, DriftMonitor driftMonitor) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.driftMonitor = Objects.requireNonNull(driftMonitor, "driftMonitor cannot be null");
    }

    public void addListener(DriftListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(DriftListener listener) {
        listeners.remove(listener);
    }

    /// Evaluates a batch and records the snapshot with all of its metric values.
    ///
    /// Evaluations of one system run one at a time, so snapshots are stamped
    /// and recorded in the same order.
    ///
    /// @return the recorded snapshot
    /// @throws io.fairlens.history.HistoryStoreException if the store cannot persist the snapshot
    public FairnessSnapshot evaluate(String systemId, String modelVersion, SampleBatch batch) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        ReentrantLock lock = systemLocks.computeIfAbsent(systemId, k -> new ReentrantLock());
        FairnessSnapshot snapshot;
        lock.lock();
        try {
            snapshot = evaluator.evaluate(systemId, modelVersion, batch);
            store.recordSnapshot(snapshot);
        } finally {
            lock.unlock();
        }
        logger.info("Recorded fairness snapshot of {} model {} at {} (category score {})",
            systemId, modelVersion, snapshot.timestamp(), snapshot.categoryScore());
        return snapshot;
    }

    /// Checks every recorded metric series of the system and notifies the
    /// listeners.
    ///
    /// A metric that was undefined in recent batches is still checked over
    /// the points it has.
    ///
    /// @return the report; [DriftStatus#INSUFFICIENT_DATA] when nothing was recorded yet
    public DriftReport checkDrift(String systemId) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        DriftReport report = driftMonitor.checkSystem(systemId, store.metrics(systemId));
        for (DriftListener listener : listeners) {
            listener.onReport(report);
        }
        return report;
    }

    public DriftMonitor driftMonitor() {
        return driftMonitor;
    }
}
