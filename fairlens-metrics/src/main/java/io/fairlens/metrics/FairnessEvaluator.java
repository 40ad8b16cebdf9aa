package io.fairlens.metrics;

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

import io.fairlens.metrics.aggregate.BiasAggregator;
import io.fairlens.metrics.aggregate.BiasSummary;
import io.fairlens.metrics.compute.FairnessMetrics;
import io.fairlens.metrics.compute.MetricComputer;
import io.fairlens.metrics.compute.MetricsConfig;
import io.fairlens.metrics.model.SampleBatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;

/// Runs the full evaluation pipeline for one batch and returns a snapshot.
///
/// ```java
/// FairnessEvaluator evaluator = new FairnessEvaluator(MetricsConfig.defaults());
/// FairnessSnapshot snapshot = evaluator.evaluate("credit-model", "2.1.0", batch);
/// snapshot.summary().criticalIssues().forEach(i -> System.out.println(i.text()));
/// ```
///
/// Nothing here has side effects: the snapshot is only a value until a
/// caller hands it to a history store.
public final class FairnessEvaluator {

    private static final Logger logger = LogManager.getLogger(FairnessEvaluator.class);

    private final MetricComputer computer;
    private final BiasAggregator aggregator;
    private final Clock clock;

    public FairnessEvaluator() {
        this(MetricsConfig.defaults());
    }

    public FairnessEvaluator(MetricsConfig config) {
        this(config, Clock.systemUTC());
    }

    /// @param config metric and aggregation settings
    /// @param clock source of snapshot timestamps
    public FairnessEvaluator(MetricsConfig config, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.computer = new MetricComputer(config);
        this.aggregator = new BiasAggregator(config);
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /// Evaluates a batch.
    ///
    /// @param systemId the evaluated system
    /// @param modelVersion the model version that produced the predictions
    /// @param batch the validated batch
    /// @return a new immutable snapshot
    public FairnessSnapshot evaluate(String systemId, String modelVersion, SampleBatch batch) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(modelVersion, "modelVersion cannot be null");
        Objects.requireNonNull(batch, "batch cannot be null");

        FairnessMetrics metrics = computer.compute(batch);
        BiasSummary summary = aggregator.aggregate(metrics);
        FairnessSnapshot snapshot = new FairnessSnapshot(systemId, modelVersion, clock.instant(), metrics, summary);
        logger.debug("Evaluated {} samples for {}: {}", batch.size(), systemId, snapshot);
        return snapshot;
    }
}
