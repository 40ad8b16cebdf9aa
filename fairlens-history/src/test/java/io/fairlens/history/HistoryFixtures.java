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

import io.fairlens.metrics.FairnessEvaluator;
import io.fairlens.metrics.FairnessSnapshot;
import io.fairlens.metrics.compute.MetricsConfig;
import io.fairlens.metrics.model.SampleBatch;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/// Shared snapshots for history tests.
final class HistoryFixtures {

    static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    private HistoryFixtures() {
    }

    static SampleBatch scenarioBatch() {
        return SampleBatch.builder()
            .labels(1, 0, 1, 0, 1, 1, 0, 0)
            .predictions(1, 0, 1, 0, 1, 0, 0, 0)
            .attribute("gender", "F", "F", "F", "F", "M", "M", "M", "M")
            .build();
    }

    static FairnessSnapshot snapshot(String system, Instant at) {
        FairnessEvaluator evaluator = new FairnessEvaluator(MetricsConfig.defaults(), Clock.fixed(at, ZoneOffset.UTC));
        return evaluator.evaluate(system, "1.0.0", scenarioBatch());
    }
}
