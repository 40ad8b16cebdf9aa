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

import io.fairlens.metrics.compute.MetricName;
import io.fairlens.metrics.compute.MetricsConfig;
import io.fairlens.metrics.model.SampleBatch;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class FairnessEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final FairnessEvaluator evaluator =
        new FairnessEvaluator(MetricsConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static SampleBatch scenario() {
        return SampleBatch.builder()
            .labels(1, 0, 1, 0, 1, 1, 0, 0)
            .predictions(1, 0, 1, 0, 1, 0, 0, 0)
            .attribute("gender", "F", "F", "F", "F", "M", "M", "M", "M")
            .build();
    }

    @Test
    void snapshotCarriesIdentityAndTimestamp() {
        FairnessSnapshot snapshot = evaluator.evaluate("credit", "1.4.0", scenario());

        assertEquals("credit", snapshot.systemId());
        assertEquals("1.4.0", snapshot.modelVersion());
        assertEquals(NOW, snapshot.timestamp());
        assertEquals(0.36, snapshot.categoryScore().getAsDouble(), 1e-9);
        assertEquals(0.2, snapshot.result(MetricName.DEMOGRAPHIC_PARITY).score().getAsDouble());
        assertTrue(snapshot.summary().hasCriticalIssues());
    }

    @Test
    void metricValuesSkipUndefinedMetrics() {
        Map<String, Double> values = evaluator.evaluate("credit", "1.4.0", scenario()).metricValues();

        assertThat(values.keySet()).containsExactly(
            "demographic_parity", "equal_opportunity", "equalized_odds", "predictive_parity",
            "subgroup_performance", FairnessSnapshot.CATEGORY_SCORE_SERIES);
        assertEquals(0.25, values.get("demographic_parity"), 1e-9);
        assertEquals(0.75, values.get("subgroup_performance"), 1e-9);
        assertThrows(UnsupportedOperationException.class, () -> values.put("x", 1.0));
    }

    @Test
    void metricScoresFollowMetricOrder() {
        Map<String, Double> scores = evaluator.evaluate("credit", "1.4.0", scenario()).metricScores();

        assertEquals(List.of(0.2, 0.2, 0.2, 1.0, 0.2), List.copyOf(scores.values()));
    }

    @Test
    void evaluationIsRepeatable() {
        FairnessSnapshot first = evaluator.evaluate("credit", "1.4.0", scenario());
        FairnessSnapshot second = evaluator.evaluate("credit", "1.4.0", scenario());

        assertEquals(first.metrics(), second.metrics());
        assertEquals(first.summary(), second.summary());
        assertEquals(first.explanations(), second.explanations());
    }

    @Test
    void requiresIdentity() {
        assertThrows(NullPointerException.class, () -> evaluator.evaluate(null, "1", scenario()));
        assertThrows(NullPointerException.class, () -> evaluator.evaluate("credit", "1", null));
    }
}
