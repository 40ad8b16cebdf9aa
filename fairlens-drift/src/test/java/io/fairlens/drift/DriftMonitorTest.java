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

import io.fairlens.history.InMemoryHistoryStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DriftMonitorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");
    private static final String SYSTEM = "credit";
    private static final String METRIC = "demographic_parity";

    private final InMemoryHistoryStore store = new InMemoryHistoryStore();
    private final DriftMonitor monitor = new DriftMonitor(store, DriftConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    private void series(String metric, double... values) {
        for (int i = 0; i < values.length; i++) {
            store.appendMetricValue(SYSTEM, metric, T0.plusSeconds(3600L * i), values[i]);
        }
    }

    @Test
    void stepChangeIsMajorForDeltaAndControlChart() {
        series(METRIC, 0.05, 0.05, 0.05, 0.05, 0.05, 0.20, 0.20, 0.20, 0.20, 0.20);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        assertEquals(DriftStatus.EVALUATED, verdict.status());
        assertEquals(DriftSeverity.MAJOR, verdict.severity());
        assertTrue(verdict.driftDetected());

        DriftEvent delta = verdict.event(DetectionMethod.DELTA).orElseThrow();
        assertEquals(0.15, delta.change(), 1e-9);
        assertEquals(DriftSeverity.MAJOR, delta.severity());
        assertEquals(300.0, delta.percentChange().getAsDouble(), 1e-6);

        DriftEvent chart = verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow();
        assertEquals(DriftSeverity.MAJOR, chart.severity());
        assertTrue(chart.flagged());
        assertEquals(Double.POSITIVE_INFINITY, chart.sigmaDistance().getAsDouble());
        assertEquals(5, chart.outOfControlCount());
        assertEquals(0.05, chart.baselineValue());

        // constant, different windows
        DriftEvent statistical = verdict.event(DetectionMethod.STATISTICAL).orElseThrow();
        assertEquals(0.0, statistical.pValue().getAsDouble());
        assertEquals(DriftSeverity.MAJOR, statistical.severity());

        assertThat(verdict.recommendation()).startsWith("URGENT: Major drift detected in demographic_parity (+300.00% change)");
        assertEquals(NOW, delta.timestamp());
    }

    @Test
    void shortHistoryIsInsufficient() {
        series(METRIC, 0.05, 0.20);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        assertEquals(DriftStatus.INSUFFICIENT_DATA, verdict.status());
        assertEquals(DriftSeverity.NONE, verdict.severity());
        assertTrue(verdict.events().isEmpty());
        assertEquals(2, verdict.availablePoints());
        assertEquals(10, verdict.requiredPoints());

        assertEquals(DriftStatus.INSUFFICIENT_DATA, monitor.check(SYSTEM, "unknown").status());
    }

    @Test
    void onlyTheMostRecentPointsAreUsed() {
        // an old spike outside both windows
        series(METRIC, 0.9, 0.9, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        assertEquals(DriftSeverity.NONE, verdict.severity());
        assertEquals(1.0, verdict.event(DetectionMethod.STATISTICAL).orElseThrow().pValue().getAsDouble());
        assertEquals(0.0, verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow().sigmaDistance().getAsDouble());
        assertEquals(10, verdict.availablePoints());
    }

    @Test
    void noisyStableSeriesHasNoDrift() {
        series(METRIC, 0.10, 0.20, 0.10, 0.20, 0.10, 0.20, 0.10, 0.20, 0.10, 0.20);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        assertEquals(DriftSeverity.NONE, verdict.severity());
        for (DriftEvent event : verdict.events()) {
            assertEquals(DriftSeverity.NONE, event.severity(), event.method().id());
        }
        DriftEvent statistical = verdict.event(DetectionMethod.STATISTICAL).orElseThrow();
        assertFalse(statistical.flagged());
        assertThat(statistical.pValue().getAsDouble()).isGreaterThan(0.05);
        DriftEvent chart = verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow();
        assertFalse(chart.flagged());
        assertEquals(0.06 / Math.sqrt(0.0024), chart.sigmaDistance().getAsDouble(), 1e-6);
        assertEquals("No significant drift in demographic_parity.", verdict.recommendation());
    }

    @Test
    void smallShiftIsMinor() {
        series(METRIC, 0.10, 0.11, 0.10, 0.11, 0.10, 0.15, 0.15, 0.15, 0.15, 0.15);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        assertEquals(DriftSeverity.MINOR, verdict.event(DetectionMethod.DELTA).orElseThrow().severity());
        assertEquals(DriftSeverity.MINOR, verdict.event(DetectionMethod.STATISTICAL).orElseThrow().severity());
        assertEquals(DriftSeverity.MINOR, verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow().severity());
        assertEquals(DriftSeverity.MINOR, verdict.severity());
        assertEquals("Minor drift in demographic_parity. Continue monitoring for escalation.", verdict.recommendation());
    }

    @Test
    void significantShiftIsFlaggedByTheTTest() {
        series(METRIC, 0.10, 0.11, 0.09, 0.10, 0.10, 0.30, 0.31, 0.29, 0.30, 0.30);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        DriftEvent statistical = verdict.event(DetectionMethod.STATISTICAL).orElseThrow();
        assertTrue(statistical.flagged());
        assertThat(statistical.pValue().getAsDouble()).isLessThan(0.001);
        assertEquals(DriftSeverity.MAJOR, statistical.severity());
        assertEquals(DriftSeverity.MAJOR, verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow().severity());
        assertEquals(5, verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow().outOfControlCount());
    }

    @Test
    void controlChartCatchesLatestOutlier() {
        series(METRIC, 0.10, 0.11, 0.10, 0.11, 0.10, 0.10, 0.11, 0.10, 0.11, 0.16);

        MetricDriftVerdict verdict = monitor.check(SYSTEM, METRIC);

        assertEquals(DriftSeverity.NONE, verdict.event(DetectionMethod.DELTA).orElseThrow().severity());
        assertFalse(verdict.event(DetectionMethod.STATISTICAL).orElseThrow().flagged());
        DriftEvent chart = verdict.event(DetectionMethod.CONTROL_CHART).orElseThrow();
        assertTrue(chart.flagged());
        assertEquals(DriftSeverity.MINOR, chart.severity());
        assertEquals(1, chart.outOfControlCount());
        assertEquals(DriftSeverity.MINOR, verdict.severity());
    }

    @Test
    void systemReportTakesMaximumSeverity() {
        series("demographic_parity", 0.05, 0.05, 0.05, 0.05, 0.05, 0.20, 0.20, 0.20, 0.20, 0.20);
        series("calibration", 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10, 0.10);
        series("equal_opportunity", 0.10);

        DriftReport report = monitor.checkSystem(SYSTEM, List.of("calibration", "demographic_parity", "equal_opportunity"));

        assertEquals(DriftStatus.EVALUATED, report.status());
        assertEquals(DriftSeverity.MAJOR, report.overallSeverity());
        assertTrue(report.driftDetected());
        assertEquals(3, report.verdicts().size());
        assertEquals(DriftStatus.INSUFFICIENT_DATA, report.verdict("equal_opportunity").orElseThrow().status());
        assertEquals(1, report.recommendations().size());
        assertEquals(List.of("calibration", "demographic_parity"), List.copyOf(report.metricChanges().keySet()));
        assertEquals(NOW, report.timestamp());
    }

    @Test
    void reportWithoutDataIsInsufficient() {
        series(METRIC, 0.1, 0.2);

        DriftReport report = monitor.checkSystem(SYSTEM, List.of(METRIC));
        assertEquals(DriftStatus.INSUFFICIENT_DATA, report.status());
        assertEquals(DriftSeverity.NONE, report.overallSeverity());
        assertFalse(report.driftDetected());

        assertEquals(DriftStatus.INSUFFICIENT_DATA, monitor.checkSystem(SYSTEM, List.of()).status());
    }

    @Test
    void compareUsesSingleValueDelta() {
        Map<String, Double> baseline = new LinkedHashMap<>();
        baseline.put("demographic_parity", 0.10);
        baseline.put("equal_opportunity", 0.0);
        baseline.put("calibration", 0.05);
        Map<String, Double> current = new LinkedHashMap<>();
        current.put("demographic_parity", 0.30);
        current.put("equal_opportunity", 0.05);
        current.put("predictive_parity", 0.5);

        DriftReport report = monitor.compare(SYSTEM, baseline, current);

        assertEquals(2, report.verdicts().size());
        MetricDriftVerdict dp = report.verdict("demographic_parity").orElseThrow();
        assertEquals(DriftSeverity.MAJOR, dp.severity());
        DriftEvent event = dp.events().get(0);
        assertEquals(DetectionMethod.DELTA, event.method());
        assertEquals(0.2, event.change(), 1e-9);
        assertEquals(200.0, event.percentChange().getAsDouble(), 1e-6);

        MetricDriftVerdict eo = report.verdict("equal_opportunity").orElseThrow();
        assertEquals(DriftSeverity.MINOR, eo.severity());
        assertTrue(eo.events().get(0).percentChange().isEmpty());

        assertEquals(DriftSeverity.MAJOR, report.overallSeverity());
        assertTrue(report.verdict("predictive_parity").isEmpty());
        assertEquals(2, report.recommendations().size());
    }

    @Test
    void compareSkipsNullValues() {
        Map<String, Double> baseline = new LinkedHashMap<>();
        baseline.put("demographic_parity", 0.10);
        baseline.put("calibration", null);
        baseline.put("equal_opportunity", 0.10);
        Map<String, Double> current = new LinkedHashMap<>();
        current.put("demographic_parity", null);
        current.put("calibration", 0.30);
        current.put("equal_opportunity", 0.12);

        DriftReport report = monitor.compare(SYSTEM, baseline, current);

        assertEquals(List.of("equal_opportunity"), report.verdicts().stream().map(MetricDriftVerdict::metric).toList());
        assertEquals(DriftSeverity.NONE, report.overallSeverity());
    }

    @Test
    void majorRecommendationWithoutPercentUsesAbsoluteChange() {
        DriftReport report = monitor.compare(SYSTEM, Map.of("calibration", 0.0), Map.of("calibration", -0.2));

        assertEquals("URGENT: Major drift detected in calibration (change -0.2000). "
            + "Immediate investigation and potential model retraining required.", report.recommendations().get(0));
    }

    @Test
    void windowSizeFollowsConfig() {
        DriftMonitor small = new DriftMonitor(store, new DriftConfig().setWindowSize(2), Clock.fixed(NOW, ZoneOffset.UTC));
        series(METRIC, 0.1, 0.1, 0.4, 0.4);

        assertEquals(4, small.requiredPoints());
        assertEquals(DriftSeverity.MAJOR, small.check(SYSTEM, METRIC).severity());
    }
}
