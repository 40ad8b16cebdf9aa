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

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DriftReportTest {

    private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");

    private static MetricDriftVerdict verdict(String metric, double baseline, double current, DriftSeverity severity) {
        DriftEvent delta = new DriftEvent("credit", metric, NOW, DetectionMethod.DELTA, baseline, current,
            current - baseline, DriftEvent.percentChange(baseline, current), severity, severity != DriftSeverity.NONE,
            OptionalDouble.empty(), OptionalDouble.empty(), 0);
        return MetricDriftVerdict.reconcile(metric, List.of(delta), 10, 10);
    }

    @Test
    void overallSeverityIsTheMaximum() {
        DriftReport report = DriftReport.of("credit", NOW, List.of(
            verdict("calibration", 0.10, 0.14, DriftSeverity.MINOR),
            verdict("equalized_odds", 0.10, 0.10, DriftSeverity.NONE)));

        assertEquals(DriftSeverity.MINOR, report.overallSeverity());
        assertEquals(List.of("Minor drift in calibration. Continue monitoring for escalation."), report.recommendations());
        assertEquals(Level.INFO, LoggingDriftListener.levelFor(report));
    }

    @Test
    void insufficientVerdictsDoNotRaiseSeverity() {
        DriftReport report = DriftReport.of("credit", NOW, List.of(
            MetricDriftVerdict.insufficient("calibration", 4, 10)));

        assertEquals(DriftStatus.INSUFFICIENT_DATA, report.status());
        assertEquals(DriftSeverity.NONE, report.overallSeverity());
        assertEquals("Insufficient history for calibration: 4 of 10 points.",
            report.verdict("calibration").orElseThrow().recommendation());
        assertTrue(report.metricChanges().isEmpty());
        assertEquals(Level.DEBUG, LoggingDriftListener.levelFor(report));
    }

    @Test
    void majorReportLogsAtWarn() {
        DriftReport report = DriftReport.of("credit", NOW, List.of(
            verdict("demographic_parity", 0.05, 0.25, DriftSeverity.MAJOR)));

        assertEquals(Level.WARN, LoggingDriftListener.levelFor(report));
        new LoggingDriftListener().onReport(report);
        DriftListener.NOOP.onReport(report);
    }

    @Test
    void percentChangeIsEmptyForZeroBaseline() {
        assertTrue(DriftEvent.percentChange(0.0, 0.2).isEmpty());
        assertEquals(-50.0, DriftEvent.percentChange(0.2, 0.1).getAsDouble(), 1e-9);
    }

    @Test
    void verdictNeedsDeltaEvent() {
        assertThrows(IllegalArgumentException.class,
            () -> MetricDriftVerdict.reconcile("calibration", List.of(), 10, 10));
    }

    @Test
    void severityOrdering() {
        assertEquals(DriftSeverity.MAJOR, DriftSeverity.MINOR.max(DriftSeverity.MAJOR));
        assertTrue(DriftSeverity.MINOR.isAbove(DriftSeverity.NONE));
        assertFalse(DriftSeverity.NONE.isAbove(DriftSeverity.NONE));
    }
}
