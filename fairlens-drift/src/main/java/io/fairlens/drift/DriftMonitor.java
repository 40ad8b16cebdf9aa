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

import io.fairlens.history.HistoryReader;
import io.fairlens.history.MetricPoint;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.inference.TTest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/// Detects drift in fairness metric series.
///
/// ## Windows
///
/// Each check reads the most recent `2 × window_size` points of a series:
///
/// ```text
///   oldest                                                newest
///   ┌────┬────┬────┬────┬────┐┌────┬────┬────┬────┬────┐
///   │ b1 │ b2 │ b3 │ b4 │ b5 ││ c1 │ c2 │ c3 │ c4 │ c5 │
///   └────┴────┴────┴────┴────┘└────┴────┴────┴────┴────┘
///        baseline window            current window
/// ```
///
/// With fewer points the verdict is [DriftStatus#INSUFFICIENT_DATA].
///
/// ## Methods
///
/// | Method | Test | Severity |
/// |--------|------|----------|
/// | delta | always | ladder(\|mean(c) − mean(b)\|) |
/// | statistical | Welch t-test, p < alpha | ladder(mean change) when the test fires, else NONE |
/// | control chart | c5 outside mean(b) ± k·σ(b) | ladder(\|c5 − mean(b)\|) when outside, else NONE |
///
/// σ is the population standard deviation of the baseline. A constant
/// baseline (σ = 0) puts any different value out of control at MAJOR, and a
/// pair of constant windows gets a p-value of 1 when they are equal and 0
/// otherwise.
///
/// The verdict takes the most severe method.
///
/// ## Thread Safety
///
/// Holds only immutable configuration; safe for concurrent use as long as
/// the [HistoryReader] is.
public final class DriftMonitor {

    private static final Logger logger = LogManager.getLogger(DriftMonitor.class);

    private final HistoryReader history;
    private final int windowSize;
    private final double alpha;
    private final double sigmaLimit;
    private final SeverityLadder ladder;
    private final Clock clock;

    public DriftMonitor(HistoryReader history) {
        this(history, DriftConfig.defaults());
    }

    public DriftMonitor(HistoryReader history, DriftConfig config) {
        this(history, config, Clock.systemUTC());
    }

    /// @param history source of metric series
    /// @param config window, test and threshold settings
    /// @param clock source of check timestamps
    public DriftMonitor(HistoryReader history, DriftConfig config, Clock clock) {
        this.history = Objects.requireNonNull(history, "history cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        this.windowSize = config.getWindowSize();
        this.alpha = config.getAlpha();
        this.sigmaLimit = config.getSigmaLimit();
        this.ladder = config.ladder();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /// Number of points a full check needs.
    public int requiredPoints() {
        return 2 * windowSize;
    }

    /// Checks one metric series.
    public MetricDriftVerdict check(String systemId, String metric) {
        return check(systemId, metric, clock.instant());
    }

    /// Checks several metric series of one system.
    ///
    /// @param systemId the monitored system
    /// @param metrics series names, reported in iteration order
    /// @return the report; [DriftStatus#INSUFFICIENT_DATA] when no series had enough points
    public DriftReport checkSystem(String systemId, Collection<String> metrics) {
        Objects.requireNonNull(metrics, "metrics cannot be null");
        Instant now = clock.instant();
        List<MetricDriftVerdict> verdicts = new ArrayList<>();
        for (String metric : metrics) {
            verdicts.add(check(systemId, metric, now));
        }
        DriftReport report = DriftReport.of(systemId, now, verdicts);
        if (report.status() == DriftStatus.INSUFFICIENT_DATA) {
            logger.warn("Drift check of {} skipped: no metric has {} points of history", systemId, requiredPoints());
        }
        return report;
    }

    /// Compares two single-value metric snapshots with the delta method.
    ///
    /// Only metrics with a non-null value in both maps are compared, in the
    /// iteration order of `current`.
    public DriftReport compare(String systemId, Map<String, Double> baseline, Map<String, Double> current) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(baseline, "baseline cannot be null");
        Objects.requireNonNull(current, "current cannot be null");
        Instant now = clock.instant();
        List<MetricDriftVerdict> verdicts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : current.entrySet()) {
            Double before = baseline.get(entry.getKey());
            if (before == null || entry.getValue() == null) {
                continue;
            }
            DriftEvent event = delta(systemId, entry.getKey(), now, before, entry.getValue());
            verdicts.add(MetricDriftVerdict.reconcile(entry.getKey(), List.of(event), 1, 1));
        }
        return DriftReport.of(systemId, now, verdicts);
    }

    private MetricDriftVerdict check(String systemId, String metric, Instant now) {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(metric, "metric cannot be null");
        int required = requiredPoints();
        List<MetricPoint> points = history.getWindow(systemId, metric, required);
        if (points.size() < required) {
            logger.debug("{}/{} has {} of {} points, skipping", systemId, metric, points.size(), required);
            return MetricDriftVerdict.insufficient(metric, points.size(), required);
        }

        double[] baseline = values(points, 0, windowSize);
        double[] current = values(points, windowSize, required);
        double baselineMean = new Mean().evaluate(baseline);
        double currentMean = new Mean().evaluate(current);

        List<DriftEvent> events = List.of(
            delta(systemId, metric, now, baselineMean, currentMean),
            statistical(systemId, metric, now, baseline, current, baselineMean, currentMean),
            controlChart(systemId, metric, now, baseline, current));
        MetricDriftVerdict verdict = MetricDriftVerdict.reconcile(metric, events, points.size(), required);

        if (verdict.driftDetected()) {
            logger.info("{} drift in {}/{}: {}", verdict.severity().label(), systemId, metric, verdict.recommendation());
        } else {
            logger.debug("No drift in {}/{}", systemId, metric);
        }
        return verdict;
    }

    private DriftEvent delta(String systemId, String metric, Instant now, double baseline, double current) {
        double change = current - baseline;
        DriftSeverity severity = ladder.classify(change);
        return new DriftEvent(systemId, metric, now, DetectionMethod.DELTA, baseline, current, change,
            DriftEvent.percentChange(baseline, current), severity, severity != DriftSeverity.NONE,
            OptionalDouble.empty(), OptionalDouble.empty(), 0);
    }

    private DriftEvent statistical(String systemId, String metric, Instant now, double[] baseline, double[] current,
                                   double baselineMean, double currentMean) {
        double pValue;
        if (isConstant(baseline) && isConstant(current)) {
            pValue = baseline[0] == current[0] ? 1.0 : 0.0;
        } else {
            pValue = new TTest().tTest(current, baseline);
        }
        boolean flagged = pValue < alpha;
        double change = currentMean - baselineMean;
        DriftSeverity severity = flagged ? ladder.classify(change) : DriftSeverity.NONE;
        return new DriftEvent(systemId, metric, now, DetectionMethod.STATISTICAL, baselineMean, currentMean, change,
            DriftEvent.percentChange(baselineMean, currentMean), severity, flagged,
            OptionalDouble.of(pValue), OptionalDouble.empty(), 0);
    }

    private DriftEvent controlChart(String systemId, String metric, Instant now, double[] baseline, double[] current) {
        boolean constant = isConstant(baseline);
        double center = constant ? baseline[0] : new Mean().evaluate(baseline);
        double std = constant ? 0.0 : new StandardDeviation(false).evaluate(baseline);

        double latest = current[current.length - 1];
        double deviation = latest - center;
        double distance = sigmaDistance(deviation, std);
        boolean flagged = Math.abs(distance) > sigmaLimit;

        int outOfControl = 0;
        for (double value : current) {
            if (Math.abs(sigmaDistance(value - center, std)) > sigmaLimit) {
                outOfControl++;
            }
        }

        DriftSeverity severity;
        if (!flagged) {
            severity = DriftSeverity.NONE;
        } else if (std == 0.0) {
            severity = DriftSeverity.MAJOR;
        } else {
            severity = ladder.classify(deviation);
        }
        return new DriftEvent(systemId, metric, now, DetectionMethod.CONTROL_CHART, center, latest, deviation,
            DriftEvent.percentChange(center, latest), severity, flagged,
            OptionalDouble.empty(), OptionalDouble.of(distance), outOfControl);
    }

    private static double sigmaDistance(double deviation, double std) {
        if (std == 0.0) {
            return deviation == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, deviation);
        }
        return deviation / std;
    }

    private static boolean isConstant(double[] values) {
        for (double value : values) {
            if (value != values[0]) {
                return false;
            }
        }
        return true;
    }

    private static double[] values(List<MetricPoint> points, int from, int to) {
        double[] values = new double[to - from];
        for (int i = from; i < to; i++) {
            values[i - from] = points.get(i).value();
        }
        return values;
    }
}
