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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// [DriftListener] that writes each report to the log.
///
/// | Report | Level |
/// |--------|-------|
/// | MAJOR drift | WARN, one line per recommendation |
/// | MINOR drift | INFO, one line per recommendation |
/// | no drift | DEBUG |
/// | insufficient data | DEBUG |
public final class LoggingDriftListener implements DriftListener {

    private static final Logger logger = LogManager.getLogger(LoggingDriftListener.class);

    @Override
    public void onReport(DriftReport report) {
        Level level = levelFor(report);
        if (!report.driftDetected()) {
            logger.log(level, "Drift check of {}: {} ({} metrics)", report.systemId(),
                report.status() == DriftStatus.INSUFFICIENT_DATA ? "insufficient data" : "no drift",
                report.verdicts().size());
            return;
        }
        logger.log(level, "Drift check of {}: {} drift", report.systemId(), report.overallSeverity().label());
        for (String recommendation : report.recommendations()) {
            logger.log(level, "  {}", recommendation);
        }
    }

    static Level levelFor(DriftReport report) {
        return switch (report.overallSeverity()) {
            case MAJOR -> Level.WARN;
            case MINOR -> Level.INFO;
            case NONE -> Level.DEBUG;
        };
    }
}
