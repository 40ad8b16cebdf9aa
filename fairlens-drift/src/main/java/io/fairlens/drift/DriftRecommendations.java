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

import java.util.Locale;
import java.util.OptionalDouble;

/// Fixed per-severity recommendation templates.
final class DriftRecommendations {

    private DriftRecommendations() {
    }

    /// Builds the recommendation for a metric verdict.
    ///
    /// @param metric the series name
    /// @param severity the reconciled severity
    /// @param change signed change of the delta method
    /// @param percentChange relative change, empty for a zero baseline
    static String forSeverity(String metric, DriftSeverity severity, double change, OptionalDouble percentChange) {
        return switch (severity) {
            case MAJOR -> {
                String magnitude = percentChange.isPresent()
                    ? String.format(Locale.ROOT, "%+.2f%% change", percentChange.getAsDouble())
                    : String.format(Locale.ROOT, "change %+.4f", change);
                yield "URGENT: Major drift detected in " + metric + " (" + magnitude + "). "
                    + "Immediate investigation and potential model retraining required.";
            }
            case MINOR -> "Minor drift in " + metric + ". Continue monitoring for escalation.";
            case NONE -> "No significant drift in " + metric + ".";
        };
    }

    static String insufficientData(String metric, int available, int required) {
        return "Insufficient history for " + metric + ": " + available + " of " + required + " points.";
    }
}
