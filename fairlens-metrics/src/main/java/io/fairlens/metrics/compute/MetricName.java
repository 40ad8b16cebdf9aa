package io.fairlens.metrics.compute;

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

/// The six fairness metrics, in declaration order.
///
/// Declaration order is significant: it is the reporting order of results and
/// the tie-break order when ranking gaps.
public enum MetricName {

    DEMOGRAPHIC_PARITY("demographic_parity", "Demographic parity", true,
        "Adjust decision thresholds per group or apply a pre-processing bias mitigation technique"),
    EQUAL_OPPORTUNITY("equal_opportunity", "Equal opportunity", true,
        "Improve recall on true positives for the underperforming groups"),
    EQUALIZED_ODDS("equalized_odds", "Equalized odds", true,
        "Balance both true positive and false positive rates across protected groups"),
    PREDICTIVE_PARITY("predictive_parity", "Predictive parity", true,
        "Make precision consistent across groups, for example with group-aware thresholds"),
    CALIBRATION("calibration", "Calibration", true,
        "Recalibrate predicted probabilities per group (Platt scaling or isotonic regression)"),
    SUBGROUP_PERFORMANCE("subgroup_performance", "Subgroup performance", false,
        "Collect more data for underperforming subgroups and apply group-specific tuning");

    private final String id;
    private final String displayName;
    private final boolean gapMetric;
    private final String mitigationHint;

    MetricName(String id, String displayName, boolean gapMetric, String mitigationHint) {
        this.id = id;
        this.displayName = displayName;
        this.gapMetric = gapMetric;
        this.mitigationHint = mitigationHint;
    }

    /// Stable snake_case identifier used as the history series name.
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /// True for max−min gap metrics, false for the subgroup accuracy ratio.
    public boolean isGapMetric() {
        return gapMetric;
    }

    /// Fixed mitigation hint quoted in critical issues.
    public String mitigationHint() {
        return mitigationHint;
    }

    /// The ladder that turns this metric's value into a score.
    public ScoreLadder ladder() {
        return gapMetric ? ScoreLadder.GAP : ScoreLadder.RATIO;
    }

    /// Looks up a metric by its identifier.
    ///
    /// @throws IllegalArgumentException if no metric has the identifier
    public static MetricName fromId(String id) {
        for (MetricName name : values()) {
            if (name.id.equals(id)) {
                return name;
            }
        }
        throw new IllegalArgumentException("unknown metric: " + id);
    }
}
