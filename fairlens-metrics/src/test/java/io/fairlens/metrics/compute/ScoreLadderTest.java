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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boundary behavior of the score ladders: lower bounds are inclusive.
 */
@Tag("unit")
public class ScoreLadderTest {

    @Test
    void gapLadderBoundaries() {
        assertEquals(1.0, ScoreLadder.GAP.score(0.0));
        assertEquals(1.0, ScoreLadder.GAP.score(0.0499));
        assertEquals(0.7, ScoreLadder.GAP.score(0.05));
        assertEquals(0.7, ScoreLadder.GAP.score(0.0999));
        assertEquals(0.5, ScoreLadder.GAP.score(0.10));
        assertEquals(0.5, ScoreLadder.GAP.score(0.1499));
        assertEquals(0.2, ScoreLadder.GAP.score(0.15));
        assertEquals(0.2, ScoreLadder.GAP.score(1.0));
    }

    @Test
    void ratioLadderBoundaries() {
        assertEquals(1.0, ScoreLadder.RATIO.score(1.0));
        assertEquals(1.0, ScoreLadder.RATIO.score(0.90));
        assertEquals(0.7, ScoreLadder.RATIO.score(0.8999));
        assertEquals(0.7, ScoreLadder.RATIO.score(0.85));
        assertEquals(0.5, ScoreLadder.RATIO.score(0.80));
        assertEquals(0.2, ScoreLadder.RATIO.score(0.7999));
        assertEquals(0.2, ScoreLadder.RATIO.score(0.0));
    }

    @Test
    void rejectsNaN() {
        assertThrows(IllegalArgumentException.class, () -> ScoreLadder.GAP.score(Double.NaN));
    }

    @Test
    void rungsAreSortedDescending() {
        ScoreLadder ladder = ScoreLadder.of(List.of(
            new ScoreLadder.Rung(Double.NEGATIVE_INFINITY, 0.0),
            new ScoreLadder.Rung(1.0, 1.0),
            new ScoreLadder.Rung(0.5, 0.5)));

        assertEquals(List.of(1.0, 0.5, Double.NEGATIVE_INFINITY),
            ladder.rungs().stream().map(ScoreLadder.Rung::lowerBound).toList());
        assertEquals(0.5, ladder.score(0.75));
        assertEquals(0.0, ladder.score(-3.0));
    }

    @Test
    void requiresBottomRung() {
        assertThrows(IllegalArgumentException.class,
            () -> ScoreLadder.of(List.of(new ScoreLadder.Rung(0.5, 1.0))));
        assertThrows(IllegalArgumentException.class, () -> ScoreLadder.of(List.of()));
    }

    @Test
    void metricLadderSelection() {
        assertSame(ScoreLadder.GAP, MetricName.CALIBRATION.ladder());
        assertSame(ScoreLadder.RATIO, MetricName.SUBGROUP_PERFORMANCE.ladder());
        assertEquals(MetricName.EQUALIZED_ODDS, MetricName.fromId("equalized_odds"));
        assertThrows(IllegalArgumentException.class, () -> MetricName.fromId("accuracy"));
    }
}
