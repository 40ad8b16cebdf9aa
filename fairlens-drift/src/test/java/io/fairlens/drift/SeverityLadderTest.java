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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SeverityLadderTest {

    @Test
    void defaultBoundaries() {
        SeverityLadder ladder = SeverityLadder.DEFAULT;
        assertEquals(DriftSeverity.NONE, ladder.classify(0.0));
        assertEquals(DriftSeverity.NONE, ladder.classify(0.0299));
        assertEquals(DriftSeverity.MINOR, ladder.classify(0.03));
        assertEquals(DriftSeverity.MINOR, ladder.classify(0.1499));
        assertEquals(DriftSeverity.MAJOR, ladder.classify(0.15));
        assertEquals(DriftSeverity.MAJOR, ladder.classify(0.8));
    }

    @Test
    void signIsIgnored() {
        assertEquals(DriftSeverity.MAJOR, SeverityLadder.DEFAULT.classify(-0.2));
        assertEquals(DriftSeverity.MINOR, SeverityLadder.DEFAULT.classify(-0.05));
    }

    @Test
    void customThresholds() {
        SeverityLadder ladder = SeverityLadder.of(0.01, 0.05);
        assertEquals(0.01, ladder.minorThreshold());
        assertEquals(0.05, ladder.majorThreshold());
        assertEquals(DriftSeverity.MAJOR, ladder.classify(0.05));
        assertEquals(3, ladder.rungs().size());
    }

    @Test
    void rejectsInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> SeverityLadder.of(0.15, 0.03));
        assertThrows(IllegalArgumentException.class, () -> SeverityLadder.of(0.0, 0.1));
        assertThrows(IllegalArgumentException.class, () -> SeverityLadder.DEFAULT.classify(Double.NaN));
    }

    @Test
    void severityOrdering() {
        assertEquals(DriftSeverity.MAJOR, DriftSeverity.MINOR.max(DriftSeverity.MAJOR));
        assertEquals(DriftSeverity.MINOR, DriftSeverity.MINOR.max(DriftSeverity.NONE));
        assertTrue(DriftSeverity.MINOR.isAbove(DriftSeverity.NONE));
        assertFalse(DriftSeverity.MINOR.isAbove(DriftSeverity.MINOR));
        assertEquals("major", DriftSeverity.MAJOR.label());
    }
}
