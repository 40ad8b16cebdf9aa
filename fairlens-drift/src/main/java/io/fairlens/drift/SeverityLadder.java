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

import java.util.List;

/// Classifies an absolute change into a [DriftSeverity].
///
/// Same boundary contract as the metric score ladders: rungs are checked in
/// descending lower-bound order and every lower bound is inclusive.
///
/// ```text
///   lower  │ severity  covers
///  ────────┼─────────────────────
///    0.15  │ MAJOR     [0.15, ∞)
///    0.03  │ MINOR     [0.03, 0.15)
///    -∞    │ NONE      (-∞, 0.03)
/// ```
public final class SeverityLadder {

    /// Default thresholds of 0.03 and 0.15.
    public static final SeverityLadder DEFAULT = of(0.03, 0.15);

    /// One threshold of the ladder.
    public record Rung(double lowerBound, DriftSeverity severity) {
    }

    private final List<Rung> rungs;

    private SeverityLadder(List<Rung> rungs) {
        this.rungs = List.copyOf(rungs);
    }

    /// Creates a ladder from the MINOR and MAJOR lower bounds.
    ///
    /// @throws IllegalArgumentException unless `0 < minor < major`
    public static SeverityLadder of(double minorThreshold, double majorThreshold) {
        if (!(minorThreshold > 0.0 && majorThreshold > minorThreshold)) {
            throw new IllegalArgumentException("thresholds must satisfy 0 < minor < major, got: "
                + minorThreshold + ", " + majorThreshold);
        }
        return new SeverityLadder(List.of(
            new Rung(majorThreshold, DriftSeverity.MAJOR),
            new Rung(minorThreshold, DriftSeverity.MINOR),
            new Rung(Double.NEGATIVE_INFINITY, DriftSeverity.NONE)));
    }

    /// Classifies the magnitude of a change; the sign is ignored.
    public DriftSeverity classify(double change) {
        if (Double.isNaN(change)) {
            throw new IllegalArgumentException("cannot classify NaN");
        }
        double magnitude = Math.abs(change);
        for (Rung rung : rungs) {
            if (magnitude >= rung.lowerBound()) {
                return rung.severity();
            }
        }
        throw new IllegalStateException("no rung matched " + change);
    }

    public double minorThreshold() {
        return rungs.get(1).lowerBound();
    }

    public double majorThreshold() {
        return rungs.get(0).lowerBound();
    }

    public List<Rung> rungs() {
        return rungs;
    }

    @Override
    public String toString() {
        return "SeverityLadder" + rungs;
    }
}
