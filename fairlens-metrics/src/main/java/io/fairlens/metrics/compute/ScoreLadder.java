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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Maps a measured value to a normalized score through ordered thresholds.
///
/// ## Boundary Contract
///
/// A ladder is a list of `(lowerBound, score)` rungs sorted by descending
/// lower bound. A value takes the score of the first rung whose lower bound it
/// reaches, so every lower bound is inclusive and every upper bound exclusive:
///
/// ```text
///   GAP ladder                       RATIO ladder
///   lower  │ score  covers           lower  │ score  covers
///  ────────┼──────────────────      ────────┼──────────────────
///    0.15  │  0.2   [0.15, ∞)         0.90  │  1.0   [0.90, ∞)
///    0.10  │  0.5   [0.10, 0.15)      0.85  │  0.7   [0.85, 0.90)
///    0.05  │  0.7   [0.05, 0.10)      0.80  │  0.5   [0.80, 0.85)
///    -∞    │  1.0   (-∞, 0.05)        -∞    │  0.2   (-∞, 0.80)
/// ```
///
/// The bottom rung must have a lower bound of negative infinity so that every
/// finite value is scored.
public final class ScoreLadder {

    /// Shared ladder for the five gap metrics (smaller gap scores higher).
    public static final ScoreLadder GAP = ScoreLadder.builder()
        .rung(0.15, 0.2)
        .rung(0.10, 0.5)
        .rung(0.05, 0.7)
        .otherwise(1.0);

    /// Ladder for the subgroup min/max accuracy ratio (larger ratio scores higher).
    public static final ScoreLadder RATIO = ScoreLadder.builder()
        .rung(0.90, 1.0)
        .rung(0.85, 0.7)
        .rung(0.80, 0.5)
        .otherwise(0.2);

    /// One threshold of a ladder.
    ///
    /// @param lowerBound inclusive lower bound of the rung
    /// @param score score assigned to values in the rung
    public record Rung(double lowerBound, double score) {
    }

    private final List<Rung> rungs;

    private ScoreLadder(List<Rung> rungs) {
        List<Rung> sorted = new ArrayList<>(rungs);
        sorted.sort(Comparator.comparingDouble(Rung::lowerBound).reversed());
        if (sorted.isEmpty() || sorted.get(sorted.size() - 1).lowerBound() != Double.NEGATIVE_INFINITY) {
            throw new IllegalArgumentException("a ladder needs a bottom rung with lower bound -Infinity");
        }
        this.rungs = List.copyOf(sorted);
    }

    /// Creates a ladder from explicit rungs.
    ///
    /// @param rungs rungs in any order; one must have lower bound `-Infinity`
    public static ScoreLadder of(List<Rung> rungs) {
        Objects.requireNonNull(rungs, "rungs cannot be null");
        return new ScoreLadder(rungs);
    }

    /// Starts a ladder definition.
    public static Builder builder() {
        return new Builder();
    }

    /// Scores a value by first match in descending lower-bound order.
    ///
    /// @param value a finite measured value
    /// @return the score of the matching rung
    public double score(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("cannot score NaN");
        }
        for (Rung rung : rungs) {
            if (value >= rung.lowerBound()) {
                return rung.score();
            }
        }
        // unreachable: the bottom rung accepts every non-NaN value
        throw new IllegalStateException("no rung matched " + value);
    }

    /// Returns the rungs in descending lower-bound order.
    public List<Rung> rungs() {
        return rungs;
    }

    @Override
    public String toString() {
        return "ScoreLadder" + rungs;
    }

    /// Fluent ladder builder.
    public static final class Builder {
        private final List<Rung> rungs = new ArrayList<>();

        private Builder() {
        }

        /// Adds a rung with an inclusive lower bound.
        public Builder rung(double lowerBound, double score) {
            rungs.add(new Rung(lowerBound, score));
            return this;
        }

        /// Adds the bottom rung and builds the ladder.
        public ScoreLadder otherwise(double score) {
            rungs.add(new Rung(Double.NEGATIVE_INFINITY, score));
            return new ScoreLadder(rungs);
        }
    }
}
