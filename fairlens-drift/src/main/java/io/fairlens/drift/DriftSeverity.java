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

/// Drift severity, ordered from least to most severe.
///
/// | Severity | Absolute change | Meaning |
/// |----------|-----------------|---------|
/// | NONE | < 0.03 | stable |
/// | MINOR | [0.03, 0.15) | keep monitoring |
/// | MAJOR | ≥ 0.15 | investigate now |
public enum DriftSeverity {
    NONE,
    MINOR,
    MAJOR;

    /// Returns the more severe of this and another severity.
    public DriftSeverity max(DriftSeverity other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    public boolean isAbove(DriftSeverity other) {
        return ordinal() > other.ordinal();
    }

    /// Lower-case name used in logs and recommendations.
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
