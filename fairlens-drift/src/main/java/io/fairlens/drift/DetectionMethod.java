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

/// The drift detection methods applied to each metric series.
public enum DetectionMethod {
    /// Absolute difference of the window means.
    DELTA("delta"),
    /// Welch two-sample t-test between the windows.
    STATISTICAL("statistical"),
    /// Most recent value against baseline mean ± k·σ.
    CONTROL_CHART("control_chart");

    private final String id;

    DetectionMethod(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
