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

/// Receives each drift report produced by a [FairnessMonitor] check.
///
/// Listeners run on the checking thread, in registration order. An exception
/// thrown by a listener propagates to the caller of the check.
@FunctionalInterface
public interface DriftListener {

    /// Listener that ignores every report.
    DriftListener NOOP = report -> {
    };

    /// Called once per system check.
    ///
    /// @param report the completed report
    void onReport(DriftReport report);
}
