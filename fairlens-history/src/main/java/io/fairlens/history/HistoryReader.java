package io.fairlens.history;

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

/// Read access to metric series, as needed by drift detection.
@FunctionalInterface
public interface HistoryReader {

    /// Returns up to `count` of the most recent points of a series.
    ///
    /// @param systemId the monitored system
    /// @param metric the series name
    /// @param count the maximum number of points, at least 1
    /// @return an immutable copy, oldest first; empty for an unknown series
    List<MetricPoint> getWindow(String systemId, String metric, int count);
}
