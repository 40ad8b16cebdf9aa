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

import java.util.Objects;

/// Identifies one metric series: a system and a metric identifier.
///
/// @param systemId the monitored system
/// @param metric a metric id such as `demographic_parity`, or `category_score`
public record MetricSeriesKey(String systemId, String metric) {
    public MetricSeriesKey {
        Objects.requireNonNull(systemId, "systemId cannot be null");
        Objects.requireNonNull(metric, "metric cannot be null");
    }

    @Override
    public String toString() {
        return systemId + "/" + metric;
    }
}
