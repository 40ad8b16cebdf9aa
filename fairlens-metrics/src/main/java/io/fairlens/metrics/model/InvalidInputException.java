package io.fairlens.metrics.model;

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

/// Thrown when a sample batch cannot be evaluated at all.
///
/// Raised for mismatched sequence lengths, labels or predictions outside
/// `{0, 1}`, probabilities outside `[0, 1]`, null attribute values and empty
/// batches. The batch is rejected as a whole; no partial result is produced.
///
/// Expected edge conditions such as small groups or single-class groups are
/// never reported through this exception. They surface as explicit result
/// states on the computed metrics instead.
public class InvalidInputException extends IllegalArgumentException {

    /// Creates an exception with the given message.
    ///
    /// @param message description of the rejected input
    public InvalidInputException(String message) {
        super(message);
    }
}
