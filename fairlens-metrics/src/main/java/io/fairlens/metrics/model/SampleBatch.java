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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// An immutable batch of labeled binary predictions with subgroup assignments.
///
/// ## Layout
///
/// All sequences are parallel: index `i` of every array describes sample `i`.
///
/// ```text
///   sample │ label │ prediction │ probability │ gender │ age
///  ────────┼───────┼────────────┼─────────────┼────────┼──────
///     0    │   1   │     1      │    0.91     │   F    │ <30
///     1    │   0   │     0      │    0.12     │   M    │ 30+
///    ...   │  ...  │    ...     │    ...      │  ...   │ ...
/// ```
///
/// The probability column is optional. Attribute columns keep the order in
/// which they were added; that order defines member order in [SubgroupKey]s.
///
/// ## Validation
///
/// [Builder#build()] rejects the batch with [InvalidInputException] when
/// sequence lengths disagree, a label or prediction is not 0/1, a probability
/// is not a finite value in `[0, 1]`, an attribute value is null, or the batch
/// has no samples or no attributes.
///
/// ## Usage
///
/// ```java
/// SampleBatch batch = SampleBatch.builder()
///     .labels(1, 0, 1, 0)
///     .predictions(1, 0, 0, 0)
///     .probabilities(0.9, 0.2, 0.4, 0.1)
///     .attribute("gender", "F", "F", "M", "M")
///     .build();
/// ```
public final class SampleBatch {

    private final int[] labels;
    private final int[] predictions;
    private final double[] probabilities;
    private final Map<String, String[]> attributes;

    private SampleBatch(int[] labels, int[] predictions, double[] probabilities,
                        Map<String, String[]> attributes) {
        this.labels = labels;
        this.predictions = predictions;
        this.probabilities = probabilities;
        this.attributes = attributes;
    }

    /// Creates a new builder.
    ///
    /// @return an empty builder
    public static Builder builder() {
        return new Builder();
    }

    /// Returns the number of samples.
    public int size() {
        return labels.length;
    }

    /// Returns the ground-truth label (0 or 1) of a sample.
    public int label(int index) {
        return labels[index];
    }

    /// Returns the predicted label (0 or 1) of a sample.
    public int prediction(int index) {
        return predictions[index];
    }

    /// Returns true if predicted probabilities were supplied.
    public boolean hasProbabilities() {
        return probabilities != null;
    }

    /// Returns the predicted probability of a sample.
    ///
    /// @throws IllegalStateException if the batch has no probabilities
    public double probability(int index) {
        if (probabilities == null) {
            throw new IllegalStateException("batch has no probabilities");
        }
        return probabilities[index];
    }

    /// Returns the attribute names in declaration order.
    public List<String> attributeNames() {
        return List.copyOf(attributes.keySet());
    }

    /// Returns true if the batch carries the named attribute.
    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /// Returns the category value of an attribute for one sample.
    ///
    /// @throws IllegalArgumentException if the attribute is unknown
    public String attributeValue(String name, int index) {
        String[] column = attributes.get(name);
        if (column == null) {
            throw new IllegalArgumentException("unknown attribute: " + name);
        }
        return column[index];
    }

    /// Returns a copy of the ground-truth labels.
    public int[] labels() {
        return labels.clone();
    }

    /// Returns a copy of the predicted labels.
    public int[] predictions() {
        return predictions.clone();
    }

    @Override
    public String toString() {
        return "SampleBatch{size=" + size()
            + ", attributes=" + attributes.keySet()
            + ", probabilities=" + hasProbabilities() + "}";
    }

    /// Builder for [SampleBatch]. Inputs are copied on [#build()].
    public static final class Builder {

        private int[] labels;
        private int[] predictions;
        private double[] probabilities;
        private final Map<String, String[]> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder labels(int... labels) {
            this.labels = Objects.requireNonNull(labels, "labels cannot be null");
            return this;
        }

        public Builder predictions(int... predictions) {
            this.predictions = Objects.requireNonNull(predictions, "predictions cannot be null");
            return this;
        }

        /// Sets the optional predicted probabilities. Passing null clears them.
        public Builder probabilities(double... probabilities) {
            this.probabilities = probabilities;
            return this;
        }

        /// Adds an attribute column. Adding the same name twice replaces the
        /// column but keeps its original position.
        public Builder attribute(String name, String... values) {
            Objects.requireNonNull(name, "attribute name cannot be null");
            Objects.requireNonNull(values, "attribute values cannot be null");
            attributes.put(name, values);
            return this;
        }

        /// Adds an attribute column from a list.
        public Builder attribute(String name, List<String> values) {
            Objects.requireNonNull(values, "attribute values cannot be null");
            return attribute(name, values.toArray(new String[0]));
        }

        /// Validates and builds the batch.
        ///
        /// @return the immutable batch
        /// @throws InvalidInputException if the inputs violate the batch invariants
        public SampleBatch build() {
            if (labels == null || predictions == null) {
                throw new InvalidInputException("labels and predictions are required");
            }
            int n = labels.length;
            if (n == 0) {
                throw new InvalidInputException("batch is empty");
            }
            if (predictions.length != n) {
                throw new InvalidInputException(
                    "predictions length " + predictions.length + " does not match labels length " + n);
            }
            if (probabilities != null && probabilities.length != n) {
                throw new InvalidInputException(
                    "probabilities length " + probabilities.length + " does not match labels length " + n);
            }
            if (attributes.isEmpty()) {
                throw new InvalidInputException("at least one subgroup attribute is required");
            }

            for (int i = 0; i < n; i++) {
                if (labels[i] != 0 && labels[i] != 1) {
                    throw new InvalidInputException("label at index " + i + " is " + labels[i] + ", expected 0 or 1");
                }
                if (predictions[i] != 0 && predictions[i] != 1) {
                    throw new InvalidInputException(
                        "prediction at index " + i + " is " + predictions[i] + ", expected 0 or 1");
                }
                if (probabilities != null) {
                    double p = probabilities[i];
                    if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
                        throw new InvalidInputException("probability at index " + i + " is " + p + ", outside [0, 1]");
                    }
                }
            }

            Map<String, String[]> columns = new LinkedHashMap<>();
            for (Map.Entry<String, String[]> entry : attributes.entrySet()) {
                String[] values = entry.getValue();
                if (values.length != n) {
                    throw new InvalidInputException("attribute '" + entry.getKey() + "' length "
                        + values.length + " does not match labels length " + n);
                }
                for (int i = 0; i < n; i++) {
                    if (values[i] == null) {
                        throw new InvalidInputException(
                            "attribute '" + entry.getKey() + "' has a null value at index " + i);
                    }
                }
                columns.put(entry.getKey(), values.clone());
            }

            return new SampleBatch(
                labels.clone(),
                predictions.clone(),
                probabilities == null ? null : probabilities.clone(),
                Collections.unmodifiableMap(columns));
        }
    }
}
