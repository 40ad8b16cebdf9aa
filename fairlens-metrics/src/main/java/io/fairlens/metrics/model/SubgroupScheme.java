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

import java.util.ArrayList;
import java.util.List;

/// Decides which attribute combinations define subgroups for a batch.
///
/// A scheme yields a list of attribute sets. Every sample belongs to exactly
/// one subgroup per attribute set, so a scheme with several sets assigns each
/// sample to several (overlapping) subgroups.
///
/// ```text
///   attributes: gender, age, region
///
///   perAttribute()        → [gender] [age] [region]
///   conjunction(gender,age) → [gender, age]
///   intersectional(2)     → [gender] [age] [region]
///                           [gender, age] [gender, region] [age, region]
/// ```
@FunctionalInterface
public interface SubgroupScheme {

    /// Returns the attribute sets for the given batch, each in batch attribute order.
    ///
    /// @param batch the batch whose attributes are partitioned
    /// @return non-empty attribute sets
    List<List<String>> attributeSets(SampleBatch batch);

    /// One subgroup per value of each attribute, attributes kept separate.
    static SubgroupScheme perAttribute() {
        return batch -> {
            List<List<String>> sets = new ArrayList<>();
            for (String name : batch.attributeNames()) {
                sets.add(List.of(name));
            }
            return sets;
        };
    }

    /// One subgroup per observed combination of the named attributes.
    ///
    /// @param attributes attribute names; must all be present in the batch
    static SubgroupScheme conjunction(String... attributes) {
        List<String> requested = List.of(attributes);
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("conjunction needs at least one attribute");
        }
        return batch -> {
            for (String name : requested) {
                if (!batch.hasAttribute(name)) {
                    throw new InvalidInputException("batch has no attribute '" + name + "'");
                }
            }
            List<String> ordered = new ArrayList<>();
            for (String name : batch.attributeNames()) {
                if (requested.contains(name)) {
                    ordered.add(name);
                }
            }
            return List.of(ordered);
        };
    }

    /// Every combination of 1 to `maxDepth` attributes.
    ///
    /// @param maxDepth the largest number of attributes in one combination, at least 1
    static SubgroupScheme intersectional(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got: " + maxDepth);
        }
        return batch -> {
            List<String> names = batch.attributeNames();
            List<List<String>> sets = new ArrayList<>();
            int depth = Math.min(maxDepth, names.size());
            for (int size = 1; size <= depth; size++) {
                combinations(names, size, 0, new ArrayList<>(), sets);
            }
            return sets;
        };
    }

    private static void combinations(List<String> names, int size, int start,
                                     List<String> current, List<List<String>> out) {
        if (current.size() == size) {
            out.add(List.copyOf(current));
            return;
        }
        for (int i = start; i < names.size(); i++) {
            current.add(names.get(i));
            combinations(names, size, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }
}
