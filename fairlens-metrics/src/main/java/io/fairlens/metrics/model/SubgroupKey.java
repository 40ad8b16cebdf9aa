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
import java.util.Objects;
import java.util.stream.Collectors;

/// Identifies a subgroup as an ordered tuple of `(attribute, value)` members.
///
/// A key with one member is a single-attribute group such as `gender=F`; a key
/// with two or more members is an intersectional group such as
/// `gender=F&age=<30`. Member order follows the batch's attribute order, so
/// the same conjunction always produces an equal key.
///
/// @param members the members, at least one
public record SubgroupKey(List<Member> members) {

    /// One `attribute=value` condition of a subgroup key.
    ///
    /// @param attribute attribute name
    /// @param value category value
    public record Member(String attribute, String value) {
        public Member {
            Objects.requireNonNull(attribute, "attribute cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String toString() {
            return attribute + "=" + value;
        }
    }

    public SubgroupKey {
        Objects.requireNonNull(members, "members cannot be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("a subgroup key needs at least one member");
        }
        members = List.copyOf(members);
    }

    /// Creates a single-attribute key.
    public static SubgroupKey of(String attribute, String value) {
        return new SubgroupKey(List.of(new Member(attribute, value)));
    }

    /// Creates a key from alternating attribute/value strings.
    ///
    /// @param attributeValuePairs `attr1, value1, attr2, value2, ...`
    public static SubgroupKey of(String... attributeValuePairs) {
        if (attributeValuePairs.length == 0 || attributeValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("expected alternating attribute/value pairs");
        }
        List<Member> members = new ArrayList<>();
        for (int i = 0; i < attributeValuePairs.length; i += 2) {
            members.add(new Member(attributeValuePairs[i], attributeValuePairs[i + 1]));
        }
        return new SubgroupKey(members);
    }

    /// Returns true if the key combines two or more attributes.
    public boolean isIntersectional() {
        return members.size() > 1;
    }

    /// Returns the attribute names of this key, in member order.
    public List<String> attributes() {
        return members.stream().map(Member::attribute).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return members.stream().map(Member::toString).collect(Collectors.joining("&"));
    }
}
