/*
 * SetPattern.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.match.pattern;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.RepeatedVariableException;
import com.apple.foundationdb.match.Variable;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An unordered container pattern. It matches a {@link Set} subject if every element pattern can be assigned to its
 * own, distinct subject element that it matches. The subject may have more elements than the pattern.
 *
 * <p>
 * Element patterns are deduplicated by {@link Object#equals(Object)}; iteration order is the order in which the
 * elements were first given. Two equal elements that contain a {@link Variable} are the same variable used twice
 * and are rejected.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class SetPattern implements Pattern {
    @Nonnull
    private final Set<Pattern> elements;

    /**
     * Create a set pattern.
     * @param elements the element patterns
     * @throws RepeatedVariableException if two equal elements contain a variable
     */
    public SetPattern(@Nonnull Collection<? extends Pattern> elements) {
        final ImmutableSet.Builder<Pattern> builder = ImmutableSet.builderWithExpectedSize(elements.size());
        final Set<Pattern> seen = new HashSet<>();
        for (Pattern element : elements) {
            if (!seen.add(element)) {
                final Variable variable = Patterns.findVariable(element);
                if (variable != null) {
                    throw new RepeatedVariableException(variable, 2);
                }
            }
            builder.add(element);
        }
        this.elements = builder.build();
    }

    @Nonnull
    public Set<Pattern> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.SET;
    }

    @Nonnull
    @Override
    public Iterable<? extends Pattern> getChildren() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return elements.equals(((SetPattern)o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
