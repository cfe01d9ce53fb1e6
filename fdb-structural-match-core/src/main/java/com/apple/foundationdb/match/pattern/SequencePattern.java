/*
 * SequencePattern.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered container pattern. It matches a subject of the same {@link SequenceFamily} and the same length whose
 * elements match the element patterns position by position.
 */
@API(API.Status.EXPERIMENTAL)
public class SequencePattern implements Pattern {
    @Nonnull
    private final SequenceFamily family;
    @Nonnull
    private final List<Pattern> elements;

    public SequencePattern(@Nonnull SequenceFamily family, @Nonnull List<? extends Pattern> elements) {
        this.family = family;
        this.elements = ImmutableList.copyOf(elements);
    }

    @Nonnull
    public SequenceFamily getFamily() {
        return family;
    }

    @Nonnull
    public List<Pattern> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.SEQUENCE;
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
        final SequencePattern that = (SequencePattern)o;
        return family.equals(that.family) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, elements);
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", family + "(", ")"));
    }
}
