/*
 * TaggedSequence.java
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

package com.apple.foundationdb.match.subject;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.pattern.SequenceFamily;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable ordered sequence that carries its {@link SequenceFamily} explicitly. Use it to build subjects of a
 * family other than {@link SequenceFamily#LIST} or {@link SequenceFamily#ARRAY}, most commonly tuples. Elements
 * may be {@code null}.
 */
@API(API.Status.EXPERIMENTAL)
public final class TaggedSequence implements Iterable<Object> {
    @Nonnull
    private final SequenceFamily family;
    @Nonnull
    private final List<Object> elements;

    private TaggedSequence(@Nonnull SequenceFamily family, @Nonnull List<?> elements) {
        this.family = family;
        // ImmutableList would reject null elements
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Nonnull
    public static TaggedSequence of(@Nonnull SequenceFamily family, @Nonnull List<?> elements) {
        return new TaggedSequence(family, elements);
    }

    @Nonnull
    public static TaggedSequence of(@Nonnull SequenceFamily family, @Nullable Object... elements) {
        return new TaggedSequence(family, elements == null ? Collections.emptyList() : Arrays.asList(elements));
    }

    @Nonnull
    public static TaggedSequence tuple(@Nullable Object... elements) {
        return of(SequenceFamily.TUPLE, elements);
    }

    @Nonnull
    public SequenceFamily getFamily() {
        return family;
    }

    @Nonnull
    public List<Object> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Nullable
    public Object get(int index) {
        return elements.get(index);
    }

    @Nonnull
    @Override
    public Iterator<Object> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TaggedSequence that = (TaggedSequence)o;
        return family.equals(that.family) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, elements);
    }

    @Override
    public String toString() {
        return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", family + "(", ")"));
    }
}
