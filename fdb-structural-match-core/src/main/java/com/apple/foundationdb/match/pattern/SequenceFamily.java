/*
 * SequenceFamily.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;

/**
 * The tag of an ordered container. A {@link SequencePattern} only matches subjects of its own family, so a pattern
 * built as a list does not match an array or a tuple with the same elements. Two families are the same iff their
 * names are equal.
 *
 * @see com.apple.foundationdb.match.subject.Subjects#familyOf(Object)
 */
@API(API.Status.EXPERIMENTAL)
public final class SequenceFamily {
    /**
     * Any {@link java.util.List}.
     */
    public static final SequenceFamily LIST = new SequenceFamily("list");
    /**
     * Java arrays, object or primitive.
     */
    public static final SequenceFamily ARRAY = new SequenceFamily("array");
    /**
     * Fixed-length records of positional values, built with
     * {@link com.apple.foundationdb.match.subject.TaggedSequence#tuple(Object...)}.
     */
    public static final SequenceFamily TUPLE = new SequenceFamily("tuple");

    @Nonnull
    private final String name;

    private SequenceFamily(@Nonnull String name) {
        this.name = name;
    }

    /**
     * Get the family with the given name.
     * @param name the name of the family
     * @return a family equal to every other family of that name
     */
    @Nonnull
    public static SequenceFamily named(@Nonnull String name) {
        Preconditions.checkArgument(!name.isEmpty(), "family name must not be empty");
        return new SequenceFamily(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((SequenceFamily)o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
