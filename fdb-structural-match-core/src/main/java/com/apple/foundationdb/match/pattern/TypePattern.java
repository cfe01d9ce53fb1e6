/*
 * TypePattern.java
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
import com.google.common.primitives.Primitives;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A pattern matching every subject that is an instance of a given class. A type pattern binds nothing.
 *
 * <p>
 * Subjects are always objects, so a primitive class is replaced by its wrapper: {@code int.class} matches
 * {@link Integer}s.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class TypePattern implements Pattern {
    @Nonnull
    private final Class<?> type;

    public TypePattern(@Nonnull Class<?> type) {
        this.type = Primitives.wrap(type);
    }

    @Nonnull
    public Class<?> getType() {
        return type;
    }

    public boolean matches(@Nullable Object subject) {
        return type.isInstance(subject);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.TYPE;
    }

    @Nonnull
    @Override
    public Iterable<? extends Pattern> getChildren() {
        return ImmutableList.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return type.equals(((TypePattern)o).type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.getSimpleName();
    }
}
