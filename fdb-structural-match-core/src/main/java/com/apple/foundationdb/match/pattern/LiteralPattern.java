/*
 * LiteralPattern.java
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
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A pattern matching subjects that are {@link Object#equals(Object) equal} to a given value. {@code null} is a
 * legal value and only matches a {@code null} subject. No conversion between types takes place, so the literal
 * {@code 1} (an {@link Integer}) does not match the subject {@code 1L}.
 */
@API(API.Status.EXPERIMENTAL)
public class LiteralPattern implements Pattern {
    @Nullable
    private final Object value;

    public LiteralPattern(@Nullable Object value) {
        this.value = value;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    public boolean matches(@Nullable Object subject) {
        return Objects.equals(value, subject);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.LITERAL;
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
        return Objects.equals(value, ((LiteralPattern)o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
