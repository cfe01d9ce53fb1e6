/*
 * Variable.java
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

package com.apple.foundationdb.match;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.pattern.Pattern;
import com.apple.foundationdb.match.pattern.Patterns;
import com.apple.foundationdb.match.pattern.WildcardPattern;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A capture site in a pattern. A variable matches whatever its sub-pattern (by default the wildcard) matches, and
 * when the whole pattern matches it is bound to the subject value it matched.
 *
 * <p>
 * Every variable has an id that is unique within the process. Variables are compared by that id only: two
 * variables are never interchangeable, even if they have the same sub-pattern and value. A variable may occur at
 * most once in any pattern it is used in.
 * </p>
 *
 * <p>
 * Variables are mutable and not thread-safe. See {@link Matcher}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class Variable implements Pattern {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    @Nonnull
    private Pattern pattern;
    @Nullable
    private Object value;

    public Variable() {
        this.id = NEXT_ID.getAndIncrement();
        this.pattern = WildcardPattern.instance();
        this.value = Symbol.UNMATCHED;
    }

    public long getId() {
        return id;
    }

    /**
     * Constrain what this variable may bind to. The argument is converted with {@link Patterns#of(Object)}. This
     * replaces any earlier constraint and is meant to be used while building a pattern:
     * <pre>
     * {@code
     * Patterns.list(1, x.where(Integer.class), 3)
     * }
     * </pre>
     *
     * @param subPattern the pattern a subject must match to be bound to this variable
     * @return this variable
     * @throws RepeatedVariableException if {@code subPattern} contains this variable
     */
    @Nonnull
    public Variable where(@Nullable Object subPattern) {
        final Pattern converted = Patterns.of(subPattern);
        if (Patterns.references(converted, this)) {
            throw new RepeatedVariableException(this, 2);
        }
        this.pattern = converted;
        return this;
    }

    @Nonnull
    public Pattern getPattern() {
        return pattern;
    }

    /**
     * The value of the variable after the last successful match, or {@link Symbol#UNMATCHED}.
     * @return the bound value
     */
    @Nullable
    public Object getValue() {
        return value;
    }

    public boolean isBound() {
        return value != Symbol.UNMATCHED;
    }

    /**
     * Forget the bound value. The sub-pattern is kept.
     */
    public void reset() {
        this.value = Symbol.UNMATCHED;
    }

    void bind(@Nullable Object newValue) {
        this.value = newValue;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
    }

    @Nonnull
    @Override
    public Iterable<? extends Pattern> getChildren() {
        return ImmutableList.of(pattern);
    }

    @Override
    public String toString() {
        return "$" + id;
    }
}
