/*
 * Patterns.java
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
import com.apple.foundationdb.match.Symbol;
import com.apple.foundationdb.match.Variable;
import com.apple.foundationdb.match.subject.Subjects;
import com.apple.foundationdb.match.subject.TaggedSequence;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory methods for {@link Pattern}s.
 *
 * <p>
 * Most patterns are easiest to write as plain Java values that are then converted with {@link #of(Object)}:
 * </p>
 * <pre>
 * {@code
 * Patterns.of(List.of(1, x, Symbol.ANY))      // list(1, x, <any>)
 * Patterns.of(Set.of(String.class, y))        // {String, y}
 * Patterns.map("id", x.where(Long.class))     // {"id": x}
 * }
 * </pre>
 */
@API(API.Status.EXPERIMENTAL)
public final class Patterns {
    private Patterns() {
        // prevent instantiation
    }

    /**
     * Convert a Java value to a pattern. Patterns are returned as they are, {@link Symbol#ANY} becomes the
     * wildcard, a {@link Class} a type check, lists, arrays and {@link TaggedSequence}s become sequence patterns
     * of their family, sets become set patterns and maps become map patterns, each with their elements converted
     * recursively. Everything else, including {@code null}, becomes a literal.
     *
     * @param value the value to convert
     * @return a pattern for {@code value}
     */
    @Nonnull
    public static Pattern of(@Nullable Object value) {
        if (value instanceof Pattern) {
            return (Pattern)value;
        }
        if (value == Symbol.ANY) {
            return any();
        }
        if (value instanceof Class<?>) {
            return type((Class<?>)value);
        }
        if (value instanceof Set<?>) {
            return set((Set<?>)value);
        }
        if (value instanceof Map<?, ?>) {
            return map((Map<?, ?>)value);
        }
        if (value instanceof TaggedSequence) {
            final TaggedSequence sequence = (TaggedSequence)value;
            return sequence(sequence.getFamily(), sequence.getElements());
        }
        if (value instanceof List<?>) {
            return sequence(SequenceFamily.LIST, (List<?>)value);
        }
        if (value != null && value.getClass().isArray()) {
            return sequence(SequenceFamily.ARRAY, Subjects.elementsOf(value));
        }
        return literal(value);
    }

    @Nonnull
    public static WildcardPattern any() {
        return WildcardPattern.instance();
    }

    /**
     * A literal pattern for the value as it is, without the conversions of {@link #of(Object)}. Use this to
     * compare a subject to a list or a class by equality.
     * @param value the value to compare subjects to
     * @return a literal pattern
     */
    @Nonnull
    public static LiteralPattern literal(@Nullable Object value) {
        return new LiteralPattern(value);
    }

    @Nonnull
    public static TypePattern type(@Nonnull Class<?> type) {
        return new TypePattern(type);
    }

    @Nonnull
    public static SequencePattern list(@Nonnull Object... elements) {
        return sequence(SequenceFamily.LIST, Arrays.asList(elements));
    }

    @Nonnull
    public static SequencePattern array(@Nonnull Object... elements) {
        return sequence(SequenceFamily.ARRAY, Arrays.asList(elements));
    }

    @Nonnull
    public static SequencePattern tuple(@Nonnull Object... elements) {
        return sequence(SequenceFamily.TUPLE, Arrays.asList(elements));
    }

    @Nonnull
    public static SequencePattern sequence(@Nonnull SequenceFamily family, @Nonnull List<?> elements) {
        final ImmutableList.Builder<Pattern> patterns = ImmutableList.builderWithExpectedSize(elements.size());
        for (Object element : elements) {
            patterns.add(of(element));
        }
        return new SequencePattern(family, patterns.build());
    }

    @Nonnull
    public static SetPattern set(@Nonnull Object... elements) {
        return set(Arrays.asList(elements));
    }

    @Nonnull
    public static SetPattern set(@Nonnull Collection<?> elements) {
        final ImmutableList.Builder<Pattern> patterns = ImmutableList.builderWithExpectedSize(elements.size());
        for (Object element : elements) {
            patterns.add(of(element));
        }
        return new SetPattern(patterns.build());
    }

    /**
     * A map pattern from alternating keys and values, each converted with {@link #of(Object)}.
     * @param keysAndValues alternating keys and values
     * @return a map pattern
     * @throws IllegalArgumentException if there is an odd number of arguments or two keys convert to equal patterns
     * @throws RepeatedVariableException if two equal keys contain a variable
     */
    @Nonnull
    public static MapPattern map(@Nonnull Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keys and values don't match");
        }
        final Map<Pattern, Pattern> entries = Maps.newLinkedHashMapWithExpectedSize(keysAndValues.length / 2);
        for (int i = 0; i < keysAndValues.length; i += 2) {
            putEntry(entries, of(keysAndValues[i]), of(keysAndValues[i + 1]));
        }
        return new MapPattern(entries);
    }

    @Nonnull
    public static MapPattern map(@Nonnull Map<?, ?> map) {
        final Map<Pattern, Pattern> entries = new LinkedHashMap<>();
        map.forEach((key, value) -> putEntry(entries, of(key), of(value)));
        return new MapPattern(entries);
    }

    private static void putEntry(@Nonnull Map<Pattern, Pattern> entries, @Nonnull Pattern key, @Nonnull Pattern value) {
        if (entries.containsKey(key)) {
            final Variable variable = findVariable(key);
            if (variable != null) {
                throw new RepeatedVariableException(variable, 2);
            }
            throw new IllegalArgumentException("duplicate key pattern " + key);
        }
        entries.put(key, value);
    }

    /**
     * Check whether a variable occurs anywhere within a pattern, including within the sub-patterns of other
     * variables.
     * @param pattern the pattern to search
     * @param variable the variable to look for
     * @return {@code true} if {@code variable} is part of {@code pattern}
     */
    public static boolean references(@Nonnull Pattern pattern, @Nonnull Variable variable) {
        final Deque<Pattern> pending = new ArrayDeque<>();
        pending.push(pattern);
        while (!pending.isEmpty()) {
            final Pattern current = pending.pop();
            if (current == variable) {
                return true;
            }
            current.getChildren().forEach(pending::push);
        }
        return false;
    }

    // the first variable in pre-order, or null
    @Nullable
    static Variable findVariable(@Nonnull Pattern pattern) {
        final Deque<Pattern> pending = new ArrayDeque<>();
        pending.push(pattern);
        while (!pending.isEmpty()) {
            final Pattern current = pending.pop();
            if (current instanceof Variable) {
                return (Variable)current;
            }
            final List<Pattern> children = ImmutableList.copyOf(current.getChildren());
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return null;
    }
}
