/*
 * Matcher.java
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
import com.apple.foundationdb.match.logging.KeyValueLogMessage;
import com.apple.foundationdb.match.logging.LogMessageKeys;
import com.apple.foundationdb.match.matching.Bindings;
import com.apple.foundationdb.match.matching.StructuralMatcher;
import com.apple.foundationdb.match.matching.VariableUniquenessChecker;
import com.apple.foundationdb.match.pattern.Pattern;
import com.apple.foundationdb.match.pattern.Patterns;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Matches patterns against subjects and keeps the values captured by the last match.
 *
 * <p>
 * A matcher owns a fixed number of {@link Variable}s, created with it. These are used to build patterns; after a
 * successful {@link #match(Object, Object)} each variable that occurs in the pattern holds the part of the subject
 * it captured:
 * </p>
 * <pre>
 * {@code
 * Matcher matcher = new Matcher(1);
 * Variable v = matcher.getVariable(0);
 * if (matcher.match(List.of(1, v, 3), List.of(1, 2, 3))) {
 *     v.getValue(); // 2
 * }
 * }
 * </pre>
 *
 * <p>
 * A match attempt is all-or-nothing. Every attempt first resets the owned variables to {@link Symbol#UNMATCHED},
 * and values are only written to variables if the whole pattern matches, so after a failed attempt all owned
 * variables are unbound.
 * </p>
 *
 * <p>
 * A matcher and its variables are mutable state. Callers must not use a matcher, or a pattern mentioning one of
 * its variables, from more than one thread at a time.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class Matcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(Matcher.class);

    @Nonnull
    private final List<Variable> variables;
    @Nonnull
    private final StructuralMatcher structuralMatcher;
    private boolean matched;

    public Matcher(int arity) {
        this(arity, MatchProperties.DEFAULT);
    }

    public Matcher(int arity, @Nonnull MatchProperties properties) {
        Preconditions.checkArgument(arity >= 0, "arity must not be negative");
        final ImmutableList.Builder<Variable> builder = ImmutableList.builderWithExpectedSize(arity);
        for (int i = 0; i < arity; i++) {
            builder.add(new Variable());
        }
        this.variables = builder.build();
        this.structuralMatcher = new StructuralMatcher(properties);
        this.matched = false;
    }

    /**
     * Match a pattern against a subject. The pattern is converted with {@link Patterns#of(Object)} first, so plain
     * Java values such as lists, sets, maps and classes can be used as patterns.
     *
     * @param pattern the pattern
     * @param subject the subject
     * @return whether {@code pattern} matches {@code subject}
     * @throws RepeatedVariableException if a variable occurs more than once in {@code pattern}; no matching is
     *         attempted in that case
     * @throws AssignmentSearchLimitException if matching a set or map exceeds the configured step limit
     */
    public boolean match(@Nullable Object pattern, @Nullable Object subject) {
        matched = false;
        variables.forEach(Variable::reset);

        final Pattern converted = Patterns.of(pattern);
        VariableUniquenessChecker.check(converted);

        final Bindings bindings = structuralMatcher.match(converted, subject).orElse(null);
        matched = bindings != null;
        if (matched) {
            bindings.forEach(Variable::bind);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("structural match attempted",
                    LogMessageKeys.ARITY, variables.size(),
                    LogMessageKeys.PATTERN_KIND, converted.getKind(),
                    LogMessageKeys.SUBJECT_TYPE, subject == null ? null : subject.getClass().getName(),
                    LogMessageKeys.MATCHED, matched,
                    LogMessageKeys.BINDING_COUNT, matched ? bindings.size() : 0));
        }
        return matched;
    }

    /**
     * Whether the last call to {@link #match(Object, Object)} succeeded. {@code false} before the first call.
     * @return the result of the last match
     */
    public boolean isMatched() {
        return matched;
    }

    public int getArity() {
        return variables.size();
    }

    /**
     * The variables owned by this matcher, in creation order.
     * @return an unmodifiable list of the variables
     */
    @Nonnull
    public List<Variable> getVariables() {
        return variables;
    }

    @Nonnull
    public Variable getVariable(int index) {
        Preconditions.checkElementIndex(index, variables.size());
        return variables.get(index);
    }

    @Nullable
    public Object getValue(int index) {
        return getVariable(index).getValue();
    }

    /**
     * The current values of the owned variables, in creation order. The view is lazy: it reflects the state of the
     * variables at the time it is iterated.
     * @return the values of the variables, {@link Symbol#UNMATCHED} for unbound ones
     */
    @Nonnull
    public Iterable<Object> values() {
        return Iterables.transform(variables, Variable::getValue);
    }

    /**
     * Hand this matcher and its variables to a function, typically one that builds a pattern from the variables,
     * matches and reads the results:
     * <pre>
     * {@code
     * Object first = new Matcher(2).destructure((m, vars) ->
     *         m.match(List.of(vars.get(0), vars.get(1)), List.of("a", "b")) ? vars.get(0).getValue() : null);
     * }
     * </pre>
     *
     * @param function the function to apply
     * @param <T> the result type
     * @return the result of {@code function}
     */
    public <T> T destructure(@Nonnull BiFunction<? super Matcher, ? super List<Variable>, ? extends T> function) {
        return function.apply(this, variables);
    }

    @Override
    public String toString() {
        return "Matcher{variables=" + variables + ", matched=" + matched + "}";
    }
}
