/*
 * VariableUniquenessChecker.java
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

package com.apple.foundationdb.match.matching;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.RepeatedVariableException;
import com.apple.foundationdb.match.Variable;
import com.apple.foundationdb.match.pattern.Pattern;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies that no {@link Variable} occurs more than once in a pattern tree. The traversal descends into the
 * sub-patterns of variables and into the elements and entries of container patterns. The check only looks at the
 * pattern, never at a subject.
 */
@API(API.Status.INTERNAL)
public final class VariableUniquenessChecker {
    private VariableUniquenessChecker() {
        // prevent instantiation
    }

    /**
     * Check a pattern.
     * @param pattern the pattern to check
     * @throws RepeatedVariableException for the first variable found to occur more than once
     */
    public static void check(@Nonnull Pattern pattern) {
        collect(pattern, new HashMap<>(), null);
    }

    /**
     * Collect the variables of a pattern in depth-first, pre-order.
     * @param pattern the pattern
     * @return the variables of {@code pattern}
     * @throws RepeatedVariableException if a variable occurs more than once
     */
    @Nonnull
    public static List<Variable> variablesOf(@Nonnull Pattern pattern) {
        final ImmutableList.Builder<Variable> variables = ImmutableList.builder();
        collect(pattern, new HashMap<>(), variables);
        return variables.build();
    }

    // occurrences counts by variable id
    private static void collect(@Nonnull Pattern pattern,
                                @Nonnull Map<Long, Integer> occurrences,
                                @Nullable ImmutableList.Builder<Variable> variables) {
        if (pattern instanceof Variable) {
            final Variable variable = (Variable)pattern;
            final int count = occurrences.merge(variable.getId(), 1, Integer::sum);
            if (count > 1) {
                throw new RepeatedVariableException(variable, count);
            }
            if (variables != null) {
                variables.add(variable);
            }
        }
        for (Pattern child : pattern.getChildren()) {
            collect(child, occurrences, variables);
        }
    }
}
