/*
 * VariableUniquenessCheckerTest.java
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

import com.apple.foundationdb.match.RepeatedVariableException;
import com.apple.foundationdb.match.Variable;
import com.apple.foundationdb.match.pattern.Pattern;
import com.apple.foundationdb.match.pattern.Patterns;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link VariableUniquenessChecker}.
 */
public class VariableUniquenessCheckerTest {
    private static final Variable V = new Variable();
    private static final Variable W = new Variable();

    static Stream<Arguments> repeated() {
        return Stream.of(
                Arguments.of("sequence", Patterns.list(V, V)),
                Arguments.of("nested sequence", Patterns.list(1, Patterns.list(V), Patterns.tuple(2, V))),
                Arguments.of("set", Patterns.set(V, Patterns.set(V))),
                Arguments.of("map key and value", Patterns.map(V, V)),
                Arguments.of("map keys", Patterns.map(V, 1, Patterns.list(V), 2)),
                Arguments.of("sub-pattern", Patterns.list(new Variable().where(Patterns.list(V)), V)),
                Arguments.of("map value and sub-pattern", Patterns.map("a", new Variable().where(Patterns.set(V)), "b", V))
        );
    }

    @ParameterizedTest(name = "repeated[{0}]")
    @MethodSource
    void repeated(String description, Pattern pattern) {
        final RepeatedVariableException e = assertThrows(RepeatedVariableException.class,
                () -> VariableUniquenessChecker.check(pattern));
        assertSame(V, e.getVariable());
        assertEquals(2, e.getLogInfo().get("occurrences"));
        assertEquals(V.getId(), e.getLogInfo().get("var_id"));
    }

    static Stream<Arguments> unique() {
        return Stream.of(
                Arguments.of("literal", Patterns.of(1)),
                Arguments.of("two variables", Patterns.list(V, W)),
                Arguments.of("equal sub-patterns", Patterns.list(new Variable().where(Integer.class), new Variable().where(Integer.class))),
                Arguments.of("nested", Patterns.map(V, Patterns.set(W.where(String.class))))
        );
    }

    @ParameterizedTest(name = "unique[{0}]")
    @MethodSource
    void unique(String description, Pattern pattern) {
        assertDoesNotThrow(() -> VariableUniquenessChecker.check(pattern));
    }

    @Test
    void variablesInPreOrder() {
        final Variable a = new Variable();
        final Variable b = new Variable();
        final Variable c = new Variable();
        final Variable d = new Variable();
        final List<Variable> variables = VariableUniquenessChecker.variablesOf(
                Patterns.list(a.where(Patterns.list(b)), Patterns.map(c, d)));
        assertThat(variables, contains(a, b, c, d));
        assertThat(VariableUniquenessChecker.variablesOf(Patterns.list(1, 2)), empty());
    }
}
