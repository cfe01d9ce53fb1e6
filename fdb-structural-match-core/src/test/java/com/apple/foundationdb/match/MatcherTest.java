/*
 * MatcherTest.java
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

import com.apple.foundationdb.match.pattern.Pattern;
import com.apple.foundationdb.match.pattern.Patterns;
import com.apple.foundationdb.match.subject.TaggedSequence;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.oneOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Matcher}.
 */
public class MatcherTest {
    @Test
    void sequenceCapture() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0);
        assertTrue(matcher.match(List.of(1, v, 3), List.of(1, 2, 3)));
        assertTrue(matcher.isMatched());
        assertEquals(2, v.getValue());
        assertEquals(2, matcher.getValue(0));
    }

    @Test
    void typeCheck() {
        final Matcher matcher = new Matcher(0);
        assertTrue(matcher.match(int.class, 5));
        assertTrue(matcher.match(Integer.class, 5));
        assertFalse(matcher.match(String.class, 5));
    }

    @Test
    void setCapture() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0);
        assertTrue(matcher.match(Patterns.set(1, v), Set.of(1, 2, 3)));
        assertThat((Integer)v.getValue(), is(oneOf(2, 3)));

        assertFalse(matcher.match(Patterns.set(1, v), Set.of(1)));
        assertEquals(Symbol.UNMATCHED, v.getValue());
    }

    @Test
    void plainSetAsPattern() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0);
        final Set<Object> pattern = new LinkedHashSet<>(Arrays.asList(1, v));
        assertTrue(matcher.match(pattern, new LinkedHashSet<>(Arrays.asList(3, 1))));
        assertEquals(3, v.getValue());
    }

    @Test
    void mappingCapture() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0);
        final Map<String, String> subject = new LinkedHashMap<>();
        subject.put("a", "x");
        subject.put("b", "y");
        assertTrue(matcher.match(Map.of(v, "x"), subject));
        assertEquals("a", v.getValue());
    }

    @Test
    void repeatedVariable() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0);
        assertTrue(matcher.match(List.of(v), List.of("bound")));

        final RepeatedVariableException e = assertThrows(RepeatedVariableException.class,
                () -> matcher.match(List.of(v, v), List.of(1, 1)));
        assertSame(v, e.getVariable());
        assertFalse(matcher.isMatched());
        assertEquals(Symbol.UNMATCHED, v.getValue());

        // regardless of the subject
        assertThrows(RepeatedVariableException.class, () -> matcher.match(Patterns.tuple(v, v), "not a tuple"));
    }

    @Test
    void repeatedVariableInUnorderedContainers() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0);

        assertThrows(RepeatedVariableException.class, () -> matcher.match(Patterns.set(v, v), ImmutableSet.of(7)));
        assertThrows(RepeatedVariableException.class,
                () -> matcher.match(Patterns.map(v, 1, v, 2), ImmutableMap.of("a", 1, "b", 2)));
        assertThrows(RepeatedVariableException.class,
                () -> matcher.match(Patterns.set(Patterns.list(v), Patterns.list(v)), ImmutableSet.of(List.of(7))));
        assertFalse(matcher.isMatched());
        assertEquals(Symbol.UNMATCHED, v.getValue());
    }

    @Test
    void familyMismatch() {
        final Matcher matcher = new Matcher(0);
        assertFalse(matcher.match(Patterns.list(1, 2), TaggedSequence.tuple(1, 2)));
        assertTrue(matcher.match(Patterns.tuple(1, 2), TaggedSequence.tuple(1, 2)));
        assertTrue(matcher.match(TaggedSequence.tuple(1, 2), TaggedSequence.tuple(1, 2)));
    }

    @Test
    void wildcard() {
        final Matcher matcher = new Matcher(2);
        for (Object subject : Arrays.asList(null, 1, "s", List.of(), Set.of(1), Map.of(), new int[0])) {
            assertTrue(matcher.match(Symbol.ANY, subject));
            assertThat(matcher.values(), everyItem(Matchers.<Object>is(Symbol.UNMATCHED)));
        }
    }

    @Test
    void unusedVariablesStayUnmatched() {
        final Matcher matcher = new Matcher(3);
        final Variable x = matcher.getVariable(0);
        final Variable z = matcher.getVariable(2);
        assertTrue(matcher.match(List.of(x, z), List.of("a", "c")));
        assertThat(matcher.values(), Matchers.<Object>contains("a", Symbol.UNMATCHED, "c"));
    }

    @Test
    void failedMatchResetsVariables() {
        final Matcher matcher = new Matcher(2);
        final Variable x = matcher.getVariable(0);
        final Variable y = matcher.getVariable(1);
        assertTrue(matcher.match(List.of(x, y), List.of(1, 2)));
        assertThat(matcher.values(), Matchers.<Object>contains(1, 2));

        // x would match before the mismatch is found
        assertFalse(matcher.match(List.of(x, y, 3), List.of(1, 2, 4)));
        assertFalse(matcher.isMatched());
        assertThat(matcher.values(), Matchers.<Object>contains(Symbol.UNMATCHED, Symbol.UNMATCHED));
    }

    @Test
    void repeatedMatchIsDeterministic() {
        final Matcher matcher = new Matcher(2);
        final Variable k = matcher.getVariable(0);
        final Variable s = matcher.getVariable(1);
        final Pattern pattern = Patterns.map(k, s.where(Patterns.set(1, 2)));
        final Map<String, Set<Integer>> subject = ImmutableMap.of(
                "one", ImmutableSet.of(1),
                "two", ImmutableSet.of(1, 2),
                "three", ImmutableSet.of(1, 2, 3));
        assertTrue(matcher.match(pattern, subject));
        final List<Object> first = ImmutableList.copyOf(matcher.values());
        assertEquals("two", first.get(0));
        for (int i = 0; i < 3; i++) {
            assertTrue(matcher.match(pattern, subject));
            assertEquals(first, ImmutableList.copyOf(matcher.values()));
        }
    }

    @Test
    void constraintSurvivesReset() {
        final Matcher matcher = new Matcher(1);
        final Variable v = matcher.getVariable(0).where(String.class);
        assertFalse(matcher.match(List.of(v), List.of(1)));
        assertTrue(matcher.match(List.of(v), List.of("1")));
        assertEquals("1", v.getValue());
    }

    @Test
    void valuesAreLazy() {
        final Matcher matcher = new Matcher(1);
        final Iterable<Object> values = matcher.values();
        assertThat(values, Matchers.<Object>contains(Symbol.UNMATCHED));
        assertTrue(matcher.match(matcher.getVariable(0), 42));
        assertThat(values, Matchers.<Object>contains(42));
    }

    @Test
    void destructure() {
        final Object captured = new Matcher(2).destructure((m, vars) ->
                m.match(List.of(vars.get(0), vars.get(1)), List.of("a", "b")) ? vars.get(1).getValue() : null);
        assertEquals("b", captured);
    }

    @Test
    void variablesFromElsewhereAreBound() {
        final Matcher matcher = new Matcher(1);
        final Variable own = matcher.getVariable(0);
        final Variable foreign = new Variable();
        assertTrue(matcher.match(List.of(own, foreign), List.of(1, 2)));
        assertEquals(1, own.getValue());
        assertEquals(2, foreign.getValue());
    }

    @Test
    void arity() {
        final Matcher matcher = new Matcher(3);
        assertEquals(3, matcher.getArity());
        assertEquals(3, ImmutableSet.copyOf(matcher.getVariables()).size());
        assertFalse(matcher.isMatched());
        assertThrows(UnsupportedOperationException.class, () -> matcher.getVariables().add(new Variable()));
        assertThrows(IndexOutOfBoundsException.class, () -> matcher.getVariable(3));
        assertThrows(IllegalArgumentException.class, () -> new Matcher(-1));
    }

    @Test
    void searchLimit() {
        final MatchProperties properties = MatchProperties.newBuilder().setMaxAssignmentSteps(5).build();
        final Matcher matcher = new Matcher(0, properties);
        final Set<Integer> subject = ImmutableSet.of(1, 2, 3, 4, 5, 6);
        assertTrue(matcher.match(Patterns.set(1), subject));
        // five element patterns that all want 1 exhaust the budget long before the search gives up
        final Pattern impossible = Patterns.set(
                new Variable().where(1), new Variable().where(1), new Variable().where(1),
                new Variable().where(1), new Variable().where(1));
        assertThrows(AssignmentSearchLimitException.class, () -> matcher.match(impossible, subject));
        assertFalse(matcher.isMatched());
        assertFalse(new Matcher(0).match(impossible, subject));
    }
}
