/*
 * BindingsTest.java
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

import com.apple.foundationdb.match.Variable;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Bindings}.
 */
public class BindingsTest {
    @Test
    void mergeKeepsOrder() {
        final Variable a = new Variable();
        final Variable b = new Variable();
        final Variable c = new Variable();
        final Bindings merged = Bindings.of(b, 2).merge(Bindings.of(a, 1)).merge(Bindings.of(c, null));
        assertEquals(3, merged.size());
        assertThat(merged.getVariables(), contains(b, a, c));

        final Map<Variable, Object> seen = new HashMap<>();
        merged.forEach(seen::put);
        assertEquals(1, seen.get(a));
        assertEquals(2, seen.get(b));
        assertTrue(seen.containsKey(c));
        assertNull(seen.get(c));
    }

    @Test
    void mergeWithEmpty() {
        final Bindings bindings = Bindings.of(new Variable(), "x");
        assertSame(bindings, bindings.merge(Bindings.empty()));
        assertSame(bindings, Bindings.empty().merge(bindings));
        assertTrue(Bindings.mergeAll(ImmutableList.of(Bindings.empty(), Bindings.empty())).isEmpty());
    }

    @Test
    void sameVariableTwice() {
        final Variable v = new Variable();
        assertThrows(VerifyException.class, () -> Bindings.of(v, 1).merge(Bindings.of(v, 2)));
    }

    @Test
    void keyedByVariable() {
        final Variable v = new Variable();
        final Variable w = new Variable();
        final Bindings bindings = Bindings.of(v, "value");
        assertTrue(bindings.containsVariable(v));
        assertFalse(bindings.containsVariable(w));
        assertEquals("value", bindings.getBinding(v).orElseThrow().getValue());
        assertFalse(bindings.getBinding(w).isPresent());

        assertEquals(Bindings.of(v, "value"), bindings);
        assertNotEquals(Bindings.of(w, "value"), bindings);
        assertNotEquals(Bindings.of(v, "other"), bindings);
    }
}
