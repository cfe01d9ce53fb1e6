/*
 * PatternMatchExceptionTest.java
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

import com.apple.foundationdb.match.logging.KeyValueLogMessage;
import com.apple.foundationdb.match.logging.LogMessageKeys;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PatternMatchException} and its subclasses.
 */
public class PatternMatchExceptionTest {
    @Test
    void logInfo() {
        final PatternMatchException e = new PatternMatchException("something failed", LogMessageKeys.ARITY, 2);
        e.addLogInfo(LogMessageKeys.MATCHED.toString(), false);
        assertEquals(2, e.getLogInfo().get("arity"));
        assertEquals(false, e.getLogInfo().get("matched"));
        assertArrayEquals(new Object[] {"arity", 2, "matched", false}, e.exportLogInfo());
        assertEquals("something failed arity=\"2\" matched=\"false\"",
                KeyValueLogMessage.of(e.getMessage(), e.exportLogInfo()));
    }

    @Test
    void noLogInfo() {
        final PatternMatchException e = new PatternMatchException("plain");
        assertTrue(e.getLogInfo().isEmpty());
        assertEquals(0, e.exportLogInfo().length);
    }

    @Test
    void cause() {
        final IllegalStateException cause = new IllegalStateException("inner");
        assertSame(cause, new PatternMatchException("outer", cause).getCause());
    }

    @Test
    void unbalanced() {
        assertThrows(IllegalArgumentException.class, () -> new PatternMatchException("odd", "key"));
    }

    @Test
    void repeatedVariable() {
        final Variable v = new Variable();
        final RepeatedVariableException e = new RepeatedVariableException(v, 3);
        assertEquals(v.getId(), e.getLogInfo().get(LogMessageKeys.VARIABLE_ID.toString()));
        assertEquals(3, e.getLogInfo().get(LogMessageKeys.OCCURRENCES.toString()));
    }
}
