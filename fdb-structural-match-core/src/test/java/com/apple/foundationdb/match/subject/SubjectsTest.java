/*
 * SubjectsTest.java
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

package com.apple.foundationdb.match.subject;

import com.apple.foundationdb.match.pattern.SequenceFamily;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Subjects} and {@link TaggedSequence}.
 */
public class SubjectsTest {
    @Test
    void classify() {
        assertEquals(SubjectShape.SET, Subjects.classify(ImmutableSet.of(1)));
        assertEquals(SubjectShape.MAPPING, Subjects.classify(ImmutableMap.of()));
        assertEquals(SubjectShape.SEQUENCE, Subjects.classify(ImmutableList.of()));
        assertEquals(SubjectShape.SEQUENCE, Subjects.classify(new long[0]));
        assertEquals(SubjectShape.SEQUENCE, Subjects.classify(TaggedSequence.tuple()));
        assertEquals(SubjectShape.SCALAR, Subjects.classify("abc"));
        assertEquals(SubjectShape.SCALAR, Subjects.classify(null));
    }

    @Test
    void familyOf() {
        assertEquals(Optional.of(SequenceFamily.LIST), Subjects.familyOf(Arrays.asList(1, 2)));
        assertEquals(Optional.of(SequenceFamily.ARRAY), Subjects.familyOf(new String[] {"a"}));
        assertEquals(Optional.of(SequenceFamily.TUPLE), Subjects.familyOf(TaggedSequence.tuple(1)));
        assertEquals(Optional.of(SequenceFamily.named("pair")),
                Subjects.familyOf(TaggedSequence.of(SequenceFamily.named("pair"), 1, 2)));
        assertEquals(Optional.empty(), Subjects.familyOf(ImmutableSet.of(1)));
        assertEquals(Optional.empty(), Subjects.familyOf(null));
    }

    @Test
    void elementsOf() {
        assertThat(Subjects.elementsOf(new int[] {3, 1, 2}), Matchers.<Object>contains(3, 1, 2));
        assertThat(Subjects.elementsOf(ImmutableList.of("a", "b")), Matchers.<Object>contains("a", "b"));
        assertThat(Subjects.elementsOf(TaggedSequence.tuple("x", 7)), Matchers.<Object>contains("x", 7));
        assertThrows(IllegalArgumentException.class, () -> Subjects.elementsOf("abc"));
    }

    @Test
    void taggedSequence() {
        final TaggedSequence sequence = TaggedSequence.tuple(1, null, "c");
        assertEquals(3, sequence.size());
        assertNull(sequence.get(1));
        assertEquals(TaggedSequence.of(SequenceFamily.TUPLE, Arrays.asList(1, null, "c")), sequence);
        assertNotEquals(TaggedSequence.of(SequenceFamily.named("other"), 1, null, "c"), sequence);
        assertThrows(UnsupportedOperationException.class, () -> sequence.getElements().add(4));
    }
}
