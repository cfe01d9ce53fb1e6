/*
 * Subjects.java
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

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.pattern.SequenceFamily;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classification of arbitrary Java values into the {@link SubjectShape}s the matcher understands.
 */
@API(API.Status.EXPERIMENTAL)
public final class Subjects {
    private Subjects() {
        // prevent instantiation
    }

    @Nonnull
    public static SubjectShape classify(@Nullable Object subject) {
        if (subject instanceof Set<?>) {
            return SubjectShape.SET;
        }
        if (subject instanceof Map<?, ?>) {
            return SubjectShape.MAPPING;
        }
        if (familyOf(subject).isPresent()) {
            return SubjectShape.SEQUENCE;
        }
        return SubjectShape.SCALAR;
    }

    /**
     * Get the sequence family of a subject.
     * @param subject the subject
     * @return the family if {@code subject} is a {@link TaggedSequence}, a {@link List} or an array, and empty
     *         otherwise
     */
    @Nonnull
    public static Optional<SequenceFamily> familyOf(@Nullable Object subject) {
        if (subject instanceof TaggedSequence) {
            return Optional.of(((TaggedSequence)subject).getFamily());
        }
        if (subject instanceof List<?>) {
            return Optional.of(SequenceFamily.LIST);
        }
        if (subject != null && subject.getClass().isArray()) {
            return Optional.of(SequenceFamily.ARRAY);
        }
        return Optional.empty();
    }

    /**
     * Get the elements of a sequence subject in order. Elements of primitive arrays are boxed.
     * @param subject a subject of shape {@link SubjectShape#SEQUENCE}
     * @return the elements of {@code subject}
     * @throws IllegalArgumentException if {@code subject} is not a sequence
     */
    @Nonnull
    public static List<Object> elementsOf(@Nonnull Object subject) {
        if (subject instanceof TaggedSequence) {
            return ((TaggedSequence)subject).getElements();
        }
        if (subject instanceof List<?>) {
            return Collections.unmodifiableList((List<?>)subject);
        }
        Preconditions.checkArgument(subject.getClass().isArray(), "subject is not a sequence");
        final int length = Array.getLength(subject);
        final List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(subject, i));
        }
        return elements;
    }

    /**
     * Get the members of a set subject in the set's iteration order.
     * @param subject a set
     * @return a list of its members
     */
    @Nonnull
    public static List<Object> membersOf(@Nonnull Set<?> subject) {
        return new ArrayList<>(subject);
    }

    /**
     * Get the entries of a map subject in the map's iteration order.
     * @param subject a map
     * @return a list of its entries
     */
    @Nonnull
    public static List<Map.Entry<?, ?>> entriesOf(@Nonnull Map<?, ?> subject) {
        return new ArrayList<>(subject.entrySet());
    }
}
