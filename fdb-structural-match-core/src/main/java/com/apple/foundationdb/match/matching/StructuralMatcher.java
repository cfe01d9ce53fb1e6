/*
 * StructuralMatcher.java
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
import com.apple.foundationdb.match.MatchProperties;
import com.apple.foundationdb.match.Variable;
import com.apple.foundationdb.match.pattern.LiteralPattern;
import com.apple.foundationdb.match.pattern.MapPattern;
import com.apple.foundationdb.match.pattern.Pattern;
import com.apple.foundationdb.match.pattern.SequencePattern;
import com.apple.foundationdb.match.pattern.SetPattern;
import com.apple.foundationdb.match.pattern.TypePattern;
import com.apple.foundationdb.match.subject.SubjectShape;
import com.apple.foundationdb.match.subject.Subjects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The recursive decision procedure that matches a pattern against a subject.
 *
 * <p>
 * Dispatch is on the kind of the pattern, in the order of {@link Pattern.Kind}:
 * </p>
 * <ol>
 *     <li>a {@link SetPattern} needs a {@link Set} subject with at least as many members and is matched by
 *     {@link UnorderedMatcher}</li>
 *     <li>a {@link MapPattern} needs a {@link Map} subject with at least as many entries and is matched by
 *     {@link UnorderedMatcher} over the entries, a pattern entry matching a subject entry if both key and value
 *     match</li>
 *     <li>a {@link SequencePattern} needs a subject of the same family and length and is matched by
 *     {@link OrderedMatcher}</li>
 *     <li>a {@link TypePattern} needs an instance of its type</li>
 *     <li>a {@link Variable} needs its sub-pattern to match, and then binds the subject</li>
 *     <li>the wildcard always matches</li>
 *     <li>a {@link LiteralPattern} needs an equal subject</li>
 * </ol>
 *
 * <p>
 * A subject of the wrong shape, size, family, type or value is simply not a match. The matcher never writes into
 * the variables it encounters; it only reports what they would be bound to.
 * </p>
 */
@API(API.Status.INTERNAL)
public class StructuralMatcher {
    @Nonnull
    private final MatchProperties properties;

    public StructuralMatcher(@Nonnull MatchProperties properties) {
        this.properties = properties;
    }

    /**
     * Match a pattern against a subject.
     * @param pattern the pattern
     * @param subject the subject
     * @return the bindings of the variables in {@code pattern} if it matches, empty otherwise
     */
    @Nonnull
    public Optional<Bindings> match(@Nonnull Pattern pattern, @Nullable Object subject) {
        switch (pattern.getKind()) {
            case SET:
                return matchSet((SetPattern)pattern, subject);
            case MAPPING:
                return matchMap((MapPattern)pattern, subject);
            case SEQUENCE:
                return matchSequence((SequencePattern)pattern, subject);
            case TYPE:
                return ((TypePattern)pattern).matches(subject) ? Optional.of(Bindings.empty()) : Optional.empty();
            case VARIABLE:
                return matchVariable((Variable)pattern, subject);
            case WILDCARD:
                return Optional.of(Bindings.empty());
            case LITERAL:
                return ((LiteralPattern)pattern).matches(subject) ? Optional.of(Bindings.empty()) : Optional.empty();
            default:
                throw new UnsupportedOperationException("unknown pattern kind " + pattern.getKind());
        }
    }

    @Nonnull
    private Optional<Bindings> matchSet(@Nonnull SetPattern pattern, @Nullable Object subject) {
        if (Subjects.classify(subject) != SubjectShape.SET) {
            return Optional.empty();
        }
        final Set<?> set = (Set<?>)subject;
        if (set.size() < pattern.size()) {
            return Optional.empty();
        }
        return UnorderedMatcher.match(ImmutableList.copyOf(pattern.getElements()), Subjects.membersOf(set),
                this::match, properties);
    }

    @Nonnull
    private Optional<Bindings> matchMap(@Nonnull MapPattern pattern, @Nullable Object subject) {
        if (Subjects.classify(subject) != SubjectShape.MAPPING) {
            return Optional.empty();
        }
        final Map<?, ?> map = (Map<?, ?>)subject;
        if (map.size() < pattern.size()) {
            return Optional.empty();
        }
        return UnorderedMatcher.match(pattern.getEntryList(), Subjects.entriesOf(map), this::matchEntry, properties);
    }

    @Nonnull
    private Optional<Bindings> matchEntry(@Nonnull Map.Entry<Pattern, Pattern> patternEntry,
                                          @Nonnull Map.Entry<?, ?> subjectEntry) {
        final Optional<Bindings> keyBindings = match(patternEntry.getKey(), subjectEntry.getKey());
        if (keyBindings.isEmpty()) {
            return Optional.empty();
        }
        return match(patternEntry.getValue(), subjectEntry.getValue()).map(keyBindings.get()::merge);
    }

    @Nonnull
    private Optional<Bindings> matchSequence(@Nonnull SequencePattern pattern, @Nullable Object subject) {
        if (Subjects.classify(subject) != SubjectShape.SEQUENCE
                || !pattern.getFamily().equals(Subjects.familyOf(subject).orElseThrow())) {
            return Optional.empty();
        }
        final List<Object> elements = Subjects.elementsOf(subject);
        if (elements.size() != pattern.size()) {
            return Optional.empty();
        }
        return OrderedMatcher.match(pattern.getElements(), elements, this::match);
    }

    @Nonnull
    private Optional<Bindings> matchVariable(@Nonnull Variable variable, @Nullable Object subject) {
        return match(variable.getPattern(), subject)
                .map(bindings -> bindings.merge(Bindings.of(variable, subject)));
    }
}
