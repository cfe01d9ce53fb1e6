/*
 * UnorderedMatcher.java
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
import com.apple.foundationdb.match.AssignmentSearchLimitException;
import com.apple.foundationdb.match.MatchProperties;
import com.apple.foundationdb.match.combinatorics.CompatibilityTable;
import com.apple.foundationdb.match.combinatorics.InjectiveAssignment;
import com.apple.foundationdb.match.logging.KeyValueLogMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Matches an unordered collection of patterns against an unordered collection of subjects. Every pattern element
 * must be assigned its own subject element that it matches; subject elements left over are ignored.
 *
 * <p>
 * All pairs are matched up front into a {@link CompatibilityTable}, then {@link InjectiveAssignment} searches for a
 * complete assignment. The bindings of the chosen pairs are combined. Sets are matched over their members and maps
 * over their entries.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class UnorderedMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(UnorderedMatcher.class);

    private UnorderedMatcher() {
        // prevent instantiation
    }

    /**
     * Match unordered.
     * @param patterns the pattern elements, in a stable order
     * @param subjects the subject elements, in a stable order
     * @param pairMatcher matches one pattern element against one subject element
     * @param properties the row ordering and step limit of the search
     * @param <P> the type of pattern elements
     * @param <S> the type of subject elements
     * @return the combined bindings of the first assignment found, or empty if there is none
     * @throws AssignmentSearchLimitException if the search exceeds the step limit of {@code properties}
     */
    @Nonnull
    public static <P, S> Optional<Bindings> match(@Nonnull List<? extends P> patterns,
                                                  @Nonnull List<? extends S> subjects,
                                                  @Nonnull BiFunction<? super P, ? super S, Optional<Bindings>> pairMatcher,
                                                  @Nonnull MatchProperties properties) {
        if (patterns.size() > subjects.size()) {
            return Optional.empty();
        }

        final CompatibilityTable<Bindings> table = CompatibilityTable.compute(patterns, subjects, pairMatcher);
        final Optional<int[]> assignment;
        try {
            assignment = InjectiveAssignment.find(table, properties);
        } catch (AssignmentSearchLimitException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("abandoned unordered match", e.exportLogInfo()));
            }
            throw e;
        }

        return assignment.map(columns -> {
            final Bindings.Builder bindings = Bindings.newBuilder();
            for (int row = 0; row < columns.length; row++) {
                bindings.addAll(table.get(row, columns[row]).orElseThrow());
            }
            return bindings.build();
        });
    }
}
