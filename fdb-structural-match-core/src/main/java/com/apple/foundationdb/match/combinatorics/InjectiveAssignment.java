/*
 * InjectiveAssignment.java
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

package com.apple.foundationdb.match.combinatorics;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.AssignmentSearchLimitException;
import com.apple.foundationdb.match.MatchProperties;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Search for an injective assignment of the rows of a {@link CompatibilityTable} to its columns such that every
 * row is assigned a column it is compatible with and no column is assigned twice.
 *
 * <p>
 * This is a satisfiability question over a bipartite graph, not a maximum matching: the search stops at the first
 * complete assignment it finds and fails if there is none. Rows are tried most-constrained-first, that is, in
 * ascending order of the number of columns they are compatible with (ties keep the original row order), and
 * columns in ascending order. The result therefore only depends on the table.
 * </p>
 *
 * <p>
 * The worst case is exponential in the number of rows.
 * </p>
 */
@API(API.Status.INTERNAL)
@SuppressWarnings("java:S3776")
public final class InjectiveAssignment {

    private InjectiveAssignment() {
        // prevent instantiation
    }

    /**
     * Find an assignment using the most-constrained-first row order and no step limit.
     * @param table the compatibility table
     * @return an array {@code a} of length {@code table.getRowCount()} where {@code a[row]} is the column assigned to
     *         {@code row}, or empty if no complete assignment exists
     */
    @Nonnull
    public static Optional<int[]> find(@Nonnull CompatibilityTable<?> table) {
        return find(table, MatchProperties.DEFAULT);
    }

    /**
     * Find an assignment.
     * @param table the compatibility table
     * @param properties decides the row order and the step limit
     * @return an array {@code a} of length {@code table.getRowCount()} where {@code a[row]} is the column assigned to
     *         {@code row}, or empty if no complete assignment exists
     * @throws AssignmentSearchLimitException if the search takes more steps than allowed by {@code properties}
     */
    @Nonnull
    public static Optional<int[]> find(@Nonnull CompatibilityTable<?> table, @Nonnull MatchProperties properties) {
        final int rowCount = table.getRowCount();
        final int columnCount = table.getColumnCount();
        if (rowCount > columnCount) {
            return Optional.empty();
        }

        final int[] order = properties.shouldUseConstrainedFirstOrdering()
                            ? constrainedFirstOrder(table)
                            : IntStream.range(0, rowCount).toArray();

        //
        // The search state: level is the position in order that is to be bound next. cursors[level] is the column
        // that is tried next on that level. All levels below level have their cursor on the column they claimed,
        // and claimed holds exactly those columns.
        //
        final int[] cursors = new int[rowCount];
        final BitSet claimed = new BitSet(columnCount);
        int level = 0;
        int steps = 0;

        while (true) {
            if (properties.isAssignmentSearchLimited() && ++steps > properties.getMaxAssignmentSteps()) {
                throw new AssignmentSearchLimitException(properties.getMaxAssignmentSteps(), rowCount, columnCount);
            }

            if (level == rowCount) {
                // every row is bound
                final int[] assignment = new int[rowCount];
                for (int i = 0; i < rowCount; i++) {
                    assignment[order[i]] = cursors[i];
                }
                return Optional.of(assignment);
            }

            if (cursors[level] == columnCount) {
                // this level is exhausted, back tracking
                if (level == 0) {
                    return Optional.empty();
                }
                cursors[level] = 0;
                level--;
                claimed.clear(cursors[level]);
                cursors[level]++;
                continue;
            }

            final int column = cursors[level];
            if (claimed.get(column) || !table.isCompatible(order[level], column)) {
                cursors[level]++;
                continue;
            }

            // bind and go down
            claimed.set(column);
            level++;
        }
    }

    /**
     * Order the rows of a table by ascending number of compatible columns. The sort is stable.
     * @param table the compatibility table
     * @return the row indexes in the order in which they should be bound
     */
    @Nonnull
    public static int[] constrainedFirstOrder(@Nonnull CompatibilityTable<?> table) {
        final Integer[] rows = new Integer[table.getRowCount()];
        Arrays.setAll(rows, i -> i);
        Arrays.sort(rows, Comparator.comparingInt(table::getCompatibleCount));
        return Arrays.stream(rows).mapToInt(Integer::intValue).toArray();
    }
}
