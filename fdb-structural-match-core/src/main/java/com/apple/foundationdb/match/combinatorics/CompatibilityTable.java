/*
 * CompatibilityTable.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * An {@code m x n} table recording, for every pair of a row element (a pattern element) and a column element (a
 * subject element), whether the two are compatible and, if so, what their pairing produced. A cell is either empty
 * (incompatible) or holds a result.
 *
 * @param <R> the type of the results stored in compatible cells
 */
@API(API.Status.INTERNAL)
public final class CompatibilityTable<R> {
    private final int rowCount;
    private final int columnCount;
    @Nonnull
    private final Object[][] cells;
    @Nonnull
    private final int[] compatibleCounts;

    private CompatibilityTable(int rowCount, int columnCount, @Nonnull Object[][] cells) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.cells = cells;
        this.compatibleCounts = new int[rowCount];
        for (int row = 0; row < rowCount; row++) {
            int count = 0;
            for (int column = 0; column < columnCount; column++) {
                if (cells[row][column] != null) {
                    count++;
                }
            }
            compatibleCounts[row] = count;
        }
    }

    /**
     * Compute the table by pairing every row element with every column element.
     * @param rows the row elements
     * @param columns the column elements
     * @param pairing computes the result for a pair, or empty if the pair is incompatible
     * @param <P> the type of the row elements
     * @param <S> the type of the column elements
     * @param <R> the type of the results
     * @return a new table
     */
    @Nonnull
    public static <P, S, R> CompatibilityTable<R> compute(@Nonnull List<? extends P> rows,
                                                          @Nonnull List<? extends S> columns,
                                                          @Nonnull BiFunction<? super P, ? super S, Optional<R>> pairing) {
        final Object[][] cells = new Object[rows.size()][columns.size()];
        for (int row = 0; row < rows.size(); row++) {
            for (int column = 0; column < columns.size(); column++) {
                cells[row][column] = pairing.apply(rows.get(row), columns.get(column)).orElse(null);
            }
        }
        return new CompatibilityTable<>(rows.size(), columns.size(), cells);
    }

    /**
     * Create a table whose compatible cells hold {@code true}.
     * @param compatible a rectangular matrix, indexed by row first
     * @return a new table
     */
    @Nonnull
    public static CompatibilityTable<Boolean> fromMatrix(@Nonnull boolean[][] compatible) {
        final int columnCount = compatible.length == 0 ? 0 : compatible[0].length;
        final Object[][] cells = new Object[compatible.length][columnCount];
        for (int row = 0; row < compatible.length; row++) {
            Preconditions.checkArgument(compatible[row].length == columnCount, "matrix must be rectangular");
            for (int column = 0; column < columnCount; column++) {
                cells[row][column] = compatible[row][column] ? Boolean.TRUE : null;
            }
        }
        return new CompatibilityTable<>(compatible.length, columnCount, cells);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isCompatible(int row, int column) {
        return cells[row][column] != null;
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public Optional<R> get(int row, int column) {
        return Optional.ofNullable((R)cells[row][column]);
    }

    /**
     * The number of columns a row is compatible with.
     * @param row the row
     * @return the number of compatible cells in {@code row}
     */
    public int getCompatibleCount(int row) {
        return compatibleCounts[row];
    }
}
