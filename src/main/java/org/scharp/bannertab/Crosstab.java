///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The cross-tabulation of one row variable against the columns of one banner group.
 * <p>
 * A {@code Crosstab} is always complete: it has a cell for every substantive code of the row variable in every
 * column it was built for.  Instances of this class are immutable and are created by {@link CrosstabBuilder}.
 * </p>
 */
public final class Crosstab {

    private final Variable rowVariable;
    private final BannerGroup group;
    private final List<BannerColumn> columns;
    private final List<Integer> rowCodes;
    private final int[] bases;
    private final CrosstabCell[][] cells; // [row][column]

    Crosstab(Variable rowVariable, BannerGroup group, List<BannerColumn> columns, List<Integer> rowCodes, int[] bases,
        CrosstabCell[][] cells) {
        this.rowVariable = rowVariable;
        this.group = group;
        this.columns = columns;
        this.rowCodes = rowCodes;
        this.bases = bases;
        this.cells = cells;
    }

    /**
     * Gets the row variable.
     *
     * @return The row variable.
     */
    public Variable rowVariable() {
        return rowVariable;
    }

    /**
     * Gets the banner group.
     *
     * @return The group whose columns this crosstab covers.
     */
    public BannerGroup group() {
        return group;
    }

    /**
     * Gets the columns of this crosstab.
     *
     * @return The columns in display order. The returned list is not modifiable.
     */
    public List<BannerColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Gets the substantive codes of the row variable.
     *
     * @return The codes in ascending order. The returned list is not modifiable.
     */
    public List<Integer> rowCodes() {
        return Collections.unmodifiableList(rowCodes);
    }

    /**
     * Gets the base of one column.
     *
     * @param columnIndex
     *     The index of the column within {@link #columns()}.
     *
     * @return The number of respondents in the column with a substantive answer.
     */
    public int base(int columnIndex) {
        return bases[columnIndex];
    }

    /**
     * Gets one cell.
     *
     * @param rowIndex
     *     The index of the code within {@link #rowCodes()}.
     * @param columnIndex
     *     The index of the column within {@link #columns()}.
     *
     * @return The cell.
     */
    public CrosstabCell cell(int rowIndex, int columnIndex) {
        return cells[rowIndex][columnIndex];
    }

    /**
     * Gets the cells of one row.
     *
     * @param rowIndex
     *     The index of the code within {@link #rowCodes()}.
     *
     * @return The row's cells in column order.
     */
    public List<CrosstabCell> row(int rowIndex) {
        return Collections.unmodifiableList(Arrays.asList(cells[rowIndex]));
    }

    /**
     * Gets the columns which have respondents but none of them answered the row variable.
     *
     * @return The locally empty columns.
     */
    public List<BannerColumn> zeroBaseColumns() {
        List<BannerColumn> zeroBaseColumns = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (bases[i] == 0 && !columns.get(i).isEmpty()) {
                zeroBaseColumns.add(columns.get(i));
            }
        }
        return zeroBaseColumns;
    }

    /**
     * Gets the observed counts as a contingency table.
     *
     * @return A new array of counts indexed by [row][column].
     */
    public long[][] contingencyTable() {
        long[][] table = new long[rowCodes.size()][columns.size()];
        for (int row = 0; row < rowCodes.size(); row++) {
            for (int column = 0; column < columns.size(); column++) {
                table[row][column] = cells[row][column].count();
            }
        }
        return table;
    }
}
