///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The block of a banner table that belongs to one row variable: its name and question text, its base in each visible
 * column, one row of percentages per substantive value, and its significance against each banner variable.
 * <p>
 * Instances of this class are immutable and are created by {@link BannerTableAssembler}.
 * </p>
 */
public final class BannerTableBlock {

    private final Variable rowVariable;
    private final TableSection section;
    private final List<Crosstab> crosstabs;
    private final List<SignificanceResult> significanceResults;

    BannerTableBlock(Variable rowVariable, TableSection section, List<Crosstab> crosstabs,
        List<SignificanceResult> significanceResults) {
        this.rowVariable = rowVariable;
        this.section = section;
        this.crosstabs = crosstabs;
        this.significanceResults = significanceResults;
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
     * Gets the section of the table in which this block appears.
     *
     * @return The section.
     */
    public TableSection section() {
        return section;
    }

    /**
     * Gets the crosstabs of this block, one per banner group.
     *
     * @return The crosstabs in column order. The returned list is not modifiable.
     */
    public List<Crosstab> crosstabs() {
        return Collections.unmodifiableList(crosstabs);
    }

    /**
     * Gets the substantive codes of the row variable, which are the rows of this block.
     *
     * @return The codes in ascending order.
     */
    public List<Integer> rowCodes() {
        return crosstabs.isEmpty() ? List.of() : crosstabs.get(0).rowCodes();
    }

    /**
     * Gets this block's columns.
     *
     * @return The visible columns of every group, in order.
     */
    public List<BannerColumn> columns() {
        List<BannerColumn> columns = new ArrayList<>();
        for (Crosstab crosstab : crosstabs) {
            columns.addAll(crosstab.columns());
        }
        return Collections.unmodifiableList(columns);
    }

    /**
     * Gets the row variable's base in each column.
     *
     * @return The bases, in the same order as {@link #columns()}.
     */
    public List<Integer> bases() {
        List<Integer> bases = new ArrayList<>();
        for (Crosstab crosstab : crosstabs) {
            for (int i = 0; i < crosstab.columns().size(); i++) {
                bases.add(crosstab.base(i));
            }
        }
        return Collections.unmodifiableList(bases);
    }

    /**
     * Gets the cells of one value row.
     *
     * @param rowIndex
     *     The index of the value within {@link #rowCodes()}.
     *
     * @return The cells, in the same order as {@link #columns()}.
     */
    public List<CrosstabCell> valueRow(int rowIndex) {
        List<CrosstabCell> cells = new ArrayList<>();
        for (Crosstab crosstab : crosstabs) {
            cells.addAll(crosstab.row(rowIndex));
        }
        return Collections.unmodifiableList(cells);
    }

    /**
     * Gets the significance results of this block.
     *
     * @return One result per banner variable, in banner order.  This is empty when tests are turned off.
     */
    public List<SignificanceResult> significanceResults() {
        return Collections.unmodifiableList(significanceResults);
    }

    /**
     * Gets the significance of this row variable against one banner variable.
     *
     * @param bannerVariableName
     *     The name of the banner variable.
     *
     * @return The result, or {@code null} if there is none.
     */
    public SignificanceResult significance(String bannerVariableName) {
        for (SignificanceResult result : significanceResults) {
            if (result.bannerVariableName().equals(bannerVariableName)) {
                return result;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return rowVariable.name() + " [" + section.tag() + "]";
    }
}
