///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.List;

/**
 * One independent unit of tabulation: a row variable against one banner group.
 * <p>
 * Work items only read the dataset, so they can be run on any thread in any order.
 * </p>
 */
final class TabulationWorkItem {

    private final int index;
    private final Variable rowVariable;
    private final TableSection section;
    private final BannerGroup group;
    private final List<BannerColumn> columns;

    TabulationWorkItem(int index, Variable rowVariable, TableSection section, BannerGroup group,
        List<BannerColumn> columns) {
        this.index = index;
        this.rowVariable = rowVariable;
        this.section = section;
        this.group = group;
        this.columns = columns;
    }

    /** The position of this item in the table (row-major). */
    int index() {
        return index;
    }

    Variable rowVariable() {
        return rowVariable;
    }

    TableSection section() {
        return section;
    }

    BannerGroup group() {
        return group;
    }

    List<BannerColumn> columns() {
        return columns;
    }

    @Override
    public String toString() {
        return "#" + index + " " + rowVariable.name() + " x " +
            (group.isTotal() ? BannerColumn.TOTAL_LABEL : group.bannerVariableName());
    }
}
