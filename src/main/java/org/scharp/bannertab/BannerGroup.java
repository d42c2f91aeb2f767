///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The columns of one banner variable, or the lone Total column.
 */
public final class BannerGroup {

    private final String bannerVariableName;
    private final List<BannerColumn> columns;

    BannerGroup(String bannerVariableName, List<BannerColumn> columns) {
        this.bannerVariableName = bannerVariableName;
        this.columns = columns;
    }

    /**
     * Determines if this is the group of the Total column.
     *
     * @return {@code true} if this group has no banner variable.
     */
    public boolean isTotal() {
        return bannerVariableName == null;
    }

    /**
     * Gets the banner variable of this group.
     *
     * @return The banner variable's name, or {@code null} for the Total column's group.
     */
    public String bannerVariableName() {
        return bannerVariableName;
    }

    /**
     * Gets every column of this group, including empty ones.
     *
     * @return The columns in display order. The returned list is not modifiable.
     */
    public List<BannerColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Gets the columns of this group that are shown.
     *
     * @param skipEmptyColumns
     *     Whether empty columns are hidden.
     *
     * @return The shown columns in display order.
     */
    public List<BannerColumn> visibleColumns(boolean skipEmptyColumns) {
        if (!skipEmptyColumns) {
            return columns();
        }
        List<BannerColumn> visible = new ArrayList<>(columns.size());
        for (BannerColumn column : columns) {
            if (!column.isEmpty()) {
                visible.add(column);
            }
        }
        return Collections.unmodifiableList(visible);
    }

    @Override
    public String toString() {
        return (isTotal() ? BannerColumn.TOTAL_LABEL : bannerVariableName) + columns;
    }
}
