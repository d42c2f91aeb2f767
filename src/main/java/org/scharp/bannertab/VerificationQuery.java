///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.List;

/**
 * A request to cross-tabulate one row variable against the banner variables, described so that another statistical
 * tool can recompute the same numbers.
 * <p>
 * Categories are ordered by ascending value and empty categories are included, so that every number in a
 * {@link BannerTable} has a counterpart in the recomputed table.
 * </p>
 */
public final class VerificationQuery {

    /** The statistics that every query asks for. */
    public static final List<VerificationStatistic> STATISTICS =
        List.of(VerificationStatistic.COUNT, VerificationStatistic.COLUMN_PERCENT);

    private final String rowVariableName;
    private final List<String> bannerVariableNames;
    private final TableSection section;

    VerificationQuery(String rowVariableName, List<String> bannerVariableNames, TableSection section) {
        this.rowVariableName = rowVariableName;
        this.bannerVariableNames = List.copyOf(bannerVariableNames);
        this.section = section;
    }

    /**
     * @return The name of the row variable.
     */
    public String rowVariableName() {
        return rowVariableName;
    }

    /**
     * @return The names of the banner variables, in column order. The returned list is not modifiable.
     */
    public List<String> bannerVariableNames() {
        return bannerVariableNames;
    }

    /**
     * @return The statistics to compute.
     */
    public List<VerificationStatistic> statistics() {
        return STATISTICS;
    }

    /**
     * @return {@code true}, since categories are always ordered by ascending value.
     */
    public boolean ascendingCategoryOrder() {
        return true;
    }

    /**
     * @return {@code true}, since empty categories are always included.
     */
    public boolean includeEmptyCategories() {
        return true;
    }

    /**
     * @return Whether the row variable is an original or a recoded one.
     */
    public TableSection section() {
        return section;
    }

    @Override
    public String toString() {
        return rowVariableName + " BY " + String.join(" + ", bannerVariableNames);
    }
}
