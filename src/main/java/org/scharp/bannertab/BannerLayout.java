///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * All banner columns of a table, grouped by banner variable, with the Total group first if there is one.
 * <p>
 * The columns are computed once from a {@link BannerSpec} and a dataset.  An empty column is never removed from the
 * layout; it is only hidden from rendering.
 * </p>
 * <p>
 * Only substantive banner categories become columns.  A respondent whose answer to a banner variable is a
 * non-substantive code, such as "Refused", is counted in the Total column but in none of that variable's columns.
 * </p>
 */
public final class BannerLayout {

    private final List<BannerGroup> groups;
    private final boolean skipEmptyColumns;

    private BannerLayout(List<BannerGroup> groups, boolean skipEmptyColumns) {
        this.groups = groups;
        this.skipEmptyColumns = skipEmptyColumns;
    }

    /**
     * Computes the banner columns of a dataset.
     *
     * @param dataset
     *     The dataset.
     * @param missingCodes
     *     The non-substantive codes of each variable, by variable name.  A variable that isn't in this map has none.
     * @param bannerSpec
     *     The banner variables.  Every one must be in {@code dataset}.
     * @param includeTotalColumn
     *     Whether to add a leading Total column.
     * @param skipEmptyColumns
     *     Whether empty columns are hidden.
     *
     * @return The layout.
     */
    static BannerLayout create(SurveyDataset dataset, Map<String, MissingCodeSet> missingCodes, BannerSpec bannerSpec,
        boolean includeTotalColumn, boolean skipEmptyColumns) {
        List<BannerGroup> groups = new ArrayList<>(bannerSpec.bannerVariables().size() + 1);
        if (includeTotalColumn) {
            groups.add(new BannerGroup(null, List.of(BannerColumn.total(dataset))));
        }

        for (String bannerVariableName : bannerSpec.bannerVariables()) {
            Variable bannerVariable = dataset.variable(bannerVariableName);
            MissingCodeSet bannerMissingCodes = missingCodes.getOrDefault(bannerVariableName, MissingCodeSet.EMPTY);
            List<Integer> categoryCodes = bannerSpec.categoryOrder(bannerVariableName);
            if (categoryCodes == null) {
                categoryCodes = new ArrayList<>(bannerVariable.codedValues());
            }

            List<BannerColumn> columns = new ArrayList<>(categoryCodes.size());
            for (Integer categoryCode : categoryCodes) {
                if (!bannerMissingCodes.isSubstantive(categoryCode)) {
                    continue;
                }
                columns.add(BannerColumn.category(dataset, bannerVariable, categoryCode));
            }
            groups.add(new BannerGroup(bannerVariableName, columns));
        }

        return new BannerLayout(groups, skipEmptyColumns);
    }

    /**
     * Gets the column groups.
     *
     * @return The groups in display order. The returned list is not modifiable.
     */
    public List<BannerGroup> groups() {
        return Collections.unmodifiableList(groups);
    }

    /**
     * Determines if empty columns are hidden.
     *
     * @return {@code true} if empty columns are not shown.
     */
    public boolean skipsEmptyColumns() {
        return skipEmptyColumns;
    }

    /**
     * Gets the columns that are shown, in display order.
     *
     * @return The visible columns.
     */
    public List<BannerColumn> visibleColumns() {
        List<BannerColumn> visible = new ArrayList<>();
        for (BannerGroup group : groups) {
            visible.addAll(group.visibleColumns(skipEmptyColumns));
        }
        return Collections.unmodifiableList(visible);
    }

    /**
     * Gets the banner categories without respondents, whether or not they are shown.
     *
     * @return The empty columns, in layout order.
     */
    public List<BannerColumn> emptyColumns() {
        List<BannerColumn> empty = new ArrayList<>();
        for (BannerGroup group : groups) {
            for (BannerColumn column : group.columns()) {
                if (column.isEmpty() && !column.isTotal()) {
                    empty.add(column);
                }
            }
        }
        return Collections.unmodifiableList(empty);
    }

    /**
     * Gets the columns that exist but aren't shown.
     *
     * @return The hidden columns, in layout order.  This is empty when empty columns are shown.
     */
    public List<BannerColumn> hiddenColumns() {
        List<BannerColumn> hidden = new ArrayList<>();
        if (skipEmptyColumns) {
            for (BannerGroup group : groups) {
                for (BannerColumn column : group.columns()) {
                    if (column.isEmpty()) {
                        hidden.add(column);
                    }
                }
            }
        }
        return Collections.unmodifiableList(hidden);
    }
}
