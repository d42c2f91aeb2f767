///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts the answers to a row variable within each column of a banner group.
 * <p>
 * Within a column, respondents whose answer is missing or non-substantive are not part of the base, so no
 * "don't know" code ever contributes to a count or a percentage.  Percentages of a column with a positive base add up
 * to 100%.
 * </p>
 */
public final class CrosstabBuilder {

    /**
     * Cross-tabulates one row variable.
     *
     * @param dataset
     *     The dataset.
     * @param rowVariable
     *     The row variable.
     * @param missingCodes
     *     The row variable's non-substantive codes.
     * @param group
     *     The banner group.
     * @param columns
     *     The columns of {@code group} to tabulate.
     *
     * @return The complete crosstab.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public Crosstab build(SurveyDataset dataset, Variable rowVariable, MissingCodeSet missingCodes, BannerGroup group,
        List<BannerColumn> columns) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(rowVariable, "rowVariable");
        ArgumentUtil.checkNotNull(missingCodes, "missingCodes");
        ArgumentUtil.checkNotNull(group, "group");
        ArgumentUtil.checkNotNull(columns, "columns");

        List<Integer> rowCodes = new ArrayList<>(missingCodes.substantiveCodes(rowVariable));
        Map<Integer, Integer> rowIndexByCode = new HashMap<>();
        for (int i = 0; i < rowCodes.size(); i++) {
            rowIndexByCode.put(rowCodes.get(i), i);
        }

        final int columnCount = columns.size();
        int[][] counts = new int[rowCodes.size()][columnCount];
        int[] bases = new int[columnCount];

        final String rowVariableName = rowVariable.name();
        for (Respondent respondent : dataset.respondents()) {
            Integer value = respondent.value(rowVariableName);
            if (!missingCodes.isSubstantive(value)) {
                continue;
            }
            int rowIndex = rowIndexByCode.get(value);
            for (int column = 0; column < columnCount; column++) {
                if (columns.get(column).respondentFilter().test(respondent)) {
                    counts[rowIndex][column]++;
                    bases[column]++;
                }
            }
        }

        CrosstabCell[][] cells = new CrosstabCell[rowCodes.size()][columnCount];
        for (int row = 0; row < rowCodes.size(); row++) {
            int code = rowCodes.get(row);
            String rowLabel = rowVariable.valueLabel(code);
            for (int column = 0; column < columnCount; column++) {
                cells[row][column] = new CrosstabCell(rowVariableName, code, rowLabel, columns.get(column),
                    counts[row][column], bases[column]);
            }
        }

        return new Crosstab(rowVariable, group, List.copyOf(columns), rowCodes, bases, cells);
    }
}
