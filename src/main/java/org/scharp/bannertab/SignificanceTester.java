///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs Pearson's chi-square test of independence over a contingency table of counts.
 * <p>
 * Rows and columns whose counts are all zero are dropped before the test, since they carry no information.  If fewer
 * than two rows or two columns remain, the result is degenerate.  With continuity correction, Yates' correction is
 * applied to tables with one degree of freedom.
 * </p>
 */
public final class SignificanceTester {

    private final double significanceLevel;
    private final double marginalSignificanceLevel;
    private final double minimumExpectedFrequency;
    private final boolean continuityCorrection;

    /**
     * Creates a tester with the conventional levels: 0.05 for significant, 0.10 for marginal, a minimum expected
     * frequency of 5, and no continuity correction.
     */
    public SignificanceTester() {
        this(0.05, 0.10, 5.0, false);
    }

    /**
     * Creates a tester.
     *
     * @param significanceLevel
     *     p-values below this are {@link SignificanceFlag#SIGNIFICANT}.
     * @param marginalSignificanceLevel
     *     p-values below this, but not below {@code significanceLevel}, are {@link SignificanceFlag#MARGINAL}.
     * @param minimumExpectedFrequency
     *     An expected cell frequency below this marks the result as low power.
     * @param continuityCorrection
     *     Whether to apply Yates' correction to 2x2 tables.
     *
     * @throws IllegalArgumentException
     *     if a level is not between 0 and 1, if {@code marginalSignificanceLevel} is smaller than
     *     {@code significanceLevel}, or if {@code minimumExpectedFrequency} is negative.
     */
    public SignificanceTester(double significanceLevel, double marginalSignificanceLevel,
        double minimumExpectedFrequency, boolean continuityCorrection) {
        ArgumentUtil.checkProbability(significanceLevel, "significanceLevel");
        ArgumentUtil.checkProbability(marginalSignificanceLevel, "marginalSignificanceLevel");
        ArgumentUtil.checkNotNegative(minimumExpectedFrequency, "minimumExpectedFrequency");
        if (marginalSignificanceLevel < significanceLevel) {
            throw new IllegalArgumentException("marginalSignificanceLevel must not be less than significanceLevel");
        }

        this.significanceLevel = significanceLevel;
        this.marginalSignificanceLevel = marginalSignificanceLevel;
        this.minimumExpectedFrequency = minimumExpectedFrequency;
        this.continuityCorrection = continuityCorrection;
    }

    /**
     * Tests a crosstab.  The Total column, if present, is not part of the test.
     *
     * @param crosstab
     *     The crosstab of a row variable against a banner variable.
     *
     * @return The result.
     */
    public SignificanceResult test(Crosstab crosstab) {
        ArgumentUtil.checkNotNull(crosstab, "crosstab");

        long[][] table = crosstab.contingencyTable();
        List<BannerColumn> columns = crosstab.columns();
        List<Integer> categoryColumns = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).isTotal()) {
                categoryColumns.add(i);
            }
        }

        long[][] observed = new long[table.length][categoryColumns.size()];
        for (int row = 0; row < table.length; row++) {
            for (int j = 0; j < categoryColumns.size(); j++) {
                observed[row][j] = table[row][categoryColumns.get(j)];
            }
        }
        return test(crosstab.rowVariable().name(), crosstab.group().bannerVariableName(), observed);
    }

    /**
     * Tests a contingency table.
     *
     * @param rowVariableName
     *     The name of the row variable.
     * @param bannerVariableName
     *     The name of the banner variable.
     * @param observed
     *     The counts, indexed by [row][column].  Every row must have the same length.
     *
     * @return The result.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code observed} is ragged or has a negative count.
     */
    public SignificanceResult test(String rowVariableName, String bannerVariableName, long[][] observed) {
        ArgumentUtil.checkNotNull(rowVariableName, "rowVariableName");
        ArgumentUtil.checkNotNull(bannerVariableName, "bannerVariableName");
        ArgumentUtil.checkNotNull(observed, "observed");

        final int columnCount = observed.length == 0 ? 0 : observed[0].length;
        for (long[] row : observed) {
            if (row.length != columnCount) {
                throw new IllegalArgumentException("observed must be rectangular");
            }
            for (long count : row) {
                if (count < 0) {
                    throw new IllegalArgumentException("observed must not contain a negative count");
                }
            }
        }

        long[][] table = dropEmptyRowsAndColumns(observed, columnCount);
        if (table.length < 2 || table[0].length < 2) {
            return SignificanceResult.degenerate(rowVariableName, bannerVariableName);
        }

        final int rows = table.length;
        final int columns = table[0].length;
        long[] rowTotals = new long[rows];
        long[] columnTotals = new long[columns];
        long total = 0;
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                rowTotals[row] += table[row][column];
                columnTotals[column] += table[row][column];
                total += table[row][column];
            }
        }

        final int degreesOfFreedom = (rows - 1) * (columns - 1);
        final boolean applyYates = continuityCorrection && degreesOfFreedom == 1;

        double chiSquare = 0;
        boolean lowPower = false;
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                double expected = (double) rowTotals[row] * columnTotals[column] / total;
                if (expected < minimumExpectedFrequency) {
                    lowPower = true;
                }
                double difference = Math.abs(table[row][column] - expected);
                if (applyYates) {
                    difference = Math.max(0, difference - 0.5);
                }
                chiSquare += difference * difference / expected;
            }
        }

        double pValue = MathUtil.chiSquareSurvival(chiSquare, degreesOfFreedom);
        final SignificanceFlag flag;
        if (pValue < significanceLevel) {
            flag = SignificanceFlag.SIGNIFICANT;
        } else if (pValue < marginalSignificanceLevel) {
            flag = SignificanceFlag.MARGINAL;
        } else {
            flag = SignificanceFlag.NOT_SIGNIFICANT;
        }

        return new SignificanceResult(rowVariableName, bannerVariableName, chiSquare, degreesOfFreedom, pValue, flag,
            lowPower, false);
    }

    private static long[][] dropEmptyRowsAndColumns(long[][] observed, int columnCount) {
        List<Integer> keptRows = new ArrayList<>();
        for (int row = 0; row < observed.length; row++) {
            for (long count : observed[row]) {
                if (count != 0) {
                    keptRows.add(row);
                    break;
                }
            }
        }
        List<Integer> keptColumns = new ArrayList<>();
        for (int column = 0; column < columnCount; column++) {
            for (long[] row : observed) {
                if (row[column] != 0) {
                    keptColumns.add(column);
                    break;
                }
            }
        }

        long[][] table = new long[keptRows.size()][keptColumns.size()];
        for (int i = 0; i < keptRows.size(); i++) {
            for (int j = 0; j < keptColumns.size(); j++) {
                table[i][j] = observed[keptRows.get(i)][keptColumns.get(j)];
            }
        }
        return table;
    }
}
