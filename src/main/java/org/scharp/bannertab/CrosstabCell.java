///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Locale;
import java.util.Objects;

/**
 * The count and percentage of one value of a row variable within one banner column.
 * <p>
 * The base is the number of respondents in the column who gave the row variable a substantive answer.  When the base
 * is 0 the percentage can't be computed; it is {@link Double#NaN} and is rendered as {@value #NOT_COMPUTABLE}, never
 * as 0%.
 * </p>
 */
public final class CrosstabCell {

    /** What is shown in place of a percentage that can't be computed. */
    public static final String NOT_COMPUTABLE = "—";

    private final String rowVariableName;
    private final int rowCode;
    private final String rowLabel;
    private final BannerColumn column;
    private final int count;
    private final int base;

    CrosstabCell(String rowVariableName, int rowCode, String rowLabel, BannerColumn column, int count, int base) {
        assert 0 <= count && count <= base : "count " + count + " is not within base " + base;
        this.rowVariableName = rowVariableName;
        this.rowCode = rowCode;
        this.rowLabel = rowLabel;
        this.column = column;
        this.count = count;
        this.base = base;
    }

    /**
     * Gets the name of the row variable.
     *
     * @return The row variable's name.
     */
    public String rowVariableName() {
        return rowVariableName;
    }

    /**
     * Gets the value of the row variable that this cell counts.
     *
     * @return The substantive code.
     */
    public int rowCode() {
        return rowCode;
    }

    /**
     * Gets the value label of {@link #rowCode()}.
     *
     * @return The label, or the code as a string if it has none.
     */
    public String rowLabel() {
        return rowLabel;
    }

    /**
     * Gets the banner column of this cell.
     *
     * @return The column.
     */
    public BannerColumn column() {
        return column;
    }

    /**
     * Gets the number of respondents in the column who gave this answer.
     *
     * @return The count.
     */
    public int count() {
        return count;
    }

    /**
     * Gets the number of respondents in the column who gave any substantive answer.
     *
     * @return The base.
     */
    public int base() {
        return base;
    }

    /**
     * Determines if a percentage can be computed for this cell.
     *
     * @return {@code true} if the base is positive.
     */
    public boolean isComputable() {
        return base != 0;
    }

    /**
     * Gets the share of the base that gave this answer.
     *
     * @return {@code count / base} as a fraction between 0 and 1, or {@link Double#NaN} if the base is 0.
     */
    public double percentage() {
        return base == 0 ? Double.NaN : (double) count / base;
    }

    /**
     * Formats the percentage with one decimal place, such as "44.4%".
     *
     * @return The formatted percentage, or {@value #NOT_COMPUTABLE} if the base is 0.
     */
    public String formattedPercentage() {
        if (!isComputable()) {
            return NOT_COMPUTABLE;
        }
        return String.format(Locale.ROOT, "%.1f%%", 100 * percentage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowVariableName, rowCode, column, count, base);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CrosstabCell that)) {
            return false;
        }
        return rowVariableName.equals(that.rowVariableName) &&
            rowCode == that.rowCode &&
            column.equals(that.column) &&
            count == that.count &&
            base == that.base;
    }

    @Override
    public String toString() {
        return rowVariableName + "=" + rowCode + " in " + column.displayLabel() + ": " + count + "/" + base + " (" +
            formattedPercentage() + ")";
    }
}
