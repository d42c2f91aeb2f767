///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * The result of a chi-square test of independence between a row variable and a banner variable.
 * <p>
 * When the contingency table has fewer than two non-empty rows or columns, no test is possible.  The result is then
 * <i>degenerate</i>: its statistic and p-value are {@link Double#NaN} and its flag is
 * {@link SignificanceFlag#NOT_SIGNIFICANT}.
 * </p><p>
 * Instances of this class are immutable.
 * </p>
 */
public final class SignificanceResult {

    private final String rowVariableName;
    private final String bannerVariableName;
    private final double chiSquare;
    private final int degreesOfFreedom;
    private final double pValue;
    private final SignificanceFlag flag;
    private final boolean lowPower;
    private final boolean degenerate;

    SignificanceResult(String rowVariableName, String bannerVariableName, double chiSquare, int degreesOfFreedom,
        double pValue, SignificanceFlag flag, boolean lowPower, boolean degenerate) {
        this.rowVariableName = rowVariableName;
        this.bannerVariableName = bannerVariableName;
        this.chiSquare = chiSquare;
        this.degreesOfFreedom = degreesOfFreedom;
        this.pValue = pValue;
        this.flag = flag;
        this.lowPower = lowPower;
        this.degenerate = degenerate;
    }

    static SignificanceResult degenerate(String rowVariableName, String bannerVariableName) {
        return new SignificanceResult(rowVariableName, bannerVariableName, Double.NaN, 0, Double.NaN,
            SignificanceFlag.NOT_SIGNIFICANT, false, true);
    }

    /**
     * @return The name of the row variable.
     */
    public String rowVariableName() {
        return rowVariableName;
    }

    /**
     * @return The name of the banner variable.
     */
    public String bannerVariableName() {
        return bannerVariableName;
    }

    /**
     * Gets the Pearson chi-square statistic.
     *
     * @return The statistic, or {@link Double#NaN} if the test is degenerate.
     */
    public double chiSquare() {
        return chiSquare;
    }

    /**
     * Gets the degrees of freedom, {@code (rows - 1) * (columns - 1)} over the non-empty rows and columns.
     *
     * @return The degrees of freedom, or 0 if the test is degenerate.
     */
    public int degreesOfFreedom() {
        return degreesOfFreedom;
    }

    /**
     * Gets the probability of a statistic at least this large if the variables were independent.
     *
     * @return The p-value, or {@link Double#NaN} if the test is degenerate.
     */
    public double pValue() {
        return pValue;
    }

    /**
     * @return The significance flag.
     */
    public SignificanceFlag flag() {
        return flag;
    }

    /**
     * Determines if some expected cell frequency is too small for the chi-square approximation to be trusted.  This
     * doesn't change the p-value.
     *
     * @return {@code true} if the test has low power.
     */
    public boolean lowPower() {
        return lowPower;
    }

    /**
     * Determines if the test could not be run.
     *
     * @return {@code true} if the contingency table has a single row or a single column.
     */
    public boolean degenerate() {
        return degenerate;
    }

    @Override
    public String toString() {
        if (degenerate) {
            return rowVariableName + " x " + bannerVariableName + ": not testable";
        }
        return rowVariableName + " x " + bannerVariableName + ": chi2=" + chiSquare + ", df=" + degreesOfFreedom +
            ", p=" + pValue + " (" + flag + (lowPower ? ", low power" : "") + ")";
    }
}
