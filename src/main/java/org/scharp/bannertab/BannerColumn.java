///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One column of a banner table: either one category of a banner variable or the Total column, which holds every
 * respondent.
 * <p>
 * A column with no respondents at all is <i>empty</i>.  Instances of this class are immutable.
 * </p>
 */
public final class BannerColumn {

    /** The display label of the Total column. */
    public static final String TOTAL_LABEL = "Total";

    private final String bannerVariableName;
    private final Integer categoryCode;
    private final String categoryLabel;
    private final String displayLabel;
    private final Predicate<Respondent> respondentFilter;
    private final int respondentCount;

    private BannerColumn(String bannerVariableName, Integer categoryCode, String categoryLabel, String displayLabel,
        Predicate<Respondent> respondentFilter, int respondentCount) {
        this.bannerVariableName = bannerVariableName;
        this.categoryCode = categoryCode;
        this.categoryLabel = categoryLabel;
        this.displayLabel = displayLabel;
        this.respondentFilter = respondentFilter;
        this.respondentCount = respondentCount;
    }

    /**
     * Creates the Total column of a dataset.
     *
     * @param dataset
     *     The dataset.
     *
     * @return A column which selects every respondent.
     */
    static BannerColumn total(SurveyDataset dataset) {
        return new BannerColumn(null, null, TOTAL_LABEL, TOTAL_LABEL, respondent -> true,
            dataset.observationCount());
    }

    /**
     * Creates the column of one banner category.
     *
     * @param dataset
     *     The dataset, used to count the respondents in the category.
     * @param bannerVariable
     *     The banner variable.
     * @param categoryCode
     *     The category.
     *
     * @return A column which selects the respondents whose answer to {@code bannerVariable} is {@code categoryCode}.
     */
    static BannerColumn category(SurveyDataset dataset, Variable bannerVariable, int categoryCode) {
        final String variableName = bannerVariable.name();
        final Integer code = categoryCode;
        Predicate<Respondent> filter = respondent -> code.equals(respondent.value(variableName));

        int count = 0;
        for (Integer value : dataset.column(variableName)) {
            if (code.equals(value)) {
                count++;
            }
        }

        String categoryLabel = bannerVariable.valueLabel(categoryCode);
        return new BannerColumn(variableName, code, categoryLabel, variableName + ": " + categoryLabel, filter,
            count);
    }

    /**
     * Determines if this is the Total column.
     *
     * @return {@code true} if this column holds all respondents.
     */
    public boolean isTotal() {
        return bannerVariableName == null;
    }

    /**
     * Gets the banner variable to which this column belongs.
     *
     * @return The banner variable's name, or {@code null} for the Total column.
     */
    public String bannerVariableName() {
        return bannerVariableName;
    }

    /**
     * Gets the category of this column.
     *
     * @return The category code, or {@code null} for the Total column.
     */
    public Integer categoryCode() {
        return categoryCode;
    }

    /**
     * Gets the value label of this column's category.
     *
     * @return The label, which is {@value #TOTAL_LABEL} for the Total column.
     */
    public String categoryLabel() {
        return categoryLabel;
    }

    /**
     * Gets the column header, such as "REGION: North".
     *
     * @return The header.
     */
    public String displayLabel() {
        return displayLabel;
    }

    /**
     * Gets the predicate that selects the respondents in this column.
     *
     * @return The filter.
     */
    public Predicate<Respondent> respondentFilter() {
        return respondentFilter;
    }

    /**
     * Gets the number of respondents in this column.
     *
     * @return The number of respondents, whether or not they answered any particular question.
     */
    public int respondentCount() {
        return respondentCount;
    }

    /**
     * Determines if this column has no respondents.
     *
     * @return {@code true} if the column is empty.
     */
    public boolean isEmpty() {
        return respondentCount == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bannerVariableName, categoryCode);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BannerColumn that)) {
            return false;
        }
        return Objects.equals(bannerVariableName, that.bannerVariableName) &&
            Objects.equals(categoryCode, that.categoryCode);
    }

    @Override
    public String toString() {
        return displayLabel + " (n=" + respondentCount + ")";
    }
}
