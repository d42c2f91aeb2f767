///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * The kinds of problems that don't stop a pipeline run but which a reviewer should know about.
 */
public enum WarningType {
    /** A variable could not be classified with confidence. */
    CLASSIFICATION_AMBIGUITY,

    /** An ordinal scale was not recoded. */
    RECODE_SKIP,

    /** A banner category has no respondents at all, so its column was elided. */
    EMPTY_BANNER_COLUMN,

    /** One variable has no substantive answers within one banner column, so its cells cannot be computed. */
    LOCAL_ZERO_BASE,

    /** A contingency table could not support a chi-square test, so no p-value was computed. */
    DEGENERATE_SIGNIFICANCE_TEST,

    /** A chi-square test had an expected cell frequency below the minimum, so its p-value is less reliable. */
    LOW_EXPECTED_FREQUENCY,
}
