///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * How strongly a chi-square test indicates that a row variable depends on a banner variable.
 */
public enum SignificanceFlag {
    /** The p-value is below the significance level (0.05 by default). */
    SIGNIFICANT,

    /** The p-value is at or above the significance level but below the marginal level (0.10 by default). */
    MARGINAL,

    /** The p-value is at or above the marginal level, or the test could not be run. */
    NOT_SIGNIFICANT,
}
