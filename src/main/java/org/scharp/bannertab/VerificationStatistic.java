///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * A statistic that a {@link VerificationQuery} asks an independent tool to compute.
 */
public enum VerificationStatistic {
    /** The number of respondents with each value in each column. */
    COUNT,

    /** The count as a share of the column's base. */
    COLUMN_PERCENT,
}
