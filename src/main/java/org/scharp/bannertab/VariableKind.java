///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * The semantic kind of a survey variable.
 * <p>
 * A variable's kind decides what happens to it downstream: only {@link #ORDINAL_SCALE} variables are recoded into
 * top/bottom box indicators, and only {@link #NOMINAL} and {@link #BINARY} variables are suggested as banners.
 * </p>
 */
public enum VariableKind {
    /** An ordered rating scale, such as a 5-point agreement (Likert) scale. */
    ORDINAL_SCALE,

    /** A set of unordered categories, such as region. */
    NOMINAL,

    /** Exactly two substantive categories, such as yes/no. */
    BINARY,

    /** A count or measurement with many distinct unlabeled values, such as age. */
    NUMERIC,

    /** A variable that could not be classified with any confidence. */
    UNCLASSIFIED,
}
