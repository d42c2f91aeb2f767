///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * Which end of an ordinal scale a box recoding collapses into 1.
 */
public enum BoxDirection {
    /** The highest codes map to 1 (for example, "agree" and "strongly agree"). */
    TOP("top", "Top"),

    /** The lowest codes map to 1. */
    BOTTOM("bottom", "Bottom");

    private final String schemePrefix;
    private final String labelPrefix;

    BoxDirection(String schemePrefix, String labelPrefix) {
        this.schemePrefix = schemePrefix;
        this.labelPrefix = labelPrefix;
    }

    /**
     * Gets the lower-case prefix used in scheme names like "top2".
     *
     * @return The prefix.
     */
    String schemePrefix() {
        return schemePrefix;
    }

    /**
     * Gets the capitalized prefix used in labels like "Top 2 Box".
     *
     * @return The prefix.
     */
    String labelPrefix() {
        return labelPrefix;
    }
}
