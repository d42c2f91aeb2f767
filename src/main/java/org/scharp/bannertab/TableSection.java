///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * The part of a banner table in which a row variable appears.
 */
public enum TableSection {
    /** An original survey variable, shown with every substantive answer. */
    FULL_DISTRIBUTION("FULL DIST"),

    /** A recoded variable, shown as its box and the rest of the scale. */
    BOX_SUMMARY("TOP/BOTTOM BOX");

    private final String tag;

    TableSection(String tag) {
        this.tag = tag;
    }

    /**
     * Gets the short tag by which the section is shown in previews.
     *
     * @return The tag.
     */
    public String tag() {
        return tag;
    }
}
