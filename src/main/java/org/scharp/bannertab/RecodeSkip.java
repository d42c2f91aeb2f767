///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Objects;

/**
 * A record that an ordinal scale was not recoded, and why.
 */
public final class RecodeSkip {

    private final String variableName;
    private final RecodingSpec spec;
    private final String reason;

    RecodeSkip(String variableName, RecodingSpec spec, String reason) {
        this.variableName = variableName;
        this.spec = spec;
        this.reason = reason;
    }

    /**
     * Gets the name of the variable that was not recoded.
     *
     * @return The variable's name.
     */
    public String variableName() {
        return variableName;
    }

    /**
     * Gets the recoding that would have been applied.
     *
     * @return The recoding.
     */
    public RecodingSpec spec() {
        return spec;
    }

    /**
     * Gets the reason the variable was not recoded.
     *
     * @return A human-readable reason.
     */
    public String reason() {
        return reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableName, spec, reason);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RecodeSkip that)) {
            return false;
        }
        return variableName.equals(that.variableName) && spec.equals(that.spec) && reason.equals(that.reason);
    }

    @Override
    public String toString() {
        return variableName + " (" + spec + "): " + reason;
    }
}
