///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * The outcome of recoding one variable: either a {@link RecodedVariable} or a {@link RecodeSkip}.
 */
public final class RecodeOutcome {

    private final RecodedVariable recodedVariable;
    private final RecodeSkip skip;

    private RecodeOutcome(RecodedVariable recodedVariable, RecodeSkip skip) {
        this.recodedVariable = recodedVariable;
        this.skip = skip;
    }

    static RecodeOutcome recoded(RecodedVariable recodedVariable) {
        return new RecodeOutcome(recodedVariable, null);
    }

    static RecodeOutcome skipped(RecodeSkip skip) {
        return new RecodeOutcome(null, skip);
    }

    /**
     * Determines if the variable was skipped.
     *
     * @return {@code true} if no recoded variable was produced.
     */
    public boolean isSkipped() {
        return skip != null;
    }

    /**
     * Gets the recoded variable.
     *
     * @return The recoded variable.
     *
     * @throws IllegalStateException
     *     if the variable was skipped.
     */
    public RecodedVariable recodedVariable() {
        if (recodedVariable == null) {
            throw new IllegalStateException("the variable was skipped: " + skip.reason());
        }
        return recodedVariable;
    }

    /**
     * Gets the reason the variable was skipped.
     *
     * @return The skip record.
     *
     * @throws IllegalStateException
     *     if the variable was recoded.
     */
    public RecodeSkip skip() {
        if (skip == null) {
            throw new IllegalStateException("the variable was recoded");
        }
        return skip;
    }
}
