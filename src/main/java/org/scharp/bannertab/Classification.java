///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Objects;

/**
 * The kind that was assigned to one variable, and how it was decided.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class Classification {

    private final String variableName;
    private final VariableKind kind;
    private final boolean confident;
    private final boolean overridden;
    private final int substantiveCodeCount;
    private final String reason;

    Classification(String variableName, VariableKind kind, boolean confident, boolean overridden,
        int substantiveCodeCount, String reason) {
        this.variableName = variableName;
        this.kind = kind;
        this.confident = confident;
        this.overridden = overridden;
        this.substantiveCodeCount = substantiveCodeCount;
        this.reason = reason;
    }

    /**
     * Creates a copy of this classification with a kind that was decided outside of the heuristic, usually by a
     * person reviewing the survey.
     *
     * @param decidedKind
     *     The kind to use.
     *
     * @return A confident classification with the given kind.
     */
    Classification overriddenBy(VariableKind decidedKind) {
        return new Classification(
            variableName,
            decidedKind,
            true,
            true,
            substantiveCodeCount,
            "decided as " + decidedKind + " (heuristic suggested " + kind + ": " + reason + ")");
    }

    /**
     * Gets the name of the classified variable.
     *
     * @return The variable's name. This is never {@code null}.
     */
    public String variableName() {
        return variableName;
    }

    /**
     * Gets the variable's kind.
     *
     * @return The kind. This is never {@code null}.
     */
    public VariableKind kind() {
        return kind;
    }

    /**
     * Determines if the classification is trustworthy without review.
     * <p>
     * A variable whose codes are consecutive integers but whose labels say nothing about intensity is classified as an
     * ordinal scale with low confidence, since a ranking question looks exactly the same.
     * </p>
     *
     * @return {@code true} if the heuristic had clear evidence or the kind was decided explicitly.
     */
    public boolean confident() {
        return confident;
    }

    /**
     * Determines if the kind came from a decision record instead of the heuristic.
     *
     * @return {@code true} if the kind was overridden.
     */
    public boolean overridden() {
        return overridden;
    }

    /**
     * Gets the number of substantive codes that the variable has.  For an ordinal scale, this is its number of scale
     * points.
     *
     * @return The number of substantive codes.
     */
    public int substantiveCodeCount() {
        return substantiveCodeCount;
    }

    /**
     * Gets a human-readable explanation of the classification.
     *
     * @return The reason. This is never {@code null}.
     */
    public String reason() {
        return reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableName, kind, confident, overridden, substantiveCodeCount, reason);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Classification that)) {
            return false;
        }
        return variableName.equals(that.variableName) &&
            kind == that.kind &&
            confident == that.confident &&
            overridden == that.overridden &&
            substantiveCodeCount == that.substantiveCodeCount &&
            reason.equals(that.reason);
    }

    @Override
    public String toString() {
        return variableName + ": " + kind + (confident ? "" : " (uncertain)") + " - " + reason;
    }
}
