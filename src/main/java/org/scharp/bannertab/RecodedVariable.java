///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * A binary variable derived from an ordinal scale by a {@link RecodingSpec}, together with the documentation of how it
 * was derived.
 * <p>
 * A respondent's derived value is 1 if their answer is in the box, 0 if it's any other substantive answer, and missing
 * if their answer was missing or non-substantive.  Recoding never changes who is missing, so the derived variable has
 * the same base as its source in every banner column.
 * </p>
 *
 * <p>
 * Instances of this class are immutable and are created by {@link RecodingEngine}.
 * </p>
 */
public final class RecodedVariable {

    private final Variable variable;
    private final String sourceVariableName;
    private final String sourceLabel;
    private final RecodingSpec spec;
    private final int threshold;
    private final int scalePoints;
    private final SortedSet<Integer> thresholdCodes;
    private final List<String> thresholdLabels;

    RecodedVariable(Variable variable, String sourceVariableName, String sourceLabel, RecodingSpec spec,
        int threshold, int scalePoints, SortedSet<Integer> thresholdCodes, List<String> thresholdLabels) {
        this.variable = variable;
        this.sourceVariableName = sourceVariableName;
        this.sourceLabel = sourceLabel;
        this.spec = spec;
        this.threshold = threshold;
        this.scalePoints = scalePoints;
        this.thresholdCodes = thresholdCodes;
        this.thresholdLabels = thresholdLabels;
    }

    /**
     * Gets the derived variable.
     *
     * @return The derived variable, whose kind is {@link VariableKind#BINARY}.
     */
    public Variable variable() {
        return variable;
    }

    /**
     * Gets the derived variable's name, such as "Q1_top2".
     *
     * @return The name.
     */
    public String name() {
        return variable.name();
    }

    /**
     * Gets the name of the ordinal scale from which this variable was derived.
     *
     * @return The source variable's name.
     */
    public String sourceVariableName() {
        return sourceVariableName;
    }

    /**
     * Gets the label of the ordinal scale from which this variable was derived.
     *
     * @return The source variable's label. This may be empty.
     */
    public String sourceLabel() {
        return sourceLabel;
    }

    /**
     * Gets the recoding that was applied.
     *
     * @return The recoding.
     */
    public RecodingSpec spec() {
        return spec;
    }

    /**
     * Gets the number of scale points that map to 1.
     *
     * @return The box size.
     */
    public int boxSize() {
        return spec.boxSize();
    }

    /**
     * Gets the end of the scale that maps to 1.
     *
     * @return The direction.
     */
    public BoxDirection direction() {
        return spec.direction();
    }

    /**
     * Gets the threshold code.  For a top box, codes at or above the threshold map to 1; for a bottom box, codes at or
     * below it.
     *
     * @return The threshold, which is {@code max - boxSize + 1} for a top box and {@code min + boxSize - 1} for a
     *     bottom box, computed over the substantive codes.
     */
    public int threshold() {
        return threshold;
    }

    /**
     * Gets the number of substantive codes of the source scale.
     *
     * @return The number of scale points.
     */
    public int scalePoints() {
        return scalePoints;
    }

    /**
     * Gets the substantive source codes that map to 1.
     *
     * @return The codes in ascending order. The returned set is not modifiable.
     */
    public SortedSet<Integer> thresholdCodes() {
        return Collections.unmodifiableSortedSet(thresholdCodes);
    }

    /**
     * Gets the value labels of the source codes that map to 1.
     *
     * @return The labels, in the same order as {@link #thresholdCodes()}. The returned list is not modifiable.
     */
    public List<String> thresholdLabels() {
        return Collections.unmodifiableList(thresholdLabels);
    }

    @Override
    public String toString() {
        return name() + " <- " + sourceVariableName + " (" + spec + ", threshold " + threshold + ")";
    }
}
