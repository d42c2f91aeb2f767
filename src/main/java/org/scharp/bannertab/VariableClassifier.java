///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;

/**
 * Decides the {@link VariableKind} of a variable from its substantive codes and their labels.
 * <p>
 * The rules are applied in order; the first that matches wins:
 * </p>
 * <ol>
 *     <li>Fewer than two substantive codes: {@link VariableKind#UNCLASSIFIED} (uncertain).</li>
 *     <li>Exactly two substantive codes: {@link VariableKind#BINARY}.</li>
 *     <li>Three to eleven consecutive integer codes whose labels use intensity language ("agree", "satisfied",
 *     "very", ...): {@link VariableKind#ORDINAL_SCALE}.</li>
 *     <li>Three to eleven consecutive integer codes starting at 1 without intensity language: this may be a scale or a
 *     ranking, so it's {@link VariableKind#UNCLASSIFIED} (uncertain) until a person decides.</li>
 *     <li>No value labels and more than twenty substantive codes: {@link VariableKind#NUMERIC}.</li>
 *     <li>Anything else: {@link VariableKind#NOMINAL}.</li>
 * </ol>
 *
 * <p>
 * The classifier never fails.  When it is unsure, it says so through {@link Classification#confident()} so that a
 * person can override it.  An uncertain variable is never recoded or suggested as a banner variable unless a person
 * decides its kind.
 * </p>
 */
public final class VariableClassifier {

    /**
     * Words in value labels that show the codes are ordered by intensity.
     */
    public static final List<String> INTENSITY_INDICATORS = List.of(
        "agree", "disagree", "satisfied", "dissatisfied",
        "likely", "unlikely", "important", "unimportant",
        "good", "poor", "excellent", "fair",
        "always", "never", "often", "rarely",
        "very", "somewhat", "not at all", "extremely",
        "strongly", "completely", "definitely", "probably");

    /** The smallest scale that can be an ordinal scale. */
    public static final int MINIMUM_SCALE_POINTS = 3;

    /** The largest scale that can be an ordinal scale (a 0-10 scale). */
    public static final int MAXIMUM_SCALE_POINTS = 11;

    /** Unlabeled variables with more codes than this are numeric. */
    public static final int MAXIMUM_UNLABELED_CATEGORIES = 20;

    /**
     * Classifies a variable.
     *
     * @param variable
     *     The variable.
     * @param missingCodes
     *     The variable's non-substantive codes.
     *
     * @return The classification. This is never {@code null}.
     */
    public Classification classify(Variable variable, MissingCodeSet missingCodes) {
        ArgumentUtil.checkNotNull(variable, "variable");
        ArgumentUtil.checkNotNull(missingCodes, "missingCodes");

        SortedSet<Integer> codes = missingCodes.substantiveCodes(variable);
        final int count = codes.size();
        final String name = variable.name();

        if (count < 2) {
            return new Classification(name, VariableKind.UNCLASSIFIED, false, false, count,
                "only " + count + " substantive code" + (count == 1 ? "" : "s"));
        }
        if (count == 2) {
            return new Classification(name, VariableKind.BINARY, true, false, count, "two substantive codes");
        }

        if (count <= MAXIMUM_SCALE_POINTS && isConsecutive(codes)) {
            boolean hasIntensityLabels = hasIntensityLanguage(variable, codes);
            if (hasIntensityLabels) {
                return new Classification(name, VariableKind.ORDINAL_SCALE, true, false, count,
                    count + "-point scale with intensity labels");
            }
            if (codes.first() == 1) {
                return new Classification(name, VariableKind.UNCLASSIFIED, false, false, count,
                    "codes 1-" + count + " are consecutive but the labels show no intensity (it may be a ranking)");
            }
        }

        if (variable.valueLabels().isEmpty() && MAXIMUM_UNLABELED_CATEGORIES < count) {
            return new Classification(name, VariableKind.NUMERIC, true, false, count,
                count + " distinct unlabeled values");
        }

        return new Classification(name, VariableKind.NOMINAL, true, false, count, count + " categories");
    }

    /**
     * Classifies every variable of a catalog.
     *
     * @param catalog
     *     The catalog.
     * @param missingCodesByVariable
     *     The non-substantive codes of each variable, keyed by variable name.  A variable without an entry is assumed
     *     to have none.
     *
     * @return The classifications in catalog order.
     */
    public List<Classification> classifyAll(VariableCatalog catalog,
        Map<String, MissingCodeSet> missingCodesByVariable) {
        ArgumentUtil.checkNotNull(catalog, "catalog");
        ArgumentUtil.checkNotNull(missingCodesByVariable, "missingCodesByVariable");

        List<Classification> classifications = new ArrayList<>(catalog.size());
        for (Variable variable : catalog.variables()) {
            MissingCodeSet missingCodes = missingCodesByVariable.getOrDefault(variable.name(), MissingCodeSet.EMPTY);
            classifications.add(classify(variable, missingCodes));
        }
        return classifications;
    }

    private static boolean isConsecutive(SortedSet<Integer> codes) {
        if (codes.size() < MINIMUM_SCALE_POINTS) {
            return false;
        }
        // A sorted set of distinct integers is consecutive exactly when its span equals its size.
        return (long) codes.last() - codes.first() + 1 == codes.size();
    }

    private static boolean hasIntensityLanguage(Variable variable, SortedSet<Integer> codes) {
        StringBuilder labelText = new StringBuilder();
        for (Integer code : codes) {
            String valueLabel = variable.valueLabels().get(code);
            if (valueLabel != null) {
                labelText.append(valueLabel.toLowerCase(Locale.ROOT)).append(' ');
            }
        }

        String text = labelText.toString();
        for (String indicator : INTENSITY_INDICATORS) {
            if (text.contains(indicator)) {
                return true;
            }
        }
        return false;
    }
}
