///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Identifies the non-substantive codes of a variable ("Don't know", "Refused", "N/A", ...) from its value labels.
 * <p>
 * A code is non-substantive if its lower-cased label contains any of the {@link #DEFAULT_PHRASES} or any additional
 * phrase given to the constructor.  Variables without value labels have no non-substantive codes.
 * </p>
 * <p>
 * A short phrase of at most three letters, such as "dk", is an abbreviation and only
 * matches as a whole word, so "DK" and "DK/NA" are non-substantive but "Vodka" is not.  Longer phrases match anywhere
 * in the label.
 * </p>
 *
 * <p>
 * This class is immutable and thread-safe.
 * </p>
 */
public final class MissingCodeResolver {

    /**
     * The phrases which mark a value label as a non-answer.  The typographic apostrophe variant is listed because
     * labels are often pasted from word processors.
     */
    public static final List<String> DEFAULT_PHRASES = List.of(
        "don't know",
        "dont know",
        "don’t know",
        "dk",
        "not sure",
        "unsure",
        "can't say",
        "no opinion",
        "refused",
        "prefer not",
        "decline",
        "not applicable",
        "n/a");

    private static final int MAXIMUM_WORD_PHRASE_LENGTH = 3;

    private final List<String> phrases;

    /**
     * Creates a resolver that uses only the {@link #DEFAULT_PHRASES}.
     */
    public MissingCodeResolver() {
        this(List.of());
    }

    /**
     * Creates a resolver that uses the {@link #DEFAULT_PHRASES} and some additional phrases.
     *
     * @param additionalPhrases
     *     Phrases that also mark a value label as non-substantive.  Matching is case-insensitive.
     *
     * @throws NullPointerException
     *     if {@code additionalPhrases} is {@code null} or contains a {@code null} entry.
     * @throws IllegalArgumentException
     *     if {@code additionalPhrases} contains a blank phrase.
     */
    public MissingCodeResolver(List<String> additionalPhrases) {
        ArgumentUtil.checkNoNullEntries(additionalPhrases, "additionalPhrases");

        List<String> allPhrases = new ArrayList<>(DEFAULT_PHRASES);
        for (String phrase : additionalPhrases) {
            ArgumentUtil.checkNotBlank(phrase, "additionalPhrases entry");
            allPhrases.add(phrase.toLowerCase(Locale.ROOT).strip());
        }
        this.phrases = Collections.unmodifiableList(allPhrases);
    }

    /**
     * Gets the phrases that this resolver looks for.
     *
     * @return The lower-case phrases. The returned list is not modifiable.
     */
    public List<String> phrases() {
        return phrases;
    }

    /**
     * Determines if a value label describes a non-answer.
     *
     * @param valueLabel
     *     The label of a code.
     *
     * @return {@code true} if the label contains one of this resolver's phrases (as a whole word, for an
     *     abbreviation).
     */
    public boolean isNonSubstantiveLabel(String valueLabel) {
        ArgumentUtil.checkNotNull(valueLabel, "valueLabel");

        String normalized = valueLabel.toLowerCase(Locale.ROOT).strip();
        for (String phrase : phrases) {
            boolean matches = isAbbreviation(phrase) ? containsWord(normalized, phrase) : normalized.contains(phrase);
            if (matches) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAbbreviation(String phrase) {
        return phrase.length() <= MAXIMUM_WORD_PHRASE_LENGTH && phrase.chars().allMatch(Character::isLetter);
    }

    private static boolean containsWord(String text, String word) {
        int index = text.indexOf(word);
        while (index != -1) {
            int end = index + word.length();
            boolean startsWord = index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
            boolean endsWord = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startsWord && endsWord) {
                return true;
            }
            index = text.indexOf(word, index + 1);
        }
        return false;
    }

    /**
     * Finds the non-substantive codes of a variable.
     *
     * @param variable
     *     The variable.
     *
     * @return The variable's non-substantive codes. This is never {@code null}.
     */
    public MissingCodeSet resolve(Variable variable) {
        ArgumentUtil.checkNotNull(variable, "variable");

        Map<Integer, String> missingCodes = new TreeMap<>();
        for (Map.Entry<Integer, String> entry : variable.valueLabels().entrySet()) {
            if (isNonSubstantiveLabel(entry.getValue())) {
                missingCodes.put(entry.getKey(), entry.getValue());
            }
        }
        return missingCodes.isEmpty() ? MissingCodeSet.EMPTY : new MissingCodeSet(missingCodes);
    }

    /**
     * Finds the non-substantive codes of every variable in a catalog.
     *
     * @param catalog
     *     The catalog.
     *
     * @return A map from variable name to its non-substantive codes, in catalog order. The map has an entry for
     *     every variable, even those with no non-substantive codes.
     */
    public Map<String, MissingCodeSet> resolveAll(VariableCatalog catalog) {
        ArgumentUtil.checkNotNull(catalog, "catalog");

        Map<String, MissingCodeSet> result = new LinkedHashMap<>();
        for (Variable variable : catalog.variables()) {
            result.put(variable.name(), resolve(variable));
        }
        return result;
    }
}
