///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A variable (question) in a survey.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link Variable.Builder}:
 * </p>
 *
 * <pre>
 * Variable satisfaction = Variable.builder().
 *     name("Q1").
 *     label("How satisfied are you with our service?").
 *     valueLabel(1, "Very dissatisfied").
 *     valueLabel(2, "Dissatisfied").
 *     valueLabel(3, "Neutral").
 *     valueLabel(4, "Satisfied").
 *     valueLabel(5, "Very satisfied").
 *     valueLabel(99, "Don't know").
 *     build();
 * </pre>
 *
 * <p>
 * A variable's coded values are all codes that are either declared by a value label or observed in the data.  When a
 * variable is added to a {@link SurveyDataset}, the dataset adds the codes it observes.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a
 * {@code HashMap}.
 * </p>
 */
public final class Variable {

    private final String name;
    private final String label;
    private final SortedMap<Integer, String> valueLabels;
    private final SortedSet<Integer> codedValues;
    private final VariableKind kind;

    /**
     * A builder class for {@link Variable}.
     */
    public final static class Builder {
        private String name;
        private String label;
        private final SortedMap<Integer, String> valueLabels;
        private final SortedSet<Integer> observedCodes;
        private VariableKind kind;

        /**
         * Creates a {@code Variable} builder.
         */
        private Builder() {
            this.name = null; // required parameter

            this.label = ""; // optional, so default to blank
            this.valueLabels = new TreeMap<>(); // open-ended variables have no value labels
            this.observedCodes = new TreeSet<>();
            this.kind = VariableKind.UNCLASSIFIED; // set by VariableClassifier
        }

        /**
         * Sets the variable's name.
         *
         * @param name
         *     The variable's new name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code name} is blank.
         */
        public Builder name(String name) {
            ArgumentUtil.checkNotNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("variable names cannot be blank");
            }

            this.name = name;
            return this;
        }

        /**
         * Sets the variable's label, which is usually the text of the question.
         *
         * @param label
         *     The variable's new label.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code label} is {@code null}.
         */
        public Builder label(String label) {
            ArgumentUtil.checkNotNull(label, "label");

            this.label = label;
            return this;
        }

        /**
         * Adds a value label, replacing any previous label for the same code.
         *
         * @param code
         *     The coded value.
         * @param valueLabel
         *     The text that respondents saw for {@code code}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code valueLabel} is {@code null}.
         */
        public Builder valueLabel(int code, String valueLabel) {
            ArgumentUtil.checkNotNull(valueLabel, "valueLabel");

            valueLabels.put(code, valueLabel);
            return this;
        }

        /**
         * Replaces all value labels.
         *
         * @param valueLabels
         *     A map from coded value to the text that respondents saw. The map is copied, so subsequent changes to it
         *     do not impact this builder or the resulting {@code Variable}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code valueLabels} is {@code null} or contains a {@code null} key or value.
         */
        public Builder valueLabels(Map<Integer, String> valueLabels) {
            ArgumentUtil.checkNotNull(valueLabels, "valueLabels");
            ArgumentUtil.checkNoNullEntries(valueLabels.keySet(), "valueLabels");
            ArgumentUtil.checkNoNullEntries(valueLabels.values(), "valueLabels");

            this.valueLabels.clear();
            this.valueLabels.putAll(valueLabels);
            return this;
        }

        /**
         * Adds codes that were observed in the data, in addition to the codes declared by the value labels.
         *
         * @param codes
         *     The observed codes.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code codes} is {@code null} or contains a {@code null} entry.
         */
        public Builder observedCodes(Collection<Integer> codes) {
            ArgumentUtil.checkNoNullEntries(codes, "codes");

            observedCodes.addAll(codes);
            return this;
        }

        /**
         * Sets the variable's kind.  This is normally left for {@link VariableClassifier} to decide.
         *
         * @param kind
         *     The variable's new kind.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code kind} is {@code null}.
         */
        public Builder kind(VariableKind kind) {
            ArgumentUtil.checkNotNull(kind, "kind");

            this.kind = kind;
            return this;
        }

        /**
         * Builds an immutable {@code Variable} with the configured options.
         *
         * @return a {@code Variable}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set.
         */
        public Variable build() {
            // There is no meaningful default name; it's an error if the caller hasn't set it.
            if (name == null) {
                throw new IllegalStateException("name must be set");
            }

            SortedSet<Integer> codedValues = new TreeSet<>(valueLabels.keySet());
            codedValues.addAll(observedCodes);
            return new Variable(name, label, new TreeMap<>(valueLabels), codedValues, kind);
        }
    }

    /**
     * Creates a new Variable builder with a blank label, no value labels, and an unclassified kind.
     * <p>
     * You must set the name before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Constructs a variable object without doing any parameter validation.
     *
     * @param name
     *     The variable's name.
     * @param label
     *     The variable's label.
     * @param valueLabels
     *     The variable's value labels. The caller must not retain a reference.
     * @param codedValues
     *     The declared and observed codes. The caller must not retain a reference.
     * @param kind
     *     The variable's kind.
     */
    private Variable(String name, String label, SortedMap<Integer, String> valueLabels,
        SortedSet<Integer> codedValues, VariableKind kind) {
        this.name = name;
        this.label = label;
        this.valueLabels = valueLabels;
        this.codedValues = codedValues;
        this.kind = kind;
    }

    /**
     * Creates a copy of this variable with a different kind.
     *
     * @param newKind
     *     The kind of the copy.
     *
     * @return A variable that differs from this one only in its kind.
     */
    Variable withKind(VariableKind newKind) {
        assert newKind != null : "newKind must not be null";
        return new Variable(name, label, valueLabels, codedValues, newKind);
    }

    /**
     * Creates a copy of this variable that also has the given observed codes.
     *
     * @param observed
     *     Codes that were observed in the data.
     *
     * @return A variable whose coded values are the union of this variable's and {@code observed}.
     */
    Variable withObservedCodes(Collection<Integer> observed) {
        SortedSet<Integer> newCodedValues = new TreeSet<>(codedValues);
        newCodedValues.addAll(observed);
        return new Variable(name, label, valueLabels, newCodedValues, kind);
    }

    /**
     * Gets this variable's name.
     *
     * @return This variable's name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this variable's label.
     *
     * @return This variable's label. This may be the empty string but never {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * Gets this variable's label, or its name if it has no label.
     *
     * @return A non-blank description of this variable.
     */
    public String displayLabel() {
        return label.isEmpty() ? name : label;
    }

    /**
     * Gets this variable's value labels.
     * <p>
     * The returned map is not modifiable.
     * </p>
     *
     * @return A map from code to label, ordered by code. This is never {@code null}.
     */
    public SortedMap<Integer, String> valueLabels() {
        return Collections.unmodifiableSortedMap(valueLabels);
    }

    /**
     * Gets the label for one code.
     *
     * @param code
     *     The coded value.
     *
     * @return The code's value label, or the code itself as a string if it has no label.
     */
    public String valueLabel(int code) {
        String valueLabel = valueLabels.get(code);
        return valueLabel != null ? valueLabel : String.valueOf(code);
    }

    /**
     * Gets the codes that this variable is known to take, whether declared by a value label or observed in the data.
     * <p>
     * The returned set is not modifiable.
     * </p>
     *
     * @return The coded values in ascending order. This is never {@code null}.
     */
    public SortedSet<Integer> codedValues() {
        return Collections.unmodifiableSortedSet(codedValues);
    }

    /**
     * Gets this variable's kind.
     *
     * @return This variable's kind. This is never {@code null}.
     */
    public VariableKind kind() {
        return kind;
    }

    /**
     * Gets a hash code for this variable.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This variable's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(name, label, valueLabels, codedValues, kind);
    }

    /**
     * Determines if this variable is equal to another object.
     * <p>
     * Two variables are equal if and only if their name, label, value labels, coded values, and kind are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this variable.
     *
     * @return {@code true}, if this variable is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Variable otherVariable)) {
            return false;
        }

        return name.equals(otherVariable.name) &&
            label.equals(otherVariable.label) &&
            valueLabels.equals(otherVariable.valueLabels) &&
            codedValues.equals(otherVariable.codedValues) &&
            kind == otherVariable.kind;
    }

    @Override
    public String toString() {
        return name + " (" + kind + ")";
    }
}
