///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The responses to a survey: a {@link VariableCatalog} and one observation (row) per respondent.
 * <p>
 * Each value is an integer code or {@code null} for a missing response.  Instances of this class are immutable and
 * can be read from any number of threads.  They are created with a {@link SurveyDataset.Builder}:
 * </p>
 *
 * <pre>
 * SurveyDataset dataset = SurveyDataset.builder().
 *     catalog(catalog).
 *     addObservation(Arrays.asList(1, 5)).
 *     addObservation(Arrays.asList(2, null)).
 *     build();
 * </pre>
 *
 * <p>
 * Derived variables, such as the top-2-box recodings, are never written into an existing dataset.  Instead,
 * {@link #withDerivedVariable(Variable, List)} returns a new dataset which shares this dataset's columns and appends
 * the derived one, so a reader of the original dataset never sees a change.
 * </p>
 */
public final class SurveyDataset {

    private final VariableCatalog catalog;
    private final Map<String, Integer[]> columns;
    private final int observationCount;
    private final int originalVariableCount;

    /**
     * A builder class for {@link SurveyDataset}.
     */
    public final static class Builder {
        private VariableCatalog catalog;
        private final List<Integer[]> observations;

        /**
         * Creates a {@code SurveyDataset} builder.
         */
        private Builder() {
            this.catalog = null; // required parameter
            this.observations = new ArrayList<>();
        }

        /**
         * Sets the survey's metadata.  This must be set before any observations are added.
         *
         * @param catalog
         *     The survey's variables.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code catalog} is {@code null}.
         * @throws IllegalStateException
         *     if observations have already been added.
         */
        public Builder catalog(VariableCatalog catalog) {
            ArgumentUtil.checkNotNull(catalog, "catalog");
            if (!observations.isEmpty()) {
                throw new IllegalStateException("catalog cannot be changed after observations are added");
            }

            this.catalog = catalog;
            return this;
        }

        /**
         * Adds a respondent's answers.
         *
         * @param values
         *     The respondent's coded answers, in the same order as the catalog's variables.  A {@code null} entry is a
         *     missing answer. This list is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code values} is {@code null}.
         * @throws IllegalStateException
         *     if the catalog hasn't been set.
         * @throws InvalidSurveyDataException
         *     if {@code values} doesn't have exactly one value per variable.
         */
        public Builder addObservation(List<Integer> values) {
            ArgumentUtil.checkNotNull(values, "values");
            if (catalog == null) {
                throw new IllegalStateException("catalog must be set before adding observations");
            }
            if (values.size() != catalog.size()) {
                throw new InvalidSurveyDataException(
                    "observation #" + (observations.size() + 1) + " has " + values.size() +
                        " values but the catalog has " + catalog.size() + " variables");
            }

            observations.add(values.toArray(new Integer[0]));
            return this;
        }

        /**
         * Builds the immutable {@code SurveyDataset}.
         * <p>
         * The coded values of each variable in the resulting dataset's catalog include every code observed in the
         * data.
         * </p>
         *
         * @return A {@code SurveyDataset}
         *
         * @throws IllegalStateException
         *     if the catalog hasn't been set.
         */
        public SurveyDataset build() {
            if (catalog == null) {
                throw new IllegalStateException("catalog must be set");
            }

            // Transpose the observations into columns.
            Map<String, Integer[]> columns = new HashMap<>(catalog.size() * 2);
            List<Variable> observedVariables = new ArrayList<>(catalog.size());
            for (int variableIndex = 0; variableIndex < catalog.size(); variableIndex++) {
                Variable variable = catalog.variables().get(variableIndex);
                Integer[] column = new Integer[observations.size()];
                for (int row = 0; row < column.length; row++) {
                    column[row] = observations.get(row)[variableIndex];
                }
                columns.put(variable.name(), column);
                observedVariables.add(variable.withObservedCodes(observedCodes(column)));
            }

            return new SurveyDataset(
                catalog.withReplacedVariables(observedVariables),
                columns,
                observations.size(),
                catalog.size());
        }
    }

    /**
     * Creates a new SurveyDataset builder with no catalog and no observations.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static Set<Integer> observedCodes(Integer[] column) {
        Set<Integer> codes = new TreeSet<>();
        for (Integer value : column) {
            if (value != null) {
                codes.add(value);
            }
        }
        return codes;
    }

    private SurveyDataset(VariableCatalog catalog, Map<String, Integer[]> columns, int observationCount,
        int originalVariableCount) {
        this.catalog = catalog;
        this.columns = columns; // callers never retain a reference that they modify
        this.observationCount = observationCount;
        this.originalVariableCount = originalVariableCount;
    }

    /**
     * Creates a dataset with the same data as this one, but whose metadata is replaced.  This is how the kinds decided
     * by {@link VariableClassifier} are attached to the variables.
     *
     * @param replacements
     *     Variables with the same names as variables in this dataset.
     *
     * @return A new dataset.
     */
    SurveyDataset withReplacedVariables(List<Variable> replacements) {
        return new SurveyDataset(
            catalog.withReplacedVariables(replacements),
            columns,
            observationCount,
            originalVariableCount);
    }

    /**
     * Creates a dataset that has all of this dataset's variables and data plus one derived variable.
     * <p>
     * This dataset is not modified.
     * </p>
     *
     * @param variable
     *     The derived variable.
     * @param values
     *     The derived variable's value for each observation, in observation order.  A {@code null} entry is a
     *     missing value. This list is copied.
     *
     * @return A new dataset with the same number of observations.
     *
     * @throws NullPointerException
     *     if {@code variable} or {@code values} is {@code null}.
     * @throws InvalidSurveyDataException
     *     if {@code values} doesn't have one value per observation or {@code variable}'s name is already used.
     */
    public SurveyDataset withDerivedVariable(Variable variable, List<Integer> values) {
        ArgumentUtil.checkNotNull(variable, "variable");
        ArgumentUtil.checkNotNull(values, "values");
        if (values.size() != observationCount) {
            throw new InvalidSurveyDataException(
                "derived variable \"" + variable.name() + "\" has " + values.size() + " values but the dataset has " +
                    observationCount + " observations");
        }

        Integer[] column = values.toArray(new Integer[0]);
        VariableCatalog newCatalog = catalog.withAppendedVariables(
            List.of(variable.withObservedCodes(observedCodes(column))));

        Map<String, Integer[]> newColumns = new HashMap<>(columns);
        newColumns.put(variable.name(), column);
        return new SurveyDataset(newCatalog, newColumns, observationCount, originalVariableCount);
    }

    /**
     * Gets this dataset's metadata.
     *
     * @return The catalog of variables, including derived variables. This is never {@code null}.
     */
    public VariableCatalog catalog() {
        return catalog;
    }

    /**
     * Gets a variable by name.
     *
     * @param name
     *     The variable's name.
     *
     * @return The variable.
     *
     * @throws InvalidSurveyDataException
     *     if there is no such variable.
     */
    public Variable variable(String name) {
        return catalog.variable(name);
    }

    /**
     * Gets the number of observations (respondents).
     *
     * @return The number of observations. Deriving variables never changes this.
     */
    public int observationCount() {
        return observationCount;
    }

    /**
     * Gets the variables that were part of the survey, in their original order.
     *
     * @return The original variables. The returned list is not modifiable.
     */
    public List<Variable> originalVariables() {
        return catalog.variables().subList(0, originalVariableCount);
    }

    /**
     * Gets the variables that were derived from the survey, in the order in which they were added.
     *
     * @return The derived variables. The returned list is not modifiable.
     */
    public List<Variable> derivedVariables() {
        return catalog.variables().subList(originalVariableCount, catalog.size());
    }

    /**
     * Determines if a variable was derived rather than part of the original survey.
     *
     * @param name
     *     The variable's name.
     *
     * @return {@code true} if the variable was added by {@link #withDerivedVariable}.
     */
    public boolean isDerived(String name) {
        return originalVariableCount <= catalog.indexOf(name);
    }

    /**
     * Gets one value.
     *
     * @param observation
     *     The zero-based observation number.
     * @param variableName
     *     The variable's name.
     *
     * @return The value, or {@code null} if it is missing.
     *
     * @throws InvalidSurveyDataException
     *     if there is no such variable.
     * @throws IndexOutOfBoundsException
     *     if {@code observation} is not a valid observation number.
     */
    public Integer value(int observation, String variableName) {
        return columnArray(variableName)[observation];
    }

    /**
     * Gets all values of one variable.
     *
     * @param variableName
     *     The variable's name.
     *
     * @return The values in observation order, with {@code null} for missing values. The returned list is not
     *     modifiable.
     *
     * @throws InvalidSurveyDataException
     *     if there is no such variable.
     */
    public List<Integer> column(String variableName) {
        final Integer[] column = columnArray(variableName);
        return new AbstractList<>() {
            @Override
            public Integer get(int index) {
                return column[index];
            }

            @Override
            public int size() {
                return column.length;
            }
        };
    }

    /**
     * Gets a read-only view of one respondent.
     *
     * @param observation
     *     The zero-based observation number.
     *
     * @return The respondent.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code observation} is not a valid observation number.
     */
    public Respondent respondent(int observation) {
        if (observation < 0 || observationCount <= observation) {
            throw new IndexOutOfBoundsException(
                "observation " + observation + " is out of range for " + observationCount + " observations");
        }
        return new Respondent(this, observation);
    }

    /**
     * Gets read-only views of all respondents.
     *
     * @return The respondents in observation order.  The returned list is not modifiable.
     */
    public List<Respondent> respondents() {
        List<Respondent> respondents = new ArrayList<>(observationCount);
        for (int i = 0; i < observationCount; i++) {
            respondents.add(new Respondent(this, i));
        }
        return Collections.unmodifiableList(respondents);
    }

    private Integer[] columnArray(String variableName) {
        Integer[] column = columns.get(variableName);
        if (column == null) {
            throw new InvalidSurveyDataException("there is no variable named \"" + variableName + "\"");
        }
        return column;
    }
}
