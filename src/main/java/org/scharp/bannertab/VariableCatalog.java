///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The metadata of a survey: its name and its variables, in the order in which they appear in the survey.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link VariableCatalog.Builder}:
 * </p>
 * <pre>
 * VariableCatalog catalog = VariableCatalog.builder().
 *     surveyName("Customer satisfaction 2025").
 *     variables(
 *         List.of(
 *             Variable.builder().
 *                 name("REGION").
 *                 label("Region of residence").
 *                 valueLabel(1, "North").
 *                 valueLabel(2, "South").
 *                 valueLabel(3, "West").
 *                 build(),
 *
 *             Variable.builder().
 *                 name("Q1").
 *                 label("How satisfied are you with our service?").
 *                 valueLabel(1, "Very dissatisfied").
 *                 valueLabel(5, "Very satisfied").
 *                 build()
 *     )).build();
 * </pre>
 */
public final class VariableCatalog {
    private final String surveyName;
    private final List<Variable> variables;
    private final Map<String, Integer> indexByName;

    /**
     * A builder class for {@link VariableCatalog}.
     */
    public final static class Builder {
        private String surveyName;
        private List<Variable> variables;

        /**
         * Creates a {@code VariableCatalog} builder initialized with a blank survey name and no variables.
         */
        private Builder() {
            this.surveyName = "";
            this.variables = List.of();
        }

        /**
         * Sets the survey's name.
         *
         * @param surveyName
         *     The survey's name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code surveyName} is {@code null}.
         */
        public Builder surveyName(String surveyName) {
            ArgumentUtil.checkNotNull(surveyName, "surveyName");

            this.surveyName = surveyName;
            return this;
        }

        /**
         * Sets the survey's variables.
         *
         * @param variables
         *     A list of variables given in the order in which they appear in the survey. This list is copied, so
         *     subsequent changes to the list do not impact this builder or the resulting {@code VariableCatalog}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code variables} is {@code null} or contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if {@code variables} is empty.
         * @throws InvalidSurveyDataException
         *     if {@code variables} contains two variables with the same name.
         */
        public Builder variables(List<Variable> variables) {
            // Check that the variables list is well-formed
            ArgumentUtil.checkNotNull(variables, "variables");
            if (variables.isEmpty()) {
                throw new IllegalArgumentException("variables must not be empty");
            }

            // Copy the variables while checking for null entries and duplicate names.
            List<Variable> newList = new ArrayList<>(variables.size());
            Map<String, Integer> names = new HashMap<>(variables.size() * 2);
            for (Variable variable : variables) {
                if (variable == null) {
                    throw new NullPointerException("variables cannot contain a null entry");
                }
                if (names.put(variable.name(), newList.size()) != null) {
                    throw new InvalidSurveyDataException(
                        "variables contains two variables named \"" + variable.name() + "\"");
                }
                newList.add(variable);
            }

            // Now that the input has been validated, we can commit to using its copy.
            this.variables = newList;
            return this;
        }

        /**
         * Builds the immutable {@code VariableCatalog} with the configured options.
         *
         * @return A {@code VariableCatalog}
         *
         * @throws IllegalStateException
         *     if the variables haven't been set.
         */
        public VariableCatalog build() {
            // There is no meaningful default variables, so it's an error if the caller hasn't set them.
            if (variables.isEmpty()) {
                throw new IllegalStateException("variables must be set");
            }
            return new VariableCatalog(surveyName, variables);
        }
    }

    /**
     * Creates a new VariableCatalog builder initialized with a blank survey name and no variables.
     * <p>
     * The variables must be set before invoking {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A private constructor, invoked only by {@link Builder} and the methods that derive a new catalog.
     *
     * @param surveyName
     *     The name of the survey
     * @param variables
     *     A list of uniquely named variables.  The caller must not retain a reference to it.
     */
    private VariableCatalog(String surveyName, List<Variable> variables) {
        this.surveyName = surveyName;
        this.variables = variables;
        this.indexByName = new HashMap<>(variables.size() * 2);
        for (int i = 0; i < variables.size(); i++) {
            indexByName.put(variables.get(i).name(), i);
        }
    }

    /**
     * Creates a catalog in which some variables are replaced by a variable with the same name.
     *
     * @param replacements
     *     The new variables. Each must have the same name as a variable in this catalog.
     *
     * @return A new catalog with the same variable order.
     */
    VariableCatalog withReplacedVariables(List<Variable> replacements) {
        List<Variable> newList = new ArrayList<>(variables);
        for (Variable replacement : replacements) {
            Integer index = indexByName.get(replacement.name());
            assert index != null : replacement.name() + " is not in the catalog";
            newList.set(index, replacement);
        }
        return new VariableCatalog(surveyName, newList);
    }

    /**
     * Creates a catalog that has all of this catalog's variables followed by {@code appended}.
     *
     * @param appended
     *     The variables to append.
     *
     * @return A new catalog.
     *
     * @throws InvalidSurveyDataException
     *     if an appended variable has the same name as an existing variable.
     */
    VariableCatalog withAppendedVariables(List<Variable> appended) {
        List<Variable> newList = new ArrayList<>(variables.size() + appended.size());
        newList.addAll(variables);
        Set<String> names = new HashSet<>(indexByName.keySet());
        for (Variable variable : appended) {
            if (!names.add(variable.name())) {
                throw new InvalidSurveyDataException(
                    "a variable named \"" + variable.name() + "\" already exists");
            }
            newList.add(variable);
        }
        return new VariableCatalog(surveyName, newList);
    }

    /**
     * Gets the name of the survey.
     *
     * @return The survey name. This is never {@code null}.
     */
    public String surveyName() {
        return surveyName;
    }

    /**
     * Gets the survey's variables.
     * <p>
     * The returned list is not modifiable.
     * </p>
     *
     * @return The survey's variables, in order.  This is never {@code null}.
     */
    public List<Variable> variables() {
        return Collections.unmodifiableList(variables);
    }

    /**
     * Gets the number of variables in this catalog.
     *
     * @return The number of variables.
     */
    public int size() {
        return variables.size();
    }

    /**
     * Determines if this catalog has a variable with the given name.
     *
     * @param name
     *     The name of the variable.
     *
     * @return {@code true}, if a variable with that name exists.  {@code false}, otherwise.
     */
    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Gets the position of a variable in this catalog.
     *
     * @param name
     *     The name of the variable.
     *
     * @return The zero-based position of the variable, or -1 if there is no such variable.
     */
    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        return index != null ? index : -1;
    }

    /**
     * Gets a variable by name.
     *
     * @param name
     *     The name of the variable.
     *
     * @return The variable.
     *
     * @throws InvalidSurveyDataException
     *     if there is no variable named {@code name}.
     */
    public Variable variable(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new InvalidSurveyDataException("there is no variable named \"" + name + "\"");
        }
        return variables.get(index);
    }
}
