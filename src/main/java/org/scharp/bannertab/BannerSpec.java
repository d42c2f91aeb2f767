///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The grouping (banner) variables by which a banner table is split, and optionally the variables that form its rows.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link BannerSpec.Builder}:
 * </p>
 * <pre>
 * BannerSpec bannerSpec = BannerSpec.builder().
 *     bannerVariables(List.of("REGION", "GENDER")).
 *     categoryOrder("REGION", List.of(3, 1, 2)).
 *     build();
 * </pre>
 *
 * <p>
 * A banner variable's columns are its categories in the order given to {@link Builder#categoryOrder}, or its coded
 * values in ascending order if no order was given.  When no row variables are given, the rows are chosen from the
 * variables' kinds by {@link BannerTableAssembler}.
 * </p>
 */
public final class BannerSpec {

    /**
     * A spec with no banner variables.  A pipeline that is given this must ask which banner variables to use.
     */
    public static final BannerSpec EMPTY = builder().build();

    private final List<String> bannerVariables;
    private final Map<String, List<Integer>> categoryOrders;
    private final List<String> rowVariables;

    /**
     * A builder class for {@link BannerSpec}.
     */
    public final static class Builder {
        private final List<String> bannerVariables;
        private final Map<String, List<Integer>> categoryOrders;
        private List<String> rowVariables;

        private Builder() {
            this.bannerVariables = new ArrayList<>();
            this.categoryOrders = new LinkedHashMap<>();
            this.rowVariables = null; // chosen from the variable kinds
        }

        /**
         * Adds banner variables, in the order of their column groups.
         *
         * @param names
         *     The names of the banner variables.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code names} is {@code null} or contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if a variable is given twice.
         */
        public Builder bannerVariables(List<String> names) {
            ArgumentUtil.checkNotNull(names, "bannerVariables");
            ArgumentUtil.checkNoNullEntries(names, "bannerVariables");

            for (String name : names) {
                bannerVariable(name);
            }
            return this;
        }

        /**
         * Adds one banner variable after the ones already added.
         *
         * @param name
         *     The name of the banner variable.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if the variable was already added.
         */
        public Builder bannerVariable(String name) {
            ArgumentUtil.checkNotNull(name, "bannerVariable");
            if (bannerVariables.contains(name)) {
                throw new IllegalArgumentException("\"" + name + "\" is already a banner variable");
            }

            bannerVariables.add(name);
            return this;
        }

        /**
         * Sets the order of a banner variable's columns.  Categories which are not listed don't get a column.
         *
         * @param bannerVariable
         *     The name of the banner variable.
         * @param categoryCodes
         *     The categories in column order.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if an argument is {@code null} or {@code categoryCodes} contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if {@code categoryCodes} is empty or lists a code twice.
         */
        public Builder categoryOrder(String bannerVariable, List<Integer> categoryCodes) {
            ArgumentUtil.checkNotNull(bannerVariable, "bannerVariable");
            ArgumentUtil.checkNotNull(categoryCodes, "categoryCodes");
            ArgumentUtil.checkNoNullEntries(categoryCodes, "categoryCodes");
            if (categoryCodes.isEmpty()) {
                throw new IllegalArgumentException("categoryCodes must not be empty");
            }
            if (new HashSet<>(categoryCodes).size() != categoryCodes.size()) {
                throw new IllegalArgumentException("categoryCodes must not contain a code twice");
            }

            categoryOrders.put(bannerVariable, List.copyOf(categoryCodes));
            return this;
        }

        /**
         * Sets the row variables explicitly.  They are tabulated in the given order, whatever their kind.
         *
         * @param names
         *     The names of the row variables.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code names} is {@code null} or contains a {@code null} entry.
         */
        public Builder rowVariables(List<String> names) {
            ArgumentUtil.checkNotNull(names, "rowVariables");
            ArgumentUtil.checkNoNullEntries(names, "rowVariables");

            this.rowVariables = List.copyOf(names);
            return this;
        }

        /**
         * Builds the immutable {@code BannerSpec}.
         *
         * @return A {@code BannerSpec}
         *
         * @throws IllegalStateException
         *     if a category order was given for a variable that isn't a banner variable.
         */
        public BannerSpec build() {
            for (String name : categoryOrders.keySet()) {
                if (!bannerVariables.contains(name)) {
                    throw new IllegalStateException(
                        "a category order was given for \"" + name + "\", which is not a banner variable");
                }
            }
            return new BannerSpec(new ArrayList<>(bannerVariables), new LinkedHashMap<>(categoryOrders),
                rowVariables);
        }
    }

    /**
     * Creates a new BannerSpec builder with no banner variables.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private BannerSpec(List<String> bannerVariables, Map<String, List<Integer>> categoryOrders,
        List<String> rowVariables) {
        this.bannerVariables = bannerVariables;
        this.categoryOrders = categoryOrders;
        this.rowVariables = rowVariables;
    }

    /**
     * Creates a copy of this spec with different banner variables.  Category orders for variables that are no longer
     * banner variables are dropped.
     *
     * @param newBannerVariables
     *     The names of the banner variables.
     *
     * @return A new spec.
     */
    BannerSpec withBannerVariables(List<String> newBannerVariables) {
        Builder builder = builder().bannerVariables(newBannerVariables);
        for (Map.Entry<String, List<Integer>> entry : categoryOrders.entrySet()) {
            if (newBannerVariables.contains(entry.getKey())) {
                builder.categoryOrder(entry.getKey(), entry.getValue());
            }
        }
        if (rowVariables != null) {
            builder.rowVariables(rowVariables);
        }
        return builder.build();
    }

    /**
     * Checks that every variable named by this spec exists.
     *
     * @param catalog
     *     The catalog against which to check, which should include any recoded variables.
     *
     * @throws InvalidSurveyDataException
     *     if a banner variable or a row variable is not in {@code catalog}.
     */
    public void validate(VariableCatalog catalog) {
        ArgumentUtil.checkNotNull(catalog, "catalog");

        for (String name : bannerVariables) {
            if (!catalog.contains(name)) {
                throw new InvalidSurveyDataException("banner variable \"" + name + "\" is not in the survey");
            }
        }
        if (rowVariables != null) {
            Set<String> seen = new HashSet<>();
            for (String name : rowVariables) {
                if (!catalog.contains(name)) {
                    throw new InvalidSurveyDataException("row variable \"" + name + "\" is not in the survey");
                }
                if (!seen.add(name)) {
                    throw new InvalidSurveyDataException("row variable \"" + name + "\" is listed twice");
                }
            }
        }
    }

    /**
     * Determines if this spec has no banner variables.
     *
     * @return {@code true} if there are no banner variables.
     */
    public boolean isEmpty() {
        return bannerVariables.isEmpty();
    }

    /**
     * Gets the banner variables.
     *
     * @return The names of the banner variables in column order. The returned list is not modifiable.
     */
    public List<String> bannerVariables() {
        return Collections.unmodifiableList(bannerVariables);
    }

    /**
     * Gets the explicit category order of a banner variable.
     *
     * @param bannerVariable
     *     The name of the banner variable.
     *
     * @return The category codes in column order, or {@code null} if the coded values are used in ascending order.
     */
    public List<Integer> categoryOrder(String bannerVariable) {
        return categoryOrders.get(bannerVariable);
    }

    /**
     * Determines if the row variables were set explicitly.
     *
     * @return {@code true} if {@link #rowVariables()} gives the rows.
     */
    public boolean hasExplicitRowVariables() {
        return rowVariables != null;
    }

    /**
     * Gets the explicit row variables.
     *
     * @return The names of the row variables, or an empty list if they weren't set.
     */
    public List<String> rowVariables() {
        return rowVariables == null ? List.of() : rowVariables;
    }

    @Override
    public String toString() {
        return "BannerSpec" + bannerVariables + (rowVariables == null ? "" : " rows " + rowVariables);
    }
}
