///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which recoding to apply to each ordinal scale: a default for all variables, per-variable overrides, and variables
 * that should not be recoded at all.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link RecodingConfig.Builder}:
 * </p>
 * <pre>
 * RecodingConfig config = RecodingConfig.builder().
 *     defaultSpec(RecodingSpec.TOP_2_BOX).
 *     spec("Q7", RecodingSpec.parse("top3")).
 *     exclude("Q9").
 *     build();
 * </pre>
 */
public final class RecodingConfig {

    /**
     * Recode every ordinal scale as top-2-box.
     */
    public static final RecodingConfig DEFAULT = builder().build();

    private final RecodingSpec defaultSpec;
    private final Map<String, RecodingSpec> overrides;
    private final Set<String> excludedVariables;

    /**
     * A builder class for {@link RecodingConfig}.
     */
    public final static class Builder {
        private RecodingSpec defaultSpec;
        private final Map<String, RecodingSpec> overrides;
        private final Set<String> excludedVariables;

        private Builder() {
            this.defaultSpec = RecodingSpec.TOP_2_BOX;
            this.overrides = new LinkedHashMap<>();
            this.excludedVariables = new LinkedHashSet<>();
        }

        /**
         * Sets the recoding for variables without an override.
         *
         * @param defaultSpec
         *     The default recoding.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code defaultSpec} is {@code null}.
         */
        public Builder defaultSpec(RecodingSpec defaultSpec) {
            ArgumentUtil.checkNotNull(defaultSpec, "defaultSpec");

            this.defaultSpec = defaultSpec;
            return this;
        }

        /**
         * Sets the recoding for one variable.
         *
         * @param variableName
         *     The name of the variable.
         * @param spec
         *     The recoding to use for it.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if either argument is {@code null}.
         */
        public Builder spec(String variableName, RecodingSpec spec) {
            ArgumentUtil.checkNotNull(variableName, "variableName");
            ArgumentUtil.checkNotNull(spec, "spec");

            overrides.put(variableName, spec);
            return this;
        }

        /**
         * Prevents a variable from being recoded.
         *
         * @param variableName
         *     The name of the variable.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code variableName} is {@code null}.
         */
        public Builder exclude(String variableName) {
            ArgumentUtil.checkNotNull(variableName, "variableName");

            excludedVariables.add(variableName);
            return this;
        }

        /**
         * Builds the immutable {@code RecodingConfig}.
         *
         * @return A {@code RecodingConfig}
         */
        public RecodingConfig build() {
            return new RecodingConfig(
                defaultSpec,
                new LinkedHashMap<>(overrides),
                new LinkedHashSet<>(excludedVariables));
        }
    }

    /**
     * Creates a new RecodingConfig builder whose default is top-2-box, with no overrides or exclusions.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private RecodingConfig(RecodingSpec defaultSpec, Map<String, RecodingSpec> overrides,
        Set<String> excludedVariables) {
        this.defaultSpec = defaultSpec;
        this.overrides = overrides;
        this.excludedVariables = excludedVariables;
    }

    /**
     * Creates a config that applies some more overrides and exclusions on top of this one.
     *
     * @param moreOverrides
     *     Overrides that replace this config's overrides for the same variable.
     * @param moreExclusions
     *     Additional variables to exclude.
     *
     * @return A new config.
     */
    RecodingConfig withDecisions(Map<String, RecodingSpec> moreOverrides, Set<String> moreExclusions) {
        Map<String, RecodingSpec> newOverrides = new LinkedHashMap<>(overrides);
        newOverrides.putAll(moreOverrides);
        Set<String> newExclusions = new LinkedHashSet<>(excludedVariables);
        newExclusions.addAll(moreExclusions);
        return new RecodingConfig(defaultSpec, newOverrides, newExclusions);
    }

    /**
     * Gets the recoding for variables without an override.
     *
     * @return The default recoding. This is never {@code null}.
     */
    public RecodingSpec defaultSpec() {
        return defaultSpec;
    }

    /**
     * Gets the recoding to use for a variable.
     *
     * @param variableName
     *     The name of the variable.
     *
     * @return The variable's override, if any, otherwise the default.
     */
    public RecodingSpec specFor(String variableName) {
        return overrides.getOrDefault(variableName, defaultSpec);
    }

    /**
     * Determines if a variable should not be recoded.
     *
     * @param variableName
     *     The name of the variable.
     *
     * @return {@code true} if the variable was excluded.
     */
    public boolean isExcluded(String variableName) {
        return excludedVariables.contains(variableName);
    }

    /**
     * Gets the per-variable overrides.
     *
     * @return A map from variable name to recoding. The returned map is not modifiable.
     */
    public Map<String, RecodingSpec> overrides() {
        return Collections.unmodifiableMap(overrides);
    }

    /**
     * Gets the excluded variables.
     *
     * @return The names of the excluded variables. The returned set is not modifiable.
     */
    public Set<String> excludedVariables() {
        return Collections.unmodifiableSet(excludedVariables);
    }
}
