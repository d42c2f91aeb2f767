///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The decisions a person made about a survey, which a {@link BannerPipeline} uses in place of its heuristics.
 * <p>
 * A decision record answers the questions of one or more {@link PendingDecision}s.  It can decide the kind of a
 * variable, accept an uncertain classification as it is, change or prevent the recoding of an ordinal scale, confirm
 * the recoding, choose the banner variables, and approve the audit.  Decisions about variables are keyed by variable
 * name.
 * </p><p>
 * Instances of this class are immutable.  They are created with a {@link DecisionRecord.Builder}:
 * </p>
 * <pre>
 * DecisionRecord decisions = DecisionRecord.builder().
 *     kind("Q12", VariableKind.NOMINAL).
 *     recodingSpec("Q3", RecodingSpec.parse("top3")).
 *     bannerVariables(List.of("REGION")).
 *     approveAudit().
 *     build();
 * </pre>
 */
public final class DecisionRecord {

    /** A record with no decisions. */
    public static final DecisionRecord EMPTY = builder().build();

    private final Map<String, VariableKind> kinds;
    private final Set<String> acknowledgedClassifications;
    private final Map<String, RecodingSpec> recodingSpecs;
    private final Set<String> recodingExclusions;
    private final boolean recodingConfirmed;
    private final List<String> bannerVariables;
    private final boolean auditApproved;

    /**
     * A builder class for {@link DecisionRecord}.
     */
    public final static class Builder {
        private final Map<String, VariableKind> kinds;
        private final Set<String> acknowledgedClassifications;
        private final Map<String, RecodingSpec> recodingSpecs;
        private final Set<String> recodingExclusions;
        private boolean recodingConfirmed;
        private List<String> bannerVariables;
        private boolean auditApproved;

        private Builder() {
            kinds = new LinkedHashMap<>();
            acknowledgedClassifications = new LinkedHashSet<>();
            recodingSpecs = new LinkedHashMap<>();
            recodingExclusions = new LinkedHashSet<>();
            recodingConfirmed = false;
            bannerVariables = null; // not decided
            auditApproved = false;
        }

        /**
         * Decides the kind of a variable.
         *
         * @param variableName
         *     The name of the variable.
         * @param kind
         *     Its kind.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if either argument is {@code null}.
         */
        public Builder kind(String variableName, VariableKind kind) {
            ArgumentUtil.checkNotNull(variableName, "variableName");
            ArgumentUtil.checkNotNull(kind, "kind");

            kinds.put(variableName, kind);
            return this;
        }

        /**
         * Accepts the heuristic classification of a variable even though it is uncertain.  The variable stays
         * {@link VariableKind#UNCLASSIFIED}, so it is not recoded; use {@link #kind} to make it an ordinal scale.
         *
         * @param variableName
         *     The name of the variable.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code variableName} is {@code null}.
         */
        public Builder acknowledgeClassification(String variableName) {
            ArgumentUtil.checkNotNull(variableName, "variableName");

            acknowledgedClassifications.add(variableName);
            return this;
        }

        /**
         * Decides how an ordinal scale is recoded.
         *
         * @param variableName
         *     The name of the variable.
         * @param spec
         *     The recoding.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if either argument is {@code null}.
         */
        public Builder recodingSpec(String variableName, RecodingSpec spec) {
            ArgumentUtil.checkNotNull(variableName, "variableName");
            ArgumentUtil.checkNotNull(spec, "spec");

            recodingSpecs.put(variableName, spec);
            return this;
        }

        /**
         * Decides that an ordinal scale is shown as it is, without a recoded variable.
         *
         * @param variableName
         *     The name of the variable.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code variableName} is {@code null}.
         */
        public Builder excludeFromRecoding(String variableName) {
            ArgumentUtil.checkNotNull(variableName, "variableName");

            recodingExclusions.add(variableName);
            return this;
        }

        /**
         * Confirms the recoding of every ordinal scale, as suggested or as decided by this record.
         *
         * @return This builder
         */
        public Builder confirmRecoding() {
            recodingConfirmed = true;
            return this;
        }

        /**
         * Chooses the banner variables.
         *
         * @param names
         *     The names of the banner variables, in column order.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code names} is {@code null} or contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if {@code names} is empty.
         */
        public Builder bannerVariables(List<String> names) {
            ArgumentUtil.checkNotNull(names, "bannerVariables");
            ArgumentUtil.checkNoNullEntries(names, "bannerVariables");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("bannerVariables must not be empty");
            }

            bannerVariables = List.copyOf(names);
            return this;
        }

        /**
         * Approves the audit.
         *
         * @return This builder
         */
        public Builder approveAudit() {
            auditApproved = true;
            return this;
        }

        /**
         * Builds the immutable {@code DecisionRecord}.
         *
         * @return A {@code DecisionRecord}
         */
        public DecisionRecord build() {
            return new DecisionRecord(
                new LinkedHashMap<>(kinds),
                new LinkedHashSet<>(acknowledgedClassifications),
                new LinkedHashMap<>(recodingSpecs),
                new LinkedHashSet<>(recodingExclusions),
                recodingConfirmed,
                bannerVariables,
                auditApproved);
        }
    }

    /**
     * Creates a new DecisionRecord builder with no decisions.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private DecisionRecord(Map<String, VariableKind> kinds, Set<String> acknowledgedClassifications,
        Map<String, RecodingSpec> recodingSpecs, Set<String> recodingExclusions, boolean recodingConfirmed,
        List<String> bannerVariables, boolean auditApproved) {
        this.kinds = kinds;
        this.acknowledgedClassifications = acknowledgedClassifications;
        this.recodingSpecs = recodingSpecs;
        this.recodingExclusions = recodingExclusions;
        this.recodingConfirmed = recodingConfirmed;
        this.bannerVariables = bannerVariables;
        this.auditApproved = auditApproved;
    }

    /**
     * Gets the decided kinds.
     *
     * @return A map from variable name to kind. The returned map is not modifiable.
     */
    public Map<String, VariableKind> kinds() {
        return Collections.unmodifiableMap(kinds);
    }

    /**
     * Determines if the classification of a variable was settled, either by deciding its kind or by accepting the
     * heuristic.
     *
     * @param variableName
     *     The name of the variable.
     *
     * @return {@code true} if the variable's classification needs no review.
     */
    public boolean isClassificationSettled(String variableName) {
        return kinds.containsKey(variableName) || acknowledgedClassifications.contains(variableName);
    }

    /**
     * Gets the variables whose uncertain classification was accepted.
     *
     * @return The variable names. The returned set is not modifiable.
     */
    public Set<String> acknowledgedClassifications() {
        return Collections.unmodifiableSet(acknowledgedClassifications);
    }

    /**
     * Gets the decided recodings.
     *
     * @return A map from variable name to recoding. The returned map is not modifiable.
     */
    public Map<String, RecodingSpec> recodingSpecs() {
        return Collections.unmodifiableMap(recodingSpecs);
    }

    /**
     * Gets the ordinal scales that should not be recoded.
     *
     * @return The variable names. The returned set is not modifiable.
     */
    public Set<String> recodingExclusions() {
        return Collections.unmodifiableSet(recodingExclusions);
    }

    /**
     * Determines if the recoding of a variable was settled.
     *
     * @param variableName
     *     The name of the variable.
     *
     * @return {@code true} if the recoding was confirmed as a whole or decided for this variable.
     */
    public boolean isRecodingSettled(String variableName) {
        return recodingConfirmed || recodingSpecs.containsKey(variableName) ||
            recodingExclusions.contains(variableName);
    }

    /**
     * @return {@code true} if the recoding was confirmed as a whole.
     */
    public boolean recodingConfirmed() {
        return recodingConfirmed;
    }

    /**
     * Gets the chosen banner variables.
     *
     * @return The names of the banner variables, or {@code null} if they weren't chosen.
     */
    public List<String> bannerVariables() {
        return bannerVariables;
    }

    /**
     * @return {@code true} if the audit was approved.
     */
    public boolean auditApproved() {
        return auditApproved;
    }
}
