///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.List;

/**
 * The settings of a {@link BannerPipeline}.
 * <p>
 * Every setting has a default, so {@link #DEFAULT} is a complete configuration that recodes ordinal scales as
 * top-2-box, hides empty banner columns, includes a Total column, tests significance at the 0.05 and 0.10 levels, and
 * never stops to ask for a decision unless it has to choose the banner variables.
 * </p><p>
 * Instances of this class are immutable.  They are created with a {@link PipelineConfig.Builder}:
 * </p>
 * <pre>
 * PipelineConfig config = PipelineConfig.builder().
 *     recodingConfig(RecodingConfig.builder().defaultSpec(RecodingSpec.parse("top3")).build()).
 *     skipEmptyBannerColumns(false).
 *     parallelism(4).
 *     build();
 * </pre>
 */
public final class PipelineConfig {

    /** The configuration with every setting at its default. */
    public static final PipelineConfig DEFAULT = builder().build();

    private final RecodingConfig recodingConfig;
    private final boolean skipEmptyBannerColumns;
    private final boolean includeTotalColumn;
    private final boolean runSignificanceTests;
    private final double significanceLevel;
    private final double marginalSignificanceLevel;
    private final double minimumExpectedFrequency;
    private final boolean continuityCorrection;
    private final List<String> additionalMissingPhrases;
    private final int maximumBannerSuggestions;
    private final int parallelism;
    private final boolean reviewClassifications;
    private final boolean reviewRecoding;
    private final boolean requireAuditApproval;

    /**
     * A builder class for {@link PipelineConfig}.
     */
    public final static class Builder {
        private RecodingConfig recodingConfig;
        private boolean skipEmptyBannerColumns;
        private boolean includeTotalColumn;
        private boolean runSignificanceTests;
        private double significanceLevel;
        private double marginalSignificanceLevel;
        private double minimumExpectedFrequency;
        private boolean continuityCorrection;
        private List<String> additionalMissingPhrases;
        private int maximumBannerSuggestions;
        private int parallelism;
        private boolean reviewClassifications;
        private boolean reviewRecoding;
        private boolean requireAuditApproval;

        private Builder() {
            recodingConfig = RecodingConfig.DEFAULT;
            skipEmptyBannerColumns = true;
            includeTotalColumn = true;
            runSignificanceTests = true;
            significanceLevel = 0.05;
            marginalSignificanceLevel = 0.10;
            minimumExpectedFrequency = 5.0;
            continuityCorrection = false;
            additionalMissingPhrases = List.of();
            maximumBannerSuggestions = 5;
            parallelism = 1;
            reviewClassifications = false;
            reviewRecoding = false;
            requireAuditApproval = false;
        }

        /**
         * Sets which recoding is applied to each ordinal scale.  The default is top-2-box for every scale.
         *
         * @param recodingConfig
         *     The recoding configuration.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code recodingConfig} is {@code null}.
         */
        public Builder recodingConfig(RecodingConfig recodingConfig) {
            ArgumentUtil.checkNotNull(recodingConfig, "recodingConfig");

            this.recodingConfig = recodingConfig;
            return this;
        }

        /**
         * Sets whether banner columns without any respondents are hidden.  The default is {@code true}.  When
         * {@code false}, such columns are shown with {@value CrosstabCell#NOT_COMPUTABLE} in every cell.
         *
         * @param skipEmptyBannerColumns
         *     Whether to hide empty columns.
         *
         * @return This builder
         */
        public Builder skipEmptyBannerColumns(boolean skipEmptyBannerColumns) {
            this.skipEmptyBannerColumns = skipEmptyBannerColumns;
            return this;
        }

        /**
         * Sets whether the table starts with a Total column.  The default is {@code true}.
         *
         * @param includeTotalColumn
         *     Whether to add the Total column.
         *
         * @return This builder
         */
        public Builder includeTotalColumn(boolean includeTotalColumn) {
            this.includeTotalColumn = includeTotalColumn;
            return this;
        }

        /**
         * Sets whether to run chi-square tests.  The default is {@code true}.
         *
         * @param runSignificanceTests
         *     Whether to test significance.
         *
         * @return This builder
         */
        public Builder runSignificanceTests(boolean runSignificanceTests) {
            this.runSignificanceTests = runSignificanceTests;
            return this;
        }

        /**
         * Sets the p-value below which a result is significant.  The default is 0.05.
         *
         * @param significanceLevel
         *     The level.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code significanceLevel} is not between 0 and 1.
         */
        public Builder significanceLevel(double significanceLevel) {
            ArgumentUtil.checkProbability(significanceLevel, "significanceLevel");

            this.significanceLevel = significanceLevel;
            return this;
        }

        /**
         * Sets the p-value below which a result is marginally significant.  The default is 0.10.
         *
         * @param marginalSignificanceLevel
         *     The level.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code marginalSignificanceLevel} is not between 0 and 1.
         */
        public Builder marginalSignificanceLevel(double marginalSignificanceLevel) {
            ArgumentUtil.checkProbability(marginalSignificanceLevel, "marginalSignificanceLevel");

            this.marginalSignificanceLevel = marginalSignificanceLevel;
            return this;
        }

        /**
         * Sets the expected cell frequency below which a test is marked as low power.  The default is 5.
         *
         * @param minimumExpectedFrequency
         *     The frequency.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code minimumExpectedFrequency} is negative.
         */
        public Builder minimumExpectedFrequency(double minimumExpectedFrequency) {
            ArgumentUtil.checkNotNegative(minimumExpectedFrequency, "minimumExpectedFrequency");

            this.minimumExpectedFrequency = minimumExpectedFrequency;
            return this;
        }

        /**
         * Sets whether Yates' continuity correction is applied to 2x2 tables.  The default is {@code false}.
         *
         * @param continuityCorrection
         *     Whether to correct.
         *
         * @return This builder
         */
        public Builder continuityCorrection(boolean continuityCorrection) {
            this.continuityCorrection = continuityCorrection;
            return this;
        }

        /**
         * Sets phrases which mark a value label as non-substantive, in addition to the built-in ones.
         *
         * @param additionalMissingPhrases
         *     The phrases.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code additionalMissingPhrases} is {@code null} or contains a {@code null} entry.
         */
        public Builder additionalMissingPhrases(List<String> additionalMissingPhrases) {
            ArgumentUtil.checkNotNull(additionalMissingPhrases, "additionalMissingPhrases");
            ArgumentUtil.checkNoNullEntries(additionalMissingPhrases, "additionalMissingPhrases");

            this.additionalMissingPhrases = List.copyOf(additionalMissingPhrases);
            return this;
        }

        /**
         * Sets how many banner variables are suggested when none were given.  The default is 5.
         *
         * @param maximumBannerSuggestions
         *     The number of suggestions.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code maximumBannerSuggestions} is not positive.
         */
        public Builder maximumBannerSuggestions(int maximumBannerSuggestions) {
            ArgumentUtil.checkPositive(maximumBannerSuggestions, "maximumBannerSuggestions");

            this.maximumBannerSuggestions = maximumBannerSuggestions;
            return this;
        }

        /**
         * Sets the number of threads that tabulate.  The default is 1, which tabulates on the calling thread.
         *
         * @param parallelism
         *     The number of threads.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code parallelism} is not positive.
         */
        public Builder parallelism(int parallelism) {
            ArgumentUtil.checkPositive(parallelism, "parallelism");

            this.parallelism = parallelism;
            return this;
        }

        /**
         * Sets whether uncertain classifications stop the pipeline until they are decided.  The default is
         * {@code false}, in which case they are only reported as warnings.
         *
         * @param reviewClassifications
         *     Whether to stop for review.
         *
         * @return This builder
         */
        public Builder reviewClassifications(boolean reviewClassifications) {
            this.reviewClassifications = reviewClassifications;
            return this;
        }

        /**
         * Sets whether the pipeline stops to confirm the recoding of each ordinal scale.  The default is
         * {@code false}.
         *
         * @param reviewRecoding
         *     Whether to stop for review.
         *
         * @return This builder
         */
        public Builder reviewRecoding(boolean reviewRecoding) {
            this.reviewRecoding = reviewRecoding;
            return this;
        }

        /**
         * Sets whether the pipeline stops after the audit until the audit is approved.  The default is
         * {@code false}.
         *
         * @param requireAuditApproval
         *     Whether to stop for approval.
         *
         * @return This builder
         */
        public Builder requireAuditApproval(boolean requireAuditApproval) {
            this.requireAuditApproval = requireAuditApproval;
            return this;
        }

        /**
         * Builds the immutable {@code PipelineConfig}.
         *
         * @return A {@code PipelineConfig}
         *
         * @throws IllegalStateException
         *     if the marginal significance level is less than the significance level.
         */
        public PipelineConfig build() {
            if (marginalSignificanceLevel < significanceLevel) {
                throw new IllegalStateException("marginalSignificanceLevel (" + marginalSignificanceLevel +
                    ") must not be less than significanceLevel (" + significanceLevel + ")");
            }
            return new PipelineConfig(this);
        }
    }

    /**
     * Creates a new PipelineConfig builder with every setting at its default.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private PipelineConfig(Builder builder) {
        recodingConfig = builder.recodingConfig;
        skipEmptyBannerColumns = builder.skipEmptyBannerColumns;
        includeTotalColumn = builder.includeTotalColumn;
        runSignificanceTests = builder.runSignificanceTests;
        significanceLevel = builder.significanceLevel;
        marginalSignificanceLevel = builder.marginalSignificanceLevel;
        minimumExpectedFrequency = builder.minimumExpectedFrequency;
        continuityCorrection = builder.continuityCorrection;
        additionalMissingPhrases = builder.additionalMissingPhrases;
        maximumBannerSuggestions = builder.maximumBannerSuggestions;
        parallelism = builder.parallelism;
        reviewClassifications = builder.reviewClassifications;
        reviewRecoding = builder.reviewRecoding;
        requireAuditApproval = builder.requireAuditApproval;
    }

    /**
     * Creates a significance tester with this configuration's levels.
     *
     * @return A new tester.
     */
    SignificanceTester newSignificanceTester() {
        return new SignificanceTester(significanceLevel, marginalSignificanceLevel, minimumExpectedFrequency,
            continuityCorrection);
    }

    /**
     * Creates a copy of this configuration with a different recoding configuration.
     *
     * @param newRecodingConfig
     *     The recoding configuration.
     *
     * @return A new configuration.
     */
    PipelineConfig withRecodingConfig(RecodingConfig newRecodingConfig) {
        Builder builder = new Builder();
        builder.recodingConfig = newRecodingConfig;
        builder.skipEmptyBannerColumns = skipEmptyBannerColumns;
        builder.includeTotalColumn = includeTotalColumn;
        builder.runSignificanceTests = runSignificanceTests;
        builder.significanceLevel = significanceLevel;
        builder.marginalSignificanceLevel = marginalSignificanceLevel;
        builder.minimumExpectedFrequency = minimumExpectedFrequency;
        builder.continuityCorrection = continuityCorrection;
        builder.additionalMissingPhrases = additionalMissingPhrases;
        builder.maximumBannerSuggestions = maximumBannerSuggestions;
        builder.parallelism = parallelism;
        builder.reviewClassifications = reviewClassifications;
        builder.reviewRecoding = reviewRecoding;
        builder.requireAuditApproval = requireAuditApproval;
        return new PipelineConfig(builder);
    }

    /** @return The recoding configuration. */
    public RecodingConfig recodingConfig() {
        return recodingConfig;
    }

    /** @return {@code true} if banner columns without respondents are hidden. */
    public boolean skipEmptyBannerColumns() {
        return skipEmptyBannerColumns;
    }

    /** @return {@code true} if the table starts with a Total column. */
    public boolean includeTotalColumn() {
        return includeTotalColumn;
    }

    /** @return {@code true} if chi-square tests are run. */
    public boolean runSignificanceTests() {
        return runSignificanceTests;
    }

    /** @return The p-value below which a result is significant. */
    public double significanceLevel() {
        return significanceLevel;
    }

    /** @return The p-value below which a result is marginally significant. */
    public double marginalSignificanceLevel() {
        return marginalSignificanceLevel;
    }

    /** @return The expected cell frequency below which a test has low power. */
    public double minimumExpectedFrequency() {
        return minimumExpectedFrequency;
    }

    /** @return {@code true} if Yates' correction is applied to 2x2 tables. */
    public boolean continuityCorrection() {
        return continuityCorrection;
    }

    /** @return The extra phrases that mark a value label as non-substantive. The list is not modifiable. */
    public List<String> additionalMissingPhrases() {
        return additionalMissingPhrases;
    }

    /** @return How many banner variables are suggested. */
    public int maximumBannerSuggestions() {
        return maximumBannerSuggestions;
    }

    /** @return The number of threads that tabulate. */
    public int parallelism() {
        return parallelism;
    }

    /** @return {@code true} if uncertain classifications stop the pipeline. */
    public boolean reviewClassifications() {
        return reviewClassifications;
    }

    /** @return {@code true} if recoding stops the pipeline for confirmation. */
    public boolean reviewRecoding() {
        return reviewRecoding;
    }

    /** @return {@code true} if the pipeline stops for audit approval. */
    public boolean requireAuditApproval() {
        return requireAuditApproval;
    }
}
