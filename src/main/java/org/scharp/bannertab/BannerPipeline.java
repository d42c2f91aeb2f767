///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the stages that turn a survey into a banner table: classification, recoding, banner selection, audit, and
 * tabulation.
 * <p>
 * Each stage returns a {@link StageResult}.  A stage that needs a person's decision doesn't guess; it returns a
 * {@link PendingDecision} instead of its output.  The caller answers it in a {@link DecisionRecord} and runs the stage
 * again.  Which stages stop is controlled by the {@link PipelineConfig}.  With the default configuration, only an
 * empty {@link BannerSpec} stops the pipeline.
 * </p>
 * <pre>
 * BannerPipeline pipeline = new BannerPipeline(PipelineConfig.DEFAULT);
 * StageResult&lt;PipelineOutput&gt; result = pipeline.run(dataset, BannerSpec.EMPTY, DecisionRecord.EMPTY);
 * if (result.isPending()) {
 *     // Nobody chose the banner variables, so the pipeline suggests some and waits.
 *     DecisionRecord decisions = DecisionRecord.builder().
 *         bannerVariables(List.of("GENDER", "REGION")).
 *         build();
 *     result = pipeline.run(dataset, BannerSpec.EMPTY, decisions);
 * }
 * PipelineOutput output = result.value();
 *
 * JsonReportWriter writer = new JsonReportWriter();
 * writer.write(writer.pipelineOutput(output), Path.of("banner.json"));
 * </pre>
 *
 * <p>
 * Only an {@link InvalidSurveyDataException} aborts a run.  Everything else that goes wrong is recorded as a
 * {@link PipelineWarning}.
 * </p>
 */
public final class BannerPipeline {

    private static final Logger logger = LoggerFactory.getLogger(BannerPipeline.class);

    /** The answer that keeps an ordinal scale as it is, without a recoded variable. */
    public static final String KEEP_AS_IS = "as_is";

    /** The answer that approves an audit. */
    public static final String APPROVE = "approve";

    /** The answer that picks a variable as a banner. */
    public static final String USE_AS_BANNER = "banner";

    private static final List<RecodingSpec> SUGGESTED_RECODINGS = List.of(
        RecodingSpec.TOP_2_BOX,
        new RecodingSpec(3, BoxDirection.TOP),
        new RecodingSpec(2, BoxDirection.BOTTOM));

    private final PipelineConfig config;
    private final Clock clock;
    private final MissingCodeResolver missingCodeResolver;
    private final VariableClassifier classifier;
    private final RecodingEngine recodingEngine;

    /**
     * Creates a pipeline.
     *
     * @param config
     *     The configuration.
     */
    public BannerPipeline(PipelineConfig config) {
        this(config, Clock.systemUTC());
    }

    BannerPipeline(PipelineConfig config, Clock clock) {
        ArgumentUtil.checkNotNull(config, "config");
        ArgumentUtil.checkNotNull(clock, "clock");

        this.config = config;
        this.clock = clock;
        this.missingCodeResolver = new MissingCodeResolver(config.additionalMissingPhrases());
        this.classifier = new VariableClassifier();
        this.recodingEngine = new RecodingEngine();
    }

    /**
     * Finds the non-substantive codes of every variable and classifies it.
     * <p>
     * Uncertain classifications are reported as {@link WarningType#CLASSIFICATION_AMBIGUITY} warnings and leave the
     * variable {@link VariableKind#UNCLASSIFIED}, which keeps it out of recoding and banner suggestions.  If
     * {@link PipelineConfig#reviewClassifications()} is set, they also stop this stage until every one of them is
     * settled by {@code decisions}.
     * </p>
     *
     * @param dataset
     *     The survey.
     * @param decisions
     *     Decided kinds, which replace the heuristic.
     *
     * @return The classified survey, or the classifications to review.
     *
     * @throws InvalidSurveyDataException
     *     if {@code decisions} decides the kind of a variable that isn't in {@code dataset}.
     */
    public StageResult<ClassificationResult> classify(SurveyDataset dataset, DecisionRecord decisions) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(decisions, "decisions");
        checkVariablesExist(dataset.catalog(), decisions.kinds().keySet(), "a kind was decided");

        Map<String, MissingCodeSet> missingCodes = missingCodeResolver.resolveAll(dataset.catalog());
        List<Classification> heuristic = classifier.classifyAll(dataset.catalog(), missingCodes);

        WarningLog warnings = new WarningLog(logger);
        List<Classification> classifications = new ArrayList<>(heuristic.size());
        List<DecisionOption> unsettled = new ArrayList<>();
        for (Classification classification : heuristic) {
            String name = classification.variableName();
            VariableKind decidedKind = decisions.kinds().get(name);
            if (decidedKind != null) {
                classifications.add(classification.overriddenBy(decidedKind));
                continue;
            }

            classifications.add(classification);
            if (!classification.confident()) {
                warnings.add(WarningType.CLASSIFICATION_AMBIGUITY, name, null, classification.reason());
                if (!decisions.isClassificationSettled(name)) {
                    unsettled.add(classificationOption(dataset.variable(name), classification));
                }
            }
        }

        if (config.reviewClassifications() && !unsettled.isEmpty()) {
            logger.info("classification is waiting for {} decisions", unsettled.size());
            return StageResult.pending(new PendingDecision(PipelineStage.CLASSIFICATION,
                unsettled.size() + " variables could not be classified with confidence", unsettled));
        }

        List<Variable> classifiedVariables = new ArrayList<>(classifications.size());
        Map<VariableKind, Integer> kindCounts = new EnumMap<>(VariableKind.class);
        for (Classification classification : classifications) {
            Variable variable = dataset.variable(classification.variableName());
            classifiedVariables.add(variable.withKind(classification.kind()));
            kindCounts.merge(classification.kind(), 1, Integer::sum);
        }
        SurveyDataset classifiedDataset = dataset.withReplacedVariables(classifiedVariables);

        List<String> bannerCandidates = bannerCandidates(classifiedDataset.originalVariables(), missingCodes);
        logger.info("classified {} variables {}, {} banner candidates", classifications.size(), kindCounts,
            bannerCandidates.size());

        return StageResult.completed(new ClassificationResult(classifiedDataset, classifications, missingCodes,
            bannerCandidates, warnings.warnings()));
    }

    /**
     * Derives the top-box and bottom-box variables of every ordinal scale.
     * <p>
     * If {@link PipelineConfig#reviewRecoding()} is set, this stage stops until {@code decisions} confirms the
     * recoding or decides it for every ordinal scale.
     * </p>
     *
     * @param classification
     *     The output of {@link #classify}.
     * @param decisions
     *     Decided recodings and exclusions, which replace the configured ones.
     *
     * @return The recoded survey, or the recodings to review.
     *
     * @throws InvalidSurveyDataException
     *     if {@code decisions} names a variable that isn't in the survey or a recoded variable's name is taken.
     */
    public StageResult<RecodeResult> recode(ClassificationResult classification, DecisionRecord decisions) {
        ArgumentUtil.checkNotNull(classification, "classification");
        ArgumentUtil.checkNotNull(decisions, "decisions");

        SurveyDataset dataset = classification.dataset();
        checkVariablesExist(dataset.catalog(), decisions.recodingSpecs().keySet(), "a recoding was decided");
        checkVariablesExist(dataset.catalog(), decisions.recodingExclusions(), "a recoding was excluded");

        RecodingConfig recodingConfig = config.recodingConfig().withDecisions(decisions.recodingSpecs(),
            decisions.recodingExclusions());

        if (config.reviewRecoding()) {
            List<DecisionOption> unsettled = new ArrayList<>();
            for (Variable variable : dataset.originalVariables()) {
                if (variable.kind() == VariableKind.ORDINAL_SCALE && !decisions.isRecodingSettled(variable.name())) {
                    unsettled.add(recodingOption(variable, classification, recodingConfig));
                }
            }
            if (!unsettled.isEmpty()) {
                logger.info("recoding is waiting for {} decisions", unsettled.size());
                return StageResult.pending(new PendingDecision(PipelineStage.RECODING,
                    "confirm how " + unsettled.size() + " ordinal scales are recoded", unsettled));
            }
        }

        return StageResult.completed(recodingEngine.recodeAll(dataset, classification.missingCodes(),
            recodingConfig));
    }

    /**
     * Settles the banner variables.  A non-empty banner spec is used as it is.  An empty one takes the banner
     * variables from {@code decisions}, or stops this stage with the banner candidates as options.
     *
     * @param recodeResult
     *     The output of {@link #recode}.
     * @param bannerSpec
     *     The requested banner spec, which may be empty.
     * @param decisions
     *     The chosen banner variables, if any.
     *
     * @return The banner spec to tabulate, or the banner candidates to choose from.
     *
     * @throws InvalidSurveyDataException
     *     if the banner spec names a variable that isn't in the survey.
     */
    public StageResult<BannerSpec> selectBanners(RecodeResult recodeResult, BannerSpec bannerSpec,
        DecisionRecord decisions) {
        ArgumentUtil.checkNotNull(recodeResult, "recodeResult");
        ArgumentUtil.checkNotNull(bannerSpec, "bannerSpec");
        ArgumentUtil.checkNotNull(decisions, "decisions");

        BannerSpec selected = bannerSpec;
        if (bannerSpec.isEmpty()) {
            if (decisions.bannerVariables() == null) {
                SurveyDataset dataset = recodeResult.dataset();
                List<DecisionOption> options = new ArrayList<>();
                for (String name : bannerCandidates(dataset.originalVariables(), recodeResult.missingCodes())) {
                    options.add(bannerOption(dataset.variable(name)));
                }
                logger.info("banner selection is waiting with {} candidates", options.size());
                return StageResult.pending(new PendingDecision(PipelineStage.BANNER_SELECTION,
                    "choose the banner variables", options));
            }
            selected = bannerSpec.withBannerVariables(decisions.bannerVariables());
        }

        selected.validate(recodeResult.dataset().catalog());
        return StageResult.completed(selected);
    }

    /**
     * Audits the recoded survey against the banner variables.  This stage never stops.
     *
     * @param recodeResult
     *     The output of {@link #recode}.
     * @param bannerSpec
     *     The banner spec, which must not be empty.
     *
     * @return The audit report.
     *
     * @throws InvalidSurveyDataException
     *     if the banner spec names a variable that isn't in the survey.
     */
    public StageResult<AuditReport> audit(RecodeResult recodeResult, BannerSpec bannerSpec) {
        ArgumentUtil.checkNotNull(recodeResult, "recodeResult");
        ArgumentUtil.checkNotNull(bannerSpec, "bannerSpec");

        AuditReport report = AuditReport.create(recodeResult, bannerSpec);
        logger.info("audited {} respondents, {} original and {} recoded variables, {} banner columns",
            report.respondentCount(), report.originalVariableCount(), report.recodedVariableCount(),
            report.bannerColumns().size());
        return StageResult.completed(report);
    }

    /**
     * Produces the banner table.
     * <p>
     * If {@link PipelineConfig#requireAuditApproval()} is set, this stage stops until {@code decisions} approves the
     * audit.  An empty banner spec is settled as {@link #selectBanners} does.
     * </p>
     *
     * @param recodeResult
     *     The output of {@link #recode}.
     * @param bannerSpec
     *     The banner spec.
     * @param decisions
     *     The banner selection and the audit approval, if any.
     *
     * @return The banner table, or the decision it is waiting for.
     *
     * @throws InvalidSurveyDataException
     *     if the banner spec names a variable that isn't in the survey.
     */
    public StageResult<BannerTable> tabulate(RecodeResult recodeResult, BannerSpec bannerSpec,
        DecisionRecord decisions) {
        StageResult<BannerSpec> selection = selectBanners(recodeResult, bannerSpec, decisions);
        if (selection.isPending()) {
            return StageResult.pending(selection.pendingDecision());
        }
        BannerSpec selected = selection.value();

        if (config.requireAuditApproval() && !decisions.auditApproved()) {
            AuditReport report = AuditReport.create(recodeResult, selected);
            int emptyColumns = 0;
            for (BannerColumn column : report.bannerColumns()) {
                if (column.isEmpty()) {
                    emptyColumns++;
                }
            }
            String summary = report.respondentCount() + " respondents, " + report.originalVariableCount() +
                " original and " + report.recodedVariableCount() + " recoded variables, " + report.rows().size() +
                " rows, " + report.bannerColumns().size() + " banner columns (" + emptyColumns + " empty)";
            logger.info("tabulation is waiting for audit approval");
            return StageResult.pending(new PendingDecision(PipelineStage.AUDIT_APPROVAL, "approve the audit",
                List.of(new DecisionOption("audit", summary, List.of(APPROVE), APPROVE))));
        }

        BannerTable table = new BannerTabulator(config).tabulate(recodeResult.dataset(), recodeResult.missingCodes(),
            selected);
        logger.info("tabulated {} blocks with {} warnings", table.blocks().size(), table.warnings().size());
        return StageResult.completed(table);
    }

    /**
     * Runs every stage.
     *
     * @param dataset
     *     The survey.
     * @param bannerSpec
     *     The banner spec, which may be empty.
     * @param decisions
     *     All decisions made so far.
     *
     * @return The output of the whole pipeline, or the first decision it is waiting for.
     *
     * @throws InvalidSurveyDataException
     *     if the survey or the banner spec is inconsistent.
     */
    public StageResult<PipelineOutput> run(SurveyDataset dataset, BannerSpec bannerSpec, DecisionRecord decisions) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(bannerSpec, "bannerSpec");
        ArgumentUtil.checkNotNull(decisions, "decisions");

        logger.info("running banner pipeline on {} respondents and {} variables", dataset.observationCount(),
            dataset.catalog().size());

        StageResult<ClassificationResult> classification = classify(dataset, decisions);
        if (classification.isPending()) {
            return StageResult.pending(classification.pendingDecision());
        }

        StageResult<RecodeResult> recoding = recode(classification.value(), decisions);
        if (recoding.isPending()) {
            return StageResult.pending(recoding.pendingDecision());
        }

        StageResult<BannerSpec> selection = selectBanners(recoding.value(), bannerSpec, decisions);
        if (selection.isPending()) {
            return StageResult.pending(selection.pendingDecision());
        }

        AuditReport auditReport = audit(recoding.value(), selection.value()).value();

        StageResult<BannerTable> table = tabulate(recoding.value(), selection.value(), decisions);
        if (table.isPending()) {
            return StageResult.pending(table.pendingDecision());
        }

        VerificationQueryDocument verificationDocument = VerificationQueryDocument.create(table.value(),
            selection.value(), clock.instant());

        return StageResult.completed(new PipelineOutput(classification.value(), recoding.value(), selection.value(),
            auditReport, table.value(), verificationDocument));
    }

    private List<String> bannerCandidates(List<Variable> variables, Map<String, MissingCodeSet> missingCodes) {
        List<String> candidates = new ArrayList<>();
        for (Variable variable : variables) {
            if (config.maximumBannerSuggestions() <= candidates.size()) {
                break;
            }
            VariableKind kind = variable.kind();
            MissingCodeSet variableMissingCodes = missingCodes.getOrDefault(variable.name(), MissingCodeSet.EMPTY);
            if ((kind == VariableKind.NOMINAL || kind == VariableKind.BINARY) && variableMissingCodes.isEmpty()) {
                candidates.add(variable.name());
            }
        }
        return candidates;
    }

    private static void checkVariablesExist(VariableCatalog catalog, Set<String> names, String what) {
        for (String name : names) {
            if (!catalog.contains(name)) {
                throw new InvalidSurveyDataException(what + " for \"" + name + "\", which is not in the survey");
            }
        }
    }

    private static DecisionOption classificationOption(Variable variable, Classification classification) {
        List<String> choices = new ArrayList<>();
        for (VariableKind kind : VariableKind.values()) {
            choices.add(kind.name());
        }
        return new DecisionOption(variable.name(), variable.displayLabel() + ": " + classification.reason(), choices,
            classification.kind().name());
    }

    private static DecisionOption recodingOption(Variable variable, ClassificationResult classification,
        RecodingConfig recodingConfig) {
        Set<String> choices = new LinkedHashSet<>();
        for (RecodingSpec spec : SUGGESTED_RECODINGS) {
            choices.add(spec.schemeName());
        }
        String suggested = recodingConfig.isExcluded(variable.name()) ?
            KEEP_AS_IS :
            recodingConfig.specFor(variable.name()).schemeName();
        choices.add(suggested);
        choices.add(KEEP_AS_IS);

        int scalePoints = classification.classification(variable.name()).substantiveCodeCount();
        return new DecisionOption(variable.name(), scalePoints + "-point scale: " + variable.displayLabel(),
            new ArrayList<>(choices), suggested);
    }

    private static DecisionOption bannerOption(Variable variable) {
        List<String> categories = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : variable.valueLabels().entrySet()) {
            categories.add(entry.getKey() + "=" + entry.getValue());
        }
        return new DecisionOption(variable.name(), variable.displayLabel() + " " + categories,
            List.of(USE_AS_BANNER), USE_AS_BANNER);
    }
}
