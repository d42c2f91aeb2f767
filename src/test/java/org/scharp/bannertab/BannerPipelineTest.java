package org.scharp.bannertab;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link BannerPipeline}. */
public class BannerPipelineTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private static final DecisionRecord BANNERS = DecisionRecord.builder().
        bannerVariables(List.of("GENDER", "REGION")).
        build();

    private static BannerPipeline pipeline(PipelineConfig config) {
        return new BannerPipeline(config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PipelineOutput runToCompletion(PipelineConfig config, DecisionRecord decisions) {
        StageResult<PipelineOutput> result = pipeline(config).run(TestSurveys.customerSurvey(), BannerSpec.EMPTY,
            decisions);
        assertFalse(result.isPending(), () -> "unexpected " + result);
        return result.value();
    }

    private static List<String> subjects(PendingDecision pendingDecision) {
        return pendingDecision.options().stream().map(DecisionOption::subject).toList();
    }

    @Test
    void classify() {
        StageResult<ClassificationResult> result = pipeline(PipelineConfig.DEFAULT).classify(
            TestSurveys.customerSurvey(), DecisionRecord.EMPTY);

        ClassificationResult classification = result.value();
        assertEquals(VariableKind.ORDINAL_SCALE, classification.classification("Q1").kind());
        assertEquals(VariableKind.UNCLASSIFIED, classification.classification("Q2").kind());
        assertEquals(VariableKind.BINARY, classification.classification("GENDER").kind());
        assertEquals(VariableKind.NOMINAL, classification.classification("REGION").kind());

        // The kinds are written into the dataset.
        assertEquals(VariableKind.BINARY, classification.dataset().variable("GENDER").kind());
        assertEquals(List.of("GENDER", "REGION"), classification.bannerCandidates());

        // Q2 might be a ranking, so it's left unclassified with a warning.
        assertFalse(classification.classification("Q2").confident());
        assertEquals(VariableKind.UNCLASSIFIED, classification.dataset().variable("Q2").kind());
        assertEquals(1, classification.warnings().size());
        assertEquals(WarningType.CLASSIFICATION_AMBIGUITY, classification.warnings().get(0).type());
        assertEquals("Q2", classification.warnings().get(0).variableName());
    }

    @Test
    void waitForBannerSelection() {
        StageResult<PipelineOutput> result = pipeline(PipelineConfig.DEFAULT).run(TestSurveys.customerSurvey(),
            BannerSpec.EMPTY, DecisionRecord.EMPTY);

        assertTrue(result.isPending());
        PendingDecision pendingDecision = result.pendingDecision();
        assertEquals(PipelineStage.BANNER_SELECTION, pendingDecision.stage());
        assertEquals("choose the banner variables", pendingDecision.message());
        assertThat(subjects(pendingDecision), contains("GENDER", "REGION"));

        DecisionOption gender = pendingDecision.options().get(0);
        assertEquals("Gender [1=Male, 2=Female]", gender.description());
        assertEquals(List.of(BannerPipeline.USE_AS_BANNER), gender.choices());
        assertEquals(BannerPipeline.USE_AS_BANNER, gender.suggestedChoice());

        Exception exception = assertThrows(IllegalStateException.class, result::value);
        assertEquals("the stage is waiting for a decision: choose the banner variables", exception.getMessage());
    }

    @Test
    void bannerSuggestionsAreLimited() {
        PipelineConfig config = PipelineConfig.builder().maximumBannerSuggestions(1).build();

        StageResult<PipelineOutput> result = pipeline(config).run(TestSurveys.customerSurvey(), BannerSpec.EMPTY,
            DecisionRecord.EMPTY);

        assertThat(subjects(result.pendingDecision()), contains("GENDER"));
    }

    @Test
    void resumeWithBannerSelection() {
        PipelineOutput output = runToCompletion(PipelineConfig.DEFAULT, BANNERS);

        assertEquals(List.of("GENDER", "REGION"), output.bannerSpec().bannerVariables());
        assertEquals(5, output.dataset().catalog().size());

        // The ambiguous Q2 is neither recoded nor tabulated by default.
        assertThat(output.recodeResult().recodedVariables().stream().map(RecodedVariable::name).toList(),
            contains("Q1_top2"));
        assertFalse(output.dataset().catalog().contains("Q2_top2"));

        BannerTable table = output.bannerTable();
        assertThat(table.blocks().stream().map(block -> block.rowVariable().name()).toList(),
            contains("Q1", "Q1_top2"));
        assertEquals(4, output.significanceResults().size());

        // The worked example: 4 of the 9 respondents with an opinion are satisfied.
        CrosstabCell topBox = table.block("Q1_top2").valueRow(1).get(0);
        assertEquals(4, topBox.count());
        assertEquals(9, topBox.base());
        assertEquals("44.4%", topBox.formattedPercentage());

        // Warnings from every stage are collected.
        List<PipelineWarning> warnings = output.warnings();
        assertEquals(WarningType.CLASSIFICATION_AMBIGUITY, warnings.get(0).type());
        assertThat(warnings.stream().map(PipelineWarning::type).toList(), hasItem(WarningType.EMPTY_BANNER_COLUMN));
    }

    @Test
    void bannerSpecNeedsNoDecision() {
        BannerSpec spec = BannerSpec.builder().bannerVariable("REGION").build();

        StageResult<PipelineOutput> result = pipeline(PipelineConfig.DEFAULT).run(TestSurveys.customerSurvey(), spec,
            DecisionRecord.EMPTY);

        assertFalse(result.isPending());
        assertEquals(List.of("REGION"), result.value().bannerSpec().bannerVariables());
    }

    @Test
    void auditReport() {
        PipelineOutput output = runToCompletion(PipelineConfig.DEFAULT, BANNERS);

        AuditReport report = output.auditReport();
        assertEquals(10, report.respondentCount());
        assertEquals(4, report.originalVariableCount());
        assertEquals(1, report.recodedVariableCount());
        assertEquals(1, report.kindCounts().get(VariableKind.ORDINAL_SCALE));
        assertEquals(1, report.kindCounts().get(VariableKind.BINARY));
        assertEquals(1, report.kindCounts().get(VariableKind.NOMINAL));
        assertEquals(0, report.kindCounts().get(VariableKind.NUMERIC));
        assertEquals(1, report.kindCounts().get(VariableKind.UNCLASSIFIED));
        assertEquals(1, report.recodedVariables().size());

        // The audit lists every category, including the empty one.
        assertEquals(6, report.bannerColumns().size());
        BannerColumn male = report.bannerColumns().get(0);
        assertEquals("GENDER: Male", male.displayLabel());
        assertEquals(0.5, report.respondentShare(male), 1e-12);
        assertTrue(report.bannerColumns().get(5).isEmpty());

        assertThat(report.rows().stream().map(AuditReport.RowEntry::toString).toList(),
            contains("[FULL DIST] Q1", "[TOP/BOTTOM BOX] Q1_top2"));
    }

    @Test
    void verificationDocument() {
        PipelineOutput output = runToCompletion(PipelineConfig.DEFAULT, BANNERS);

        VerificationQueryDocument document = output.verificationDocument();
        assertEquals("Customer Survey", document.title());
        assertEquals(NOW, document.generatedAt());
        assertEquals(List.of("GENDER", "REGION"), document.bannerVariableNames());
        assertEquals(List.of("Q1", "Q1_top2"), document.rowVariableNames());

        VerificationQuery query = document.queries().get(1);
        assertEquals("Q1_top2", query.rowVariableName());
        assertEquals(TableSection.BOX_SUMMARY, query.section());
        assertEquals(List.of(VerificationStatistic.COUNT, VerificationStatistic.COLUMN_PERCENT), query.statistics());
        assertTrue(query.ascendingCategoryOrder());
        assertTrue(query.includeEmptyCategories());
        assertEquals("Q1_top2 BY GENDER + REGION", query.toString());
    }

    @Test
    void waitForClassificationReview() {
        PipelineConfig config = PipelineConfig.builder().reviewClassifications(true).build();

        StageResult<PipelineOutput> result = pipeline(config).run(TestSurveys.customerSurvey(), BannerSpec.EMPTY,
            BANNERS);

        PendingDecision pendingDecision = result.pendingDecision();
        assertEquals(PipelineStage.CLASSIFICATION, pendingDecision.stage());
        assertEquals("1 variables could not be classified with confidence", pendingDecision.message());
        assertThat(subjects(pendingDecision), contains("Q2"));

        DecisionOption option = pendingDecision.options().get(0);
        assertEquals("UNCLASSIFIED", option.suggestedChoice());
        assertEquals(List.of("ORDINAL_SCALE", "NOMINAL", "BINARY", "NUMERIC", "UNCLASSIFIED"), option.choices());
    }

    @Test
    void resumeWithClassificationOverride() {
        PipelineConfig config = PipelineConfig.builder().reviewClassifications(true).build();
        DecisionRecord decisions = DecisionRecord.builder().
            kind("Q2", VariableKind.NOMINAL).
            bannerVariables(List.of("GENDER", "REGION")).
            build();

        PipelineOutput output = runToCompletion(config, decisions);

        Classification q2 = output.classificationResult().classification("Q2");
        assertEquals(VariableKind.NOMINAL, q2.kind());
        assertTrue(q2.overridden());

        // A nominal Q2 isn't recoded, and it's tabulated after the ordinal scales.
        assertThat(output.recodeResult().recodedVariables().stream().map(RecodedVariable::name).toList(),
            contains("Q1_top2"));
        assertThat(output.bannerTable().blocks().stream().map(block -> block.rowVariable().name()).toList(),
            contains("Q1", "Q2", "Q1_top2"));
        assertEquals(TableSection.FULL_DISTRIBUTION, output.bannerTable().block("Q2").section());
    }

    @Test
    void resumeWithClassificationAcknowledged() {
        PipelineConfig config = PipelineConfig.builder().reviewClassifications(true).build();
        DecisionRecord decisions = DecisionRecord.builder().
            acknowledgeClassification("Q2").
            bannerVariables(List.of("GENDER", "REGION")).
            build();

        PipelineOutput output = runToCompletion(config, decisions);

        // Accepting the classification leaves Q2 unclassified.
        assertEquals(VariableKind.UNCLASSIFIED, output.classificationResult().classification("Q2").kind());
        assertFalse(output.dataset().catalog().contains("Q2_top2"));
        assertThat(output.bannerTable().blocks().stream().map(block -> block.rowVariable().name()).toList(),
            contains("Q1", "Q1_top2"));
    }

    @Test
    void decidedOrdinalScaleIsRecoded() {
        DecisionRecord decisions = DecisionRecord.builder().
            kind("Q2", VariableKind.ORDINAL_SCALE).
            bannerVariables(List.of("GENDER", "REGION")).
            build();

        PipelineOutput output = runToCompletion(PipelineConfig.DEFAULT, decisions);

        Classification q2 = output.classificationResult().classification("Q2");
        assertEquals(VariableKind.ORDINAL_SCALE, q2.kind());
        assertTrue(q2.overridden());
        assertThat(output.recodeResult().recodedVariables().stream().map(RecodedVariable::name).toList(),
            contains("Q1_top2", "Q2_top2"));
        assertThat(output.bannerTable().blocks().stream().map(block -> block.rowVariable().name()).toList(),
            contains("Q1", "Q2", "Q1_top2", "Q2_top2"));

        // A decided kind isn't ambiguous.
        assertFalse(output.warnings().stream().anyMatch(
            warning -> warning.type() == WarningType.CLASSIFICATION_AMBIGUITY));
    }

    @Test
    void waitForRecodingReview() {
        PipelineConfig config = PipelineConfig.builder().reviewRecoding(true).build();

        StageResult<PipelineOutput> result = pipeline(config).run(TestSurveys.customerSurvey(), BannerSpec.EMPTY,
            BANNERS);

        PendingDecision pendingDecision = result.pendingDecision();
        assertEquals(PipelineStage.RECODING, pendingDecision.stage());
        assertThat(subjects(pendingDecision), contains("Q1"));

        DecisionOption q1 = pendingDecision.options().get(0);
        assertEquals("5-point scale: Overall satisfaction", q1.description());
        assertEquals(List.of("top2", "top3", "bottom2", BannerPipeline.KEEP_AS_IS), q1.choices());
        assertEquals("top2", q1.suggestedChoice());
    }

    @Test
    void resumeWithRecodingDecisions() {
        PipelineConfig config = PipelineConfig.builder().reviewRecoding(true).build();
        DecisionRecord decisions = DecisionRecord.builder().
            kind("Q2", VariableKind.ORDINAL_SCALE).
            recodingSpec("Q1", RecodingSpec.parse("top3")).
            excludeFromRecoding("Q2").
            bannerVariables(List.of("GENDER", "REGION")).
            build();

        PipelineOutput output = runToCompletion(config, decisions);

        List<RecodedVariable> recoded = output.recodeResult().recodedVariables();
        assertEquals(1, recoded.size());
        assertEquals("Q1_top3", recoded.get(0).name());
        assertEquals(3, recoded.get(0).threshold());
    }

    @Test
    void resumeWithRecodingConfirmed() {
        PipelineConfig config = PipelineConfig.builder().reviewRecoding(true).build();
        DecisionRecord decisions = DecisionRecord.builder().
            confirmRecoding().
            bannerVariables(List.of("GENDER", "REGION")).
            build();

        PipelineOutput output = runToCompletion(config, decisions);

        assertEquals(1, output.recodeResult().recodedVariables().size());
    }

    @Test
    void waitForAuditApproval() {
        PipelineConfig config = PipelineConfig.builder().requireAuditApproval(true).build();

        StageResult<PipelineOutput> result = pipeline(config).run(TestSurveys.customerSurvey(), BannerSpec.EMPTY,
            BANNERS);

        PendingDecision pendingDecision = result.pendingDecision();
        assertEquals(PipelineStage.AUDIT_APPROVAL, pendingDecision.stage());
        DecisionOption option = pendingDecision.options().get(0);
        assertEquals("audit", option.subject());
        assertEquals(List.of(BannerPipeline.APPROVE), option.choices());
        assertEquals("10 respondents, 4 original and 1 recoded variables, 2 rows, 6 banner columns (1 empty)",
            option.description());

        DecisionRecord approved = DecisionRecord.builder().
            bannerVariables(List.of("GENDER", "REGION")).
            approveAudit().
            build();
        assertEquals(2, runToCompletion(config, approved).bannerTable().blocks().size());
    }

    @Test
    void parallelRunMatchesSerialRun() throws JsonProcessingException {
        JsonReportWriter writer = new JsonReportWriter();

        PipelineOutput serial = runToCompletion(PipelineConfig.DEFAULT, BANNERS);
        PipelineOutput parallel = runToCompletion(PipelineConfig.builder().parallelism(4).build(), BANNERS);

        assertEquals(writer.toJson(writer.pipelineOutput(serial)), writer.toJson(writer.pipelineOutput(parallel)));
    }

    @Test
    void unknownVariables() {
        BannerPipeline pipeline = pipeline(PipelineConfig.DEFAULT);
        SurveyDataset dataset = TestSurveys.customerSurvey();

        DecisionRecord unknownKind = DecisionRecord.builder().kind("AGE", VariableKind.NUMERIC).build();
        Exception exception = assertThrows(
            InvalidSurveyDataException.class,
            () -> pipeline.run(dataset, BannerSpec.EMPTY, unknownKind));
        assertEquals("a kind was decided for \"AGE\", which is not in the survey", exception.getMessage());

        DecisionRecord unknownBanner = DecisionRecord.builder().bannerVariables(List.of("AGE")).build();
        exception = assertThrows(
            InvalidSurveyDataException.class,
            () -> pipeline.run(dataset, BannerSpec.EMPTY, unknownBanner));
        assertEquals("banner variable \"AGE\" is not in the survey", exception.getMessage());

        DecisionRecord unknownRecoding = DecisionRecord.builder().excludeFromRecoding("Q9").build();
        exception = assertThrows(
            InvalidSurveyDataException.class,
            () -> pipeline.run(dataset, BannerSpec.EMPTY, unknownRecoding));
        assertEquals("a recoding was excluded for \"Q9\", which is not in the survey", exception.getMessage());
    }

    @Test
    void badArguments() {
        Exception exception = assertThrows(NullPointerException.class, () -> new BannerPipeline(null));
        assertEquals("config must not be null", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> DecisionRecord.builder().bannerVariables(List.of()));
        assertEquals("bannerVariables must not be empty", exception.getMessage());

        exception = assertThrows(
            IllegalStateException.class,
            () -> PipelineConfig.builder().significanceLevel(0.2).build());
        assertEquals("marginalSignificanceLevel (0.1) must not be less than significanceLevel (0.2)",
            exception.getMessage());
    }
}
