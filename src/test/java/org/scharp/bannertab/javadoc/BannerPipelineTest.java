package org.scharp.bannertab.javadoc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scharp.bannertab.BannerPipeline;
import org.scharp.bannertab.BannerSpec;
import org.scharp.bannertab.DecisionRecord;
import org.scharp.bannertab.JsonReportWriter;
import org.scharp.bannertab.PipelineConfig;
import org.scharp.bannertab.PipelineOutput;
import org.scharp.bannertab.PipelineStage;
import org.scharp.bannertab.StageResult;
import org.scharp.bannertab.SurveyDataset;
import org.scharp.bannertab.Variable;
import org.scharp.bannertab.VariableCatalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A class for executing the sample code that's within the JavaDoc.
 */
public class BannerPipelineTest {

    private static SurveyDataset customerSurvey() {
        VariableCatalog catalog = VariableCatalog.builder().
            surveyName("Customer Survey").
            variables(
                List.of(
                    Variable.builder().
                        name("Q1").
                        label("Overall satisfaction").
                        valueLabel(1, "Very dissatisfied").
                        valueLabel(2, "Dissatisfied").
                        valueLabel(3, "Neither satisfied nor dissatisfied").
                        valueLabel(4, "Satisfied").
                        valueLabel(5, "Very satisfied").
                        valueLabel(99, "Don't know").
                        build(),

                    Variable.builder().
                        name("GENDER").
                        label("Gender").
                        valueLabel(1, "Male").
                        valueLabel(2, "Female").
                        build(),

                    Variable.builder().
                        name("REGION").
                        label("Region").
                        valueLabel(1, "North").
                        valueLabel(2, "South").
                        valueLabel(5, "West").
                        build())).
            build();

        return SurveyDataset.builder().
            catalog(catalog).
            addObservation(List.of(1, 1, 1)).
            addObservation(List.of(2, 2, 1)).
            addObservation(List.of(3, 1, 2)).
            addObservation(List.of(4, 2, 2)).
            addObservation(List.of(5, 1, 5)).
            addObservation(List.of(4, 2, 5)).
            addObservation(List.of(5, 1, 1)).
            addObservation(List.of(99, 2, 2)).
            build();
    }

    /**
     * Runs the sample code in {@link BannerPipeline}'s class documentation.
     */
    @Test
    void runBannerPipeline(@TempDir Path tempDir) throws IOException {
        SurveyDataset dataset = customerSurvey();
        Path targetLocation = tempDir.resolve("banner.json");

        BannerPipeline pipeline = new BannerPipeline(PipelineConfig.DEFAULT);
        StageResult<PipelineOutput> result = pipeline.run(dataset, BannerSpec.EMPTY, DecisionRecord.EMPTY);

        // Without banner variables, the pipeline waits.
        assertTrue(result.isPending());
        assertEquals(PipelineStage.BANNER_SELECTION, result.pendingDecision().stage());

        DecisionRecord decisions = DecisionRecord.builder().
            bannerVariables(List.of("GENDER", "REGION")).
            build();
        result = pipeline.run(dataset, BannerSpec.EMPTY, decisions);
        assertFalse(result.isPending());
        PipelineOutput output = result.value();

        JsonReportWriter writer = new JsonReportWriter();
        writer.write(writer.pipelineOutput(output), targetLocation);

        // Read back the report.
        JsonNode report = new ObjectMapper().readTree(Files.readString(targetLocation));
        JsonNode bannerTable = report.get("bannerTable");
        assertEquals("Customer Survey", bannerTable.get("title").asText());
        assertEquals(8, bannerTable.get("respondentCount").asInt());
        assertEquals(6, bannerTable.get("columns").size()); // Total + 2 genders + 3 regions
        assertEquals("Q1_top2", report.get("recoding").get("recodings").get(0).get("recoded").asText());
    }
}
