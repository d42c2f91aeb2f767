package org.scharp.bannertab;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;

/** Unit tests for {@link BannerTableAssembler}. */
public class BannerTableAssemblerTest {

    private final BannerTableAssembler assembler = new BannerTableAssembler();

    /**
     * The customer survey, classified and with Q1 and Q2 recoded as top-2-box.
     */
    private static SurveyDataset recodedCustomerSurvey() {
        SurveyDataset dataset = TestSurveys.customerSurvey();
        SurveyDataset classified = dataset.withReplacedVariables(List.of(
            dataset.variable("Q1").withKind(VariableKind.ORDINAL_SCALE),
            dataset.variable("Q2").withKind(VariableKind.ORDINAL_SCALE),
            dataset.variable("GENDER").withKind(VariableKind.BINARY),
            dataset.variable("REGION").withKind(VariableKind.NOMINAL)));
        Map<String, MissingCodeSet> missingCodes = new MissingCodeResolver().resolveAll(classified.catalog());
        return new RecodingEngine().recodeAll(classified, missingCodes, RecodingConfig.DEFAULT).dataset();
    }

    private static List<String> names(List<Variable> variables) {
        return variables.stream().map(Variable::name).toList();
    }

    @Test
    void defaultRowOrder() {
        SurveyDataset dataset = recodedCustomerSurvey();
        BannerSpec spec = BannerSpec.builder().bannerVariable("GENDER").build();

        List<Variable> rows = assembler.rowVariables(dataset, spec);

        // Ordinal scales, then categorical variables, then the recoded variables.  Banner variables aren't rows.
        assertThat(names(rows), contains("Q1", "Q2", "REGION", "Q1_top2", "Q2_top2"));
    }

    @Test
    void defaultRowOrderWithTwoBanners() {
        SurveyDataset dataset = recodedCustomerSurvey();
        BannerSpec spec = BannerSpec.builder().bannerVariables(List.of("REGION", "GENDER")).build();

        assertThat(names(assembler.rowVariables(dataset, spec)), contains("Q1", "Q2", "Q1_top2", "Q2_top2"));
    }

    @Test
    void explicitRowOrder() {
        SurveyDataset dataset = recodedCustomerSurvey();
        BannerSpec spec = BannerSpec.builder().
            bannerVariable("GENDER").
            rowVariables(List.of("Q2_top2", "REGION", "Q1")).
            build();

        // The caller's order is kept as it is.
        assertThat(names(assembler.rowVariables(dataset, spec)), contains("Q2_top2", "REGION", "Q1"));
    }

    @Test
    void workItemsAreRowMajor() {
        SurveyDataset dataset = recodedCustomerSurvey();
        BannerSpec spec = BannerSpec.builder().bannerVariables(List.of("GENDER", "REGION")).build();
        BannerLayout layout = BannerLayout.create(dataset, Map.of(), spec, true, true);
        List<Variable> rows = assembler.rowVariables(dataset, spec);

        List<TabulationWorkItem> workItems = assembler.workItems(dataset, rows, layout);

        // four rows by three groups (Total, GENDER, REGION)
        assertEquals(12, workItems.size());
        for (int i = 0; i < workItems.size(); i++) {
            TabulationWorkItem workItem = workItems.get(i);
            assertEquals(i, workItem.index());
            assertEquals(rows.get(i / 3), workItem.rowVariable());
            assertEquals(layout.groups().get(i % 3), workItem.group());
        }

        assertEquals(TableSection.FULL_DISTRIBUTION, workItems.get(0).section());
        assertEquals(TableSection.FULL_DISTRIBUTION, workItems.get(5).section());
        assertEquals(TableSection.BOX_SUMMARY, workItems.get(6).section());
        assertEquals(TableSection.BOX_SUMMARY, workItems.get(11).section());

        // The empty "East" column isn't tabulated.
        assertEquals(3, workItems.get(2).columns().size());
    }

    @Test
    void boxSummaryValues() {
        SurveyDataset dataset = recodedCustomerSurvey();
        BannerSpec spec = BannerSpec.builder().
            bannerVariable("GENDER").
            rowVariables(List.of("Q1_top2")).
            build();

        BannerTable table = new BannerTabulator(PipelineConfig.DEFAULT).tabulate(dataset,
            Map.of("Q1", new MissingCodeSet(Map.of(99, "Don't know"))), spec);

        // Both the bottom box (0) and the top box (1) are shown.
        BannerTableBlock block = table.block("Q1_top2");
        assertEquals(TableSection.BOX_SUMMARY, block.section());
        assertEquals(List.of(0, 1), block.rowCodes());
        assertEquals(List.of(9, 5, 4), block.bases());

        List<CrosstabCell> topBox = block.valueRow(1);
        assertEquals("Top 2 Box", topBox.get(0).rowLabel());
        assertEquals(4, topBox.get(0).count());
        assertEquals("44.4%", topBox.get(0).formattedPercentage());
        assertEquals("40.0%", topBox.get(1).formattedPercentage());
        assertEquals("50.0%", topBox.get(2).formattedPercentage());
    }
}
