package org.scharp.bannertab;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link RecodingEngine}. */
public class RecodingEngineTest {

    private final RecodingEngine engine = new RecodingEngine();

    private static Variable scale(String name, int first, int last) {
        Variable.Builder builder = Variable.builder().name(name).label(name + " scale");
        for (int code = first; code <= last; code++) {
            builder.valueLabel(code, "Point " + code);
        }
        return builder.kind(VariableKind.ORDINAL_SCALE).build();
    }

    private RecodedVariable recode(Variable variable, MissingCodeSet missingCodes, RecodingSpec spec) {
        RecodeOutcome outcome = engine.recode(variable, missingCodes, spec);
        assertFalse(outcome.isSkipped(), "the variable was skipped");
        return outcome.recodedVariable();
    }

    @Test
    void topTwoBoxThresholds() {
        // 5-point scale
        RecodedVariable recoded = recode(scale("Q5", 1, 5), MissingCodeSet.EMPTY, RecodingSpec.TOP_2_BOX);
        assertEquals(4, recoded.threshold());
        assertEquals(5, recoded.scalePoints());
        assertEquals(Set.of(4, 5), recoded.thresholdCodes());
        assertEquals(List.of("Point 4", "Point 5"), recoded.thresholdLabels());

        // 7-point scale
        recoded = recode(scale("Q7", 1, 7), MissingCodeSet.EMPTY, RecodingSpec.TOP_2_BOX);
        assertEquals(6, recoded.threshold());

        // 10-point scale
        recoded = recode(scale("Q10", 1, 10), MissingCodeSet.EMPTY, RecodingSpec.TOP_2_BOX);
        assertEquals(9, recoded.threshold());

        // 0-10 scale
        recoded = recode(scale("NPS", 0, 10), MissingCodeSet.EMPTY, RecodingSpec.TOP_2_BOX);
        assertEquals(9, recoded.threshold());
        assertEquals(11, recoded.scalePoints());
        assertEquals(Set.of(9, 10), recoded.thresholdCodes());
    }

    @Test
    void otherBoxes() {
        RecodedVariable topThree = recode(scale("Q7", 1, 7), MissingCodeSet.EMPTY, RecodingSpec.parse("top3"));
        assertEquals(5, topThree.threshold());
        assertEquals(Set.of(5, 6, 7), topThree.thresholdCodes());
        assertEquals("Q7_top3", topThree.name());

        RecodedVariable bottomTwo = recode(scale("Q5", 1, 5), MissingCodeSet.EMPTY, RecodingSpec.parse("bottom2"));
        assertEquals(2, bottomTwo.threshold());
        assertEquals(Set.of(1, 2), bottomTwo.thresholdCodes());
        assertEquals(BoxDirection.BOTTOM, bottomTwo.direction());
        assertEquals("Q5_bottom2", bottomTwo.name());
    }

    @Test
    void missingCodesAreNotScalePoints() {
        Variable variable = TestSurveys.satisfaction();
        MissingCodeSet missingCodes = new MissingCodeResolver().resolve(variable);

        RecodedVariable recoded = recode(variable, missingCodes, RecodingSpec.TOP_2_BOX);

        // Without excluding 99, the top 2 box would be {5, 99}.
        assertEquals(4, recoded.threshold());
        assertEquals(5, recoded.scalePoints());
        assertEquals(List.of("Satisfied", "Very satisfied"), recoded.thresholdLabels());
    }

    @Test
    void derivedVariable() {
        Variable variable = TestSurveys.satisfaction();
        MissingCodeSet missingCodes = new MissingCodeResolver().resolve(variable);

        RecodedVariable recoded = recode(variable, missingCodes, RecodingSpec.TOP_2_BOX);

        assertEquals("Q1_top2", recoded.name());
        assertEquals("Q1", recoded.sourceVariableName());
        assertEquals("Overall satisfaction", recoded.sourceLabel());
        assertEquals(RecodingSpec.TOP_2_BOX, recoded.spec());
        assertEquals(2, recoded.boxSize());

        Variable derived = recoded.variable();
        assertEquals("Q1_top2", derived.name());
        assertEquals("Overall satisfaction [Top 2 Box]", derived.label());
        assertEquals(Map.of(0, "Bottom box", 1, "Top 2 Box"), derived.valueLabels());
        assertEquals(VariableKind.BINARY, derived.kind());
    }

    @Test
    void recodeValue() {
        Variable variable = TestSurveys.satisfaction();
        MissingCodeSet missingCodes = new MissingCodeResolver().resolve(variable);
        RecodedVariable recoded = recode(variable, missingCodes, RecodingSpec.TOP_2_BOX);

        assertEquals(Integer.valueOf(0), engine.recodeValue(recoded, missingCodes, 1));
        assertEquals(Integer.valueOf(0), engine.recodeValue(recoded, missingCodes, 3));
        assertEquals(Integer.valueOf(1), engine.recodeValue(recoded, missingCodes, 4));
        assertEquals(Integer.valueOf(1), engine.recodeValue(recoded, missingCodes, 5));

        // Missing and non-substantive answers stay missing.
        assertNull(engine.recodeValue(recoded, missingCodes, 99));
        assertNull(engine.recodeValue(recoded, missingCodes, null));

        RecodedVariable bottom = recode(variable, missingCodes, RecodingSpec.parse("bottom2"));
        assertEquals(Integer.valueOf(1), engine.recodeValue(bottom, missingCodes, 2));
        assertEquals(Integer.valueOf(0), engine.recodeValue(bottom, missingCodes, 3));
        assertNull(engine.recodeValue(bottom, missingCodes, 99));
    }

    @Test
    void skipBinary() {
        Variable variable = TestSurveys.gender();

        RecodeOutcome outcome = engine.recode(variable, MissingCodeSet.EMPTY, RecodingSpec.TOP_2_BOX);

        assertTrue(outcome.isSkipped());
        assertEquals("GENDER", outcome.skip().variableName());
        assertEquals(RecodingSpec.TOP_2_BOX, outcome.skip().spec());
        assertEquals("only 2 substantive codes, which is already binary", outcome.skip().reason());

        Exception exception = assertThrows(IllegalStateException.class, outcome::recodedVariable);
        assertEquals("the variable was skipped: only 2 substantive codes, which is already binary",
            exception.getMessage());
    }

    @Test
    void skipBoxCoveringTheWholeScale() {
        RecodeOutcome outcome = engine.recode(scale("Q3", 1, 3), MissingCodeSet.EMPTY, RecodingSpec.parse("top3"));

        assertTrue(outcome.isSkipped());
        assertEquals("a box of 3 covers all 3 scale points", outcome.skip().reason());

        // A smaller box on the same scale is fine.
        outcome = engine.recode(scale("Q3", 1, 3), MissingCodeSet.EMPTY, RecodingSpec.TOP_2_BOX);
        assertFalse(outcome.isSkipped());
        assertEquals(2, outcome.recodedVariable().threshold());

        Exception exception = assertThrows(IllegalStateException.class, outcome::skip);
        assertEquals("the variable was recoded", exception.getMessage());
    }

    @Test
    void recodeAllWorkedExample() {
        SurveyDataset dataset = TestSurveys.customerSurvey();
        SurveyDataset classified = dataset.withReplacedVariables(
            List.of(dataset.variable("Q1").withKind(VariableKind.ORDINAL_SCALE)));
        Map<String, MissingCodeSet> missingCodes = new MissingCodeResolver().resolveAll(classified.catalog());

        RecodeResult result = engine.recodeAll(classified, missingCodes, RecodingConfig.DEFAULT);

        // Q1 = 1,2,3,4,5,4,5,99,3,2
        SurveyDataset recoded = result.dataset();
        assertEquals(10, recoded.observationCount());
        assertEquals(Arrays.asList(0, 0, 0, 1, 1, 1, 1, null, 0, 0), recoded.column("Q1_top2"));
        assertTrue(recoded.isDerived("Q1_top2"));
        assertEquals(dataset.column("Q1"), recoded.column("Q1"));

        assertEquals(1, result.recodedVariables().size());
        assertEquals("Q1_top2", result.recodedVariables().get(0).name());
        assertThat(result.skips(), empty());
        assertThat(result.warnings(), empty());

        // The derived variable has no non-substantive codes.
        assertSame(MissingCodeSet.EMPTY, result.missingCodes().get("Q1_top2"));
        assertEquals(Set.of(99), result.missingCodes().get("Q1").codes());

        // The input dataset is unchanged.
        assertFalse(classified.catalog().contains("Q1_top2"));
    }

    @Test
    void recodeAllOnlyRecodesOrdinalScales() {
        Variable q5 = scale("Q5", 1, 5);
        Variable q7 = scale("Q7", 1, 7);
        Variable nominal = TestSurveys.region().withKind(VariableKind.NOMINAL);
        Variable shortScale = Variable.builder().
            name("AGREE").
            valueLabel(1, "Agree").
            valueLabel(2, "Disagree").
            kind(VariableKind.ORDINAL_SCALE).
            build();
        VariableCatalog catalog = VariableCatalog.builder().variables(List.of(q5, q7, nominal, shortScale)).build();
        SurveyDataset dataset = SurveyDataset.builder().
            catalog(catalog).
            addObservation(List.of(5, 7, 1, 1)).
            addObservation(List.of(1, 2, 2, 2)).
            build();

        RecodingConfig config = RecodingConfig.builder().
            spec("Q7", RecodingSpec.parse("top3")).
            build();
        RecodeResult result = engine.recodeAll(dataset, Map.of(), config);

        assertThat(result.dataset().derivedVariables().stream().map(Variable::name).toList(),
            contains("Q5_top2", "Q7_top3"));
        assertEquals(Arrays.asList(1, 0), result.dataset().column("Q7_top3"));

        // The two-point "scale" is skipped with a warning.
        assertEquals(1, result.skips().size());
        assertEquals("AGREE", result.skips().get(0).variableName());
        assertEquals(1, result.warnings().size());
        PipelineWarning warning = result.warnings().get(0);
        assertEquals(WarningType.RECODE_SKIP, warning.type());
        assertEquals("AGREE", warning.variableName());
        assertNull(warning.bannerVariableName());
        assertEquals("only 2 substantive codes, which is already binary", warning.detail());
    }

    @Test
    void recodeAllWithExclusion() {
        Variable q5 = scale("Q5", 1, 5);
        Variable q7 = scale("Q7", 1, 7);
        SurveyDataset dataset = SurveyDataset.builder().
            catalog(VariableCatalog.builder().variables(List.of(q5, q7)).build()).
            addObservation(List.of(5, 7)).
            build();

        RecodingConfig config = RecodingConfig.builder().exclude("Q5").build();
        RecodeResult result = engine.recodeAll(dataset, Map.of(), config);

        assertEquals(1, result.recodedVariables().size());
        assertEquals("Q7_top2", result.recodedVariables().get(0).name());
        assertFalse(result.dataset().catalog().contains("Q5_top2"));
        assertThat(result.skips(), empty());
    }

    @Test
    void recodeAllNameCollision() {
        Variable q5 = scale("Q5", 1, 5);
        Variable existing = Variable.builder().name("Q5_top2").build();
        SurveyDataset dataset = SurveyDataset.builder().
            catalog(VariableCatalog.builder().variables(List.of(q5, existing)).build()).
            addObservation(List.of(5, 1)).
            build();

        Exception exception = assertThrows(
            InvalidSurveyDataException.class,
            () -> engine.recodeAll(dataset, Map.of(), RecodingConfig.DEFAULT));
        assertEquals("cannot recode Q5 as \"Q5_top2\" because a variable with that name already exists",
            exception.getMessage());
    }
}
