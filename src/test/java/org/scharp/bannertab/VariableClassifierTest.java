package org.scharp.bannertab;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link VariableClassifier}. */
public class VariableClassifierTest {

    private final VariableClassifier classifier = new VariableClassifier();

    private static MissingCodeSet missingCodes(Variable variable) {
        return new MissingCodeResolver().resolve(variable);
    }

    @Test
    void likertScale() {
        Variable variable = TestSurveys.satisfaction();

        Classification classification = classifier.classify(variable, missingCodes(variable));

        // The "Don't know" code isn't a scale point.
        assertEquals(VariableKind.ORDINAL_SCALE, classification.kind());
        assertTrue(classification.confident());
        assertFalse(classification.overridden());
        assertEquals(5, classification.substantiveCodeCount());
        assertEquals("5-point scale with intensity labels", classification.reason());
    }

    @Test
    void zeroToTenScale() {
        Variable variable = Variable.builder().
            name("NPS").
            valueLabel(0, "Not at all likely").
            valueLabel(10, "Extremely likely").
            observedCodes(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9)).
            build();

        Classification classification = classifier.classify(variable, MissingCodeSet.EMPTY);

        assertEquals(VariableKind.ORDINAL_SCALE, classification.kind());
        assertTrue(classification.confident());
        assertEquals(11, classification.substantiveCodeCount());
    }

    @Test
    void possibleRankingIsUnclassified() {
        Variable variable = TestSurveys.preferredFeature();

        Classification classification = classifier.classify(variable, MissingCodeSet.EMPTY);

        // Consecutive codes from 1 without intensity labels could be a scale or a ranking, so it's left for a person.
        assertEquals(VariableKind.UNCLASSIFIED, classification.kind());
        assertFalse(classification.confident());
        assertEquals("codes 1-4 are consecutive but the labels show no intensity (it may be a ranking)",
            classification.reason());
        assertEquals("Q2: UNCLASSIFIED (uncertain) - " + classification.reason(), classification.toString());
    }

    @Test
    void consecutiveCodesNotStartingAtOne() {
        Variable variable = Variable.builder().
            name("STORE").
            valueLabel(2, "Downtown").
            valueLabel(3, "Airport").
            valueLabel(4, "Mall").
            build();

        Classification classification = classifier.classify(variable, MissingCodeSet.EMPTY);

        assertEquals(VariableKind.NOMINAL, classification.kind());
        assertTrue(classification.confident());
        assertEquals("3 categories", classification.reason());
    }

    @Test
    void binary() {
        Variable variable = Variable.builder().
            name("Q9").
            valueLabel(1, "Yes").
            valueLabel(2, "No").
            valueLabel(9, "Refused").
            build();

        Classification classification = classifier.classify(variable, missingCodes(variable));

        assertEquals(VariableKind.BINARY, classification.kind());
        assertTrue(classification.confident());
        assertEquals(2, classification.substantiveCodeCount());
    }

    @Test
    void nominal() {
        Classification classification = classifier.classify(TestSurveys.region(), MissingCodeSet.EMPTY);

        assertEquals(VariableKind.NOMINAL, classification.kind());
        assertTrue(classification.confident());
        assertEquals(4, classification.substantiveCodeCount());
    }

    @Test
    void numeric() {
        Variable.Builder builder = Variable.builder().name("AGE");
        for (int age = 18; age < 48; age++) {
            builder.observedCodes(List.of(age));
        }

        Classification classification = classifier.classify(builder.build(), MissingCodeSet.EMPTY);

        assertEquals(VariableKind.NUMERIC, classification.kind());
        assertEquals("30 distinct unlabeled values", classification.reason());
    }

    @Test
    void tooFewCodes() {
        Variable constant = Variable.builder().name("WAVE").observedCodes(List.of(3)).build();
        Classification classification = classifier.classify(constant, MissingCodeSet.EMPTY);
        assertEquals(VariableKind.UNCLASSIFIED, classification.kind());
        assertFalse(classification.confident());
        assertEquals("only 1 substantive code", classification.reason());

        Variable empty = Variable.builder().name("OPEN").build();
        classification = classifier.classify(empty, MissingCodeSet.EMPTY);
        assertEquals(VariableKind.UNCLASSIFIED, classification.kind());
        assertEquals("only 0 substantive codes", classification.reason());
    }

    @Test
    void overriddenBy() {
        Classification heuristic = classifier.classify(TestSurveys.preferredFeature(), MissingCodeSet.EMPTY);

        Classification decided = heuristic.overriddenBy(VariableKind.NOMINAL);

        assertEquals(VariableKind.NOMINAL, decided.kind());
        assertTrue(decided.confident());
        assertTrue(decided.overridden());
        assertEquals("Q2", decided.variableName());
        assertEquals(4, decided.substantiveCodeCount());
    }

    @Test
    void classifyAll() {
        SurveyDataset dataset = TestSurveys.customerSurvey();
        Map<String, MissingCodeSet> missingCodes = new MissingCodeResolver().resolveAll(dataset.catalog());

        List<Classification> classifications = classifier.classifyAll(dataset.catalog(), missingCodes);

        assertEquals(4, classifications.size());
        assertEquals(VariableKind.ORDINAL_SCALE, classifications.get(0).kind());
        assertEquals(VariableKind.UNCLASSIFIED, classifications.get(1).kind());
        assertEquals(VariableKind.BINARY, classifications.get(2).kind());
        assertEquals(VariableKind.NOMINAL, classifications.get(3).kind());

        // Without the missing codes, Q1 has six codes that aren't consecutive.
        Classification withoutMissingCodes = classifier.classifyAll(dataset.catalog(), Map.of()).get(0);
        assertEquals(VariableKind.NOMINAL, withoutMissingCodes.kind());
    }
}
