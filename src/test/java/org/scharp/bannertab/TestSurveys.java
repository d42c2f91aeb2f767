package org.scharp.bannertab;

import java.util.Arrays;
import java.util.List;

/**
 * Small surveys that are shared by the unit tests.
 */
final class TestSurveys {

    private TestSurveys() {
    }

    /**
     * A five-point satisfaction scale with a "Don't know" code.
     */
    static Variable satisfaction() {
        return Variable.builder().
            name("Q1").
            label("Overall satisfaction").
            valueLabel(1, "Very dissatisfied").
            valueLabel(2, "Dissatisfied").
            valueLabel(3, "Neither satisfied nor dissatisfied").
            valueLabel(4, "Satisfied").
            valueLabel(5, "Very satisfied").
            valueLabel(99, "Don't know").
            build();
    }

    /**
     * A question whose codes look like a scale but whose labels are brand names.
     */
    static Variable preferredFeature() {
        return Variable.builder().
            name("Q2").
            label("Most important feature").
            valueLabel(1, "Price").
            valueLabel(2, "Quality").
            valueLabel(3, "Service").
            valueLabel(4, "Design").
            build();
    }

    static Variable gender() {
        return Variable.builder().
            name("GENDER").
            label("Gender").
            valueLabel(1, "Male").
            valueLabel(2, "Female").
            build();
    }

    /**
     * A region variable.  Nobody lives in the East.
     */
    static Variable region() {
        return Variable.builder().
            name("REGION").
            label("Region").
            valueLabel(1, "North").
            valueLabel(2, "South").
            valueLabel(5, "West").
            valueLabel(7, "East").
            build();
    }

    /**
     * Ten respondents answering Q1, Q2, GENDER, and REGION.  Q1 is the sequence 1,2,3,4,5,4,5,99,3,2.
     */
    static SurveyDataset customerSurvey() {
        VariableCatalog catalog = VariableCatalog.builder().
            surveyName("Customer Survey").
            variables(List.of(satisfaction(), preferredFeature(), gender(), region())).
            build();

        return SurveyDataset.builder().
            catalog(catalog).
            addObservation(List.of(1, 1, 1, 1)).
            addObservation(List.of(2, 2, 2, 1)).
            addObservation(List.of(3, 3, 1, 2)).
            addObservation(List.of(4, 4, 2, 2)).
            addObservation(List.of(5, 1, 1, 5)).
            addObservation(List.of(4, 2, 2, 5)).
            addObservation(List.of(5, 3, 1, 1)).
            addObservation(List.of(99, 4, 2, 2)).
            addObservation(List.of(3, 1, 1, 5)).
            addObservation(List.of(2, 2, 2, 1)).
            build();
    }

    /**
     * Six respondents with an ordinal scale Q3, a nominal Q4, and a banner variable GROUP.  The respondents in group
     * "B" all answered "Don't know" to Q3 and nobody is in group "C".
     */
    static SurveyDataset groupSurvey() {
        Variable q3 = Variable.builder().
            name("Q3").
            label("Likelihood to recommend").
            valueLabel(1, "Very unlikely").
            valueLabel(2, "Unlikely").
            valueLabel(3, "Neutral").
            valueLabel(4, "Likely").
            valueLabel(5, "Very likely").
            valueLabel(9, "Don't know").
            kind(VariableKind.ORDINAL_SCALE).
            build();

        Variable q4 = Variable.builder().
            name("Q4").
            label("Preferred channel").
            valueLabel(1, "Web").
            valueLabel(2, "Phone").
            kind(VariableKind.BINARY).
            build();

        Variable group = Variable.builder().
            name("GROUP").
            label("Customer group").
            valueLabel(1, "A").
            valueLabel(2, "B").
            valueLabel(3, "C").
            kind(VariableKind.NOMINAL).
            build();

        VariableCatalog catalog = VariableCatalog.builder().
            surveyName("Group Survey").
            variables(List.of(q3, q4, group)).
            build();

        return SurveyDataset.builder().
            catalog(catalog).
            addObservation(List.of(1, 1, 1)).
            addObservation(List.of(4, 2, 1)).
            addObservation(List.of(5, 1, 1)).
            addObservation(List.of(9, 2, 2)).
            addObservation(Arrays.asList(9, null, 2)).
            addObservation(List.of(2, 2, 1)).
            build();
    }
}
