package org.scharp.bannertab;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link SignificanceTester}. */
public class SignificanceTesterTest {

    private final SignificanceTester tester = new SignificanceTester();

    @Test
    void significantTable() {
        SignificanceResult result = tester.test("Q1_top2", "GENDER", new long[][] { { 30, 20 }, { 10, 40 } });

        // expected frequencies are 20, 30, 20, 30
        assertEquals("Q1_top2", result.rowVariableName());
        assertEquals("GENDER", result.bannerVariableName());
        assertThat(result.chiSquare(), closeTo(50.0 / 3, 1e-9));
        assertEquals(1, result.degreesOfFreedom());
        assertThat(result.pValue(), closeTo(4.455709060405608e-05, 1e-9));
        assertThat(result.pValue(), lessThan(0.05));
        assertEquals(SignificanceFlag.SIGNIFICANT, result.flag());
        assertFalse(result.lowPower());
        assertFalse(result.degenerate());
    }

    @Test
    void continuityCorrection() {
        SignificanceTester yates = new SignificanceTester(0.05, 0.10, 5.0, true);

        SignificanceResult result = yates.test("Q1_top2", "GENDER", new long[][] { { 30, 20 }, { 10, 40 } });

        // Each |O-E| of 10 is reduced to 9.5.
        assertThat(result.chiSquare(), closeTo(15.041666666666666, 1e-9));
        assertThat(result.pValue(), closeTo(1.0516355403363118e-4, 1e-9));
        assertEquals(SignificanceFlag.SIGNIFICANT, result.flag());

        // The correction only applies to 2x2 tables.
        long[][] table = { { 10, 20 }, { 20, 10 }, { 15, 15 } };
        assertEquals(tester.test("Q", "B", table).chiSquare(), yates.test("Q", "B", table).chiSquare(), 1e-12);
    }

    @Test
    void largerTable() {
        SignificanceResult result = tester.test("Q2", "REGION", new long[][] { { 10, 20 }, { 20, 10 }, { 15, 15 } });

        assertThat(result.chiSquare(), closeTo(20.0 / 3, 1e-9));
        assertEquals(2, result.degreesOfFreedom());
        assertThat(result.pValue(), closeTo(Math.exp(-10.0 / 3), 1e-9));
        assertEquals(SignificanceFlag.SIGNIFICANT, result.flag());
    }

    @Test
    void marginalAndNotSignificant() {
        SignificanceResult marginal = tester.test("Q", "B", new long[][] { { 21, 9 }, { 14, 16 } });
        assertThat(marginal.chiSquare(), closeTo(3.36, 1e-9));
        assertThat(marginal.pValue(), closeTo(0.06679806847513832, 1e-9));
        assertEquals(SignificanceFlag.MARGINAL, marginal.flag());

        SignificanceResult notSignificant = tester.test("Q", "B", new long[][] { { 15, 15 }, { 15, 15 } });
        assertEquals(0, notSignificant.chiSquare(), 1e-12);
        assertEquals(1, notSignificant.pValue(), 1e-12);
        assertEquals(SignificanceFlag.NOT_SIGNIFICANT, notSignificant.flag());
    }

    @Test
    void lowExpectedFrequency() {
        SignificanceResult result = tester.test("Q", "B", new long[][] { { 3, 2 }, { 2, 2 } });

        assertTrue(result.lowPower());
        assertFalse(result.degenerate());
        assertEquals(1, result.degreesOfFreedom());

        // A lower minimum makes the same table adequate.
        SignificanceTester lenient = new SignificanceTester(0.05, 0.10, 1.0, false);
        assertFalse(lenient.test("Q", "B", new long[][] { { 3, 2 }, { 2, 2 } }).lowPower());
    }

    @Test
    void emptyRowsAndColumnsAreDropped() {
        long[][] withEmpty = { { 30, 0, 20 }, { 0, 0, 0 }, { 10, 0, 40 } };

        SignificanceResult result = tester.test("Q", "B", withEmpty);

        assertEquals(1, result.degreesOfFreedom());
        assertThat(result.chiSquare(), closeTo(50.0 / 3, 1e-9));
    }

    @Test
    void degenerateTables() {
        // only one non-empty column
        SignificanceResult result = tester.test("Q3", "GROUP", new long[][] { { 1, 0 }, { 3, 0 } });
        assertTrue(result.degenerate());
        assertTrue(Double.isNaN(result.chiSquare()));
        assertTrue(Double.isNaN(result.pValue()));
        assertEquals(0, result.degreesOfFreedom());
        assertEquals(SignificanceFlag.NOT_SIGNIFICANT, result.flag());
        assertEquals("Q3 x GROUP: not testable", result.toString());

        // only one non-empty row
        assertTrue(tester.test("Q", "B", new long[][] { { 4, 5, 6 }, { 0, 0, 0 } }).degenerate());

        // nothing at all
        assertTrue(tester.test("Q", "B", new long[][] {}).degenerate());
        assertTrue(tester.test("Q", "B", new long[][] { { 0, 0 }, { 0, 0 } }).degenerate());
    }

    @Test
    void crosstabIgnoresTotalColumn() {
        SurveyDataset dataset = TestSurveys.customerSurvey();
        Map<String, MissingCodeSet> missingCodes = new MissingCodeResolver().resolveAll(dataset.catalog());
        BannerSpec spec = BannerSpec.builder().bannerVariable("GENDER").build();
        BannerLayout layout = BannerLayout.create(dataset, missingCodes, spec, true, true);
        BannerGroup gender = layout.groups().get(1);

        List<BannerColumn> withTotal = new ArrayList<>();
        withTotal.add(layout.groups().get(0).columns().get(0));
        withTotal.addAll(gender.columns());

        CrosstabBuilder builder = new CrosstabBuilder();
        Variable q1 = dataset.variable("Q1");
        Crosstab crosstab = builder.build(dataset, q1, missingCodes.get("Q1"), gender, gender.columns());
        Crosstab crosstabWithTotal = builder.build(dataset, q1, missingCodes.get("Q1"), gender, withTotal);

        SignificanceResult result = tester.test(crosstab);
        SignificanceResult resultWithTotal = tester.test(crosstabWithTotal);

        assertEquals("Q1", result.rowVariableName());
        assertEquals("GENDER", result.bannerVariableName());
        assertEquals(4, result.degreesOfFreedom());
        assertEquals(result.chiSquare(), resultWithTotal.chiSquare(), 1e-12);
        assertEquals(result.degreesOfFreedom(), resultWithTotal.degreesOfFreedom());

        // Men and women never gave the same answer, but there are only nine respondents.
        assertThat(result.chiSquare(), closeTo(9.0, 1e-9));
        assertTrue(result.lowPower());
    }

    @Test
    void badArguments() {
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> new SignificanceTester(0.10, 0.05, 5, false));
        assertEquals("marginalSignificanceLevel must not be less than significanceLevel", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> new SignificanceTester(1, 1, 5, false));
        assertEquals("significanceLevel must be between 0 and 1 (exclusive)", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> new SignificanceTester(0.05, 0.1, -1, false));
        assertEquals("minimumExpectedFrequency must not be negative", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> tester.test("Q", "B", new long[][] { { 1, 2 }, { 3 } }));
        assertEquals("observed must be rectangular", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> tester.test("Q", "B", new long[][] { { 1, 2 }, { 3, -4 } }));
        assertEquals("observed must not contain a negative count", exception.getMessage());
    }
}
