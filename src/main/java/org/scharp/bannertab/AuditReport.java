///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A summary of a recoded dataset and of the banner table it will produce, for review before tabulation.
 * <p>
 * The report shows the respondent and variable counts, how many variables of each kind there are, which recoded
 * variable came from which scale, how many respondents fall in each banner column (flagging the empty ones), and
 * which rows the table will have.
 * </p>
 */
public final class AuditReport {

    /**
     * One row variable of the previewed table.
     */
    public static final class RowEntry {
        private final Variable variable;
        private final TableSection section;

        RowEntry(Variable variable, TableSection section) {
            this.variable = variable;
            this.section = section;
        }

        /**
         * @return The row variable.
         */
        public Variable variable() {
            return variable;
        }

        /**
         * @return The section in which the variable will appear.
         */
        public TableSection section() {
            return section;
        }

        @Override
        public String toString() {
            return "[" + section.tag() + "] " + variable.name();
        }
    }

    private final int respondentCount;
    private final int originalVariableCount;
    private final int recodedVariableCount;
    private final Map<VariableKind, Integer> kindCounts;
    private final List<RecodedVariable> recodedVariables;
    private final List<BannerColumn> bannerColumns;
    private final List<RowEntry> rows;

    private AuditReport(int respondentCount, int originalVariableCount, int recodedVariableCount,
        Map<VariableKind, Integer> kindCounts, List<RecodedVariable> recodedVariables, List<BannerColumn> bannerColumns,
        List<RowEntry> rows) {
        this.respondentCount = respondentCount;
        this.originalVariableCount = originalVariableCount;
        this.recodedVariableCount = recodedVariableCount;
        this.kindCounts = kindCounts;
        this.recodedVariables = recodedVariables;
        this.bannerColumns = bannerColumns;
        this.rows = rows;
    }

    /**
     * Audits a recoded dataset.
     *
     * @param recodeResult
     *     The output of the recoding stage.
     * @param bannerSpec
     *     The banner variables, which must be in the recoded dataset.
     *
     * @return The report.
     *
     * @throws InvalidSurveyDataException
     *     if {@code bannerSpec} names a variable that isn't in the dataset.
     */
    static AuditReport create(RecodeResult recodeResult, BannerSpec bannerSpec) {
        SurveyDataset dataset = recodeResult.dataset();
        bannerSpec.validate(dataset.catalog());

        Map<VariableKind, Integer> kindCounts = new EnumMap<>(VariableKind.class);
        for (VariableKind kind : VariableKind.values()) {
            kindCounts.put(kind, 0);
        }
        for (Variable variable : dataset.originalVariables()) {
            kindCounts.merge(variable.kind(), 1, Integer::sum);
        }

        BannerLayout layout = BannerLayout.create(dataset, recodeResult.missingCodes(), bannerSpec, false, false);
        List<BannerColumn> bannerColumns = new ArrayList<>();
        for (BannerGroup group : layout.groups()) {
            bannerColumns.addAll(group.columns());
        }

        List<RowEntry> rows = new ArrayList<>();
        for (Variable variable : new BannerTableAssembler().rowVariables(dataset, bannerSpec)) {
            TableSection section = dataset.isDerived(variable.name()) ?
                TableSection.BOX_SUMMARY :
                TableSection.FULL_DISTRIBUTION;
            rows.add(new RowEntry(variable, section));
        }

        return new AuditReport(
            dataset.observationCount(),
            dataset.originalVariables().size(),
            dataset.derivedVariables().size(),
            kindCounts,
            recodeResult.recodedVariables(),
            bannerColumns,
            rows);
    }

    /**
     * @return The number of respondents.
     */
    public int respondentCount() {
        return respondentCount;
    }

    /**
     * @return The number of variables in the original survey.
     */
    public int originalVariableCount() {
        return originalVariableCount;
    }

    /**
     * @return The number of recoded variables.
     */
    public int recodedVariableCount() {
        return recodedVariableCount;
    }

    /**
     * Gets the number of original variables of each kind.
     *
     * @return A map with an entry for every kind. The returned map is not modifiable.
     */
    public Map<VariableKind, Integer> kindCounts() {
        return Collections.unmodifiableMap(kindCounts);
    }

    /**
     * Gets the recoded variables, each of which knows its source and its number of scale points.
     *
     * @return The recoded variables. The returned list is not modifiable.
     */
    public List<RecodedVariable> recodedVariables() {
        return Collections.unmodifiableList(recodedVariables);
    }

    /**
     * Gets every column of every banner variable, including empty ones.
     *
     * @return The columns in banner order. The returned list is not modifiable.
     */
    public List<BannerColumn> bannerColumns() {
        return Collections.unmodifiableList(bannerColumns);
    }

    /**
     * Gets the share of all respondents in a banner column.
     *
     * @param column
     *     The column.
     *
     * @return The share as a fraction between 0 and 1, or 0 if there are no respondents.
     */
    public double respondentShare(BannerColumn column) {
        return respondentCount == 0 ? 0 : (double) column.respondentCount() / respondentCount;
    }

    /**
     * Gets the rows that the banner table will have.
     *
     * @return The rows in table order. The returned list is not modifiable.
     */
    public List<RowEntry> rows() {
        return Collections.unmodifiableList(rows);
    }
}
