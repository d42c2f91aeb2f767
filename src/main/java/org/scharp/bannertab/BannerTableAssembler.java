///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders the rows of a banner table and merges the per-item tabulation results into a {@link BannerTable}.
 * <p>
 * Unless the rows were listed explicitly, they are the original ordinal scales, then the original nominal and binary
 * variables, then the recoded variables, each group in dataset order.  Banner variables are never rows.  The merge is
 * by position, so the table is the same whatever order the work items finished in.
 * </p>
 */
public final class BannerTableAssembler {

    /**
     * Determines the row variables of a table.
     *
     * @param dataset
     *     The recoded dataset.
     * @param bannerSpec
     *     The banner spec, which may list the rows explicitly.
     *
     * @return The row variables in table order.
     */
    public List<Variable> rowVariables(SurveyDataset dataset, BannerSpec bannerSpec) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(bannerSpec, "bannerSpec");

        List<Variable> rows = new ArrayList<>();
        if (bannerSpec.hasExplicitRowVariables()) {
            for (String name : bannerSpec.rowVariables()) {
                rows.add(dataset.variable(name));
            }
            return rows;
        }

        List<String> bannerVariables = bannerSpec.bannerVariables();
        for (Variable variable : dataset.originalVariables()) {
            if (variable.kind() == VariableKind.ORDINAL_SCALE && !bannerVariables.contains(variable.name())) {
                rows.add(variable);
            }
        }
        for (Variable variable : dataset.originalVariables()) {
            VariableKind kind = variable.kind();
            if ((kind == VariableKind.NOMINAL || kind == VariableKind.BINARY) &&
                !bannerVariables.contains(variable.name())) {
                rows.add(variable);
            }
        }
        for (Variable variable : dataset.derivedVariables()) {
            if (!bannerVariables.contains(variable.name())) {
                rows.add(variable);
            }
        }
        return rows;
    }

    /**
     * Enumerates the work items of a table: every row variable against every banner group, row-major.
     *
     * @param dataset
     *     The recoded dataset.
     * @param rowVariables
     *     The row variables in table order.
     * @param layout
     *     The banner columns.
     *
     * @return The work items, whose indexes are their positions in the list.
     */
    List<TabulationWorkItem> workItems(SurveyDataset dataset, List<Variable> rowVariables, BannerLayout layout) {
        List<TabulationWorkItem> workItems = new ArrayList<>(rowVariables.size() * layout.groups().size());
        for (Variable rowVariable : rowVariables) {
            TableSection section = dataset.isDerived(rowVariable.name()) ?
                TableSection.BOX_SUMMARY :
                TableSection.FULL_DISTRIBUTION;
            for (BannerGroup group : layout.groups()) {
                workItems.add(new TabulationWorkItem(workItems.size(), rowVariable, section, group,
                    group.visibleColumns(layout.skipsEmptyColumns())));
            }
        }
        return workItems;
    }

    /**
     * Merges tabulation results into a table.
     *
     * @param title
     *     The table's title.
     * @param respondentCount
     *     The number of respondents.
     * @param layout
     *     The banner columns.
     * @param results
     *     One result per work item, in work item order.
     * @param warnings
     *     The warnings of the whole tabulation.
     *
     * @return The table.
     */
    BannerTable assemble(String title, int respondentCount, BannerLayout layout, List<TabulationResult> results,
        List<PipelineWarning> warnings) {
        final int groupCount = layout.groups().size();
        assert groupCount == 0 || results.size() % groupCount == 0 : "results are not row x group";

        List<BannerTableBlock> blocks = new ArrayList<>();
        for (int start = 0; start < results.size(); start += groupCount) {
            List<Crosstab> crosstabs = new ArrayList<>(groupCount);
            List<SignificanceResult> significanceResults = new ArrayList<>();
            for (TabulationResult result : results.subList(start, start + groupCount)) {
                assert result.workItem().index() == start + crosstabs.size() : "result out of order";
                crosstabs.add(result.crosstab());
                if (result.significance() != null) {
                    significanceResults.add(result.significance());
                }
            }

            TabulationWorkItem first = results.get(start).workItem();
            blocks.add(new BannerTableBlock(first.rowVariable(), first.section(), crosstabs, significanceResults));
        }

        return new BannerTable(title, respondentCount, layout.visibleColumns(), layout.hiddenColumns(), blocks,
            warnings);
    }
}
