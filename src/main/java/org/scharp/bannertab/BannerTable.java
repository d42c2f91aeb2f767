///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A banner table: one block per row variable, split into the visible banner columns.
 * <p>
 * This is what a renderer consumes.  Empty columns that were hidden are listed separately so that they can be
 * reported.  Instances of this class are immutable.
 * </p>
 */
public final class BannerTable {

    private final String title;
    private final int respondentCount;
    private final List<BannerColumn> columns;
    private final List<BannerColumn> hiddenColumns;
    private final List<BannerTableBlock> blocks;
    private final List<PipelineWarning> warnings;

    BannerTable(String title, int respondentCount, List<BannerColumn> columns, List<BannerColumn> hiddenColumns,
        List<BannerTableBlock> blocks, List<PipelineWarning> warnings) {
        this.title = title;
        this.respondentCount = respondentCount;
        this.columns = columns;
        this.hiddenColumns = hiddenColumns;
        this.blocks = blocks;
        this.warnings = warnings;
    }

    /**
     * @return The table's title, which is the survey's name. This may be empty.
     */
    public String title() {
        return title;
    }

    /**
     * @return The number of respondents in the dataset.
     */
    public int respondentCount() {
        return respondentCount;
    }

    /**
     * Gets the column headers.
     *
     * @return The visible columns in display order. The returned list is not modifiable.
     */
    public List<BannerColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Gets the columns that were hidden because they have no respondents.
     *
     * @return The hidden columns. The returned list is not modifiable.
     */
    public List<BannerColumn> hiddenColumns() {
        return Collections.unmodifiableList(hiddenColumns);
    }

    /**
     * Gets the blocks.
     *
     * @return The blocks in row order. The returned list is not modifiable.
     */
    public List<BannerTableBlock> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Gets the block of one row variable.
     *
     * @param rowVariableName
     *     The name of the row variable.
     *
     * @return The block.
     *
     * @throws IllegalArgumentException
     *     if the variable is not a row of this table.
     */
    public BannerTableBlock block(String rowVariableName) {
        for (BannerTableBlock block : blocks) {
            if (block.rowVariable().name().equals(rowVariableName)) {
                return block;
            }
        }
        throw new IllegalArgumentException("\"" + rowVariableName + "\" is not a row of this table");
    }

    /**
     * Gets every significance result of the table.
     *
     * @return The results in row order, then banner order.
     */
    public List<SignificanceResult> significanceResults() {
        List<SignificanceResult> results = new ArrayList<>();
        for (BannerTableBlock block : blocks) {
            results.addAll(block.significanceResults());
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Gets the warnings raised while tabulating.
     *
     * @return The warnings. The returned list is not modifiable.
     */
    public List<PipelineWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
