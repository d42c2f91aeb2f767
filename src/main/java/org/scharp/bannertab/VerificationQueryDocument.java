///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The cross-tabulation requests that reproduce a {@link BannerTable}, one per row variable, original variables first.
 */
public final class VerificationQueryDocument {

    private final String title;
    private final Instant generatedAt;
    private final List<String> bannerVariableNames;
    private final List<VerificationQuery> queries;

    private VerificationQueryDocument(String title, Instant generatedAt, List<String> bannerVariableNames,
        List<VerificationQuery> queries) {
        this.title = title;
        this.generatedAt = generatedAt;
        this.bannerVariableNames = bannerVariableNames;
        this.queries = queries;
    }

    /**
     * Describes the queries that reproduce a banner table.
     *
     * @param table
     *     The banner table.
     * @param bannerSpec
     *     The banner variables of the table.
     * @param generatedAt
     *     When the document was generated.
     *
     * @return The document.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public static VerificationQueryDocument create(BannerTable table, BannerSpec bannerSpec, Instant generatedAt) {
        ArgumentUtil.checkNotNull(table, "table");
        ArgumentUtil.checkNotNull(bannerSpec, "bannerSpec");
        ArgumentUtil.checkNotNull(generatedAt, "generatedAt");

        List<String> bannerVariableNames = bannerSpec.bannerVariables();
        List<VerificationQuery> queries = new ArrayList<>(table.blocks().size());
        for (TableSection section : TableSection.values()) {
            for (BannerTableBlock block : table.blocks()) {
                if (block.section() == section) {
                    queries.add(new VerificationQuery(block.rowVariable().name(), bannerVariableNames, section));
                }
            }
        }

        String title = table.title().isEmpty() ? "Survey Analysis" : table.title();
        return new VerificationQueryDocument(title, generatedAt, List.copyOf(bannerVariableNames), queries);
    }

    /**
     * @return The document's title.
     */
    public String title() {
        return title;
    }

    /**
     * @return When the document was generated.
     */
    public Instant generatedAt() {
        return generatedAt;
    }

    /**
     * @return The banner variables. The returned list is not modifiable.
     */
    public List<String> bannerVariableNames() {
        return bannerVariableNames;
    }

    /**
     * Gets the row variables of every query.
     *
     * @return The row variable names in query order.
     */
    public List<String> rowVariableNames() {
        List<String> names = new ArrayList<>(queries.size());
        for (VerificationQuery query : queries) {
            names.add(query.rowVariableName());
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * @return The queries, original variables first. The returned list is not modifiable.
     */
    public List<VerificationQuery> queries() {
        return Collections.unmodifiableList(queries);
    }
}
