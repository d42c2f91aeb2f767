///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Produces a {@link BannerTable} from a recoded dataset.
 * <p>
 * Each row variable is cross-tabulated against each banner group as an independent work item.  With a parallelism
 * above 1, the work items run on a fixed pool of threads; either way, the results are merged in work item order, so
 * the table and its warnings don't depend on which item finished first.  A work item's crosstab is either complete or
 * absent: if any item fails, the whole tabulation fails.
 * </p>
 */
public final class BannerTabulator {

    private static final Logger logger = LoggerFactory.getLogger(BannerTabulator.class);

    private final PipelineConfig config;
    private final CrosstabBuilder crosstabBuilder;
    private final SignificanceTester significanceTester;
    private final BannerTableAssembler assembler;

    /**
     * Creates a tabulator.
     *
     * @param config
     *     The configuration, which determines the columns, the tests and the parallelism.
     */
    public BannerTabulator(PipelineConfig config) {
        ArgumentUtil.checkNotNull(config, "config");

        this.config = config;
        this.crosstabBuilder = new CrosstabBuilder();
        this.significanceTester = config.runSignificanceTests() ? config.newSignificanceTester() : null;
        this.assembler = new BannerTableAssembler();
    }

    /**
     * Tabulates a dataset.
     *
     * @param dataset
     *     The recoded dataset.
     * @param missingCodes
     *     The non-substantive codes of each variable.  A variable without an entry is assumed to have none.
     * @param bannerSpec
     *     The banner variables and, optionally, the row variables.
     *
     * @return The banner table.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws InvalidSurveyDataException
     *     if {@code bannerSpec} names a variable that isn't in {@code dataset}.
     */
    public BannerTable tabulate(SurveyDataset dataset, Map<String, MissingCodeSet> missingCodes,
        BannerSpec bannerSpec) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(missingCodes, "missingCodes");
        ArgumentUtil.checkNotNull(bannerSpec, "bannerSpec");
        bannerSpec.validate(dataset.catalog());

        WarningLog warnings = new WarningLog(logger);
        BannerLayout layout = BannerLayout.create(dataset, missingCodes, bannerSpec, config.includeTotalColumn(),
            config.skipEmptyBannerColumns());
        for (BannerColumn column : layout.emptyColumns()) {
            warnings.add(WarningType.EMPTY_BANNER_COLUMN, column.bannerVariableName(), column.bannerVariableName(),
                "\"" + column.displayLabel() + "\" has no respondents" +
                    (layout.skipsEmptyColumns() ? " and is not shown" : ""));
        }
        List<Variable> rowVariables = assembler.rowVariables(dataset, bannerSpec);
        List<TabulationWorkItem> workItems = assembler.workItems(dataset, rowVariables, layout);

        logger.info("tabulating {} row variables against {} banner columns ({} work items)", rowVariables.size(),
            layout.visibleColumns().size(), workItems.size());

        List<TabulationResult> results = run(dataset, missingCodes, workItems);
        for (TabulationResult result : results) {
            warnings.addAll(result.warnings());
        }

        return assembler.assemble(dataset.catalog().surveyName(), dataset.observationCount(), layout, results,
            warnings.warnings());
    }

    private List<TabulationResult> run(SurveyDataset dataset, Map<String, MissingCodeSet> missingCodes,
        List<TabulationWorkItem> workItems) {
        if (config.parallelism() == 1 || workItems.size() <= 1) {
            List<TabulationResult> results = new ArrayList<>(workItems.size());
            for (TabulationWorkItem workItem : workItems) {
                results.add(tabulate(dataset, missingCodes, workItem));
            }
            return results;
        }

        List<Callable<TabulationResult>> tasks = new ArrayList<>(workItems.size());
        for (TabulationWorkItem workItem : workItems) {
            tasks.add(() -> tabulate(dataset, missingCodes, workItem));
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.parallelism(), workItems.size()));
        try {
            List<Future<TabulationResult>> futures = executor.invokeAll(tasks);
            List<TabulationResult> results = new ArrayList<>(futures.size());
            for (Future<TabulationResult> future : futures) {
                results.add(future.get());
            }
            return results;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("tabulation was interrupted", e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("tabulation failed", cause);

        } finally {
            executor.shutdownNow();
        }
    }

    private TabulationResult tabulate(SurveyDataset dataset, Map<String, MissingCodeSet> missingCodes,
        TabulationWorkItem workItem) {
        Variable rowVariable = workItem.rowVariable();
        BannerGroup group = workItem.group();
        MissingCodeSet rowMissingCodes = missingCodes.getOrDefault(rowVariable.name(), MissingCodeSet.EMPTY);

        Crosstab crosstab = crosstabBuilder.build(dataset, rowVariable, rowMissingCodes, group, workItem.columns());

        List<PipelineWarning> warnings = new ArrayList<>();
        for (BannerColumn column : crosstab.zeroBaseColumns()) {
            warnings.add(new PipelineWarning(WarningType.LOCAL_ZERO_BASE, rowVariable.name(),
                group.bannerVariableName(), "none of the " + column.respondentCount() + " respondents in \"" +
                column.displayLabel() + "\" gave a substantive answer"));
        }

        SignificanceResult significance = null;
        if (significanceTester != null && !group.isTotal()) {
            significance = significanceTester.test(crosstab);
            if (significance.degenerate()) {
                warnings.add(new PipelineWarning(WarningType.DEGENERATE_SIGNIFICANCE_TEST, rowVariable.name(),
                    group.bannerVariableName(), "fewer than two non-empty rows or columns to test"));
            } else if (significance.lowPower()) {
                warnings.add(new PipelineWarning(WarningType.LOW_EXPECTED_FREQUENCY, rowVariable.name(),
                    group.bannerVariableName(), "an expected cell frequency is below " +
                    config.minimumExpectedFrequency()));
            }
        }

        logger.debug("tabulated {}", workItem);
        return new TabulationResult(workItem, crosstab, significance, warnings);
    }
}
