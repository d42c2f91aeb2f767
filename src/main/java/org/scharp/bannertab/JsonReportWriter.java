///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders pipeline results as JSON documents: the recoding documentation, the audit, the banner table, the
 * significance results, the verification queries, and the warnings.
 * <p>
 * A value that can't be computed, such as the percentage of a cell with a zero base or the p-value of a degenerate
 * test, is written as {@code null}.
 * </p>
 */
public final class JsonReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper;

    /**
     * Creates a writer that indents its output.
     */
    public JsonReportWriter() {
        objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Documents what the recoding stage did.
     *
     * @param recodeResult
     *     The output of the recoding stage.
     * @param originalVariableCount
     *     The number of variables in the original survey.
     *
     * @return The documentation.
     */
    public ObjectNode recodingDocumentation(RecodeResult recodeResult, int originalVariableCount) {
        ArgumentUtil.checkNotNull(recodeResult, "recodeResult");

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode dontKnowCodes = root.putObject("dontKnowCodes");
        for (Map.Entry<String, MissingCodeSet> entry : recodeResult.missingCodes().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                ArrayNode codes = dontKnowCodes.putArray(entry.getKey());
                for (Integer code : entry.getValue().codes()) {
                    codes.add(code);
                }
            }
        }

        ArrayNode recodings = root.putArray("recodings");
        for (RecodedVariable recodedVariable : recodeResult.recodedVariables()) {
            ObjectNode recoding = recodings.addObject();
            recoding.put("original", recodedVariable.sourceVariableName());
            recoding.put("recoded", recodedVariable.name());
            recoding.put("scheme", recodedVariable.spec().schemeName());
            recoding.put("scalePoints", recodedVariable.scalePoints());
            recoding.put("threshold", recodedVariable.threshold());
            ArrayNode thresholdCodes = recoding.putArray("thresholdCodes");
            for (Integer code : recodedVariable.thresholdCodes()) {
                thresholdCodes.add(code);
            }
            ArrayNode thresholdLabels = recoding.putArray("thresholdLabels");
            for (String label : recodedVariable.thresholdLabels()) {
                thresholdLabels.add(label);
            }
            recoding.put("originalLabel", recodedVariable.sourceLabel());
            recoding.put("recodedLabel", recodedVariable.variable().label());
        }

        ArrayNode skips = root.putArray("skipped");
        for (RecodeSkip skip : recodeResult.skips()) {
            ObjectNode skipNode = skips.addObject();
            skipNode.put("variable", skip.variableName());
            skipNode.put("scheme", skip.spec().schemeName());
            skipNode.put("reason", skip.reason());
        }

        root.put("originalVariableCount", originalVariableCount);
        root.put("totalVariableCount", recodeResult.dataset().catalog().size());
        root.put("respondentCount", recodeResult.dataset().observationCount());
        return root;
    }

    /**
     * Renders an audit report.
     *
     * @param report
     *     The audit report.
     *
     * @return The report as JSON.
     */
    public ObjectNode auditReport(AuditReport report) {
        ArgumentUtil.checkNotNull(report, "report");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("respondentCount", report.respondentCount());
        root.put("originalVariableCount", report.originalVariableCount());
        root.put("recodedVariableCount", report.recodedVariableCount());

        ObjectNode kindCounts = root.putObject("kindCounts");
        for (Map.Entry<VariableKind, Integer> entry : report.kindCounts().entrySet()) {
            kindCounts.put(entry.getKey().name(), entry.getValue());
        }

        ArrayNode mapping = root.putArray("recodedVariables");
        for (RecodedVariable recodedVariable : report.recodedVariables()) {
            ObjectNode node = mapping.addObject();
            node.put("recoded", recodedVariable.name());
            node.put("original", recodedVariable.sourceVariableName());
            node.put("scalePoints", recodedVariable.scalePoints());
        }

        ArrayNode bannerColumns = root.putArray("bannerColumns");
        for (BannerColumn column : report.bannerColumns()) {
            ObjectNode node = bannerColumns.addObject();
            node.put("bannerVariable", column.bannerVariableName());
            node.put("category", column.categoryCode());
            node.put("label", column.categoryLabel());
            node.put("n", column.respondentCount());
            node.put("share", report.respondentShare(column));
            node.put("empty", column.isEmpty());
        }

        ArrayNode rows = root.putArray("rows");
        for (AuditReport.RowEntry row : report.rows()) {
            ObjectNode node = rows.addObject();
            node.put("variable", row.variable().name());
            node.put("tag", row.section().tag());
            node.put("label", row.variable().label());
        }
        return root;
    }

    /**
     * Renders a banner table.
     *
     * @param table
     *     The banner table.
     *
     * @return The table as JSON.
     */
    public ObjectNode bannerTable(BannerTable table) {
        ArgumentUtil.checkNotNull(table, "table");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", table.title());
        root.put("respondentCount", table.respondentCount());

        ArrayNode columns = root.putArray("columns");
        for (BannerColumn column : table.columns()) {
            columns.add(column.displayLabel());
        }
        ArrayNode hiddenColumns = root.putArray("hiddenColumns");
        for (BannerColumn column : table.hiddenColumns()) {
            hiddenColumns.add(column.displayLabel());
        }

        ArrayNode blocks = root.putArray("blocks");
        for (BannerTableBlock block : table.blocks()) {
            ObjectNode blockNode = blocks.addObject();
            blockNode.put("variable", block.rowVariable().name());
            blockNode.put("label", block.rowVariable().label());
            blockNode.put("section", block.section().name());

            ArrayNode bases = blockNode.putArray("bases");
            for (Integer base : block.bases()) {
                bases.add(base);
            }

            ArrayNode values = blockNode.putArray("values");
            List<Integer> rowCodes = block.rowCodes();
            for (int i = 0; i < rowCodes.size(); i++) {
                List<CrosstabCell> cells = block.valueRow(i);
                ObjectNode valueNode = values.addObject();
                valueNode.put("code", rowCodes.get(i));
                valueNode.put("label", cells.isEmpty() ? String.valueOf(rowCodes.get(i)) : cells.get(0).rowLabel());
                ArrayNode counts = valueNode.putArray("counts");
                ArrayNode percentages = valueNode.putArray("percentages");
                ArrayNode formatted = valueNode.putArray("formatted");
                for (CrosstabCell cell : cells) {
                    counts.add(cell.count());
                    if (cell.isComputable()) {
                        percentages.add(cell.percentage());
                    } else {
                        percentages.addNull();
                    }
                    formatted.add(cell.formattedPercentage());
                }
            }

            blockNode.set("significance", significanceResults(block.significanceResults()));
        }

        root.set("warnings", warnings(table.warnings()));
        return root;
    }

    /**
     * Renders significance results.
     *
     * @param results
     *     The results.
     *
     * @return An array with one object per result.
     */
    public ArrayNode significanceResults(List<SignificanceResult> results) {
        ArgumentUtil.checkNotNull(results, "results");

        ArrayNode array = objectMapper.createArrayNode();
        for (SignificanceResult result : results) {
            ObjectNode node = array.addObject();
            node.put("rowVariable", result.rowVariableName());
            node.put("bannerVariable", result.bannerVariableName());
            putNumber(node, "chiSquare", result.chiSquare());
            node.put("degreesOfFreedom", result.degreesOfFreedom());
            putNumber(node, "pValue", result.pValue());
            node.put("flag", result.flag().name());
            node.put("lowPower", result.lowPower());
            node.put("degenerate", result.degenerate());
        }
        return array;
    }

    /**
     * Renders a verification query document.
     *
     * @param document
     *     The document.
     *
     * @return The document as JSON.
     */
    public ObjectNode verificationDocument(VerificationQueryDocument document) {
        ArgumentUtil.checkNotNull(document, "document");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", document.title());
        root.put("generatedAt", document.generatedAt().toString());
        ArrayNode bannerVariables = root.putArray("bannerVariables");
        document.bannerVariableNames().forEach(bannerVariables::add);
        ArrayNode rowVariables = root.putArray("rowVariables");
        document.rowVariableNames().forEach(rowVariables::add);

        ArrayNode queries = root.putArray("queries");
        for (VerificationQuery query : document.queries()) {
            ObjectNode node = queries.addObject();
            node.put("rowVariable", query.rowVariableName());
            ArrayNode by = node.putArray("bannerVariables");
            query.bannerVariableNames().forEach(by::add);
            ArrayNode statistics = node.putArray("statistics");
            for (VerificationStatistic statistic : query.statistics()) {
                statistics.add(statistic.name());
            }
            node.put("categoryOrder", query.ascendingCategoryOrder() ? "ASCENDING" : "DESCENDING");
            node.put("includeEmptyCategories", query.includeEmptyCategories());
            node.put("section", query.section().name());
        }
        return root;
    }

    /**
     * Renders warnings.
     *
     * @param warnings
     *     The warnings.
     *
     * @return An array with one object per warning.
     */
    public ArrayNode warnings(List<PipelineWarning> warnings) {
        ArgumentUtil.checkNotNull(warnings, "warnings");

        ArrayNode array = objectMapper.createArrayNode();
        for (PipelineWarning warning : warnings) {
            ObjectNode node = array.addObject();
            node.put("type", warning.type().name());
            node.put("variable", warning.variableName());
            if (warning.bannerVariableName() != null) {
                node.put("bannerVariable", warning.bannerVariableName());
            }
            node.put("detail", warning.detail());
        }
        return array;
    }

    /**
     * Renders everything a pipeline produced.
     *
     * @param output
     *     The output of a completed pipeline.
     *
     * @return A document with one member per part of the output.
     */
    public ObjectNode pipelineOutput(PipelineOutput output) {
        ArgumentUtil.checkNotNull(output, "output");

        ObjectNode root = objectMapper.createObjectNode();
        root.set("recoding", recodingDocumentation(output.recodeResult(),
            output.dataset().originalVariables().size()));
        root.set("audit", auditReport(output.auditReport()));
        root.set("bannerTable", bannerTable(output.bannerTable()));
        root.set("significance", significanceResults(output.significanceResults()));
        root.set("verification", verificationDocument(output.verificationDocument()));
        root.set("warnings", warnings(output.warnings()));
        return root;
    }

    /**
     * Serializes a document.
     *
     * @param document
     *     The document.
     *
     * @return Indented JSON text.
     *
     * @throws JsonProcessingException
     *     if the document can't be serialized.
     */
    public String toJson(JsonNode document) throws JsonProcessingException {
        return objectMapper.writeValueAsString(document);
    }

    /**
     * Writes a document to a file, replacing the file if it exists.
     *
     * @param document
     *     The document.
     * @param path
     *     The file.
     *
     * @throws IOException
     *     if the file can't be written.
     */
    public void write(JsonNode document, Path path) throws IOException {
        ArgumentUtil.checkNotNull(document, "document");
        ArgumentUtil.checkNotNull(path, "path");

        Files.writeString(path, toJson(document));
        logger.info("wrote {}", path);
    }

    private static void putNumber(ObjectNode node, String fieldName, double value) {
        if (Double.isNaN(value)) {
            node.putNull(fieldName);
        } else {
            node.put(fieldName, value);
        }
    }
}
