///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a completed {@link BannerPipeline} produced: the recoded dataset, the banner table with its significance
 * results, the audit, the verification queries, and every warning raised along the way.
 */
public final class PipelineOutput {

    private final ClassificationResult classificationResult;
    private final RecodeResult recodeResult;
    private final BannerSpec bannerSpec;
    private final AuditReport auditReport;
    private final BannerTable bannerTable;
    private final VerificationQueryDocument verificationDocument;

    PipelineOutput(ClassificationResult classificationResult, RecodeResult recodeResult, BannerSpec bannerSpec,
        AuditReport auditReport, BannerTable bannerTable, VerificationQueryDocument verificationDocument) {
        this.classificationResult = classificationResult;
        this.recodeResult = recodeResult;
        this.bannerSpec = bannerSpec;
        this.auditReport = auditReport;
        this.bannerTable = bannerTable;
        this.verificationDocument = verificationDocument;
    }

    /**
     * @return The output of the classification stage.
     */
    public ClassificationResult classificationResult() {
        return classificationResult;
    }

    /**
     * @return The output of the recoding stage.
     */
    public RecodeResult recodeResult() {
        return recodeResult;
    }

    /**
     * Gets the derived dataset: the original variables, untouched, followed by the recoded variables.
     *
     * @return The recoded dataset.
     */
    public SurveyDataset dataset() {
        return recodeResult.dataset();
    }

    /**
     * Gets the banner spec that was tabulated, including any banner variables that were chosen by decision.
     *
     * @return The banner spec.
     */
    public BannerSpec bannerSpec() {
        return bannerSpec;
    }

    /**
     * @return The audit of the recoded data.
     */
    public AuditReport auditReport() {
        return auditReport;
    }

    /**
     * @return The banner table.
     */
    public BannerTable bannerTable() {
        return bannerTable;
    }

    /**
     * @return The significance results in table order.
     */
    public List<SignificanceResult> significanceResults() {
        return bannerTable.significanceResults();
    }

    /**
     * @return The queries with which another tool can verify the banner table.
     */
    public VerificationQueryDocument verificationDocument() {
        return verificationDocument;
    }

    /**
     * Gets every warning of every stage.
     *
     * @return The warnings in the order they were raised. The returned list is not modifiable.
     */
    public List<PipelineWarning> warnings() {
        List<PipelineWarning> warnings = new ArrayList<>(classificationResult.warnings());
        warnings.addAll(recodeResult.warnings());
        warnings.addAll(bannerTable.warnings());
        return Collections.unmodifiableList(warnings);
    }
}
