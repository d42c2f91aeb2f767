///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.List;

/**
 * The complete result of one {@link TabulationWorkItem}.
 */
final class TabulationResult {

    private final TabulationWorkItem workItem;
    private final Crosstab crosstab;
    private final SignificanceResult significance;
    private final List<PipelineWarning> warnings;

    TabulationResult(TabulationWorkItem workItem, Crosstab crosstab, SignificanceResult significance,
        List<PipelineWarning> warnings) {
        this.workItem = workItem;
        this.crosstab = crosstab;
        this.significance = significance;
        this.warnings = warnings;
    }

    TabulationWorkItem workItem() {
        return workItem;
    }

    Crosstab crosstab() {
        return crosstab;
    }

    /** The test result, or {@code null} for the Total group or when tests are turned off. */
    SignificanceResult significance() {
        return significance;
    }

    List<PipelineWarning> warnings() {
        return warnings;
    }
}
