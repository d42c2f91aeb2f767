///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the warnings of one stage and logs each as it's recorded.
 * <p>
 * Instances are confined to the thread that runs the stage.
 * </p>
 */
final class WarningLog {

    private final Logger logger;
    private final List<PipelineWarning> warnings;

    WarningLog(Logger logger) {
        this.logger = logger;
        this.warnings = new ArrayList<>();
    }

    void add(WarningType type, String variableName, String bannerVariableName, String detail) {
        add(new PipelineWarning(type, variableName, bannerVariableName, detail));
    }

    void add(PipelineWarning warning) {
        logger.warn("{}", warning);
        warnings.add(warning);
    }

    void addAll(List<PipelineWarning> moreWarnings) {
        for (PipelineWarning warning : moreWarnings) {
            add(warning);
        }
    }

    List<PipelineWarning> warnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }
}
