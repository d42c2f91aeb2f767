///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The output of recoding a whole dataset: the derived dataset, what was recoded, what was skipped, and the
 * non-substantive codes that were excluded along the way.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class RecodeResult {

    private final SurveyDataset dataset;
    private final List<RecodedVariable> recodedVariables;
    private final List<RecodeSkip> skips;
    private final Map<String, MissingCodeSet> missingCodes;
    private final List<PipelineWarning> warnings;

    RecodeResult(SurveyDataset dataset, List<RecodedVariable> recodedVariables, List<RecodeSkip> skips,
        Map<String, MissingCodeSet> missingCodes, List<PipelineWarning> warnings) {
        this.dataset = dataset;
        this.recodedVariables = recodedVariables;
        this.skips = skips;
        this.missingCodes = missingCodes;
        this.warnings = warnings;
    }

    /**
     * Gets the derived dataset.  It has every original variable, unchanged and in the original order, followed by the
     * recoded variables.
     *
     * @return The derived dataset. It has as many observations as the input dataset.
     */
    public SurveyDataset dataset() {
        return dataset;
    }

    /**
     * Gets the recoded variables in the order they were appended.
     *
     * @return The recoded variables. The returned list is not modifiable.
     */
    public List<RecodedVariable> recodedVariables() {
        return Collections.unmodifiableList(recodedVariables);
    }

    /**
     * Gets the ordinal scales that were not recoded.
     *
     * @return The skips. The returned list is not modifiable.
     */
    public List<RecodeSkip> skips() {
        return Collections.unmodifiableList(skips);
    }

    /**
     * Gets the non-substantive codes of every variable, including the derived ones.
     *
     * @return A map from variable name to its missing codes. The returned map is not modifiable.
     */
    public Map<String, MissingCodeSet> missingCodes() {
        return Collections.unmodifiableMap(missingCodes);
    }

    /**
     * Gets the warnings that were raised while recoding.
     *
     * @return The warnings. The returned list is not modifiable.
     */
    public List<PipelineWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
