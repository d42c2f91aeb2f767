///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The output of the classification stage: the dataset with every variable's kind set, how each kind was decided, the
 * non-substantive codes of every variable, and the variables that would make good banners.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class ClassificationResult {

    private final SurveyDataset dataset;
    private final List<Classification> classifications;
    private final Map<String, MissingCodeSet> missingCodes;
    private final List<String> bannerCandidates;
    private final List<PipelineWarning> warnings;

    ClassificationResult(SurveyDataset dataset, List<Classification> classifications,
        Map<String, MissingCodeSet> missingCodes, List<String> bannerCandidates, List<PipelineWarning> warnings) {
        this.dataset = dataset;
        this.classifications = classifications;
        this.missingCodes = missingCodes;
        this.bannerCandidates = bannerCandidates;
        this.warnings = warnings;
    }

    /**
     * Gets the classified dataset.  Its data is the same as the input's; only the variables' kinds differ.
     *
     * @return The classified dataset.
     */
    public SurveyDataset dataset() {
        return dataset;
    }

    /**
     * Gets every variable's classification.
     *
     * @return The classifications in dataset order. The returned list is not modifiable.
     */
    public List<Classification> classifications() {
        return Collections.unmodifiableList(classifications);
    }

    /**
     * Gets the classification of one variable.
     *
     * @param variableName
     *     The name of the variable.
     *
     * @return The classification.
     *
     * @throws InvalidSurveyDataException
     *     if there is no such variable.
     */
    public Classification classification(String variableName) {
        for (Classification classification : classifications) {
            if (classification.variableName().equals(variableName)) {
                return classification;
            }
        }
        throw new InvalidSurveyDataException("there is no variable named \"" + variableName + "\"");
    }

    /**
     * Gets the non-substantive codes of every variable.
     *
     * @return A map from variable name to its missing codes, in dataset order. The returned map is not modifiable.
     */
    public Map<String, MissingCodeSet> missingCodes() {
        return Collections.unmodifiableMap(missingCodes);
    }

    /**
     * Gets the variables that are suggested as banners: nominal or binary variables with no "don't know" codes.
     *
     * @return The names of the suggested banner variables. The returned list is not modifiable.
     */
    public List<String> bannerCandidates() {
        return Collections.unmodifiableList(bannerCandidates);
    }

    /**
     * Gets the warnings raised while classifying.
     *
     * @return The warnings. The returned list is not modifiable.
     */
    public List<PipelineWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
