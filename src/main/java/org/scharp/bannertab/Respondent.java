///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * A read-only view of one respondent's answers in a {@link SurveyDataset}.
 */
public final class Respondent {

    private final SurveyDataset dataset;
    private final int observation;

    Respondent(SurveyDataset dataset, int observation) {
        this.dataset = dataset;
        this.observation = observation;
    }

    /**
     * Gets the respondent's position in the dataset.
     *
     * @return The zero-based observation number.
     */
    public int observation() {
        return observation;
    }

    /**
     * Gets the respondent's answer to one variable.
     *
     * @param variableName
     *     The name of the variable.
     *
     * @return The coded answer, or {@code null} if the answer is missing.
     *
     * @throws InvalidSurveyDataException
     *     if there is no such variable.
     */
    public Integer value(String variableName) {
        return dataset.value(observation, variableName);
    }
}
