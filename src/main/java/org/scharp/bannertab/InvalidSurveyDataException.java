///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * Thrown when a survey dataset, its metadata, or a banner specification does not describe a consistent survey: for
 * example, an observation with the wrong number of values, two variables with the same name, or a banner variable that
 * doesn't exist.
 * <p>
 * This is the only problem that aborts a pipeline run. Everything else is reported as a {@link PipelineWarning}.
 * </p>
 */
public class InvalidSurveyDataException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message
     *     A description of what is wrong with the input.
     */
    public InvalidSurveyDataException(String message) {
        super(message);
    }
}
