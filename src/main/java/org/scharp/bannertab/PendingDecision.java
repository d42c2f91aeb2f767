///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.List;

/**
 * The reason a pipeline stage stopped: what has to be decided and the options to decide among.
 * <p>
 * The pipeline resumes when the stage is run again with a {@link DecisionRecord} that settles every option.
 * </p>
 */
public final class PendingDecision {

    private final PipelineStage stage;
    private final String message;
    private final List<DecisionOption> options;

    PendingDecision(PipelineStage stage, String message, List<DecisionOption> options) {
        this.stage = stage;
        this.message = message;
        this.options = List.copyOf(options);
    }

    /**
     * @return The stage that is waiting.
     */
    public PipelineStage stage() {
        return stage;
    }

    /**
     * @return A human-readable summary of what must be decided.
     */
    public String message() {
        return message;
    }

    /**
     * Gets the questions to answer.
     *
     * @return The options in dataset order. The returned list is not modifiable.
     */
    public List<DecisionOption> options() {
        return options;
    }

    @Override
    public String toString() {
        return stage + ": " + message + " " + options;
    }
}
