///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * The result of running one stage of a {@link BannerPipeline}: either the stage's output, or the decision it is waiting
 * for.
 *
 * @param <T>
 *     The type of the stage's output.
 */
public final class StageResult<T> {

    private final T value;
    private final PendingDecision pendingDecision;

    private StageResult(T value, PendingDecision pendingDecision) {
        this.value = value;
        this.pendingDecision = pendingDecision;
    }

    static <T> StageResult<T> completed(T value) {
        assert value != null : "value must not be null";
        return new StageResult<>(value, null);
    }

    static <T> StageResult<T> pending(PendingDecision pendingDecision) {
        assert pendingDecision != null : "pendingDecision must not be null";
        return new StageResult<>(null, pendingDecision);
    }

    /**
     * Determines if the stage is waiting for a decision.
     *
     * @return {@code true} if the stage stopped without output.
     */
    public boolean isPending() {
        return pendingDecision != null;
    }

    /**
     * Gets the stage's output.
     *
     * @return The output.
     *
     * @throws IllegalStateException
     *     if the stage is waiting for a decision.
     */
    public T value() {
        if (pendingDecision != null) {
            throw new IllegalStateException("the stage is waiting for a decision: " + pendingDecision.message());
        }
        return value;
    }

    /**
     * Gets the decision for which the stage is waiting.
     *
     * @return The pending decision.
     *
     * @throws IllegalStateException
     *     if the stage completed.
     */
    public PendingDecision pendingDecision() {
        if (pendingDecision == null) {
            throw new IllegalStateException("the stage completed");
        }
        return pendingDecision;
    }

    @Override
    public String toString() {
        return isPending() ? "pending " + pendingDecision : "completed " + value;
    }
}
