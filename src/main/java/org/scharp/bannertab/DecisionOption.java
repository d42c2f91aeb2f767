///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.List;
import java.util.Objects;

/**
 * One question of a {@link PendingDecision}: a subject (usually a variable), what is known about it, the possible
 * answers, and the answer that the pipeline would choose by itself.
 */
public final class DecisionOption {

    private final String subject;
    private final String description;
    private final List<String> choices;
    private final String suggestedChoice;

    DecisionOption(String subject, String description, List<String> choices, String suggestedChoice) {
        assert choices.contains(suggestedChoice) : suggestedChoice + " is not one of " + choices;
        this.subject = subject;
        this.description = description;
        this.choices = List.copyOf(choices);
        this.suggestedChoice = suggestedChoice;
    }

    /**
     * @return What the question is about, usually a variable name.
     */
    public String subject() {
        return subject;
    }

    /**
     * @return A human-readable description of the subject.
     */
    public String description() {
        return description;
    }

    /**
     * @return The possible answers. The returned list is not modifiable.
     */
    public List<String> choices() {
        return choices;
    }

    /**
     * @return The answer the pipeline suggests, which is one of {@link #choices()}.
     */
    public String suggestedChoice() {
        return suggestedChoice;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, description, choices, suggestedChoice);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DecisionOption that)) {
            return false;
        }
        return subject.equals(that.subject) &&
            description.equals(that.description) &&
            choices.equals(that.choices) &&
            suggestedChoice.equals(that.suggestedChoice);
    }

    @Override
    public String toString() {
        return subject + " " + choices + " (suggested: " + suggestedChoice + ") - " + description;
    }
}
