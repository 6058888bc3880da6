package com.presentos.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A trackable task.
 *
 * @param due          always set; equals the invocation time when the classifier gave no usable date
 * @param dueSpecified true when {@code due} came from the classifier rather than the default
 */
public record TaskIntent(
    String title,
    String result,
    String purpose,
    @JsonProperty("action_plan") List<String> actionPlan,
    TaskRole role,
    TaskStatus status,
    OffsetDateTime due,
    @JsonProperty("due_specified") boolean dueSpecified,
    int xp,
    String context,
    String source
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.TASK;
    }

    @Override
    public boolean forwardable() {
        return dueSpecified;
    }
}
