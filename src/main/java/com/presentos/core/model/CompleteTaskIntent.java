package com.presentos.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Marks an existing task as done. {@code status} is always {@link TaskStatus#COMPLETED}.
 */
public record CompleteTaskIntent(
    @JsonProperty("task_name") String taskName,
    TaskStatus status,
    String context,
    String source
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.COMPLETE_TASK;
    }
}
