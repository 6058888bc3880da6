package com.presentos.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A task as stored in the external document store.
 * <p>
 * {@code id} is null until the store has assigned one. The link fields are
 * attached after creation by the reconciliation step.
 */
public record TaskRecord(
    String id,
    String title,
    String result,
    String purpose,
    @JsonProperty("action_plan") List<String> actionPlan,
    TaskRole role,
    TaskStatus status,
    OffsetDateTime due,
    int xp,
    @JsonProperty("created_at") OffsetDateTime createdAt,
    String source,
    String context,
    @JsonProperty("calendar_link") String calendarLink,
    @JsonProperty("email_link") String emailLink
) {

    public TaskRecord withId(String newId) {
        return new TaskRecord(newId, title, result, purpose, actionPlan, role, status, due, xp,
                createdAt, source, context, calendarLink, emailLink);
    }
}
