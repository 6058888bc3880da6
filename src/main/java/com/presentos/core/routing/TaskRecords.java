package com.presentos.core.routing;

import com.presentos.core.model.CalendarIntent;
import com.presentos.core.model.EmailIntent;
import com.presentos.core.model.IntentRecord;
import com.presentos.core.model.TaskIntent;
import com.presentos.core.model.TaskRecord;
import com.presentos.core.model.TaskRole;
import com.presentos.core.model.TaskStatus;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Builds the task record persisted for intents whose route creates one.
 * Calendar and email intents are stored as short summary tasks.
 */
final class TaskRecords {

    private TaskRecords() {}

    static TaskRecord fromIntent(IntentRecord record, OffsetDateTime createdAt) {
        if (record instanceof TaskIntent task) {
            return new TaskRecord(null, task.title(), task.result(), task.purpose(), task.actionPlan(),
                    task.role(), task.status(), task.due(), task.xp(), createdAt,
                    task.source(), task.context(), null, null);
        }
        if (record instanceof CalendarIntent event) {
            return new TaskRecord(null, event.title(), "Event scheduled", event.description(), List.of(),
                    TaskRole.ADMINISTRATOR, TaskStatus.TO_DO, event.start(), 0, createdAt,
                    event.source(), event.context(), null, null);
        }
        if (record instanceof EmailIntent email) {
            String title = email.subject().isBlank()
                    ? "Email to " + email.to()
                    : "Email to " + email.to() + ": " + email.subject();
            return new TaskRecord(null, title, "Email drafted", email.subject(), List.of(),
                    TaskRole.ADMINISTRATOR, TaskStatus.TO_DO, null, 0, createdAt,
                    email.source(), email.context(), null, null);
        }
        throw new IllegalArgumentException("No task record mapping for " + record.intent());
    }
}
