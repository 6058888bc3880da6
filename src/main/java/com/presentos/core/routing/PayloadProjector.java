package com.presentos.core.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.presentos.core.model.CalendarIntent;
import com.presentos.core.model.CompleteTaskIntent;
import com.presentos.core.model.EmailIntent;
import com.presentos.core.model.IntentRecord;
import com.presentos.core.model.MessageIntent;
import com.presentos.core.model.ResearchIntent;
import com.presentos.core.model.TaskIntent;
import com.presentos.core.model.TaskRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Projects an intent onto the JSON body each handler service expects.
 */
@Component
public class PayloadProjector {

    static final Duration TASK_EVENT_LENGTH = Duration.ofMinutes(30);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param stored the record created or found for this request; null when the route persists nothing
     */
    public ObjectNode project(IntentRecord record, TaskRecord stored) {
        ObjectNode payload = objectMapper.createObjectNode();
        if (record instanceof TaskIntent task) {
            payload.put("title", task.title());
            payload.put("start", iso(task.due()));
            payload.put("end", iso(task.due().plus(TASK_EVENT_LENGTH)));
            payload.put("description", describe(task));
        } else if (record instanceof CalendarIntent event) {
            payload.put("title", event.title());
            payload.put("start", iso(event.start()));
            payload.put("end", iso(event.end()));
            payload.put("description", event.description());
            strings(payload.putArray("attendees"), event.attendees());
        } else if (record instanceof EmailIntent email) {
            payload.put("to", email.to());
            payload.put("subject", email.subject());
            payload.put("body", email.body());
        } else if (record instanceof ResearchIntent research) {
            payload.put("topic", research.topic());
            payload.put("query", research.query());
        } else if (record instanceof MessageIntent message) {
            payload.put("priority", message.priority());
            payload.put("text", message.text());
        } else if (record instanceof CompleteTaskIntent complete) {
            payload.put("task_name", complete.taskName());
            payload.put("status", complete.status().label());
            if (stored != null) {
                payload.put("title", stored.title());
                payload.put("role", stored.role().label());
                payload.put("xp", stored.xp());
            }
        }
        if (stored != null && stored.id() != null) {
            payload.put("task_id", stored.id());
        }
        payload.put("context", record.context());
        payload.put("source", record.source());
        return payload;
    }

    private static String describe(TaskIntent task) {
        var sb = new StringBuilder();
        if (!task.result().isBlank()) {
            sb.append("Expected result: ").append(task.result()).append('\n');
        }
        if (!task.purpose().isBlank()) {
            sb.append("Purpose: ").append(task.purpose()).append('\n');
        }
        for (int i = 0; i < task.actionPlan().size(); i++) {
            sb.append(i + 1).append(". ").append(task.actionPlan().get(i)).append('\n');
        }
        return sb.toString().strip();
    }

    private static void strings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static String iso(OffsetDateTime time) {
        return time.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
