package com.presentos.core.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.presentos.core.config.RouterProperties;
import com.presentos.core.model.CalendarIntent;
import com.presentos.core.model.CompleteTaskIntent;
import com.presentos.core.model.EmailIntent;
import com.presentos.core.model.Intent;
import com.presentos.core.model.IntentRecord;
import com.presentos.core.model.MessageIntent;
import com.presentos.core.model.RawMessage;
import com.presentos.core.model.ResearchIntent;
import com.presentos.core.model.TaskIntent;
import com.presentos.core.model.TaskRole;
import com.presentos.core.model.TaskStatus;
import com.presentos.core.model.UnknownIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a parsed classifier object onto one {@link IntentRecord} variant.
 * <p>
 * Total and deterministic: every required field missing from the classifier output
 * is filled with a fixed default, so a recognized intent never fails validation.
 * Missing or unrecognized {@code intent} values become {@link UnknownIntent}.
 */
@Component
public class IntentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(IntentNormalizer.class);

    static final String DEFAULT_TITLE = "Untitled Task";
    static final String DEFAULT_PRIORITY = "normal";
    static final Duration DEFAULT_EVENT_LENGTH = Duration.ofMinutes(30);

    /** Objects the classifier sometimes nests its fields under. */
    private static final List<String> NESTED = List.of("task", "event", "email", "research", "message", "data", "details");

    private final RouterProperties properties;

    public IntentNormalizer(RouterProperties properties) {
        this.properties = properties;
    }

    /**
     * @param json    the sanitized classifier object
     * @param message the inbound message; its text becomes the record's context and its
     *                arrival time is the invocation time used for date defaults
     * @param raw     the unparsed classifier text, kept on {@link UnknownIntent}
     */
    public IntentRecord normalize(ObjectNode json, RawMessage message, String raw) {
        var fields = new Fields(json);
        Intent intent = Intent.fromLabel(fields.text("intent"));
        return switch (intent) {
            case TASK -> task(fields, message);
            case COMPLETE_TASK -> completeTask(fields, message, raw);
            case CALENDAR -> calendar(fields, message);
            case EMAIL -> email(fields, message);
            case RESEARCH -> research(fields, message);
            case MESSAGE -> message(fields, message);
            case UNKNOWN -> new UnknownIntent(raw, "Unrecognized intent: " + fields.text("intent"), message.text());
        };
    }

    private TaskIntent task(Fields fields, RawMessage message) {
        OffsetDateTime now = message.receivedAt().toOffsetDateTime();
        ZoneId zone = message.receivedAt().getZone();

        Optional<OffsetDateTime> parsedDue = DateResolver
                .parse(fields.text("due_date", "dueDate", "datetime_iso", "due", "deadline"), zone)
                .filter(due -> !due.isBefore(now));
        if (parsedDue.isEmpty()) {
            log.debug("TASK due date missing or in the past; defaulting to invocation time {}", now);
        }

        Integer xp = fields.integer("xp", "experience", "experience_points");
        return new TaskIntent(
                fields.textOr(DEFAULT_TITLE, "title", "task_title", "name"),
                fields.textOr("", "result", "expected_result"),
                fields.textOr("", "purpose"),
                fields.list("action_plan", "actionPlan", "steps"),
                TaskRole.fromLabel(fields.text("role")),
                TaskStatus.fromLabel(fields.text("status")),
                parsedDue.orElse(now),
                parsedDue.isPresent(),
                xp == null ? 0 : Math.max(0, xp),
                message.text(),
                properties.getSourceTag());
    }

    private IntentRecord completeTask(Fields fields, RawMessage message, String raw) {
        String taskName = fields.text("task_name", "taskName", "title", "task");
        if (taskName == null) {
            log.debug("COMPLETE_TASK without a task name");
            return new UnknownIntent(raw, "COMPLETE_TASK without a task name", message.text());
        }
        return new CompleteTaskIntent(taskName, TaskStatus.COMPLETED, message.text(), properties.getSourceTag());
    }

    private CalendarIntent calendar(Fields fields, RawMessage message) {
        ZoneId zone = message.receivedAt().getZone();
        OffsetDateTime start = DateResolver.parse(fields.text("start", "start_time", "datetime_iso", "when"), zone)
                .orElse(message.receivedAt().toOffsetDateTime());
        OffsetDateTime end = DateResolver.parse(fields.text("end", "end_time"), zone)
                .filter(e -> e.isAfter(start))
                .orElse(start.plus(DEFAULT_EVENT_LENGTH));
        return new CalendarIntent(
                fields.textOr(message.text(), "title", "summary"),
                start,
                end,
                fields.textOr("", "description", "details"),
                fields.list("attendees", "guests"),
                message.text(),
                properties.getSourceTag());
    }

    private EmailIntent email(Fields fields, RawMessage message) {
        String to = fields.text("to", "recipient", "email");
        if (to == null) {
            log.debug("EMAIL without recipient; using fallback address");
            to = properties.getFallbackEmail();
        }
        return new EmailIntent(
                to,
                fields.textOr("", "subject"),
                fields.textOr(message.text(), "body", "content"),
                message.text(),
                properties.getSourceTag());
    }

    private ResearchIntent research(Fields fields, RawMessage message) {
        String query = fields.textOr(message.text(), "query", "question");
        return new ResearchIntent(
                fields.textOr(query, "topic"),
                query,
                message.text(),
                properties.getSourceTag());
    }

    private MessageIntent message(Fields fields, RawMessage message) {
        return new MessageIntent(
                fields.textOr(DEFAULT_PRIORITY, "priority").toLowerCase(Locale.ROOT),
                fields.textOr(message.text(), "text", "message", "content"),
                message.text(),
                properties.getSourceTag());
    }

    /**
     * Field lookup over the top-level object, then any nested container object.
     */
    private static final class Fields {

        private final List<JsonNode> scopes = new ArrayList<>();

        Fields(ObjectNode root) {
            scopes.add(root);
            for (String name : NESTED) {
                JsonNode nested = root.get(name);
                if (nested != null && nested.isObject()) {
                    scopes.add(nested);
                }
            }
        }

        private JsonNode find(String... names) {
            for (JsonNode scope : scopes) {
                for (String name : names) {
                    JsonNode value = scope.get(name);
                    if (value != null && !value.isNull() && !value.isMissingNode()) {
                        return value;
                    }
                }
            }
            return null;
        }

        /** Non-blank scalar text for the first alias present; null otherwise. */
        String text(String... names) {
            for (JsonNode scope : scopes) {
                for (String name : names) {
                    JsonNode value = scope.get(name);
                    if (value != null && value.isValueNode() && !value.isNull()) {
                        String text = value.asText().strip();
                        if (!text.isEmpty()) {
                            return text;
                        }
                    }
                }
            }
            return null;
        }

        String textOr(String fallback, String... names) {
            String value = text(names);
            return value != null ? value : fallback;
        }

        Integer integer(String... names) {
            JsonNode value = find(names);
            if (value == null) {
                return null;
            }
            if (value.isNumber()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().strip());
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric value '{}' for {}", value.asText(), names[0]);
                }
            }
            return null;
        }

        /** Array elements, or the lines of a string with list markers removed. */
        List<String> list(String... names) {
            JsonNode value = find(names);
            var items = new ArrayList<String>();
            if (value == null) {
                return List.of();
            }
            if (value.isArray()) {
                for (JsonNode item : value) {
                    if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                        items.add(item.asText().strip());
                    }
                }
            } else if (value.isTextual()) {
                for (String line : value.asText().split("\\R")) {
                    String step = line.strip().replaceFirst("^(\\d+[.)]|[-*•])\\s*", "");
                    if (!step.isEmpty()) {
                        items.add(step);
                    }
                }
            }
            return List.copyOf(items);
        }
    }
}
