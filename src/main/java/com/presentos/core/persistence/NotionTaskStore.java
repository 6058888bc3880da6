package com.presentos.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.presentos.core.config.RouterProperties;
import com.presentos.core.model.TaskField;
import com.presentos.core.model.TaskRecord;
import com.presentos.core.model.TaskRole;
import com.presentos.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link TaskStore} backed by a Notion database, using the pages and database-query
 * endpoints of the Notion REST API.
 *
 * <p>Each {@link TaskField} maps to one database property. Patches send only the
 * property being changed, so concurrent patches of different fields never clobber
 * each other.
 */
@Component
public class NotionTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(NotionTaskStore.class);

    /** Notion rejects rich-text segments longer than this. */
    static final int MAX_TEXT_LENGTH = 2000;
    private static final int QUERY_PAGE_SIZE = 10;

    private final RouterProperties.Notion notion;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public NotionTaskStore(RouterProperties properties) {
        this.notion = properties.getNotion();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean isConfigured() {
        return notion.isConfigured();
    }

    @Override
    public String create(TaskRecord record) {
        ObjectNode properties = objectMapper.createObjectNode();
        putIfPresent(properties, TaskField.TITLE, record.title());
        putIfPresent(properties, TaskField.RESULT, record.result());
        putIfPresent(properties, TaskField.PURPOSE, record.purpose());
        putIfPresent(properties, TaskField.ACTION_PLAN, record.actionPlan());
        putIfPresent(properties, TaskField.ROLE, record.role());
        putIfPresent(properties, TaskField.STATUS, record.status());
        putIfPresent(properties, TaskField.DUE, record.due());
        putIfPresent(properties, TaskField.XP, record.xp());
        putIfPresent(properties, TaskField.CREATED_AT, record.createdAt());
        putIfPresent(properties, TaskField.SOURCE, record.source());
        putIfPresent(properties, TaskField.CONTEXT, record.context());
        putIfPresent(properties, TaskField.CALENDAR_LINK, record.calendarLink());
        putIfPresent(properties, TaskField.EMAIL_LINK, record.emailLink());

        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("parent").put("database_id", notion.getDatabaseId());
        body.set("properties", properties);

        JsonNode response = send("POST", "/pages", body);
        JsonNode id = response.get("id");
        if (id == null || id.asText().isBlank()) {
            throw new PersistenceException("Notion create returned no page id");
        }
        log.info("Created Notion page {} for task '{}'", id.asText(), record.title());
        return id.asText();
    }

    @Override
    public void patch(String id, TaskField field, Object value) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("properties").set(field.propertyName(), toPropertyValue(field, value));
        send("PATCH", "/pages/" + id, body);
        log.info("Patched Notion page {} ({})", id, field.propertyName());
    }

    @Override
    public List<TaskRecord> findByTitleContaining(String titleText) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode filter = body.putObject("filter");
        filter.put("property", TaskField.TITLE.propertyName());
        filter.putObject("title").put("contains", titleText);
        body.put("page_size", QUERY_PAGE_SIZE);

        JsonNode response = send("POST", "/databases/" + notion.getDatabaseId() + "/query", body);
        var records = new ArrayList<TaskRecord>();
        JsonNode results = response.get("results");
        if (results != null) {
            for (JsonNode page : results) {
                records.add(fromPage(page));
            }
        }
        log.debug("Notion query for '{}' matched {} page(s)", titleText, records.size());
        return records;
    }

    // ── Property mapping ─────────────────────────────────────────────

    private void putIfPresent(ObjectNode properties, TaskField field, Object value) {
        if (value != null) {
            properties.set(field.propertyName(), toPropertyValue(field, value));
        }
    }

    ObjectNode toPropertyValue(TaskField field, Object value) {
        ObjectNode node = objectMapper.createObjectNode();
        switch (field.kind()) {
            case TITLE -> node.set("title", richText(asText(value)));
            case RICH_TEXT -> node.set("rich_text", richText(asText(value)));
            case SELECT -> node.putObject("select").put("name", asText(value));
            case NUMBER -> node.put("number", ((Number) value).intValue());
            case DATE -> node.putObject("date").put("start", asText(value));
            case URL -> node.put("url", asText(value));
        }
        return node;
    }

    private ArrayNode richText(String content) {
        ArrayNode array = objectMapper.createArrayNode();
        String text = content.length() > MAX_TEXT_LENGTH ? content.substring(0, MAX_TEXT_LENGTH) : content;
        array.addObject().putObject("text").put("content", text);
        return array;
    }

    private static String asText(Object value) {
        if (value instanceof TaskRole role) {
            return role.label();
        }
        if (value instanceof TaskStatus status) {
            return status.label();
        }
        if (value instanceof List<?> steps) {
            var lines = new ArrayList<String>();
            for (int i = 0; i < steps.size(); i++) {
                lines.add((i + 1) + ". " + steps.get(i));
            }
            return String.join("\n", lines);
        }
        if (value instanceof OffsetDateTime time) {
            return time.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return String.valueOf(value);
    }

    TaskRecord fromPage(JsonNode page) {
        JsonNode props = page.path("properties");
        JsonNode number = props.path(TaskField.XP.propertyName()).path("number");
        int xp = number.isNumber() ? number.asInt() : 0;
        return new TaskRecord(
                page.path("id").asText(null),
                readText(props, TaskField.TITLE),
                readText(props, TaskField.RESULT),
                readText(props, TaskField.PURPOSE),
                readSteps(readText(props, TaskField.ACTION_PLAN)),
                TaskRole.fromLabel(readText(props, TaskField.ROLE)),
                TaskStatus.fromLabel(readText(props, TaskField.STATUS)),
                readDate(props, TaskField.DUE),
                xp,
                readDate(props, TaskField.CREATED_AT),
                readText(props, TaskField.SOURCE),
                readText(props, TaskField.CONTEXT),
                readText(props, TaskField.CALENDAR_LINK),
                readText(props, TaskField.EMAIL_LINK));
    }

    private static String readText(JsonNode props, TaskField field) {
        JsonNode property = props.path(field.propertyName());
        return switch (field.kind()) {
            case TITLE -> joinSegments(property.path("title"));
            case RICH_TEXT -> joinSegments(property.path("rich_text"));
            case SELECT -> property.path("select").path("name").asText(null);
            case URL -> property.path("url").asText(null);
            case DATE -> property.path("date").path("start").asText(null);
            case NUMBER -> property.path("number").asText(null);
        };
    }

    private static String joinSegments(JsonNode segments) {
        if (!segments.isArray() || segments.isEmpty()) {
            return null;
        }
        var sb = new StringBuilder();
        for (JsonNode segment : segments) {
            JsonNode plain = segment.get("plain_text");
            sb.append(plain != null ? plain.asText() : segment.path("text").path("content").asText(""));
        }
        return sb.toString();
    }

    private static List<String> readSteps(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        var steps = new ArrayList<String>();
        for (String line : text.split("\\R")) {
            String step = line.strip().replaceFirst("^\\d+\\.\\s*", "");
            if (!step.isEmpty()) {
                steps.add(step);
            }
        }
        return List.copyOf(steps);
    }

    private static OffsetDateTime readDate(JsonNode props, TaskField field) {
        String value = readText(props, field);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable {} value '{}'", field.propertyName(), value);
            return null;
        }
    }

    // ── HTTP ─────────────────────────────────────────────────────────

    JsonNode send(String method, String path, JsonNode body) {
        if (!isConfigured()) {
            throw new PersistenceException("Notion store not configured (token/database id missing)");
        }
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(notion.getApiUrl() + path))
                    .timeout(Duration.ofSeconds(notion.getTimeoutSeconds()))
                    .header("Authorization", "Bearer " + notion.getToken())
                    .header("Notion-Version", notion.getVersion())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            CompletableFuture<HttpResponse<String>> pending =
                    httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> response;
            try {
                response = pending.get(notion.getTimeoutSeconds(), TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                throw new PersistenceException("Notion request timed out after %ds: %s %s"
                        .formatted(notion.getTimeoutSeconds(), method, path), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new PersistenceException("Notion request failed: " + method + " " + path, cause);
            }
            if (response.statusCode() >= 400) {
                throw new PersistenceException("Notion %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()));
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new PersistenceException("Notion request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Notion request interrupted: " + method + " " + path, e);
        }
    }
}
