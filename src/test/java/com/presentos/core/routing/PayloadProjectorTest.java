package com.presentos.core.routing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.presentos.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PayloadProjectorTest {

    private final PayloadProjector projector = new PayloadProjector();

    @Test
    @DisplayName("Task becomes a thirty-minute calendar block with a description")
    void taskPayload() {
        var task = new TaskIntent("Call Aayush", "Aayush briefed", "Unblock launch", List.of("Dial", "Talk"),
                TaskRole.PRODUCER, TaskStatus.TO_DO, OffsetDateTime.parse("2025-11-13T21:00:00+05:30"), true,
                10, "call Aayush", "presentos-router");

        ObjectNode payload = projector.project(task, null);

        assertEquals("Call Aayush", payload.get("title").asText());
        assertEquals("2025-11-13T21:00:00+05:30", payload.get("start").asText());
        assertEquals("2025-11-13T21:30:00+05:30", payload.get("end").asText());
        assertEquals("Expected result: Aayush briefed\nPurpose: Unblock launch\n1. Dial\n2. Talk",
                payload.get("description").asText());
        assertFalse(payload.has("task_id"));
        assertEquals("presentos-router", payload.get("source").asText());
    }

    @Test
    @DisplayName("Calendar payload carries attendees and the stored task id")
    void calendarPayload() {
        var event = new CalendarIntent("Sync", OffsetDateTime.parse("2025-11-13T15:00:00+05:30"),
                OffsetDateTime.parse("2025-11-13T16:00:00+05:30"), "weekly", List.of("a@b.com"), "c", "s");
        var stored = new TaskRecord("page-4", "Sync", "", "", List.of(), TaskRole.ADMINISTRATOR,
                TaskStatus.TO_DO, null, 0, null, "s", "c", null, null);

        ObjectNode payload = projector.project(event, stored);

        assertEquals("a@b.com", payload.get("attendees").get(0).asText());
        assertEquals("2025-11-13T16:00:00+05:30", payload.get("end").asText());
        assertEquals("page-4", payload.get("task_id").asText());
    }

    @Test
    @DisplayName("Message payload carries priority and text")
    void messagePayload() {
        ObjectNode payload = projector.project(new MessageIntent("high", "running late", "ctx", "s"), null);

        assertEquals("high", payload.get("priority").asText());
        assertEquals("running late", payload.get("text").asText());
        assertEquals("ctx", payload.get("context").asText());
    }
}
