package com.presentos.core.persistence;

import com.presentos.core.metrics.RouterMetrics;
import com.presentos.core.model.TaskField;
import com.presentos.core.model.TaskRecord;
import com.presentos.core.model.TaskRole;
import com.presentos.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PersistenceGatewayTest {

    private TaskStore store;
    private RouterMetrics metrics;
    private PersistenceGateway gateway;

    @BeforeEach
    void setUp() {
        store = mock(TaskStore.class);
        metrics = mock(RouterMetrics.class);
        gateway = new PersistenceGateway(store, metrics);
    }

    private static TaskRecord task(String id, String title) {
        return new TaskRecord(id, title, "", "", List.of(), TaskRole.PRODUCER, TaskStatus.TO_DO,
                OffsetDateTime.parse("2025-11-12T10:00:00+05:30"), 0, null, "presentos-router", "", null, null);
    }

    @Test
    @DisplayName("create returns the store id")
    void createReturnsId() {
        when(store.create(any())).thenReturn("page-1");

        assertEquals("page-1", gateway.create(task(null, "Call Aayush")));
    }

    @Test
    @DisplayName("create wraps unexpected store errors in PersistenceException")
    void createWrapsErrors() {
        when(store.create(any())).thenThrow(new IllegalStateException("boom"));

        var ex = assertThrows(PersistenceException.class, () -> gateway.create(task(null, "x")));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("create propagates PersistenceException unchanged")
    void createPropagates() {
        var original = new PersistenceException("HTTP 400");
        when(store.create(any())).thenThrow(original);

        assertSame(original, assertThrows(PersistenceException.class, () -> gateway.create(task(null, "x"))));
    }

    @Test
    @DisplayName("patch reports success and records the metric")
    void patchSuccess() {
        assertTrue(gateway.patch("page-1", TaskField.STATUS, TaskStatus.COMPLETED));

        verify(store).patch("page-1", TaskField.STATUS, TaskStatus.COMPLETED);
        verify(metrics).recordPatch("STATUS", true);
    }

    @Test
    @DisplayName("patch failure is reported as false, not thrown")
    void patchFailure() {
        doThrow(new PersistenceException("HTTP 502")).when(store).patch(anyString(), any(), any());

        assertFalse(gateway.patch("page-1", TaskField.CALENDAR_LINK, "https://x"));
        verify(metrics).recordPatch("CALENDAR_LINK", false);
    }

    @Test
    @DisplayName("findFirstByTitle takes the first of several matches")
    void firstMatchWins() {
        when(store.findByTitleContaining("Aayush"))
                .thenReturn(List.of(task("page-1", "Call Aayush"), task("page-2", "Email Aayush")));

        assertEquals("page-1", gateway.findFirstByTitle("Aayush").match().id());
    }

    @Test
    @DisplayName("findFirstByTitle with no match is a miss, not a failure")
    void noMatch() {
        when(store.findByTitleContaining("Aayush")).thenReturn(List.of());

        TaskLookup lookup = gateway.findFirstByTitle("Aayush");
        assertNull(lookup.match());
        assertFalse(lookup.isFailed());
    }

    @Test
    @DisplayName("findFirstByTitle reports store failures instead of throwing")
    void lookupFailure() {
        when(store.findByTitleContaining(anyString())).thenThrow(new PersistenceException("down"));

        TaskLookup lookup = gateway.findFirstByTitle("Aayush");
        assertTrue(lookup.isFailed());
        assertNull(lookup.match());
        assertEquals("down", lookup.failure());
    }
}
