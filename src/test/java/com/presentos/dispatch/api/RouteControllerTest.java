package com.presentos.dispatch.api;

import com.presentos.core.model.*;
import com.presentos.core.routing.RoutingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RouteController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RouteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RoutingEngine routingEngine;

    @BeforeEach
    void setUp() {
        when(routingEngine.generateRequestId()).thenReturn("REQ-1");
    }

    private void respondWith(RouteOutcome outcome) {
        when(routingEngine.route(eq("REQ-1"), anyString())).thenReturn(outcome);
    }

    @Test
    @DisplayName("POST /route returns 200 with the routed task")
    void routedTask() throws Exception {
        var task = new TaskIntent("Call Aayush", "", "", List.of(), TaskRole.PRODUCER, TaskStatus.TO_DO,
                OffsetDateTime.parse("2025-11-13T21:00:00+05:30"), true, 10, "call Aayush", "presentos-router");
        respondWith(RouteOutcome.builder("REQ-1", Intent.TASK).record(task).taskId("page-1")
                .link("https://c/1").build());

        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"call Aayush tomorrow at 9pm\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").value("REQ-1"))
                .andExpect(jsonPath("$.intent").value("TASK"))
                .andExpect(jsonPath("$.status").value("ROUTED"))
                .andExpect(jsonPath("$.task_id").value("page-1"))
                .andExpect(jsonPath("$.link").value("https://c/1"))
                .andExpect(jsonPath("$.record.title").value("Call Aayush"))
                .andExpect(jsonPath("$.record.due").value(startsWith("2025-11-13T21:00:00")))
                .andExpect(jsonPath("$.warnings").doesNotExist());
    }

    @Test
    @DisplayName("POST /route returns 200 for UNKNOWN")
    void unknown() throws Exception {
        respondWith(RouteOutcome.builder("REQ-1", Intent.UNKNOWN).status(OutcomeStatus.UNKNOWN)
                .raw("no idea").error(ErrorKind.MALFORMED_OUTPUT, "Classifier output is not a JSON object").build());

        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"asdf\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNKNOWN"))
                .andExpect(jsonPath("$.raw").value("no idea"))
                .andExpect(jsonPath("$.error_kind").value("MALFORMED_OUTPUT"));
    }

    @Test
    @DisplayName("POST /route returns 404 when the task to complete does not exist")
    void notFound() throws Exception {
        respondWith(RouteOutcome.builder("REQ-1", Intent.COMPLETE_TASK).status(OutcomeStatus.NOT_FOUND)
                .error(ErrorKind.NOT_FOUND, "No task matching 'x'").build());

        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"I finished x\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /route returns 502 when the store rejects the record")
    void persistenceFailure() throws Exception {
        respondWith(RouteOutcome.builder("REQ-1", Intent.TASK).status(OutcomeStatus.FAILED)
                .error(ErrorKind.PERSISTENCE_ERROR, "HTTP 400").build());

        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"call Aayush\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error_kind").value("PERSISTENCE_ERROR"));
    }

    @Test
    @DisplayName("POST /route surfaces warnings")
    void warnings() throws Exception {
        respondWith(RouteOutcome.builder("REQ-1", Intent.TASK).taskId("page-1")
                .warn("forward", "CALENDAR handler returned HTTP 500").build());

        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"call Aayush\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warnings", hasSize(1)))
                .andExpect(jsonPath("$.warnings[0].stage").value("forward"));
    }

    @Test
    @DisplayName("POST /route with a blank message returns 400 without routing")
    void blankMessage() throws Exception {
        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Empty message"));

        verify(routingEngine, never()).route(anyString(), anyString());
    }

    @Test
    @DisplayName("POST /route with no body field returns 400")
    void missingMessage() throws Exception {
        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Empty message"));
    }

    @Test
    @DisplayName("POST /route returns 500 with the error text on an unexpected failure")
    void unexpectedFailure() throws Exception {
        when(routingEngine.route(eq("REQ-1"), anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("boom"));
    }
}
