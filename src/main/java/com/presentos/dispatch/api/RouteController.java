package com.presentos.dispatch.api;

import com.presentos.core.model.RouteOutcome;
import com.presentos.core.routing.RoutingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST entry point: classifies a message and routes it to the matching handler.
 */
@RestController
public class RouteController {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    private final RoutingEngine routingEngine;

    public RouteController(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    /**
     * POST /route: route one message. Runs synchronously on the request thread.
     * <p>
     * 200 for routed and unknown messages, 404 when a task to complete does not exist,
     * 502 when the task store rejected the record.
     */
    @PostMapping("/route")
    public ResponseEntity<?> route(@RequestBody(required = false) RouteRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Empty message"));
        }

        String requestId = routingEngine.generateRequestId();
        try {
            RouteOutcome outcome = routingEngine.route(requestId, request.message());
            return ResponseEntity.status(httpStatus(outcome)).body(outcome);
        } catch (Exception e) {
            log.error("Request {} failed", requestId, e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    "request_id", requestId));
        }
    }

    static HttpStatus httpStatus(RouteOutcome outcome) {
        return switch (outcome.status()) {
            case ROUTED, UNKNOWN -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }
}
