package com.presentos.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presentos.core.model.OutcomeStatus;
import com.presentos.core.model.RouteOutcome;
import com.presentos.core.routing.RoutingEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: presentos route "&lt;message&gt;"
 * <p>
 * Runs one message through the full pipeline in-process, with the same side
 * effects as POST /route, and prints the outcome.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Classify and route a single message")
@Component
public class RouteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Free-text message to route")
    private String message;

    @Option(names = {"--json", "-j"}, description = "Print the outcome as JSON")
    private boolean json;

    private final RoutingEngine routingEngine;
    private final ObjectMapper objectMapper;

    public RouteCommand(RoutingEngine routingEngine, ObjectMapper objectMapper) {
        this.routingEngine = routingEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (message == null || message.isBlank()) {
            ConsoleOutput.error("Empty message");
            return 2;
        }

        RouteOutcome outcome;
        try {
            outcome = routingEngine.route(message);
        } catch (Exception e) {
            ConsoleOutput.error("Routing failed: " + rootCauseMessage(e));
            return 1;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(outcome));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render outcome: " + e.getOriginalMessage());
                return 1;
            }
        } else {
            ConsoleOutput.printBanner();
            ConsoleOutput.outcome(outcome);
        }
        return outcome.status() == OutcomeStatus.FAILED ? 1 : 0;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
