package com.presentos.core.routing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.presentos.core.classify.ClassificationResult;
import com.presentos.core.classify.ClassifierGateway;
import com.presentos.core.classify.IntentNormalizer;
import com.presentos.core.classify.OutputSanitizer;
import com.presentos.core.logging.MdcContext;
import com.presentos.core.metrics.RouterMetrics;
import com.presentos.core.model.ErrorKind;
import com.presentos.core.model.Intent;
import com.presentos.core.model.IntentRecord;
import com.presentos.core.model.OutcomeStatus;
import com.presentos.core.model.RawMessage;
import com.presentos.core.model.RouteOutcome;
import com.presentos.core.model.UnknownIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one message through classify → sanitize → normalize → dispatch.
 * <p>
 * Classifier failures and unparseable output degrade to an UNKNOWN outcome with no
 * side effects; everything else is delegated to {@link DispatchRouter}.
 */
@Service
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final ClassifierGateway classifier;
    private final OutputSanitizer sanitizer;
    private final IntentNormalizer normalizer;
    private final DispatchRouter router;
    private final RouterMetrics metrics;
    private final Clock clock;

    public RoutingEngine(ClassifierGateway classifier,
                         OutputSanitizer sanitizer,
                         IntentNormalizer normalizer,
                         DispatchRouter router,
                         RouterMetrics metrics,
                         Clock clock) {
        this.classifier = classifier;
        this.sanitizer = sanitizer;
        this.normalizer = normalizer;
        this.router = router;
        this.metrics = metrics;
        this.clock = clock;
    }

    public String generateRequestId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Routes a message, generating a new request ID.
     */
    public RouteOutcome route(String text) {
        return route(generateRequestId(), text);
    }

    /**
     * @param text non-blank message text
     */
    public RouteOutcome route(String requestId, String text) {
        MdcContext.setRequest(requestId);
        try {
            var message = new RawMessage(text.strip(), ZonedDateTime.now(clock));
            log.info("Routing message ({} chars) received at {}", message.text().length(), message.receivedAt());

            long start = System.currentTimeMillis();
            ClassificationResult classification = classifier.classify(message);
            long elapsed = System.currentTimeMillis() - start;

            RouteOutcome outcome;
            if (classification.isFailed()) {
                metrics.recordClassification(elapsed, classification.failure() == ErrorKind.UPSTREAM_UNAVAILABLE
                        ? "unavailable" : "malformed");
                outcome = unknown(requestId, message, classification.raw(), classification.failure(), classification.detail());
            } else {
                Optional<ObjectNode> parsed = sanitizer.parse(classification.raw());
                if (parsed.isEmpty()) {
                    log.warn("Classifier output is not a JSON object; treating as UNKNOWN");
                    metrics.recordClassification(elapsed, "malformed");
                    outcome = unknown(requestId, message, classification.raw(), ErrorKind.MALFORMED_OUTPUT,
                            "Classifier output is not a JSON object");
                } else {
                    metrics.recordClassification(elapsed, "ok");
                    IntentRecord record = normalizer.normalize(parsed.get(), message, classification.raw());
                    MdcContext.setIntent(requestId, record.intent().name());
                    log.info("Classified as {}", record.intent());
                    outcome = router.dispatch(requestId, record, message);
                }
            }

            metrics.recordIntent(outcome.intent().name());
            metrics.recordOutcome(outcome.status().name());
            log.info("Request finished: {} / {}", outcome.intent(), outcome.status());
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private static RouteOutcome unknown(String requestId, RawMessage message, String raw, ErrorKind kind, String detail) {
        return RouteOutcome.builder(requestId, Intent.UNKNOWN)
                .status(OutcomeStatus.UNKNOWN)
                .record(new UnknownIntent(raw, detail, message.text()))
                .raw(raw)
                .error(kind, detail)
                .build();
    }
}
