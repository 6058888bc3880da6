package com.presentos.core.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presentos.core.config.RouterProperties;
import com.presentos.core.model.DownstreamResponse;
import com.presentos.core.model.TaskField;
import com.presentos.core.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Pulls a reference out of a handler response and attaches it to the stored task.
 * <p>
 * Calendar handlers return an event hyperlink; email handlers return a message id,
 * which is turned into a mailbox URL. Everything here is best-effort: a response
 * without a usable reference or a failed patch is logged and reported as empty.
 */
@Component
public class ReconciliationLinker {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationLinker.class);

    private static final List<String> CALENDAR_LINK_FIELDS =
            List.of("htmlLink", "html_link", "link", "event_link", "calendar_link");
    private static final List<String> EMAIL_LINK_FIELDS = List.of("email_link", "link");
    private static final List<String> EMAIL_ID_FIELDS = List.of("message_id", "messageId", "id");

    private final PersistenceGateway persistence;
    private final String emailBaseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ReconciliationLinker(PersistenceGateway persistence, RouterProperties properties) {
        this.persistence = persistence;
        this.emailBaseUrl = properties.getLinks().getEmailBaseUrl();
    }

    /**
     * Extracts the reference from {@code response} and patches it onto {@code taskId}.
     *
     * @return the link, only if it was extracted and stored
     */
    public Optional<String> reconcile(String taskId, DownstreamResponse response, TaskField linkField) {
        Optional<String> link = extractLink(response);
        if (link.isEmpty()) {
            log.warn("{} response carried no usable reference; task {} left without {}",
                    response.handler(), taskId, linkField.propertyName());
            return Optional.empty();
        }
        if (!persistence.patch(taskId, linkField, link.get())) {
            return Optional.empty();
        }
        log.info("Linked task {} → {}", taskId, link.get());
        return link;
    }

    Optional<String> extractLink(DownstreamResponse response) {
        JsonNode body;
        try {
            body = response.body() == null ? null : objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            log.warn("{} response is not JSON: {}", response.handler(), e.getOriginalMessage());
            return Optional.empty();
        }
        if (body == null || !body.isObject()) {
            return Optional.empty();
        }
        return switch (response.handler()) {
            case CALENDAR -> firstText(body, CALENDAR_LINK_FIELDS);
            case EMAIL -> firstText(body, EMAIL_LINK_FIELDS)
                    .or(() -> firstText(body, EMAIL_ID_FIELDS))
                    .or(() -> firstText(body.path("message"), List.of("id")).map(id -> emailBaseUrl + id))
                    .map(value -> value.startsWith("http") ? value : emailBaseUrl + value);
            default -> Optional.empty();
        };
    }

    private static Optional<String> firstText(JsonNode node, List<String> names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText().strip());
            }
        }
        return Optional.empty();
    }
}
