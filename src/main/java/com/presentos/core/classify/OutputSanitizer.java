package com.presentos.core.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recovers a JSON object from free-form model output.
 * <p>
 * Strips markdown code fences (with an optional language tag) and, when the text
 * still holds more than a JSON object, extracts the first balanced-brace substring
 * that parses as one. Returns {@link Optional#empty()} instead of throwing when
 * nothing usable is found.
 */
@Component
public class OutputSanitizer {

    private static final Logger log = LoggerFactory.getLogger(OutputSanitizer.class);
    private static final String FENCE = "```";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Returns the JSON object text contained in {@code raw}, exactly as it appears there.
     */
    public Optional<String> sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = stripFences(raw.strip());
        if (parseObject(text).isPresent()) {
            return Optional.of(text);
        }
        int from = text.indexOf('{');
        while (from >= 0) {
            int end = matchingBrace(text, from);
            if (end < 0) {
                break;
            }
            String candidate = text.substring(from, end + 1);
            if (parseObject(candidate).isPresent()) {
                return Optional.of(candidate);
            }
            from = text.indexOf('{', from + 1);
        }
        log.debug("No JSON object found in classifier output ({} chars)", raw.length());
        return Optional.empty();
    }

    /**
     * Sanitizes and parses {@code raw} into a JSON object.
     */
    public Optional<ObjectNode> parse(String raw) {
        return sanitize(raw).flatMap(this::parseObject);
    }

    static String stripFences(String text) {
        String cleaned = text;
        if (cleaned.startsWith(FENCE)) {
            int i = FENCE.length();
            // optional language tag, e.g. ```json
            while (i < cleaned.length() && Character.isLetterOrDigit(cleaned.charAt(i))) {
                i++;
            }
            cleaned = cleaned.substring(i);
        }
        cleaned = cleaned.strip();
        if (cleaned.endsWith(FENCE)) {
            cleaned = cleaned.substring(0, cleaned.length() - FENCE.length());
        }
        return cleaned.strip();
    }

    /**
     * Index of the brace closing the one at {@code open}, ignoring braces inside string literals; -1 if unbalanced.
     */
    static int matchingBrace(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<ObjectNode> parseObject(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node instanceof ObjectNode obj ? Optional.of(obj) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Not a JSON object: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
