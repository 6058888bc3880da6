package com.presentos.core.classify;

import com.presentos.core.llm.LlmEmptyResponseException;
import com.presentos.core.llm.LlmService;
import com.presentos.core.llm.LlmUnavailableException;
import com.presentos.core.model.ErrorKind;
import com.presentos.core.model.RawMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;

/**
 * Sends the user's message to the language model together with a fixed instruction
 * template describing every intent schema.
 * <p>
 * Never throws: an unreachable model or an empty reply is returned as a failed
 * {@link ClassificationResult} so the caller can degrade to UNKNOWN.
 */
@Component
public class ClassifierGateway {

    private static final Logger log = LoggerFactory.getLogger(ClassifierGateway.class);

    static final String SYSTEM_PROMPT = """
            You are the core reasoning engine of the Present Operating System (POS).
            Classify the user's message into exactly one intent and return a single JSON object.

            TASK — an actionable item to track ("remind", "call", "finish", "prepare"):
            {"intent": "TASK", "title": "<concise task title>", "result": "<expected result>",
             "purpose": "<why it matters>", "action_plan": ["<step>", "..."],
             "role": "Producer|Administrator|Entrepreneur|Integrator", "status": "To Do",
             "due_date": "<ISO-8601 date-time with offset, or null>", "xp": <integer>}

            COMPLETE_TASK — the user reports finishing an existing task:
            {"intent": "COMPLETE_TASK", "task_name": "<title of the finished task>"}

            CALENDAR — schedule a meeting or event:
            {"intent": "CALENDAR", "title": "<event title>", "start": "<ISO-8601>", "end": "<ISO-8601 or null>",
             "description": "<details>", "attendees": ["<email>", "..."]}

            EMAIL — draft or send an email:
            {"intent": "EMAIL", "to": "<recipient email or null>", "subject": "<subject>", "body": "<body>"}

            RESEARCH — a question or something to look up:
            {"intent": "RESEARCH", "topic": "<topic>", "query": "<question>"}

            MESSAGE — notify someone or send a quick note:
            {"intent": "MESSAGE", "priority": "low|normal|high", "text": "<message text>"}

            Resolve relative dates ("tomorrow", "at 9pm") against the current local time given
            with the message and always include the UTC offset.
            Always produce valid JSON — no markdown, no code blocks, no explanations.
            If unsure, still produce a JSON object with "intent": "UNKNOWN".
            """;

    private final LlmService llmService;

    public ClassifierGateway(LlmService llmService) {
        this.llmService = llmService;
    }

    public ClassificationResult classify(RawMessage message) {
        String userPrompt = "Current local time: "
                + message.receivedAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                + " (" + message.receivedAt().getZone().getId() + ")\n\n"
                + "Message: " + message.text();
        try {
            return ClassificationResult.of(llmService.rawCall(SYSTEM_PROMPT, userPrompt));
        } catch (LlmUnavailableException e) {
            log.warn("Classifier unavailable: {}", e.getMessage());
            return ClassificationResult.failed(ErrorKind.UPSTREAM_UNAVAILABLE, e.getMessage());
        } catch (LlmEmptyResponseException e) {
            log.warn("Classifier returned no content");
            return ClassificationResult.failed(ErrorKind.MALFORMED_OUTPUT, e.getMessage());
        }
    }
}
