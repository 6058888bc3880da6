package com.presentos.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper around Spring AI's {@link ChatClient} that returns the model's reply verbatim.
 * <p>
 * The reply is not parsed here: the classifier's output is unreliable and is cleaned up
 * by the sanitizer and normalizer downstream.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI-compatible base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt and returns the raw text reply.
     *
     * @throws LlmUnavailableException   if the model could not be reached or the call timed out
     * @throws LlmEmptyResponseException if the model answered with null or blank content
     */
    public String rawCall(String systemPrompt, String userPrompt) {
        log.info("LLM call started");
        long start = System.currentTimeMillis();
        String response;
        try {
            response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            log.error("LLM call failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
            throw new LlmUnavailableException("Classifier unavailable: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content");
        }
        log.debug("Raw LLM response: {}", response);
        return response.strip();
    }
}
