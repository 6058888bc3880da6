package com.presentos.core.llm;

/**
 * Thrown when the LLM endpoint cannot be reached or does not answer in time.
 */
public class LlmUnavailableException extends RuntimeException {

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
