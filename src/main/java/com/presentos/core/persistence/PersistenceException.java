package com.presentos.core.persistence;

/**
 * Thrown when the task store rejects or cannot serve a request.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
