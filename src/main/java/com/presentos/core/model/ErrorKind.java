package com.presentos.core.model;

public enum ErrorKind {
    UPSTREAM_UNAVAILABLE,
    MALFORMED_OUTPUT,
    VALIDATION_GAP,
    PERSISTENCE_ERROR,
    DOWNSTREAM_ERROR,
    NOT_FOUND
}
