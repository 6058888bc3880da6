package com.presentos.core.model;

/**
 * A best-effort step that failed without changing the primary outcome.
 *
 * @param stage  one of {@code lookup}, {@code status}, {@code forward}, {@code link}
 * @param detail human-readable failure description
 */
public record RouteWarning(String stage, String detail) {}
