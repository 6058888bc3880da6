package com.presentos.core.model;

import java.time.ZonedDateTime;

/**
 * Inbound message text and the instant it arrived, in the router's zone.
 */
public record RawMessage(String text, ZonedDateTime receivedAt) {}
