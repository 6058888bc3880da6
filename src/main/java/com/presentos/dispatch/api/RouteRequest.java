package com.presentos.dispatch.api;

/**
 * Inbound JSON body for POST /route.
 *
 * @param message free-text user message
 */
public record RouteRequest(String message) {}
