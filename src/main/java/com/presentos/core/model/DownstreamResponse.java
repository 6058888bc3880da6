package com.presentos.core.model;

/**
 * Status and body returned by one handler invocation. Transport failures are
 * represented as status 500 with the error text as body.
 */
public record DownstreamResponse(
    HandlerKind handler,
    int status,
    String body
) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
