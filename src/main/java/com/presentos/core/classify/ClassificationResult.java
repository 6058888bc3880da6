package com.presentos.core.classify;

import com.presentos.core.model.ErrorKind;

/**
 * Raw classifier reply, or the reason there is none.
 *
 * @param raw     text returned by the model (null when the call failed)
 * @param failure {@link ErrorKind#UPSTREAM_UNAVAILABLE} or {@link ErrorKind#MALFORMED_OUTPUT}; null on success
 * @param detail  failure description
 */
public record ClassificationResult(String raw, ErrorKind failure, String detail) {

    public static ClassificationResult of(String raw) {
        return new ClassificationResult(raw, null, null);
    }

    public static ClassificationResult failed(ErrorKind failure, String detail) {
        return new ClassificationResult(null, failure, detail);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
