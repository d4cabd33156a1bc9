package com.memic.sdk.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a single HTTP exchange exceeded the configured request timeout.
 */
public class RequestTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7071019530397087493L;

    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
