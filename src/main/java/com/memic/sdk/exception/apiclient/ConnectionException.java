package com.memic.sdk.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the Memic API could not be reached (DNS failure, refused connection,
 * reset socket). No HTTP response was received.
 */
public class ConnectionException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2812514621225838422L;

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
