package com.memic.sdk.exception.apiclient;

import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that the API key is missing, invalid or not allowed to perform the request
 * (HTTP 401 or 403).
 */
public class AuthenticationException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6346735715117211440L;

    /**
     * Constructs a new AuthenticationException raised locally, before any request was sent.
     *
     * @param message A descriptive message about the exception.
     */
    public AuthenticationException(String message) {
        super(message, null, null);
    }

    /**
     * Constructs a new AuthenticationException from a 401 or 403 response.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code, 401 or 403.
     * @param responseBody The raw response body.
     */
    public AuthenticationException(String message, int statusCode, @Nullable String responseBody) {
        super(message, statusCode, responseBody);
    }
}
