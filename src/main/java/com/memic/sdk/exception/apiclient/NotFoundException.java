package com.memic.sdk.exception.apiclient;

import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that a resource was not found (HTTP 404).
 *
 * <p>This exception is thrown when the server cannot find the requested project, file or route.
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    /**
     * Constructs a new NotFoundException with the specified message.
     *
     * @param message      A descriptive message about the exception.
     * @param responseBody The raw response body.
     */
    public NotFoundException(String message, @Nullable String responseBody) {
        super(message, 404, responseBody);
    }
}
