package com.memic.sdk.exception.apiclient;

import com.memic.sdk.exception.MemicException;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Base class for errors returned by, or raised while talking to, the Memic API.
 *
 * <p>Carries the HTTP status code and the raw response body when a response was received. Both are
 * {@code null} when the request never produced a response (connectivity failures, timeouts).
 */
@Getter
public class ApiException extends MemicException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;

    @Nullable
    private final Integer statusCode;

    @Nullable
    private final String responseBody;

    /**
     * Constructs a new ApiException with the specified message, status code and response body.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code associated with the exception, if any.
     * @param responseBody The raw response body, if any.
     */
    public ApiException(String message, @Nullable Integer statusCode, @Nullable String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Constructs a new ApiException for a failure that happened before any response was received.
     *
     * @param message A descriptive message about the exception.
     * @param cause   The underlying cause.
     */
    public ApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
        this.responseBody = null;
    }
}
