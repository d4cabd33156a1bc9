package com.memic.sdk.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Represents a successful (2xx) response from the Memic API.
 *
 * <p>The body is kept as raw bytes; decoding is left to the typed endpoint that issued the call.
 */
@Builder
@Getter
public class ApiResponse {

    private static final byte[] NO_CONTENT = new byte[0];

    /**
     * The response data. Empty, never {@code null}, for 204 responses and empty bodies.
     */
    @Builder.Default
    private final byte[] data = NO_CONTENT;

    /**
     * The media type of the response.
     */
    @Nullable
    private final MediaType contentType;

    /**
     * The HTTP headers from the response.
     */
    @Nullable
    private final HttpHeaders headers;

    /**
     * The HTTP status code of the response.
     */
    private final int statusCode;

    /**
     * The timestamp when the response was received.
     */
    private final Instant timestamp;

    /**
     * @return {@code true} when the response carries a non-empty body.
     */
    public boolean hasBody() {
        return data != null && data.length > 0;
    }
}
