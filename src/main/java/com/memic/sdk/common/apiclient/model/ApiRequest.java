package com.memic.sdk.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to the Memic API.
 *
 * <p>The path is a URI template relative to the client's base URL; its placeholders are expanded from
 * {@link #pathVariables}. Variables without a matching placeholder are ignored, which lets the same
 * call site serve deployments whose routes omit the project or organization segment.
 */
@Builder
@Data
public class ApiRequest {

    /**
     * The HTTP method for the API request (e.g., GET, POST, PUT, DELETE).
     */
    private final HttpMethod method;

    /**
     * The path template of the API request.
     */
    private final String path;

    /**
     * Optional query parameters to be included in the API request.
     */
    @Nullable
    private final Map<String, Object> queryParams;

    /**
     * Optional values for the placeholders of {@link #path}.
     */
    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Per-request headers. Authentication is applied to this map before the request is sent, so it
     * is excluded from {@link #toString()}.
     */
    @ToString.Exclude
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The JSON body of the API request, {@code null} for body-less calls.
     */
    @Nullable
    private final Object body;

    /**
     * The media type that the client will accept in the response.
     */
    @Nullable
    private final MediaType acceptMediaType;

    /**
     * The content type of the request body. Defaults to JSON.
     */
    @Nullable
    private final MediaType contentType;
}
