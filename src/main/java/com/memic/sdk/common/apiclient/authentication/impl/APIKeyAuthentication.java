package com.memic.sdk.common.apiclient.authentication.impl;

import com.memic.sdk.common.apiclient.authentication.Authentication;
import com.memic.sdk.exception.apiclient.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * An implementation of {@link Authentication} that injects a static API key into request headers.
 *
 * @param headerName name of the header carrying the key, {@code X-API-Key} for Memic
 * @param apiKey     the API key
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    public APIKeyAuthentication {
        if (!StringUtils.hasText(apiKey)) {
            throw new AuthenticationException(
                    "No API key provided. Pass an API key or set the MEMIC_API_KEY environment variable.");
        }
    }

    /**
     * Applies the API key to the provided header map by adding a header with the configured name and
     * key.
     *
     * @param headers A non-null, mutable map of headers to which the API key will be added.
     */
    @Override
    public void applyAuthentication(Map<String, String> headers) {
        log.trace("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + ", apiKey=****]";
    }
}
