package com.memic.sdk.common.apiclient.memic.config;

import com.memic.sdk.common.apiclient.model.HeaderConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.List;

/**
 * Fixed headers of every Memic API request: the client identifier and the JSON content type.
 */
public class MemicHeaderConfig extends HeaderConfig {

    private final List<Header> headers;

    public MemicHeaderConfig(String userAgent) {
        this.headers = List.of(new Header(HttpHeaders.USER_AGENT, userAgent),
                               new Header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE));
    }

    @Override
    public List<Header> getHeaders() {
        return headers;
    }
}
