package com.memic.sdk.common.apiclient.model;

import java.util.List;

/**
 * Abstract base class for the fixed headers sent with every API request. Subclasses define the
 * specific headers to be included.
 */
public abstract class HeaderConfig {

    /**
     * @return the headers applied to every request, in order.
     */
    public abstract List<Header> getHeaders();

    /**
     * Represents a single header with a name and a value.
     *
     * @param name  header name
     * @param value header value
     */
    public record Header(String name, String value) {
    }
}
