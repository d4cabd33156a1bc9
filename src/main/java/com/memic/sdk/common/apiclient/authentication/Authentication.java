package com.memic.sdk.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 *
 * <p>This interface allows different authentication schemes to be applied to API requests in a
 * consistent manner.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided header map.
     *
     * @param headers A mutable map of request headers. Implementations should add or modify entries
     *                in this map to apply the authentication scheme.
     */
    void applyAuthentication(Map<String, String> headers);
}
