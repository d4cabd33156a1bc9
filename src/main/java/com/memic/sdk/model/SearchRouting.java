package com.memic.sdk.model;

import org.springframework.lang.Nullable;

/**
 * How the service routed a query between its semantic and structured backends.
 *
 * @param route          {@code semantic}, {@code structured} or {@code hybrid}
 * @param reasoning      explanation of the routing decision
 * @param connectorId    database connector used for structured search
 * @param connectorName  display name of that connector
 * @param sqlGenerated   SQL generated for structured search
 * @param sqlExplanation explanation of the generated SQL
 */
public record SearchRouting(String route,
                            @Nullable String reasoning,
                            @Nullable String connectorId,
                            @Nullable String connectorName,
                            @Nullable String sqlGenerated,
                            @Nullable String sqlExplanation) {
}
