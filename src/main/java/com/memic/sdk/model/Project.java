package com.memic.sdk.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A project of the organization owning the API key.
 */
public record Project(String id,
                      String name,
                      String organizationId,
                      boolean active,
                      @Nullable Instant createdAt,
                      @Nullable Instant updatedAt) {
}
