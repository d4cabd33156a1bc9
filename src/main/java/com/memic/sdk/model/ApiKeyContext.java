package com.memic.sdk.model;

import org.springframework.lang.Nullable;

/**
 * What the API key resolves to on the server side.
 *
 * @param organizationId   organization owning the key, always present
 * @param organizationName organization display name, if reported
 * @param projectId        project the key is scoped to, for deployments with project-scoped keys
 * @param environmentSlug  deployment environment, e.g. {@code staging} or {@code production}
 */
public record ApiKeyContext(String organizationId,
                            @Nullable String organizationName,
                            @Nullable String projectId,
                            @Nullable String environmentSlug) {
}
