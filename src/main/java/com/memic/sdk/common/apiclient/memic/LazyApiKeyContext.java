package com.memic.sdk.common.apiclient.memic;

import com.memic.sdk.model.ApiKeyContext;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Holds the API-key context of one client instance, resolving it on first access.
 *
 * <p>The state is either unresolved or resolved and only ever moves from the former to the latter.
 * There is no locking: threads that race on the first access may each run the resolver, and the last
 * write wins. The resolver is idempotent for a given key, so every winner stores the same value.
 */
@Slf4j
final class LazyApiKeyContext {

    private interface State {
    }

    private record Unresolved() implements State {
    }

    private record Resolved(ApiKeyContext context) implements State {
    }

    private final Supplier<ApiKeyContext> resolver;
    private volatile State state = new Unresolved();

    LazyApiKeyContext(Supplier<ApiKeyContext> resolver) {
        this.resolver = resolver;
    }

    ApiKeyContext get() {
        if (state instanceof Resolved resolved) {
            return resolved.context();
        }
        ApiKeyContext context = resolver.get();
        log.info("Resolved API key to organization {}", context.organizationId());
        state = new Resolved(context);
        return context;
    }

    boolean isResolved() {
        return state instanceof Resolved;
    }
}
