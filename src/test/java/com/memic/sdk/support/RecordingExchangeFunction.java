package com.memic.sdk.support;

import com.memic.sdk.config.MemicClientAutoConfiguration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Replays queued responses and records every request, body included, so tests can assert on the
 * exact HTTP traffic without a server.
 */
public class RecordingExchangeFunction implements ExchangeFunction {

    private final ExchangeStrategies strategies = MemicClientAutoConfiguration.memicExchangeStrategies();
    private final Deque<Supplier<Mono<ClientResponse>>> responses = new ArrayDeque<>();
    private final List<RecordedRequest> requests = new ArrayList<>();

    public RecordingExchangeFunction respond(HttpStatus status, String json) {
        responses.add(() -> Mono.just(ClientResponse.create(status, strategies)
                                                    .header(HttpHeaders.CONTENT_TYPE,
                                                            MediaType.APPLICATION_JSON_VALUE)
                                                    .body(json)
                                                    .build()));
        return this;
    }

    public RecordingExchangeFunction respondText(HttpStatus status, String text) {
        responses.add(() -> Mono.just(ClientResponse.create(status, strategies)
                                                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                                                    .body(text)
                                                    .build()));
        return this;
    }

    public RecordingExchangeFunction respondEmpty(HttpStatus status) {
        responses.add(() -> Mono.just(ClientResponse.create(status, strategies).build()));
        return this;
    }

    public RecordingExchangeFunction hang() {
        responses.add(Mono::never);
        return this;
    }

    public RecordingExchangeFunction fail(Throwable error) {
        responses.add(() -> Mono.error(error));
        return this;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(record(request));
        Supplier<Mono<ClientResponse>> response = responses.poll();
        if (response == null) {
            return Mono.error(new AssertionError("Unexpected request " + request.method() + " " + request.url()));
        }
        return response.get();
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public RecordedRequest request(int index) {
        return requests.get(index);
    }

    public int requestCount() {
        return requests.size();
    }

    private RecordedRequest record(ClientRequest request) {
        MockClientHttpRequest httpRequest = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(httpRequest, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return strategies.messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        String body = httpRequest.getBodyAsString().defaultIfEmpty("").block();

        HttpHeaders headers = new HttpHeaders();
        headers.addAll(request.headers());
        return new RecordedRequest(request.method(), request.url(), headers, body);
    }

    public record RecordedRequest(HttpMethod method, URI url, HttpHeaders headers, String body) {

        public String path() {
            return url.getPath();
        }
    }
}
