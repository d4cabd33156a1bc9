package com.memic.sdk.common.apiclient;

import com.memic.sdk.common.apiclient.authentication.Authentication;
import com.memic.sdk.common.apiclient.model.ApiRequest;
import com.memic.sdk.common.apiclient.model.ApiResponse;
import com.memic.sdk.common.apiclient.model.ErrorBody;
import com.memic.sdk.common.apiclient.model.HeaderConfig;
import com.memic.sdk.common.json.JsonParser;
import com.memic.sdk.exception.apiclient.ApiException;
import com.memic.sdk.exception.apiclient.AuthenticationException;
import com.memic.sdk.exception.apiclient.ConnectionException;
import com.memic.sdk.exception.apiclient.NotFoundException;
import com.memic.sdk.exception.apiclient.RequestTimeoutException;
import com.memic.sdk.exception.json.JsonParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients, providing common functionality for making API calls,
 * handling responses, and mapping exceptions. Subclasses configure the {@link WebClient},
 * {@link Authentication} and {@link HeaderConfig} and expose typed endpoints on top of
 * {@link #call(ApiRequest)}.
 *
 * <p>Calls are blocking: each one returns only once its HTTP exchange has completed or failed.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;
    protected final JsonParser jsonParser;
    protected final Duration timeout;

    protected ApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                        JsonParser jsonParser, Duration timeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.headerConfig = headerConfig;
        this.jsonParser = jsonParser;
        this.timeout = timeout;
    }

    /**
     * Executes an API call based on the provided {@link ApiRequest}. This method configures the
     * request, applies authentication and headers, sends the request, handles the response, and maps
     * any exceptions.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The API response of an exchange with a status below 400.
     *
     * @throws ApiException If the call failed or the API answered with a status of 400 or above.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());
        log.debug("ApiRequest details: {}", apiRequest);

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(timeout)
                                                     .onErrorMap(this::mapException)
                                                     .block();
            log.debug("Received response with status: {}",
                      Optional.ofNullable(apiResponse).map(ApiResponse::getStatusCode).orElse(null));
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call {} {} failed: {}", apiRequest.getMethod(), apiRequest.getPath(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call", e);
            throw mapException(e);
        }
    }

    /**
     * Maps exceptions to the SDK's exception types. {@link ApiException}s raised while handling an
     * error response pass through unchanged.
     *
     * @param error The throwable error.
     *
     * @return A specific {@link ApiException} representing the error.
     */
    protected ApiException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.warn("Mapping exception: {}", error.getMessage());
        if (error instanceof WebClientRequestException || error instanceof ConnectException
                || error instanceof UnknownHostException) {
            return new ConnectionException("Request failed: " + error.getMessage(), error);
        } else if (error instanceof TimeoutException) {
            return new RequestTimeoutException("Request timed out after " + timeout.toMillis() + " ms", error);
        } else {
            return new ApiException("Request failed: " + error.getMessage(), error);
        }
    }

    /**
     * Configures the WebClient request by setting the HTTP method and URI. Query parameters and path
     * variables are added to the URI.
     */
    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Configures the headers for the WebClient request. Authentication headers, fixed headers from
     * {@link HeaderConfig}, and headers from the {@link ApiRequest} are applied, in that order of
     * increasing precedence.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.name(), header.value()));
        }

        apiRequest.getHeaders().forEach(requestBodySpec::header);

        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    /**
     * Configures the JSON body of the WebClient request, if the {@link ApiRequest} has one.
     */
    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            log.trace("Request {} has no body", apiRequest.getPath());
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
    }

    /**
     * Handles the {@link ClientResponse} from the WebClient. A status below 400 becomes an
     * {@link ApiResponse}; any other status becomes an error signal carrying the mapped exception.
     */
    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        log.debug("Handling response with status code: {}", statusCode);

        if (statusCode < 400) {
            return handleSuccessResponse(response, statusCode);
        }
        return handleErrorResponse(response, statusCode);
    }

    private Mono<ApiResponse> handleSuccessResponse(ClientResponse response, int statusCode) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        ApiResponse.ApiResponseBuilder builder = ApiResponse.builder()
                                                            .contentType(headers.getContentType())
                                                            .headers(headers)
                                                            .statusCode(statusCode)
                                                            .timestamp(timestamp);

        if (statusCode == HttpStatus.NO_CONTENT.value()) {
            return response.releaseBody().then(Mono.fromSupplier(builder::build));
        }
        return response.bodyToMono(byte[].class)
                       .map(data -> builder.data(data).build())
                       .switchIfEmpty(Mono.fromSupplier(builder::build));
    }

    private Mono<ApiResponse> handleErrorResponse(ClientResponse response, int statusCode) {
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> {
                           log.warn("API responded with status {} and body: {}", statusCode, body);
                           return Mono.error(createException(body, statusCode));
                       });
    }

    /**
     * Creates an appropriate {@link ApiException} based on the provided HTTP status code and error
     * body.
     *
     * @param body       The raw response body.
     * @param statusCode The HTTP status code.
     *
     * @return An {@link ApiException} representing the error.
     */
    private ApiException createException(String body, int statusCode) {
        String message = extractErrorMessage(body, statusCode);
        return switch (statusCode) {
            case 401, 403 -> new AuthenticationException(message, statusCode, body);
            case 404 -> new NotFoundException(message, body);
            default -> new ApiException(message, statusCode, body);
        };
    }

    /**
     * Builds a human-readable message from an error body: the {@code detail} field, then the
     * {@code message} field, then the raw text, then {@code HTTP <status>}.
     */
    private String extractErrorMessage(String body, int statusCode) {
        if (!StringUtils.hasText(body)) {
            return "HTTP " + statusCode;
        }
        if (body.trim().startsWith("{")) {
            try {
                String message = jsonParser.parseObject(body, ErrorBody.class).firstMessage();
                if (message != null) {
                    return message;
                }
            } catch (JsonParsingException e) {
                log.debug("Error body for status {} is not valid JSON, using raw text", statusCode);
            }
        }
        return body;
    }
}
