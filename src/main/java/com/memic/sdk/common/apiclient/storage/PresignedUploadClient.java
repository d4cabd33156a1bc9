package com.memic.sdk.common.apiclient.storage;

import com.memic.sdk.exception.MemicException;
import com.memic.sdk.exception.apiclient.ApiException;
import com.memic.sdk.exception.apiclient.ConnectionException;
import com.memic.sdk.exception.apiclient.RequestTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Streams a local file to a presigned storage URL with a single PUT.
 *
 * <p>The storage provider is not the Memic API: no API key is sent, the URL is used verbatim so its
 * signature is not re-encoded, and the response body is treated as opaque text.
 */
@Slf4j
public class PresignedUploadClient {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final WebClient webClient;
    private final Duration timeout;

    /**
     * @param webClient WebClient without a base URL or default headers
     * @param timeout   timeout of one upload, longer than the API request timeout
     */
    public PresignedUploadClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    /**
     * Uploads the file. The file is opened here and closed before this method returns, whether the
     * upload succeeded or not.
     *
     * @param uploadUrl presigned URL returned by the upload init call
     * @param file      local file to send
     * @param size      size of the file in bytes, sent as {@code Content-Length}
     * @param mimeType  content type, must match the one declared at init
     *
     * @throws ApiException   if the storage provider answers with a status of 400 or above, cannot
     *                        be reached, or does not answer within the timeout
     * @throws MemicException if the file cannot be read
     */
    public void upload(String uploadUrl, Path file, long size, String mimeType) {
        log.info("Uploading {} ({} bytes, {}) to storage", file.getFileName(), size, mimeType);
        URI uri = toUri(uploadUrl);
        try (InputStream inputStream = Files.newInputStream(file)) {
            Flux<DataBuffer> body = DataBufferUtils.readInputStream(() -> inputStream,
                                                                    DefaultDataBufferFactory.sharedInstance,
                                                                    BUFFER_SIZE);
            webClient.put()
                     .uri(uri)
                     .contentType(MediaType.parseMediaType(mimeType))
                     .contentLength(size)
                     .body(BodyInserters.fromDataBuffers(body))
                     .exchangeToMono(this::handleResponse)
                     .timeout(timeout)
                     .onErrorMap(this::mapException)
                     .block();
            log.info("Storage upload of {} completed", file.getFileName());
        } catch (IOException e) {
            log.error("Failed to read {} for upload", file, e);
            throw new MemicException("Failed to read file for upload: " + file, e);
        }
    }

    private static URI toUri(String uploadUrl) {
        try {
            return URI.create(uploadUrl);
        } catch (IllegalArgumentException e) {
            log.warn("Storage upload URL is not a valid URI: {}", e.getMessage());
            throw new ApiException("Invalid storage upload URL: " + e.getMessage(), e);
        }
    }

    private Mono<Void> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (statusCode < 400) {
            return response.releaseBody();
        }
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> {
                           log.warn("Storage rejected upload with status {}: {}", statusCode, body);
                           return Mono.error(new ApiException("Failed to upload file to storage: " + body,
                                                              statusCode, body));
                       });
    }

    private Throwable mapException(Throwable error) {
        if (error instanceof ApiException) {
            return error;
        }
        if (error instanceof WebClientRequestException) {
            return new ConnectionException("Storage upload failed: " + error.getMessage(), error);
        }
        if (error instanceof TimeoutException) {
            return new RequestTimeoutException("Storage upload timed out after " + timeout.toSeconds() + " s", error);
        }
        return new ApiException("Storage upload failed: " + error.getMessage(), error);
    }
}
