package com.memic.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Processing stages a file moves through in the remote ingestion pipeline, in pipeline order.
 *
 * <p>Classification is derived from the wire value: every {@code *_failed} stage is a failure, and
 * everything that is neither failed nor {@link #READY} is still processing.
 */
@Getter
@AllArgsConstructor
public enum FileStatus {
    UPLOADING("uploading"),
    UPLOADED("uploaded"),
    UPLOAD_FAILED("upload_failed"),
    CONVERSION_STARTED("conversion_started"),
    CONVERSION_COMPLETE("conversion_complete"),
    CONVERSION_FAILED("conversion_failed"),
    PARSING_STARTED("parsing_started"),
    PARSING_COMPLETE("parsing_complete"),
    PARSING_FAILED("parsing_failed"),
    CHUNKING_STARTED("chunking_started"),
    CHUNKING_COMPLETE("chunking_complete"),
    CHUNKING_FAILED("chunking_failed"),
    EMBEDDING_STARTED("embedding_started"),
    EMBEDDING_COMPLETE("embedding_complete"),
    EMBEDDING_FAILED("embedding_failed"),
    READY("ready");

    private static final String FAILED_SUFFIX = "_failed";
    private static final Map<String, FileStatus> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(FileStatus::getValue, Function.identity()));

    @JsonValue
    private final String value;

    /**
     * Converts a wire value into its enum constant.
     *
     * @param value the status string received from the API
     *
     * @return the matching {@link FileStatus}
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static FileStatus fromValue(String value) {
        FileStatus status = VALUE_MAP.get(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown file status: " + value);
        }
        return status;
    }

    public boolean isFailed() {
        return value.endsWith(FAILED_SUFFIX);
    }

    public boolean isProcessing() {
        return !isFailed() && this != READY;
    }

    public boolean isTerminal() {
        return !isProcessing();
    }
}
