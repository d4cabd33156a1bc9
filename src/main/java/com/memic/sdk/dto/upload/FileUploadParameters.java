package com.memic.sdk.dto.upload;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Parameters of a file upload.
 *
 * <p>{@code projectId} may be left out when the API key is scoped to a single project. Poll settings
 * left unset fall back to the client's configured polling defaults.
 */
@Getter
@Builder
@ToString
public class FileUploadParameters {

    @NonNull
    private final Path filePath;

    @Nullable
    private final String projectId;

    @Nullable
    private final String referenceId;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    @Builder.Default
    private final boolean waitForReady = true;

    @Nullable
    private final Duration pollInterval;

    @Nullable
    private final Duration pollTimeout;
}
