package com.memic.sdk.exception;

import com.memic.sdk.model.FileStatus;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Thrown when the remote pipeline reports a terminal {@code *_failed} status for a file.
 */
@Getter
public class FileProcessingException extends MemicException {

    @Serial
    private static final long serialVersionUID = 1840736115079914387L;

    private final String fileId;
    private final FileStatus status;

    @Nullable
    private final String errorMessage;

    public FileProcessingException(String fileId, FileStatus status, @Nullable String errorMessage) {
        super("File processing failed with status " + status.getValue() + ": "
                + (errorMessage != null ? errorMessage : "Unknown error"));
        this.fileId = fileId;
        this.status = status;
        this.errorMessage = errorMessage;
    }
}
