package com.memic.sdk.exception;

import com.memic.sdk.model.FileStatus;
import lombok.Getter;

import java.io.Serial;
import java.time.Duration;

/**
 * Thrown when a file did not reach {@code ready} within the poll timeout.
 */
@Getter
public class ProcessingTimeoutException extends MemicException {

    @Serial
    private static final long serialVersionUID = -5122958712356064710L;

    private final String fileId;
    private final FileStatus lastStatus;
    private final Duration timeout;

    public ProcessingTimeoutException(String fileId, FileStatus lastStatus, Duration timeout) {
        super("Timeout waiting for file to be ready. Current status: " + lastStatus.getValue());
        this.fileId = fileId;
        this.lastStatus = lastStatus;
        this.timeout = timeout;
    }
}
