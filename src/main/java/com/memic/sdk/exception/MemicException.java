package com.memic.sdk.exception;

import java.io.Serial;

/**
 * Base exception for every error raised by the Memic SDK.
 */
public class MemicException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public MemicException(String message) {
        super(message);
    }

    public MemicException(String message, Throwable cause) {
        super(message, cause);
    }
}
