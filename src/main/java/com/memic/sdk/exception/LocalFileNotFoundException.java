package com.memic.sdk.exception;

import lombok.Getter;

import java.io.Serial;
import java.nio.file.Path;

/**
 * Thrown when the local file passed to an upload does not exist. Raised before any network call.
 */
@Getter
public class LocalFileNotFoundException extends MemicException {

    @Serial
    private static final long serialVersionUID = 3275610449187702816L;

    private final transient Path path;

    public LocalFileNotFoundException(Path path) {
        super("File not found: " + path);
        this.path = path;
    }
}
