package com.bdfrenumber.core;

import java.nio.file.Path;

/**
 * Unrecoverable failure while reading or writing deck files.
 *
 * <p>Carries the offending path so callers can report it without parsing the message.
 */
public class RenumberException extends RuntimeException {

    private final transient Path path;

    public RenumberException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public RenumberException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * File the failure relates to.
     *
     * @return path, or null when not file related
     */
    public Path getPath() {
        return path;
    }
}
