package com.example.dsload.exception;

/**
 * Base class for failures that abort the processing of a single source file.
 */
public class LoadException extends RuntimeException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
