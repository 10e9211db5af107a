package com.example.dsload.exception;

public class MalformedFileException extends LoadException {

    public MalformedFileException(String message) {
        super(message);
    }

    public MalformedFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
