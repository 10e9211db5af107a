package com.example.dsload.exception;

public class UnknownSourceFileException extends LoadException {

    public UnknownSourceFileException(String fileName) {
        super("No load specification registered for file: " + fileName);
    }
}
