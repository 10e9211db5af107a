package com.example.dsload.exception;

import java.nio.file.Path;

public class NoSourceFilesException extends LoadException {

    public NoSourceFilesException(Path directory, String pattern) {
        super("No " + pattern + " files in " + directory);
    }
}
