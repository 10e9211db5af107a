package com.example.dsload.exception;

import java.nio.file.Path;
import java.util.List;

public class DecodeException extends LoadException {

    public DecodeException(Path file, List<String> triedEncodings) {
        super("Cannot decode " + file.getFileName() + " with any of " + triedEncodings);
    }
}
