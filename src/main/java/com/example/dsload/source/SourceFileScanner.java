package com.example.dsload.source;

import com.example.dsload.exception.NoSourceFilesException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists the files of the source directory that match the configured glob, in lexicographic order
 * of their names so reruns process and audit files in the same sequence.
 */
@Slf4j
public class SourceFileScanner {

    private final String pattern;

    public SourceFileScanner(String pattern) {
        this.pattern = pattern;
    }

    public List<Path> scan(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new NoSourceFilesException(directory, pattern);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, pattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
        if (files.isEmpty()) {
            throw new NoSourceFilesException(directory, pattern);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        log.info("Found {} files in {}: {}", files.size(), directory,
                files.stream().map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        return files;
    }
}
