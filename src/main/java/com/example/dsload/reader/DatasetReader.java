package com.example.dsload.reader;

import com.example.dsload.exception.DecodeException;
import com.example.dsload.exception.MalformedFileException;
import com.example.dsload.model.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a semicolon-delimited export into a {@link Dataset} of raw text cells, decoded with the
 * first candidate encoding that accepts every byte.
 */
@Slf4j
public class DatasetReader {

    public static final char DELIMITER = ';';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(DELIMITER)
            .setIgnoreEmptyLines(true)
            .setTrailingData(true)
            .build();

    private final List<Charset> encodings;

    public DatasetReader(List<String> encodings) {
        if (encodings == null || encodings.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate encoding is required");
        }
        this.encodings = encodings.stream().map(Charset::forName).collect(Collectors.toList());
    }

    public Dataset read(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        String text = decode(file, content);
        return parse(file, text);
    }

    private String decode(Path file, byte[] content) {
        for (Charset charset : encodings) {
            CharsetDecoder decoder = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            try {
                String text = decoder.decode(ByteBuffer.wrap(content)).toString();
                log.debug("Decoded {} as {}", file.getFileName(), charset.name());
                return text;
            } catch (CharacterCodingException e) {
                log.debug("{} is not valid {}", file.getFileName(), charset.name());
            }
        }
        throw new DecodeException(file, encodings.stream().map(Charset::name).collect(Collectors.toList()));
    }

    private Dataset parse(Path file, String text) {
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        try (CSVParser parser = CSVParser.parse(new StringReader(text), FORMAT)) {
            List<String> header = null;
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (header == null) {
                    header = record.toList();
                    continue;
                }
                if (record.size() > header.size()) {
                    throw new MalformedFileException(file.getFileName() + ": record " + record.getRecordNumber()
                            + " has " + record.size() + " fields, header has " + header.size());
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < record.size(); i++) {
                    row.put(header.get(i), record.get(i));
                }
                rows.add(row);
            }
            if (header == null) {
                throw new MalformedFileException(file.getFileName() + " has no header row");
            }
            return new Dataset(header, rows);
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new MalformedFileException("Cannot parse " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
