package com.example.dsload.processor;

import com.example.dsload.exception.MalformedFileException;
import com.example.dsload.model.Dataset;
import com.example.dsload.model.LoadSpec;
import com.example.dsload.model.NormalizationReport;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes a freshly read {@link Dataset} in place: names, whitespace, date columns, then flag columns.
 */
@Slf4j
public class FieldNormalizer {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    public NormalizationReport normalize(Dataset dataset, LoadSpec spec) {
        normalizeColumnNames(dataset);
        trimValues(dataset);
        int dateErrors = coerceDates(dataset, spec.getDateColumns());
        List<String> flagColumns = spec.flagRule()
                .map(rule -> rule.resolve(dataset.getColumns()))
                .orElse(List.of());
        coerceFlags(dataset, flagColumns);
        return new NormalizationReport(dateErrors, flagColumns);
    }

    void normalizeColumnNames(Dataset dataset) {
        Set<String> seen = new HashSet<>();
        for (String column : dataset.getColumns()) {
            String normalized = normalizeName(column);
            if (!seen.add(normalized)) {
                throw new MalformedFileException("Duplicate column after normalization: " + normalized);
            }
        }
        dataset.renameColumns(FieldNormalizer::normalizeName);
    }

    void trimValues(Dataset dataset) {
        for (Map<String, Object> row : dataset.getRows()) {
            row.replaceAll((column, value) -> value instanceof String ? ((String) value).strip() : value);
        }
    }

    int coerceDates(Dataset dataset, List<String> dateColumns) {
        int errors = 0;
        for (String column : dateColumns) {
            if (!dataset.hasColumn(column)) {
                continue;
            }
            for (Map<String, Object> row : dataset.getRows()) {
                Object raw = row.get(column);
                if (raw == null || raw instanceof LocalDate) {
                    continue;
                }
                String text = raw.toString();
                Optional<LocalDate> parsed = FuzzyDateParser.parse(text);
                if (parsed.isEmpty() && !text.isBlank()) {
                    errors++;
                    log.debug("Unparseable date in column {}: '{}'", column, text);
                }
                row.put(column, parsed.orElse(null));
            }
        }
        return errors;
    }

    void coerceFlags(Dataset dataset, List<String> flagColumns) {
        for (String column : flagColumns) {
            for (Map<String, Object> row : dataset.getRows()) {
                row.put(column, toFlag(row.get(column)));
            }
        }
    }

    static String normalizeName(String column) {
        return column.strip().toLowerCase();
    }

    static Integer toFlag(Object raw) {
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Integer) {
            return (Integer) raw;
        }
        Matcher m = DIGITS.matcher(raw.toString());
        if (!m.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(m.group());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
