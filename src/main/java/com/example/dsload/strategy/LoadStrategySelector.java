package com.example.dsload.strategy;

import com.example.dsload.config.LoaderProperties;
import com.example.dsload.exception.UnknownSourceFileException;
import com.example.dsload.model.LoadSpec;
import com.example.dsload.util.SqlIdentifierValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class LoadStrategySelector {

    private final Map<String, LoadSpec> specs;

    public LoadStrategySelector(Collection<LoadSpec> specs) {
        Map<String, LoadSpec> byFile = new LinkedHashMap<>();
        for (LoadSpec spec : specs) {
            validate(spec);
            if (byFile.put(spec.getFileName(), spec) != null) {
                throw new IllegalArgumentException("Duplicate load specification for " + spec.getFileName());
            }
        }
        this.specs = Collections.unmodifiableMap(byFile);
    }

    public static LoadStrategySelector fromProperties(LoaderProperties properties) {
        return new LoadStrategySelector(properties.getLoadSpecs().entrySet().stream()
                .map(e -> toSpec(e.getKey(), e.getValue()))
                .collect(Collectors.toList()));
    }

    public LoadSpec select(String fileName) {
        LoadSpec spec = specs.get(fileName.toLowerCase());
        if (spec == null) {
            throw new UnknownSourceFileException(fileName);
        }
        return spec;
    }

    public Collection<LoadSpec> getSpecs() {
        return specs.values();
    }

    private static LoadSpec toSpec(String fileName, LoaderProperties.Spec spec) {
        return switch (spec.getMode().toLowerCase()) {
            case "merge" -> LoadSpec.merge(fileName, spec.getTable(), spec.getPrimaryKey(),
                    spec.getDateColumns(), spec.getFlagPrefix());
            case "replace" -> {
                if (!spec.getPrimaryKey().isEmpty()) {
                    throw new IllegalArgumentException("REPLACE load of " + fileName + " must not declare a primary key");
                }
                yield LoadSpec.replace(fileName, spec.getTable(), spec.getDateColumns(), spec.getFlagPrefix());
            }
            default -> throw new IllegalArgumentException("Unknown load mode '" + spec.getMode() + "' for " + fileName);
        };
    }

    private static void validate(LoadSpec spec) {
        SqlIdentifierValidator.validateQualified(spec.getTargetTable());
        spec.getPrimaryKey().forEach(SqlIdentifierValidator::validate);
        spec.getDateColumns().forEach(SqlIdentifierValidator::validate);
        log.debug("Registered {} -> {} ({}, key={})", spec.getFileName(), spec.getTargetTable(),
                spec.getMode(), spec.getPrimaryKey());
    }
}
