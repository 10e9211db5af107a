package com.example.dsload.model;

import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Value
public class LoadSpec {

    String fileName;
    String targetTable;
    LoadMode mode;
    List<String> primaryKey;
    List<String> dateColumns;
    String flagColumnPrefix;

    private LoadSpec(String fileName, String targetTable, LoadMode mode, List<String> primaryKey,
                     List<String> dateColumns, String flagColumnPrefix) {
        this.fileName = Objects.requireNonNull(fileName, "fileName").toLowerCase();
        this.targetTable = Objects.requireNonNull(targetTable, "target table of " + fileName).toLowerCase();
        this.mode = mode;
        this.primaryKey = List.copyOf(primaryKey);
        this.dateColumns = List.copyOf(dateColumns);
        this.flagColumnPrefix = flagColumnPrefix;
    }

    public static LoadSpec merge(String fileName, String targetTable, List<String> primaryKey,
                                 List<String> dateColumns, String flagColumnPrefix) {
        if (primaryKey == null || primaryKey.isEmpty()) {
            throw new IllegalArgumentException("MERGE load of " + fileName + " requires a primary key");
        }
        return new LoadSpec(fileName, targetTable, LoadMode.MERGE, primaryKey, dateColumns, flagColumnPrefix);
    }

    public static LoadSpec replace(String fileName, String targetTable,
                                   List<String> dateColumns, String flagColumnPrefix) {
        return new LoadSpec(fileName, targetTable, LoadMode.REPLACE, List.of(), dateColumns, flagColumnPrefix);
    }

    public Optional<FlagColumnRule> flagRule() {
        return Optional.ofNullable(flagColumnPrefix).map(FlagColumnRule::new);
    }
}
