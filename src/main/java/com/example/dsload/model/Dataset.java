package com.example.dsload.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Ordered columns plus ordered rows of one source file. An absent cell is not the same as an empty one.
 */
public class Dataset {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = new ArrayList<>(columns);
        this.rows = new ArrayList<>(rows);
    }

    public List<String> getColumns() {
        return List.copyOf(columns);
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public void renameColumns(UnaryOperator<String> renamer) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            renamed.add(renamer.apply(column));
        }
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            Map<String, Object> rewritten = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                String original = columns.get(c);
                if (row.containsKey(original)) {
                    rewritten.put(renamed.get(c), row.get(original));
                }
            }
            rows.set(i, rewritten);
        }
        columns.clear();
        columns.addAll(renamed);
    }

    public void retainRows(List<Map<String, Object>> survivors) {
        rows.clear();
        rows.addAll(survivors);
    }
}
