package com.example.dsload.processor;

import com.example.dsload.exception.MalformedFileException;
import com.example.dsload.model.Dataset;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses rows that share a primary key, keeping the last occurrence in file order.
 */
@Slf4j
public class Deduplicator {

    public int deduplicate(Dataset dataset, List<String> primaryKey) {
        if (primaryKey == null || primaryKey.isEmpty()) {
            return 0;
        }
        for (String column : primaryKey) {
            if (!dataset.hasColumn(column)) {
                throw new MalformedFileException("Primary key column missing from file: " + column);
            }
        }

        List<Map<String, Object>> rows = dataset.getRows();
        Map<List<Object>, Integer> lastIndex = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            lastIndex.put(keyOf(rows.get(i), primaryKey), i);
        }
        if (lastIndex.size() == rows.size()) {
            return 0;
        }

        List<Map<String, Object>> survivors = new ArrayList<>(lastIndex.size());
        for (int i = 0; i < rows.size(); i++) {
            if (lastIndex.get(keyOf(rows.get(i), primaryKey)) == i) {
                survivors.add(rows.get(i));
            }
        }
        int removed = rows.size() - survivors.size();
        dataset.retainRows(survivors);
        log.debug("Removed {} duplicate rows on key {}", removed, primaryKey);
        return removed;
    }

    private static List<Object> keyOf(Map<String, Object> row, List<String> primaryKey) {
        List<Object> key = new ArrayList<>(primaryKey.size());
        for (String column : primaryKey) {
            key.add(row.get(column));
        }
        return key;
    }
}
