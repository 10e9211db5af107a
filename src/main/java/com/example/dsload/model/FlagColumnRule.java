package com.example.dsload.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Declares that every column whose normalized name starts with {@code prefix} holds an integer flag
 * embedded in free text (for example {@code "1 - Yes"}).
 */
@Value
public class FlagColumnRule {

    String prefix;

    public FlagColumnRule(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Flag column prefix must not be blank");
        }
        this.prefix = prefix.trim().toLowerCase();
    }

    public List<String> resolve(List<String> columns) {
        return columns.stream()
                .filter(c -> c.startsWith(prefix))
                .collect(Collectors.toList());
    }
}
