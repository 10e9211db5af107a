package com.example.dsload.util;

import java.util.regex.Pattern;

public class SqlIdentifierValidator {
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    public static void validate(String identifier) {
        if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
    }

    public static void validateQualified(String qualifiedName) {
        if (qualifiedName == null) {
            throw new IllegalArgumentException("Invalid SQL identifier: null");
        }
        String[] parts = qualifiedName.split("\\.", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected schema-qualified table name: " + qualifiedName);
        }
        validate(parts[0]);
        validate(parts[1]);
    }

    public static String unqualified(String qualifiedName) {
        return qualifiedName.substring(qualifiedName.indexOf('.') + 1);
    }
}
