package com.example.storage.util;

import java.util.regex.Pattern;

public class SqlIdentifierValidator {
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final int MAX_LENGTH = 63;

    private SqlIdentifierValidator() {
    }

    public static void validate(String identifier) {
        if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        if (identifier.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("SQL identifier longer than " + MAX_LENGTH + " characters: " + identifier);
        }
    }
}
