package com.fotoreport.backend.global.common;

public final class Texts {

    private Texts() {
    }

    /**
     * Trims the value and maps blank input to {@code null} for optional text columns.
     */
    public static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
