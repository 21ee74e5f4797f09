package io.scanhive.runtime.app;

import java.util.Locale;

public enum DumpFormat {
    JSON("application/json"),
    CSV("text/csv");

    private final String mediaType;

    DumpFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }

    public static DumpFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported dump format: " + value, e);
        }
    }
}
