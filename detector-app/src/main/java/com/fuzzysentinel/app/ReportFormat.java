package com.fuzzysentinel.app;

import java.util.Locale;

/**
 * Output format of the window reports.
 */
public enum ReportFormat {

    /** Aligned, human-readable block per window. */
    TEXT,

    /** One JSON document per window. */
    JSON;

    /**
     * @throws IllegalArgumentException if the name matches no format
     */
    public static ReportFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Report format must not be null or blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Unknown report format: '" + name + "'. Supported: text, json");
        };
    }
}
