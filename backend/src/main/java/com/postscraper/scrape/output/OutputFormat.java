package com.postscraper.scrape.output;

import java.util.Locale;

public enum OutputFormat {
    JSON("json"),
    MARKDOWN("md");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Accepts "json", "markdown" and "md", case-insensitively.
     */
    public static OutputFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "markdown", "md" -> MARKDOWN;
            default -> throw new IllegalArgumentException("Unknown output format: " + value);
        };
    }
}
