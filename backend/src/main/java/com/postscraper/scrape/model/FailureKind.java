package com.postscraper.scrape.model;

public enum FailureKind {
    TOOL_MISSING("Bird CLI not found. Install it with: bun install -g @nicepkg/bird"),
    AUTH_EXPIRED("Authentication failed. Re-extract cookies from your browser."),
    RATE_LIMITED("Rate limit exceeded. Wait before retrying."),
    NOT_FOUND_OR_STALE("Post not found or query IDs outdated."),
    TIMEOUT("Bird command timed out."),
    MALFORMED_OUTPUT("Failed to parse Bird output as JSON."),
    UNCLASSIFIED("Bird CLI failed.");

    private final String defaultMessage;

    FailureKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /**
     * Missing credentials and a missing binary do not get better by waiting.
     */
    public boolean isRetryable() {
        return switch (this) {
            case AUTH_EXPIRED, TOOL_MISSING -> false;
            default -> true;
        };
    }

    public boolean triggersRefresh() {
        return this == NOT_FOUND_OR_STALE;
    }
}
