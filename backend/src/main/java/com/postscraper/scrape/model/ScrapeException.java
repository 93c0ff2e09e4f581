package com.postscraper.scrape.model;

public class ScrapeException extends RuntimeException {
    private final FailureKind kind;

    public ScrapeException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScrapeException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
