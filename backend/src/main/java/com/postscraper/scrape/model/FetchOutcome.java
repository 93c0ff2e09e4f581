package com.postscraper.scrape.model;

public record FetchOutcome(
    boolean success,
    PostRecord record,
    FailureKind kind,
    String message,
    int attempts
) {
    public static FetchOutcome success(PostRecord record, int attempts) {
        return new FetchOutcome(true, record, null, null, attempts);
    }

    public static FetchOutcome failure(FailureKind kind, String message, int attempts) {
        return new FetchOutcome(false, null, kind, message, attempts);
    }
}
