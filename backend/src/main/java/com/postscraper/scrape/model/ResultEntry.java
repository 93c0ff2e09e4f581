package com.postscraper.scrape.model;

public record ResultEntry(
    FetchInput input,
    FetchOutcome outcome
) {
    public boolean isSuccess() {
        return outcome != null && outcome.success();
    }
}
