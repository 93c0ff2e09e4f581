package com.postscraper.scrape.model;

public record ToolInfoResponse(
    String version,
    ToolCredentials.Source credentialsSource
) {
}
