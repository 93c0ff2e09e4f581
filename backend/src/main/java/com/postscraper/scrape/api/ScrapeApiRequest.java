package com.postscraper.scrape.api;

import java.util.List;

public record ScrapeApiRequest(
    List<String> urls,
    Integer concurrency,
    Integer maxAttempts,
    Integer retryDelaySeconds,
    String proxyUrl
) {
}
