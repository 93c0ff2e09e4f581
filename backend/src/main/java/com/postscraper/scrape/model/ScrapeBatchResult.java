package com.postscraper.scrape.model;

import java.time.Instant;
import java.util.List;

public record ScrapeBatchResult(
    Instant startedAt,
    Instant finishedAt,
    List<ResultEntry> entries
) {
    public ScrapeBatchResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public int successCount() {
        int count = 0;
        for (ResultEntry entry : entries) {
            if (entry.isSuccess()) {
                count++;
            }
        }
        return count;
    }

    public int failureCount() {
        return entries.size() - successCount();
    }
}
