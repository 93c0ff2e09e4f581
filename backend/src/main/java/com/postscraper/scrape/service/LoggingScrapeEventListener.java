package com.postscraper.scrape.service;

import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.FetchInput;
import com.postscraper.scrape.model.JobState;
import com.postscraper.scrape.model.ScrapeBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingScrapeEventListener implements ScrapeEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingScrapeEventListener.class);

    @Override
    public void onTransition(FetchInput input, JobState state, int attempt) {
        if (state == JobState.SUCCEEDED) {
            log.info("Scraped {} after {} attempt(s)", input.target(), attempt);
        } else if (state == JobState.FAILED) {
            log.warn("Giving up on {} after {} attempt(s)", input.target(), attempt);
        } else {
            log.debug("{} -> {} (attempt {})", input.target(), state, attempt);
        }
    }

    @Override
    public void onAttemptFailed(FetchInput input, int attempt, FailureKind kind, String message) {
        if (kind == FailureKind.RATE_LIMITED) {
            log.warn("Rate limited on {} (attempt {})", input.target(), attempt);
            return;
        }
        log.warn("Attempt {} for {} failed: {} {}", attempt, input.target(), kind, message);
    }

    @Override
    public void onRefreshFailed(FetchInput input, String reason) {
        log.warn("Query id refresh for {} failed: {}", input.target(), reason);
    }

    @Override
    public void onBatchFinished(ScrapeBatchResult result) {
        log.info(
            "Batch finished: total={}, success={}, failed={}",
            result.entries().size(),
            result.successCount(),
            result.failureCount()
        );
    }
}
