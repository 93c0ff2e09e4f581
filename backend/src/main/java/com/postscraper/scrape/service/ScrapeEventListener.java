package com.postscraper.scrape.service;

import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.FetchInput;
import com.postscraper.scrape.model.JobState;
import com.postscraper.scrape.model.ScrapeBatchResult;

/**
 * Receives job progress from {@link ScrapeOrchestratorService}. Calls arrive from worker
 * threads concurrently.
 */
public interface ScrapeEventListener {

    default void onTransition(FetchInput input, JobState state, int attempt) {
    }

    default void onAttemptFailed(FetchInput input, int attempt, FailureKind kind, String message) {
    }

    default void onRefreshFailed(FetchInput input, String reason) {
    }

    default void onBatchFinished(ScrapeBatchResult result) {
    }
}
