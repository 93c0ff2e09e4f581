package com.postscraper.scrape.service;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.FetchInput;
import com.postscraper.scrape.model.FetchOutcome;
import com.postscraper.scrape.model.JobState;
import com.postscraper.scrape.model.PostRecord;
import com.postscraper.scrape.model.ProcessResult;
import com.postscraper.scrape.model.ResultEntry;
import com.postscraper.scrape.model.ScrapeBatchResult;
import com.postscraper.scrape.model.ScrapeException;
import com.postscraper.scrape.normalize.MalformedOutputException;
import com.postscraper.scrape.normalize.PostNormalizer;
import com.postscraper.scrape.process.BirdToolClient;
import com.postscraper.scrape.util.FailureClassifier;
import com.postscraper.scrape.util.PostUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs one fetch-and-normalize job per input on the scrape executor. A batch gets at most
 * {@code concurrency} workers; each pulls the next pending input once its current job,
 * retries included, is done. Results come back in input order.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final BirdToolClient client;
    private final PostNormalizer normalizer;
    private final ExecutorService scrapeExecutor;
    private final ScraperProperties properties;
    private final ScrapeEventListener listener;

    public ScrapeOrchestratorService(
        BirdToolClient client,
        PostNormalizer normalizer,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        ScraperProperties properties,
        ScrapeEventListener listener
    ) {
        this.client = client;
        this.normalizer = normalizer;
        this.scrapeExecutor = scrapeExecutor;
        this.properties = properties;
        this.listener = listener;
    }

    public ScrapeBatchResult run(List<FetchInput> inputs) {
        return run(
            inputs,
            properties.getParallelWorkers(),
            properties.getMaxRetry(),
            Duration.ofSeconds(properties.getRetryWaitSeconds())
        );
    }

    public ScrapeBatchResult run(List<FetchInput> inputs, int concurrency, int maxAttempts, Duration retryDelay) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs must not be null");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }

        Instant startedAt = Instant.now();
        int workers = Math.min(concurrency, inputs.size());
        log.info("Scraping {} post(s) with concurrency={}, maxAttempts={}", inputs.size(), workers, maxAttempts);
        AtomicInteger nextIndex = new AtomicInteger();
        AtomicReferenceArray<FetchOutcome> outcomes = new AtomicReferenceArray<>(inputs.size());

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            futures.add(CompletableFuture.runAsync(
                () -> drain(inputs, nextIndex, outcomes, maxAttempts, retryDelay),
                scrapeExecutor
            ));
        }
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                log.warn("Scrape worker stopped unexpectedly", e.getCause());
            }
        }

        List<ResultEntry> entries = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            FetchOutcome outcome = outcomes.get(i);
            if (outcome == null) {
                outcome = FetchOutcome.failure(FailureKind.UNCLASSIFIED, "Job did not run", 0);
            }
            entries.add(new ResultEntry(inputs.get(i), outcome));
        }

        ScrapeBatchResult result = new ScrapeBatchResult(startedAt, Instant.now(), entries);
        listener.onBatchFinished(result);
        return result;
    }

    /**
     * One worker: takes pending inputs by index until none are left, finishing each job
     * (retries included) before taking the next.
     */
    private void drain(
        List<FetchInput> inputs,
        AtomicInteger nextIndex,
        AtomicReferenceArray<FetchOutcome> outcomes,
        int maxAttempts,
        Duration retryDelay
    ) {
        int index;
        while ((index = nextIndex.getAndIncrement()) < inputs.size()) {
            FetchInput input = inputs.get(index);
            FetchOutcome outcome;
            try {
                outcome = runJob(input, maxAttempts, retryDelay);
            } catch (RuntimeException e) {
                log.warn("Scrape job failed unexpectedly for {}", input.target(), e);
                listener.onTransition(input, JobState.FAILED, 0);
                outcome = FetchOutcome.failure(FailureKind.UNCLASSIFIED, "Unexpected error: " + e, 0);
            }
            outcomes.set(index, outcome);
        }
    }

    FetchOutcome runJob(FetchInput input, int maxAttempts, Duration retryDelay) {
        listener.onTransition(input, JobState.PENDING, 0);
        String url = PostUrls.normalize(input.target());
        if (url.isEmpty()) {
            listener.onTransition(input, JobState.FAILED, 0);
            return FetchOutcome.failure(FailureKind.UNCLASSIFIED, "No URL provided", 0);
        }
        if (Thread.currentThread().isInterrupted()) {
            listener.onTransition(input, JobState.FAILED, 0);
            return FetchOutcome.failure(FailureKind.UNCLASSIFIED, "Interrupted before first attempt", 0);
        }
        return attempt(input, url, maxAttempts, retryDelay);
    }

    private FetchOutcome attempt(FetchInput input, String url, int maxAttempts, Duration retryDelay) {
        int attempts = 0;
        boolean refreshed = false;
        while (true) {
            attempts++;
            listener.onTransition(input, JobState.INVOKING, attempts);

            FailureKind kind;
            String message;
            try {
                ProcessResult result = client.readPost(url, input.proxyUrl());
                if (result.isSuccessful()) {
                    PostRecord record = normalizer.normalize(result.stdout(), url);
                    listener.onTransition(input, JobState.SUCCEEDED, attempts);
                    return FetchOutcome.success(record, attempts);
                }
                listener.onTransition(input, JobState.CLASSIFYING, attempts);
                kind = FailureClassifier.classify(result);
                message = FailureClassifier.describe(kind, result);
            } catch (MalformedOutputException e) {
                listener.onTransition(input, JobState.CLASSIFYING, attempts);
                kind = e.getKind();
                message = e.getMessage();
            } catch (ScrapeException e) {
                // tool vanished or the worker was interrupted mid-invocation
                kind = e.getKind();
                message = e.getMessage();
            }
            listener.onAttemptFailed(input, attempts, kind, message);

            boolean retry = kind.isRetryable()
                && attempts < maxAttempts
                && !Thread.currentThread().isInterrupted();
            if (kind.triggersRefresh() && !refreshed) {
                listener.onTransition(input, JobState.REFRESHING, attempts);
                refresh(input);
                refreshed = true;
            } else if (retry) {
                listener.onTransition(input, JobState.RETRYING, attempts);
            }
            if (!retry) {
                listener.onTransition(input, JobState.FAILED, attempts);
                return FetchOutcome.failure(kind, message, attempts);
            }

            if (!sleep(retryDelay)) {
                listener.onTransition(input, JobState.FAILED, attempts);
                return FetchOutcome.failure(kind, message, attempts);
            }
        }
    }

    /**
     * Best effort: a failed refresh never fails the job that asked for it.
     */
    private void refresh(FetchInput input) {
        try {
            ProcessResult result = client.refreshQueryIds();
            if (result.timedOut()) {
                listener.onRefreshFailed(input, "timed out");
            } else if (result.exitCode() != 0) {
                listener.onRefreshFailed(input, "exit code " + result.exitCode() + ": " + result.stderr().trim());
            }
        } catch (RuntimeException e) {
            log.warn("Query id refresh failed for {}", input.target(), e);
            listener.onRefreshFailed(input, e.getMessage());
        }
    }

    private boolean sleep(Duration delay) {
        long millis = delay.toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
