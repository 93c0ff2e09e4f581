package com.postscraper.scrape.process;

import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.ProcessResult;
import com.postscraper.scrape.model.ScrapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class SubprocessInvoker implements ProcessInvoker {
    private static final Logger log = LoggerFactory.getLogger(SubprocessInvoker.class);
    private static final Duration DRAIN_GRACE = Duration.ofSeconds(2);

    private final ExecutorService streamExecutor;

    public SubprocessInvoker(ExecutorService streamExecutor) {
        this.streamExecutor = streamExecutor;
    }

    @Override
    public ProcessResult invoke(List<String> command, Map<String, String> environmentOverrides, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        // Each builder carries its own copy of the ambient environment.
        Map<String, String> environment = builder.environment();
        if (environmentOverrides != null) {
            environmentOverrides.forEach((key, value) -> {
                if (key != null && value != null) {
                    environment.put(key, value);
                }
            });
        }

        Instant startedAt = Instant.now();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ToolMissingException(command.get(0), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}", command.get(0), e);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Command {} timed out after {}s", command.get(0), timeout.toSeconds());
                kill(process);
                return ProcessResult.timedOut(
                    collect(stdout),
                    collect(stderr),
                    Duration.between(startedAt, Instant.now())
                );
            }
            return new ProcessResult(
                process.exitValue(),
                collect(stdout),
                collect(stderr),
                false,
                Duration.between(startedAt, Instant.now())
            );
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new ScrapeException(FailureKind.UNCLASSIFIED, "Interrupted while waiting for " + command.get(0), e);
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor);
    }

    private String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(DRAIN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect process output", e);
            return "";
        }
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
