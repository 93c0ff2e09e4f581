package com.postscraper.scrape.process;

import com.postscraper.scrape.model.ProcessResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one external command to completion. Implementations never throw on timeout; they
 * return a result with {@link ProcessResult#timedOut()} set instead.
 */
public interface ProcessInvoker {

    /**
     * @param command executable followed by its arguments
     * @param environmentOverrides merged over a private copy of the ambient environment; null values are skipped
     * @param timeout wall-clock ceiling for the whole invocation
     * @throws ToolMissingException if the executable cannot be started
     */
    ProcessResult invoke(List<String> command, Map<String, String> environmentOverrides, Duration timeout);
}
