package com.postscraper.scrape.model;

import java.time.Duration;

public record ProcessResult(
    int exitCode,
    String stdout,
    String stderr,
    boolean timedOut,
    Duration duration
) {
    public static final int TIMED_OUT_EXIT_CODE = -1;

    public ProcessResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static ProcessResult timedOut(String stdout, String stderr, Duration duration) {
        return new ProcessResult(TIMED_OUT_EXIT_CODE, stdout, stderr, true, duration);
    }

    public boolean isSuccessful() {
        return exitCode == 0 && !timedOut;
    }
}
