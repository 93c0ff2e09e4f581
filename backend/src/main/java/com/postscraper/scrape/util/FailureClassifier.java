package com.postscraper.scrape.util;

import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.ProcessResult;

import java.util.Locale;

/**
 * Maps a failed bird invocation to a {@link FailureKind}. Rules are checked in order and the
 * first match wins, so "401 ... 404" is an auth problem, not a stale query id.
 */
public final class FailureClassifier {

    private FailureClassifier() {}

    public static FailureKind classify(ProcessResult result) {
        if (result.timedOut()) {
            return FailureKind.TIMEOUT;
        }
        return classify(result.exitCode(), result.stderr());
    }

    public static FailureKind classify(int exitCode, String stderr) {
        if (exitCode == 0) {
            throw new IllegalArgumentException("exit code 0 is not a failure");
        }
        String text = stderr == null ? "" : stderr;
        String lower = text.toLowerCase(Locale.ROOT);
        if (text.contains("401") || text.contains("Unauthorized") || lower.contains("auth")) {
            return FailureKind.AUTH_EXPIRED;
        }
        if (text.contains("429") || lower.contains("rate")) {
            return FailureKind.RATE_LIMITED;
        }
        if (text.contains("404")) {
            return FailureKind.NOT_FOUND_OR_STALE;
        }
        return FailureKind.UNCLASSIFIED;
    }

    public static String describe(FailureKind kind, ProcessResult result) {
        String stderr = result == null ? "" : result.stderr().trim();
        if (stderr.isEmpty()) {
            return kind.defaultMessage();
        }
        return kind.defaultMessage() + " " + stderr;
    }
}
