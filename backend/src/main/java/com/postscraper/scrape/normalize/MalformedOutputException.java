package com.postscraper.scrape.normalize;

import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.ScrapeException;

public class MalformedOutputException extends ScrapeException {
    public MalformedOutputException(String message) {
        super(FailureKind.MALFORMED_OUTPUT, message);
    }

    public MalformedOutputException(String message, Throwable cause) {
        super(FailureKind.MALFORMED_OUTPUT, message, cause);
    }
}
