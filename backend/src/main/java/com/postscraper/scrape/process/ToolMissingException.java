package com.postscraper.scrape.process;

import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.ScrapeException;

public class ToolMissingException extends ScrapeException {
    public ToolMissingException(String executable) {
        super(FailureKind.TOOL_MISSING, message(executable));
    }

    public ToolMissingException(String executable, Throwable cause) {
        super(FailureKind.TOOL_MISSING, message(executable), cause);
    }

    private static String message(String executable) {
        return "Executable '" + executable + "' not found. "
            + FailureKind.TOOL_MISSING.defaultMessage()
            + " Or see: https://github.com/steipete/bird";
    }
}
