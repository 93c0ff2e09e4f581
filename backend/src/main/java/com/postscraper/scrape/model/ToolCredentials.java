package com.postscraper.scrape.model;

public record ToolCredentials(
    String authToken,
    String ct0,
    Source source
) {
    public static final String TOOL_MANAGED_MARKER = "[bird-managed]";

    public enum Source {
        PROPERTIES,
        COOKIE_FILE,
        TOOL_MANAGED,
        NONE
    }

    public static ToolCredentials none() {
        return new ToolCredentials(null, null, Source.NONE);
    }

    public static ToolCredentials toolManaged() {
        return new ToolCredentials(TOOL_MANAGED_MARKER, TOOL_MANAGED_MARKER, Source.TOOL_MANAGED);
    }

    /**
     * True when the values should be exported to the tool; tool-managed credentials are
     * picked up by the tool from the browser.
     */
    public boolean isExportable() {
        return source == Source.PROPERTIES || source == Source.COOKIE_FILE;
    }
}
