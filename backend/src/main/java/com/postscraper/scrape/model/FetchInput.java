package com.postscraper.scrape.model;

import java.util.ArrayList;
import java.util.List;

public record FetchInput(
    String target,
    String proxyUrl
) {
    public FetchInput {
        target = target == null ? "" : target.trim();
        proxyUrl = proxyUrl == null || proxyUrl.isBlank() ? null : proxyUrl.trim();
    }

    public static FetchInput of(String target) {
        return new FetchInput(target, null);
    }

    public static List<FetchInput> ofTargets(List<String> targets, String proxyUrl) {
        if (targets == null) {
            return List.of();
        }
        List<FetchInput> out = new ArrayList<>();
        for (String target : targets) {
            out.add(new FetchInput(target, proxyUrl));
        }
        return out;
    }
}
