package com.postscraper.scrape.output;

import com.postscraper.scrape.model.FetchOutcome;
import com.postscraper.scrape.model.PostRecord;
import com.postscraper.scrape.model.ResultEntry;
import com.postscraper.scrape.model.ScrapeBatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class BatchMarkdownFormatter {

    public String format(ScrapeBatchResult batch) {
        if (batch == null || batch.entries().isEmpty()) {
            return "# No posts scraped\n";
        }
        List<String> lines = new ArrayList<>();
        lines.add("# Scraped Posts");
        lines.add("");
        lines.add("**Total:** " + batch.entries().size() + " posts | **Success:** " + batch.successCount()
            + " | **Failed:** " + batch.failureCount());
        lines.add("");
        lines.add("---");
        lines.add("");
        for (ResultEntry entry : batch.entries()) {
            lines.add(formatEntry(entry));
        }
        return String.join("\n", lines);
    }

    public String formatEntry(ResultEntry entry) {
        FetchOutcome outcome = entry.outcome();
        if (outcome == null || !outcome.success()) {
            String error = outcome == null || outcome.message() == null ? "Unknown error" : outcome.message();
            return "## Failed to scrape\n\n**URL:** " + entry.input().target() + "\n\n**Error:** " + error + "\n";
        }
        PostRecord post = outcome.record();
        if (post == null) {
            return "## No post data\n";
        }

        List<String> lines = new ArrayList<>();
        String handle = post.authorHandle().isEmpty() ? "unknown" : post.authorHandle();
        if (post.authorName() != null && !post.authorName().isEmpty()) {
            lines.add("## " + post.authorName() + " (@" + handle + ")");
        } else {
            lines.add("## @" + handle);
        }
        lines.add("");

        if (!post.text().isEmpty()) {
            lines.add(post.text());
            lines.add("");
        }

        if (post.createdAt() != null) {
            lines.add("**Posted:** " + post.createdAt());
        }
        String url = post.url() == null ? entry.input().target() : post.url();
        lines.add("**URL:** [" + url + "](" + url + ")");
        lines.add("");

        if (!post.images().isEmpty()) {
            lines.add("### Images (" + post.images().size() + ")");
            lines.add("");
            for (int i = 0; i < post.images().size(); i++) {
                lines.add("![Image " + (i + 1) + "](" + post.images().get(i) + ")");
                lines.add("");
            }
        }

        if (!post.videos().isEmpty()) {
            lines.add("### Videos (" + post.videos().size() + ")");
            lines.add("");
            for (int i = 0; i < post.videos().size(); i++) {
                lines.add("- [Video " + (i + 1) + "](" + post.videos().get(i) + ")");
            }
            lines.add("");
        }

        lines.add("---");
        lines.add("");
        return String.join("\n", lines);
    }
}
