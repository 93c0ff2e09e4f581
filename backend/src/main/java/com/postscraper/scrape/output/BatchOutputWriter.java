package com.postscraper.scrape.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.model.ScrapeBatchResult;
import com.postscraper.scrape.util.PostUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes a batch as JSON or Markdown. Paths default to
 * {@code <output-dir>/yyyy/MM/dd/<author>/<postId>.<ext>} for a single post and
 * {@code <output-dir>/yyyy/MM/dd/batch_HHmmss.<ext>} otherwise.
 */
@Component
public class BatchOutputWriter {
    private static final Logger log = LoggerFactory.getLogger(BatchOutputWriter.class);
    private static final DateTimeFormatter DATE_DIRS = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final DateTimeFormatter BATCH_TIME = DateTimeFormatter.ofPattern("HHmmss");

    private final ObjectMapper objectMapper;
    private final BatchMarkdownFormatter markdownFormatter;
    private final ScraperProperties properties;
    private final Clock clock;

    public BatchOutputWriter(
        ObjectMapper objectMapper,
        BatchMarkdownFormatter markdownFormatter,
        ScraperProperties properties,
        Clock clock
    ) {
        this.objectMapper = objectMapper;
        this.markdownFormatter = markdownFormatter;
        this.properties = properties;
        this.clock = clock;
    }

    public Path write(ScrapeBatchResult batch, OutputFormat format, Path target) {
        String content = render(batch, format);
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        log.info("Output saved to {} ({})", target, format);
        return target;
    }

    public String render(ScrapeBatchResult batch, OutputFormat format) {
        if (format == OutputFormat.MARKDOWN) {
            return markdownFormatter.format(batch);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(batch.entries());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize batch", e);
        }
    }

    public Path resolvePath(List<String> urls, OutputFormat format) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path base = Paths.get(properties.getOutputDir()).resolve(DATE_DIRS.format(now));
        if (urls != null && urls.size() == 1) {
            PostUrls.ParsedUrl parsed = PostUrls.parse(urls.get(0));
            String author = parsed.username() == null ? "unknown" : parsed.username();
            String postId = parsed.postId() == null ? "post" : parsed.postId();
            return base.resolve(author).resolve(postId + "." + format.extension());
        }
        return base.resolve("batch_" + BATCH_TIME.format(now) + "." + format.extension());
    }
}
