package com.postscraper.scrape.service;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.auth.CredentialResolver;
import com.postscraper.scrape.model.FetchInput;
import com.postscraper.scrape.model.ScrapeBatchResult;
import com.postscraper.scrape.model.ToolCredentials;
import com.postscraper.scrape.output.BatchOutputWriter;
import com.postscraper.scrape.output.OutputFormat;
import com.postscraper.scrape.process.BirdToolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final BirdToolClient client;
    private final CredentialResolver credentialResolver;
    private final BatchOutputWriter outputWriter;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        BirdToolClient client,
        CredentialResolver credentialResolver,
        BatchOutputWriter outputWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.client = client;
        this.credentialResolver = credentialResolver;
        this.outputWriter = outputWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = execute();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    /**
     * @return 0 when at least one post was scraped, 1 otherwise
     */
    int execute() {
        List<String> urls = parseUrls(properties.getCli().getUrls());
        if (urls.isEmpty()) {
            log.error("No URLs given; set scraper.cli.urls");
            return 1;
        }
        OutputFormat format = OutputFormat.fromValue(properties.getCli().getFormat());
        Path target = properties.getCli().getOutput() == null
            ? outputWriter.resolvePath(urls, format)
            : Paths.get(properties.getCli().getOutput());

        log.info("Scraping {} post(s) using bird {}", urls.size(), client.version());
        ToolCredentials credentials = credentialResolver.resolve(client);
        if (credentials.source() == ToolCredentials.Source.NONE) {
            log.warn("No cookies found. Bird will attempt auto-detection.");
        } else {
            log.info("Authentication configured ({})", credentials.source());
        }

        ScrapeBatchResult result = orchestratorService.run(FetchInput.ofTargets(urls, null));
        outputWriter.write(result, format, target);
        if (result.failureCount() == 0) {
            log.info("Successfully scraped all {} post(s)", result.successCount());
        } else {
            log.warn("Scraped {}/{} posts ({} failed)", result.successCount(), urls.size(), result.failureCount());
        }
        return result.successCount() > 0 ? 0 : 1;
    }

    static List<String> parseUrls(String urls) {
        if (urls == null) {
            return List.of();
        }
        return Arrays.stream(urls.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
