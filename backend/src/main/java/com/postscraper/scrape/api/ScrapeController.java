package com.postscraper.scrape.api;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.auth.CredentialResolver;
import com.postscraper.scrape.model.FetchInput;
import com.postscraper.scrape.model.ScrapeBatchResult;
import com.postscraper.scrape.model.ToolInfoResponse;
import com.postscraper.scrape.process.BirdToolClient;
import com.postscraper.scrape.service.ScrapeOrchestratorService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private final ScrapeOrchestratorService orchestratorService;
    private final BirdToolClient client;
    private final CredentialResolver credentialResolver;
    private final ScraperProperties properties;

    public ScrapeController(
        ScrapeOrchestratorService orchestratorService,
        BirdToolClient client,
        CredentialResolver credentialResolver,
        ScraperProperties properties
    ) {
        this.orchestratorService = orchestratorService;
        this.client = client;
        this.credentialResolver = credentialResolver;
        this.properties = properties;
    }

    @PostMapping("/scrape")
    public ScrapeBatchResult scrape(@RequestBody(required = false) ScrapeApiRequest request) {
        if (request == null || request.urls() == null || request.urls().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "urls must not be empty");
        }
        int concurrency = request.concurrency() == null
            ? properties.getParallelWorkers()
            : Math.max(1, request.concurrency());
        int maxAttempts = request.maxAttempts() == null
            ? properties.getMaxRetry()
            : Math.max(1, request.maxAttempts());
        Duration retryDelay = Duration.ofSeconds(request.retryDelaySeconds() == null
            ? properties.getRetryWaitSeconds()
            : Math.max(0, request.retryDelaySeconds()));
        return orchestratorService.run(
            FetchInput.ofTargets(request.urls(), request.proxyUrl()),
            concurrency,
            maxAttempts,
            retryDelay
        );
    }

    @GetMapping("/tool")
    public ToolInfoResponse tool() {
        return new ToolInfoResponse(client.version(), credentialResolver.resolve(client).source());
    }
}
