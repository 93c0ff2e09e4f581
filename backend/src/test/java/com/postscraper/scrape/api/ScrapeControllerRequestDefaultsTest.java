package com.postscraper.scrape.api;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.auth.CredentialResolver;
import com.postscraper.scrape.model.FetchInput;
import com.postscraper.scrape.model.ScrapeBatchResult;
import com.postscraper.scrape.model.ToolCredentials;
import com.postscraper.scrape.model.ToolInfoResponse;
import com.postscraper.scrape.process.BirdToolClient;
import com.postscraper.scrape.service.ScrapeOrchestratorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeControllerRequestDefaultsTest {

    @Mock
    private ScrapeOrchestratorService orchestratorService;
    @Mock
    private BirdToolClient client;
    @Mock
    private CredentialResolver credentialResolver;

    @Test
    void appliesConfiguredDefaultsWhenRequestOmitsThem() {
        ScraperProperties properties = new ScraperProperties();
        properties.setParallelWorkers(3);
        properties.setMaxRetry(4);
        properties.setRetryWaitSeconds(7);
        when(orchestratorService.run(anyList(), anyInt(), anyInt(), any())).thenReturn(emptyBatch());
        ScrapeController controller = new ScrapeController(orchestratorService, client, credentialResolver, properties);

        controller.scrape(new ScrapeApiRequest(List.of("https://x.com/a/status/1"), null, null, null, null));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<FetchInput>> inputs = ArgumentCaptor.forClass(List.class);
        verify(orchestratorService).run(inputs.capture(), eq(3), eq(4), eq(Duration.ofSeconds(7)));
        assertThat(inputs.getValue()).containsExactly(FetchInput.of("https://x.com/a/status/1"));
    }

    @Test
    void requestValuesOverrideDefaultsAndAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        when(orchestratorService.run(anyList(), anyInt(), anyInt(), any())).thenReturn(emptyBatch());
        ScrapeController controller = new ScrapeController(orchestratorService, client, credentialResolver, properties);

        controller.scrape(new ScrapeApiRequest(List.of("u1", "u2"), 0, 9, -5, "http://proxy:1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<FetchInput>> inputs = ArgumentCaptor.forClass(List.class);
        verify(orchestratorService).run(inputs.capture(), eq(1), eq(9), eq(Duration.ZERO));
        assertThat(inputs.getValue()).extracting(FetchInput::proxyUrl).containsOnly("http://proxy:1");
    }

    @Test
    void rejectsMissingUrls() {
        ScrapeController controller = new ScrapeController(
            orchestratorService, client, credentialResolver, new ScraperProperties()
        );

        assertThatThrownBy(() -> controller.scrape(null)).isInstanceOf(ResponseStatusException.class);
        assertThatThrownBy(() -> controller.scrape(new ScrapeApiRequest(List.of(), null, null, null, null)))
            .isInstanceOf(ResponseStatusException.class);
        verifyNoInteractions(orchestratorService);
    }

    @Test
    void toolInfoReportsVersionAndCredentialSource() {
        when(client.version()).thenReturn("0.8.0");
        when(credentialResolver.resolve(client)).thenReturn(ToolCredentials.toolManaged());
        ScrapeController controller = new ScrapeController(
            orchestratorService, client, credentialResolver, new ScraperProperties()
        );

        ToolInfoResponse info = controller.tool();

        assertThat(info.version()).isEqualTo("0.8.0");
        assertThat(info.credentialsSource()).isEqualTo(ToolCredentials.Source.TOOL_MANAGED);
    }

    private static ScrapeBatchResult emptyBatch() {
        return new ScrapeBatchResult(Instant.now(), Instant.now(), List.of());
    }
}
