package com.postscraper.scrape.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.auth.CredentialResolver;
import com.postscraper.scrape.process.BirdToolClient;
import com.postscraper.scrape.process.ToolMissingException;
import com.postscraper.scrape.service.ScrapeOrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ScrapeExceptionHandlerTest {

  @Mock private ScrapeOrchestratorService orchestratorService;
  @Mock private BirdToolClient client;
  @Mock private CredentialResolver credentialResolver;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    ScrapeController controller =
        new ScrapeController(orchestratorService, client, credentialResolver, new ScraperProperties());
    this.mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ScrapeExceptionHandler())
            .build();
  }

  @Test
  void missingToolMapsToServiceUnavailable() throws Exception {
    when(orchestratorService.run(anyList(), anyInt(), anyInt(), any()))
        .thenThrow(new ToolMissingException("bird"));

    mockMvc
        .perform(
            post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\": [\"https://x.com/a/status/1\"]}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("tool_missing"));
  }

  @Test
  void illegalArgumentMapsToBadRequest() throws Exception {
    when(orchestratorService.run(anyList(), anyInt(), anyInt(), any()))
        .thenThrow(new IllegalArgumentException("concurrency must be positive"));

    mockMvc
        .perform(
            post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\": [\"https://x.com/a/status/1\"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"))
        .andExpect(jsonPath("$.message").value("concurrency must be positive"));
  }
}
