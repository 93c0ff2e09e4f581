package com.postscraper.scrape.process;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.model.FailureKind;
import com.postscraper.scrape.model.ProcessResult;
import com.postscraper.scrape.model.ScrapeException;
import com.postscraper.scrape.model.ToolCredentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BirdToolClientTest {
    private static final String BIRD = "/usr/local/bin/bird";
    private static final String URL = "https://x.com/user/status/123";

    @Mock
    private ProcessInvoker invoker;

    @Mock
    private ExecutableLocator locator;

    private ScraperProperties.Tool tool;

    @BeforeEach
    void setUp() {
        tool = new ScraperProperties.Tool();
    }

    @Test
    void readPostRunsReadWithJsonFlag() {
        BirdToolClient client = client(ToolCredentials.none(), null);
        ProcessResult ok = new ProcessResult(0, "{}", "", false, Duration.ZERO);
        when(invoker.invoke(anyList(), anyMap(), any())).thenReturn(ok);

        assertThat(client.readPost(URL, null)).isSameAs(ok);

        verify(invoker).invoke(List.of(BIRD, "read", URL, "--json"), Map.of(), Duration.ofSeconds(60));
    }

    @Test
    void refreshUsesConfiguredCommandAndTimeout() {
        tool.setRefreshCommand("query-ids");
        tool.setRefreshTimeoutSeconds(90);
        BirdToolClient client = client(ToolCredentials.none(), null);
        when(invoker.invoke(anyList(), anyMap(), any()))
            .thenReturn(new ProcessResult(0, "", "", false, Duration.ZERO));

        client.refreshQueryIds();

        verify(invoker).invoke(List.of(BIRD, "query-ids", "--fresh"), Map.of(), Duration.ofSeconds(90));
    }

    @Test
    void exportsCredentialsAndProxy() {
        BirdToolClient client = client(
            new ToolCredentials("token", "csrf", ToolCredentials.Source.PROPERTIES),
            "http://proxy:8080"
        );

        Map<String, String> env = client.buildEnvironment(null);

        assertThat(env)
            .containsEntry(BirdToolClient.AUTH_TOKEN_VAR, "token")
            .containsEntry(BirdToolClient.CT0_VAR, "csrf")
            .containsEntry(BirdToolClient.HTTPS_PROXY_VAR, "http://proxy:8080")
            .containsEntry(BirdToolClient.HTTP_PROXY_VAR, "http://proxy:8080");
    }

    @Test
    void perCallProxyWinsOverConfiguredProxy() {
        BirdToolClient client = client(ToolCredentials.none(), "http://configured:1");

        assertThat(client.buildEnvironment(" socks5://override:2 "))
            .containsEntry(BirdToolClient.HTTPS_PROXY_VAR, "socks5://override:2")
            .doesNotContainKey(BirdToolClient.AUTH_TOKEN_VAR);
        assertThat(client.buildEnvironment("  "))
            .containsEntry(BirdToolClient.HTTPS_PROXY_VAR, "http://configured:1");
    }

    @Test
    void emptyCookieValuesAreNotExported() {
        BirdToolClient client = client(
            new ToolCredentials("token", "", ToolCredentials.Source.COOKIE_FILE),
            null
        );

        assertThat(client.buildEnvironment(null))
            .containsEntry(BirdToolClient.AUTH_TOKEN_VAR, "token")
            .doesNotContainKey(BirdToolClient.CT0_VAR);
    }

    @Test
    void toolManagedCredentialsAreNotExported() {
        BirdToolClient client = client(ToolCredentials.toolManaged(), null);

        assertThat(client.buildEnvironment(null)).isEmpty();
    }

    @Test
    void readPostPassesEnvironmentThrough() {
        BirdToolClient client = client(
            new ToolCredentials("token", "csrf", ToolCredentials.Source.COOKIE_FILE),
            null
        );
        when(invoker.invoke(anyList(), anyMap(), any()))
            .thenReturn(new ProcessResult(0, "{}", "", false, Duration.ZERO));

        client.readPost(URL, "http://p:3");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> env = ArgumentCaptor.forClass(Map.class);
        verify(invoker).invoke(anyList(), env.capture(), eq(Duration.ofSeconds(60)));
        assertThat(env.getValue())
            .containsEntry("AUTH_TOKEN", "token")
            .containsEntry("CT0", "csrf")
            .containsEntry("HTTPS_PROXY", "http://p:3");
    }

    @Test
    void missingExecutableFailsConstruction() {
        when(locator.locate("bird")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> new BirdToolClient(tool, ToolCredentials.none(), null, invoker, locator))
            .isInstanceOf(ToolMissingException.class)
            .hasMessageContaining("bird")
            .extracting(e -> ((ScrapeException) e).getKind())
            .isEqualTo(FailureKind.TOOL_MISSING);
        verifyNoInteractions(invoker);
    }

    @Test
    void versionTrimsOutput() {
        BirdToolClient client = client(ToolCredentials.none(), null);
        when(invoker.invoke(eq(List.of(BIRD, "--version")), anyMap(), eq(Duration.ofSeconds(10))))
            .thenReturn(new ProcessResult(0, "0.8.0\n", "", false, Duration.ZERO));

        assertThat(client.version()).isEqualTo("0.8.0");
    }

    @Test
    void versionIsUnknownOnFailure() {
        BirdToolClient client = client(ToolCredentials.none(), null);
        when(invoker.invoke(anyList(), anyMap(), any()))
            .thenReturn(ProcessResult.timedOut("", "", Duration.ofSeconds(10)))
            .thenReturn(new ProcessResult(0, "  ", "", false, Duration.ZERO))
            .thenThrow(new ToolMissingException("bird"));

        assertThat(client.version()).isEqualTo(BirdToolClient.UNKNOWN_VERSION);
        assertThat(client.version()).isEqualTo(BirdToolClient.UNKNOWN_VERSION);
        assertThat(client.version()).isEqualTo(BirdToolClient.UNKNOWN_VERSION);
    }

    @Test
    void whoamiReturnsLastToken() {
        BirdToolClient client = client(ToolCredentials.none(), null);
        when(invoker.invoke(eq(List.of(BIRD, "whoami")), anyMap(), any()))
            .thenReturn(new ProcessResult(0, "Logged in as @someone\n", "", false, Duration.ZERO))
            .thenReturn(new ProcessResult(1, "", "no cookies", false, Duration.ZERO));

        assertThat(client.whoami()).isEqualTo("@someone");
        assertThat(client.whoami()).isEmpty();
    }

    @Test
    void abbreviateCapsLength() {
        assertThat(BirdToolClient.abbreviate("abcdef", 3)).isEqualTo("abc");
        assertThat(BirdToolClient.abbreviate("ab", 3)).isEqualTo("ab");
        assertThat(BirdToolClient.abbreviate(null, 3)).isEmpty();
    }

    private BirdToolClient client(ToolCredentials credentials, String proxy) {
        when(locator.locate("bird")).thenReturn(Optional.of(Path.of(BIRD)));
        return new BirdToolClient(tool, credentials, proxy, invoker, locator);
    }
}
