package com.postscraper.scrape.process;

import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.model.ProcessResult;
import com.postscraper.scrape.model.ScrapeException;
import com.postscraper.scrape.model.ToolCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps the bird CLI. The executable is resolved once, here; a missing binary fails
 * construction instead of every call.
 */
public class BirdToolClient {
    private static final Logger log = LoggerFactory.getLogger(BirdToolClient.class);

    public static final String AUTH_TOKEN_VAR = "AUTH_TOKEN";
    public static final String CT0_VAR = "CT0";
    public static final String HTTPS_PROXY_VAR = "HTTPS_PROXY";
    public static final String HTTP_PROXY_VAR = "HTTP_PROXY";
    public static final String UNKNOWN_VERSION = "unknown";

    private final ScraperProperties.Tool tool;
    private final ToolCredentials credentials;
    private final String proxyUrl;
    private final ProcessInvoker invoker;
    private final String executable;

    public BirdToolClient(
        ScraperProperties.Tool tool,
        ToolCredentials credentials,
        String proxyUrl,
        ProcessInvoker invoker,
        ExecutableLocator locator
    ) {
        this.tool = tool;
        this.credentials = credentials == null ? ToolCredentials.none() : credentials;
        this.proxyUrl = proxyUrl == null || proxyUrl.isBlank() ? null : proxyUrl.trim();
        this.invoker = invoker;
        Path resolved = locator.locate(tool.getExecutable())
            .orElseThrow(() -> new ToolMissingException(tool.getExecutable()));
        this.executable = resolved.toString();
        log.debug("Using bird executable {}", executable);
    }

    public ProcessResult readPost(String url, String proxyOverride) {
        log.info("Reading post {}", url);
        return invoker.invoke(
            List.of(executable, "read", url, "--json"),
            buildEnvironment(proxyOverride),
            Duration.ofSeconds(tool.getFetchTimeoutSeconds())
        );
    }

    /**
     * Forces bird to re-discover the rotating GraphQL query ids.
     */
    public ProcessResult refreshQueryIds() {
        log.info("Refreshing query ids");
        return invoker.invoke(
            List.of(executable, tool.getRefreshCommand(), "--fresh"),
            buildEnvironment(null),
            Duration.ofSeconds(tool.getRefreshTimeoutSeconds())
        );
    }

    public String version() {
        try {
            ProcessResult result = invoker.invoke(
                List.of(executable, "--version"),
                Map.of(),
                Duration.ofSeconds(tool.getVersionTimeoutSeconds())
            );
            if (!result.isSuccessful() || result.stdout().isBlank()) {
                return UNKNOWN_VERSION;
            }
            return result.stdout().trim();
        } catch (ScrapeException e) {
            log.debug("Version probe failed", e);
            return UNKNOWN_VERSION;
        }
    }

    /**
     * Asks bird which account it is authenticated as, using whatever cookies it can find on its own.
     *
     * @return the account name, or an empty string when bird could not authenticate
     */
    public String whoami() {
        try {
            ProcessResult result = invoker.invoke(
                List.of(executable, "whoami"),
                Map.of(),
                Duration.ofSeconds(tool.getWhoamiTimeoutSeconds())
            );
            String out = result.stdout().trim();
            if (!result.isSuccessful() || out.isEmpty()) {
                log.warn("bird whoami failed: {}", abbreviate(result.stderr(), 200));
                return "";
            }
            String[] tokens = out.split("\\s+");
            return tokens[tokens.length - 1];
        } catch (ScrapeException e) {
            log.warn("bird whoami failed", e);
            return "";
        }
    }

    public Map<String, String> buildEnvironment(String proxyOverride) {
        Map<String, String> env = new LinkedHashMap<>();
        if (credentials.isExportable()) {
            // an empty value would mask one already set in the ambient environment
            if (credentials.authToken() != null && !credentials.authToken().isEmpty()) {
                env.put(AUTH_TOKEN_VAR, credentials.authToken());
            }
            if (credentials.ct0() != null && !credentials.ct0().isEmpty()) {
                env.put(CT0_VAR, credentials.ct0());
            }
        }
        String proxy = proxyOverride == null || proxyOverride.isBlank() ? proxyUrl : proxyOverride.trim();
        if (proxy != null) {
            // bird reads the same variable for socks and http proxies
            env.put(HTTPS_PROXY_VAR, proxy);
            env.put(HTTP_PROXY_VAR, proxy);
        }
        return env;
    }

    static String abbreviate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
