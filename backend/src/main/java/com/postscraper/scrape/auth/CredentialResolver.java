package com.postscraper.scrape.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.postscraper.config.ScraperProperties;
import com.postscraper.scrape.model.ToolCredentials;
import com.postscraper.scrape.process.BirdToolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Picks the cookies handed to bird: configured values first, then the saved cookie file,
 * then whatever bird finds in the local browsers on its own.
 */
public class CredentialResolver {
    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final ScraperProperties.Auth auth;
    private final ObjectMapper objectMapper;

    public CredentialResolver(ScraperProperties.Auth auth, ObjectMapper objectMapper) {
        this.auth = auth;
        this.objectMapper = objectMapper;
    }

    /**
     * Configured or saved credentials, or {@link ToolCredentials#none()}.
     */
    public ToolCredentials resolve() {
        if (auth.getAuthToken() != null && auth.getCt0() != null) {
            log.debug("Using configured cookies");
            return new ToolCredentials(auth.getAuthToken(), auth.getCt0(), ToolCredentials.Source.PROPERTIES);
        }
        ToolCredentials saved = load();
        if (saved != null
            && saved.authToken() != null
            && !saved.authToken().isEmpty()
            && !ToolCredentials.TOOL_MANAGED_MARKER.equals(saved.authToken())) {
            log.debug("Using saved cookies from {}", cookieFile());
            return saved;
        }
        return ToolCredentials.none();
    }

    public ToolCredentials resolve(BirdToolClient client) {
        ToolCredentials resolved = resolve();
        if (resolved.source() != ToolCredentials.Source.NONE || client == null) {
            return resolved;
        }
        String account = client.whoami();
        if (!account.isEmpty()) {
            log.info("bird authenticated from browser cookies as {}", account);
            return ToolCredentials.toolManaged();
        }
        return resolved;
    }

    public ToolCredentials load() {
        Path file = cookieFile();
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                log.warn("Ignoring cookie file {}: not a JSON object", file);
                return null;
            }
            return new ToolCredentials(
                root.path("auth_token").asText(""),
                root.path("ct0").asText(""),
                ToolCredentials.Source.COOKIE_FILE
            );
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cookie file {}", file, e);
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cookie file " + file, e);
        }
    }

    public Path save(ToolCredentials credentials) {
        Path file = cookieFile();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("auth_token", credentials.authToken());
        node.put("ct0", credentials.ct0());
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cookie file " + file, e);
        }
        log.info("Saved cookies to {}", file);
        return file;
    }

    private Path cookieFile() {
        return Paths.get(auth.getCookieFile());
    }
}
