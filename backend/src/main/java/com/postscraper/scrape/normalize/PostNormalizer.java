package com.postscraper.scrape.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postscraper.scrape.model.MediaItem;
import com.postscraper.scrape.model.PostRecord;
import com.postscraper.scrape.util.PostDates;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Turns bird's JSON output into a {@link PostRecord}. bird's schema has drifted between
 * releases, so most fields are looked up under several names.
 */
public class PostNormalizer {
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PostNormalizer(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public PostRecord normalize(String rawJson, String sourceUrl) {
        if (rawJson == null || rawJson.isBlank()) {
            throw new MalformedOutputException("Failed to parse Bird output as JSON: empty output");
        }
        JsonNode root;
        try {
            root = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readTree(rawJson);
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException("Failed to parse Bird output as JSON: " + e.getOriginalMessage(), e);
        }
        return normalize(root, sourceUrl);
    }

    public PostRecord normalize(JsonNode root, String sourceUrl) {
        if (root == null || !root.isObject()) {
            throw new MalformedOutputException("Expected a JSON object from Bird");
        }
        JsonNode author = root.path("author");
        String id = firstNonEmpty(text(root, "id"));
        String authorHandle = firstNonEmpty(text(author, "username"), text(author, "handle"), text(author, "screen_name"));
        String authorName = firstNonEmpty(text(author, "name"), text(author, "displayName"));
        String body = firstNonEmpty(text(root, "text"), text(root, "full_text"));

        String createdAtRaw = firstNonEmpty(text(root, "createdAt"), text(root, "created_at"));
        OffsetDateTime createdAt = createdAtRaw.isEmpty() ? null : PostDates.parse(createdAtRaw, clock);

        String conversationId = firstNonEmpty(text(root, "conversationId"), text(root.path("legacy"), "conversation_id_str"));

        List<MediaItem> media = MediaExtractor.mediaItems(root);
        return new PostRecord(
            id,
            sourceUrl,
            body,
            createdAt,
            createdAtRaw,
            authorHandle,
            authorName,
            MediaExtractor.imageUrls(media),
            MediaExtractor.videoUrls(media),
            false,
            conversationId.isEmpty() ? null : conversationId
        );
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
