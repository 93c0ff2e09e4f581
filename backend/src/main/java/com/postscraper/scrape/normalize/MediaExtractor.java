package com.postscraper.scrape.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.postscraper.scrape.model.MediaItem;
import com.postscraper.scrape.util.PostUrls;

import java.util.ArrayList;
import java.util.List;

public final class MediaExtractor {
    private static final String ORIGINAL_SIZE_QUERY = "?format=jpg&name=orig";
    private static final String ORIGINAL_SIZE_SUFFIX = ":orig";

    private MediaExtractor() {}

    public static List<MediaItem> mediaItems(JsonNode post) {
        JsonNode media = post == null ? null : post.get("media");
        if (media == null || !media.isArray()) {
            return List.of();
        }
        List<MediaItem> items = new ArrayList<>();
        for (JsonNode node : media) {
            if (!node.isObject()) {
                continue;
            }
            items.add(new MediaItem(
                text(node, "type"),
                text(node, "url"),
                integer(node, "width"),
                integer(node, "height"),
                text(node, "videoUrl")
            ));
        }
        return items;
    }

    /**
     * Full-resolution photo URLs, in media order.
     */
    public static List<String> imageUrls(List<MediaItem> media) {
        List<String> images = new ArrayList<>();
        for (MediaItem item : media) {
            if (!item.isPhoto()) {
                continue;
            }
            String url = item.url();
            if (url == null || url.isEmpty() || !url.contains(PostUrls.IMAGE_HOST)) {
                continue;
            }
            String base = PostUrls.stripQuery(url);
            images.add(base.endsWith(ORIGINAL_SIZE_SUFFIX) ? url : base + ORIGINAL_SIZE_QUERY);
        }
        return images;
    }

    /**
     * Video URLs for videos and animated gifs; items without one are skipped.
     */
    public static List<String> videoUrls(List<MediaItem> media) {
        List<String> videos = new ArrayList<>();
        for (MediaItem item : media) {
            if (item.isVideo() && item.videoUrl() != null && !item.videoUrl().isEmpty()) {
                videos.add(item.videoUrl());
            }
        }
        return videos;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            return null;
        }
        return value.asInt();
    }
}
