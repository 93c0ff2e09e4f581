package com.postscraper.scrape.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Normalized post. {@code createdAt} is null only when the tool reported no date at all;
 * {@code createdAtRaw} keeps what the tool sent. {@code thread} is always recomputed from
 * {@code conversationId}: a post is part of a thread when its conversation root is another post.
 */
public record PostRecord(
    String id,
    String url,
    String text,
    OffsetDateTime createdAt,
    String createdAtRaw,
    String authorHandle,
    String authorName,
    List<String> images,
    List<String> videos,
    boolean thread,
    String conversationId
) {
    public PostRecord {
        id = id == null ? "" : id;
        text = text == null ? "" : text;
        createdAtRaw = createdAtRaw == null ? "" : createdAtRaw;
        authorHandle = authorHandle == null ? "" : authorHandle;
        images = images == null ? List.of() : List.copyOf(images);
        videos = videos == null ? List.of() : List.copyOf(videos);
        thread = conversationId != null && !conversationId.equals(id);
    }
}
