package com.postscraper.scrape.model;

public record MediaItem(
    String type,
    String url,
    Integer width,
    Integer height,
    String videoUrl
) {
    public static final String PHOTO = "photo";
    public static final String VIDEO = "video";
    public static final String ANIMATED_GIF = "animated_gif";

    public boolean isPhoto() {
        return PHOTO.equals(type);
    }

    public boolean isVideo() {
        return VIDEO.equals(type) || ANIMATED_GIF.equals(type);
    }
}
