package com.postscraper.scrape.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PostUrls {
    public static final String IMAGE_HOST = "twimg.com";

    private static final Pattern POST_PATTERN =
        Pattern.compile("https?://(?:www\\.)?(?:x|twitter)\\.com/([^/]+)/status/(\\d+).*");
    private static final Pattern PROFILE_PATTERN =
        Pattern.compile("https?://(?:www\\.)?(?:x|twitter)\\.com/([^/]+)/?");

    private PostUrls() {}

    public enum UrlType {
        POST,
        PROFILE,
        UNKNOWN
    }

    public record ParsedUrl(String username, String postId, UrlType type) {
        public static ParsedUrl unknown() {
            return new ParsedUrl(null, null, UrlType.UNKNOWN);
        }
    }

    public static ParsedUrl parse(String url) {
        if (url == null) {
            return ParsedUrl.unknown();
        }
        String value = url.trim();
        Matcher post = POST_PATTERN.matcher(value);
        if (post.matches()) {
            return new ParsedUrl(post.group(1), post.group(2), UrlType.POST);
        }
        Matcher profile = PROFILE_PATTERN.matcher(value);
        if (profile.matches()) {
            return new ParsedUrl(profile.group(1), null, UrlType.PROFILE);
        }
        return ParsedUrl.unknown();
    }

    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        return url.trim().replace("twitter.com", "x.com");
    }

    /**
     * Renders an image host URL at the given size variant (orig, large, medium, small, thumb).
     * Other URLs are returned unchanged.
     */
    public static String formatImageUrl(String url, String size) {
        if (url == null || url.isEmpty() || !url.contains(IMAGE_HOST)) {
            return url;
        }
        return stripQuery(url) + "?format=jpg&name=" + size;
    }

    public static String stripQuery(String url) {
        int idx = url.indexOf('?');
        return idx < 0 ? url : url.substring(0, idx);
    }
}
