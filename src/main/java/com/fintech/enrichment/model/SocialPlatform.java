package com.fintech.enrichment.model;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Social networks recognised when ranking social-profile candidates.
 */
public enum SocialPlatform {
    FACEBOOK(List.of("facebook.com", "fb.com")),
    LINKEDIN(List.of("linkedin.com")),
    INSTAGRAM(List.of("instagram.com")),
    TWITTER(List.of("twitter.com", "x.com")),
    YOUTUBE(List.of("youtube.com")),
    TIKTOK(List.of("tiktok.com"));

    private final List<String> hosts;

    SocialPlatform(List<String> hosts) {
        this.hosts = hosts;
    }

    public List<String> getHosts() {
        return hosts;
    }

    /**
     * Identifies the platform of a profile URL by its host.
     */
    public static Optional<SocialPlatform> of(String url) {
        String host = hostOf(url);
        if (host.isEmpty()) {
            return Optional.empty();
        }
        for (SocialPlatform platform : values()) {
            for (String candidate : platform.hosts) {
                if (host.equals(candidate) || host.endsWith("." + candidate)) {
                    return Optional.of(platform);
                }
            }
        }
        return Optional.empty();
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String withScheme = url.contains("://") ? url.trim() : "http://" + url.trim();
        try {
            String host = URI.create(withScheme).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
