package com.fintech.enrichment.service;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Derives the logo filename recorded for a resolved merchant.
 */
public final class LogoFilenames {

    private static final String EXTENSION = ".png";

    private LogoFilenames() {
    }

    /**
     * Website present: first domain label, lower-cased, ignoring a leading {@code www.}.
     * Otherwise, socials present: cleaned name without whitespace. Otherwise empty.
     */
    public static String derive(String website, String cleanedName, List<String> socials) {
        if (website != null && !website.isBlank()) {
            String label = firstDomainLabel(website);
            return label.isEmpty() ? "" : label + EXTENSION;
        }
        if (socials != null && !socials.isEmpty() && cleanedName != null) {
            String compact = cleanedName.replaceAll("\\s+", "");
            return compact.isEmpty() ? "" : compact + EXTENSION;
        }
        return "";
    }

    static String firstDomainLabel(String website) {
        String trimmed = website.trim();
        String withScheme = trimmed.contains("://") ? trimmed : "http://" + trimmed;
        String host;
        try {
            host = URI.create(withScheme).getHost();
        } catch (IllegalArgumentException e) {
            host = null;
        }
        if (host == null) {
            return "";
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int dot = host.indexOf('.');
        return dot < 0 ? host : host.substring(0, dot);
    }
}
