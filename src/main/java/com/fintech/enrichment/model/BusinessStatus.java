package com.fintech.enrichment.model;

import java.util.Locale;

/**
 * Operational status of a business as inferred by the extraction call.
 */
public enum BusinessStatus {
    OPERATIONAL,
    TEMPORARILY_CLOSED,
    PERMANENTLY_CLOSED,
    HISTORICAL,
    UNCERTAIN;

    /**
     * Closed or historical businesses are rejected as soon as the status is observed.
     */
    public boolean isClosed() {
        return this == PERMANENTLY_CLOSED || this == HISTORICAL;
    }

    /**
     * Lenient mapping of free-text model output ("Permanently Closed", "operational",
     * "closed_permanently") to a status. Unknown text maps to {@link #UNCERTAIN}.
     */
    public static BusinessStatus fromText(String text) {
        if (text == null || text.isBlank()) {
            return UNCERTAIN;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]+", "_");
        if (normalized.contains("PERMANENT")) {
            return PERMANENTLY_CLOSED;
        }
        if (normalized.contains("HISTORIC") || normalized.contains("DEFUNCT")) {
            return HISTORICAL;
        }
        if (normalized.contains("TEMPORAR")) {
            return TEMPORARILY_CLOSED;
        }
        if (normalized.startsWith("OPERATIONAL") || normalized.equals("OPEN") || normalized.equals("ACTIVE")) {
            return OPERATIONAL;
        }
        return UNCERTAIN;
    }
}
