package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input row as seen by the resolver.
 * <p>
 * Only {@code merchantNameRaw} is required. Columns that are not part of the
 * column mapping travel along verbatim, in their original header order.
 */
@Value
public class RawRecord {

    String merchantNameRaw;
    String address;
    String city;
    String country;
    String state;
    Map<String, String> passthroughColumns;

    @Builder(toBuilder = true)
    private RawRecord(String merchantNameRaw, String address, String city, String country,
                      String state, Map<String, String> passthroughColumns) {
        this.merchantNameRaw = merchantNameRaw == null ? "" : merchantNameRaw;
        this.address = blankToNull(address);
        this.city = blankToNull(city);
        this.country = blankToNull(country);
        this.state = blankToNull(state);
        this.passthroughColumns = passthroughColumns == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(passthroughColumns));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
