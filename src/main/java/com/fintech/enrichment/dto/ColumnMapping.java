package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps source table headers to the fields the resolver understands.
 * Only the merchant name column is mandatory.
 */
@Value
@Builder
@Jacksonized
public class ColumnMapping {

    String merchantName;
    String address;
    String city;
    String country;
    String state;

    /**
     * Headers referenced by this mapping, in field order, skipping unset ones.
     */
    public List<String> mappedHeaders() {
        List<String> headers = new ArrayList<>();
        for (String header : new String[]{merchantName, address, city, country, state}) {
            if (header != null && !header.isBlank()) {
                headers.add(header);
            }
        }
        return headers;
    }
}
