package com.fintech.enrichment.service;

import com.fintech.enrichment.dto.RawRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the cascading search queries for one merchant, most specific first.
 * <p>
 * Order: name+address+city+country, name+city+country, name+city, name+country,
 * name, name+address. Missing parts are omitted and a query identical to an
 * earlier one is skipped.
 */
public final class SearchQueryBuilder {

    public static final int MAX_QUERIES = 6;

    private SearchQueryBuilder() {
    }

    public static List<String> build(String name, RawRecord record) {
        return build(name, record.getAddress(), record.getCity(), record.getCountry());
    }

    public static List<String> build(String name, String address, String city, String country) {
        Set<String> queries = new LinkedHashSet<>();
        queries.add(join(name, address, city, country));
        queries.add(join(name, city, country));
        queries.add(join(name, city));
        queries.add(join(name, country));
        queries.add(join(name));
        queries.add(join(name, address));
        queries.remove("");

        List<String> ordered = new ArrayList<>(queries);
        return ordered.size() > MAX_QUERIES ? ordered.subList(0, MAX_QUERIES) : ordered;
    }

    private static String join(String... parts) {
        return Arrays.stream(parts)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
