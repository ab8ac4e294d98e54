package com.fintech.enrichment.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Payment-processor prefixes that acquirers inject in front of the real merchant
 * name, e.g. {@code "SQ *Coffee Shop"} or {@code "PAYPAL *ACME"}.
 */
public final class AggregatorPrefixes {

    /**
     * Known aggregator names, upper case.
     */
    public static final List<String> KNOWN = List.of(
            "SQ", "SQUARE", "PAYPAL", "PP", "TST", "STRIPE", "OPENPAY", "PAYTM", "RAZORPAY",
            "PHONEPE", "GOOGLE PAY", "G PAY", "UBER EATS", "SWIGGY", "ZOMATO"
    );

    // Longest names first so "SQUARE" wins over "SQ"
    private static final Pattern PREFIX = Pattern.compile(
            "^\\s*(" + String.join("|", KNOWN.stream()
                    .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                    .map(Pattern::quote)
                    .toList()) + ")\\s*\\*\\s*",
            Pattern.CASE_INSENSITIVE);

    private AggregatorPrefixes() {
    }

    /**
     * Removes one leading aggregator prefix, if present.
     */
    public static String strip(String rawName) {
        if (rawName == null) {
            return "";
        }
        Matcher matcher = PREFIX.matcher(rawName);
        return matcher.find() ? rawName.substring(matcher.end()).trim() : rawName.trim();
    }

    /**
     * The aggregator found at the start of the name, upper case, or {@code null}.
     */
    public static String detect(String rawName) {
        if (rawName == null) {
            return null;
        }
        Matcher matcher = PREFIX.matcher(rawName);
        return matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : null;
    }
}
