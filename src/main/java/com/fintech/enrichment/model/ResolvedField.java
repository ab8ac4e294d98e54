package com.fintech.enrichment.model;

import com.fintech.enrichment.dto.ResolvedRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Fields of a {@link ResolvedRecord} that can be projected into output columns.
 * List-valued fields are joined with {@code ", "}.
 */
public enum ResolvedField {
    CLEANED_NAME(ResolvedRecord::getCleanedName),
    WEBSITE(ResolvedRecord::getWebsite),
    SOCIALS(record -> join(record.getSocials())),
    EVIDENCE(ResolvedRecord::getEvidence),
    EVIDENCE_LINKS(record -> join(record.getEvidenceLinks())),
    ACCUMULATED_COST(record -> BigDecimal.valueOf(record.getAccumulatedCost()).stripTrailingZeros().toPlainString()),
    LOGO_FILENAME(ResolvedRecord::getLogoFilename),
    REMARKS(ResolvedRecord::getRemarks);

    private final Function<ResolvedRecord, String> accessor;

    ResolvedField(Function<ResolvedRecord, String> accessor) {
        this.accessor = accessor;
    }

    public String valueOf(ResolvedRecord record) {
        String value = accessor.apply(record);
        return value == null ? "" : value;
    }

    private static String join(List<String> values) {
        return values == null ? "" : String.join(", ", values);
    }
}
