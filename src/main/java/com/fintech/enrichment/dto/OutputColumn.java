package com.fintech.enrichment.dto;

import com.fintech.enrichment.model.ResolvedField;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One column of the output projection: which resolved field goes under which header.
 */
@Value
@Builder
@Jacksonized
public class OutputColumn {

    ResolvedField sourceField;
    String header;
    @Builder.Default
    boolean enabled = true;

    public static OutputColumn of(ResolvedField field, String header) {
        return OutputColumn.builder().sourceField(field).header(header).build();
    }

    public static List<OutputColumn> defaults() {
        return List.of(
                of(ResolvedField.CLEANED_NAME, "Cleaned Merchant Name"),
                of(ResolvedField.WEBSITE, "Website"),
                of(ResolvedField.SOCIALS, "Social(s)"),
                of(ResolvedField.EVIDENCE, "Evidence"),
                of(ResolvedField.EVIDENCE_LINKS, "Evidence Links"),
                of(ResolvedField.ACCUMULATED_COST, "Cost per Row"),
                of(ResolvedField.LOGO_FILENAME, "Logo Filename"),
                of(ResolvedField.REMARKS, "Remarks")
        );
    }
}
