package com.fintech.enrichment.job;

import com.fintech.enrichment.dto.ColumnMapping;
import com.fintech.enrichment.dto.RawRecord;
import com.fintech.enrichment.table.Table;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a table row to a {@link RawRecord} through the column mapping.
 * Unmapped columns are carried as passthrough values in header order.
 */
public class RecordMapper {

    private final Table table;
    private final ColumnMapping mapping;
    private final Set<String> mappedHeaders;

    public RecordMapper(Table table, ColumnMapping mapping) {
        this.table = table;
        this.mapping = mapping;
        this.mappedHeaders = Set.copyOf(mapping.mappedHeaders());
    }

    public RawRecord map(int rowNumber) {
        List<String> headers = table.getHeaders();
        Map<String, String> passthrough = new LinkedHashMap<>();
        for (int column = 0; column < headers.size(); column++) {
            String header = headers.get(column);
            if (!mappedHeaders.contains(header)) {
                passthrough.put(header, table.getCell(rowNumber, column));
            }
        }
        return RawRecord.builder()
                .merchantNameRaw(cell(rowNumber, mapping.getMerchantName()))
                .address(cell(rowNumber, mapping.getAddress()))
                .city(cell(rowNumber, mapping.getCity()))
                .country(cell(rowNumber, mapping.getCountry()))
                .state(cell(rowNumber, mapping.getState()))
                .passthroughColumns(passthrough)
                .build();
    }

    private String cell(int rowNumber, String header) {
        int column = table.columnIndex(header);
        return column < 0 ? null : table.getCell(rowNumber, column);
    }
}
