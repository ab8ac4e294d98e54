package com.fintech.enrichment.table;

import java.nio.file.Path;

/**
 * Reads and writes whole tables.
 */
public interface TableStore {

    /**
     * @throws com.fintech.enrichment.exception.TableReadException if the file cannot be read
     */
    Table read(Path path);

    /**
     * Replaces the file at {@code path} with the table.
     *
     * @throws com.fintech.enrichment.exception.OutputWriteException if the file cannot be written
     */
    void write(Table table, Path path);
}
