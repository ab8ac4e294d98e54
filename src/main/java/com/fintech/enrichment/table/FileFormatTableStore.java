package com.fintech.enrichment.table;

import com.fintech.enrichment.exception.OutputWriteException;
import com.fintech.enrichment.exception.TableReadException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the table store from the file extension: {@code .xlsx} goes to Excel,
 * {@code .csv} to CSV.
 */
public class FileFormatTableStore implements TableStore {

    private final Map<String, TableStore> storesByExtension;

    public FileFormatTableStore(TableStore csvStore, TableStore xlsxStore) {
        this.storesByExtension = Map.of("csv", csvStore, "xlsx", xlsxStore);
    }

    @Override
    public Table read(Path path) {
        return storeFor(path)
                .orElseThrow(() -> new TableReadException("Unsupported table format for " + path
                        + ", expected one of " + storesByExtension.keySet()))
                .read(path);
    }

    @Override
    public void write(Table table, Path path) {
        storeFor(path)
                .orElseThrow(() -> new OutputWriteException("Unsupported table format for " + path
                        + ", expected one of " + storesByExtension.keySet()))
                .write(table, path);
    }

    private Optional<TableStore> storeFor(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(storesByExtension.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }
}
