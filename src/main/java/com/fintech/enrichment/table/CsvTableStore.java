package com.fintech.enrichment.table;

import com.fintech.enrichment.exception.OutputWriteException;
import com.fintech.enrichment.exception.TableReadException;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CSV table store backed by OpenCSV. The first record is the header row.
 */
@Slf4j
public class CsvTableStore implements TableStore {

    @Override
    public Table read(Path path) {
        List<String[]> records;
        try (Reader fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(fileReader)) {
            records = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new TableReadException("Failed to read table " + path + ": " + e.getMessage(), e);
        }

        if (records.isEmpty()) {
            return new Table(List.of(), List.of());
        }
        List<String> headers = Arrays.asList(records.get(0));
        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (String[] record : records.subList(1, records.size())) {
            rows.add(Arrays.asList(record));
        }
        log.debug("Read {} data rows with {} columns from {}", rows.size(), headers.size(), path);
        return new Table(headers, rows);
    }

    @Override
    public void write(Table table, Path path) {
        try (Writer fileWriter = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(fileWriter)) {
            writer.writeNext(table.getHeaders().toArray(new String[0]));
            for (List<String> row : table.getRows()) {
                writer.writeNext(row.toArray(new String[0]));
            }
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write table " + path + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} data rows to {}", table.getDataRowCount(), path);
    }
}
