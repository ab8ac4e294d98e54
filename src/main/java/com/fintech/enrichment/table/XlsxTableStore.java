package com.fintech.enrichment.table;

import com.fintech.enrichment.exception.OutputWriteException;
import com.fintech.enrichment.exception.TableReadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Excel table store backed by Apache POI. Only the first sheet is read; its first row
 * is the header row. Cells are read as the text Excel would display.
 */
@Slf4j
public class XlsxTableStore implements TableStore {

    static final String SHEET_NAME = "Sheet1";

    @Override
    public Table read(Path path) {
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new Table(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            if (sheet.getPhysicalNumberOfRows() == 0) {
                return new Table(List.of(), List.of());
            }

            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            List<String> headers = readRow(sheet.getRow(0), formatter, evaluator);
            List<List<String>> rows = new ArrayList<>();
            for (int r = 1; r <= sheet.getLastRowNum(); r++) {
                rows.add(readRow(sheet.getRow(r), formatter, evaluator));
            }
            log.debug("Read {} data rows with {} columns from {}", rows.size(), headers.size(), path);
            return new Table(headers, rows);
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
            throw new TableReadException("Failed to read table " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(Table table, Path path) {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(path)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            writeRow(sheet.createRow(0), table.getHeaders());
            List<List<String>> rows = table.getRows();
            for (int r = 0; r < rows.size(); r++) {
                writeRow(sheet.createRow(r + 1), rows.get(r));
            }
            workbook.write(out);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write table " + path + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} data rows to {}", table.getDataRowCount(), path);
    }

    private static List<String> readRow(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (row == null || row.getLastCellNum() < 0) {
            return new ArrayList<>();
        }
        List<String> values = new ArrayList<>(row.getLastCellNum());
        for (int c = 0; c < row.getLastCellNum(); c++) {
            values.add(formatter.formatCellValue(row.getCell(c), evaluator));
        }
        return values;
    }

    private static void writeRow(Row row, List<String> values) {
        for (int c = 0; c < values.size(); c++) {
            String value = values.get(c);
            // Blank cells stay absent
            if (value != null && !value.isEmpty()) {
                row.createCell(c).setCellValue(value);
            }
        }
    }
}
