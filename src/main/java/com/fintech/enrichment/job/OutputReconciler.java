package com.fintech.enrichment.job;

import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.OutputColumn;
import com.fintech.enrichment.dto.ResolvedRecord;
import com.fintech.enrichment.table.Table;
import com.fintech.enrichment.table.TableStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes resolved records back into a copy of the original table.
 * <p>
 * The full input table is loaded, the rows {@code [actualStart, actualStart + records)} are
 * overwritten through the output-column projection and every other row is left as it was.
 * Projection headers missing from the input are appended as new columns.
 */
@Slf4j
@RequiredArgsConstructor
public class OutputReconciler {

    private final TableStore tableStore;

    /**
     * @throws com.fintech.enrichment.exception.OutputWriteException if the output cannot be written
     */
    public void reconcile(JobSettings settings, List<ResolvedRecord> records, int actualStart) {
        Table table = tableStore.read(Paths.get(settings.getInputPath()));

        List<OutputColumn> columns = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        for (OutputColumn column : settings.getOutputColumns()) {
            if (column.isEnabled()) {
                columns.add(column);
                indexes.add(table.ensureColumn(column.getHeader()));
            }
        }

        int written = 0;
        for (ResolvedRecord record : records) {
            int rowNumber = actualStart + written;
            if (!table.hasRow(rowNumber)) {
                log.warn("Output slice runs past the last data row {}, {} records not written",
                        table.getLastRowNumber(), records.size() - written);
                break;
            }
            for (int i = 0; i < columns.size(); i++) {
                table.setCell(rowNumber, indexes.get(i), columns.get(i).getSourceField().valueOf(record));
            }
            written++;
        }

        tableStore.write(table, Paths.get(settings.getOutputPath()));
        log.info("Wrote {} resolved rows starting at row {} to {}", written, actualStart, settings.getOutputPath());
    }
}
