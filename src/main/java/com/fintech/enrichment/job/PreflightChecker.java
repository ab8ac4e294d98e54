package com.fintech.enrichment.job;

import com.fintech.enrichment.client.LanguageModelClient;
import com.fintech.enrichment.client.PlaceLookupClient;
import com.fintech.enrichment.client.SearchClient;
import com.fintech.enrichment.client.WebsiteFetchClient;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.exception.PreflightException;
import com.fintech.enrichment.exception.TableReadException;
import com.fintech.enrichment.model.ProcessingMode;
import com.fintech.enrichment.service.CostEstimator;
import com.fintech.enrichment.table.Table;
import com.fintech.enrichment.table.TableStore;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Synchronous checks run by {@code start()} before any worker exists.
 * All problems are collected and reported together.
 */
@Slf4j
public class PreflightChecker {

    private final TableStore tableStore;
    private final SearchClient searchClient;
    private final LanguageModelClient languageModelClient;
    private final WebsiteFetchClient websiteFetchClient;
    private final PlaceLookupClient placeLookupClient;
    private final CostEstimator costEstimator;

    public PreflightChecker(TableStore tableStore,
                            SearchClient searchClient,
                            LanguageModelClient languageModelClient,
                            WebsiteFetchClient websiteFetchClient,
                            PlaceLookupClient placeLookupClient,
                            CostEstimator costEstimator) {
        this.tableStore = tableStore;
        this.searchClient = searchClient;
        this.languageModelClient = languageModelClient;
        this.websiteFetchClient = websiteFetchClient;
        this.placeLookupClient = placeLookupClient;
        this.costEstimator = costEstimator;
    }

    /**
     * @throws PreflightException listing every failed check
     */
    public void check(JobSettings settings) {
        List<String> problems = new ArrayList<>();

        checkInput(settings, problems);
        checkRowRange(settings, problems);
        checkOutput(settings, problems);
        checkCredentials(settings, problems);
        checkBudget(settings, problems);

        if (!problems.isEmpty()) {
            log.warn("Preflight failed for {}: {}", settings.getInputPath(), problems);
            throw new PreflightException(problems);
        }
        log.debug("Preflight passed for {}", settings.getInputPath());
    }

    private void checkInput(JobSettings settings, List<String> problems) {
        if (settings.getColumnMapping() == null || isBlank(settings.getColumnMapping().getMerchantName())) {
            problems.add("Merchant name column must be mapped");
        }
        if (isBlank(settings.getInputPath())) {
            problems.add("Input path is required");
            return;
        }
        Path input = Paths.get(settings.getInputPath());
        if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
            problems.add("Input file not found or not readable: " + input);
            return;
        }
        if (settings.getColumnMapping() == null) {
            return;
        }

        Table table;
        try {
            table = tableStore.read(input);
        } catch (TableReadException e) {
            problems.add(e.getMessage());
            return;
        }
        for (String header : settings.getColumnMapping().mappedHeaders()) {
            if (table.columnIndex(header) < 0) {
                problems.add("Mapped column '" + header + "' not found in input header");
            }
        }
    }

    private void checkRowRange(JobSettings settings, List<String> problems) {
        if (settings.getStartRow() < Table.FIRST_DATA_ROW) {
            problems.add("Start row must be " + Table.FIRST_DATA_ROW + " or greater, was " + settings.getStartRow());
        }
        if (settings.getEndRow() < settings.getStartRow()) {
            problems.add("End row " + settings.getEndRow() + " is before start row " + settings.getStartRow());
        }
    }

    private void checkOutput(JobSettings settings, List<String> problems) {
        if (isBlank(settings.getOutputPath())) {
            problems.add("Output path is required");
            return;
        }
        Path directory = Paths.get(settings.getOutputPath()).toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory) || !Files.isWritable(directory)) {
            problems.add("Output directory is not writable: " + directory);
        }
    }

    private void checkCredentials(JobSettings settings, List<String> problems) {
        checkCredential("Search", searchClient::validateCredentials, problems);
        checkCredential("Language model", languageModelClient::validateCredentials, problems);
        checkCredential("Website fetch", websiteFetchClient::validateCredentials, problems);
        if (settings.getMode() == ProcessingMode.ENHANCED && placeLookupClient != null) {
            checkCredential("Place lookup", placeLookupClient::validateCredentials, problems);
        }
    }

    private void checkCredential(String capability, BooleanSupplier check, List<String> problems) {
        try {
            if (!check.getAsBoolean()) {
                problems.add(capability + " credentials are invalid");
            }
        } catch (RuntimeException e) {
            problems.add(capability + " credential check failed: " + e.getMessage());
        }
    }

    private void checkBudget(JobSettings settings, List<String> problems) {
        if (!costEstimator.isWithinBudget(settings.getMode(), settings.getModelName(), settings.getBudgetPerRow())) {
            BigDecimal perRow = costEstimator.estimateCostPerRow(settings.getMode(), settings.getModelName());
            problems.add("Estimated cost per row " + perRow.toPlainString() + " exceeds the budget of "
                    + BigDecimal.valueOf(settings.getBudgetPerRow()).toPlainString());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
