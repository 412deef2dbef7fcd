package de.bsommerfeld.finance.db;

import de.bsommerfeld.finance.core.domain.InvalidTransactionException;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.db.TransactionCsv.CsvRow;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV export and import on top of any {@link TransactionStore}. Both store
 * implementations delegate here so the file handling and row validation
 * behave identically in PROD and TEST mode.
 */
final class CsvTransfer {

    private final TransactionStore store;
    private final Logger log;

    CsvTransfer(TransactionStore store, Logger log) {
        this.store = store;
        this.log = log;
    }

    boolean exportTo(Path path) {
        QueryResult<List<Transaction>> all = store.fetchTransactions();
        if (!all.isOk()) {
            log.error("CSV export to {} aborted: {}", path, all.error());
            return false;
        }
        List<String[]> records = new ArrayList<>(all.value().size());
        for (Transaction tx : all.value()) {
            records.add(TransactionCsv.record(tx));
        }
        return exportRecords(path, records);
    }

    /** Writes already rendered rows; used by stores that export raw stored values. */
    boolean exportRecords(Path path, List<String[]> records) {
        try {
            TransactionCsv.writeRecords(path, records);
            log.info("Exported {} transactions to {}", records.size(), path);
            return true;
        } catch (IOException e) {
            log.error("Failed to export transactions to {}", path, e);
            return false;
        }
    }

    /**
     * Validates every row through the {@link Transaction} invariants before
     * inserting it. Invalid rows are logged with their line and field and are
     * not counted.
     */
    int importFrom(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("CSV import skipped, file not found: {}", path);
            return 0;
        }

        List<CsvRow> rows;
        try {
            rows = TransactionCsv.read(path);
        } catch (IOException e) {
            log.error("Failed to read CSV from {}", path, e);
            return 0;
        }

        int imported = 0;
        int rejected = 0;
        for (CsvRow row : rows) {
            Transaction tx;
            try {
                tx = row.toTransaction();
            } catch (InvalidTransactionException e) {
                rejected++;
                log.warn("Rejected CSV line {} ({}): {}", row.line(), e.getField(), e.getMessage());
                continue;
            }
            if (store.addTransaction(tx).isPresent()) {
                imported++;
            } else {
                log.warn("CSV line {} could not be stored, skipped.", row.line());
            }
        }
        log.info("Imported {} of {} CSV rows from {} ({} rejected).", imported, rows.size(), path, rejected);
        return imported;
    }
}
