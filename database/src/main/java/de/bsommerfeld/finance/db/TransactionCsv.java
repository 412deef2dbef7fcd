package de.bsommerfeld.finance.db;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import de.bsommerfeld.finance.core.domain.Transaction;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV interchange format for transactions.
 *
 * <h3>Export</h3>
 * UTF-8, comma separated, header {@code id,description,amount,date,category},
 * amounts as plain decimals (no exponent notation).
 *
 * <h3>Import</h3>
 * Header driven with case-sensitive column names. Alternate spellings are
 * accepted for three columns; the first non-blank value wins:
 * <ul>
 * <li>{@code description}, {@code desc}</li>
 * <li>{@code date}, {@code datetime} (a time part is cut off)</li>
 * <li>{@code category}, {@code cat}</li>
 * </ul>
 * An {@code id} column is ignored. Missing columns and short rows read as
 * blank values; validation happens later in {@link CsvRow#toTransaction()}.
 */
final class TransactionCsv {

    static final String[] HEADER = { "id", "description", "amount", "date", "category" };

    private static final String[] DESCRIPTION_COLUMNS = { "description", "desc" };
    private static final String[] DATE_COLUMNS = { "date", "datetime" };
    private static final String[] CATEGORY_COLUMNS = { "category", "cat" };
    private static final String[] AMOUNT_COLUMNS = { "amount" };

    private static final char BOM = '\uFEFF';

    private TransactionCsv() {
    }

    /**
     * One data row of an import file, with aliases already resolved.
     *
     * @param line        physical line number in the file, 1-based
     * @param description raw description, may be blank
     * @param amount      raw amount text, may be blank
     * @param date        raw date text, time part removed, may be blank
     * @param category    raw category, may be blank
     */
    record CsvRow(long line, String description, String amount, String date, String category) {

        /**
         * Parsed amount; blank or unparseable text counts as 0, which the
         * {@link Transaction} invariants then reject.
         */
        double amountValue() {
            if (amount == null || amount.isBlank())
                return 0;
            try {
                return Double.parseDouble(amount.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }

        /**
         * @throws de.bsommerfeld.finance.core.domain.InvalidTransactionException
         *         if the row violates a transaction invariant
         */
        Transaction toTransaction() {
            return Transaction.of(description, amountValue(), date, category);
        }
    }

    static void write(Path path, List<Transaction> transactions) throws IOException {
        List<String[]> records = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            records.add(record(tx));
        }
        writeRecords(path, records);
    }

    /** One export line per transaction, in {@link #HEADER} column order. */
    static String[] record(Transaction tx) {
        return new String[] {
                String.valueOf(tx.id()),
                tx.description(),
                formatAmount(tx.amount()),
                tx.dateText(),
                tx.category()
        };
    }

    /**
     * Writes the header followed by pre-rendered records. Records are written
     * as given, so stored values that no longer pass validation survive an
     * export unchanged.
     */
    static void writeRecords(Path path, List<String[]> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER, false);
            for (String[] record : records) {
                writer.writeNext(record, false);
            }
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("Failed to write CSV to " + path, writer.getException());
            }
        }
    }

    static List<CsvRow> read(Path path) throws IOException {
        List<CsvRow> rows = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVReader reader = new CSVReader(in)) {
            String[] header = reader.readNext();
            if (header == null) {
                return rows;
            }
            Map<String, Integer> columns = indexHeader(header);

            String[] record;
            while ((record = reader.readNext()) != null) {
                if (isBlankRecord(record))
                    continue;
                rows.add(new CsvRow(
                        reader.getLinesRead(),
                        firstValue(record, columns, DESCRIPTION_COLUMNS),
                        firstValue(record, columns, AMOUNT_COLUMNS),
                        stripTime(firstValue(record, columns, DATE_COLUMNS)),
                        firstValue(record, columns, CATEGORY_COLUMNS)));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + path + ": " + e.getMessage(), e);
        }
        return rows;
    }

    /** Renders an amount without exponent, e.g. {@code 2.5}, {@code 500.0}. */
    static String formatAmount(double amount) {
        return BigDecimal.valueOf(amount).toPlainString();
    }

    private static Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private static String firstValue(String[] record, Map<String, Integer> columns, String[] names) {
        for (String name : names) {
            Integer index = columns.get(name);
            if (index == null || index >= record.length)
                continue;
            String value = record[index];
            if (value != null && !value.isBlank())
                return value.trim();
        }
        return "";
    }

    /** {@code 2025-12-01T10:15:00} and {@code 2025-12-01 10:15} become {@code 2025-12-01}. */
    private static String stripTime(String value) {
        if (value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ')) {
            return value.substring(0, 10);
        }
        return value;
    }

    private static boolean isBlankRecord(String[] record) {
        for (String value : record) {
            if (value != null && !value.isBlank())
                return false;
        }
        return true;
    }
}
