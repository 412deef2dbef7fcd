package de.bsommerfeld.finance.db;

import de.bsommerfeld.finance.core.domain.InvalidTransactionException;
import de.bsommerfeld.finance.core.domain.InvalidTransactionException.Field;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.db.TransactionCsv.CsvRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCsvTest {

    @TempDir
    Path tempDir;

    @Test
    void write_shouldUseExactHeaderAndPlainAmounts() throws IOException {
        Path file = tempDir.resolve("out").resolve("export.csv");

        TransactionCsv.write(file, List.of(
                Transaction.of("Salary", 2850, "2025-01-01", "Salary").withId(1),
                Transaction.of("Dinner, with friends", -64.2, "2025-01-04", "Food").withId(2)));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals("id,description,amount,date,category", lines.get(0));
        assertEquals("1,Salary,2850.0,2025-01-01,Salary", lines.get(1));
        assertEquals("2,\"Dinner, with friends\",-64.2,2025-01-04,Food", lines.get(2));
    }

    @Test
    void read_canonicalFile_shouldYieldRowsWithLineNumbers() throws Exception {
        List<CsvRow> rows = TransactionCsv.read(resource("canonical.csv"));

        assertEquals(2, rows.size());
        assertEquals(new CsvRow(2, "Rent", "-950.0", "2025-01-03", "Rent"), rows.get(0));
        assertEquals("Dinner, with friends", rows.get(1).description());
        assertEquals(-64.2, rows.get(1).toTransaction().amount());
    }

    @Test
    void read_aliasesAndTimestamps_shouldNormalize() throws Exception {
        List<CsvRow> rows = TransactionCsv.read(resource("mixed.csv"));

        assertEquals(6, rows.size(), "blank line must be skipped");
        CsvRow coffee = rows.get(0);
        assertEquals("Coffee", coffee.description());
        assertEquals("2025-12-01", coffee.date());
        assertEquals("Food", coffee.category());
        assertEquals("2025-12-06", rows.get(5).date());
        assertEquals(8, rows.get(5).line());
    }

    @Test
    void read_invalidRows_shouldFailOnTheirOwnField() throws Exception {
        List<CsvRow> rows = TransactionCsv.read(resource("mixed.csv"));

        assertEquals(Field.DESCRIPTION, rejectedField(rows.get(1)));
        assertEquals(Field.AMOUNT, rejectedField(rows.get(2)));
        assertEquals(Field.DATE, rejectedField(rows.get(3)));
        assertEquals(Field.CATEGORY, rejectedField(rows.get(4)));
    }

    @Test
    void read_byteOrderMark_shouldNotHideFirstColumn() throws IOException {
        Path file = tempDir.resolve("bom.csv");
        Files.writeString(file, "\uFEFFdescription,amount,date,category\nTea,-1.2,2025-05-05,Food\n",
                StandardCharsets.UTF_8);

        List<CsvRow> rows = TransactionCsv.read(file);

        assertEquals("Tea", rows.get(0).description());
    }

    @Test
    void read_duplicateColumns_shouldUseFirstOccurrence() throws IOException {
        Path file = tempDir.resolve("dup.csv");
        Files.writeString(file, "description,amount,amount,date,category\nTea,-1,-99,2025-05-05,Food\n");

        assertEquals("-1", TransactionCsv.read(file).get(0).amount());
    }

    @Test
    void read_emptyFile_shouldYieldNoRows() throws IOException {
        Path file = tempDir.resolve("empty.csv");
        Files.createFile(file);

        assertTrue(TransactionCsv.read(file).isEmpty());
    }

    @Test
    void formatAmount_shouldAvoidExponents() {
        assertEquals("10000000000", TransactionCsv.formatAmount(1e10));
        assertEquals("-2.5", TransactionCsv.formatAmount(-2.5));
        assertEquals("0.001", TransactionCsv.formatAmount(0.001));
    }

    private static Field rejectedField(CsvRow row) {
        return assertThrows(InvalidTransactionException.class, row::toTransaction).getField();
    }

    private Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getResource("/csv/" + name).toURI());
    }
}
