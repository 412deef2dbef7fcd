package de.bsommerfeld.finance.db;

import de.bsommerfeld.finance.core.domain.InvalidTransactionException.Field;
import de.bsommerfeld.finance.core.domain.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests CSV import/export bookkeeping in isolation from SQLite. The store and
 * the logger are mocked so rejected rows can be checked by line and field.
 */
@ExtendWith(MockitoExtension.class)
class CsvTransferTest {

    @TempDir
    Path tempDir;

    @Mock
    private TransactionStore store;

    @Mock
    private Logger log;

    private CsvTransfer transfer;

    @BeforeEach
    void setUp() {
        transfer = new CsvTransfer(store, log);
    }

    @Test
    void importFrom_shouldInsertOnlyValidRows() throws Exception {
        when(store.addTransaction(any())).thenReturn(OptionalLong.of(1));

        int imported = transfer.importFrom(Path.of(getClass().getResource("/csv/mixed.csv").toURI()));

        assertEquals(2, imported);
        ArgumentCaptor<Transaction> inserted = ArgumentCaptor.forClass(Transaction.class);
        verify(store, times(2)).addTransaction(inserted.capture());
        assertEquals(List.of("Coffee", "Salary"),
                inserted.getAllValues().stream().map(Transaction::description).toList());
        assertNull(inserted.getAllValues().get(0).id());
    }

    @Test
    void importFrom_shouldLogEachRejectedRowWithLineAndField() throws Exception {
        when(store.addTransaction(any())).thenReturn(OptionalLong.of(1));

        transfer.importFrom(Path.of(getClass().getResource("/csv/mixed.csv").toURI()));

        verify(log).warn(eq("Rejected CSV line {} ({}): {}"), eq(3L), eq(Field.DESCRIPTION), anyString());
        verify(log).warn(eq("Rejected CSV line {} ({}): {}"), eq(4L), eq(Field.AMOUNT), anyString());
        verify(log).warn(eq("Rejected CSV line {} ({}): {}"), eq(5L), eq(Field.DATE), anyString());
        verify(log).warn(eq("Rejected CSV line {} ({}): {}"), eq(6L), eq(Field.CATEGORY), anyString());
    }

    @Test
    void importFrom_failedInsert_shouldNotBeCounted() throws Exception {
        when(store.addTransaction(any())).thenReturn(OptionalLong.empty(), OptionalLong.of(7));

        int imported = transfer.importFrom(Path.of(getClass().getResource("/csv/mixed.csv").toURI()));

        assertEquals(1, imported);
    }

    @Test
    void importFrom_missingFile_shouldNotTouchStore() {
        assertEquals(0, transfer.importFrom(tempDir.resolve("missing.csv")));
        verifyNoInteractions(store);
    }

    @Test
    void exportTo_failedRead_shouldNotCreateFile() {
        Path target = tempDir.resolve("out.csv");
        when(store.fetchTransactions()).thenReturn(QueryResult.failed("boom", null));

        assertFalse(transfer.exportTo(target));
        assertFalse(Files.exists(target));
        verify(log).error(eq("CSV export to {} aborted: {}"), eq(target), eq("boom"));
    }

    @Test
    void exportTo_unwritableTarget_shouldReturnFalse() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("taken"));
        when(store.fetchTransactions()).thenReturn(
                QueryResult.ok(List.of(Transaction.of("Tea", -1, "2025-01-01", "Food").withId(1))));

        assertFalse(transfer.exportTo(directory));
    }
}
