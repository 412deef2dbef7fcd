package de.bsommerfeld.finance.ui.view;

import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.MoreExecutors;
import de.bsommerfeld.finance.core.concurrent.BackgroundTaskRunner;
import de.bsommerfeld.finance.core.config.GlobalConfig;
import de.bsommerfeld.finance.core.domain.Category;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.core.domain.TransactionFilter;
import de.bsommerfeld.finance.core.event.ApplicationEventBus;
import de.bsommerfeld.finance.core.event.TransactionEvents.Change;
import de.bsommerfeld.finance.core.event.TransactionEvents.IdsCompactedEvent;
import de.bsommerfeld.finance.core.event.TransactionEvents.TransactionsChangedEvent;
import de.bsommerfeld.finance.db.QueryResult;
import de.bsommerfeld.finance.db.StoreException;
import de.bsommerfeld.finance.db.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests MainViewModel against a mocked store. The task runner uses direct
 * executors, so every store call and callback completes before the
 * operation returns.
 */
@ExtendWith(MockitoExtension.class)
class MainViewModelTest {

    private static final Transaction COFFEE = Transaction.of("Coffee", -2.5, "2025-12-01", "Food").withId(1);
    private static final Transaction SALARY = Transaction.of("Salary", 2850, "2025-12-01", "Salary").withId(2);

    @Mock
    private TransactionStore store;

    private GlobalConfig config;
    private ApplicationEventBus eventBus;
    private MainViewModel viewModel;
    private final List<String> reportedErrors = new ArrayList<>();
    private final List<Object> postedEvents = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config = new GlobalConfig();
        eventBus = new ApplicationEventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void onChange(TransactionsChangedEvent event) {
                postedEvents.add(event);
            }

            @Subscribe
            public void onCompacted(IdsCompactedEvent event) {
                postedEvents.add(event);
            }
        });
        BackgroundTaskRunner runner = new BackgroundTaskRunner(MoreExecutors.newDirectExecutorService(),
                Runnable::run);
        viewModel = new MainViewModel(store, runner, eventBus, config);
        viewModel.setErrorReporter(reportedErrors::add);

        lenient().when(store.fetchTransactions(any(), any())).thenReturn(QueryResult.ok(List.of(COFFEE, SALARY)));
        lenient().when(store.fetchCategories()).thenReturn(QueryResult.ok(List.of(new Category(1, "Food"))));
    }

    @Test
    void refresh_shouldPublishRowsAndStatus() {
        viewModel.refresh().join();

        assertEquals(List.of(COFFEE, SALARY), viewModel.getTransactions());
        assertEquals("2 transactions", viewModel.statusProperty().get());
        assertFalse(viewModel.loadFailedProperty().get());
        verify(store).fetchTransactions(TransactionFilter.none(), null);
    }

    @Test
    void refresh_failedRead_shouldShowEmptyListAndWarning() {
        viewModel.refresh().join();
        when(store.fetchTransactions(any(), any())).thenReturn(QueryResult.failed("database is locked", null));

        viewModel.refresh().join();

        assertTrue(viewModel.getTransactions().isEmpty());
        assertTrue(viewModel.loadFailedProperty().get());
        assertTrue(viewModel.statusProperty().get().contains("database is locked"));
    }

    @Test
    void refresh_unexpectedException_shouldBeReported() {
        when(store.fetchTransactions(any(), any())).thenThrow(new IllegalStateException("driver missing"));

        CompletableFuture<?> future = viewModel.refresh();

        assertTrue(future.isCompletedExceptionally());
        assertEquals(1, reportedErrors.size());
        assertTrue(reportedErrors.get(0).contains("driver missing"));
    }

    @Test
    void applyFilter_shouldQueryWithFilterAndLimit() {
        TransactionFilter food = TransactionFilter.byCategory("Food");

        viewModel.applyFilter(food, 10).join();

        verify(store).fetchTransactions(food, 10);
        assertEquals(food, viewModel.filterProperty().get());
        assertEquals("2 transactions (filtered)", viewModel.statusProperty().get());
    }

    @Test
    void clearFilter_shouldFallBackToConfiguredDefaultLimit() {
        config.getDatabase().setDefaultLimit(0);
        viewModel.applyFilter(TransactionFilter.byCategory("Food"), 10).join();

        viewModel.clearFilter().join();

        verify(store).fetchTransactions(TransactionFilter.none(), null);
        assertTrue(viewModel.filterProperty().get().isEmpty());
        assertEquals(0, viewModel.limitProperty().get());
    }

    @Test
    void add_success_shouldSelectNewRowPostEventAndReload() {
        Transaction tea = Transaction.of("Tea", -1.2, "2025-12-02", "Food");
        when(store.addTransaction(tea)).thenReturn(OptionalLong.of(3));
        when(store.fetchTransactions(any(), any()))
                .thenReturn(QueryResult.ok(List.of(COFFEE, SALARY, tea.withId(3))));

        viewModel.add(tea).join();

        assertEquals(3L, viewModel.selectedIdProperty().get());
        assertEquals(List.of(new TransactionsChangedEvent(Change.ADDED, 1)), postedEvents);
        verify(store).fetchTransactions(any(), any());
        verify(store).fetchCategories();
        assertTrue(reportedErrors.isEmpty());
    }

    @Test
    void add_failure_shouldReportAndNotPost() {
        Transaction tea = Transaction.of("Tea", -1.2, "2025-12-02", "Food");
        when(store.addTransaction(tea)).thenReturn(OptionalLong.empty());

        viewModel.add(tea).join();

        assertEquals(1, reportedErrors.size());
        assertTrue(postedEvents.isEmpty());
        verify(store, never()).fetchTransactions(any(), any());
    }

    @Test
    void update_missingRow_shouldReport() {
        when(store.updateTransaction(COFFEE)).thenReturn(false);

        viewModel.update(COFFEE).join();

        assertTrue(reportedErrors.get(0).contains("#1"));
        assertTrue(postedEvents.isEmpty());
    }

    @Test
    void delete_selectedRow_shouldClearSelection() {
        viewModel.selectedIdProperty().set(1L);
        when(store.deleteTransaction(1)).thenReturn(true);

        viewModel.delete(1).join();

        assertNull(viewModel.selectedIdProperty().get());
        assertEquals(List.of(new TransactionsChangedEvent(Change.DELETED, 1)), postedEvents);
    }

    @Test
    void selectedTransaction_shouldResolveFromCurrentList() {
        viewModel.refresh().join();
        viewModel.selectedIdProperty().set(2L);

        assertEquals(SALARY, viewModel.selectedTransaction().orElseThrow());
    }

    @Test
    void applyFilter_hidingSelectedRow_shouldClearSelection() {
        viewModel.refresh().join();
        viewModel.selectedIdProperty().set(2L);
        TransactionFilter food = TransactionFilter.byCategory("Food");
        when(store.fetchTransactions(food, null)).thenReturn(QueryResult.ok(List.of(COFFEE)));

        viewModel.applyFilter(food, 0).join();

        assertNull(viewModel.selectedIdProperty().get());
        assertTrue(viewModel.selectedTransaction().isEmpty());
    }

    @Test
    void refresh_keepingSelectedRow_shouldKeepSelection() {
        viewModel.selectedIdProperty().set(1L);

        viewModel.refresh().join();

        assertEquals(COFFEE, viewModel.selectedTransaction().orElseThrow());
    }

    @Test
    void refresh_failedRead_shouldKeepSelection() {
        viewModel.selectedIdProperty().set(1L);
        when(store.fetchTransactions(any(), any())).thenReturn(QueryResult.failed("database is locked", null));

        viewModel.refresh().join();

        assertEquals(1L, viewModel.selectedIdProperty().get());
    }

    @Test
    void importCsv_shouldOnlyPostWhenRowsArrived() {
        Path csv = Path.of("import.csv");
        when(store.importFromCsv(csv)).thenReturn(0, 4);

        viewModel.importCsv(csv).join();
        assertTrue(postedEvents.isEmpty());
        assertEquals("Imported 0 transactions from import.csv", viewModel.statusProperty().get());

        viewModel.importCsv(csv).join();
        assertEquals(List.of(new TransactionsChangedEvent(Change.IMPORTED, 4)), postedEvents);
    }

    @Test
    void exportCsv_failure_shouldReport() {
        Path csv = Path.of("export.csv");
        when(store.exportToCsv(csv)).thenReturn(false);

        viewModel.exportCsv(csv).join();

        assertEquals(1, reportedErrors.size());
    }

    @Test
    void compactIds_shouldTranslateSelectionAndPostMapping() {
        Map<Long, Long> mapping = Map.of(4L, 1L, 9L, 2L);
        when(store.compactTransactionIds()).thenReturn(mapping);
        viewModel.selectedIdProperty().set(9L);

        viewModel.compactIds().join();

        assertEquals(2L, viewModel.selectedIdProperty().get());
        assertEquals(List.of(new IdsCompactedEvent(mapping)), postedEvents);
        verify(store).fetchTransactions(any(), any());
    }

    @Test
    void compactIds_failure_shouldReportAndKeepSelection() {
        when(store.compactTransactionIds()).thenThrow(new StoreException("Transaction id compaction failed"));
        viewModel.selectedIdProperty().set(9L);

        CompletableFuture<?> future = viewModel.compactIds();

        assertTrue(future.isCompletedExceptionally());
        assertEquals(9L, viewModel.selectedIdProperty().get());
        assertTrue(reportedErrors.get(0).contains("unchanged"));
        assertTrue(postedEvents.isEmpty());
    }

    @Test
    void loadCategories_shouldMergeStoredNamesWithDefaults() {
        config.getUser().setDefaultCategories(List.of("Rent", "Food"));
        when(store.fetchCategories()).thenReturn(QueryResult.ok(List.of(
                new Category(1, "Food"), new Category(2, "Hobby"))));

        viewModel.loadCategories().join();

        assertEquals(List.of("Food", "Hobby", "Rent"), viewModel.getCategories());
    }

    @Test
    void currentReport_shouldAggregateVisibleRows() {
        viewModel.refresh().join();

        assertEquals(2850, viewModel.currentReport().income(), 1e-9);
        assertEquals(-2.5, viewModel.currentReport().expenses(), 1e-9);
        assertEquals(LocalDate.of(2025, 12, 1), viewModel.getTransactions().get(0).date());
    }
}
