package de.bsommerfeld.finance.ui.view;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.finance.core.concurrent.BackgroundTaskRunner;
import de.bsommerfeld.finance.core.config.GlobalConfig;
import de.bsommerfeld.finance.core.domain.Category;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.core.domain.TransactionFilter;
import de.bsommerfeld.finance.core.event.ApplicationEventBus;
import de.bsommerfeld.finance.core.event.TransactionEvents.Change;
import de.bsommerfeld.finance.core.event.TransactionEvents.IdsCompactedEvent;
import de.bsommerfeld.finance.core.event.TransactionEvents.TransactionsChangedEvent;
import de.bsommerfeld.finance.core.report.SpendingReport;
import de.bsommerfeld.finance.db.QueryResult;
import de.bsommerfeld.finance.db.TransactionStore;
import jakarta.inject.Inject;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Observable model behind the main window. Every store call runs on the
 * {@link BackgroundTaskRunner} worker; results are applied to the observable
 * state on the callback executor (the FX thread in the application).
 *
 * <p>
 * Mutations post a {@link TransactionsChangedEvent}; this model listens for
 * it and reloads the list, so other listeners (reports) stay in sync without
 * referencing each other.
 */
@Singleton
public class MainViewModel {

    private static final Logger LOG = LoggerFactory.getLogger(MainViewModel.class);

    private final TransactionStore store;
    private final BackgroundTaskRunner runner;
    private final ApplicationEventBus eventBus;
    private final GlobalConfig config;

    private final ObservableList<Transaction> transactions = FXCollections.observableArrayList();
    private final ObservableList<String> categories = FXCollections.observableArrayList();
    private final StringProperty status = new SimpleStringProperty("");
    private final BooleanProperty loadFailed = new SimpleBooleanProperty(false);
    private final ObjectProperty<TransactionFilter> filter = new SimpleObjectProperty<>(TransactionFilter.none());
    private final IntegerProperty limit = new SimpleIntegerProperty();
    private final ObjectProperty<Long> selectedId = new SimpleObjectProperty<>();

    private Consumer<String> errorReporter = message -> LOG.warn("Unreported UI error: {}", message);

    @Inject
    public MainViewModel(TransactionStore store, BackgroundTaskRunner runner, ApplicationEventBus eventBus,
            GlobalConfig config) {
        this.store = store;
        this.runner = runner;
        this.eventBus = eventBus;
        this.config = config;
        this.limit.set(Math.max(0, config.getDatabase().getDefaultLimit()));
        eventBus.register(this);
    }

    /** Target for messages that need the user's attention, e.g. a dialog. */
    public void setErrorReporter(Consumer<String> errorReporter) {
        this.errorReporter = errorReporter;
    }

    // =====================================================================
    // Reads
    // =====================================================================

    public CompletableFuture<QueryResult<List<Transaction>>> refresh() {
        TransactionFilter activeFilter = filter.get();
        Integer activeLimit = limit.get() > 0 ? limit.get() : null;
        return runner.submit(() -> store.fetchTransactions(activeFilter, activeLimit), result -> {
            if (result.isOk()) {
                transactions.setAll(result.value());
                dropHiddenSelection();
                loadFailed.set(false);
                status.set(describeList(result.value().size(), activeFilter));
            } else {
                transactions.clear();
                loadFailed.set(true);
                status.set("Could not load transactions: " + result.error());
            }
        }, this::onUnexpectedFailure);
    }

    /**
     * Reloads the category choices: every stored category plus the configured
     * defaults, sorted and without duplicates.
     */
    public CompletableFuture<QueryResult<List<Category>>> loadCategories() {
        return runner.submit(store::fetchCategories, result -> {
            TreeSet<String> names = new TreeSet<>(config.getUser().getDefaultCategories());
            if (result.isOk()) {
                result.value().forEach(c -> names.add(c.name()));
            } else {
                LOG.warn("Category list falls back to defaults: {}", result.error());
            }
            categories.setAll(names);
        }, this::onUnexpectedFailure);
    }

    public SpendingReport currentReport() {
        return SpendingReport.of(List.copyOf(transactions));
    }

    // =====================================================================
    // Writes
    // =====================================================================

    public CompletableFuture<OptionalLong> add(Transaction transaction) {
        return runner.submit(() -> store.addTransaction(transaction), id -> {
            if (id.isPresent()) {
                status.set("Added transaction #" + id.getAsLong());
                selectedId.set(id.getAsLong());
                eventBus.post(new TransactionsChangedEvent(Change.ADDED, 1));
            } else {
                errorReporter.accept("Could not save transaction '" + transaction.description() + "'.");
            }
        }, this::onUnexpectedFailure);
    }

    public CompletableFuture<Boolean> update(Transaction transaction) {
        return runner.submit(() -> store.updateTransaction(transaction), updated -> {
            if (updated) {
                status.set("Updated transaction #" + transaction.id());
                eventBus.post(new TransactionsChangedEvent(Change.UPDATED, 1));
            } else {
                errorReporter.accept("Could not update transaction #" + transaction.id()
                        + ". It may have been deleted.");
            }
        }, this::onUnexpectedFailure);
    }

    public CompletableFuture<Boolean> delete(long id) {
        return runner.submit(() -> store.deleteTransaction(id), deleted -> {
            if (deleted) {
                status.set("Deleted transaction #" + id);
                if (Long.valueOf(id).equals(selectedId.get())) {
                    selectedId.set(null);
                }
                eventBus.post(new TransactionsChangedEvent(Change.DELETED, 1));
            } else {
                errorReporter.accept("Could not delete transaction #" + id + ".");
            }
        }, this::onUnexpectedFailure);
    }

    public CompletableFuture<Boolean> exportCsv(Path path) {
        return runner.submit(() -> store.exportToCsv(path), ok -> {
            if (ok) {
                status.set("Exported transactions to " + path.getFileName());
            } else {
                errorReporter.accept("Export to " + path + " failed. See the log for details.");
            }
        }, this::onUnexpectedFailure);
    }

    public CompletableFuture<Integer> importCsv(Path path) {
        return runner.submit(() -> store.importFromCsv(path), count -> {
            status.set("Imported " + count + " transaction" + (count == 1 ? "" : "s") + " from "
                    + path.getFileName());
            if (count > 0) {
                eventBus.post(new TransactionsChangedEvent(Change.IMPORTED, count));
            }
        }, this::onUnexpectedFailure);
    }

    /**
     * Renumbers all ids. The selected id is translated through the returned
     * mapping; every other id held by the UI is refreshed from the store.
     */
    public CompletableFuture<Map<Long, Long>> compactIds() {
        return runner.submit(store::compactTransactionIds, mapping -> {
            Long selected = selectedId.get();
            if (selected != null) {
                selectedId.set(mapping.get(selected));
            }
            long changed = mapping.entrySet().stream().filter(e -> !e.getKey().equals(e.getValue())).count();
            status.set("Compacted ids: " + changed + " of " + mapping.size() + " changed");
            eventBus.post(new IdsCompactedEvent(mapping));
        }, error -> {
            LOG.error("Id compaction failed", error);
            errorReporter.accept("Id compaction failed, your data is unchanged: " + error.getMessage());
        });
    }

    // =====================================================================
    // Filter
    // =====================================================================

    public CompletableFuture<QueryResult<List<Transaction>>> applyFilter(TransactionFilter newFilter,
            int newLimit) {
        filter.set(newFilter == null ? TransactionFilter.none() : newFilter);
        limit.set(Math.max(0, newLimit));
        return refresh();
    }

    public CompletableFuture<QueryResult<List<Transaction>>> clearFilter() {
        return applyFilter(TransactionFilter.none(), config.getDatabase().getDefaultLimit());
    }

    // =====================================================================
    // Events
    // =====================================================================

    @Subscribe
    public void onTransactionsChanged(TransactionsChangedEvent event) {
        LOG.debug("Reloading after {} ({} rows)", event.change(), event.count());
        refresh();
        loadCategories();
    }

    @Subscribe
    public void onIdsCompacted(IdsCompactedEvent event) {
        refresh();
    }

    private void onUnexpectedFailure(Throwable error) {
        LOG.error("Store operation failed unexpectedly", error);
        errorReporter.accept("Unexpected error: " + error.getMessage());
    }

    /** A selection the current list no longer shows cannot be edited or deleted. */
    private void dropHiddenSelection() {
        Long id = selectedId.get();
        if (id != null && transactions.stream().noneMatch(t -> id.equals(t.id()))) {
            selectedId.set(null);
        }
    }

    private static String describeList(int count, TransactionFilter filter) {
        String base = count + " transaction" + (count == 1 ? "" : "s");
        return filter.isEmpty() ? base : base + " (filtered)";
    }

    // =====================================================================
    // Properties
    // =====================================================================

    public ObservableList<Transaction> getTransactions() {
        return transactions;
    }

    public ObservableList<String> getCategories() {
        return categories;
    }

    public StringProperty statusProperty() {
        return status;
    }

    public BooleanProperty loadFailedProperty() {
        return loadFailed;
    }

    public ObjectProperty<TransactionFilter> filterProperty() {
        return filter;
    }

    public IntegerProperty limitProperty() {
        return limit;
    }

    public ObjectProperty<Long> selectedIdProperty() {
        return selectedId;
    }

    public Optional<Transaction> selectedTransaction() {
        Long id = selectedId.get();
        if (id == null)
            return Optional.empty();
        return transactions.stream().filter(t -> id.equals(t.id())).findFirst();
    }

    public String currency() {
        return config.getUser().getCurrency();
    }
}
