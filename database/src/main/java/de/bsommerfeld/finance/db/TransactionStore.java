package de.bsommerfeld.finance.db;

import de.bsommerfeld.finance.core.domain.Category;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.core.domain.TransactionFilter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistence contract for transactions and their categories. Every method is
 * synchronous and blocking; callers on the UI thread must go through
 * {@link de.bsommerfeld.finance.core.concurrent.BackgroundTaskRunner}.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlTransactionStore}: production persistence via SQLite</li>
 * <li>{@link InMemoryTransactionStore}: in-memory store for TEST mode,
 * pre-seeded with sample data, no disk I/O</li>
 * </ul>
 *
 * <h3>Failure policy</h3>
 * <ul>
 * <li>Reads never throw. A failed query comes back as
 * {@link QueryResult#failed}.</li>
 * <li>Writes never throw. Failure is reported through the return value
 * (empty id, {@code false}, zero count).</li>
 * <li>{@link #ensureDatabase()} and {@link #compactTransactionIds()} throw
 * {@link StoreException}.</li>
 * </ul>
 */
public interface TransactionStore {

    /**
     * Creates the store and its schema if it does not exist yet. Safe to call
     * repeatedly.
     *
     * @throws StoreException if the store cannot be created
     */
    void ensureDatabase();

    /** All categories, ordered by name. */
    QueryResult<List<Category>> fetchCategories();

    /**
     * Resolves a category name to its id, creating the category on first use.
     *
     * @param name category name; {@code null} or blank yields no id
     * @return the id, or empty for a blank name or a failed write
     */
    Optional<Long> ensureCategory(String name);

    /**
     * Looks up one transaction with its category name resolved.
     *
     * @return {@code ok(Optional.empty())} if no row has that id
     */
    QueryResult<Optional<Transaction>> fetchTransactionById(long id);

    /**
     * Lists transactions, newest date first. Order among equal dates is
     * unspecified.
     *
     * @param filter criteria to AND together, {@code null} for none
     * @param limit  row cap, {@code null} or {@code <= 0} for none
     */
    QueryResult<List<Transaction>> fetchTransactions(TransactionFilter filter, Integer limit);

    /** Lists all transactions without filter or cap. */
    default QueryResult<List<Transaction>> fetchTransactions() {
        return fetchTransactions(TransactionFilter.none(), null);
    }

    /**
     * Inserts a transaction, creating its category if needed. An id already
     * present on {@code transaction} is ignored.
     *
     * @return the id assigned by the store, empty on failure
     */
    OptionalLong addTransaction(Transaction transaction);

    /**
     * Overwrites every field of the row identified by {@code transaction.id()}.
     *
     * @return {@code false} if the id is missing, matched no row, or the write
     *         failed
     */
    boolean updateTransaction(Transaction transaction);

    /**
     * @return {@code true} only if a row was removed
     */
    boolean deleteTransaction(long id);

    /**
     * Writes every transaction to a CSV file with the header
     * {@code id,description,amount,date,category}.
     *
     * @return {@code false} if reading the store or writing the file failed
     */
    boolean exportToCsv(Path path);

    /**
     * Inserts the rows of a CSV file as new transactions. Rows that fail
     * validation or insertion are skipped.
     *
     * @return number of rows inserted; 0 for a missing or unreadable file
     */
    int importFromCsv(Path path);

    /**
     * Rebuilds the transaction table so ids become dense and sequential,
     * preserving every other field. All-or-nothing: either the full mapping is
     * returned or the store is left untouched and an exception is thrown.
     *
     * <p>
     * <strong>Every id held outside the store is stale afterwards.</strong>
     * Callers must translate or drop selections using the returned mapping.
     *
     * @return old id to new id, in ascending order of the old id
     * @throws StoreException if the rebuild failed and was rolled back
     */
    Map<Long, Long> compactTransactionIds();
}
