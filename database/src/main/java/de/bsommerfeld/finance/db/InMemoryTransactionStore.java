package de.bsommerfeld.finance.db;

import com.google.inject.Singleton;
import de.bsommerfeld.finance.core.domain.Category;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.core.domain.TransactionFilter;
import de.bsommerfeld.finance.core.util.SampleDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * In-memory {@link TransactionStore} for TEST mode. No SQLite, nothing is
 * written to disk except explicit CSV exports. Bound by Guice when the
 * application starts with {@code app.mode=TEST}.
 *
 * <p>
 * The injectable constructor seeds about three months of sample data (see
 * {@link SampleDataGenerator}) so every view has something to show
 * immediately. {@link #empty()} gives an unseeded instance.
 *
 * <p>
 * Ids are assigned like SQLite's AUTOINCREMENT: strictly increasing, never
 * reused after a delete, and restarting after the highest id once
 * {@link #compactTransactionIds()} has run.
 */
@Singleton
public class InMemoryTransactionStore implements TransactionStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTransactionStore.class);

    private static final Comparator<Transaction> NEWEST_FIRST = Comparator
            .comparing(Transaction::date)
            .thenComparing(Transaction::id)
            .reversed();

    private final Map<Long, Transaction> transactions = new TreeMap<>();
    private final Map<String, Long> categories = new LinkedHashMap<>();
    private long nextTransactionId = 1;
    private long nextCategoryId = 1;

    public InMemoryTransactionStore() {
        this(true);
    }

    private InMemoryTransactionStore(boolean seed) {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");

        if (seed) {
            SampleDataGenerator.generate(60, 90, 42L).forEach(this::addTransaction);
        }
    }

    public static InMemoryTransactionStore empty() {
        return new InMemoryTransactionStore(false);
    }

    /** No-op, there is nothing to create. */
    @Override
    public void ensureDatabase() {
    }

    @Override
    public synchronized QueryResult<List<Category>> fetchCategories() {
        List<Category> result = new ArrayList<>();
        categories.forEach((name, id) -> result.add(new Category(id, name)));
        result.sort(Comparator.comparing(Category::name));
        return QueryResult.ok(result);
    }

    @Override
    public synchronized Optional<Long> ensureCategory(String name) {
        if (name == null || name.isBlank())
            return Optional.empty();
        return Optional.of(categories.computeIfAbsent(name.trim(), n -> nextCategoryId++));
    }

    @Override
    public synchronized QueryResult<Optional<Transaction>> fetchTransactionById(long id) {
        return QueryResult.ok(Optional.ofNullable(transactions.get(id)));
    }

    @Override
    public synchronized QueryResult<List<Transaction>> fetchTransactions(TransactionFilter filter, Integer limit) {
        TransactionFilter f = filter == null ? TransactionFilter.none() : filter;
        List<Transaction> result = new ArrayList<>();
        for (Transaction tx : transactions.values()) {
            if (f.hasCategory() && !f.category().equals(tx.category()))
                continue;
            if (f.startDate() != null && tx.date().isBefore(f.startDate()))
                continue;
            if (f.endDate() != null && tx.date().isAfter(f.endDate()))
                continue;
            result.add(tx);
        }
        result.sort(NEWEST_FIRST);
        if (limit != null && limit > 0 && result.size() > limit)
            return QueryResult.ok(new ArrayList<>(result.subList(0, limit)));
        return QueryResult.ok(result);
    }

    @Override
    public synchronized OptionalLong addTransaction(Transaction transaction) {
        ensureCategory(transaction.category());
        long id = nextTransactionId++;
        transactions.put(id, transaction.withId(id));
        return OptionalLong.of(id);
    }

    @Override
    public synchronized boolean updateTransaction(Transaction transaction) {
        if (transaction.id() == null || !transactions.containsKey(transaction.id()))
            return false;
        ensureCategory(transaction.category());
        transactions.put(transaction.id(), transaction);
        return true;
    }

    @Override
    public synchronized boolean deleteTransaction(long id) {
        return transactions.remove(id) != null;
    }

    @Override
    public boolean exportToCsv(Path path) {
        return new CsvTransfer(this, LOG).exportTo(path);
    }

    @Override
    public int importFromCsv(Path path) {
        return new CsvTransfer(this, LOG).importFrom(path);
    }

    @Override
    public synchronized Map<Long, Long> compactTransactionIds() {
        Map<Long, Long> mapping = new LinkedHashMap<>();
        List<Transaction> ordered = new ArrayList<>(transactions.values());
        transactions.clear();

        long newId = 1;
        for (Transaction tx : ordered) {
            mapping.put(tx.id(), newId);
            transactions.put(newId, tx.withId(newId));
            newId++;
        }
        nextTransactionId = newId;
        LOG.info("Compacted {} in-memory transaction ids.", mapping.size());
        return Collections.unmodifiableMap(mapping);
    }
}
