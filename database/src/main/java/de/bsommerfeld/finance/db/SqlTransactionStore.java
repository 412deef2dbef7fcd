package de.bsommerfeld.finance.db;

import de.bsommerfeld.finance.core.domain.Category;
import de.bsommerfeld.finance.core.domain.InvalidTransactionException;
import de.bsommerfeld.finance.core.domain.Transaction;
import de.bsommerfeld.finance.core.domain.TransactionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * SQLite-backed {@link TransactionStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema in {@code schema.sql} is applied once, when
 * {@link #ensureDatabase()} finds no store file.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level anyway, so pooling
 * provides no benefit. Consequently "resolve category, then insert" runs as
 * two separate connections; a concurrent writer inserting the same category
 * name in between is rejected by the UNIQUE constraint.
 *
 * <h3>Transaction boundaries</h3>
 * Schema creation and {@link #compactTransactionIds()} use explicit
 * transactions with rollback-on-failure. Everything else is a single
 * auto-committed statement.
 *
 * @see SqlLoader
 * @see TransactionQuery
 */
public class SqlTransactionStore implements TransactionStore {

    private final Path databaseFile;
    private final String dbUrl;
    private final Logger log;

    public SqlTransactionStore(Path databaseFile) {
        this(databaseFile, LoggerFactory.getLogger(SqlTransactionStore.class));
    }

    public SqlTransactionStore(Path databaseFile, Logger log) {
        this.databaseFile = databaseFile.toAbsolutePath();
        this.dbUrl = "jdbc:sqlite:" + this.databaseFile;
        this.log = log;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    // =====================================================================
    // Schema
    // =====================================================================

    @Override
    public void ensureDatabase() {
        log.debug("Ensuring database exists at {}", databaseFile);
        try {
            Files.createDirectories(databaseFile.getParent());
        } catch (IOException e) {
            log.error("Failed to create database directory {}", databaseFile.getParent(), e);
            throw new StoreException("Cannot create database directory: " + databaseFile.getParent(), e);
        }

        if (Files.exists(databaseFile)) {
            log.debug("Database file already exists: {}", databaseFile);
            return;
        }

        try (Connection conn = getConnection()) {
            applySchema(conn);
            log.info("Created and initialized database at {}", databaseFile);
        } catch (SQLException e) {
            log.error("Failed to create/initialize database at {}", databaseFile, e);
            discardPartialFile();
            throw new StoreException("Database initialization failed: " + databaseFile, e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql} in one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadSchema()) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
            conn.commit();
        } catch (SQLException e) {
            rollback(conn, e);
            throw e;
        }
    }

    /**
     * Removes a store file left behind by a failed initialization so the next
     * {@link #ensureDatabase()} retries instead of treating it as ready.
     */
    private void discardPartialFile() {
        try {
            Files.deleteIfExists(databaseFile);
        } catch (IOException e) {
            log.warn("Could not remove partially created database {}", databaseFile, e);
        }
    }

    // =====================================================================
    // Categories
    // =====================================================================

    @Override
    public QueryResult<List<Category>> fetchCategories() {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-categories"));
                ResultSet rs = ps.executeQuery()) {
            List<Category> categories = new ArrayList<>();
            while (rs.next()) {
                categories.add(new Category(rs.getLong("id"), rs.getString("name")));
            }
            return QueryResult.ok(categories);
        } catch (SQLException e) {
            log.error("Failed to fetch categories", e);
            return QueryResult.failed("Failed to fetch categories: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Long> ensureCategory(String name) {
        if (name == null || name.isBlank())
            return Optional.empty();

        String trimmed = name.trim();
        try (Connection conn = getConnection()) {
            Optional<Long> existing = findCategoryId(conn, trimmed);
            if (existing.isPresent())
                return existing;

            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-category"),
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, trimmed);
                ps.executeUpdate();
                long id = generatedId(ps);
                log.debug("[DB] Created category '{}' with id {}", trimmed, id);
                return Optional.of(id);
            }
        } catch (SQLException e) {
            log.error("Failed to resolve category '{}'", trimmed, e);
            return Optional.empty();
        }
    }

    private Optional<Long> findCategoryId(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-category-id"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong("id")) : Optional.empty();
            }
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public QueryResult<Optional<Transaction>> fetchTransactionById(long id) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-transaction-by-id"))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return QueryResult.ok(Optional.ofNullable(mapTransaction(rs)));
                }
            }
            return QueryResult.ok(Optional.empty());
        } catch (SQLException e) {
            log.error("Failed to fetch transaction {}", id, e);
            return QueryResult.failed("Failed to fetch transaction " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public QueryResult<List<Transaction>> fetchTransactions(TransactionFilter filter, Integer limit) {
        TransactionQuery query = TransactionQuery.forFilter(filter, limit);
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(query.sql())) {
            query.bind(ps);
            List<Transaction> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Transaction tx = mapTransaction(rs);
                    if (tx != null)
                        results.add(tx);
                }
            }
            return QueryResult.ok(results);
        } catch (SQLException e) {
            log.error("Failed to query transactions (filter={}, limit={})", filter, limit, e);
            return QueryResult.failed("Failed to query transactions: " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public OptionalLong addTransaction(Transaction transaction) {
        Optional<Long> categoryId = ensureCategory(transaction.category());
        if (categoryId.isEmpty()) {
            log.error("Cannot add transaction '{}': category '{}' could not be resolved",
                    transaction.description(), transaction.category());
            return OptionalLong.empty();
        }

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-transaction"),
                        Statement.RETURN_GENERATED_KEYS)) {
            bindTransaction(ps, transaction, categoryId.get());
            ps.executeUpdate();
            long id = generatedId(ps);
            log.debug("[DB] Inserted transaction {}", id);
            return OptionalLong.of(id);
        } catch (SQLException e) {
            log.error("Failed to add transaction '{}'", transaction.description(), e);
            return OptionalLong.empty();
        }
    }

    @Override
    public boolean updateTransaction(Transaction transaction) {
        if (transaction.id() == null) {
            log.warn("Refusing to update transaction '{}' without id", transaction.description());
            return false;
        }
        Optional<Long> categoryId = ensureCategory(transaction.category());
        if (categoryId.isEmpty()) {
            log.error("Cannot update transaction {}: category '{}' could not be resolved",
                    transaction.id(), transaction.category());
            return false;
        }

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-transaction"))) {
            bindTransaction(ps, transaction, categoryId.get());
            ps.setLong(5, transaction.id());
            int updated = ps.executeUpdate();
            if (updated == 0) {
                log.warn("No transaction with id {} to update", transaction.id());
            }
            return updated > 0;
        } catch (SQLException e) {
            log.error("Failed to update transaction {}", transaction.id(), e);
            return false;
        }
    }

    @Override
    public boolean deleteTransaction(long id) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-transaction"))) {
            ps.setLong(1, id);
            boolean deleted = ps.executeUpdate() > 0;
            if (!deleted) {
                log.debug("[DB] No transaction with id {} to delete", id);
            }
            return deleted;
        } catch (SQLException e) {
            log.error("Failed to delete transaction {}", id, e);
            return false;
        }
    }

    /** Binds description, amount, date and category id to parameters 1-4. */
    private void bindTransaction(PreparedStatement ps, Transaction tx, long categoryId) throws SQLException {
        ps.setString(1, tx.description());
        ps.setDouble(2, tx.amount());
        ps.setString(3, tx.dateText());
        ps.setLong(4, categoryId);
    }

    // =====================================================================
    // CSV
    // =====================================================================

    /**
     * Exports every stored row as it is on disk, including rows the listing
     * skips because they break the {@link Transaction} invariants.
     */
    @Override
    public boolean exportToCsv(Path path) {
        List<String[]> records = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-export-rows"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(exportRecord(rs));
            }
        } catch (SQLException e) {
            log.error("CSV export to {} aborted: could not read transactions", path, e);
            return false;
        }
        return new CsvTransfer(this, log).exportRecords(path, records);
    }

    @Override
    public int importFromCsv(Path path) {
        return new CsvTransfer(this, log).importFrom(path);
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    /**
     * Rebuilds {@code transactions} through a shadow table on a single
     * connection:
     * <ol>
     * <li>create {@code transactions_compacted} (dropping a leftover one)</li>
     * <li>copy every row in ascending id order, letting SQLite assign new
     * ids, and record old -> new</li>
     * <li>drop {@code transactions}, rename the shadow table into its
     * place</li>
     * </ol>
     * All steps share one transaction. If any of them fails the transaction
     * is rolled back, the original table is untouched and no mapping is
     * returned.
     */
    @Override
    public Map<Long, Long> compactTransactionIds() {
        Map<Long, Long> mapping = new LinkedHashMap<>();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                execute(conn, "drop-transactions-shadow");
                execute(conn, "create-transactions-shadow");
                copyIntoShadow(conn, mapping);
                execute(conn, "drop-transactions");
                execute(conn, "rename-transactions-shadow");
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Transaction id compaction failed, store left unchanged", e);
            throw new StoreException("Transaction id compaction failed", e);
        }

        long changed = mapping.entrySet().stream().filter(en -> !en.getKey().equals(en.getValue())).count();
        log.info("Compacted {} transaction ids ({} changed).", mapping.size(), changed);
        return Collections.unmodifiableMap(mapping);
    }

    private void copyIntoShadow(Connection conn, Map<Long, Long> mapping) throws SQLException {
        try (PreparedStatement select = conn.prepareStatement(SqlLoader.load("select-transaction-rows"));
                PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert-transaction-shadow"),
                        Statement.RETURN_GENERATED_KEYS);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                long oldId = rs.getLong("id");
                insert.setString(1, rs.getString("description"));
                insert.setDouble(2, rs.getDouble("amount"));
                insert.setString(3, rs.getString("date"));
                long categoryId = rs.getLong("category_id");
                if (rs.wasNull()) {
                    insert.setNull(4, Types.INTEGER);
                } else {
                    insert.setLong(4, categoryId);
                }
                insert.executeUpdate();
                mapping.put(oldId, generatedId(insert));
            }
        }
    }

    private void execute(Connection conn, String sqlName) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load(sqlName));
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (keys.next())
                return keys.getLong(1);
        }
        throw new SQLException("Insert did not return a generated id");
    }

    private void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private String[] exportRecord(ResultSet rs) throws SQLException {
        String description = rs.getString("description");
        String date = rs.getString("date");
        String category = rs.getString("category");
        return new String[] {
                String.valueOf(rs.getLong("id")),
                description == null ? "" : description,
                TransactionCsv.formatAmount(rs.getDouble("amount")),
                date == null ? "" : date,
                category == null ? Category.UNCATEGORIZED : category
        };
    }

    /**
     * Maps a joined transaction row. A null or dangling {@code category_id}
     * surfaces as {@link Category#UNCATEGORIZED}. Rows that break the
     * {@link Transaction} invariants (possible in files written by older
     * versions) are logged and mapped to {@code null}.
     */
    private Transaction mapTransaction(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        String category = rs.getString("category");
        try {
            return new Transaction(
                    id,
                    rs.getString("description"),
                    rs.getDouble("amount"),
                    Transaction.parseDate(rs.getString("date")),
                    category == null ? Category.UNCATEGORIZED : category);
        } catch (InvalidTransactionException e) {
            log.warn("Skipping stored transaction {} ({}): {}", id, e.getField(), e.getMessage());
            return null;
        }
    }
}
