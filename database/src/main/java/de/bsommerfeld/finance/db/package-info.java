/**
 * Persistence gateway for transactions and categories. SQLite-backed in
 * production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [MainViewModel]
 *        │  (BackgroundTaskRunner, off the FX thread)
 *        ▼
 *   TransactionStore   ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴──────────┐
 *    │              │
 *  SqlStore    InMemoryStore
 *    │              │
 *    └──► CsvTransfer ◄──┘  (export/import shared by both)
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ categories                                                        │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Surrogate key                                  │
 * │ name (UQ)        │ Category name, interned on first use           │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ transactions                                                      │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Never reused, except through compaction        │
 * │ description      │ Free text                                      │
 * │ amount           │ REAL, signed                                   │
 * │ date             │ TEXT, YYYY-MM-DD, sorts lexicographically      │
 * │ category_id      │ FK → categories.id, nullable                   │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * Reads LEFT JOIN the category so a missing or dangling {@code category_id}
 * still yields the transaction, labelled {@code Uncategorized}.
 *
 * <h2>Id Compaction</h2>
 * {@code compactTransactionIds()} copies every row into
 * {@code transactions_compacted} in ascending id order, drops the original
 * and renames the copy, all inside one SQL transaction. The returned
 * old → new map is the only way for callers to re-identify rows they were
 * holding on to.
 *
 * <h2>SQL File Inventory</h2>
 * All SQL statements are externalized to {@code sql/*.sql}, loaded via
 * {@link SqlLoader}:
 * <ul>
 * <li>{@code select-categories.sql}, {@code select-category-id.sql},
 * {@code insert-category.sql}: category interning</li>
 * <li>{@code select-transactions.sql}: base query extended by
 * {@link TransactionQuery} with filters, ordering and limit</li>
 * <li>{@code select-transaction-by-id.sql}</li>
 * <li>{@code select-export-rows.sql}: unvalidated rows for CSV export</li>
 * <li>{@code insert-transaction.sql}, {@code update-transaction.sql},
 * {@code delete-transaction.sql}</li>
 * <li>{@code drop-transactions-shadow.sql},
 * {@code create-transactions-shadow.sql},
 * {@code select-transaction-rows.sql},
 * {@code insert-transaction-shadow.sql}, {@code drop-transactions.sql},
 * {@code rename-transactions-shadow.sql}: compaction</li>
 * </ul>
 */
package de.bsommerfeld.finance.db;
