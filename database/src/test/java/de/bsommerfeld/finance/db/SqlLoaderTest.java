package de.bsommerfeld.finance.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests SqlLoader against the statements shipped in {@code sql/} and the
 * root-level {@code schema.sql}.
 */
class SqlLoaderTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "select-categories", "select-category-id", "insert-category",
            "select-transactions", "select-transaction-by-id", "select-export-rows",
            "insert-transaction", "update-transaction", "delete-transaction",
            "drop-transactions-shadow", "create-transactions-shadow", "select-transaction-rows",
            "insert-transaction-shadow", "drop-transactions", "rename-transactions-shadow" })
    void load_shouldFindEveryStatementTheStoreUses(String name) {
        String sql = SqlLoader.load(name);
        assertFalse(sql.isBlank());
        assertFalse(sql.endsWith(";"), "statements are executed one at a time");
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        assertSame(SqlLoader.load("insert-transaction"), SqlLoader.load("insert-transaction"));
    }

    @Test
    void load_updateShouldBindIdLast() {
        String sql = SqlLoader.load("update-transaction");
        assertTrue(sql.trim().endsWith("WHERE id = ?"));
        assertEquals(5, sql.chars().filter(c -> c == '?').count());
    }

    @Test
    void load_missingResource_shouldThrow() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("does-not-exist"));
    }

    @Test
    void loadSchema_shouldSplitIntoTableStatements() {
        String[] statements = SqlLoader.loadSchema();

        assertEquals(2, statements.length);
        assertTrue(statements[0].contains("CREATE TABLE IF NOT EXISTS categories"));
        assertTrue(statements[1].contains("CREATE TABLE IF NOT EXISTS transactions"));
    }
}
