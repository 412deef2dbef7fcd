package de.bsommerfeld.finance.db;

import de.bsommerfeld.finance.core.domain.TransactionFilter;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the parameterized transaction listing query. Each filter criterion
 * becomes a {@link Condition} with its bound value; the SQL text only ever
 * contains placeholders.
 *
 * <pre>
 * TransactionQuery q = TransactionQuery.forFilter(filter, 50);
 * try (PreparedStatement ps = conn.prepareStatement(q.sql())) {
 *     q.bind(ps);
 *     ...
 * }
 * </pre>
 */
final class TransactionQuery {

    /** Predicates the listing supports. Dates compare as {@code YYYY-MM-DD} text. */
    enum Condition {
        CATEGORY("c.name = ?"),
        START_DATE("t.date >= ?"),
        END_DATE("t.date <= ?");

        private final String predicate;

        Condition(String predicate) {
            this.predicate = predicate;
        }

        String predicate() {
            return predicate;
        }
    }

    private record Clause(Condition condition, String value) {
    }

    private static final String ORDER_BY = "ORDER BY t.date DESC";

    private final List<Clause> clauses = new ArrayList<>();
    private Integer limit;

    private TransactionQuery() {
    }

    /**
     * Translates a filter and optional row cap into a query. A {@code null}
     * filter matches everything; a {@code null} or non-positive limit means
     * no cap.
     */
    static TransactionQuery forFilter(TransactionFilter filter, Integer limit) {
        TransactionQuery query = new TransactionQuery();
        if (filter != null) {
            if (filter.hasCategory())
                query.where(Condition.CATEGORY, filter.category());
            if (filter.startDate() != null)
                query.where(Condition.START_DATE, filter.startDate().toString());
            if (filter.endDate() != null)
                query.where(Condition.END_DATE, filter.endDate().toString());
        }
        return query.limit(limit);
    }

    TransactionQuery where(Condition condition, String value) {
        clauses.add(new Clause(condition, value));
        return this;
    }

    TransactionQuery limit(Integer limit) {
        this.limit = (limit != null && limit > 0) ? limit : null;
        return this;
    }

    String sql() {
        StringBuilder sql = new StringBuilder(SqlLoader.load("select-transactions"));
        for (int i = 0; i < clauses.size(); i++) {
            sql.append(i == 0 ? "\nWHERE " : "\n  AND ");
            sql.append(clauses.get(i).condition().predicate());
        }
        sql.append('\n').append(ORDER_BY);
        if (limit != null) {
            sql.append("\nLIMIT ?");
        }
        return sql.toString();
    }

    /** Binds the clause values, then the limit, in placeholder order. */
    void bind(PreparedStatement ps) throws SQLException {
        int index = 1;
        for (Clause clause : clauses) {
            ps.setString(index++, clause.value());
        }
        if (limit != null) {
            ps.setInt(index, limit);
        }
    }
}
