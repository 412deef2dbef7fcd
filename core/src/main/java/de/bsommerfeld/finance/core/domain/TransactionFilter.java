package de.bsommerfeld.finance.core.domain;

import java.time.LocalDate;

/**
 * Optional criteria for listing transactions. Every non-null component
 * narrows the result; the components are combined with AND. Both date bounds
 * are inclusive.
 *
 * @param category  exact category name, {@code null} or blank for any
 * @param startDate earliest date to include, {@code null} for unbounded
 * @param endDate   latest date to include, {@code null} for unbounded
 */
public record TransactionFilter(String category, LocalDate startDate, LocalDate endDate) {

    private static final TransactionFilter NONE = new TransactionFilter(null, null, null);

    public TransactionFilter {
        if (category != null) {
            category = category.isBlank() ? null : category.trim();
        }
    }

    public static TransactionFilter none() {
        return NONE;
    }

    public static TransactionFilter byCategory(String category) {
        return new TransactionFilter(category, null, null);
    }

    public static TransactionFilter between(LocalDate startDate, LocalDate endDate) {
        return new TransactionFilter(null, startDate, endDate);
    }

    public boolean hasCategory() {
        return category != null;
    }

    public boolean isEmpty() {
        return category == null && startDate == null && endDate == null;
    }
}
