package de.bsommerfeld.finance.core.domain;

import de.bsommerfeld.finance.core.domain.InvalidTransactionException.Field;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * A single financial record. Validated on construction, so an instance that
 * exists is always fit for storage.
 *
 * <p>
 * The sign of {@code amount} is the caller's convention; the UI treats
 * negative values as expenses. Amounts are plain doubles, so aggregated sums
 * are approximations rather than an exact ledger.
 *
 * @param id          store-assigned identifier, {@code null} until inserted
 * @param description free text, non-blank, stored trimmed
 * @param amount      signed, non-zero amount
 * @param date        booking date, serialized as {@code YYYY-MM-DD}
 * @param category    category name, non-blank, stored trimmed
 */
public record Transaction(
        Long id,
        String description,
        double amount,
        LocalDate date,
        String category) {

    private static final int MIN_YEAR = 0;
    private static final int MAX_YEAR = 9999;

    public Transaction {
        if (description == null || description.isBlank()) {
            throw new InvalidTransactionException(Field.DESCRIPTION, "Description cannot be empty");
        }
        if (amount == 0) {
            throw new InvalidTransactionException(Field.AMOUNT, "Amount cannot be zero");
        }
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new InvalidTransactionException(Field.AMOUNT, "Amount must be a finite number: " + amount);
        }
        if (date == null) {
            throw new InvalidTransactionException(Field.DATE, "Date cannot be empty");
        }
        // dates are stored, sorted and range-filtered as YYYY-MM-DD text
        if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
            throw new InvalidTransactionException(Field.DATE,
                    "Year must be between 0000 and 9999: " + date);
        }
        if (category == null || category.isBlank()) {
            throw new InvalidTransactionException(Field.CATEGORY, "Category cannot be empty");
        }
        description = description.trim();
        category = category.trim();
    }

    /**
     * Convenience constructor for records that have not been persisted yet.
     */
    public Transaction(String description, double amount, LocalDate date, String category) {
        this(null, description, amount, date, category);
    }

    /**
     * Builds an unsaved transaction from raw form or file input. The date must
     * be an ISO calendar date ({@code YYYY-MM-DD}).
     *
     * @throws InvalidTransactionException naming the first invalid field
     */
    public static Transaction of(String description, double amount, String dateText, String category) {
        return new Transaction(null, description, amount, parseDate(dateText), category);
    }

    /**
     * Parses a canonical {@code YYYY-MM-DD} date.
     *
     * @throws InvalidTransactionException with {@link Field#DATE} if the text
     *                                     is blank, not a valid date or
     *                                     outside years 0000-9999
     */
    public static LocalDate parseDate(String dateText) {
        if (dateText == null || dateText.isBlank()) {
            throw new InvalidTransactionException(Field.DATE, "Date cannot be empty");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(dateText.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidTransactionException(Field.DATE,
                    "Invalid date format: " + dateText + ". Expected YYYY-MM-DD", e);
        }
        if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
            throw new InvalidTransactionException(Field.DATE,
                    "Invalid date format: " + dateText + ". Expected YYYY-MM-DD");
        }
        return date;
    }

    /** Returns a copy carrying the given store id. */
    public Transaction withId(long newId) {
        return new Transaction(newId, description, amount, date, category);
    }

    /** The canonical {@code YYYY-MM-DD} form of {@link #date()}. */
    public String dateText() {
        return date.toString();
    }

    public boolean isExpense() {
        return amount < 0;
    }
}
