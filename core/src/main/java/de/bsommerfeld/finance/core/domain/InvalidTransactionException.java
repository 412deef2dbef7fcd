package de.bsommerfeld.finance.core.domain;

/**
 * Thrown when a {@link Transaction} is constructed from values that violate
 * its invariants. The offending {@link Field} lets form-level callers point
 * the user at the input that needs fixing.
 */
public class InvalidTransactionException extends IllegalArgumentException {

    /** The transaction attribute that failed validation. */
    public enum Field {
        DESCRIPTION,
        AMOUNT,
        DATE,
        CATEGORY
    }

    private final Field field;

    public InvalidTransactionException(Field field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidTransactionException(Field field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public Field getField() {
        return field;
    }
}
