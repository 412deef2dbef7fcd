package de.bsommerfeld.finance.db;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a read against the store: either the rows that were found or
 * the reason the query failed. Lets callers tell "no data" apart from
 * "could not read" while still degrading to an empty view with
 * {@link #orElse(Object)}.
 *
 * @param <T> the payload type
 */
public final class QueryResult<T> {

    private final T value;
    private final String error;
    private final Throwable cause;

    private QueryResult(T value, String error, Throwable cause) {
        this.value = value;
        this.error = error;
        this.cause = cause;
    }

    public static <T> QueryResult<T> ok(T value) {
        return new QueryResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> QueryResult<T> failed(String reason, Throwable cause) {
        return new QueryResult<>(null, Objects.requireNonNull(reason, "reason"), cause);
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if the query failed
     */
    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("Query failed: " + error, cause);
        }
        return value;
    }

    /** The failure reason, {@code null} for a successful result. */
    public String error() {
        return error;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public <R> QueryResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) {
            return new QueryResult<>(null, error, cause);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isOk() ? "QueryResult[ok=" + value + "]" : "QueryResult[failed=" + error + "]";
    }
}
