package de.bsommerfeld.finance.core.domain;

/**
 * A named grouping of transactions. Categories are interned by name: the
 * first transaction using a name creates the row, later ones reuse its id.
 * Nothing ever renames or removes a category.
 *
 * @param id   store-assigned identifier
 * @param name unique category name
 */
public record Category(long id, String name) {

    /**
     * Name shown for transactions whose category reference no longer
     * resolves (null or dangling {@code category_id}).
     */
    public static final String UNCATEGORIZED = "Uncategorized";
}
