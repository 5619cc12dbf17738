package com.marketbot.pk.model;

/**
 * A numeric field that maps one-to-one onto a persisted column.
 */
public interface ColumnField {
    String column();

    /**
     * Whether the column holds a whole number (share counts, volumes).
     */
    boolean integral();
}
