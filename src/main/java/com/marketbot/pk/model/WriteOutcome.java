package com.marketbot.pk.model;

/**
 * Result of persisting one item. A failure carries a message and never aborts the batch.
 */
public final class WriteOutcome {
    public final String symbol;
    public final boolean success;
    public final String error;

    private WriteOutcome(String symbol, boolean success, String error) {
        this.symbol = symbol;
        this.success = success;
        this.error = error == null ? "" : error;
    }

    public static WriteOutcome ok(String symbol) {
        return new WriteOutcome(symbol, true, "");
    }

    public static WriteOutcome failed(String symbol, String error) {
        return new WriteOutcome(symbol, false, error);
    }
}
