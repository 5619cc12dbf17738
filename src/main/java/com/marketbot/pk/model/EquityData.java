package com.marketbot.pk.model;

/**
 * Market cap and share counts from the equity section, used to backfill fundamentals.
 */
public final class EquityData extends FieldSet<EquityField> {
    public EquityData() {
        super(EquityField.class);
    }
}
