package com.marketbot.pk.model;

public enum EquityField implements ColumnField {
    MARKET_CAP("market_cap", false),
    SHARES_OUTSTANDING("shares_outstanding", true),
    FREE_FLOAT_PCT("free_float_pct", false),
    FREE_FLOAT_SHARES("float_shares", true);

    private final String column;
    private final boolean integral;

    EquityField(String column, boolean integral) {
        this.column = column;
        this.integral = integral;
    }

    @Override
    public String column() {
        return column;
    }

    @Override
    public boolean integral() {
        return integral;
    }
}
