package com.marketbot.pk.model;

public enum FundamentalField implements ColumnField {
    MARKET_CAP("market_cap", false),
    PE_RATIO("pe_ratio", false),
    PB_RATIO("pb_ratio", false),
    PS_RATIO("ps_ratio", false),
    PEG_RATIO("peg_ratio", false),
    EV_EBITDA("ev_ebitda", false),
    EPS("eps", false),
    BOOK_VALUE("book_value", false),
    DPS("dps", false),
    DIVIDEND_YIELD("dividend_yield", false),
    SHARES_OUTSTANDING("shares_outstanding", true),
    FLOAT_SHARES("float_shares", true),
    WEEK_52_HIGH("week_52_high", false),
    WEEK_52_LOW("week_52_low", false),
    AVG_VOLUME("avg_volume", true),
    // Quote copy from the detail page header; only a fallback for the listing values.
    VOLUME("volume", true),
    CURRENT_PRICE("current_price", false),
    CHANGE_AMOUNT("change_amount", false),
    CHANGE_PERCENTAGE("change_percentage", false);

    private final String column;
    private final boolean integral;

    FundamentalField(String column, boolean integral) {
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

    public boolean isQuote() {
        return this == VOLUME || this == CURRENT_PRICE || this == CHANGE_AMOUNT || this == CHANGE_PERCENTAGE;
    }
}
