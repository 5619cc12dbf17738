package com.marketbot.pk.model;

public enum RatioField implements ColumnField {
    ROE("roe"),
    ROA("roa"),
    ROCE("roce"),
    GROSS_MARGIN("gross_margin"),
    OPERATING_MARGIN("operating_margin"),
    NET_MARGIN("net_margin"),
    PROFIT_MARGIN("profit_margin"),
    DEBT_TO_EQUITY("debt_to_equity"),
    DEBT_TO_ASSETS("debt_to_assets"),
    CURRENT_RATIO("current_ratio"),
    QUICK_RATIO("quick_ratio"),
    INTEREST_COVERAGE("interest_coverage"),
    REVENUE_GROWTH("revenue_growth"),
    EARNINGS_GROWTH("earnings_growth"),
    PROFIT_GROWTH("profit_growth");

    private final String column;

    RatioField(String column) {
        this.column = column;
    }

    @Override
    public String column() {
        return column;
    }

    @Override
    public boolean integral() {
        return false;
    }
}
