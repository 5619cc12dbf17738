package com.marketbot.pk.model;

/**
 * Financial statement line items, income statement first, then balance sheet, then cash flow.
 */
public enum StatementField implements ColumnField {
    REVENUE("revenue"),
    COST_OF_REVENUE("cost_of_revenue"),
    GROSS_PROFIT("gross_profit"),
    OPERATING_EXPENSES("operating_expenses"),
    OPERATING_INCOME("operating_income"),
    EBITDA("ebitda"),
    INTEREST_EXPENSE("interest_expense"),
    NET_INCOME("net_income"),
    EPS("eps"),
    TOTAL_ASSETS("total_assets"),
    CURRENT_ASSETS("current_assets"),
    NON_CURRENT_ASSETS("non_current_assets"),
    TOTAL_LIABILITIES("total_liabilities"),
    CURRENT_LIABILITIES("current_liabilities"),
    NON_CURRENT_LIABILITIES("non_current_liabilities"),
    TOTAL_EQUITY("total_equity"),
    OPERATING_CASH_FLOW("operating_cash_flow"),
    INVESTING_CASH_FLOW("investing_cash_flow"),
    FINANCING_CASH_FLOW("financing_cash_flow"),
    NET_CASH_CHANGE("net_cash_change"),
    FREE_CASH_FLOW("free_cash_flow");

    private final String column;

    StatementField(String column) {
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
