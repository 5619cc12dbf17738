package com.marketbot.pk.model;

import java.util.Collections;
import java.util.List;

/**
 * Everything parsed from one company detail page.
 */
public final class CompanyFullData {
    public final String symbol;
    public final CompanyInfo info;
    public final FundamentalsData fundamentals;
    public final RatiosData ratios;
    public final List<FinancialPeriod> financials;
    public final EquityData equity;

    public CompanyFullData(
            String symbol,
            CompanyInfo info,
            FundamentalsData fundamentals,
            RatiosData ratios,
            List<FinancialPeriod> financials,
            EquityData equity
    ) {
        this.symbol = symbol;
        this.info = info == null ? new CompanyInfo(symbol) : info;
        this.fundamentals = fundamentals == null ? new FundamentalsData() : fundamentals;
        this.ratios = ratios == null ? new RatiosData() : ratios;
        this.financials = financials == null ? List.of() : Collections.unmodifiableList(financials);
        this.equity = equity == null ? new EquityData() : equity;
    }

    @Override
    public String toString() {
        return "CompanyFullData{symbol=" + symbol
                + ", fundamentals=" + fundamentals.size()
                + ", ratios=" + ratios.size()
                + ", periods=" + financials.size()
                + ", equity=" + equity.size() + "}";
    }
}
