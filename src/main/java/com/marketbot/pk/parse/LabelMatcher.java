package com.marketbot.pk.parse;

import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.RatioField;
import com.marketbot.pk.model.StatementField;

import java.util.Locale;

/**
 * Maps normalized row labels from company pages onto fields. Order of the checks matters:
 * the first matching rule wins, so narrower fragments come before broader ones.
 */
final class LabelMatcher {
    private LabelMatcher() {
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.replace('\u00a0', ' ')
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
        while (s.endsWith(":")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }

    /**
     * Field for a fundamentals label, or null. Session open/high/low are left to the listing.
     */
    static FundamentalField fundamental(String label) {
        if (label.isEmpty()) {
            return null;
        }
        boolean week52 = label.contains("52") || label.contains("week");
        if (label.equals("current") || label.equals("close") || label.contains("current price")
                || label.contains("last price") || label.contains("closing price") && !label.contains("previous")) {
            return FundamentalField.CURRENT_PRICE;
        }
        if (label.contains("open") && !label.contains("52")) {
            return null;
        }
        if (label.contains("high")) {
            return week52 ? FundamentalField.WEEK_52_HIGH : null;
        }
        if (label.contains("low")) {
            return week52 ? FundamentalField.WEEK_52_LOW : null;
        }
        if (label.contains("volume")) {
            return label.contains("avg") || label.contains("average")
                    ? FundamentalField.AVG_VOLUME
                    : FundamentalField.VOLUME;
        }
        if (label.contains("market cap") || label.contains("mcap")) {
            return FundamentalField.MARKET_CAP;
        }
        if (label.contains("p/e") || label.contains("pe ratio") || label.contains("pe ttm")) {
            return FundamentalField.PE_RATIO;
        }
        if (label.contains("p/b") || label.contains("pb ratio") || label.contains("price to book")) {
            return FundamentalField.PB_RATIO;
        }
        if (label.contains("p/s") || label.contains("ps ratio") || label.contains("price to sales")) {
            return FundamentalField.PS_RATIO;
        }
        if (label.contains("peg")) {
            return FundamentalField.PEG_RATIO;
        }
        if (label.contains("ev/ebitda") || label.contains("ev ebitda")) {
            return FundamentalField.EV_EBITDA;
        }
        if (label.equals("eps") || label.contains("earnings per share")) {
            return FundamentalField.EPS;
        }
        if (label.contains("dividend yield") || label.contains("div yield")) {
            return FundamentalField.DIVIDEND_YIELD;
        }
        if (label.contains("book value") || label.contains("bvps")) {
            return FundamentalField.BOOK_VALUE;
        }
        if (label.contains("dps") || label.contains("dividend per share")) {
            return FundamentalField.DPS;
        }
        if (label.contains("shares outstanding") || label.contains("outstanding shares")) {
            return FundamentalField.SHARES_OUTSTANDING;
        }
        if (label.contains("free float") || label.contains("float")) {
            return FundamentalField.FLOAT_SHARES;
        }
        return null;
    }

    static RatioField ratio(String label) {
        if (label.isEmpty()) {
            return null;
        }
        if (label.contains("return on equity") || label.equals("roe")) {
            return RatioField.ROE;
        }
        if (label.contains("return on assets") || label.equals("roa")) {
            return RatioField.ROA;
        }
        if (label.contains("roce") || label.contains("return on capital")) {
            return RatioField.ROCE;
        }
        if (label.contains("gross") && label.contains("margin")) {
            return RatioField.GROSS_MARGIN;
        }
        if (label.contains("operating") && label.contains("margin")) {
            return RatioField.OPERATING_MARGIN;
        }
        if (label.contains("net") && label.contains("margin")) {
            return RatioField.NET_MARGIN;
        }
        if (label.contains("profit margin")) {
            return RatioField.PROFIT_MARGIN;
        }
        if (label.contains("debt") && label.contains("equity")) {
            return RatioField.DEBT_TO_EQUITY;
        }
        if (label.contains("debt") && label.contains("asset")) {
            return RatioField.DEBT_TO_ASSETS;
        }
        if (label.contains("current ratio")) {
            return RatioField.CURRENT_RATIO;
        }
        if (label.contains("quick ratio")) {
            return RatioField.QUICK_RATIO;
        }
        if (label.contains("interest coverage")) {
            return RatioField.INTEREST_COVERAGE;
        }
        if (label.contains("revenue growth") || label.contains("sales growth")) {
            return RatioField.REVENUE_GROWTH;
        }
        if (label.contains("eps growth") || label.contains("earnings growth")) {
            return RatioField.EARNINGS_GROWTH;
        }
        if (label.contains("profit growth")) {
            return RatioField.PROFIT_GROWTH;
        }
        return null;
    }

    static StatementField statement(String label) {
        if (label.isEmpty()) {
            return null;
        }
        if (containsAny(label, "sales", "revenue", "turnover", "mark-up earned", "markup earned")
                && !label.contains("cost of") && !label.contains("growth")) {
            return StatementField.REVENUE;
        }
        if (containsAny(label, "profit after tax", "net profit", "net income", "profit/(loss)")) {
            return StatementField.NET_INCOME;
        }
        if (containsAny(label, "eps", "earning per share", "earnings per share")) {
            return label.contains("growth") ? null : StatementField.EPS;
        }
        if (label.contains("gross profit")) {
            return StatementField.GROSS_PROFIT;
        }
        if (label.contains("cost of") && containsAny(label, "revenue", "sales", "goods")) {
            return StatementField.COST_OF_REVENUE;
        }
        if (label.contains("operating") && containsAny(label, "profit", "income") && !label.contains("cash")) {
            return StatementField.OPERATING_INCOME;
        }
        if (label.contains("operating") && label.contains("expense")) {
            return StatementField.OPERATING_EXPENSES;
        }
        if (label.contains("ebitda")) {
            return StatementField.EBITDA;
        }
        if (label.contains("interest") && label.contains("expense")) {
            return StatementField.INTEREST_EXPENSE;
        }
        if (label.contains("total assets")) {
            return StatementField.TOTAL_ASSETS;
        }
        if (label.contains("current assets") && !label.contains("non")) {
            return StatementField.CURRENT_ASSETS;
        }
        if (label.contains("non") && label.contains("current") && label.contains("asset")) {
            return StatementField.NON_CURRENT_ASSETS;
        }
        if (label.contains("total liabilities")) {
            return StatementField.TOTAL_LIABILITIES;
        }
        if (label.contains("current liabilities") && !label.contains("non")) {
            return StatementField.CURRENT_LIABILITIES;
        }
        if (label.contains("non") && label.contains("current") && label.contains("liabilit")) {
            return StatementField.NON_CURRENT_LIABILITIES;
        }
        if (containsAny(label, "total equity", "shareholders equity", "shareholder")) {
            return StatementField.TOTAL_EQUITY;
        }
        if (containsAny(label, "operating", "operations") && label.contains("cash")) {
            return StatementField.OPERATING_CASH_FLOW;
        }
        if (label.contains("investing") && label.contains("cash")) {
            return StatementField.INVESTING_CASH_FLOW;
        }
        if (label.contains("financing") && label.contains("cash")) {
            return StatementField.FINANCING_CASH_FLOW;
        }
        if (label.contains("free cash flow")) {
            return StatementField.FREE_CASH_FLOW;
        }
        if (label.contains("net") && label.contains("cash") && label.contains("change")) {
            return StatementField.NET_CASH_CHANGE;
        }
        return null;
    }

    private static boolean containsAny(String label, String... fragments) {
        for (String fragment : fragments) {
            if (label.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
