package com.marketbot.pk.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tally of one writer pass.
 */
public final class WriteCounts {
    private int pricesUpdated;
    private int historySaved;
    private int companiesUpdated;
    private int fundamentalsUpdated;
    private int financialsSaved;
    private int skipped;
    private final List<String> errors = new ArrayList<>();

    public void incPricesUpdated() {
        pricesUpdated++;
    }

    public void incHistorySaved() {
        historySaved++;
    }

    public void incCompaniesUpdated() {
        companiesUpdated++;
    }

    public void incFundamentalsUpdated() {
        fundamentalsUpdated++;
    }

    public void incFinancialsSaved() {
        financialsSaved++;
    }

    public void incSkipped() {
        skipped++;
    }

    public void record(WriteOutcome outcome) {
        if (outcome != null && !outcome.success) {
            errors.add(outcome.error);
        }
    }

    public int pricesUpdated() {
        return pricesUpdated;
    }

    public int historySaved() {
        return historySaved;
    }

    public int companiesUpdated() {
        return companiesUpdated;
    }

    public int fundamentalsUpdated() {
        return fundamentalsUpdated;
    }

    public int financialsSaved() {
        return financialsSaved;
    }

    public int skipped() {
        return skipped;
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public String toString() {
        return "WriteCounts{prices=" + pricesUpdated
                + ", history=" + historySaved
                + ", companies=" + companiesUpdated
                + ", fundamentals=" + fundamentalsUpdated
                + ", financials=" + financialsSaved
                + ", skipped=" + skipped
                + ", errors=" + errors.size() + "}";
    }
}
