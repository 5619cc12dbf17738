package com.marketbot.pk.model;

import java.util.Objects;

/**
 * Statement line items for one reporting period. Quarter is null for annual periods.
 */
public final class FinancialPeriod extends FieldSet<StatementField> {
    private final PeriodType periodType;
    private final int fiscalYear;
    private final Integer quarter;

    public FinancialPeriod(PeriodType periodType, int fiscalYear, Integer quarter) {
        super(StatementField.class);
        this.periodType = Objects.requireNonNull(periodType, "periodType");
        this.fiscalYear = fiscalYear;
        this.quarter = periodType == PeriodType.ANNUAL ? null : quarter;
    }

    public static FinancialPeriod annual(int fiscalYear) {
        return new FinancialPeriod(PeriodType.ANNUAL, fiscalYear, null);
    }

    public static FinancialPeriod quarterly(int fiscalYear, int quarter) {
        return new FinancialPeriod(PeriodType.QUARTERLY, fiscalYear, quarter);
    }

    public PeriodType periodType() {
        return periodType;
    }

    public int fiscalYear() {
        return fiscalYear;
    }

    public Integer quarter() {
        return quarter;
    }

    public String key() {
        return key(periodType, fiscalYear, quarter);
    }

    public static String key(PeriodType type, int fiscalYear, Integer quarter) {
        return type.code() + ":" + fiscalYear + ":" + (quarter == null ? "-" : quarter);
    }

    @Override
    public String toString() {
        return "FinancialPeriod{" + key() + ", " + values() + "}";
    }
}
