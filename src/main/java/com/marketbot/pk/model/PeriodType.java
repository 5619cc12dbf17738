package com.marketbot.pk.model;

public enum PeriodType {
    ANNUAL("annual"),
    QUARTERLY("quarterly");

    private final String code;

    PeriodType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
