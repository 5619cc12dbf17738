package com.marketbot.pk.model;

public final class FundamentalsData extends FieldSet<FundamentalField> {
    public FundamentalsData() {
        super(FundamentalField.class);
    }
}
