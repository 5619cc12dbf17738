package com.marketbot.pk.model;

public final class RatiosData extends FieldSet<RatioField> {
    public RatiosData() {
        super(RatioField.class);
    }
}
