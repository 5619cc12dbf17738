package com.marketbot.pk.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Numeric record whose fields are filled first-write-wins while a page is parsed.
 * A missing key means "no data", which is different from a stored zero.
 */
public abstract class FieldSet<F extends Enum<F> & ColumnField> {
    private final EnumMap<F, Double> values;

    protected FieldSet(Class<F> type) {
        this.values = new EnumMap<>(type);
    }

    /**
     * Stores {@code value} only if the field has no value yet.
     *
     * @return true when the value was stored
     */
    public boolean setIfAbsent(F field, Double value) {
        if (field == null || value == null || value.isNaN() || value.isInfinite()) {
            return false;
        }
        if (values.containsKey(field)) {
            return false;
        }
        values.put(field, value);
        return true;
    }

    public Double get(F field) {
        return values.get(field);
    }

    public Long getLong(F field) {
        Double value = values.get(field);
        return value == null ? null : Math.round(value);
    }

    public boolean isSet(F field) {
        return values.containsKey(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<F, Double> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values;
    }
}
