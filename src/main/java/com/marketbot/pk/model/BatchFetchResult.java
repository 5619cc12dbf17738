package com.marketbot.pk.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed companies in input order, plus one error line per symbol that failed.
 */
public final class BatchFetchResult {
    public final Map<String, CompanyFullData> companies;
    public final List<String> errors;
    public final boolean interrupted;

    public BatchFetchResult(Map<String, CompanyFullData> companies, List<String> errors, boolean interrupted) {
        this.companies = Collections.unmodifiableMap(new LinkedHashMap<>(companies));
        this.errors = List.copyOf(errors);
        this.interrupted = interrupted;
    }
}
