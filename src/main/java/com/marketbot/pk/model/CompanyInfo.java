package com.marketbot.pk.model;

import lombok.Getter;

/**
 * Identity fields from a company page. Blank strings count as absent.
 */
@Getter
public final class CompanyInfo {
    private final String symbol;
    private String name;
    private String description;
    private String sector;
    private String logoUrl;

    public CompanyInfo(String symbol) {
        this.symbol = symbol;
    }

    public boolean setNameIfAbsent(String value) {
        if (name != null || isBlank(value)) {
            return false;
        }
        name = value.trim();
        return true;
    }

    public boolean setDescriptionIfAbsent(String value) {
        if (description != null || isBlank(value)) {
            return false;
        }
        description = value.trim();
        return true;
    }

    public boolean setSectorIfAbsent(String value) {
        if (sector != null || isBlank(value)) {
            return false;
        }
        sector = value.trim();
        return true;
    }

    public boolean setLogoUrlIfAbsent(String value) {
        if (logoUrl != null || isBlank(value)) {
            return false;
        }
        logoUrl = value.trim();
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "CompanyInfo{symbol=" + symbol + ", name=" + name + ", sector=" + sector + ", logo=" + logoUrl + "}";
    }
}
