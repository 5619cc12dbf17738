package com.marketbot.pk.parse;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric normalization shared by every parser. Returns null for anything that does not carry a value,
 * so "no data" never turns into 0.
 */
public final class NumberParser {
    private static final Set<String> ABSENT_TOKENS = Set.of("", "-", "--", "n/a", "na", "none", "null", "nil");
    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^(?i)(rs\\.?|pkr|\\$)\\s*");
    private static final Pattern NUMBER_WITH_SUFFIX = Pattern.compile(
            "^([+-]?(?:\\d+\\.?\\d*|\\.\\d+))(crore|cr|lakh|lac|l|b|m|k)?$",
            Pattern.CASE_INSENSITIVE
    );

    private NumberParser() {
    }

    public static Double parse(String text) {
        if (text == null) {
            return null;
        }
        String s = text.replace('\u00a0', ' ').trim();
        if (ABSENT_TOKENS.contains(s.toLowerCase(Locale.ROOT))) {
            return null;
        }

        // Accounting negatives appear both as "(Rs. 12)" and "Rs. (12)".
        boolean negative = isParenthesized(s);
        if (negative) {
            s = s.substring(1, s.length() - 1).trim();
        }
        s = CURRENCY_PREFIX.matcher(s).replaceFirst("").trim();
        if (!negative && isParenthesized(s)) {
            negative = true;
            s = s.substring(1, s.length() - 1).trim();
        }
        s = s.replace(",", "").replace("%", "").replaceAll("\\s+", "");
        if (ABSENT_TOKENS.contains(s.toLowerCase(Locale.ROOT))) {
            return null;
        }

        Matcher m = NUMBER_WITH_SUFFIX.matcher(s);
        if (!m.matches()) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        value *= multiplier(m.group(2));
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return negative ? -value : value;
    }

    public static Long parseLong(String text) {
        Double value = parse(text);
        return value == null ? null : Math.round(value);
    }

    private static boolean isParenthesized(String s) {
        return s.length() > 2 && s.startsWith("(") && s.endsWith(")");
    }

    private static double multiplier(String suffix) {
        if (suffix == null) {
            return 1.0;
        }
        switch (suffix.toLowerCase(Locale.ROOT)) {
            case "k":
                return 1e3;
            case "m":
                return 1e6;
            case "b":
                return 1e9;
            case "l":
            case "lac":
            case "lakh":
                return 1e5;
            case "cr":
            case "crore":
                return 1e7;
            default:
                return 1.0;
        }
    }
}
