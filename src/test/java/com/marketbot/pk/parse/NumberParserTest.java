package com.marketbot.pk.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class NumberParserTest {

    @Test
    void parse_shouldStripCurrencyAndThousandsSeparators() {
        assertEquals(1234.5, NumberParser.parse("Rs. 1,234.50"));
        assertEquals(1234.5, NumberParser.parse("Rs1,234.50"));
        assertEquals(99.0, NumberParser.parse("PKR 99"));
        assertEquals(7.25, NumberParser.parse("$7.25"));
    }

    @Test
    void parse_shouldTreatParenthesesAsNegative() {
        assertEquals(-12.3, NumberParser.parse("(12.3)"));
        assertEquals(-1500.0, NumberParser.parse("(1,500)"));
    }

    @Test
    void parse_shouldTreatParenthesesAsNegativeOnEitherSideOfCurrency() {
        assertEquals(-12.3, NumberParser.parse("Rs. (12.3)"));
        assertEquals(-1234.0, NumberParser.parse("PKR (1,234)"));
        assertEquals(-12.3, NumberParser.parse("(Rs. 12.3)"));
        assertNull(NumberParser.parse("Rs. ()"));
    }

    @Test
    void parse_shouldApplyMagnitudeSuffixes() {
        assertEquals(2.5e9, NumberParser.parse("2.5B"));
        assertEquals(3e6, NumberParser.parse("3m"));
        assertEquals(12e3, NumberParser.parse("12K"));
        assertEquals(4e5, NumberParser.parse("4 Lakh"));
        assertEquals(1.5e7, NumberParser.parse("1.5 Cr"));
        assertEquals(2e7, NumberParser.parse("2 crore"));
    }

    @Test
    void parse_shouldDropPercentSign() {
        assertEquals(-0.75, NumberParser.parse("-0.75%"));
        assertEquals(12.0, NumberParser.parse("12 %"));
    }

    @Test
    void parse_shouldReturnNullForAbsentMarkers() {
        assertNull(NumberParser.parse(null));
        assertNull(NumberParser.parse(""));
        assertNull(NumberParser.parse("   "));
        assertNull(NumberParser.parse("-"));
        assertNull(NumberParser.parse("--"));
        assertNull(NumberParser.parse("N/A"));
        assertNull(NumberParser.parse("n/a"));
        assertNull(NumberParser.parse("None"));
        assertNull(NumberParser.parse("null"));
    }

    @Test
    void parse_shouldReturnNullForGarbage() {
        assertNull(NumberParser.parse("abc"));
        assertNull(NumberParser.parse("12x"));
        assertNull(NumberParser.parse("1.2.3"));
    }

    @Test
    void parse_shouldKeepZeroDistinctFromAbsent() {
        assertEquals(0.0, NumberParser.parse("0"));
        assertEquals(0.0, NumberParser.parse("0.00"));
    }

    @Test
    void parseLong_shouldRound() {
        assertEquals(1_234_568L, NumberParser.parseLong("1,234,567.6"));
        assertNull(NumberParser.parseLong("-"));
    }
}
