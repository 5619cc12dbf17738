package com.marketbot.pk.parse;

import com.marketbot.pk.model.CompanyFullData;
import com.marketbot.pk.model.CompanyInfo;
import com.marketbot.pk.model.EquityData;
import com.marketbot.pk.model.EquityField;
import com.marketbot.pk.model.FinancialPeriod;
import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.FundamentalsData;
import com.marketbot.pk.model.PeriodType;
import com.marketbot.pk.model.RatioField;
import com.marketbot.pk.model.RatiosData;
import com.marketbot.pk.model.StatementField;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a company detail page into identity, fundamentals, ratios, statements and equity.
 * Each section is read independently; a section that cannot be read comes back partially filled.
 * Every field keeps the first non-empty value found.
 */
public final class CompanyPageParser {
    private static final Logger LOG = LogManager.getLogger(CompanyPageParser.class);

    private static final int MAX_DESCRIPTION = 1000;
    private static final String STAT_BLOCKS = ".quote__stat, .stats__item, .info__row";
    private static final String STAT_LABELS = ".stat__label, .info__label, label";
    private static final String STAT_VALUES = ".stat__value, .info__value";
    private static final String EQUITY_BLOCKS = ".stat, .info__row, [class*='stat']";
    private static final String EQUITY_LABELS = "label, .stat__label, .info__label, span:first-child";
    private static final String EQUITY_VALUES = ".stat__value, .info__value, span:last-child";

    private static final Pattern QUOTE_CHANGE = Pattern.compile(
            "([+-]?\\d[\\d,]*\\.?\\d*)\\s*\\(\\s*([+-]?\\d+\\.?\\d*)\\s*%\\s*\\)");
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");
    private static final Pattern QUARTER_THEN_YEAR = Pattern.compile(
            "(?i)(?<![a-z])Q([1-4])\\s*-?\\s*((?:19|20)\\d{2})(?!\\d)");
    private static final Pattern YEAR_THEN_QUARTER = Pattern.compile(
            "(?i)(?<!\\d)((?:19|20)\\d{2})\\s*-?\\s*Q([1-4])(?!\\d)");

    private static final List<TextPattern> TEXT_PATTERNS = List.of(
            new TextPattern("Market\\s*Cap[:\\s]+Rs\\.?\\s*([\\d,.]+)", FundamentalField.MARKET_CAP),
            new TextPattern("P/E\\s*(?:Ratio)?[:\\s]+([\\d,.]+)", FundamentalField.PE_RATIO),
            new TextPattern("EPS[:\\s]+Rs\\.?\\s*(-?[\\d,.]+)", FundamentalField.EPS),
            new TextPattern("Dividend\\s*Yield[:\\s]+([\\d,.]+)%?", FundamentalField.DIVIDEND_YIELD),
            new TextPattern("52[- ]?Week\\s*High[:\\s]+Rs\\.?\\s*([\\d,.]+)", FundamentalField.WEEK_52_HIGH),
            new TextPattern("52[- ]?Week\\s*Low[:\\s]+Rs\\.?\\s*([\\d,.]+)", FundamentalField.WEEK_52_LOW),
            new TextPattern("Shares\\s*Outstanding[:\\s]+([\\d,.]+)", FundamentalField.SHARES_OUTSTANDING),
            new TextPattern("Free\\s*Float[:\\s]+([\\d,.]++)(?!\\s*%)", FundamentalField.FLOAT_SHARES)
    );

    private final LogoResolver logoResolver;

    public CompanyPageParser(LogoResolver logoResolver) {
        this.logoResolver = logoResolver;
    }

    public CompanyFullData parseCompanyPage(String html, String symbol) {
        String sym = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        Document doc = Jsoup.parse(html == null ? "" : html);
        return new CompanyFullData(
                sym,
                parseInfo(doc, sym),
                parseFundamentals(doc),
                parseRatios(doc),
                parseFinancials(doc, sym),
                parseEquity(doc)
        );
    }

    CompanyInfo parseInfo(Document doc, String symbol) {
        CompanyInfo info = new CompanyInfo(symbol);
        try {
            Element name = doc.selectFirst(".quote__name");
            if (name != null) {
                info.setNameIfAbsent(Parser.unescapeEntities(clean(name.text()), false));
            }
            Element about = doc.selectFirst(".company__about, .company__description, .profile__text");
            if (about != null) {
                String text = clean(about.text());
                info.setDescriptionIfAbsent(text.length() > MAX_DESCRIPTION ? text.substring(0, MAX_DESCRIPTION) : text);
            }
            Element sector = doc.selectFirst("a[href*='/sector/']");
            if (sector != null) {
                info.setSectorIfAbsent(clean(sector.text()));
            }
        } catch (RuntimeException e) {
            LOG.debug("identity section unreadable for {}: {}", symbol, e.toString());
        }
        info.setLogoUrlIfAbsent(logoResolver.resolve(doc, symbol));
        return info;
    }

    FundamentalsData parseFundamentals(Document doc) {
        FundamentalsData f = new FundamentalsData();
        try {
            Element close = doc.selectFirst(".quote__close");
            if (close != null) {
                f.setIfAbsent(FundamentalField.CURRENT_PRICE, NumberParser.parse(close.text()));
            }
            Element change = doc.selectFirst(".quote__change");
            if (change != null) {
                Matcher m = QUOTE_CHANGE.matcher(clean(change.text()));
                if (m.find()) {
                    f.setIfAbsent(FundamentalField.CHANGE_AMOUNT, NumberParser.parse(m.group(1)));
                    f.setIfAbsent(FundamentalField.CHANGE_PERCENTAGE, NumberParser.parse(m.group(2)));
                }
            }

            for (LabelValue pair : labelPairs(doc)) {
                FundamentalField field = LabelMatcher.fundamental(pair.label);
                if (field == null) {
                    continue;
                }
                // A percentage float belongs to the equity section, not the share count.
                if (field == FundamentalField.FLOAT_SHARES && pair.value.contains("%")) {
                    continue;
                }
                f.setIfAbsent(field, numeric(field.integral(), pair.value));
            }

            String text = doc.text();
            for (TextPattern tp : TEXT_PATTERNS) {
                if (f.isSet(tp.field)) {
                    continue;
                }
                Matcher m = tp.pattern.matcher(text);
                if (m.find()) {
                    f.setIfAbsent(tp.field, numeric(tp.field.integral(), m.group(1)));
                }
            }
        } catch (RuntimeException e) {
            LOG.debug("fundamentals section unreadable: {}", e.toString());
        }
        return f;
    }

    RatiosData parseRatios(Document doc) {
        RatiosData r = new RatiosData();
        try {
            for (LabelValue pair : labelPairs(doc)) {
                RatioField field = LabelMatcher.ratio(pair.label);
                if (field != null) {
                    r.setIfAbsent(field, NumberParser.parse(pair.value));
                }
            }
        } catch (RuntimeException e) {
            LOG.debug("ratios section unreadable: {}", e.toString());
        }
        return r;
    }

    List<FinancialPeriod> parseFinancials(Document doc, String symbol) {
        Map<String, FinancialPeriod> periods = new LinkedHashMap<>();
        try {
            for (Element table : doc.select("table")) {
                collectStatementTable(table, periods);
            }
        } catch (RuntimeException e) {
            LOG.debug("statements unreadable for {}: {}", symbol, e.toString());
        }
        List<FinancialPeriod> out = new ArrayList<>();
        for (FinancialPeriod period : periods.values()) {
            if (!period.isEmpty()) {
                out.add(period);
            }
        }
        return out;
    }

    private void collectStatementTable(Element table, Map<String, FinancialPeriod> periods) {
        Element header = headerRow(table);
        List<PeriodColumn> columns = periodColumns(table);
        if (header == null || columns.isEmpty()) {
            return;
        }

        for (Element row : table.select("tr")) {
            if (row == header || row.parent() != null && "thead".equals(row.parent().tagName())) {
                continue;
            }
            Elements cells = row.select("td, th");
            if (cells.size() < 2) {
                continue;
            }
            StatementField field = LabelMatcher.statement(LabelMatcher.normalize(cells.get(0).text()));
            if (field == null) {
                continue;
            }
            for (PeriodColumn column : columns) {
                if (column.index >= cells.size()) {
                    continue;
                }
                String key = FinancialPeriod.key(column.type, column.year, column.quarter);
                FinancialPeriod period = periods.computeIfAbsent(
                        key, k -> new FinancialPeriod(column.type, column.year, column.quarter));
                period.setIfAbsent(field, NumberParser.parse(cells.get(column.index).text()));
            }
        }
    }

    private static Element headerRow(Element table) {
        Element header = table.selectFirst("thead tr");
        return header != null ? header : table.selectFirst("tr");
    }

    /**
     * Period columns of a statement table; empty for any other table.
     */
    private static List<PeriodColumn> periodColumns(Element table) {
        List<PeriodColumn> columns = new ArrayList<>();
        Element header = headerRow(table);
        if (header == null) {
            return columns;
        }
        Elements headerCells = header.select("th, td");
        // The first cell labels the rows.
        for (int i = 1; i < headerCells.size(); i++) {
            PeriodColumn column = periodColumn(i, clean(headerCells.get(i).text()));
            if (column != null) {
                columns.add(column);
            }
        }
        return columns;
    }

    static PeriodColumn periodColumn(int index, String header) {
        if (header == null || header.isEmpty()) {
            return null;
        }
        Matcher qy = QUARTER_THEN_YEAR.matcher(header);
        if (qy.find()) {
            return new PeriodColumn(index, PeriodType.QUARTERLY, Integer.parseInt(qy.group(2)), Integer.parseInt(qy.group(1)));
        }
        Matcher yq = YEAR_THEN_QUARTER.matcher(header);
        if (yq.find()) {
            return new PeriodColumn(index, PeriodType.QUARTERLY, Integer.parseInt(yq.group(1)), Integer.parseInt(yq.group(2)));
        }
        Matcher y = YEAR.matcher(header);
        if (y.find()) {
            return new PeriodColumn(index, PeriodType.ANNUAL, Integer.parseInt(y.group(1)), null);
        }
        return null;
    }

    EquityData parseEquity(Document doc) {
        EquityData eq = new EquityData();
        try {
            for (Element table : doc.select("table")) {
                for (Element row : table.select("tr")) {
                    Elements cells = row.select("td, th");
                    if (cells.size() < 2) {
                        continue;
                    }
                    mapEquity(eq, LabelMatcher.normalize(cells.get(0).text()), clean(cells.last().text()));
                }
            }
            for (Element block : doc.select(EQUITY_BLOCKS)) {
                Element label = block.selectFirst(EQUITY_LABELS);
                Element value = statValue(block, EQUITY_VALUES, label);
                if (label != null && value != null) {
                    mapEquity(eq, LabelMatcher.normalize(label.text()), clean(value.text()));
                }
            }
        } catch (RuntimeException e) {
            LOG.debug("equity section unreadable: {}", e.toString());
        }
        return eq;
    }

    private static void mapEquity(EquityData eq, String label, String value) {
        if (label.isEmpty() || value.isEmpty()) {
            return;
        }
        if (label.contains("market cap")) {
            eq.setIfAbsent(EquityField.MARKET_CAP, NumberParser.parse(value));
        } else if (label.contains("shares") && (label.contains("outstanding") || label.contains("total"))) {
            eq.setIfAbsent(EquityField.SHARES_OUTSTANDING, numeric(true, value));
        } else if (label.contains("free float")) {
            if (value.contains("%")) {
                eq.setIfAbsent(EquityField.FREE_FLOAT_PCT, NumberParser.parse(value));
            } else {
                eq.setIfAbsent(EquityField.FREE_FLOAT_SHARES, numeric(true, value));
            }
        }
    }

    /**
     * Label/value pairs from table rows (first and last cell), definition lists and stat blocks,
     * in that order.
     */
    private static List<LabelValue> labelPairs(Document doc) {
        List<LabelValue> out = new ArrayList<>();
        for (Element table : doc.select("table")) {
            if (!periodColumns(table).isEmpty()) {
                continue;
            }
            for (Element row : table.select("tr")) {
                Elements cells = row.select("td, th");
                if (cells.size() >= 2) {
                    add(out, cells.first().text(), cells.last().text());
                }
            }
        }
        for (Element dl : doc.select("dl")) {
            Elements dts = dl.select("dt");
            Elements dds = dl.select("dd");
            int n = Math.min(dts.size(), dds.size());
            for (int i = 0; i < n; i++) {
                add(out, dts.get(i).text(), dds.get(i).text());
            }
        }
        for (Element block : doc.select(STAT_BLOCKS)) {
            Element label = block.selectFirst(STAT_LABELS);
            Element value = statValue(block, STAT_VALUES, label);
            if (label != null && value != null) {
                add(out, label.text(), value.text());
            }
        }
        return out;
    }

    /**
     * The block's value element: a dedicated value class first, else the first span that is not
     * the label and does not sit inside it.
     */
    static Element statValue(Element block, String valueSelector, Element label) {
        Element value = block.selectFirst(valueSelector);
        if (value != null && value != label) {
            return value;
        }
        for (Element span : block.select("span")) {
            if (label == null || (span != label && !span.parents().contains(label) && !label.parents().contains(span))) {
                return span;
            }
        }
        return null;
    }

    private static void add(List<LabelValue> out, String label, String value) {
        String l = LabelMatcher.normalize(label);
        String v = clean(value);
        if (!l.isEmpty() && !v.isEmpty()) {
            out.add(new LabelValue(l, v));
        }
    }

    private static Double numeric(boolean integral, String value) {
        Double parsed = NumberParser.parse(value);
        if (parsed == null || !integral) {
            return parsed;
        }
        return (double) Math.round(parsed);
    }

    private static String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    }

    static final class PeriodColumn {
        final int index;
        final PeriodType type;
        final int year;
        final Integer quarter;

        PeriodColumn(int index, PeriodType type, int year, Integer quarter) {
            this.index = index;
            this.type = type;
            this.year = year;
            this.quarter = quarter;
        }
    }

    private static final class LabelValue {
        final String label;
        final String value;

        LabelValue(String label, String value) {
            this.label = label;
            this.value = value;
        }
    }

    private static final class TextPattern {
        final Pattern pattern;
        final FundamentalField field;

        TextPattern(String regex, FundamentalField field) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            this.field = field;
        }
    }
}
