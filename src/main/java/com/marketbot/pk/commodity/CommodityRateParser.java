package com.marketbot.pk.commodity;

import com.marketbot.pk.model.CommodityRate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads per-tola gold and silver rates from the gold.pk rate pages.
 */
public final class CommodityRateParser {
    private static final Pattern PRICE = Pattern.compile("Rs\\.\\s*([\\d,]+\\.?\\d*)");

    private static final Pattern DIGITS = Pattern.compile("\\d+(\\.\\d*)?");

    private static final String GOLD_CONTAINERS = ".goldratehome, .single-defination p";
    private static final String SILVER_CONTAINERS = ".goldratehome, .single-defination p, .progress-table-wrap";

    private static final double GOLD_MIN = 100_000d;
    private static final double SILVER_MIN = 1_000d;
    private static final double SILVER_MAX = 50_000d;

    // The page lists 24K tola, 10g and 1g first, then the lower karats per tola.
    private static final Map<Integer, String> GOLD_SLOTS = new TreeMap<>(Map.of(
            0, "Gold 24K (Per Tola)",
            3, "Gold 22K (Per Tola)",
            4, "Gold 21K (Per Tola)",
            5, "Gold 18K (Per Tola)"
    ));
    private static final Map<Integer, String> SILVER_SLOTS = new TreeMap<>(Map.of(
            0, "Silver (Per Tola)",
            1, "Silver (Per 10 Grams)"
    ));

    private final String source;

    public CommodityRateParser(String source) {
        this.source = source == null ? "gold.pk" : source;
    }

    public List<CommodityRate> parseGold(String html) {
        List<Double> prices = extractPrices(html, GOLD_CONTAINERS, GOLD_MIN, Double.MAX_VALUE);
        return assign(prices, GOLD_SLOTS);
    }

    public List<CommodityRate> parseSilver(String html) {
        List<Double> prices = extractPrices(html, SILVER_CONTAINERS, SILVER_MIN, SILVER_MAX);
        return assign(prices, SILVER_SLOTS);
    }

    /**
     * First price of each rate container; the whole page text when no container yields one.
     * Duplicates and values outside the open band {@code (min, max)} are dropped, order kept.
     */
    static List<Double> extractPrices(String html, String containers, double min, double max) {
        if (html == null || html.trim().isEmpty()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html);
        Set<Double> unique = new LinkedHashSet<>();
        for (Element container : doc.select(containers)) {
            Matcher m = PRICE.matcher(container.text());
            if (m.find()) {
                addInBand(unique, m.group(1), min, max);
            }
        }
        if (unique.isEmpty()) {
            Matcher m = PRICE.matcher(html);
            while (m.find()) {
                addInBand(unique, m.group(1), min, max);
            }
        }
        return new ArrayList<>(unique);
    }

    private static void addInBand(Set<Double> out, String raw, double min, double max) {
        String cleaned = raw.replace(",", "");
        if (!DIGITS.matcher(cleaned).matches()) {
            return;
        }
        double value = Double.parseDouble(cleaned);
        if (value > min && value < max) {
            out.add(value);
        }
    }

    private List<CommodityRate> assign(List<Double> prices, Map<Integer, String> slots) {
        List<CommodityRate> out = new ArrayList<>();
        for (Map.Entry<Integer, String> slot : slots.entrySet()) {
            if (slot.getKey() < prices.size()) {
                out.add(new CommodityRate(slot.getValue(), prices.get(slot.getKey()), source));
            }
        }
        return out;
    }
}
