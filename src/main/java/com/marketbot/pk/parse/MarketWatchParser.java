package com.marketbot.pk.parse;

import com.marketbot.pk.model.MarketWatchRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the market-watch listing table. Column layout:
 * symbol, sector code, listed in, LDCP, open, high, low, current, change, change %, volume.
 */
public final class MarketWatchParser {
    private static final Logger LOG = LogManager.getLogger(MarketWatchParser.class);
    private static final int MIN_CELLS = 10;

    public List<MarketWatchRow> parseListing(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        Element table = doc.selectFirst("table.tbl");
        if (table == null) {
            table = doc.selectFirst("table");
        }
        if (table == null) {
            throw new ListingParseException("market-watch page has no table");
        }

        // jsoup moves rows outside a thead into a tbody, so header rows are recognized by their th cells.
        List<MarketWatchRow> out = new ArrayList<>();
        int dropped = 0;
        int headers = 0;
        for (Element tr : table.select("tbody > tr")) {
            if (tr.selectFirst("th") != null) {
                headers++;
                continue;
            }
            MarketWatchRow row = parseRow(tr);
            if (row == null) {
                dropped++;
                continue;
            }
            out.add(row);
        }
        LOG.debug("market-watch rows parsed={}, dropped={}, header_rows={}", out.size(), dropped, headers);
        return out;
    }

    private MarketWatchRow parseRow(Element tr) {
        Elements cells = tr.select("td");
        if (cells.size() < MIN_CELLS) {
            return null;
        }
        Element first = cells.get(0);
        String symbol = firstNonBlank(first.attr("data-search"), first.attr("data-order"));
        if (symbol == null) {
            Element strong = first.selectFirst("strong");
            symbol = strong == null ? null : firstNonBlank(strong.text());
        }
        if (symbol == null) {
            return null;
        }
        symbol = symbol.trim();

        String name = symbol;
        Element anchor = first.selectFirst("a.tbl__symbol, a[data-title]");
        if (anchor != null) {
            String title = firstNonBlank(anchor.attr("data-title"));
            if (title != null) {
                name = Parser.unescapeEntities(title, false).trim();
            }
        }

        String sectorCode = firstNonBlank(cells.get(1).text());
        return MarketWatchRow.builder()
                .symbol(symbol)
                .name(name)
                .sectorCode(sectorCode)
                .sectorName(SectorCodes.nameOf(sectorCode))
                .listedIn(firstNonBlank(cells.get(2).text()))
                .ldcp(number(cells.get(3)))
                .open(number(cells.get(4)))
                .high(number(cells.get(5)))
                .low(number(cells.get(6)))
                .current(number(cells.get(7)))
                .change(number(cells.get(8)))
                .changePercent(number(cells.get(9)))
                .volume(cells.size() > 10 ? NumberParser.parseLong(cellValue(cells.get(10))) : null)
                .build();
    }

    private static Double number(Element cell) {
        return NumberParser.parse(cellValue(cell));
    }

    // data-order carries the raw sortable value; the visible text may be formatted.
    private static String cellValue(Element cell) {
        String order = firstNonBlank(cell.attr("data-order"));
        return order != null ? order : cell.text();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }
}
