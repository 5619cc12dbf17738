package com.marketbot.pk.commodity;

import com.marketbot.pk.model.CommodityRate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommodityRateParserTest {

    private final CommodityRateParser parser = new CommodityRateParser("gold.pk");

    @Test
    void parseGold_shouldMapUniquePricesToKarats() {
        String html = "<div class='goldratehome'>24K per Tola Rs. 469,000.00</div>"
                + "<div class='goldratehome'>24K per 10 Gram Rs. 402,100.00</div>"
                + "<div class='goldratehome'>24K per Gram Rs. 40,210.00</div>"
                + "<div class='goldratehome'>24K per Ounce Rs. 1,140,500.00</div>"
                + "<div class='goldratehome'>24K per Tola again Rs. 469,000.00</div>"
                + "<div class='single-defination'><p>22K Rs. 429,900.00</p><p>21K Rs. 410,375.00</p>"
                + "<p>18K Rs. 351,750.00</p></div>";

        List<CommodityRate> rates = parser.parseGold(html);

        // 40,210 is below the gold band and the repeated 469,000 is dropped.
        assertEquals(4, rates.size());
        assertEquals("Gold 24K (Per Tola)", rates.get(0).getName());
        assertEquals(469_000.0, rates.get(0).getPrice());
        assertEquals("Gold 22K (Per Tola)", rates.get(1).getName());
        assertEquals(429_900.0, rates.get(1).getPrice());
        assertEquals("Gold 21K (Per Tola)", rates.get(2).getName());
        assertEquals(410_375.0, rates.get(2).getPrice());
        assertEquals("Gold 18K (Per Tola)", rates.get(3).getName());
        assertEquals(351_750.0, rates.get(3).getPrice());
        assertEquals("gold.pk", rates.get(0).getSource());
    }

    @Test
    void parseGold_shouldReturnOnlyTolaRateWhenFewPricesFound() {
        List<CommodityRate> rates = parser.parseGold("<p>Today gold Rs. 470,500 per tola</p>");

        assertEquals(1, rates.size());
        assertEquals(470_500.0, rates.get(0).getPrice());
    }

    @Test
    void parseSilver_shouldReadProgressTableAndApplyBand() {
        String html = "<div class='progress-table-wrap'>Silver per Tola Rs. 5,250.00</div>"
                + "<div class='progress-table-wrap'>Silver per 10 Grams Rs. 4,501.00</div>"
                + "<div class='progress-table-wrap'>Silver per Gram Rs. 450.10</div>";

        List<CommodityRate> rates = parser.parseSilver(html);

        assertEquals(2, rates.size());
        assertEquals("Silver (Per Tola)", rates.get(0).getName());
        assertEquals(5_250.0, rates.get(0).getPrice());
        assertEquals("Silver (Per 10 Grams)", rates.get(1).getName());
        assertEquals(4_501.0, rates.get(1).getPrice());
    }

    @Test
    void parseSilver_shouldIgnorePricesOutsideBand() {
        assertTrue(parser.parseSilver("<p>Gold Rs. 469,000</p><p>Silver gram Rs. 450</p>").isEmpty());
        assertTrue(parser.parseSilver("").isEmpty());
    }
}
