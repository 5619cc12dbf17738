package com.marketbot.pk.writer;

import com.marketbot.pk.db.InMemoryStore;
import com.marketbot.pk.db.mybatis.StockHistoryParam;
import com.marketbot.pk.model.CompanyFullData;
import com.marketbot.pk.model.CompanyInfo;
import com.marketbot.pk.model.EquityData;
import com.marketbot.pk.model.EquityField;
import com.marketbot.pk.model.FinancialPeriod;
import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.FundamentalsData;
import com.marketbot.pk.model.MarketWatchRow;
import com.marketbot.pk.model.RatioField;
import com.marketbot.pk.model.RatiosData;
import com.marketbot.pk.model.StatementField;
import com.marketbot.pk.model.WriteCounts;
import com.marketbot.pk.parse.LogoResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketDataWriterTest {

    private static final LocalDate TRADE_DATE = LocalDate.of(2025, 3, 4);

    private InMemoryStore store;
    private MarketDataWriter writer;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        writer = new MarketDataWriter(store.companyDao, store.stockDao, store.historyDao, store.statementDao);
    }

    @Test
    void applyDaily_shouldWritePricesAndOneHistoryRowPerDay() {
        store.addCompany("ABC", "ABC");
        List<MarketWatchRow> rows = List.of(row("ABC", "ABC Cement", 101.5, 1_250_000L));

        WriteCounts first = writer.applyDaily(rows, TRADE_DATE);
        WriteCounts second = writer.applyDaily(rows, TRADE_DATE);

        assertEquals(1, first.pricesUpdated());
        assertEquals(1, first.historySaved());
        assertEquals(1, second.historySaved());
        assertEquals(1, store.history.size());

        Map<String, Object> stock = store.stockOf("ABC");
        assertEquals(101.5, stock.get("current_price"));
        assertEquals(100.0, stock.get("previous_close"));
        assertEquals(1_250_000L, stock.get("volume"));

        StockHistoryParam day = store.historyOf("ABC").get(0);
        assertEquals(TRADE_DATE, day.getDate());
        assertEquals(101.5, day.getClosePrice());
        assertEquals("ABC Cement", store.companies.get("ABC").name);
    }

    @Test
    void applyDaily_shouldNotOverwriteStoredValuesWithAbsentCells() {
        store.addCompany("IDLE", "Idle Textiles");
        store.stockOf("IDLE").put("current_price", 12.0);
        MarketWatchRow blank = MarketWatchRow.builder().symbol("IDLE").name("IDLE").ldcp(12.0).build();

        WriteCounts counts = writer.applyDaily(List.of(blank), TRADE_DATE);

        assertEquals(1, counts.pricesUpdated());
        assertEquals(12.0, store.stockOf("IDLE").get("current_price"));
        assertFalse(store.stockOf("IDLE").containsKey("volume"));
        assertNull(store.historyOf("IDLE").get(0).getClosePrice());
        // A row whose name is just the symbol never replaces the stored name.
        assertEquals("Idle Textiles", store.companies.get("IDLE").name);
    }

    @Test
    void applyDaily_shouldSkipUnknownSymbols() {
        store.addCompany("ABC", "ABC Cement");

        WriteCounts counts = writer.applyDaily(
                List.of(row("NEW", "New Listing", 10.0, 5L), row("ABC", "ABC Cement", 101.5, 1L)), TRADE_DATE);

        assertEquals(1, counts.skipped());
        assertEquals(1, counts.pricesUpdated());
        assertTrue(counts.errors().isEmpty());
        assertFalse(store.companies.containsKey("NEW"));
    }

    @Test
    void applyDaily_shouldIsolateFailingRow() {
        InMemoryStore.Company bad = store.addCompany("BAD", "Bad Co");
        store.addCompany("ABC", "ABC Cement");
        store.failingStocks.add(store.stockIdOf(bad));

        WriteCounts counts = writer.applyDaily(
                List.of(row("BAD", "Bad Co", 5.0, 1L), row("ABC", "ABC Cement", 101.5, 1L)), TRADE_DATE);

        assertEquals(1, counts.pricesUpdated());
        assertEquals(List.of("BAD price: deadlock detected"), counts.errors());
        assertEquals(101.5, store.stockOf("ABC").get("current_price"));
    }

    @Test
    void applyFull_shouldWriteIdentityFundamentalsAndStatements() {
        store.addCompany("ABC", "ABC").logoUrl = LogoResolver.placeholderUrl("ABC");

        WriteCounts counts = writer.applyFull(List.of(fullData("ABC")));

        InMemoryStore.Company abc = store.companies.get("ABC");
        assertEquals("ABC Cement Limited", abc.name);
        assertEquals("Cement", abc.sector);
        assertEquals("https://dps.psx.com.pk/images/abc.png", abc.logoUrl);

        Map<String, Object> stock = store.stockOf("ABC");
        assertEquals(8.4, stock.get("pe_ratio"));
        assertEquals(18.5, stock.get("roe"));
        assertEquals(12.5e9, stock.get("market_cap"));
        assertEquals(100_000_000L, stock.get("shares_outstanding"));
        // Page price fills a stock that never had a listing price.
        assertEquals(101.5, stock.get("current_price"));
        assertFalse(stock.containsKey("change_amount"));

        assertEquals(1, counts.companiesUpdated());
        assertEquals(1, counts.fundamentalsUpdated());
        assertEquals(2, counts.financialsSaved());
        assertEquals(2, store.statements.size());
        assertEquals(1000.0, store.statements.get(abc.id + "|annual:2024:-").get("revenue"));
        assertEquals(260.0, store.statements.get(abc.id + "|quarterly:2025:1").get("revenue"));
    }

    @Test
    void applyFull_shouldKeepListingPriceAndRealLogo() {
        InMemoryStore.Company abc = store.addCompany("ABC", "ABC Cement Limited");
        abc.logoUrl = "https://logo.clearbit.com/abc.com.pk";
        store.stockOf("ABC").put("current_price", 99.0);

        writer.applyFull(List.of(fullData("ABC")));

        assertEquals(99.0, store.stockOf("ABC").get("current_price"));
        assertEquals("https://logo.clearbit.com/abc.com.pk", abc.logoUrl);
    }

    @Test
    void applyFull_shouldUpdateExistingPeriodInsteadOfDuplicating() {
        store.addCompany("ABC", "ABC");

        writer.applyFull(List.of(fullData("ABC")));
        writer.applyFull(List.of(fullData("ABC")));

        assertEquals(2, store.statements.size());
    }

    @Test
    void applyFull_shouldReportFundamentalsFailureAndStillSaveStatements() {
        InMemoryStore.Company abc = store.addCompany("ABC", "ABC");
        store.failingStocks.add(store.stockIdOf(abc));

        WriteCounts counts = writer.applyFull(List.of(fullData("ABC")));

        assertEquals(List.of("ABC fundamentals: deadlock detected"), counts.errors());
        assertEquals(2, counts.financialsSaved());
    }

    @Test
    void applyFull_shouldSkipCompaniesNotInDatabase() {
        WriteCounts counts = writer.applyFull(List.of(fullData("ZZZ")));

        assertEquals(1, counts.skipped());
        assertEquals(0, store.stockUpdateCalls);
    }

    private static MarketWatchRow row(String symbol, String name, double current, long volume) {
        return MarketWatchRow.builder()
                .symbol(symbol)
                .name(name)
                .ldcp(100.0)
                .open(100.5)
                .high(102.0)
                .low(99.75)
                .current(current)
                .change(current - 100.0)
                .changePercent(1.5)
                .volume(volume)
                .build();
    }

    private static CompanyFullData fullData(String symbol) {
        CompanyInfo info = new CompanyInfo(symbol);
        info.setNameIfAbsent("ABC Cement Limited");
        info.setSectorIfAbsent("Cement");
        info.setLogoUrlIfAbsent("https://dps.psx.com.pk/images/abc.png");

        FundamentalsData fundamentals = new FundamentalsData();
        fundamentals.setIfAbsent(FundamentalField.CURRENT_PRICE, 101.5);
        fundamentals.setIfAbsent(FundamentalField.PE_RATIO, 8.4);

        RatiosData ratios = new RatiosData();
        ratios.setIfAbsent(RatioField.ROE, 18.5);

        EquityData equity = new EquityData();
        equity.setIfAbsent(EquityField.MARKET_CAP, 12.5e9);
        equity.setIfAbsent(EquityField.SHARES_OUTSTANDING, 1e8);
        equity.setIfAbsent(EquityField.FREE_FLOAT_PCT, 35.0);

        FinancialPeriod fy2024 = FinancialPeriod.annual(2024);
        fy2024.setIfAbsent(StatementField.REVENUE, 1000.0);
        FinancialPeriod q1 = FinancialPeriod.quarterly(2025, 1);
        q1.setIfAbsent(StatementField.REVENUE, 260.0);

        return new CompanyFullData(symbol, info, fundamentals, ratios, List.of(fy2024, q1), equity);
    }
}
