package com.marketbot.pk.writer;

import com.marketbot.pk.db.CompanyDao;
import com.marketbot.pk.db.FinancialStatementDao;
import com.marketbot.pk.db.StockDao;
import com.marketbot.pk.db.StockHistoryDao;
import com.marketbot.pk.db.mybatis.CompanyRow;
import com.marketbot.pk.db.mybatis.StockHistoryParam;
import com.marketbot.pk.model.CompanyFullData;
import com.marketbot.pk.model.CompanyInfo;
import com.marketbot.pk.model.EquityField;
import com.marketbot.pk.model.FinancialPeriod;
import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.MarketWatchRow;
import com.marketbot.pk.model.RatioField;
import com.marketbot.pk.model.WriteCounts;
import com.marketbot.pk.model.WriteOutcome;
import com.marketbot.pk.parse.LogoResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists parsed listing rows and company pages. Every write is keyed by a natural key, so
 * applying the same input twice leaves the same rows behind. Null values are never written.
 */
public class MarketDataWriter {
    private static final Logger LOG = LogManager.getLogger(MarketDataWriter.class);

    private final CompanyDao companyDao;
    private final StockDao stockDao;
    private final StockHistoryDao historyDao;
    private final FinancialStatementDao statementDao;

    public MarketDataWriter(
            CompanyDao companyDao,
            StockDao stockDao,
            StockHistoryDao historyDao,
            FinancialStatementDao statementDao
    ) {
        this.companyDao = companyDao;
        this.stockDao = stockDao;
        this.historyDao = historyDao;
        this.statementDao = statementDao;
    }

    public WriteCounts applyDaily(List<MarketWatchRow> rows, LocalDate tradeDate) {
        WriteCounts counts = new WriteCounts();
        if (rows == null) {
            return counts;
        }
        for (MarketWatchRow row : rows) {
            counts.record(applyDailyRow(row, tradeDate, counts));
        }
        LOG.info("daily write {}: {}", tradeDate, counts);
        return counts;
    }

    private WriteOutcome applyDailyRow(MarketWatchRow row, LocalDate tradeDate, WriteCounts counts) {
        String symbol = row.getSymbol();
        try {
            Optional<CompanyRow> company = companyDao.findBySymbol(symbol);
            if (company.isEmpty()) {
                counts.incSkipped();
                return WriteOutcome.ok(symbol);
            }
            Optional<Long> stockId = stockDao.findIdByCompany(company.get().getId());
            if (stockId.isEmpty()) {
                counts.incSkipped();
                return WriteOutcome.ok(symbol);
            }

            Map<String, Object> prices = new LinkedHashMap<>();
            prices.put(FundamentalField.CURRENT_PRICE.column(), row.getCurrent());
            prices.put(StockDao.OPEN_PRICE, row.getOpen());
            prices.put(StockDao.HIGH_PRICE, row.getHigh());
            prices.put(StockDao.LOW_PRICE, row.getLow());
            prices.put(StockDao.PREVIOUS_CLOSE, row.getLdcp());
            prices.put(FundamentalField.CHANGE_AMOUNT.column(), row.getChange());
            prices.put(FundamentalField.CHANGE_PERCENTAGE.column(), row.getChangePercent());
            prices.put(FundamentalField.VOLUME.column(), row.getVolume());
            if (stockDao.updateColumns(stockId.get(), prices) > 0) {
                counts.incPricesUpdated();
            }

            historyDao.upsert(StockHistoryParam.builder()
                    .stockId(stockId.get())
                    .date(tradeDate)
                    .openPrice(row.getOpen())
                    .highPrice(row.getHigh())
                    .lowPrice(row.getLow())
                    .closePrice(row.getCurrent())
                    .volume(row.getVolume())
                    .build());
            counts.incHistorySaved();

            String name = row.getName();
            if (name != null && !name.equals(symbol) && !name.equals(company.get().getName())) {
                companyDao.updateIdentity(company.get().getId(), name, null, null, null);
            }
            return WriteOutcome.ok(symbol);
        } catch (SQLException | RuntimeException e) {
            LOG.debug("price write failed for {}: {}", symbol, e.getMessage());
            return WriteOutcome.failed(symbol, symbol + " price: " + e.getMessage());
        }
    }

    public WriteCounts applyFull(Collection<CompanyFullData> companies) {
        WriteCounts counts = new WriteCounts();
        if (companies == null) {
            return counts;
        }
        for (CompanyFullData data : companies) {
            applyCompany(data, counts);
        }
        LOG.info("full write: {}", counts);
        return counts;
    }

    private void applyCompany(CompanyFullData data, WriteCounts counts) {
        String symbol = data.symbol;
        CompanyRow company;
        try {
            Optional<CompanyRow> found = companyDao.findBySymbol(symbol);
            if (found.isEmpty()) {
                counts.incSkipped();
                return;
            }
            company = found.get();
        } catch (SQLException | RuntimeException e) {
            counts.record(WriteOutcome.failed(symbol, symbol + " lookup: " + e.getMessage()));
            return;
        }

        counts.record(writeIdentity(company, data.info, counts));
        counts.record(writeFundamentals(company, data, counts));
        for (FinancialPeriod period : data.financials) {
            counts.record(writePeriod(company, period, counts));
        }
    }

    private WriteOutcome writeIdentity(CompanyRow company, CompanyInfo info, WriteCounts counts) {
        String symbol = company.getSymbol();
        String name = info.getName() != null && !info.getName().equals(symbol) ? info.getName() : null;
        String logo = info.getLogoUrl() != null && LogoResolver.isPlaceholder(company.getLogoUrl())
                ? info.getLogoUrl()
                : null;
        try {
            if (companyDao.updateIdentity(company.getId(), name, info.getDescription(), info.getSector(), logo)) {
                counts.incCompaniesUpdated();
            }
            return WriteOutcome.ok(symbol);
        } catch (SQLException | RuntimeException e) {
            LOG.debug("identity write failed for {}: {}", symbol, e.getMessage());
            return WriteOutcome.failed(symbol, symbol + " company: " + e.getMessage());
        }
    }

    private WriteOutcome writeFundamentals(CompanyRow company, CompanyFullData data, WriteCounts counts) {
        String symbol = company.getSymbol();
        try {
            Optional<Long> stockId = stockDao.findIdByCompany(company.getId());
            if (stockId.isEmpty()) {
                return WriteOutcome.ok(symbol);
            }

            Map<String, Object> columns = new LinkedHashMap<>();
            for (Map.Entry<FundamentalField, Double> entry : data.fundamentals.values().entrySet()) {
                FundamentalField field = entry.getKey();
                if (!field.isQuote()) {
                    columns.put(field.column(), columnValue(field.integral(), entry.getValue()));
                }
            }
            backfill(columns, FundamentalField.MARKET_CAP, data.equity.get(EquityField.MARKET_CAP));
            backfill(columns, FundamentalField.SHARES_OUTSTANDING, data.equity.get(EquityField.SHARES_OUTSTANDING));
            backfill(columns, FundamentalField.FLOAT_SHARES, data.equity.get(EquityField.FREE_FLOAT_SHARES));
            for (Map.Entry<RatioField, Double> entry : data.ratios.values().entrySet()) {
                columns.put(entry.getKey().column(), entry.getValue());
            }

            // The page header price only fills a stock that has never had a listing price.
            Double pagePrice = data.fundamentals.get(FundamentalField.CURRENT_PRICE);
            if (pagePrice != null && stockDao.currentPrice(stockId.get()) == null) {
                columns.put(FundamentalField.CURRENT_PRICE.column(), pagePrice);
            }

            if (stockDao.updateColumns(stockId.get(), columns) > 0) {
                counts.incFundamentalsUpdated();
            }
            return WriteOutcome.ok(symbol);
        } catch (SQLException | RuntimeException e) {
            LOG.debug("fundamentals write failed for {}: {}", symbol, e.getMessage());
            return WriteOutcome.failed(symbol, symbol + " fundamentals: " + e.getMessage());
        }
    }

    private WriteOutcome writePeriod(CompanyRow company, FinancialPeriod period, WriteCounts counts) {
        String symbol = company.getSymbol();
        try {
            statementDao.upsertPeriod(company.getId(), period);
            counts.incFinancialsSaved();
            return WriteOutcome.ok(symbol);
        } catch (SQLException | RuntimeException e) {
            LOG.debug("statement write failed for {} {}: {}", symbol, period.key(), e.getMessage());
            return WriteOutcome.failed(symbol, symbol + " " + period.key() + ": " + e.getMessage());
        }
    }

    private static void backfill(Map<String, Object> columns, FundamentalField field, Double value) {
        if (value != null && !columns.containsKey(field.column())) {
            columns.put(field.column(), columnValue(field.integral(), value));
        }
    }

    private static Object columnValue(boolean integral, Double value) {
        if (value == null) {
            return null;
        }
        return integral ? (Object) Math.round(value) : value;
    }
}
