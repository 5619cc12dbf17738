package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.CompanyRow;
import com.marketbot.pk.db.mybatis.StockHistoryParam;
import com.marketbot.pk.model.FinancialPeriod;
import com.marketbot.pk.model.StatementField;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table-shaped in-memory stand-in for the DAOs, keyed the same way the SQL upserts are.
 */
public final class InMemoryStore {
    public final Map<String, Company> companies = new LinkedHashMap<>();
    public final Map<Long, Map<String, Object>> stocks = new LinkedHashMap<>();
    public final Map<String, StockHistoryParam> history = new LinkedHashMap<>();
    public final Map<String, Map<String, Double>> statements = new LinkedHashMap<>();
    public final Map<String, String> metadata = new LinkedHashMap<>();
    public final Map<String, Double> commodities = new LinkedHashMap<>();
    public final Set<Long> failingStocks = new HashSet<>();
    public int stockUpdateCalls;
    private long nextCompanyId = 1;

    public final CompanyDao companyDao = new FakeCompanyDao();
    public final StockDao stockDao = new FakeStockDao();
    public final StockHistoryDao historyDao = new FakeHistoryDao();
    public final FinancialStatementDao statementDao = new FakeStatementDao();
    public final MetadataDao metadataDao = new FakeMetadataDao();
    public final CommodityDao commodityDao = new FakeCommodityDao();

    /**
     * Adds a company with its stock row; the stock id is the company id plus 1000.
     */
    public Company addCompany(String symbol, String name) {
        Company company = new Company(nextCompanyId++, symbol, name);
        companies.put(symbol, company);
        stocks.put(stockIdOf(company), new LinkedHashMap<>());
        return company;
    }

    public long stockIdOf(Company company) {
        return company.id + 1000L;
    }

    public Map<String, Object> stockOf(String symbol) {
        return stocks.get(stockIdOf(companies.get(symbol)));
    }

    public List<StockHistoryParam> historyOf(String symbol) {
        long stockId = stockIdOf(companies.get(symbol));
        List<StockHistoryParam> out = new ArrayList<>();
        for (StockHistoryParam row : history.values()) {
            if (row.getStockId() == stockId) {
                out.add(row);
            }
        }
        return out;
    }

    public static final class Company {
        public final long id;
        public final String symbol;
        public String name;
        public String description;
        public String sector;
        public String sectorCode;
        public String logoUrl;

        Company(long id, String symbol, String name) {
            this.id = id;
            this.symbol = symbol;
            this.name = name;
        }
    }

    private Company byId(long id) {
        for (Company company : companies.values()) {
            if (company.id == id) {
                return company;
            }
        }
        return null;
    }

    private final class FakeCompanyDao extends CompanyDao {
        FakeCompanyDao() {
            super(null);
        }

        @Override
        public Optional<CompanyRow> findBySymbol(String symbol) {
            Company c = companies.get(symbol);
            return c == null ? Optional.empty() : Optional.of(new CompanyRow(c.id, c.symbol, c.name, c.logoUrl));
        }

        @Override
        public boolean updateIdentity(long companyId, String name, String description, String sector, String logoUrl) {
            if (name == null && description == null && sector == null && logoUrl == null) {
                return false;
            }
            Company c = byId(companyId);
            if (c == null) {
                return false;
            }
            if (name != null) {
                c.name = name;
            }
            if (description != null) {
                c.description = description;
            }
            if (sector != null) {
                c.sector = sector;
            }
            if (logoUrl != null) {
                c.logoUrl = logoUrl;
            }
            return true;
        }

        @Override
        public Optional<Long> insertIfAbsent(String symbol, String name, String sector, String sectorCode, String logoUrl) {
            if (companies.containsKey(symbol)) {
                return Optional.empty();
            }
            Company c = new Company(nextCompanyId++, symbol, name == null ? symbol : name);
            c.sector = sector;
            c.sectorCode = sectorCode;
            c.logoUrl = logoUrl;
            companies.put(symbol, c);
            return Optional.of(c.id);
        }
    }

    private final class FakeStockDao extends StockDao {
        FakeStockDao() {
            super(null);
        }

        @Override
        public Optional<Long> findIdByCompany(long companyId) {
            long stockId = companyId + 1000L;
            return stocks.containsKey(stockId) ? Optional.of(stockId) : Optional.empty();
        }

        @Override
        public Double currentPrice(long stockId) {
            Map<String, Object> row = stocks.get(stockId);
            Object value = row == null ? null : row.get("current_price");
            return value == null ? null : ((Number) value).doubleValue();
        }

        @Override
        public int updateColumns(long stockId, Map<String, ?> values) throws SQLException {
            stockUpdateCalls++;
            if (failingStocks.contains(stockId)) {
                throw new SQLException("deadlock detected");
            }
            int written = 0;
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                if (!COLUMNS.contains(entry.getKey())) {
                    throw new IllegalArgumentException("unknown stocks column: " + entry.getKey());
                }
                if (entry.getValue() != null) {
                    stocks.get(stockId).put(entry.getKey(), entry.getValue());
                    written++;
                }
            }
            return written;
        }

        @Override
        public boolean insertIfAbsent(long companyId) {
            long stockId = companyId + 1000L;
            if (stocks.containsKey(stockId)) {
                return false;
            }
            stocks.put(stockId, new LinkedHashMap<>());
            return true;
        }
    }

    private final class FakeHistoryDao extends StockHistoryDao {
        FakeHistoryDao() {
            super(null);
        }

        @Override
        public void upsert(StockHistoryParam row) {
            String key = row.getStockId() + "|" + row.getDate();
            StockHistoryParam existing = history.get(key);
            if (existing == null) {
                history.put(key, copy(row));
                return;
            }
            // Same COALESCE rule as the SQL upsert: a null never replaces a stored value.
            if (row.getOpenPrice() != null) {
                existing.setOpenPrice(row.getOpenPrice());
            }
            if (row.getHighPrice() != null) {
                existing.setHighPrice(row.getHighPrice());
            }
            if (row.getLowPrice() != null) {
                existing.setLowPrice(row.getLowPrice());
            }
            if (row.getClosePrice() != null) {
                existing.setClosePrice(row.getClosePrice());
            }
            if (row.getVolume() != null) {
                existing.setVolume(row.getVolume());
            }
        }

        private StockHistoryParam copy(StockHistoryParam row) {
            return new StockHistoryParam(row.getStockId(), row.getDate(), row.getOpenPrice(), row.getHighPrice(),
                    row.getLowPrice(), row.getClosePrice(), row.getVolume());
        }
    }

    private final class FakeStatementDao extends FinancialStatementDao {
        FakeStatementDao() {
            super(null);
        }

        @Override
        public boolean upsertPeriod(long companyId, FinancialPeriod period) {
            String key = companyId + "|" + period.key();
            boolean inserted = !statements.containsKey(key);
            Map<String, Double> row = statements.computeIfAbsent(key, k -> new LinkedHashMap<>());
            for (Map.Entry<StatementField, Double> entry : period.values().entrySet()) {
                row.put(entry.getKey().column(), entry.getValue());
            }
            return inserted;
        }
    }

    private final class FakeMetadataDao extends MetadataDao {
        FakeMetadataDao() {
            super(null);
        }

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(metadata.get(key));
        }

        @Override
        public void put(String key, String value) {
            metadata.put(key, value);
        }
    }

    private final class FakeCommodityDao extends CommodityDao {
        FakeCommodityDao() {
            super(null);
        }

        @Override
        public boolean updatePrice(String name, double price, String source) {
            if (!commodities.containsKey(name)) {
                return false;
            }
            commodities.put(name, price);
            return true;
        }
    }
}
