package com.marketbot.app;

import com.marketbot.data.http.FetchException;
import com.marketbot.data.http.HttpFetcher;
import com.marketbot.pk.commodity.CommodityRateParser;
import com.marketbot.pk.commodity.CommodityScrapeRunner;
import com.marketbot.pk.config.Config;
import com.marketbot.pk.db.CommodityDao;
import com.marketbot.pk.db.CompanyDao;
import com.marketbot.pk.db.Database;
import com.marketbot.pk.db.FinancialStatementDao;
import com.marketbot.pk.db.JobLogDao;
import com.marketbot.pk.db.MetadataDao;
import com.marketbot.pk.db.MigrationRunner;
import com.marketbot.pk.db.StockDao;
import com.marketbot.pk.db.StockHistoryDao;
import com.marketbot.pk.model.CompanyFullData;
import com.marketbot.pk.model.FinancialPeriod;
import com.marketbot.pk.model.ScrapeResult;
import com.marketbot.pk.parse.CompanyPageParser;
import com.marketbot.pk.parse.LogoResolver;
import com.marketbot.pk.parse.MarketWatchParser;
import com.marketbot.pk.runner.CompanyBatchFetcher;
import com.marketbot.pk.runner.PsxScrapeRunner;
import com.marketbot.pk.schedule.CronTrigger;
import com.marketbot.pk.schedule.JobScheduler;
import com.marketbot.pk.schedule.JobTask;
import com.marketbot.pk.schedule.JobTaskProvider;
import com.marketbot.pk.writer.MarketDataWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

public final class MarketBotApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private static final List<String> SOURCE_LOGGED_KEYS = List.of("db.url", "psx.base_url", "schedule.zone");
    private static final Map<String, String> BUILT_IN_SCHEDULE_KEYS = Map.of(
            "psx_daily", "schedule.daily",
            "psx_full", "schedule.full",
            "commodities", "schedule.commodities"
    );

    public static void main(String[] args) {
        int exit = new MarketBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("marketbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("marketbot", options);
            return 0;
        }
        if (cmd.hasOption("symbols") && !cmd.hasOption("full")) {
            System.err.println("ERROR: --symbols requires --full.");
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            Logger log = LogManager.getLogger(MarketBotApplication.class);

            for (String key : SOURCE_LOGGED_KEYS) {
                log.info("config {} from {}", key, config.sourceOf(key));
            }

            HttpFetcher fetcher = new HttpFetcher(config);
            String baseUrl = config.requireString("psx.base_url");
            LogoResolver logoResolver = new LogoResolver(baseUrl, config.getMap("logo.websites"));
            CompanyBatchFetcher batchFetcher = new CompanyBatchFetcher(
                    fetcher,
                    new CompanyPageParser(logoResolver),
                    trimSlash(baseUrl) + config.requireString("psx.company_path"),
                    config.getInt("batch.progress_every", 50)
            );

            if (cmd.hasOption("company")) {
                return printCompany(batchFetcher, cmd.getOptionValue("company"));
            }

            Database database = Database.fromConfig(config);
            System.out.println("DB url=" + database.maskedJdbcUrl() + ", schema=" + database.schema());
            new MigrationRunner().run(database);
            if (cmd.hasOption("migrate")) {
                System.out.println("Schema migration completed.");
                return 0;
            }

            CompanyDao companyDao = new CompanyDao(database);
            StockDao stockDao = new StockDao(database);
            MarketDataWriter writer = new MarketDataWriter(
                    companyDao, stockDao, new StockHistoryDao(database), new FinancialStatementDao(database));
            ZoneId zone = ZoneId.of(config.getString("schedule.zone", "Asia/Karachi"));
            PsxScrapeRunner psx = new PsxScrapeRunner(
                    config,
                    fetcher,
                    new MarketWatchParser(),
                    batchFetcher,
                    writer,
                    companyDao,
                    stockDao,
                    new MetadataDao(database),
                    Clock.system(zone)
            );
            CommodityScrapeRunner commodities = new CommodityScrapeRunner(
                    config, fetcher, new CommodityRateParser("gold.pk"), new CommodityDao(database));

            if (cmd.hasOption("daily")) {
                return report(psx.runDaily());
            }
            if (cmd.hasOption("full")) {
                List<String> symbols = cmd.hasOption("symbols")
                        ? Arrays.asList(cmd.getOptionValue("symbols").split(","))
                        : List.of();
                return report(psx.runFull(symbols));
            }
            if (cmd.hasOption("commodities")) {
                return report(commodities.run());
            }
            if (cmd.hasOption("seed")) {
                return report(psx.seedListing());
            }

            JobScheduler scheduler = new JobScheduler(new JobLogDao(database), Clock.system(zone));
            Map<String, JobTask> builtIns = new LinkedHashMap<>();
            builtIns.put("psx_daily", psx::runDaily);
            builtIns.put("psx_full", () -> psx.runFull(List.of()));
            builtIns.put("commodities", commodities::run);
            List<String> jobs = registerJobs(scheduler, config, zone, builtIns, ServiceLoader.load(JobTaskProvider.class));
            log.info("Registered jobs: {}", jobs);
            return runSchedule(scheduler, log);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    /**
     * Registers the built-in jobs, then one job per provider. A provider's trigger is read from
     * {@code schedule.<jobName>} and must be present.
     *
     * @return registered job names in registration order
     */
    static List<String> registerJobs(JobScheduler scheduler, Config config, ZoneId zone,
                                     Map<String, JobTask> builtIns, Iterable<JobTaskProvider> providers) throws Exception {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, JobTask> job : builtIns.entrySet()) {
            String key = BUILT_IN_SCHEDULE_KEYS.getOrDefault(job.getKey(), "schedule." + job.getKey());
            scheduler.register(job.getKey(), CronTrigger.parse(config.requireString(key), zone), job.getValue());
            names.add(job.getKey());
        }
        for (JobTaskProvider provider : providers) {
            String name = provider.jobName();
            CronTrigger trigger = CronTrigger.parse(config.requireString("schedule." + name), zone);
            scheduler.register(name, trigger, provider.create(config));
            names.add(name);
        }
        return names;
    }

    private int runSchedule(JobScheduler scheduler, Logger log) {
        CountDownLatch stopped = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            scheduler.stop();
            stopped.countDown();
        }, "marketbot-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        scheduler.start();
        log.info("Schedule mode started. Press Ctrl+C to stop.");
        try {
            stopped.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.stop();
            return 130;
        }
    }

    private int printCompany(CompanyBatchFetcher batchFetcher, String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            System.err.println("ERROR: --company needs a symbol.");
            return 2;
        }
        CompanyFullData data;
        try {
            data = batchFetcher.fetchCompany(normalized);
        } catch (FetchException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        }
        System.out.println("symbol=" + data.symbol);
        System.out.println("name=" + Optional.ofNullable(data.info.getName()).orElse("-"));
        System.out.println("sector=" + Optional.ofNullable(data.info.getSector()).orElse("-"));
        System.out.println("logo=" + Optional.ofNullable(data.info.getLogoUrl()).orElse("-"));
        System.out.println("fundamentals=" + data.fundamentals.values());
        System.out.println("ratios=" + data.ratios.values());
        System.out.println("equity=" + data.equity.values());
        for (FinancialPeriod period : data.financials) {
            System.out.println("period " + period.key() + " fields=" + period.size());
        }
        return 0;
    }

    private int report(ScrapeResult result) {
        System.out.println(result.mode() + " completed: " + result.toCounts());
        int shown = 0;
        for (String error : result.errors()) {
            if (shown++ >= 20) {
                System.out.println("... " + (result.errors().size() - 20) + " more errors");
                break;
            }
            System.out.println("  error: " + error);
        }
        return 0;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MarketBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("marketbot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j before swapping streams so the console appender keeps the real stdout.
                LogManager.getLogger(MarketBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("daily").desc("Refresh prices from the market-watch listing").build());
        options.addOption(Option.builder().longOpt("full").desc("Listing refresh plus company detail pages").build());
        options.addOption(Option.builder().longOpt("symbols").hasArg().argName("A,B")
                .desc("Restrict --full to these symbols").build());
        options.addOption(Option.builder().longOpt("company").hasArg().argName("SYM")
                .desc("Fetch one company page and print what was parsed").build());
        options.addOption(Option.builder().longOpt("commodities").desc("Refresh gold and silver rates").build());
        options.addOption(Option.builder().longOpt("seed").desc("Insert listed symbols missing from the database").build());
        options.addOption(Option.builder().longOpt("migrate").desc("Create or update the schema and exit").build());
        options.addOption(Option.builder().longOpt("schedule").desc("Run the job scheduler (default)").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }

    private static String trimSlash(String url) {
        String out = url == null ? "" : url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
