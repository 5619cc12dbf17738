package com.marketbot.app;

import com.marketbot.pk.config.Config;
import com.marketbot.pk.model.JobState;
import com.marketbot.pk.model.ScrapeResult;
import com.marketbot.pk.schedule.JobLogSink;
import com.marketbot.pk.schedule.JobScheduler;
import com.marketbot.pk.schedule.JobTask;
import com.marketbot.pk.schedule.JobTaskProvider;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketBotApplicationTest {
    private static final ZoneId KARACHI = ZoneId.of("Asia/Karachi");

    @Test
    void registerJobs_shouldAddProviderJobOnItsConfiguredTrigger() throws Exception {
        Config config = Config.of(Map.of("schedule.ai_processing", "19:00"));
        JobScheduler scheduler = new JobScheduler(new SilentSink(), null);
        AtomicBoolean processed = new AtomicBoolean(false);
        JobTaskProvider provider = new FixedProvider("ai_processing", () -> {
            processed.set(true);
            return null;
        });

        List<String> names = MarketBotApplication.registerJobs(scheduler, config, KARACHI, builtIns(), List.of(provider));

        assertEquals(List.of("psx_daily", "psx_full", "commodities", "ai_processing"), names);
        assertTrue(scheduler.runNow("ai_processing"));
        assertTrue(processed.get());
        assertEquals(JobState.COMPLETED, scheduler.state("ai_processing"));
        assertEquals(JobState.IDLE, scheduler.state("psx_daily"));
    }

    @Test
    void registerJobs_shouldRejectProviderWithoutSchedule() {
        JobScheduler scheduler = new JobScheduler(new SilentSink(), null);
        JobTaskProvider provider = new FixedProvider("ai_processing", () -> null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MarketBotApplication.registerJobs(scheduler, Config.of(Map.of()), KARACHI, builtIns(), List.of(provider)));

        assertEquals("missing required config: schedule.ai_processing", e.getMessage());
    }

    @Test
    void registerJobs_shouldReadBuiltInTriggersFromConfig() {
        Config config = Config.of(Map.of("schedule.full", "someday 20:00"));
        JobScheduler scheduler = new JobScheduler(new SilentSink(), null);

        assertThrows(IllegalArgumentException.class,
                () -> MarketBotApplication.registerJobs(scheduler, config, KARACHI, builtIns(), List.of()));
    }

    private static Map<String, JobTask> builtIns() {
        Map<String, JobTask> tasks = new LinkedHashMap<>();
        tasks.put("psx_daily", () -> new ScrapeResult(ScrapeResult.MODE_PRICES));
        tasks.put("psx_full", () -> new ScrapeResult(ScrapeResult.MODE_FULL));
        tasks.put("commodities", () -> new ScrapeResult(ScrapeResult.MODE_COMMODITIES));
        return tasks;
    }

    private static final class FixedProvider implements JobTaskProvider {
        private final String name;
        private final JobTask task;

        FixedProvider(String name, JobTask task) {
            this.name = name;
            this.task = task;
        }

        @Override
        public String jobName() {
            return name;
        }

        @Override
        public JobTask create(Config config) {
            return task;
        }
    }

    private static final class SilentSink implements JobLogSink {
        private long nextId = 1;

        @Override
        public synchronized long logJobStart(String jobName) {
            return nextId++;
        }

        @Override
        public void logJobComplete(long id, Map<String, Object> counts, long durationMs) {
        }

        @Override
        public void logJobFail(long id, String error, long durationMs) {
        }
    }
}
