package com.marketbot.pk.schedule;

import com.marketbot.pk.model.JobState;
import com.marketbot.pk.model.ScrapeResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs registered jobs on their triggers. Each firing is written to the job log; a job that is
 * still running when it fires again is skipped. Task failures never stop the scheduler.
 */
public class JobScheduler {
    private static final Logger LOG = LogManager.getLogger(JobScheduler.class);

    private final JobLogSink jobLog;
    private final Clock clock;
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private ScheduledExecutorService executor;

    public JobScheduler(JobLogSink jobLog, Clock clock) {
        this.jobLog = jobLog;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized void register(String name, CronTrigger trigger, JobTask task) {
        if (executor != null) {
            throw new IllegalStateException("scheduler already started");
        }
        if (jobs.containsKey(name)) {
            throw new IllegalArgumentException("job already registered: " + name);
        }
        jobs.put(name, new Job(name, trigger, task));
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newScheduledThreadPool(Math.max(1, jobs.size()), r -> {
            Thread t = new Thread(r, "job-scheduler");
            t.setDaemon(false);
            return t;
        });
        for (Job job : jobs.values()) {
            scheduleNext(job);
        }
        LOG.info("scheduler started with {} jobs", jobs.size());
    }

    public void stop() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
            executor = null;
        }
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("scheduler threads still busy after stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("scheduler stopped");
    }

    /**
     * Runs the job on the calling thread.
     *
     * @return false when the job was already running and this firing was skipped
     */
    public boolean runNow(String name) {
        return fire(job(name));
    }

    public JobState state(String name) {
        return job(name).state;
    }

    public ScrapeResult lastResult(String name) {
        return job(name).lastResult;
    }

    public synchronized boolean isStarted() {
        return executor != null;
    }

    private Job job(String name) {
        Job job;
        synchronized (this) {
            job = jobs.get(name);
        }
        if (job == null) {
            throw new IllegalArgumentException("unknown job: " + name);
        }
        return job;
    }

    private void scheduleNext(Job job) {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime next = job.trigger.next(now);
        long delayMs = Math.max(0L, Duration.between(now, next).toMillis());
        try {
            current.schedule(() -> {
                try {
                    fire(job);
                } finally {
                    scheduleNext(job);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
            LOG.info("job {} next run at {}", job.name, next);
        } catch (RejectedExecutionException e) {
            LOG.debug("job {} not rescheduled, scheduler stopping", job.name);
        }
    }

    boolean fire(Job job) {
        if (!job.running.compareAndSet(false, true)) {
            LOG.warn("job {} still running, firing skipped", job.name);
            return false;
        }
        job.state = JobState.RUNNING;
        long started = System.nanoTime();
        long logId = startLog(job.name);
        try {
            ScrapeResult result = job.task.run();
            long durationMs = elapsedMs(started);
            job.lastResult = result;
            job.state = JobState.COMPLETED;
            Map<String, Object> counts = result == null ? Map.of() : result.toCounts();
            LOG.info("job {} completed in {} ms: {}", job.name, durationMs, counts);
            if (logId >= 0) {
                try {
                    jobLog.logJobComplete(logId, counts, durationMs);
                } catch (SQLException | RuntimeException e) {
                    LOG.warn("job log completion failed for {}: {}", job.name, e.getMessage());
                }
            }
        } catch (Exception | Error e) {
            // An Error from the task fails this run only; the job keeps its schedule.
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            long durationMs = elapsedMs(started);
            job.state = JobState.FAILED;
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.error("job {} failed after {} ms: {}", job.name, durationMs, message, e);
            if (logId >= 0) {
                try {
                    jobLog.logJobFail(logId, message, durationMs);
                } catch (SQLException | RuntimeException logError) {
                    LOG.warn("job log failure record failed for {}: {}", job.name, logError.getMessage());
                }
            }
        } finally {
            job.running.set(false);
        }
        return true;
    }

    private long startLog(String name) {
        try {
            return jobLog.logJobStart(name);
        } catch (SQLException | RuntimeException e) {
            LOG.warn("job log start failed for {}: {}", name, e.getMessage());
            return -1L;
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    static final class Job {
        final String name;
        final CronTrigger trigger;
        final JobTask task;
        final AtomicBoolean running = new AtomicBoolean(false);
        volatile JobState state = JobState.IDLE;
        volatile ScrapeResult lastResult;

        Job(String name, CronTrigger trigger, JobTask task) {
            this.name = name;
            this.trigger = trigger;
            this.task = task;
        }
    }
}
