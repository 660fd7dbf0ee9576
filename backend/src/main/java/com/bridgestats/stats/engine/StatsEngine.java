package com.bridgestats.stats.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs every pass on its own fixed-delay timer until stopped. Owns its scheduler thread pool
 * (one thread per pass) and the scheduled futures.
 * <p>
 * A pass never overlaps with itself. Passes do not share state, so a slow or failing pass never delays
 * another one. {@link #stop()} cancels future ticks, lets in-flight passes finish and blocks until the
 * pool has terminated or the await timeout elapses.
 */
@Slf4j
public class StatsEngine implements SmartLifecycle {

    private final Map<ScheduledPass, Duration> schedule;
    private final Duration shutdownAwait;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private ThreadPoolTaskScheduler scheduler;
    private volatile boolean running;

    public StatsEngine(Map<ScheduledPass, Duration> schedule, Duration shutdownAwait) {
        if (schedule.isEmpty()) {
            throw new IllegalArgumentException("At least one pass must be scheduled");
        }
        this.schedule = new LinkedHashMap<>(schedule);
        this.shutdownAwait = shutdownAwait;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedule.size());
        scheduler.setThreadNamePrefix("stats-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(shutdownAwait.toMillis());
        scheduler.initialize();
        Instant now = Instant.now();
        schedule.forEach((pass, interval) -> {
            futures.add(scheduler.scheduleWithFixedDelay(() -> runPass(pass), now.plus(interval), interval));
            log.info("Scheduled pass {} every {}s", pass.name(), interval.toSeconds());
        });
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping stats engine, waiting up to {}s for in-flight passes", shutdownAwait.toSeconds());
        futures.forEach(f -> f.cancel(false));
        futures.clear();
        scheduler.shutdown();
        running = false;
        log.info("Stats engine stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Pass names in scheduling order. */
    public List<String> passNames() {
        return schedule.keySet().stream().map(ScheduledPass::name).toList();
    }

    static void runPass(ScheduledPass pass) {
        long started = System.currentTimeMillis();
        try {
            pass.run();
            log.debug("Pass {} finished in {} ms", pass.name(), System.currentTimeMillis() - started);
        } catch (Exception e) {
            log.error("Pass {} failed after {} ms, retrying next tick: {}",
                    pass.name(), System.currentTimeMillis() - started, e.getMessage(), e);
        }
    }
}
