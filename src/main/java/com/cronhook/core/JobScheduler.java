package com.cronhook.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Lifecycle of the scheduler: restores persisted jobs on start and stops
 * every trigger and flushes the store on shutdown.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final JobDispatcher dispatcher;
    private final ScheduledThreadPoolExecutor timer;
    private final JobRegistry registry;
    private volatile boolean started = false;
    private volatile boolean stopped = false;

    public JobScheduler(JobStore store, JobDispatcher dispatcher) {
        this(store, dispatcher, Config.getZone(), Clock.systemUTC(),
             Config.getInt("TIMER_THREADS", Runtime.getRuntime().availableProcessors()));
    }

    public JobScheduler(JobStore store, JobDispatcher dispatcher, ZoneId zone, Clock clock, int timerThreads) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.timer = new ScheduledThreadPoolExecutor(Math.max(1, timerThreads),
                WebhookDispatcher.daemonThreads("cronhook-timer-"));
        this.timer.setRemoveOnCancelPolicy(true);
        this.registry = new JobRegistry(store, dispatcher, timer, zone, clock);
    }

    /**
     * Loads the persisted jobs and arms a trigger for each one with a valid
     * schedule. An unreadable store is logged and the scheduler starts empty.
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Scheduler already started");
        }
        Metrics.init();
        started = true;

        List<Job> persisted;
        try {
            persisted = store.load();
        } catch (StoreCorruptException e) {
            log.error("Job store is corrupt, starting with no jobs: {}", e.getMessage());
            return;
        } catch (IOException e) {
            log.error("Could not read job store, starting with no jobs", e);
            return;
        }

        int armed = 0;
        for (Job job : persisted) {
            if (!ScheduleValidator.validate(job.schedule())) {
                log.warn("Skipping job {} ({}): invalid schedule '{}'", job.id(), job.name(), job.schedule());
                continue;
            }
            if (registry.register(job)) {
                armed++;
            } else {
                log.warn("Skipping job {} ({}): duplicate id", job.id(), job.name());
            }
        }
        log.info("Restored {} of {} persisted jobs", armed, persisted.size());
    }

    /** The live registry; valid once {@link #start()} has been called. */
    public JobRegistry getRegistry() {
        return registry;
    }

    public boolean isStarted() {
        return started && !stopped;
    }

    /**
     * Stops all triggers, writes the registry snapshot taken at that moment
     * and releases the timer and dispatch threads without waiting for
     * in-flight calls.
     */
    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        List<Job> remaining = registry.disarmAll();
        if (started) {
            registry.flush();
        }
        timer.shutdownNow();
        dispatcher.shutdown();
        log.info("Scheduler stopped, {} jobs saved", remaining.size());
    }
}
