package com.cronhook.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Live trigger of one job. Waits for the next instant matching the job's
 * schedule, hands the job to the dispatcher and re-arms for the following
 * instant.
 * <p>
 * Firings of one engine never overlap: the next instant is only computed
 * after the current firing has been handed off. Occurrences that fall into a
 * period when the engine was not armed are not fired afterwards.
 */
public class TriggerEngine {
    private static final Logger log = LoggerFactory.getLogger(TriggerEngine.class);

    /** Tolerated early wake-up before the timer is re-set for the remaining time. */
    private static final long EARLY_TOLERANCE_MILLIS = 1000;

    public enum State { NEW, ARMED, FIRING, STOPPED }

    private final Job job;
    private final CronSchedule schedule;
    private final ScheduledExecutorService timer;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private final Object lock = new Object();

    private State state = State.NEW;
    private ScheduledFuture<?> pending;
    private Instant nextFireTime;

    public TriggerEngine(Job job, CronSchedule schedule, ScheduledExecutorService timer,
                         JobDispatcher dispatcher, Clock clock) {
        this.job = job;
        this.schedule = schedule;
        this.timer = timer;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /** Starts waiting for the first instant strictly after now. */
    public void arm() {
        synchronized (lock) {
            if (state != State.NEW) {
                throw new IllegalStateException("Trigger for job " + job.id() + " is already " + state);
            }
            state = State.ARMED;
            scheduleAfter(clock.instant());
        }
    }

    /**
     * Cancels the pending wait. Safe to call repeatedly and while a firing is
     * in progress; that firing completes but no further firing starts.
     */
    public void stop() {
        synchronized (lock) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            nextFireTime = null;
        }
    }

    public State getState() {
        synchronized (lock) {
            return state;
        }
    }

    /** Next scheduled instant, or null when stopped or the schedule is exhausted. */
    public Instant getNextFireTime() {
        synchronized (lock) {
            return nextFireTime;
        }
    }

    // caller holds lock
    private void scheduleAfter(Instant after) {
        Instant next = schedule.nextFireAfter(after);
        nextFireTime = next;
        if (next == null) {
            log.warn("Schedule '{}' of job {} has no future occurrence; it will not fire", schedule, job.id());
            return;
        }
        waitFor(next);
    }

    // caller holds lock
    private void waitFor(Instant instant) {
        long delay = Math.max(0, Duration.between(clock.instant(), instant).toMillis());
        try {
            pending = timer.schedule(() -> fire(instant), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer is shut down, job {} will not fire again", job.id());
            state = State.STOPPED;
            pending = null;
            nextFireTime = null;
        }
    }

    private void fire(Instant scheduled) {
        synchronized (lock) {
            if (state != State.ARMED) {
                return;
            }
            Instant now = clock.instant();
            if (now.plusMillis(EARLY_TOLERANCE_MILLIS).isBefore(scheduled)) {
                waitFor(scheduled);
                return;
            }
            state = State.FIRING;
        }

        Metrics.getInstance().recordFiring();
        log.debug("Firing job {} ({}) scheduled for {}", job.id(), job.name(), scheduled);
        try {
            dispatcher.dispatch(job);
        } catch (RuntimeException e) {
            log.error("Dispatcher failed for job {}", job.id(), e);
        }

        synchronized (lock) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.ARMED;
            Instant now = clock.instant();
            scheduleAfter(now.isAfter(scheduled) ? now : scheduled);
        }
    }
}
