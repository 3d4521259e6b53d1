package com.cronhook.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the live set of jobs and their triggers.
 * <p>
 * Every mutation validates first, then updates the map, arms or stops the
 * affected trigger and writes a full snapshot to the {@link JobStore}, all
 * under one lock. Reads return copies. A failed store write is logged and the
 * in-memory state stays authoritative.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private record Entry(Job job, TriggerEngine trigger) {}

    private final Map<String, Entry> jobs = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final JobStore store;
    private final JobDispatcher dispatcher;
    private final ScheduledExecutorService timer;
    private final ZoneId zone;
    private final Clock clock;
    private boolean closed;

    public JobRegistry(JobStore store, JobDispatcher dispatcher, ScheduledExecutorService timer, ZoneId zone) {
        this(store, dispatcher, timer, zone, Clock.systemUTC());
    }

    public JobRegistry(JobStore store, JobDispatcher dispatcher, ScheduledExecutorService timer,
                       ZoneId zone, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.timer = timer;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * Creates, persists and arms a new job.
     *
     * @throws InvalidInputException    if name or schedule is missing, or the payload url is not http(s)
     * @throws InvalidScheduleException if the schedule does not parse
     * @throws IllegalStateException    if the registry has been closed
     */
    public Job create(String name, String schedule, JobPayload payload) {
        if (isBlank(name) || isBlank(schedule)) {
            throw new InvalidInputException("name and schedule are required");
        }
        CronSchedule parsed = CronSchedule.parse(schedule, zone);
        checkPayload(payload);

        lock.lock();
        try {
            checkOpen();
            String id = newId();
            Job job = new Job(id, name, parsed.getExpression(), payload,
                    clock.instant().truncatedTo(ChronoUnit.MILLIS));
            jobs.put(id, new Entry(job, arm(job, parsed)));
            persist();
            log.info("Created job {} ({}) with schedule '{}'", id, name, job.schedule());
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a job loaded from the store and arms it without writing the store.
     *
     * @return false if a job with the same id is already registered
     * @throws InvalidScheduleException if the stored schedule does not parse
     */
    public boolean register(Job job) {
        CronSchedule parsed = CronSchedule.parse(job.schedule(), zone);
        lock.lock();
        try {
            checkOpen();
            if (jobs.containsKey(job.id())) {
                return false;
            }
            jobs.put(job.id(), new Entry(job, arm(job, parsed)));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the definition of an existing job and re-arms it. Null
     * arguments keep the current value; a payload without url turns firings
     * into no-ops.
     *
     * @return the updated job, or empty if no job has this id
     */
    public Optional<Job> update(String id, String name, String schedule, JobPayload payload) {
        if (name != null && name.isBlank()) {
            throw new InvalidInputException("name must not be blank");
        }
        if (schedule != null && schedule.isBlank()) {
            throw new InvalidInputException("schedule must not be blank");
        }
        CronSchedule parsed = schedule == null ? null : CronSchedule.parse(schedule, zone);
        checkPayload(payload);

        lock.lock();
        try {
            checkOpen();
            Entry entry = jobs.get(id);
            if (entry == null) {
                return Optional.empty();
            }
            Job current = entry.job();
            if (parsed == null) {
                parsed = CronSchedule.parse(current.schedule(), zone);
            }
            Job updated = current.withDefinition(
                    name == null ? current.name() : name,
                    parsed.getExpression(),
                    payload == null ? current.payload() : payload);
            entry.trigger().stop();
            jobs.put(id, new Entry(updated, arm(updated, parsed)));
            persist();
            log.info("Updated job {} ({}) with schedule '{}'", id, updated.name(), updated.schedule());
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of all jobs in insertion order. */
    public List<Job> list() {
        lock.lock();
        try {
            List<Job> snapshot = new ArrayList<>(jobs.size());
            for (Entry e : jobs.values()) {
                snapshot.add(e.job());
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> get(String id) {
        lock.lock();
        try {
            Entry e = jobs.get(id);
            return e == null ? Optional.empty() : Optional.of(e.job());
        } finally {
            lock.unlock();
        }
    }

    /** Next instant the job will fire, empty if unknown or it never fires again. */
    public Optional<Instant> nextFireTime(String id) {
        lock.lock();
        try {
            Entry e = jobs.get(id);
            return e == null ? Optional.empty() : Optional.ofNullable(e.trigger().getNextFireTime());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the job's trigger, removes it and persists the remaining jobs.
     *
     * @return false if no job has this id
     */
    public boolean delete(String id) {
        lock.lock();
        try {
            checkOpen();
            Entry entry = jobs.remove(id);
            if (entry == null) {
                return false;
            }
            entry.trigger().stop();
            persist();
            log.info("Deleted job {} ({})", id, entry.job().name());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects further mutations and stops every trigger.
     *
     * @return the jobs registered at the moment of closing
     */
    public List<Job> disarmAll() {
        lock.lock();
        try {
            closed = true;
            for (Entry e : jobs.values()) {
                e.trigger().stop();
            }
            return list();
        } finally {
            lock.unlock();
        }
    }

    /** Writes the current snapshot to the store. */
    public void flush() {
        lock.lock();
        try {
            persist();
        } finally {
            lock.unlock();
        }
    }

    private TriggerEngine arm(Job job, CronSchedule schedule) {
        TriggerEngine trigger = new TriggerEngine(job, schedule, timer, dispatcher, clock);
        trigger.arm();
        return trigger;
    }

    // caller holds lock
    private void persist() {
        try {
            store.save(list());
        } catch (IOException e) {
            log.error("Failed to save jobs; changes are kept in memory only", e);
        }
    }

    // caller holds lock
    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString();
        } while (jobs.containsKey(id));
        return id;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Scheduler is shutting down");
        }
    }

    private static void checkPayload(JobPayload payload) {
        if (payload == null || isBlank(payload.url())) {
            return;
        }
        String scheme;
        try {
            scheme = URI.create(payload.url()).getScheme();
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("payload.url is not a valid URL");
        }
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new InvalidInputException("payload.url must be an http or https URL");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
