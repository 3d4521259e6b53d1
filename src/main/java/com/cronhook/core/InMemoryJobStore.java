package com.cronhook.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple in-memory JobStore; nothing survives the process.
 */
public class InMemoryJobStore implements JobStore {
    private final List<Job> jobs = new ArrayList<>();
    private int saveCount;

    @Override
    public synchronized void save(List<Job> snapshot) {
        jobs.clear();
        jobs.addAll(snapshot);
        saveCount++;
    }

    @Override
    public synchronized List<Job> load() {
        return new ArrayList<>(jobs);
    }

    /** Number of snapshots written so far. */
    public synchronized int getSaveCount() {
        return saveCount;
    }
}
