package com.cronhook.core;

import java.io.IOException;
import java.util.List;

/**
 * Persists the complete set of job definitions.
 */
public interface JobStore {
    /**
     * Load all persisted job definitions.
     *
     * @throws StoreCorruptException if the stored data cannot be read as a job list
     */
    List<Job> load() throws IOException;

    /** Replace the persisted job definitions with the given snapshot. */
    void save(List<Job> jobs) throws IOException;
}
