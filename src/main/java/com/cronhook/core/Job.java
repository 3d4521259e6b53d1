package com.cronhook.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Definition of a recurring job. This is both the persisted and the public
 * form; the live trigger handle is kept by {@link JobRegistry} alongside it.
 */
@JsonPropertyOrder({"id", "name", "schedule", "payload", "createdAt"})
public record Job(String id, String name, String schedule, JobPayload payload, Instant createdAt) {

    /** Returns a copy with the mutable fields replaced. */
    public Job withDefinition(String name, String schedule, JobPayload payload) {
        return new Job(id, name, schedule, payload, createdAt);
    }

    /** True if a firing of this job results in an outbound call. */
    public boolean hasTarget() {
        return payload != null && payload.url() != null && !payload.url().isBlank();
    }
}
