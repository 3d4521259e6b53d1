package com.cronhook.core;

/**
 * Performs the side effect of a single firing.
 * <p>
 * Implementations must return without waiting for the side effect to finish
 * and must never throw back into the caller.
 */
public interface JobDispatcher {
    void dispatch(Job job);

    /** Stops accepting work; in-flight dispatches are not awaited. */
    default void shutdown() {
    }
}
