package com.cronhook.core;

/**
 * Listener notified when a webhook call finishes.
 */
public interface DispatchListener {
    /**
     * Invoked on the dispatch worker thread after each call.
     *
     * @param outcome result of the call
     */
    void dispatchFinished(DispatchOutcome outcome);
}
