package com.cronhook.core;

/**
 * Result of one outbound call.
 *
 * @param jobId          job that fired
 * @param url            target url
 * @param statusCode     HTTP status, or -1 when no response was received
 * @param success        true for a 2xx response
 * @param error          failure description, null on success
 * @param durationMillis time spent on the call
 */
public record DispatchOutcome(String jobId, String url, int statusCode, boolean success,
                              String error, long durationMillis) {
}
