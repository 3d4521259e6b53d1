package com.cronhook.core;

/**
 * Validates recurrence expressions without side effects.
 */
public final class ScheduleValidator {
    private ScheduleValidator() {}

    /**
     * Returns true if the expression is a well formed five or six field cron
     * expression. Malformed input, including {@code null}, yields false.
     */
    public static boolean validate(String expression) {
        try {
            CronSchedule.parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }
}
