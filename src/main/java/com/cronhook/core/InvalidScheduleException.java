package com.cronhook.core;

/**
 * Thrown when a recurrence expression does not parse.
 */
public class InvalidScheduleException extends IllegalArgumentException {
    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super("Invalid schedule '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
