package com.cronhook.core;

/**
 * Thrown when a required job field is missing or blank.
 */
public class InvalidInputException extends IllegalArgumentException {
    public InvalidInputException(String message) {
        super(message);
    }
}
