package com.cronhook.core;

import java.io.IOException;

/**
 * Thrown when the persisted job file exists but is not a readable job list.
 */
public class StoreCorruptException extends IOException {
    public StoreCorruptException(String message) {
        super(message);
    }

    public StoreCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
