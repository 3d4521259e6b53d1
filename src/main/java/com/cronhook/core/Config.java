package com.cronhook.core;

import java.time.ZoneId;

/**
 * Configuration lookup: system property first, then environment variable,
 * then the supplied default.
 */
public final class Config {
    private Config() {}

    public static String get(String key, String def) {
        String v = System.getProperty(key);
        if (v == null || v.isEmpty()) {
            v = System.getenv(key);
        }
        return v == null || v.isEmpty() ? def : v;
    }

    /** Integer setting; unparsable or non-positive values fall back to the default. */
    public static int getInt(String key, int def) {
        String v = get(key, null);
        if (v == null) return def;
        try {
            int parsed = Integer.parseInt(v.trim());
            return parsed > 0 ? parsed : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Time zone used to evaluate schedules, {@code CRON_TIME_ZONE} or the system zone. */
    public static ZoneId getZone() {
        String v = get("CRON_TIME_ZONE", null);
        return v == null ? ZoneId.systemDefault() : ZoneId.of(v);
    }
}
