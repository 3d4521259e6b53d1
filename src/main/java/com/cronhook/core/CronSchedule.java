package com.cronhook.core;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Date;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Parsed standard cron expression.
 * <p>
 * Accepts five fields ({@code minute hour day-of-month month day-of-week}) or
 * six fields with a leading {@code second}. Each field supports {@code *},
 * single values, ranges, steps and comma separated lists; months and weekdays
 * may also be given by their three letter English names. Day-of-week 0 and 7
 * both mean Sunday.
 * <p>
 * The parsed fields are rendered in canonical Quartz syntax and handed to
 * {@link CronExpression} for calendar arithmetic. When both day-of-month and
 * day-of-week are restricted, a time must match both of them, which Quartz
 * cannot express in one expression, so a second expression is used as a
 * day-of-week filter.
 */
public final class CronSchedule {
    private static final String[] MONTH_NAMES = {
        "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    };
    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    /** Upper bound on day skips while searching a day-of-week match (about 30 years). */
    private static final int MAX_DAY_SKIPS = 11_000;

    private enum Field {
        SECOND("second", 0, 59, null, 0),
        MINUTE("minute", 0, 59, null, 0),
        HOUR("hour", 0, 23, null, 0),
        DAY_OF_MONTH("day-of-month", 1, 31, null, 0),
        MONTH("month", 1, 12, MONTH_NAMES, 1),
        DAY_OF_WEEK("day-of-week", 0, 7, DAY_NAMES, 0);

        final String label;
        final int min;
        final int max;
        final String[] names;
        final int nameOffset;

        Field(String label, int min, int max, String[] names, int nameOffset) {
            this.label = label;
            this.min = min;
            this.max = max;
            this.names = names;
            this.nameOffset = nameOffset;
        }
    }

    private final String expression;
    private final boolean withSeconds;
    private final ZoneId zone;
    private final CronExpression primary;
    private final CronExpression dayOfWeekFilter;

    private CronSchedule(String expression, boolean withSeconds, ZoneId zone,
                         CronExpression primary, CronExpression dayOfWeekFilter) {
        this.expression = expression;
        this.withSeconds = withSeconds;
        this.zone = zone;
        this.primary = primary;
        this.dayOfWeekFilter = dayOfWeekFilter;
    }

    /** Parses the expression in the system default time zone. */
    public static CronSchedule parse(String expression) {
        return parse(expression, ZoneId.systemDefault());
    }

    /**
     * Parses the expression, evaluating it in the given time zone.
     *
     * @throws InvalidScheduleException if the expression is malformed
     */
    public static CronSchedule parse(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            throw new InvalidScheduleException(expression,
                    "expected 5 or 6 fields but found " + parts.length);
        }
        boolean withSeconds = parts.length == 6;
        int i = 0;
        BitSet seconds = withSeconds ? parseField(expression, parts[i++], Field.SECOND) : single(0);
        BitSet minutes = parseField(expression, parts[i++], Field.MINUTE);
        BitSet hours = parseField(expression, parts[i++], Field.HOUR);
        BitSet daysOfMonth = parseField(expression, parts[i++], Field.DAY_OF_MONTH);
        BitSet months = parseField(expression, parts[i++], Field.MONTH);
        BitSet daysOfWeek = parseField(expression, parts[i], Field.DAY_OF_WEEK);
        if (daysOfWeek.get(7)) {
            daysOfWeek.clear(7);
            daysOfWeek.set(0);
        }

        boolean domRestricted = daysOfMonth.cardinality() < 31;
        boolean dowRestricted = daysOfWeek.cardinality() < 7;
        String timePart = render(seconds, Field.SECOND) + " " + render(minutes, Field.MINUTE) + " "
                + render(hours, Field.HOUR);
        String monthPart = render(months, Field.MONTH);
        String dom = render(daysOfMonth, Field.DAY_OF_MONTH);
        String dow = renderQuartzDaysOfWeek(daysOfWeek);

        String primary;
        String filter = null;
        if (dowRestricted && !domRestricted) {
            primary = timePart + " ? " + monthPart + " " + dow;
        } else {
            primary = timePart + " " + dom + " " + monthPart + " ?";
            if (dowRestricted) {
                filter = timePart + " ? " + monthPart + " " + dow;
            }
        }
        TimeZone tz = TimeZone.getTimeZone(zone);
        return new CronSchedule(expression.trim(), withSeconds, zone,
                quartz(expression, primary, tz),
                filter == null ? null : quartz(expression, filter, tz));
    }

    private static CronExpression quartz(String expression, String quartzExpression, TimeZone tz) {
        try {
            CronExpression expr = new CronExpression(quartzExpression);
            expr.setTimeZone(tz);
            return expr;
        } catch (ParseException e) {
            throw new InvalidScheduleException(expression, e.getMessage());
        }
    }

    private static BitSet single(int value) {
        BitSet set = new BitSet();
        set.set(value);
        return set;
    }

    private static BitSet parseField(String expression, String text, Field field) {
        BitSet values = new BitSet(field.max + 1);
        for (String item : text.split(",", -1)) {
            if (item.isEmpty()) {
                throw new InvalidScheduleException(expression, "empty list item in " + field.label + " field");
            }
            parseItem(expression, item, field, values);
        }
        return values;
    }

    private static void parseItem(String expression, String item, Field field, BitSet values) {
        String range = item;
        int step = 1;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            step = parseNumber(expression, item.substring(slash + 1), field, "step");
            if (step < 1) {
                throw new InvalidScheduleException(expression, "step must be positive in " + field.label + " field");
            }
        }

        int start;
        int end;
        if ("*".equals(range)) {
            start = field.min;
            end = field.max;
        } else {
            int dash = range.indexOf('-');
            if (dash >= 0) {
                start = parseValue(expression, range.substring(0, dash), field);
                end = parseValue(expression, range.substring(dash + 1), field);
                if (start > end) {
                    throw new InvalidScheduleException(expression,
                            "range " + range + " is reversed in " + field.label + " field");
                }
            } else {
                start = parseValue(expression, range, field);
                end = slash >= 0 ? field.max : start;
            }
        }
        for (int v = start; v <= end; v += step) {
            values.set(v);
        }
    }

    private static int parseValue(String expression, String token, Field field) {
        if (field.names != null && token.length() == 3 && Character.isLetter(token.charAt(0))) {
            String upper = token.toUpperCase(Locale.ROOT);
            for (int i = 0; i < field.names.length; i++) {
                if (field.names[i].equals(upper)) {
                    return i + field.nameOffset;
                }
            }
        }
        int value = parseNumber(expression, token, field, "value");
        if (value < field.min || value > field.max) {
            throw new InvalidScheduleException(expression, "value " + value + " out of range "
                    + field.min + "-" + field.max + " in " + field.label + " field");
        }
        return value;
    }

    private static int parseNumber(String expression, String token, Field field, String what) {
        if (token.isEmpty()) {
            throw new InvalidScheduleException(expression, "malformed " + what + " '" + token
                    + "' in " + field.label + " field");
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidScheduleException(expression, "malformed " + what + " '" + token
                        + "' in " + field.label + " field");
            }
        }
        // leading zeros are allowed; anything longer is far out of every field's range
        String digits = token.replaceFirst("^0+(?=.)", "");
        if (digits.length() > 4) {
            throw new InvalidScheduleException(expression, what + " " + token + " out of range in "
                    + field.label + " field");
        }
        return Integer.parseInt(digits);
    }

    private static String render(BitSet values, Field field) {
        if (values.cardinality() == field.max - field.min + 1) {
            return "*";
        }
        StringBuilder sb = new StringBuilder();
        for (int v = values.nextSetBit(0); v >= 0; v = values.nextSetBit(v + 1)) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(v);
        }
        return sb.toString();
    }

    // Quartz numbers weekdays 1 (Sunday) to 7 (Saturday).
    private static String renderQuartzDaysOfWeek(BitSet values) {
        StringBuilder sb = new StringBuilder();
        for (int v = values.nextSetBit(0); v >= 0 && v < 7; v = values.nextSetBit(v + 1)) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(v + 1);
        }
        return sb.toString();
    }

    /** The expression as given, trimmed. */
    public String getExpression() {
        return expression;
    }

    /** True for six-field expressions that carry a seconds field. */
    public boolean hasSeconds() {
        return withSeconds;
    }

    /** Quartz form of the expression used for the time search. */
    public String toQuartzExpression() {
        return primary.getCronExpression();
    }

    /**
     * Returns the first matching instant strictly after {@code after}, or
     * {@code null} if the expression never matches again.
     */
    public Instant nextFireAfter(Instant after) {
        Date candidate = primary.getNextValidTimeAfter(Date.from(after));
        if (dayOfWeekFilter == null || candidate == null) {
            return candidate == null ? null : candidate.toInstant();
        }
        for (int skips = 0; candidate != null && skips < MAX_DAY_SKIPS; skips++) {
            if (dayOfWeekFilter.isSatisfiedBy(candidate)) {
                return candidate.toInstant();
            }
            ZonedDateTime lastSecondOfDay = candidate.toInstant().atZone(zone)
                    .toLocalDate().plusDays(1).atStartOfDay(zone).minusSeconds(1);
            candidate = primary.getNextValidTimeAfter(Date.from(lastSecondOfDay.toInstant()));
        }
        return null;
    }

    @Override
    public String toString() {
        return expression;
    }
}
