package com.umitunal.qcron.trigger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;

/**
 * Parsed five-field cron rule: {@code minute hour day-of-month month day-of-week}.
 *
 * Supported field syntax: {@code *}, single values, ranges {@code a-b}, steps <code>&#42;/n</code>,
 * {@code a-b/n} and {@code a/n}, and comma lists of these. Months accept {@code JAN..DEC},
 * days of week accept {@code SUN..SAT} (0 = Sunday, 6 = Saturday).
 *
 * When both day-of-month and day-of-week are restricted, a date matching either one qualifies.
 * Only a bare {@code *} leaves a day field unrestricted: <code>&#42;/2</code> counts as a restriction,
 * so <code>0 0 &#42;/2 * MON</code> fires on odd days of the month and on Mondays.
 *
 * A step may not exceed the field's maximum value. Wall-clock times that fall into a zone's
 * daylight-saving gap do not exist on that day and are skipped rather than shifted.
 * Instances are immutable and safe to share between threads.
 */
public final class CronExpression {

    static final int SEARCH_YEARS = 5;

    private static final String[] MONTH_NAMES = {
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    };
    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private final String rule;
    private final ZoneId zone;
    private final BitSet minutes = new BitSet(60);
    private final BitSet hours = new BitSet(24);
    private final BitSet daysOfMonth = new BitSet(32);  // 1..31
    private final BitSet months = new BitSet(13);       // 1..12
    private final BitSet daysOfWeek = new BitSet(7);    // 0..6
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String rule, ZoneId zone, String[] fields) throws InvalidRuleException {
        this.rule = rule;
        this.zone = zone;
        parseField(fields[0], 0, 59, null, 0, minutes);
        parseField(fields[1], 0, 23, null, 0, hours);
        parseField(fields[2], 1, 31, null, 0, daysOfMonth);
        parseField(fields[3], 1, 12, MONTH_NAMES, 1, months);
        parseField(fields[4], 0, 6, DAY_NAMES, 0, daysOfWeek);
        this.dayOfMonthRestricted = !fields[2].equals("*");
        this.dayOfWeekRestricted = !fields[4].equals("*");
    }

    /**
     * Parse a rule evaluated in UTC.
     */
    public static CronExpression parse(String rule) throws InvalidRuleException {
        return parse(rule, ZoneOffset.UTC);
    }

    /**
     * Parse a rule whose wall-clock fields are evaluated in the given zone.
     *
     * @throws InvalidRuleException if the rule does not have five fields or any field is malformed
     */
    public static CronExpression parse(String rule, ZoneId zone) throws InvalidRuleException {
        if (rule == null || rule.isBlank()) {
            throw new InvalidRuleException(String.valueOf(rule), "Cron rule is empty");
        }
        String[] fields = rule.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidRuleException(rule, "Cron rule must have 5 fields, found " + fields.length);
        }
        return new CronExpression(rule.trim(), zone, fields);
    }

    /**
     * Smallest minute-aligned instant strictly after {@code from} that satisfies every field.
     *
     * @throws UnsatisfiableRuleException if nothing matches within {@value #SEARCH_YEARS} years
     */
    public Instant nextFireAfter(Instant from) throws UnsatisfiableRuleException {
        ZonedDateTime start = ZonedDateTime.ofInstant(from, zone)
                .truncatedTo(ChronoUnit.MINUTES)
                .plusMinutes(1);
        LocalDate date = start.toLocalDate();
        LocalDate limit = date.plusYears(SEARCH_YEARS);
        int hour = start.getHour();
        int minute = start.getMinute();

        while (!date.isAfter(limit)) {
            if (!months.get(date.getMonthValue())) {
                date = date.plusMonths(1).withDayOfMonth(1);
                hour = 0;
                minute = 0;
                continue;
            }
            if (dayMatches(date)) {
                LocalTime time = firstTimeAtOrAfter(hour, minute);
                if (time != null) {
                    ZonedDateTime zoned = ZonedDateTime.of(date, time, zone);
                    Instant candidate = zoned.toInstant();
                    if (zoned.toLocalTime().equals(time) && candidate.isAfter(from)) {
                        return candidate;
                    }
                    // Time lies in a DST gap or was folded back by an offset change; try the next minute
                    minute = time.getMinute() + 1;
                    hour = time.getHour();
                    if (minute == 60) {
                        minute = 0;
                        hour++;
                    }
                    if (hour < 24) {
                        continue;
                    }
                }
            }
            date = date.plusDays(1);
            hour = 0;
            minute = 0;
        }
        throw new UnsatisfiableRuleException(rule, "No matching time within " + SEARCH_YEARS + " years");
    }

    /**
     * Whether the minute containing {@code instant} satisfies the rule.
     */
    public boolean matches(Instant instant) {
        ZonedDateTime z = ZonedDateTime.ofInstant(instant, zone);
        return months.get(z.getMonthValue())
                && dayMatches(z.toLocalDate())
                && hours.get(z.getHour())
                && minutes.get(z.getMinute());
    }

    /**
     * Whether a stored fire time is due at {@code now} and still consistent with this rule.
     */
    public boolean isDue(Instant nextFireAt, Instant now) {
        return nextFireAt != null && !nextFireAt.isAfter(now) && matches(nextFireAt);
    }

    public ZoneId getZone() {
        return zone;
    }

    private boolean dayMatches(LocalDate date) {
        boolean domMatch = daysOfMonth.get(date.getDayOfMonth());
        boolean dowMatch = daysOfWeek.get(date.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    private LocalTime firstTimeAtOrAfter(int hour, int minute) {
        for (int h = hours.nextSetBit(hour); h >= 0; h = hours.nextSetBit(h + 1)) {
            int m = minutes.nextSetBit(h == hour ? minute : 0);
            if (m >= 0) {
                return LocalTime.of(h, m);
            }
        }
        return null;
    }

    private void parseField(String field, int min, int max, String[] names, int nameBase, BitSet out)
            throws InvalidRuleException {
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new InvalidRuleException(rule, "Empty list element in field '" + field + "'");
            }
            String rangePart = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                rangePart = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), field);
                if (step <= 0) {
                    throw new InvalidRuleException(rule, "Step must be positive in field '" + field + "'");
                }
                if (step > max) {
                    throw new InvalidRuleException(rule, "Step exceeds " + max + " in field '" + field + "'");
                }
            }

            int start;
            int end;
            if (rangePart.equals("*")) {
                start = min;
                end = max;
            } else if (rangePart.indexOf('-') > 0) {
                String[] bounds = rangePart.split("-", -1);
                if (bounds.length != 2) {
                    throw new InvalidRuleException(rule, "Malformed range '" + rangePart + "'");
                }
                start = parseValue(bounds[0], names, nameBase, field);
                end = parseValue(bounds[1], names, nameBase, field);
            } else {
                start = parseValue(rangePart, names, nameBase, field);
                end = slash >= 0 ? max : start;
            }

            if (start < min || end > max || start > end) {
                throw new InvalidRuleException(rule,
                        "Value out of range " + min + "-" + max + " in field '" + field + "'");
            }
            for (int v = start; v <= end; v += step) {
                out.set(v);
            }
        }
    }

    private int parseValue(String token, String[] names, int nameBase, String field) throws InvalidRuleException {
        if (names != null) {
            String upper = token.toUpperCase(Locale.ROOT);
            for (int i = 0; i < names.length; i++) {
                if (names[i].equals(upper)) {
                    return i + nameBase;
                }
            }
        }
        return parseNumber(token, field);
    }

    private int parseNumber(String token, String field) throws InvalidRuleException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidRuleException(rule, "Not a number '" + token + "' in field '" + field + "'", e);
        }
    }

    @Override
    public String toString() {
        return rule;
    }
}
