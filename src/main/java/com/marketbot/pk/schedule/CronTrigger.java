package com.marketbot.pk.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fires at fixed wall-clock times in one zone, optionally on a single day of the week.
 * Accepts {@code "15:45"}, {@code "11:30,15:00"} and {@code "SUN 20:00"}.
 */
public final class CronTrigger {
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("H:mm");

    private final ZoneId zone;
    private final List<LocalTime> times;
    private final DayOfWeek dayOfWeek;

    CronTrigger(ZoneId zone, List<LocalTime> times, DayOfWeek dayOfWeek) {
        if (times == null || times.isEmpty()) {
            throw new IllegalArgumentException("trigger needs at least one time");
        }
        List<LocalTime> sorted = new ArrayList<>(times);
        Collections.sort(sorted);
        this.zone = zone;
        this.times = Collections.unmodifiableList(sorted);
        this.dayOfWeek = dayOfWeek;
    }

    public static CronTrigger parse(String expression, ZoneId zone) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new IllegalArgumentException("empty schedule expression");
        }
        String value = expression.trim();
        DayOfWeek day = null;
        int space = value.indexOf(' ');
        if (space > 0 && Character.isLetter(value.charAt(0))) {
            day = parseDay(value.substring(0, space));
            value = value.substring(space + 1).trim();
        }
        List<LocalTime> out = new ArrayList<>();
        for (String token : value.split(",")) {
            LocalTime parsed = parseTime(token.trim(), expression);
            if (!out.contains(parsed)) {
                out.add(parsed);
            }
        }
        return new CronTrigger(zone, out, day);
    }

    /**
     * Next firing strictly after {@code after}, expressed in this trigger's zone.
     */
    public ZonedDateTime next(ZonedDateTime after) {
        ZonedDateTime now = after.withZoneSameInstant(zone);
        LocalDate date = now.toLocalDate();
        for (int i = 0; i <= 8; i++) {
            LocalDate candidateDate = date.plusDays(i);
            if (dayOfWeek != null && candidateDate.getDayOfWeek() != dayOfWeek) {
                continue;
            }
            for (LocalTime t : times) {
                ZonedDateTime candidate = candidateDate.atTime(t).atZone(zone);
                if (candidate.isAfter(now)) {
                    return candidate;
                }
            }
        }
        throw new IllegalStateException("no next firing for " + this);
    }

    @Override
    public String toString() {
        String formatted = times.stream()
                .map(t -> t.format(DateTimeFormatter.ofPattern("HH:mm")))
                .collect(Collectors.joining(","));
        String prefix = dayOfWeek == null ? "" : dayOfWeek.name().substring(0, 3) + " ";
        return prefix + formatted + " " + zone;
    }

    private static LocalTime parseTime(String token, String expression) {
        try {
            return LocalTime.parse(token, TIME_FMT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid time '" + token + "' in schedule '" + expression + "'", e);
        }
    }

    private static DayOfWeek parseDay(String token) {
        String upper = token.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(upper) || day.name().startsWith(upper) && upper.length() >= 3) {
                return day;
            }
        }
        throw new IllegalArgumentException("invalid day of week: " + token);
    }
}
