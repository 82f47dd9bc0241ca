package com.phillippitts.commandrouter.service.executor.builtin;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns spoken time expressions ("tomorrow at 3pm", "next friday", "in 2 hours") into a start time.
 *
 * <p>Rules:
 * <ul>
 *   <li>date words: today, tonight, tomorrow, day after tomorrow, [next|on|this] weekday</li>
 *   <li>times: "3pm", "3:30 pm", "15:00", "at 9"; "tonight" alone means 20:00</li>
 *   <li>relative: "in N minutes|hours|days"</li>
 *   <li>a date without a time starts at 09:00; nothing recognizable means the next full hour</li>
 *   <li>a bare time already past today moves to tomorrow</li>
 * </ul>
 */
final class EventTimeParser {

    private static final Pattern RELATIVE = Pattern.compile("\\bin\\s+(\\d+)\\s+(minute|min|hour|hr|day)s?\\b");
    private static final Pattern TIME = Pattern.compile(
            "\\b(?:at\\s+)?(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)|\\b(\\d{1,2}):(\\d{2})\\b|\\bat\\s+(\\d{1,2})\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:(next|on|this)\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b");

    private final Clock clock;

    EventTimeParser(Clock clock) {
        this.clock = clock;
    }

    LocalDateTime parse(String when) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (when == null || when.isBlank()) {
            return nextFullHour(now);
        }
        String s = when.toLowerCase(Locale.ROOT);

        Matcher rel = RELATIVE.matcher(s);
        if (rel.find()) {
            long n = Long.parseLong(rel.group(1));
            return switch (rel.group(2)) {
                case "minute", "min" -> now.plusMinutes(n).truncatedTo(ChronoUnit.MINUTES);
                case "hour", "hr" -> now.plusHours(n).truncatedTo(ChronoUnit.MINUTES);
                default -> now.plusDays(n).toLocalDate().atTime(9, 0);
            };
        }

        LocalDate today = now.toLocalDate();
        LocalDate date = null;
        if (s.contains("day after tomorrow")) {
            date = today.plusDays(2);
        } else if (s.contains("tomorrow")) {
            date = today.plusDays(1);
        } else if (s.contains("today") || s.contains("tonight")) {
            date = today;
        } else {
            Matcher wd = WEEKDAY.matcher(s);
            if (wd.find()) {
                DayOfWeek day = DayOfWeek.valueOf(wd.group(2).toUpperCase(Locale.ROOT));
                date = today.with(TemporalAdjusters.next(day));
            }
        }

        LocalTime time = parseTime(s);
        if (time == null && s.contains("tonight")) {
            time = LocalTime.of(20, 0);
        }

        if (date == null && time == null) {
            return nextFullHour(now);
        }
        if (date == null) {
            LocalDateTime candidate = today.atTime(time);
            return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
        }
        return date.atTime(time == null ? LocalTime.of(9, 0) : time);
    }

    private static LocalTime parseTime(String s) {
        Matcher m = TIME.matcher(s);
        if (!m.find()) {
            return null;
        }
        int hour;
        int minute = 0;
        if (m.group(1) != null) {
            hour = Integer.parseInt(m.group(1));
            if (m.group(2) != null) {
                minute = Integer.parseInt(m.group(2));
            }
            boolean pm = m.group(3).startsWith("p");
            if (hour == 12) {
                hour = pm ? 12 : 0;
            } else if (pm) {
                hour += 12;
            }
        } else if (m.group(4) != null) {
            hour = Integer.parseInt(m.group(4));
            minute = Integer.parseInt(m.group(5));
        } else {
            hour = Integer.parseInt(m.group(6));
            // "at 3" most likely means the afternoon
            if (hour >= 1 && hour <= 7) {
                hour += 12;
            }
        }
        if (hour > 23 || minute > 59) {
            return null;
        }
        return LocalTime.of(hour, minute);
    }

    private static LocalDateTime nextFullHour(LocalDateTime now) {
        return now.truncatedTo(ChronoUnit.HOURS).plusHours(1);
    }
}
