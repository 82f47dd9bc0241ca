package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a Google Calendar event template link. Events last one hour.
 */
@Component
public class CalendarLinkExecutor implements ActionExecutor {

    private static final DateTimeFormatter GOOGLE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final DateTimeFormatter SPOKEN_FORMAT = DateTimeFormatter.ofPattern("EEE d MMM, h:mm a", Locale.ENGLISH);

    private final EventTimeParser timeParser;

    public CalendarLinkExecutor() {
        this(Clock.systemDefaultZone());
    }

    CalendarLinkExecutor(Clock clock) {
        this.timeParser = new EventTimeParser(clock);
    }

    @Override
    public String name() {
        return "calendar";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.CALENDAR;
    }

    @Override
    public String description() {
        return "Creates a calendar event";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String title = Links.orDefault(parameters.get(SlotNames.TITLE), "Event");
        title = Character.toUpperCase(title.charAt(0)) + title.substring(1);
        LocalDateTime start = timeParser.parse(parameters.get(SlotNames.WHEN));
        LocalDateTime end = start.plusHours(1);

        String url = "https://calendar.google.com/calendar/render?action=TEMPLATE"
                + "&text=" + Links.encode(title)
                + "&dates=" + GOOGLE_FORMAT.format(start) + "/" + GOOGLE_FORMAT.format(end);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", url);
        payload.put("title", title);
        payload.put("start", start.toString());
        payload.put("end", end.toString());
        return ActionOutcome.success("Calendar event '" + title + "' ready for " + SPOKEN_FORMAT.format(start) + ".",
                payload);
    }
}
