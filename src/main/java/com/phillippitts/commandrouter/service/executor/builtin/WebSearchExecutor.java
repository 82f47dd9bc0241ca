package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Builds a Google or YouTube search URL.
 */
@Component
public class WebSearchExecutor implements ActionExecutor {

    private static final Map<String, String> ENGINES = Map.of(
            "google", "https://www.google.com/search?q=",
            "youtube", "https://www.youtube.com/results?search_query=");

    @Override
    public String name() {
        return "web_search";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.WEB_SEARCH;
    }

    @Override
    public String description() {
        return "Searches the web";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String query = parameters.get(SlotNames.QUERY);
        if (query == null || query.isBlank()) {
            return ActionOutcome.failure("What should I search for?");
        }
        String engine = Links.orDefault(parameters.get(SlotNames.ENGINE), "google").toLowerCase(Locale.ROOT);
        String base = ENGINES.getOrDefault(engine, ENGINES.get("google"));
        String url = base + Links.encode(query);
        return ActionOutcome.success("Searching " + (ENGINES.containsKey(engine) ? engine : "google")
                + " for '" + query + "'.", Map.of("url", url, "query", query));
    }
}
