package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns a launch reference for an application resolved from the applications directory.
 * Web applications are returned as a URL; native ones as an application id the client opens.
 */
@Component
public class AppLaunchExecutor implements ActionExecutor {

    @Override
    public String name() {
        return "app_launcher";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.APP_LAUNCH;
    }

    @Override
    public String description() {
        return "Opens an application or website";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String target = parameters.get(SlotNames.APP);
        if (target == null || target.isBlank()) {
            return ActionOutcome.failure("Which app should I open?");
        }
        String name = Links.orDefault(parameters.get(SlotNames.APP_NAME), target);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("app", name);
        if (target.startsWith("http://") || target.startsWith("https://")) {
            payload.put("url", target);
        } else {
            payload.put("app_id", target);
        }
        return ActionOutcome.success("Opening " + name + ".", payload);
    }
}
