package com.example.interviewcoach.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Presence of the four STAR narrative components in an answer.
 */
public record StarComponents(
        boolean situation,
        boolean task,
        boolean action,
        boolean result
) {
    public static final StarComponents NONE = new StarComponents(false, false, false, false);

    public int count() {
        int count = 0;
        if (situation) count++;
        if (task) count++;
        if (action) count++;
        if (result) count++;
        return count;
    }

    /**
     * Map view keyed {@code situation, task, action, result}, always in that order
     * and always with all four keys.
     */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        map.put("situation", situation);
        map.put("task", task);
        map.put("action", action);
        map.put("result", result);
        return Collections.unmodifiableMap(map);
    }

    /** Upper-cased names of the components that were found. */
    public List<String> present() {
        return names(true);
    }

    /** Upper-cased names of the components that are missing. */
    public List<String> missing() {
        return names(false);
    }

    private List<String> names(boolean found) {
        List<String> names = new ArrayList<>();
        asMap().forEach((name, present) -> {
            if (present == found) {
                names.add(name.toUpperCase(Locale.ROOT));
            }
        });
        return names;
    }
}
