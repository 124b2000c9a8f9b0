package org.pragmatica.slides.model;

import java.util.Map;
import java.util.TreeMap;

/**
 * Names and substitution of {@code %{name}} variables.
 */
public final class Variables {
    public static final String PAGE_NUMBER = "%{pagenumber}";
    public static final String TOTAL_PAGES = "%{totalpages}";
    public static final String DATE = "%{date}";
    public static final String RESOURCE_PATH = "%{resourcepath}";

    private Variables() {}

    public static String bracket(String name) {
        return "%{" + name + "}";
    }

    /**
     * Replace every occurrence of each bracketed key in {@code text}, in ascending key order, so a
     * value may refer to a variable that sorts after it. Unknown variables stay as written.
     */
    public static String substitute(String text, Map<String, String> variables) {
        if (text.indexOf("%{") < 0) {
            return text;
        }
        var result = text;
        for (var entry : new TreeMap<>(variables).entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }
}
