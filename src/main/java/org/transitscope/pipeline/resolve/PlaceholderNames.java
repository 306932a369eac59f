package org.transitscope.pipeline.resolve;

import java.util.regex.Pattern;

/**
 * Recognizes synthesized or empty names that must never win over a real name.
 */
public final class PlaceholderNames {

    private static final Pattern PLACEHOLDER = Pattern.compile("^(Stop|Station|Line) #\\d+$");

    private PlaceholderNames() {
    }

    /**
     * Returns whether a candidate name is a placeholder: {@code null}, empty, whitespace
     * only, or shaped like {@code "Stop #7"} / {@code "Station #3"}.
     */
    public static boolean isPlaceholder(String name) {
        return name == null || name.isBlank() || PLACEHOLDER.matcher(name.trim()).matches();
    }

    public static boolean isRealName(Object candidate) {
        return candidate instanceof String s && !isPlaceholder(s);
    }
}
