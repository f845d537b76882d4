package io.penguin.metrics.config;

import java.util.Locale;

/**
 * Deterministic identifier derivation shared by the binder and the runtime.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /**
     * Lower-cases and reduces a display name to {@code [a-z0-9_]}, collapsing separators.
     * {@code "Main Battery-1"} becomes {@code "main_battery_1"}.
     */
    public static String sanitize(String name) {
        StringBuilder out = new StringBuilder(name.length());
        for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
            } else if (c == ' ' || c == '-' || c == '_' || c == '.' || c == '/' || c == ':') {
                if (out.length() > 0 && out.charAt(out.length() - 1) != '_') {
                    out.append('_');
                }
            }
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '_') {
            end--;
        }
        return out.substring(0, end);
    }
}
