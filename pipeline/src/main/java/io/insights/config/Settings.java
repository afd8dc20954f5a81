package io.insights.config;

import java.util.Map;

/**
 * Configuration lookup: a JVM system property wins over an environment variable, which wins over the default.
 * Property names are dotted ({@code insights.lowStockLimit}); the matching variable is upper snake case
 * ({@code INSIGHTS_LOW_STOCK_LIMIT}).
 */
public final class Settings {
    private final Map<String, String> env;

    public Settings() { this(System.getenv()); }
    public Settings(Map<String, String> env) { this.env = Map.copyOf(env); }

    public String string(String property, String defaultValue) {
        String v = System.getProperty(property);
        if (v == null || v.isBlank()) v = env.get(envName(property));
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public int intValue(String property, int defaultValue) {
        String v = string(property, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + property + " must be an integer, got '" + v + "'", e);
        }
    }

    public boolean flag(String property, boolean defaultValue) {
        String v = string(property, null);
        return v == null ? defaultValue : Boolean.parseBoolean(v);
    }

    // insights.lowStockLimit -> INSIGHTS_LOW_STOCK_LIMIT
    static String envName(String property) {
        StringBuilder sb = new StringBuilder(property.length() + 8);
        for (int i = 0; i < property.length(); i++) {
            char c = property.charAt(i);
            if (c == '.' || c == '-') {
                sb.append('_');
            } else if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(property.charAt(i - 1))) {
                sb.append('_').append(c);
            } else {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }
}
