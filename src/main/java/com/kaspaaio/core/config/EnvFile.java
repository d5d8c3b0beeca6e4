package com.kaspaaio.core.config;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Flat {@code KEY=value} environment file. Keys are sorted on write so the output is
 * a pure function of the map.
 */
public final class EnvFile {

    public static final Pattern KEY_PATTERN = Pattern.compile("^[A-Z_][A-Z0-9_]*$");

    static final String HEADER = "# Kaspa All-in-One configuration\n"
            + "# Generated by kaspa-aio; changes are applied through reconfiguration\n";

    private EnvFile() {}

    public static boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    public static String render(Map<String, String> env) {
        var sb = new StringBuilder(HEADER);
        for (var entry : new TreeMap<>(env).entrySet()) {
            if (!isValidKey(entry.getKey())) {
                throw new IllegalArgumentException("Invalid environment key: " + entry.getKey());
            }
            String value = entry.getValue() != null ? entry.getValue() : "";
            if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("Value of " + entry.getKey() + " contains a line break");
            }
            sb.append(entry.getKey()).append('=').append(needsQuotes(value) ? '"' + value + '"' : value).append('\n');
        }
        return sb.toString();
    }

    /** Values that {@link #parse} would trim or unquote are written in double quotes. */
    private static boolean needsQuotes(String value) {
        return !value.equals(value.trim()) || !unquote(value).equals(value);
    }

    /**
     * Parses an environment file. Blank lines and {@code #} comments are skipped;
     * surrounding double or single quotes are stripped from values.
     *
     * @throws IllegalArgumentException on a malformed line or key
     */
    public static Map<String, String> parse(String text) {
        var env = new TreeMap<String, String>();
        if (text == null) {
            return env;
        }
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Line " + (i + 1) + " is not KEY=value");
            }
            String key = line.substring(0, eq).trim();
            if (!isValidKey(key)) {
                throw new IllegalArgumentException("Line " + (i + 1) + ": invalid key " + key);
            }
            env.put(key, unquote(line.substring(eq + 1).trim()));
        }
        return env;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
