package dev.dmcode.output;

import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@RequiredArgsConstructor
final class SettingsReader {

    private final Map<String, ?> settings;
    private final Set<String> readNames = new HashSet<>();

    String string(String name, String defaultValue) {
        var value = read(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw invalidType(name, value, "string");
    }

    Integer integer(String name, Integer defaultValue) {
        var value = number(name, defaultValue == null ? null : defaultValue.longValue());
        if (value == null) {
            return null;
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigurationException(String.format("Setting '%s' is out of range: %d", name, value));
        }
        return value.intValue();
    }

    Long number(String name, Long defaultValue) {
        var value = read(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof CharSequence) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException exception) {
                throw invalidType(name, value, "number");
            }
        }
        throw invalidType(name, value, "number");
    }

    Map<String, String> map(String name) {
        var value = read(name);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw invalidType(name, value, "map");
        }
        var entries = new LinkedHashMap<String, String>();
        for (var entry : ((Map<?, ?>) value).entrySet()) {
            entries.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        return entries;
    }

    void rejectUnknown() {
        var unknown = new TreeSet<>(settings.keySet());
        unknown.removeAll(readNames);
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown settings: " + unknown);
        }
    }

    private Object read(String name) {
        readNames.add(name);
        return settings.get(name);
    }

    private static ConfigurationException invalidType(String name, Object value, String expected) {
        return new ConfigurationException(String.format(
            "Setting '%s' must be a %s, got %s: %s", name, expected, value.getClass().getSimpleName(), value));
    }
}
