package dev.dmcode.event;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class Event {

    public static final String TIMESTAMP_FIELD = "@timestamp";

    private static final EventTemplate DEFAULT_BODY = EventTemplate.compile("%{host} %{message}");

    private final Map<String, Object> fields;

    private Event(Map<String, ?> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Event of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "Event fields must be provided");
        if (fields.containsKey(TIMESTAMP_FIELD)) {
            return new Event(fields);
        }
        return of(fields, Instant.now());
    }

    public static Event of(Map<String, ?> fields, Instant timestamp) {
        Objects.requireNonNull(fields, "Event fields must be provided");
        Objects.requireNonNull(timestamp, "Event timestamp must be provided");
        var withTimestamp = new LinkedHashMap<String, Object>(fields);
        withTimestamp.put(TIMESTAMP_FIELD, timestamp);
        return new Event(withTimestamp);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Resolves a field name ({@code host}) or a nested reference ({@code [request][host]}).
     *
     * @return the value, or {@code null} when any segment of the reference is missing
     */
    public Object get(String reference) {
        if (!reference.startsWith("[")) {
            return fields.get(reference);
        }
        Object current = fields;
        int position = 0;
        while (position < reference.length()) {
            if (reference.charAt(position) != '[') {
                return null;
            }
            int end = reference.indexOf(']', position);
            if (end < 0 || !(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(reference.substring(position + 1, end));
            position = end + 1;
        }
        return current;
    }

    public Instant timestamp() {
        var value = fields.get(TIMESTAMP_FIELD);
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof CharSequence) {
            try {
                return Instant.parse((CharSequence) value);
            } catch (DateTimeParseException exception) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return timestamp() + " " + DEFAULT_BODY.render(this);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Event && fields.equals(((Event) other).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }
}
