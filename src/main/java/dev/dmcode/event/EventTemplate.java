package dev.dmcode.event;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String with {@code %{reference}} placeholders resolved against an {@link Event}.
 *
 * <p>Supported placeholders:
 * <ul>
 *   <li>{@code %{field}} and {@code %{[outer][inner]}} - field values</li>
 *   <li>{@code %{+yyyy.MM.dd}} - event timestamp formatted in UTC</li>
 *   <li>{@code %{+%s}} - event timestamp as epoch seconds</li>
 * </ul>
 * A placeholder whose value is missing is rendered verbatim.
 */
public final class EventTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("%\\{([^}]+)}");
    private static final String EPOCH_SECONDS = "%s";

    private final String source;
    private final List<Part> parts;

    private EventTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = parts;
    }

    /**
     * @throws IllegalArgumentException if a timestamp placeholder carries an invalid pattern
     */
    public static EventTemplate compile(String source) {
        Objects.requireNonNull(source, "Template source must be provided");
        var parts = new ArrayList<Part>();
        var matcher = PLACEHOLDER.matcher(source);
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() > position) {
                parts.add(new Literal(source.substring(position, matcher.start())));
            }
            parts.add(placeholder(matcher.group(), matcher.group(1)));
            position = matcher.end();
        }
        if (position < source.length()) {
            parts.add(new Literal(source.substring(position)));
        }
        return new EventTemplate(source, List.copyOf(parts));
    }

    public boolean isLiteral() {
        return parts.stream().allMatch(Literal.class::isInstance);
    }

    public String render(Event event) {
        if (isLiteral()) {
            return source;
        }
        var output = new StringBuilder(source.length() + 16);
        for (var part : parts) {
            part.appendTo(output, event);
        }
        return output.toString();
    }

    @Override
    public String toString() {
        return source;
    }

    private static Part placeholder(String raw, String reference) {
        if (!reference.startsWith("+")) {
            return new FieldReference(raw, reference);
        }
        var pattern = reference.substring(1);
        if (EPOCH_SECONDS.equals(pattern)) {
            return new EpochSeconds(raw);
        }
        return new TimestampFormat(raw, DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC));
    }

    private interface Part {

        void appendTo(StringBuilder output, Event event);
    }

    private record Literal(String text) implements Part {

        @Override
        public void appendTo(StringBuilder output, Event event) {
            output.append(text);
        }
    }

    private record FieldReference(String raw, String reference) implements Part {

        @Override
        public void appendTo(StringBuilder output, Event event) {
            var value = event.get(reference);
            if (value == null) {
                output.append(raw);
            } else if (value instanceof Collection) {
                output.append(((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else {
                output.append(value);
            }
        }
    }

    private record TimestampFormat(String raw, DateTimeFormatter formatter) implements Part {

        @Override
        public void appendTo(StringBuilder output, Event event) {
            var timestamp = event.timestamp();
            output.append(timestamp != null ? formatter.format(timestamp) : raw);
        }
    }

    private record EpochSeconds(String raw) implements Part {

        @Override
        public void appendTo(StringBuilder output, Event event) {
            var timestamp = event.timestamp();
            output.append(timestamp != null ? String.valueOf(timestamp.getEpochSecond()) : raw);
        }
    }
}
