package dev.dmcode.output;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
enum SerializerType {

    STRING(StringSerializer.class.getName()) {
        @Override
        Object toWire(String value) {
            return value;
        }
    },
    BYTE_ARRAY(ByteArraySerializer.class.getName()) {
        @Override
        Object toWire(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }
    };

    private final String className;

    abstract Object toWire(String value);

    static SerializerType fromIdentifier(String option, String identifier) {
        return Arrays.stream(values())
            .filter(type -> type.className.equals(identifier))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException(String.format(
                "Invalid %s '%s', expected one of: %s", option, identifier, supportedIdentifiers())));
    }

    private static String supportedIdentifiers() {
        return Arrays.stream(values())
            .map(SerializerType::getClassName)
            .collect(Collectors.joining(", "));
    }
}
