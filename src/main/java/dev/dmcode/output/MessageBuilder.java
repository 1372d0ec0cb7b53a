package dev.dmcode.output;

import dev.dmcode.event.Event;
import dev.dmcode.event.EventTemplate;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@RequiredArgsConstructor
final class MessageBuilder {

    private final EventTemplate topic;
    private final EventTemplate key;
    private final Map<String, EventTemplate> headers;
    private final SerializerType keySerializer;
    private final SerializerType valueSerializer;

    static MessageBuilder fromConfiguration(OutputConfiguration configuration) {
        try {
            var headers = new LinkedHashMap<String, EventTemplate>();
            configuration.messageHeaders().forEach((name, value) -> headers.put(name, EventTemplate.compile(value)));
            return new MessageBuilder(
                EventTemplate.compile(configuration.topicId()),
                configuration.messageKey() != null ? EventTemplate.compile(configuration.messageKey()) : null,
                Collections.unmodifiableMap(headers),
                SerializerType.fromIdentifier("key_serializer", configuration.keySerializer()),
                SerializerType.fromIdentifier("value_serializer", configuration.valueSerializer())
            );
        } catch (ConfigurationException exception) {
            throw exception;
        } catch (IllegalArgumentException exception) {
            throw new ConfigurationException("Invalid message template: " + exception.getMessage(), exception);
        }
    }

    ProducerRecord<Object, Object> build(Event event) {
        var recordHeaders = new RecordHeaders();
        headers.forEach((name, template) ->
            recordHeaders.add(name, template.render(event).getBytes(StandardCharsets.UTF_8)));
        return new ProducerRecord<>(
            topic.render(event),
            null,
            null,
            key != null ? keySerializer.toWire(key.render(event)) : null,
            valueSerializer.toWire(event.toString()),
            recordHeaders
        );
    }
}
