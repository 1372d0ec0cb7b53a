package dev.dmcode.output;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

import java.util.HashMap;
import java.util.Map;

@FunctionalInterface
public interface ProducerFactory {

    ProducerFactory KAFKA = properties -> new KafkaProducer<>(new HashMap<String, Object>(properties));

    Producer<Object, Object> create(Map<String, String> properties);
}
