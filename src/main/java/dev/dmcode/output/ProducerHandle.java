package dev.dmcode.output;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

final class ProducerHandle implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProducerHandle.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final Producer<Object, Object> producer;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ProducerHandle(Producer<Object, Object> producer) {
        this.producer = Objects.requireNonNull(producer, "Producer must be provided");
    }

    static ProducerHandle open(ProducerFactory factory, Map<String, String> properties) {
        Producer<Object, Object> producer;
        try {
            producer = factory.create(properties);
        } catch (KafkaException exception) {
            throw new ConfigurationException("Could not create Kafka producer: " + exception.getMessage(), exception);
        }
        LOGGER.info("Kafka producer created for bootstrap servers {}", properties.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        return new ProducerHandle(producer);
    }

    Future<RecordMetadata> send(ProducerRecord<Object, Object> record) {
        if (closed.get()) {
            throw new IllegalStateException("Producer is closed");
        }
        return producer.send(record);
    }

    boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            producer.flush();
        } catch (KafkaException exception) {
            LOGGER.error("Could not flush Kafka producer before closing", exception);
        } finally {
            closeProducer();
        }
    }

    private void closeProducer() {
        try {
            producer.close(CLOSE_TIMEOUT);
            LOGGER.info("Kafka producer closed");
        } catch (KafkaException exception) {
            LOGGER.error("Could not close Kafka producer", exception);
        }
    }
}
