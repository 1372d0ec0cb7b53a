package dev.dmcode.output;

import dev.dmcode.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Publishes events to Kafka, one at a time and in order.
 *
 * <p>{@link #register()} validates the configuration and creates the producer; configuration problems
 * surface there as {@link ConfigurationException}. Send failures never escape {@link #multiReceive(Collection)}:
 * each event ends either delivered or dropped with a logged reason, and the next event is processed.
 */
public class KafkaOutput implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaOutput.class);

    private final OutputConfiguration configuration;
    private final ProducerFactory producerFactory;
    private final Sleeper sleeper;

    private ProducerHandle producer;
    private MessageBuilder messageBuilder;
    private RetrySendEngine engine;
    private Thread shutdownHook;

    public KafkaOutput(OutputConfiguration configuration) {
        this(configuration, ProducerFactory.KAFKA, Sleeper.THREAD);
    }

    KafkaOutput(OutputConfiguration configuration, ProducerFactory producerFactory, Sleeper sleeper) {
        this.configuration = Objects.requireNonNull(configuration, "Output configuration must be provided");
        this.producerFactory = Objects.requireNonNull(producerFactory, "Producer factory must be provided");
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper must be provided");
    }

    public void register() {
        if (producer != null) {
            throw new IllegalStateException("Output is already registered");
        }
        var properties = ProducerProperties.translate(configuration);
        var builder = MessageBuilder.fromConfiguration(configuration);
        var handle = ProducerHandle.open(producerFactory, properties);
        producer = handle;
        messageBuilder = builder;
        engine = new RetrySendEngine(handle, configuration.retries(), configuration.retryBackoff(), sleeper);
        shutdownHook = new Thread(handle::close, "kafka-output-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Kafka output registered: topic={}, retries={}",
            configuration.topicId(), configuration.unboundedRetries() ? "unbounded" : configuration.retries());
    }

    /**
     * Sends the events in order and returns once each of them reached a terminal outcome.
     *
     * @return one outcome per event, in input order
     */
    public List<DeliveryOutcome> multiReceive(Collection<Event> events) {
        requireRegistered();
        var outcomes = new ArrayList<DeliveryOutcome>(events.size());
        for (var event : events) {
            outcomes.add(receive(event));
        }
        return outcomes;
    }

    public DeliveryOutcome receive(Event event) {
        requireRegistered();
        var record = messageBuilder.build(event);
        return engine.send(record, event);
    }

    public OutputConfiguration configuration() {
        return configuration;
    }

    @Override
    public void close() {
        if (producer == null) {
            return;
        }
        removeShutdownHook();
        producer.close();
    }

    Thread shutdownHook() {
        return shutdownHook;
    }

    private void removeShutdownHook() {
        if (shutdownHook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException exception) {
            LOGGER.debug("JVM shutdown in progress, producer closed by the shutdown hook");
        }
        shutdownHook = null;
    }

    private void requireRegistered() {
        if (engine == null) {
            throw new IllegalStateException("Output is not registered");
        }
        if (producer.isClosed()) {
            throw new IllegalStateException("Output is closed");
        }
    }
}
