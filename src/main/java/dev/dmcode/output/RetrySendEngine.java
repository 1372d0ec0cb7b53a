package dev.dmcode.output;

import dev.dmcode.event.Event;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.InterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Sends one record at a time and blocks until it is acknowledged or dropped.
 *
 * <p>A retriable failure is retried after a fixed backoff while the retry count allows it
 * ({@code null} retries means no limit). A fatal failure is dropped after the first attempt.
 * Every drop is logged together with the event.
 *
 * <p>An interrupted send is retriable: the interrupt flag it leaves behind is cleared so that the
 * backoff and the following sends can block again. Only an interrupt that arrives while backing off
 * ends the loop, with the flag restored.
 */
@RequiredArgsConstructor
final class RetrySendEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrySendEngine.class);

    private final ProducerHandle producer;
    private final Integer maxRetries;
    private final Duration backoff;
    private final Sleeper sleeper;

    DeliveryOutcome send(ProducerRecord<Object, Object> record, Event event) {
        int attempts = 0;
        while (true) {
            attempts++;
            var outcome = attempt(record);
            if (outcome.status() == SendOutcome.Status.SUCCESS) {
                LOGGER.debug("Record delivered after {} attempt(s): {}", attempts, outcome.metadata());
                return DeliveryOutcome.delivered(attempts);
            }
            if (outcome.status() == SendOutcome.Status.FATAL_FAILURE) {
                LOGGER.error("Dropping event after non-retriable failure sending to topic {}: {}",
                    record.topic(), event, outcome.cause());
                return DeliveryOutcome.failed(attempts, outcome.cause());
            }
            if (maxRetries != null && attempts > maxRetries) {
                LOGGER.error("Dropping event, exhausted {} user-configured retries sending to topic {}: {}",
                    maxRetries, record.topic(), event, outcome.cause());
                return DeliveryOutcome.retriesExhausted(attempts, outcome.cause());
            }
            LOGGER.warn("Send attempt {} to topic {} failed, retrying in {} ms: {}",
                attempts, record.topic(), backoff.toMillis(), outcome.cause().toString());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                LOGGER.error("Dropping event, interrupted while backing off after attempt {} to topic {}: {}",
                    attempts, record.topic(), event, outcome.cause());
                return DeliveryOutcome.interrupted(attempts, outcome.cause());
            }
        }
    }

    private SendOutcome attempt(ProducerRecord<Object, Object> record) {
        try {
            return SendOutcome.success(producer.send(record).get());
        } catch (InterruptedException exception) {
            // get() has already cleared the interrupt flag
            return SendErrorClassifier.classify(exception);
        } catch (InterruptException exception) {
            // Raised on this thread, the exception marked it as interrupted
            Thread.interrupted();
            return SendErrorClassifier.classify(exception);
        } catch (Exception exception) {
            return SendErrorClassifier.classify(exception);
        }
    }
}
