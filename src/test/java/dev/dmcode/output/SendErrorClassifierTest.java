package dev.dmcode.output;

import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class SendErrorClassifierTest {

    @Test
    void shouldClassifyKafkaRetriableExceptionsAsRetriable() {
        assertThat(SendErrorClassifier.classify(new NetworkException("down")).status())
            .isEqualTo(SendOutcome.Status.RETRIABLE_FAILURE);
        assertThat(SendErrorClassifier.classify(new NotLeaderOrFollowerException("moved")).status())
            .isEqualTo(SendOutcome.Status.RETRIABLE_FAILURE);
    }

    @Test
    void shouldClassifyThreadInterruptionAsRetriable() {
        assertThat(SendErrorClassifier.classify(new InterruptedException()).status())
            .isEqualTo(SendOutcome.Status.RETRIABLE_FAILURE);
    }

    @Test
    void shouldUnwrapFutureExceptions() {
        var cause = new TimeoutException("expired");

        var outcome = SendErrorClassifier.classify(new ExecutionException(new CompletionException(cause)));

        assertThat(outcome.status()).isEqualTo(SendOutcome.Status.RETRIABLE_FAILURE);
        assertThat(outcome.cause()).isSameAs(cause);
    }

    @Test
    void shouldClassifyOtherExceptionsAsFatal() {
        assertThat(SendErrorClassifier.classify(new SerializationException("bad")).status())
            .isEqualTo(SendOutcome.Status.FATAL_FAILURE);
        assertThat(SendErrorClassifier.classify(new AuthorizationException("denied")).status())
            .isEqualTo(SendOutcome.Status.FATAL_FAILURE);
        assertThat(SendErrorClassifier.classify(new KafkaException("generic")).status())
            .isEqualTo(SendOutcome.Status.FATAL_FAILURE);
        assertThat(SendErrorClassifier.classify(new ExecutionException("no cause", null)).status())
            .isEqualTo(SendOutcome.Status.FATAL_FAILURE);
    }
}
