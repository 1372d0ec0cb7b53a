package dev.dmcode.output;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RetriableException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class SendErrorClassifier {

    static SendOutcome classify(Exception exception) {
        var cause = unwrap(exception);
        if (isRetriable(cause)) {
            return SendOutcome.retriable(cause);
        }
        return SendOutcome.fatal(cause);
    }

    static boolean isRetriable(Exception cause) {
        return cause instanceof RetriableException
            || cause instanceof InterruptException
            || cause instanceof InterruptedException;
    }

    private static Exception unwrap(Exception exception) {
        Exception current = exception;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
            && current.getCause() instanceof Exception) {
            current = (Exception) current.getCause();
        }
        return current;
    }
}
