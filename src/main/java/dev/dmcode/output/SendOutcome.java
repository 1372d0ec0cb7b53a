package dev.dmcode.output;

import org.apache.kafka.clients.producer.RecordMetadata;

record SendOutcome(Status status, RecordMetadata metadata, Exception cause) {

    enum Status {
        SUCCESS,
        RETRIABLE_FAILURE,
        FATAL_FAILURE
    }

    static SendOutcome success(RecordMetadata metadata) {
        return new SendOutcome(Status.SUCCESS, metadata, null);
    }

    static SendOutcome retriable(Exception cause) {
        return new SendOutcome(Status.RETRIABLE_FAILURE, null, cause);
    }

    static SendOutcome fatal(Exception cause) {
        return new SendOutcome(Status.FATAL_FAILURE, null, cause);
    }
}
