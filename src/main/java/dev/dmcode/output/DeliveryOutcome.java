package dev.dmcode.output;

public record DeliveryOutcome(DeliveryStatus status, int attempts, Exception cause) {

    public enum DeliveryStatus {
        DELIVERED,
        FAILED,
        RETRIES_EXHAUSTED,
        INTERRUPTED
    }

    static DeliveryOutcome delivered(int attempts) {
        return new DeliveryOutcome(DeliveryStatus.DELIVERED, attempts, null);
    }

    static DeliveryOutcome failed(int attempts, Exception cause) {
        return new DeliveryOutcome(DeliveryStatus.FAILED, attempts, cause);
    }

    static DeliveryOutcome retriesExhausted(int attempts, Exception cause) {
        return new DeliveryOutcome(DeliveryStatus.RETRIES_EXHAUSTED, attempts, cause);
    }

    static DeliveryOutcome interrupted(int attempts, Exception cause) {
        return new DeliveryOutcome(DeliveryStatus.INTERRUPTED, attempts, cause);
    }

    public boolean delivered() {
        return status == DeliveryStatus.DELIVERED;
    }
}
