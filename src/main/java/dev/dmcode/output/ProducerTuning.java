package dev.dmcode.output;

import lombok.With;

@With
public record ProducerTuning(
    int batchSize,
    long bufferMemory,
    long lingerMs,
    int maxRequestSize,
    Integer requestTimeoutMs,
    long reconnectBackoffMs,
    long metadataMaxAgeMs,
    int sendBufferBytes,
    int receiveBufferBytes,
    long connectionsMaxIdleMs
) {
    private static final int DEFAULT_BATCH_SIZE = 16_384;
    private static final long DEFAULT_BUFFER_MEMORY = 33_554_432;
    private static final long DEFAULT_LINGER_MS = 0;
    private static final int DEFAULT_MAX_REQUEST_SIZE = 1_048_576;
    private static final long DEFAULT_RECONNECT_BACKOFF_MS = 50;
    private static final long DEFAULT_METADATA_MAX_AGE_MS = 300_000;
    private static final int DEFAULT_SEND_BUFFER_BYTES = 131_072;
    private static final int DEFAULT_RECEIVE_BUFFER_BYTES = 32_768;
    private static final long DEFAULT_CONNECTIONS_MAX_IDLE_MS = 540_000;

    public ProducerTuning {
        if (batchSize < 0) {
            throw new ConfigurationException("Batch size must not be negative");
        }
        if (bufferMemory < 0) {
            throw new ConfigurationException("Buffer memory must not be negative");
        }
        if (lingerMs < 0) {
            throw new ConfigurationException("Linger must not be negative");
        }
        if (maxRequestSize < 1) {
            throw new ConfigurationException("Max request size must be bigger than zero");
        }
        if (requestTimeoutMs != null && requestTimeoutMs < 0) {
            throw new ConfigurationException("Request timeout must not be negative");
        }
        if (reconnectBackoffMs < 0) {
            throw new ConfigurationException("Reconnect backoff must not be negative");
        }
        if (metadataMaxAgeMs < 0) {
            throw new ConfigurationException("Metadata max age must not be negative");
        }
    }

    public static ProducerTuning defaults() {
        return new ProducerTuning(
            DEFAULT_BATCH_SIZE,
            DEFAULT_BUFFER_MEMORY,
            DEFAULT_LINGER_MS,
            DEFAULT_MAX_REQUEST_SIZE,
            null,
            DEFAULT_RECONNECT_BACKOFF_MS,
            DEFAULT_METADATA_MAX_AGE_MS,
            DEFAULT_SEND_BUFFER_BYTES,
            DEFAULT_RECEIVE_BUFFER_BYTES,
            DEFAULT_CONNECTIONS_MAX_IDLE_MS
        );
    }

    static ProducerTuning fromSettings(SettingsReader settings) {
        var defaults = defaults();
        return new ProducerTuning(
            settings.integer("batch_size", defaults.batchSize()),
            settings.number("buffer_memory", defaults.bufferMemory()),
            settings.number("linger_ms", defaults.lingerMs()),
            settings.integer("max_request_size", defaults.maxRequestSize()),
            settings.integer("request_timeout_ms", null),
            settings.number("reconnect_backoff_ms", defaults.reconnectBackoffMs()),
            settings.number("metadata_max_age_ms", defaults.metadataMaxAgeMs()),
            settings.integer("send_buffer_bytes", defaults.sendBufferBytes()),
            settings.integer("receive_buffer_bytes", defaults.receiveBufferBytes()),
            settings.number("connections_max_idle_ms", defaults.connectionsMaxIdleMs())
        );
    }
}
