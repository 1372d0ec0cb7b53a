package dev.dmcode.output;

import lombok.With;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@With
public record OutputConfiguration(
    String bootstrapServers,
    String topicId,
    String messageKey,
    Map<String, String> messageHeaders,
    String keySerializer,
    String valueSerializer,
    Integer retries,
    Duration retryBackoff,
    String clientDnsLookup,
    String clientId,
    String acks,
    String compressionType,
    String partitioner,
    ProducerTuning tuning,
    String securityProtocol,
    SslConfiguration ssl,
    SaslConfiguration sasl
) {
    static final String DEPRECATED_DNS_LOOKUP = "default";
    static final String USE_ALL_DNS_IPS = "use_all_dns_ips";

    private static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
    private static final String DEFAULT_SERIALIZER = StringSerializer.class.getName();
    private static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);
    private static final String DEFAULT_ACKS = "1";
    private static final String DEFAULT_COMPRESSION_TYPE = "none";
    private static final String DEFAULT_SECURITY_PROTOCOL = "PLAINTEXT";

    public OutputConfiguration {
        Objects.requireNonNull(bootstrapServers, "Bootstrap servers must be provided");
        Objects.requireNonNull(keySerializer, "Key serializer must be provided");
        Objects.requireNonNull(valueSerializer, "Value serializer must be provided");
        Objects.requireNonNull(retryBackoff, "Retry backoff must be provided");
        if (retryBackoff.isNegative()) {
            throw new ConfigurationException("Retry backoff must not be negative");
        }
        Objects.requireNonNull(clientDnsLookup, "Client DNS lookup must be provided");
        Objects.requireNonNull(acks, "Acks must be provided");
        Objects.requireNonNull(compressionType, "Compression type must be provided");
        Objects.requireNonNull(tuning, "Producer tuning must be provided");
        Objects.requireNonNull(securityProtocol, "Security protocol must be provided");
        Objects.requireNonNull(ssl, "SSL configuration must be provided");
        Objects.requireNonNull(sasl, "SASL configuration must be provided");
        messageHeaders = messageHeaders == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(messageHeaders));
        if (DEPRECATED_DNS_LOOKUP.equals(clientDnsLookup)) {
            clientDnsLookup = USE_ALL_DNS_IPS;
        }
    }

    public static OutputConfiguration defaults(String topicId) {
        return new OutputConfiguration(
            DEFAULT_BOOTSTRAP_SERVERS,
            topicId,
            null,
            Collections.emptyMap(),
            DEFAULT_SERIALIZER,
            DEFAULT_SERIALIZER,
            null,
            DEFAULT_RETRY_BACKOFF,
            USE_ALL_DNS_IPS,
            null,
            DEFAULT_ACKS,
            DEFAULT_COMPRESSION_TYPE,
            null,
            ProducerTuning.defaults(),
            DEFAULT_SECURITY_PROTOCOL,
            SslConfiguration.defaults(),
            SaslConfiguration.defaults()
        );
    }

    /**
     * Reads underscore-named settings such as {@code topic_id}, {@code message_key} or
     * {@code sasl_mechanism}. Absent settings take their defaults.
     *
     * @throws ConfigurationException on unknown setting names or values of the wrong type
     */
    public static OutputConfiguration fromSettings(Map<String, ?> settings) {
        Objects.requireNonNull(settings, "Settings must be provided");
        var reader = new SettingsReader(settings);
        var defaults = defaults(null);
        var retryBackoffMs = reader.number("retry_backoff_ms", defaults.retryBackoff().toMillis());
        var configuration = new OutputConfiguration(
            reader.string("bootstrap_servers", defaults.bootstrapServers()),
            reader.string("topic_id", null),
            reader.string("message_key", null),
            reader.map("message_headers"),
            reader.string("key_serializer", defaults.keySerializer()),
            reader.string("value_serializer", defaults.valueSerializer()),
            reader.integer("retries", null),
            Duration.ofMillis(retryBackoffMs),
            reader.string("client_dns_lookup", defaults.clientDnsLookup()),
            reader.string("client_id", null),
            reader.string("acks", defaults.acks()),
            reader.string("compression_type", defaults.compressionType()),
            reader.string("partitioner", null),
            ProducerTuning.fromSettings(reader),
            reader.string("security_protocol", defaults.securityProtocol()),
            SslConfiguration.fromSettings(reader),
            SaslConfiguration.fromSettings(reader)
        );
        reader.rejectUnknown();
        return configuration;
    }

    boolean unboundedRetries() {
        return retries == null;
    }
}
