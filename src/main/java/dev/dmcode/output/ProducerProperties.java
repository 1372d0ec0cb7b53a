package dev.dmcode.output;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class ProducerProperties {

    private static final Set<String> ACKS = Set.of("0", "1", "all", "-1");
    private static final Set<String> COMPRESSION_TYPES = Set.of("none", "gzip", "snappy", "lz4", "zstd");
    private static final Set<String> DNS_LOOKUPS = Set.of(
        OutputConfiguration.USE_ALL_DNS_IPS,
        "resolve_canonical_bootstrap_servers_only"
    );
    private static final Set<String> SECURITY_PROTOCOLS = Set.of("PLAINTEXT", "SSL", "SASL_PLAINTEXT", "SASL_SSL");
    private static final Set<String> TLS_PROTOCOLS = Set.of("SSL", "SASL_SSL");
    private static final Map<String, String> PARTITIONER_ALIASES = Map.of(
        "round_robin", "org.apache.kafka.clients.producer.RoundRobinPartitioner",
        "uniform_sticky", "org.apache.kafka.clients.producer.UniformStickyPartitioner"
    );
    private static final String DEFAULT_PARTITIONER = "default";

    /**
     * @throws ConfigurationException if a setting is missing or has a value the producer cannot use
     */
    static Map<String, String> translate(OutputConfiguration configuration) {
        validate(configuration);
        var properties = new LinkedHashMap<String, String>();
        properties.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, configuration.bootstrapServers());
        properties.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, configuration.keySerializer());
        properties.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, configuration.valueSerializer());
        properties.put(ProducerConfig.ACKS_CONFIG, configuration.acks());
        properties.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, configuration.compressionType());
        properties.put(ProducerConfig.CLIENT_DNS_LOOKUP_CONFIG, configuration.clientDnsLookup());
        putIfPresent(properties, ProducerConfig.CLIENT_ID_CONFIG, configuration.clientId());
        putIfPresent(properties, ProducerConfig.RETRIES_CONFIG, configuration.retries());
        properties.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, String.valueOf(configuration.retryBackoff().toMillis()));
        putIfPresent(properties, ProducerConfig.PARTITIONER_CLASS_CONFIG, partitionerClass(configuration.partitioner()));
        putTuning(properties, configuration.tuning());
        properties.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, configuration.securityProtocol());
        if (TLS_PROTOCOLS.contains(configuration.securityProtocol())) {
            putSsl(properties, configuration.ssl());
        }
        if (configuration.sasl().enabled()) {
            putSasl(properties, configuration.sasl());
        }
        return properties;
    }

    private static void validate(OutputConfiguration configuration) {
        if (configuration.topicId() == null || configuration.topicId().isBlank()) {
            throw new ConfigurationException("Setting 'topic_id' is required");
        }
        if (configuration.bootstrapServers().isBlank()) {
            throw new ConfigurationException("Setting 'bootstrap_servers' must not be blank");
        }
        if (configuration.retries() != null && configuration.retries() < 0) {
            throw new ConfigurationException(
                "Setting 'retries' must be zero or bigger, got: " + configuration.retries());
        }
        SerializerType.fromIdentifier("key_serializer", configuration.keySerializer());
        SerializerType.fromIdentifier("value_serializer", configuration.valueSerializer());
        requireOneOf("acks", configuration.acks(), ACKS);
        requireOneOf("compression_type", configuration.compressionType(), COMPRESSION_TYPES);
        requireOneOf("client_dns_lookup", configuration.clientDnsLookup(), DNS_LOOKUPS);
        requireOneOf("security_protocol", configuration.securityProtocol(), SECURITY_PROTOCOLS);
    }

    private static void requireOneOf(String name, String value, Set<String> allowed) {
        if (!allowed.contains(value)) {
            throw new ConfigurationException(String.format(
                "Invalid value '%s' for setting '%s', expected one of: %s", value, name, allowed));
        }
    }

    private static String partitionerClass(String partitioner) {
        if (partitioner == null || DEFAULT_PARTITIONER.equals(partitioner)) {
            return null;
        }
        return PARTITIONER_ALIASES.getOrDefault(partitioner, partitioner);
    }

    private static void putTuning(Map<String, String> properties, ProducerTuning tuning) {
        properties.put(ProducerConfig.BATCH_SIZE_CONFIG, String.valueOf(tuning.batchSize()));
        properties.put(ProducerConfig.BUFFER_MEMORY_CONFIG, String.valueOf(tuning.bufferMemory()));
        properties.put(ProducerConfig.LINGER_MS_CONFIG, String.valueOf(tuning.lingerMs()));
        properties.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, String.valueOf(tuning.maxRequestSize()));
        putIfPresent(properties, ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, tuning.requestTimeoutMs());
        properties.put(ProducerConfig.RECONNECT_BACKOFF_MS_CONFIG, String.valueOf(tuning.reconnectBackoffMs()));
        properties.put(ProducerConfig.METADATA_MAX_AGE_CONFIG, String.valueOf(tuning.metadataMaxAgeMs()));
        properties.put(ProducerConfig.SEND_BUFFER_CONFIG, String.valueOf(tuning.sendBufferBytes()));
        properties.put(ProducerConfig.RECEIVE_BUFFER_CONFIG, String.valueOf(tuning.receiveBufferBytes()));
        properties.put(ProducerConfig.CONNECTIONS_MAX_IDLE_MS_CONFIG, String.valueOf(tuning.connectionsMaxIdleMs()));
    }

    // An empty endpoint identification algorithm is forwarded, it turns hostname verification off.
    private static void putSsl(Map<String, String> properties, SslConfiguration ssl) {
        putIfPresent(properties, SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, ssl.endpointIdentificationAlgorithm());
        putIfPresent(properties, SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, ssl.truststoreType());
        putIfPresent(properties, SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, ssl.truststoreLocation());
        putIfPresent(properties, SslConfigs.SSL_TRUSTSTORE_PASSWORD_CONFIG, ssl.truststorePassword());
        putIfPresent(properties, SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, ssl.keystoreType());
        putIfPresent(properties, SslConfigs.SSL_KEYSTORE_LOCATION_CONFIG, ssl.keystoreLocation());
        putIfPresent(properties, SslConfigs.SSL_KEYSTORE_PASSWORD_CONFIG, ssl.keystorePassword());
        putIfPresent(properties, SslConfigs.SSL_KEY_PASSWORD_CONFIG, ssl.keyPassword());
    }

    private static void putSasl(Map<String, String> properties, SaslConfiguration sasl) {
        properties.put(SaslConfigs.SASL_MECHANISM, sasl.mechanism());
        putIfPresent(properties, SaslConfigs.SASL_JAAS_CONFIG, sasl.jaasConfig());
        putIfPresent(properties, SaslConfigs.SASL_KERBEROS_SERVICE_NAME, sasl.kerberosServiceName());
        putIfPresent(properties, SaslConfigs.SASL_CLIENT_CALLBACK_HANDLER_CLASS, sasl.clientCallbackHandlerClass());
        putIfPresent(properties, SaslConfigs.SASL_LOGIN_CALLBACK_HANDLER_CLASS, sasl.loginCallbackHandlerClass());
        putIfPresent(properties, SaslConfigs.SASL_LOGIN_CONNECT_TIMEOUT_MS, sasl.loginConnectTimeoutMs());
        putIfPresent(properties, SaslConfigs.SASL_LOGIN_READ_TIMEOUT_MS, sasl.loginReadTimeoutMs());
        putIfPresent(properties, SaslConfigs.SASL_LOGIN_RETRY_BACKOFF_MS, sasl.loginRetryBackoffMs());
        putIfPresent(properties, SaslConfigs.SASL_LOGIN_RETRY_BACKOFF_MAX_MS, sasl.loginRetryBackoffMaxMs());
        putIfPresent(properties, SaslConfigs.SASL_OAUTHBEARER_TOKEN_ENDPOINT_URL, sasl.oauthbearerTokenEndpointUrl());
        putIfPresent(properties, SaslConfigs.SASL_OAUTHBEARER_SCOPE_CLAIM_NAME, sasl.oauthbearerScopeClaimName());
    }

    private static void putIfPresent(Map<String, String> properties, String name, Object value) {
        if (value != null) {
            properties.put(name, value.toString());
        }
    }
}
