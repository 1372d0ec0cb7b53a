package dev.dmcode.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProducerProperties")
class ProducerPropertiesTest {

    private static Map<String, String> translate(Map<String, ?> settings) {
        var withTopic = new HashMap<String, Object>(settings);
        withTopic.putIfAbsent("topic_id", "test");
        return ProducerProperties.translate(OutputConfiguration.fromSettings(withTopic));
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("should translate defaults to dotted string properties")
        void shouldTranslateDefaults() {
            var properties = translate(Map.of());

            assertThat(properties)
                .containsEntry("bootstrap.servers", "localhost:9092")
                .containsEntry("key.serializer", "org.apache.kafka.common.serialization.StringSerializer")
                .containsEntry("value.serializer", "org.apache.kafka.common.serialization.StringSerializer")
                .containsEntry("acks", "1")
                .containsEntry("compression.type", "none")
                .containsEntry("client.dns.lookup", "use_all_dns_ips")
                .containsEntry("batch.size", "16384")
                .containsEntry("buffer.memory", "33554432")
                .containsEntry("linger.ms", "0")
                .containsEntry("retry.backoff.ms", "100")
                .containsEntry("security.protocol", "PLAINTEXT")
                .doesNotContainKeys("retries", "client.id", "partitioner.class", "request.timeout.ms");
        }

        @Test
        @DisplayName("should not emit TLS or SASL properties for plaintext")
        void shouldNotEmitSecurityPropertiesForPlaintext() {
            var properties = translate(Map.of("ssl_truststore_location", "/tmp/trust.jks"));

            assertThat(properties.keySet()).noneMatch(name -> name.startsWith("ssl.") || name.startsWith("sasl."));
        }
    }

    @Nested
    @DisplayName("Options")
    class OptionTests {

        @Test
        @DisplayName("should convert numeric options to strings")
        void shouldConvertNumericOptions() {
            var properties = translate(Map.of(
                "retries", 3,
                "linger_ms", 5,
                "request_timeout_ms", "40000",
                "max_request_size", 2_097_152
            ));

            assertThat(properties)
                .containsEntry("retries", "3")
                .containsEntry("linger.ms", "5")
                .containsEntry("request.timeout.ms", "40000")
                .containsEntry("max.request.size", "2097152");
        }

        @Test
        @DisplayName("should rewrite the deprecated default DNS lookup")
        void shouldRewriteDeprecatedDnsLookup() {
            assertThat(translate(Map.of("client_dns_lookup", "default")))
                .containsEntry("client.dns.lookup", "use_all_dns_ips");
        }

        @Test
        @DisplayName("should resolve partitioner aliases")
        void shouldResolvePartitionerAliases() {
            assertThat(translate(Map.of("partitioner", "round_robin")))
                .containsEntry("partitioner.class", "org.apache.kafka.clients.producer.RoundRobinPartitioner");
            assertThat(translate(Map.of("partitioner", "org.example.CustomPartitioner")))
                .containsEntry("partitioner.class", "org.example.CustomPartitioner");
            assertThat(translate(Map.of("partitioner", "default"))).doesNotContainKey("partitioner.class");
        }
    }

    @Nested
    @DisplayName("TLS")
    class SslTests {

        @Test
        @DisplayName("should keep an empty endpoint identification algorithm")
        void shouldKeepEmptyEndpointIdentificationAlgorithm() {
            var properties = translate(Map.of(
                "security_protocol", "SSL",
                "ssl_endpoint_identification_algorithm", "",
                "ssl_truststore_location", "/etc/kafka/trust-store.jks"
            ));

            assertThat(properties)
                .containsEntry("ssl.endpoint.identification.algorithm", "")
                .containsEntry("ssl.truststore.location", "/etc/kafka/trust-store.jks");
        }

        @Test
        @DisplayName("should not require a truststore location")
        void shouldNotRequireTruststoreLocation() {
            var properties = translate(Map.of("security_protocol", "SSL"));

            assertThat(properties)
                .containsEntry("ssl.endpoint.identification.algorithm", "https")
                .doesNotContainKey("ssl.truststore.location");
        }
    }

    @Nested
    @DisplayName("SASL")
    class SaslTests {

        @Test
        @DisplayName("should set OAuth bearer properties")
        void shouldSetOauthProperties() {
            var properties = translate(Map.of(
                "security_protocol", "SASL_PLAINTEXT",
                "sasl_mechanism", "OAUTHBEARER",
                "sasl_oauthbearer_token_endpoint_url", "https://auth.example.com/token",
                "sasl_oauthbearer_scope_claim_name", "custom_scope"
            ));

            assertThat(properties)
                .containsEntry("security.protocol", "SASL_PLAINTEXT")
                .containsEntry("sasl.mechanism", "OAUTHBEARER")
                .containsEntry("sasl.oauthbearer.token.endpoint.url", "https://auth.example.com/token")
                .containsEntry("sasl.oauthbearer.scope.claim.name", "custom_scope");
        }

        @Test
        @DisplayName("should set SASL login properties")
        void shouldSetSaslLoginProperties() {
            var properties = translate(Map.of(
                "security_protocol", "SASL_PLAINTEXT",
                "sasl_mechanism", "OAUTHBEARER",
                "sasl_login_connect_timeout_ms", 15000,
                "sasl_login_read_timeout_ms", 5000,
                "sasl_login_retry_backoff_ms", 200,
                "sasl_login_retry_backoff_max_ms", 15000,
                "sasl_login_callback_handler_class", "org.example.CustomLoginHandler"
            ));

            assertThat(properties)
                .containsEntry("sasl.login.connect.timeout.ms", "15000")
                .containsEntry("sasl.login.read.timeout.ms", "5000")
                .containsEntry("sasl.login.retry.backoff.ms", "200")
                .containsEntry("sasl.login.retry.backoff.max.ms", "15000")
                .containsEntry("sasl.login.callback.handler.class", "org.example.CustomLoginHandler");
        }

        @Test
        @DisplayName("should omit SASL properties without a mechanism")
        void shouldOmitSaslPropertiesWithoutMechanism() {
            var properties = translate(Map.of(
                "security_protocol", "SASL_PLAINTEXT",
                "sasl_oauthbearer_token_endpoint_url", "https://auth.example.com/token",
                "sasl_login_connect_timeout_ms", 15000
            ));

            assertThat(properties.keySet()).noneMatch(name -> name.startsWith("sasl."));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject negative retries")
        void shouldRejectNegativeRetries() {
            assertThatThrownBy(() -> translate(Map.of("retries", -1)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("retries");
        }

        @Test
        @DisplayName("should reject unknown value serializers")
        void shouldRejectUnknownValueSerializer() {
            assertThatThrownBy(() -> translate(Map.of("value_serializer", "test_string")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("value_serializer");
        }

        @Test
        @DisplayName("should require a topic")
        void shouldRequireTopic() {
            var configuration = OutputConfiguration.defaults(null);

            assertThatThrownBy(() -> ProducerProperties.translate(configuration))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("topic_id");
        }

        @Test
        @DisplayName("should reject unsupported enumerated values")
        void shouldRejectUnsupportedEnumeratedValues() {
            assertThatThrownBy(() -> translate(Map.of("acks", "2"))).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> translate(Map.of("compression_type", "brotli")))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> translate(Map.of("security_protocol", "TLS")))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> translate(Map.of("client_dns_lookup", "first")))
                .isInstanceOf(ConfigurationException.class);
        }
    }
}
