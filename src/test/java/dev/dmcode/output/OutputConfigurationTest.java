package dev.dmcode.output;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputConfigurationTest {

    @Test
    void shouldPopulateDefaults() {
        var configuration = OutputConfiguration.fromSettings(Map.of("topic_id", "test"));

        assertThat(configuration.bootstrapServers()).isEqualTo("localhost:9092");
        assertThat(configuration.topicId()).isEqualTo("test");
        assertThat(configuration.keySerializer()).isEqualTo("org.apache.kafka.common.serialization.StringSerializer");
        assertThat(configuration.valueSerializer()).isEqualTo("org.apache.kafka.common.serialization.StringSerializer");
        assertThat(configuration.retries()).isNull();
        assertThat(configuration.unboundedRetries()).isTrue();
        assertThat(configuration.retryBackoff()).isEqualTo(Duration.ofMillis(100));
        assertThat(configuration.messageHeaders()).isEmpty();
        assertThat(configuration).isEqualTo(OutputConfiguration.defaults("test"));
    }

    @Test
    void shouldAliasDeprecatedDnsLookup() {
        assertThat(OutputConfiguration.fromSettings(Map.of("topic_id", "test", "client_dns_lookup", "default"))
            .clientDnsLookup()).isEqualTo("use_all_dns_ips");
        assertThat(OutputConfiguration.defaults("test").withClientDnsLookup("default").clientDnsLookup())
            .isEqualTo("use_all_dns_ips");
    }

    @Test
    void shouldReadNestedSettings() {
        var settings = new HashMap<String, Object>();
        settings.put("topic_id", "test");
        settings.put("message_headers", Map.of("host", "%{host}"));
        settings.put("retries", "2");
        settings.put("retry_backoff_ms", 250);
        settings.put("batch_size", 100);
        settings.put("ssl_keystore_location", "/etc/kafka/key-store.jks");
        settings.put("sasl_login_read_timeout_ms", 5000);

        var configuration = OutputConfiguration.fromSettings(settings);

        assertThat(configuration.messageHeaders()).containsExactly(Map.entry("host", "%{host}"));
        assertThat(configuration.retries()).isEqualTo(2);
        assertThat(configuration.retryBackoff()).isEqualTo(Duration.ofMillis(250));
        assertThat(configuration.tuning().batchSize()).isEqualTo(100);
        assertThat(configuration.ssl().keystoreLocation()).isEqualTo("/etc/kafka/key-store.jks");
        assertThat(configuration.sasl().loginReadTimeoutMs()).isEqualTo(5000L);
    }

    @Test
    void shouldRejectUnknownSettings() {
        assertThatThrownBy(() -> OutputConfiguration.fromSettings(Map.of("topic_id", "test", "topic", "other")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("topic");
    }

    @Test
    void shouldRejectValuesOfWrongType() {
        assertThatThrownBy(() -> OutputConfiguration.fromSettings(Map.of("topic_id", "test", "retries", "many")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("retries");
        assertThatThrownBy(() -> OutputConfiguration.fromSettings(Map.of("topic_id", "test", "message_headers", "x")))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectNegativeDurations() {
        assertThatThrownBy(() -> OutputConfiguration.fromSettings(Map.of("topic_id", "test", "retry_backoff_ms", -5)))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OutputConfiguration.fromSettings(Map.of("topic_id", "test", "linger_ms", -1)))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldCopyMessageHeaders() {
        var headers = new HashMap<String, String>();
        headers.put("host", "%{host}");
        var configuration = OutputConfiguration.defaults("test").withMessageHeaders(headers);

        headers.put("other", "value");

        assertThat(configuration.messageHeaders()).containsOnlyKeys("host");
    }
}
