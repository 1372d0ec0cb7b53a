package dev.dmcode.output;

import lombok.With;

@With
public record SaslConfiguration(
    String mechanism,
    String jaasConfig,
    String kerberosServiceName,
    String clientCallbackHandlerClass,
    String loginCallbackHandlerClass,
    Long loginConnectTimeoutMs,
    Long loginReadTimeoutMs,
    Long loginRetryBackoffMs,
    Long loginRetryBackoffMaxMs,
    String oauthbearerTokenEndpointUrl,
    String oauthbearerScopeClaimName
) {
    public static SaslConfiguration defaults() {
        return new SaslConfiguration(null, null, null, null, null, null, null, null, null, null, null);
    }

    boolean enabled() {
        return mechanism != null && !mechanism.isBlank();
    }

    static SaslConfiguration fromSettings(SettingsReader settings) {
        return new SaslConfiguration(
            settings.string("sasl_mechanism", null),
            settings.string("sasl_jaas_config", null),
            settings.string("sasl_kerberos_service_name", null),
            settings.string("sasl_client_callback_handler_class", null),
            settings.string("sasl_login_callback_handler_class", null),
            settings.number("sasl_login_connect_timeout_ms", null),
            settings.number("sasl_login_read_timeout_ms", null),
            settings.number("sasl_login_retry_backoff_ms", null),
            settings.number("sasl_login_retry_backoff_max_ms", null),
            settings.string("sasl_oauthbearer_token_endpoint_url", null),
            settings.string("sasl_oauthbearer_scope_claim_name", null)
        );
    }
}
