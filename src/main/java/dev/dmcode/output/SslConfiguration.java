package dev.dmcode.output;

import lombok.With;

@With
public record SslConfiguration(
    String endpointIdentificationAlgorithm,
    String truststoreType,
    String truststoreLocation,
    String truststorePassword,
    String keystoreType,
    String keystoreLocation,
    String keystorePassword,
    String keyPassword
) {
    private static final String DEFAULT_ENDPOINT_IDENTIFICATION_ALGORITHM = "https";

    public static SslConfiguration defaults() {
        return new SslConfiguration(DEFAULT_ENDPOINT_IDENTIFICATION_ALGORITHM, null, null, null, null, null, null, null);
    }

    static SslConfiguration fromSettings(SettingsReader settings) {
        return new SslConfiguration(
            settings.string("ssl_endpoint_identification_algorithm", DEFAULT_ENDPOINT_IDENTIFICATION_ALGORITHM),
            settings.string("ssl_truststore_type", null),
            settings.string("ssl_truststore_location", null),
            settings.string("ssl_truststore_password", null),
            settings.string("ssl_keystore_type", null),
            settings.string("ssl_keystore_location", null),
            settings.string("ssl_keystore_password", null),
            settings.string("ssl_key_password", null)
        );
    }
}
