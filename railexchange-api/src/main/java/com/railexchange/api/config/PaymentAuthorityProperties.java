package com.railexchange.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for the payment authority (Stripe).
 * The secret key is never logged.
 */
@Configuration
@ConfigurationProperties(prefix = "railexchange.payment-authority")
public class PaymentAuthorityProperties {

    private String secretKey;
    private int connectTimeoutMillis = 3_000;
    private int readTimeoutMillis = 5_000;

    public String getSecretKey() { return secretKey; }
    public void setSecretKey(String secretKey) { this.secretKey = secretKey; }
    public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
    public void setConnectTimeoutMillis(int connectTimeoutMillis) { this.connectTimeoutMillis = connectTimeoutMillis; }
    public int getReadTimeoutMillis() { return readTimeoutMillis; }
    public void setReadTimeoutMillis(int readTimeoutMillis) { this.readTimeoutMillis = readTimeoutMillis; }

    public boolean isConfigured() {
        return secretKey != null && !secretKey.isBlank();
    }
}
