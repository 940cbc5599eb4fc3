package com.trade.gateway.auth;

import com.trade.gateway.core.ConfigManager;

/**
 * API credentials. toString() never reveals more than a 4-character prefix.
 */
public final class Credentials {
    private final String apiKey;
    private final String secretKey;
    private final String passphrase;    // OKX only, null for Bybit

    public Credentials(String apiKey, String secretKey, String passphrase) {
        if (apiKey == null || apiKey.isBlank() || secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("API key and secret are required");
        }
        this.apiKey = apiKey;
        this.secretKey = secretKey;
        this.passphrase = passphrase;
    }

    /**
     * Reads {prefix}.api.key, {prefix}.secret.key and {prefix}.passphrase.
     */
    public static Credentials fromConfig(ConfigManager config, String prefix) {
        String apiKey = config.getProperty(prefix + ".api.key", null);
        String secretKey = config.getProperty(prefix + ".secret.key", null);
        String passphrase = config.getProperty(prefix + ".passphrase", null);
        if (apiKey == null || apiKey.isBlank() || secretKey == null || secretKey.isBlank()) {
            throw new IllegalStateException("Missing credentials: " + prefix + ".api.key / " + prefix + ".secret.key");
        }
        return new Credentials(apiKey, secretKey, passphrase);
    }

    public String getApiKey() { return apiKey; }
    public String getSecretKey() { return secretKey; }
    public String getPassphrase() { return passphrase; }

    public boolean hasPassphrase() {
        return passphrase != null && !passphrase.isBlank();
    }

    public static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return "<empty>";
        }
        if (value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }

    @Override
    public String toString() {
        return "Credentials{apiKey=" + mask(apiKey)
                + ", secretKey=" + mask(secretKey)
                + ", passphrase=" + (hasPassphrase() ? "****" : "<none>") + "}";
    }
}
