package com.trade.gateway.transport;

import com.trade.gateway.auth.Credentials;

/**
 * One configured network path. baseUrl is the proxy address (host:port URL for
 * FORWARD_PROXY, service endpoint for PARAM_PROXY) and is unused for DIRECT.
 */
public final class TransportAttempt {

    public static final long DEFAULT_DIRECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_PROXY_TIMEOUT_MS = 45_000L;

    private final String name;
    private final TransportKind kind;
    private final String baseUrl;
    private final String proxyCredential;   // "user:pass" for FORWARD_PROXY, service api key for PARAM_PROXY
    private final long timeoutMs;

    public TransportAttempt(String name, TransportKind kind, String baseUrl, String proxyCredential, long timeoutMs) {
        if (name == null || name.isBlank() || kind == null) {
            throw new IllegalArgumentException("Transport name and kind are required");
        }
        if (kind != TransportKind.DIRECT && (baseUrl == null || baseUrl.isBlank())) {
            throw new IllegalArgumentException("Transport " + name + " requires a url");
        }
        if (kind == TransportKind.PARAM_PROXY && (proxyCredential == null || proxyCredential.isBlank())) {
            throw new IllegalArgumentException("Transport " + name + " requires an api key");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Transport " + name + " timeout must be positive");
        }
        this.name = name;
        this.kind = kind;
        this.baseUrl = baseUrl;
        this.proxyCredential = proxyCredential;
        this.timeoutMs = timeoutMs;
    }

    public static TransportAttempt direct(String name) {
        return new TransportAttempt(name, TransportKind.DIRECT, null, null, DEFAULT_DIRECT_TIMEOUT_MS);
    }

    public String getName() { return name; }
    public TransportKind getKind() { return kind; }
    public String getBaseUrl() { return baseUrl; }
    public String getProxyCredential() { return proxyCredential; }
    public long getTimeoutMs() { return timeoutMs; }

    @Override
    public String toString() {
        return "TransportAttempt{" + name + ", " + kind
                + (baseUrl != null ? ", " + baseUrl : "")
                + (proxyCredential != null ? ", credential=" + Credentials.mask(proxyCredential) : "")
                + ", timeoutMs=" + timeoutMs + "}";
    }
}
