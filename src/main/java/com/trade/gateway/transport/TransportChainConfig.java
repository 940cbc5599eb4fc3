package com.trade.gateway.transport;

import com.trade.gateway.core.ConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered transport list plus retry settings. Reordering or adding a path is a
 * configuration change:
 * <pre>
 * transport.chain=direct,scrapeops
 * transport.scrapeops.type=param_proxy
 * transport.scrapeops.url=https://proxy.scrapeops.io/v1/
 * transport.scrapeops.api.key=...
 * </pre>
 */
public final class TransportChainConfig {

    private static final Logger logger = LoggerFactory.getLogger(TransportChainConfig.class);

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final long DEFAULT_BACKOFF_MS = 200L;
    public static final long DEFAULT_ESCALATION_DELAY_MS = 1000L;

    private final List<TransportAttempt> attempts;
    private final int maxRetries;
    private final long backoffMs;
    private final long escalationDelayMs;

    public TransportChainConfig(List<TransportAttempt> attempts, int maxRetries, long backoffMs, long escalationDelayMs) {
        if (attempts == null || attempts.isEmpty()) {
            throw new IllegalArgumentException("At least one transport is required");
        }
        if (maxRetries < 0 || backoffMs < 0 || escalationDelayMs < 0) {
            throw new IllegalArgumentException("Retry settings must not be negative");
        }
        this.attempts = List.copyOf(attempts);
        this.maxRetries = maxRetries;
        this.backoffMs = backoffMs;
        this.escalationDelayMs = escalationDelayMs;
    }

    public static TransportChainConfig directOnly() {
        return new TransportChainConfig(List.of(TransportAttempt.direct("direct")),
                DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_MS, DEFAULT_ESCALATION_DELAY_MS);
    }

    public static TransportChainConfig fromConfig(ConfigManager config) {
        String chain = config.getProperty("transport.chain", "direct");
        List<TransportAttempt> attempts = new ArrayList<>();
        for (String raw : chain.split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            TransportAttempt attempt = readAttempt(config, name);
            if (attempt != null) {
                attempts.add(attempt);
            }
        }
        if (attempts.isEmpty()) {
            logger.warn("No usable transport in transport.chain={}, falling back to direct", chain);
            attempts.add(TransportAttempt.direct("direct"));
        }
        TransportChainConfig result = new TransportChainConfig(
                attempts,
                config.getIntProperty("transport.retry.max", DEFAULT_MAX_RETRIES),
                config.getLongProperty("transport.retry.backoff.ms", DEFAULT_BACKOFF_MS),
                config.getLongProperty("transport.escalation.delay.ms", DEFAULT_ESCALATION_DELAY_MS)
        );
        logger.info("Transport chain: {}", result.getAttempts());
        return result;
    }

    private static TransportAttempt readAttempt(ConfigManager config, String name) {
        String prefix = "transport." + name + ".";
        String defaultType = "direct".equalsIgnoreCase(name) ? "direct" : null;
        String type = config.getProperty(prefix + "type", defaultType);
        if (type == null) {
            logger.warn("Transport {} has no {}type, skipped", name, prefix);
            return null;
        }
        TransportKind kind = TransportKind.fromString(type);
        long defaultTimeout = kind == TransportKind.DIRECT
                ? TransportAttempt.DEFAULT_DIRECT_TIMEOUT_MS
                : TransportAttempt.DEFAULT_PROXY_TIMEOUT_MS;
        long timeoutMs = config.getLongProperty(prefix + "timeout.ms", defaultTimeout);
        String url = config.getProperty(prefix + "url", null);
        String credential = kind == TransportKind.PARAM_PROXY
                ? config.getProperty(prefix + "api.key", null)
                : config.getProperty(prefix + "credential", null);
        if (credential != null && (credential.isBlank() || credential.startsWith("YOUR_"))) {
            credential = null;
        }

        if (kind != TransportKind.DIRECT && (url == null || url.isBlank())) {
            logger.warn("Transport {} has no url, skipped", name);
            return null;
        }
        if (kind == TransportKind.PARAM_PROXY && credential == null) {
            logger.warn("Transport {} has no api key, skipped", name);
            return null;
        }
        return new TransportAttempt(name, kind, url, credential, timeoutMs);
    }

    public List<TransportAttempt> getAttempts() { return attempts; }
    public int getMaxRetries() { return maxRetries; }
    public long getBackoffMs() { return backoffMs; }
    public long getEscalationDelayMs() { return escalationDelayMs; }
}
