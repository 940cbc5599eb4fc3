package com.trade.gateway.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.error.Classification;
import com.trade.gateway.error.ErrorClassifier;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends one logical request through the configured transports in order.
 * Transient failures retry on the same transport with exponential backoff;
 * geo-blocks and exhausted retries escalate to the next transport. A transport
 * that has been passed is never tried again within the same send().
 * <p>
 * Thread-safe: concurrent sends share the clients but nothing else.
 */
public class TransportFallbackChain {

    private static final Logger logger = LoggerFactory.getLogger(TransportFallbackChain.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_LOGGED_BODY = 200;

    private final TransportChainConfig config;
    private final Sleeper sleeper;
    private final Map<String, OkHttpClient> clients = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TransportFallbackChain(OkHttpClient baseClient, TransportChainConfig config) {
        this(baseClient, config, Sleeper.THREAD);
    }

    public TransportFallbackChain(OkHttpClient baseClient, TransportChainConfig config, Sleeper sleeper) {
        this.config = config;
        this.sleeper = sleeper;
        for (TransportAttempt attempt : config.getAttempts()) {
            clients.put(attempt.getName(), buildClient(baseClient, attempt));
        }
    }

    public TransportChainConfig getConfig() {
        return config;
    }

    public TransportResult send(SignedRequestFactory requestFactory, ResponseClassifier classifier) throws IOException {
        List<TransportAttempt> attempts = config.getAttempts();
        List<TransportFailure> failures = new ArrayList<>();
        Throwable lastCause = null;
        String requestLabel = null;

        for (int i = 0; i < attempts.size(); i++) {
            TransportAttempt transport = attempts.get(i);
            if (i > 0) {
                pause(config.getEscalationDelayMs());
            }

            int tries = 0;
            Classification lastClassification;
            String lastMessage;
            while (true) {
                tries++;
                SignedRequest signed = requestFactory.create();
                requestLabel = signed.toString();
                try (Response response = clients.get(transport.getName())
                        .newCall(buildRequest(transport, signed))
                        .execute()) {
                    String body = response.body() == null ? "" : response.body().string();
                    int status = response.code();
                    Classification classification = classifier.classifyResponse(status, body);
                    if (classification.isTerminal()) {
                        if (i > 0 || tries > 1) {
                            logger.info("{} answered via {} after {} failed transport(s), attempt {}",
                                    requestLabel, transport.getName(), failures.size(), tries);
                        }
                        return new TransportResult(new RawResponse(transport.getName(), status, body),
                                classification, failures);
                    }
                    lastClassification = classification;
                    lastMessage = "HTTP " + status + ": " + abbreviate(body);
                    lastCause = null;
                } catch (InterruptedIOException e) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw e;
                    }
                    lastClassification = classifier.classifyFailure(e);
                    lastMessage = ErrorClassifier.summarize(e);
                    lastCause = e;
                } catch (IOException e) {
                    lastClassification = classifier.classifyFailure(e);
                    lastMessage = ErrorClassifier.summarize(e);
                    lastCause = e;
                }

                if (lastClassification == Classification.RETRYABLE_NETWORK && tries <= config.getMaxRetries()) {
                    long backoff = config.getBackoffMs() * (1L << (tries - 1));
                    logger.debug("{} via {} failed ({}), retry {} in {}ms",
                            requestLabel, transport.getName(), lastMessage, tries, backoff);
                    pause(backoff);
                    continue;
                }
                break;
            }

            TransportFailure failure = new TransportFailure(transport.getName(), tries, lastClassification, lastMessage);
            failures.add(failure);
            if (i + 1 < attempts.size()) {
                logger.info("{} escalating from {} to {}: {}",
                        requestLabel, transport.getName(), attempts.get(i + 1).getName(), failure);
            }
        }

        logger.error("{} failed on every transport: {}", requestLabel, failures);
        throw new TransportException("All transports failed: " + failures.get(failures.size() - 1),
                failures, lastCause);
    }

    Request buildRequest(TransportAttempt transport, SignedRequest signed) throws IOException {
        Request.Builder builder = new Request.Builder();
        switch (transport.getKind()) {
            case DIRECT, FORWARD_PROXY -> builder.url(signed.url());
            case PARAM_PROXY -> builder.url(buildParamProxyUrl(transport, signed));
            default -> throw new IllegalStateException("Unsupported transport kind: " + transport.getKind());
        }
        for (Map.Entry<String, String> header : signed.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        String method = signed.getMethod().toUpperCase(Locale.ROOT);
        if ("GET".equals(method)) {
            builder.get();
        } else {
            builder.method(method, RequestBody.create(signed.getBody(), JSON_MEDIA_TYPE));
        }
        return builder.build();
    }

    /**
     * Proxy services forward the caller's headers only when asked to, so the header set
     * travels JSON-encoded next to keep_headers=true.
     */
    private HttpUrl buildParamProxyUrl(TransportAttempt transport, SignedRequest signed) throws JsonProcessingException {
        HttpUrl proxyUrl = HttpUrl.parse(transport.getBaseUrl());
        if (proxyUrl == null) {
            throw new IllegalStateException("Invalid proxy url for transport " + transport.getName());
        }
        return proxyUrl.newBuilder()
                .addQueryParameter("api_key", transport.getProxyCredential())
                .addQueryParameter("url", signed.url())
                .addQueryParameter("keep_headers", "true")
                .addQueryParameter("headers", objectMapper.writeValueAsString(signed.getHeaders()))
                .build();
    }

    private static OkHttpClient buildClient(OkHttpClient baseClient, TransportAttempt attempt) {
        OkHttpClient.Builder builder = baseClient.newBuilder()
                .callTimeout(attempt.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .connectTimeout(attempt.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(attempt.getTimeoutMs(), TimeUnit.MILLISECONDS);
        if (attempt.getKind() == TransportKind.FORWARD_PROXY) {
            HttpUrl proxyUrl = HttpUrl.parse(attempt.getBaseUrl());
            if (proxyUrl == null) {
                throw new IllegalArgumentException("Invalid proxy url for transport " + attempt.getName());
            }
            builder.proxy(new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(proxyUrl.host(), proxyUrl.port())));
            String credential = attempt.getProxyCredential();
            if (credential != null && credential.contains(":")) {
                int colon = credential.indexOf(':');
                String basic = okhttp3.Credentials.basic(credential.substring(0, colon), credential.substring(colon + 1));
                builder.proxyAuthenticator((route, response) -> {
                    if (response.request().header("Proxy-Authorization") != null) {
                        return null;
                    }
                    return response.request().newBuilder()
                            .header("Proxy-Authorization", basic)
                            .build();
                });
            }
        }
        return builder.build();
    }

    private void pause(long millis) throws InterruptedIOException {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting between transport attempts");
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_LOGGED_BODY ? flat : flat.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
