package com.trade.gateway.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.auth.Credentials;
import com.trade.gateway.auth.RequestSigner;
import com.trade.gateway.error.Classification;
import com.trade.gateway.error.ErrorClassifier;
import com.trade.gateway.transport.RawResponse;
import com.trade.gateway.transport.ResponseClassifier;
import com.trade.gateway.transport.SignedRequest;
import com.trade.gateway.transport.TransportException;
import com.trade.gateway.transport.TransportFallbackChain;
import com.trade.gateway.transport.TransportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns an {@link ExchangeCall} into signed wire requests, sends them through the
 * transport chain and unwraps the exchange envelope.
 */
public class ExchangeRestClient {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeRestClient.class);

    private final ExchangeAdapter adapter;
    private final Credentials credentials;
    private final TransportFallbackChain chain;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseClassifier responseClassifier = new EnvelopeClassifier();

    public ExchangeRestClient(ExchangeAdapter adapter, Credentials credentials, TransportFallbackChain chain) {
        this(adapter, credentials, chain, Clock.systemUTC());
    }

    public ExchangeRestClient(ExchangeAdapter adapter,
                              Credentials credentials,
                              TransportFallbackChain chain,
                              Clock clock) {
        this.adapter = adapter;
        this.credentials = credentials;
        this.chain = chain;
        this.classifier = new ErrorClassifier(adapter.getErrorCodes());
        this.clock = clock;
    }

    public ExchangeAdapter getAdapter() {
        return adapter;
    }

    public ErrorClassifier getClassifier() {
        return classifier;
    }

    /**
     * @return the accepted response; rejections, auth failures and exhausted transports throw
     */
    public ExchangeResponse call(ExchangeCall call) throws ExchangeException {
        if (call.isSigned() && credentials == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED,
                    call + " requires API credentials but none are configured");
        }
        String query = buildQueryString(call.getQuery());
        String requestPath = query.isEmpty() ? call.getPath() : call.getPath() + "?" + query;
        String bodyJson = toRequestBodyJson(call.getBody());
        String method = call.getMethod().toUpperCase(Locale.ROOT);

        TransportResult result;
        try {
            result = chain.send(() -> buildSignedRequest(call, method, requestPath, bodyJson), responseClassifier);
        } catch (TransportException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR,
                    adapter.getName() + " " + call + " failed on every transport: " + e.getFailures(), e);
        } catch (IOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR,
                    adapter.getName() + " " + call + " failed: " + ErrorClassifier.summarize(e), e);
        }

        RawResponse raw = result.getResponse();
        JsonNode root = readTreeOrNull(raw.body());
        EnvelopeStatus status = root == null ? EnvelopeStatus.UNPARSEABLE : adapter.parseStatus(root);
        Classification classification = result.getClassification();

        if (classification == Classification.SUCCESS) {
            return new ExchangeResponse(root, raw, result.getFailures());
        }
        String hint = classifier.remediationHint(status.code(), raw.httpStatus());
        String message = adapter.getName() + " " + call + " rejected: HTTP " + raw.httpStatus()
                + ", code=" + status.code() + ", msg=" + status.message();
        if (classification == Classification.AUTHENTICATION_FATAL) {
            logger.error("{} authentication failed (apiKey={}): code={}, msg={}{}",
                    adapter.getName(), Credentials.mask(credentials == null ? null : credentials.getApiKey()),
                    status.code(), status.message(), hint == null ? "" : ", hint: " + hint);
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED, message,
                    status.code(), hint, raw.body(), null);
        }
        ExchangeException.ErrorCode errorCode = "POST".equals(method)
                ? ExchangeException.ErrorCode.ORDER_REJECTED
                : ExchangeException.ErrorCode.API_ERROR;
        throw new ExchangeException(errorCode, message, status.code(), hint, raw.body(), null);
    }

    /**
     * Response root only.
     */
    public JsonNode execute(ExchangeCall call) throws ExchangeException {
        return call(call).root();
    }

    private SignedRequest buildSignedRequest(ExchangeCall call, String method, String requestPath, String bodyJson) {
        Map<String, String> headers = new LinkedHashMap<>(adapter.extraHeaders());
        if (call.isSigned()) {
            Instant now = Instant.now(clock);
            headers.putAll(RequestSigner.sign(method, requestPath, bodyJson, credentials,
                    adapter.getSignatureScheme(), now));
        }
        headers.put("Content-Type", "application/json");
        return new SignedRequest(method, adapter.getBaseUrl(), requestPath, bodyJson, headers);
    }

    String buildQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        // Keep deterministic order for signing.
        Map<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("&");
            }
            sb.append(urlEncode(entry.getKey()))
                    .append("=")
                    .append(urlEncode(entry.getValue()));
        }
        return sb.toString();
    }

    private String toRequestBodyJson(Object bodyParams) {
        if (bodyParams == null) {
            return "";
        }
        if (bodyParams instanceof Map<?, ?> map && map.isEmpty()) {
            return "";
        }
        if (bodyParams instanceof List<?> list && list.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(bodyParams);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize request body", e);
        }
    }

    private JsonNode readTreeOrNull(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root != null && root.isObject() ? root : null;
        } catch (IOException e) {
            return null;
        }
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    private final class EnvelopeClassifier implements ResponseClassifier {

        @Override
        public Classification classifyResponse(int httpStatus, String body) {
            JsonNode root = readTreeOrNull(body);
            if (root == null) {
                return classifier.classify(httpStatus, null, body);
            }
            EnvelopeStatus status = adapter.parseStatus(root);
            if (status.code() == null) {
                return classifier.classify(httpStatus, null, body);
            }
            return classifier.classify(httpStatus, status.code(), status.message());
        }

        @Override
        public Classification classifyFailure(Throwable error) {
            return classifier.classify(error);
        }
    }
}
