package com.trade.gateway.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire-ready request for one attempt. path includes the encoded query string.
 */
public final class SignedRequest {
    private final String method;
    private final String baseUrl;
    private final String path;
    private final String body;
    private final Map<String, String> headers;

    public SignedRequest(String method, String baseUrl, String path, String body, Map<String, String> headers) {
        this.method = method;
        this.baseUrl = baseUrl;
        this.path = path;
        this.body = body == null ? "" : body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String getMethod() { return method; }
    public String getBaseUrl() { return baseUrl; }
    public String getPath() { return path; }
    public String getBody() { return body; }
    public Map<String, String> getHeaders() { return headers; }

    public String url() {
        return baseUrl + path;
    }

    public boolean hasBody() {
        return !body.isEmpty();
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
