package com.trade.gateway.exchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exchange-specific request description produced by an {@link ExchangeAdapter}.
 * body is serialized as JSON (a Map or a List of Maps); query values are URL-encoded
 * by the client.
 */
public final class ExchangeCall {
    private final String method;
    private final String path;
    private final Map<String, String> query;
    private final Object body;
    private final boolean signed;

    private ExchangeCall(String method, String path, Map<String, String> query, Object body, boolean signed) {
        this.method = method;
        this.path = path;
        this.query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
        this.body = body;
        this.signed = signed;
    }

    public static ExchangeCall publicGet(String path, Map<String, String> query) {
        return new ExchangeCall("GET", path, query, null, false);
    }

    public static ExchangeCall privateGet(String path, Map<String, String> query) {
        return new ExchangeCall("GET", path, query, null, true);
    }

    public static ExchangeCall privatePost(String path, Object body) {
        return new ExchangeCall("POST", path, null, body, true);
    }

    public String getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, String> getQuery() { return query; }
    public Object getBody() { return body; }
    public boolean isSigned() { return signed; }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
