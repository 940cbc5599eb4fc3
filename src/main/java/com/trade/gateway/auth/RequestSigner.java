package com.trade.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Computes authentication headers. Stateless: every attempt calls sign() again
 * because the timestamp is part of the signed material.
 */
public final class RequestSigner {

    public static final String RECV_WINDOW_MS = "5000";

    /**
     * Always three fraction digits; Instant.toString() drops ".000".
     */
    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private RequestSigner() {
    }

    /**
     * @param path request path including the encoded query string, e.g. /api/v5/account/balance?ccy=USDT
     * @param body raw request body, empty string for none
     */
    public static Map<String, String> sign(String method,
                                           String path,
                                           String body,
                                           Credentials credentials,
                                           SignatureScheme scheme,
                                           Instant timestamp) {
        String upperMethod = method.toUpperCase(Locale.ROOT);
        String rawBody = body == null ? "" : body;
        Map<String, String> headers = new LinkedHashMap<>();
        switch (scheme) {
            case ISO_TIMESTAMP_BASE64 -> {
                String ts = formatIsoTimestamp(timestamp);
                String preHash = ts + upperMethod + path + rawBody;
                headers.put("OK-ACCESS-KEY", credentials.getApiKey());
                headers.put("OK-ACCESS-SIGN", hmacSha256Base64(preHash, credentials.getSecretKey()));
                headers.put("OK-ACCESS-TIMESTAMP", ts);
                if (credentials.hasPassphrase()) {
                    headers.put("OK-ACCESS-PASSPHRASE", credentials.getPassphrase());
                }
            }
            case SORTED_PARAMS_HEX -> {
                String ts = String.valueOf(timestamp.toEpochMilli());
                String canonical = canonicalSortedParams(path, rawBody, ts, RECV_WINDOW_MS);
                headers.put("X-BAPI-API-KEY", credentials.getApiKey());
                headers.put("X-BAPI-TIMESTAMP", ts);
                headers.put("X-BAPI-RECV-WINDOW", RECV_WINDOW_MS);
                headers.put("X-BAPI-SIGN", hmacSha256Hex(canonical, credentials.getSecretKey()));
            }
            default -> throw new IllegalArgumentException("Unsupported scheme: " + scheme);
        }
        return headers;
    }

    public static String formatIsoTimestamp(Instant timestamp) {
        return ISO_MILLIS.format(timestamp);
    }

    /**
     * key=value&... over query parameters, top-level body fields, timestamp and recvWindow,
     * sorted by key. Values are used unencoded.
     */
    public static String canonicalSortedParams(String path, String body, String timestamp, String recvWindow) {
        Map<String, String> params = new TreeMap<>();
        int q = path.indexOf('?');
        if (q >= 0 && q < path.length() - 1) {
            for (String pair : path.substring(q + 1).split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = eq < 0 ? pair : pair.substring(0, eq);
                String value = eq < 0 ? "" : pair.substring(eq + 1);
                params.put(urlDecode(key), urlDecode(value));
            }
        }
        if (body != null && !body.isBlank()) {
            JsonNode root;
            try {
                root = objectMapper.readTree(body);
            } catch (IOException e) {
                throw new IllegalArgumentException("Body is not valid JSON", e);
            }
            if (root != null && root.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    JsonNode value = field.getValue();
                    params.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
                }
            }
        }
        params.put("timestamp", timestamp);
        params.put("recvWindow", recvWindow);

        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            joiner.add(entry.getKey() + "=" + entry.getValue());
        }
        return joiner.toString();
    }

    public static String hmacSha256Base64(String data, String secret) {
        return Base64.getEncoder().encodeToString(hmacSha256(data, secret));
    }

    public static String hmacSha256Hex(String data, String secret) {
        return bytesToHex(hmacSha256(data, secret));
    }

    private static byte[] hmacSha256(String data, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sign failed", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    private static String urlDecode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
