package com.trade.gateway.auth;

import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestSignerTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testIsoSignatureMatchesLiteralConcatenation() throws Exception {
        Credentials credentials = new Credentials("key-1234", "k", "pass");

        Map<String, String> headers = RequestSigner.sign("post", "/orders", "{\"sz\":\"1\"}",
                credentials, SignatureScheme.ISO_TIMESTAMP_BASE64, TS);

        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("k".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        String expected = Base64.getEncoder().encodeToString(
                mac.doFinal("2024-01-01T00:00:00.000ZPOST/orders{\"sz\":\"1\"}".getBytes(StandardCharsets.UTF_8)));

        assertEquals(expected, headers.get("OK-ACCESS-SIGN"));
        assertEquals("2024-01-01T00:00:00.000Z", headers.get("OK-ACCESS-TIMESTAMP"));
        assertEquals("key-1234", headers.get("OK-ACCESS-KEY"));
        assertEquals("pass", headers.get("OK-ACCESS-PASSPHRASE"));
    }

    @Test
    void testIsoTimestampAlwaysHasMillis() {
        assertEquals("2024-01-01T00:00:00.000Z", RequestSigner.formatIsoTimestamp(TS));
        assertEquals("2024-01-01T00:00:00.120Z",
                RequestSigner.formatIsoTimestamp(Instant.parse("2024-01-01T00:00:00.12Z")));
    }

    @Test
    void testPassphraseHeaderOmittedWhenNotSet() {
        Credentials credentials = new Credentials("key", "secret", null);
        Map<String, String> headers = RequestSigner.sign("GET", "/api/v5/account/balance?ccy=USDT", "",
                credentials, SignatureScheme.ISO_TIMESTAMP_BASE64, TS);
        assertFalse(headers.containsKey("OK-ACCESS-PASSPHRASE"));
    }

    @Test
    void testSignatureChangesWithTimestamp() {
        Credentials credentials = new Credentials("key", "secret", null);
        String first = RequestSigner.sign("GET", "/a", "", credentials,
                SignatureScheme.ISO_TIMESTAMP_BASE64, TS).get("OK-ACCESS-SIGN");
        String second = RequestSigner.sign("GET", "/a", "", credentials,
                SignatureScheme.ISO_TIMESTAMP_BASE64, TS.plusMillis(1)).get("OK-ACCESS-SIGN");
        assertNotEquals(first, second);
    }

    @Test
    void testCanonicalParamsAreSortedAndDecoded() {
        String canonical = RequestSigner.canonicalSortedParams(
                "/v5/position/list?symbol=BTCUSDT&category=linear&cursor=a%20b",
                "",
                "1704067200000",
                "5000");
        assertEquals("category=linear&cursor=a b&recvWindow=5000&symbol=BTCUSDT&timestamp=1704067200000", canonical);
    }

    @Test
    void testCanonicalParamsIncludeTopLevelBodyFields() {
        String canonical = RequestSigner.canonicalSortedParams(
                "/v5/order/create",
                "{\"symbol\":\"BTCUSDT\",\"qty\":\"0.01\",\"reduceOnly\":true}",
                "1704067200000",
                "5000");
        assertEquals("qty=0.01&recvWindow=5000&reduceOnly=true&symbol=BTCUSDT&timestamp=1704067200000", canonical);
    }

    @Test
    void testSortedParamsHexHeaders() throws Exception {
        Credentials credentials = new Credentials("bybit-key", "secret", null);
        Map<String, String> headers = RequestSigner.sign("GET", "/v5/account/info", "",
                credentials, SignatureScheme.SORTED_PARAMS_HEX, TS);

        assertEquals("bybit-key", headers.get("X-BAPI-API-KEY"));
        assertEquals("1704067200000", headers.get("X-BAPI-TIMESTAMP"));
        assertEquals(RequestSigner.RECV_WINDOW_MS, headers.get("X-BAPI-RECV-WINDOW"));

        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("secret".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] raw = mac.doFinal("recvWindow=5000&timestamp=1704067200000".getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder();
        for (byte b : raw) {
            hex.append(String.format("%02x", b));
        }
        assertEquals(hex.toString(), headers.get("X-BAPI-SIGN"));
    }

    @Test
    void testCredentialsNeverPrintInFull() {
        Credentials credentials = new Credentials("abcdef123456", "topsecretvalue", "mypassphrase");
        String text = credentials.toString();
        assertTrue(text.contains("abcd****"));
        assertFalse(text.contains("abcdef123456"));
        assertFalse(text.contains("topsecretvalue"));
        assertFalse(text.contains("mypassphrase"));
        assertEquals("****", Credentials.mask("abc"));
        assertEquals("<empty>", Credentials.mask(null));
    }
}
