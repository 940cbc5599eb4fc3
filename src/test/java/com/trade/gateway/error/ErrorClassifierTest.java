package com.trade.gateway.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier okx = new ErrorClassifier(ErrorCodeTable.okx());
    private final ErrorClassifier bybit = new ErrorClassifier(ErrorCodeTable.bybit());

    @Test
    void testSuccess() {
        assertEquals(Classification.SUCCESS, okx.classify(200, "0", ""));
        assertEquals(Classification.SUCCESS, bybit.classify(200, "0", "OK"));
    }

    @Test
    void testAuthenticationIsFatal() {
        assertEquals(Classification.AUTHENTICATION_FATAL, okx.classify(401, "50113", "Invalid Sign"));
        assertEquals(Classification.AUTHENTICATION_FATAL, okx.classify(200, "50111", "Invalid OK-ACCESS-KEY"));
        assertEquals(Classification.AUTHENTICATION_FATAL, bybit.classify(200, "10003", "API key is invalid."));
        assertTrue(Classification.AUTHENTICATION_FATAL.isTerminal());
    }

    @Test
    void testGeoBlockEscalates() {
        String cloudFront = "<!DOCTYPE HTML PUBLIC><HTML><BODY><H1>403 ERROR</H1>"
                + "The request could not be satisfied. Generated by cloudfront (CloudFront)</BODY></HTML>";
        assertEquals(Classification.ESCALATE_PROXY, okx.classify(403, null, cloudFront));
        assertEquals(Classification.ESCALATE_PROXY, okx.classify(200, null, "<html>blocked</html>"));
        assertEquals(Classification.ESCALATE_PROXY, bybit.classify(451, null, ""));
        assertEquals(Classification.ESCALATE_PROXY, bybit.classify(403, null, "Forbidden"));
        assertEquals(Classification.ESCALATE_PROXY, bybit.classify(200, null,
                "The service is not available in your country"));
        assertFalse(Classification.ESCALATE_PROXY.isTerminal());
    }

    @Test
    void testClientErrorWithoutEnvelopeEscalates() {
        assertEquals(Classification.ESCALATE_PROXY,
                okx.classify(401, null, "Unauthorized request, please make sure your API key is valid."));
        assertEquals(Classification.ESCALATE_PROXY, okx.classify(404, null, "Not Found"));
        assertEquals(Classification.ESCALATE_PROXY, bybit.classify(400, null, "{}"));
        assertEquals(Classification.ESCALATE_PROXY, bybit.classify(407, null, ""));
        // the exchange's own envelope still decides
        assertEquals(Classification.AUTHENTICATION_FATAL, okx.classify(401, "50113", "Invalid Sign"));
        assertEquals(Classification.BUSINESS_REJECTION, okx.classify(404, "51001", "Instrument ID does not exist"));
    }

    @Test
    void testTransientCodesRetry() {
        assertEquals(Classification.RETRYABLE_NETWORK, okx.classify(200, "50011", "Too Many Requests"));
        assertEquals(Classification.RETRYABLE_NETWORK, okx.classify(429, null, ""));
        assertEquals(Classification.RETRYABLE_NETWORK, okx.classify(503, null, ""));
        assertEquals(Classification.RETRYABLE_NETWORK, bybit.classify(200, "10006", "Too many visits"));
    }

    @Test
    void testBusinessRejection() {
        assertEquals(Classification.BUSINESS_REJECTION, okx.classify(200, "51008", "Insufficient margin"));
        assertEquals(Classification.BUSINESS_REJECTION, okx.classify(400, "51000", "Parameter sz error"));
        assertEquals(Classification.BUSINESS_REJECTION, bybit.classify(200, "110007", "ab not enough"));
        assertTrue(Classification.BUSINESS_REJECTION.isTerminal());
    }

    @Test
    void testExceptions() {
        assertEquals(Classification.RETRYABLE_NETWORK, okx.classify(new SocketTimeoutException("timeout")));
        assertEquals(Classification.RETRYABLE_NETWORK, okx.classify(new ConnectException("Connection refused")));
        assertEquals(Classification.RETRYABLE_NETWORK,
                okx.classify(new IOException("wrapped", new SocketTimeoutException("Read timed out"))));
        assertEquals(Classification.RETRYABLE_NETWORK, okx.classify(new IOException("unexpected end of stream")));
        assertEquals(Classification.ESCALATE_PROXY, okx.classify(new IOException("PKIX path building failed")));
    }

    @Test
    void testRemediationHints() {
        assertTrue(okx.remediationHint("50101", 401).contains("okx.demo"));
        assertTrue(okx.remediationHint("51008", 200).contains("margin"));
        assertTrue(bybit.remediationHint("10004", 200).contains("signature"));
        assertNotNull(okx.remediationHint(null, 403));
        assertNotNull(okx.remediationHint(null, 451));
        assertNull(okx.remediationHint("99999", 200));
    }

    @Test
    void testSummarizeCauseChain() {
        IOException error = new IOException("outer", new SocketTimeoutException());
        assertEquals("outer | SocketTimeoutException", ErrorClassifier.summarize(error));
    }
}
