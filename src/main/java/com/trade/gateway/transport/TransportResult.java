package com.trade.gateway.transport;

import com.trade.gateway.error.Classification;

import java.util.List;

/**
 * Terminal outcome of a chain run: SUCCESS, BUSINESS_REJECTION or AUTHENTICATION_FATAL,
 * with the failures of any transports passed on the way.
 */
public final class TransportResult {
    private final RawResponse response;
    private final Classification classification;
    private final List<TransportFailure> failures;

    public TransportResult(RawResponse response, Classification classification, List<TransportFailure> failures) {
        this.response = response;
        this.classification = classification;
        this.failures = List.copyOf(failures);
    }

    public RawResponse getResponse() { return response; }
    public Classification getClassification() { return classification; }
    public List<TransportFailure> getFailures() { return failures; }

    public boolean isSuccess() {
        return classification == Classification.SUCCESS;
    }
}
