package com.trade.gateway.transport;

import com.trade.gateway.error.Classification;

/**
 * Decides what the chain does with an HTTP response or an I/O failure.
 */
public interface ResponseClassifier {

    Classification classifyResponse(int httpStatus, String body);

    Classification classifyFailure(Throwable error);
}
