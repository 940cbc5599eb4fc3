package com.trade.gateway.transport;

import java.io.IOException;
import java.util.List;

/**
 * Every transport in the chain failed.
 */
public class TransportException extends IOException {

    private final List<TransportFailure> failures;

    public TransportException(String message, List<TransportFailure> failures, Throwable cause) {
        super(message, cause);
        this.failures = List.copyOf(failures);
    }

    public List<TransportFailure> getFailures() {
        return failures;
    }

    public TransportFailure getLastFailure() {
        return failures.isEmpty() ? null : failures.get(failures.size() - 1);
    }
}
