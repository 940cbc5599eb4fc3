package com.trade.gateway.error;

/**
 * What the caller should do with a response or a transport exception.
 */
public enum Classification {
    /** Transient: retry on the same transport with backoff. */
    RETRYABLE_NETWORK,
    /** Geo-block or proxy-level failure: move to the next transport. */
    ESCALATE_PROXY,
    /** Bad key, signature, timestamp or environment: stop, never retry. */
    AUTHENTICATION_FATAL,
    /** Exchange refused the request itself: return verbatim, never retry. */
    BUSINESS_REJECTION,
    SUCCESS;

    public boolean isTerminal() {
        return this == SUCCESS || this == BUSINESS_REJECTION || this == AUTHENTICATION_FATAL;
    }
}
