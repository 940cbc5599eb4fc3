package com.trade.gateway.error;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Maps a raw exchange response, or a transport exception, to a {@link Classification}.
 * Pure: no I/O, no state beyond the exchange's code table.
 */
public final class ErrorClassifier {

    private final ErrorCodeTable codes;

    public ErrorClassifier(ErrorCodeTable codes) {
        this.codes = codes;
    }

    public ErrorCodeTable getCodes() {
        return codes;
    }

    /**
     * @param httpStatus HTTP status of the response
     * @param exchangeCode envelope code, null when the body carried none
     * @param message exchange message, or the raw body when it could not be parsed
     */
    public Classification classify(int httpStatus, String exchangeCode, String message) {
        boolean hasCode = exchangeCode != null && !exchangeCode.isBlank();

        if (looksLikeGeoBlock(message) || httpStatus == 451) {
            return Classification.ESCALATE_PROXY;
        }
        // a 4xx without the exchange's envelope came from an intermediary (proxy quota, bad proxy key, CDN)
        if (!hasCode && httpStatus >= 400 && httpStatus < 500 && httpStatus != 429) {
            return Classification.ESCALATE_PROXY;
        }
        if (httpStatus == 401 || codes.isAuthentication(exchangeCode)) {
            return Classification.AUTHENTICATION_FATAL;
        }
        if (codes.isRetryable(exchangeCode) || httpStatus == 429 || httpStatus >= 500) {
            return Classification.RETRYABLE_NETWORK;
        }
        boolean ok = httpStatus >= 200 && httpStatus < 300;
        if (ok && codes.isSuccess(exchangeCode)) {
            return Classification.SUCCESS;
        }
        if (hasCode) {
            return Classification.BUSINESS_REJECTION;
        }
        // 2xx/3xx without a structured envelope: some intermediary answered instead of the exchange
        return Classification.ESCALATE_PROXY;
    }

    public Classification classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof NoRouteToHostException
                    || current instanceof UnknownHostException
                    || current instanceof InterruptedIOException
                    || current instanceof SocketException) {
                return Classification.RETRYABLE_NETWORK;
            }
            if (current instanceof IOException && containsNetworkHint(current.getMessage())) {
                return Classification.RETRYABLE_NETWORK;
            }
            current = current.getCause();
        }
        return Classification.ESCALATE_PROXY;
    }

    /**
     * Operator-facing hint for a known code or status, null when nothing useful is known.
     */
    public String remediationHint(String exchangeCode, int httpStatus) {
        String hint = codes.hintFor(exchangeCode);
        if (hint != null) {
            return hint;
        }
        return switch (httpStatus) {
            case 401 -> "Unauthorized: invalid API key or signature; check credentials and the host clock";
            case 403 -> "Forbidden: the exchange blocks this region or IP; configure a proxy transport or check the IP whitelist";
            case 451 -> "Unavailable for legal reasons: geo-blocked region; configure a proxy transport";
            case 429 -> "Rate limited; reduce request frequency";
            default -> null;
        };
    }

    public static boolean looksLikeGeoBlock(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        String m = body.trim().toLowerCase(Locale.ROOT);
        return m.startsWith("<")
                || m.contains("<html")
                || m.contains("<!doctype")
                || m.contains("cloudfront")
                || m.contains("the request could not be satisfied")
                || m.contains("restricted location")
                || m.contains("blocked in your country")
                || m.contains("not available in your country")
                || m.contains("from your country");
    }

    /**
     * First three messages of the cause chain.
     */
    public static String summarize(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 3) {
            if (depth > 0) {
                sb.append(" | ");
            }
            String msg = current.getMessage();
            if (msg == null || msg.isBlank()) {
                sb.append(current.getClass().getSimpleName());
            } else {
                sb.append(msg);
            }
            current = current.getCause();
            depth++;
        }
        return sb.toString();
    }

    private static boolean containsNetworkHint(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("timeout")
                || m.contains("timed out")
                || m.contains("connection reset")
                || m.contains("connection refused")
                || m.contains("connection aborted")
                || m.contains("broken pipe")
                || m.contains("unexpected end of stream")
                || m.contains("no route to host");
    }
}
