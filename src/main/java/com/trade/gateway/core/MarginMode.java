package com.trade.gateway.core;

import java.util.Locale;

/**
 * 保证金模式：逐仓或全仓
 */
public enum MarginMode {
    CROSS("cross"),
    ISOLATED("isolated");

    private final String wireValue;

    MarginMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static MarginMode fromString(String raw, MarginMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (MarginMode mode : values()) {
            if (mode.wireValue.equals(value)) {
                return mode;
            }
        }
        return fallback;
    }
}
