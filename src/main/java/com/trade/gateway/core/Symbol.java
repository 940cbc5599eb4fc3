package com.trade.gateway.core;

import java.util.Locale;
import java.util.Objects;

/**
 * 交易对
 * 仅支持 USDT 本位永续合约
 */
public class Symbol {
    private final String base;      // 基础资产，如 BTC
    private final String quote;     // 固定为 USDT

    public Symbol(String base, String quote) {
        if (base == null || base.isBlank()) {
            throw new IllegalArgumentException("基础资产不能为空");
        }
        if (!"USDT".equalsIgnoreCase(quote)) {
            throw new IllegalArgumentException("仅支持 USDT 本位合约, quote=" + quote);
        }
        this.base = base.trim().toUpperCase(Locale.ROOT);
        this.quote = quote.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * 支持 "BTC-USDT"、"BTC_USDT"、"BTCUSDT"、"BTC-USDT-SWAP" 或单独的基础资产 "BTC"
     */
    public static Symbol of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("交易对不能为空");
        }
        String value = symbol.trim().toUpperCase(Locale.ROOT);
        if (value.endsWith("-SWAP")) {
            value = value.substring(0, value.length() - "-SWAP".length());
        }
        String[] parts = value.split("[-_/]");
        if (parts.length == 2) {
            return new Symbol(parts[0], parts[1]);
        }
        if (parts.length == 1) {
            if (value.endsWith("USDT") && value.length() > 4) {
                return new Symbol(value.substring(0, value.length() - 4), "USDT");
            }
            return new Symbol(value, "USDT");
        }
        throw new IllegalArgumentException("无效的交易对格式: " + symbol);
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }

    public String toPairString() {
        return base + quote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(base, symbol.base) && Objects.equals(quote, symbol.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote);
    }

    @Override
    public String toString() {
        return base + "-" + quote;
    }
}
