package com.trade.gateway.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 单个资产的账户余额
 */
public class AccountBalance {
    private final String asset;
    private final BigDecimal totalEquity;       // 账户权益（USD）
    private final BigDecimal available;         // 可用于开新仓
    private final BigDecimal unrealizedPnl;
    private final Instant timestamp;

    public AccountBalance(String asset, BigDecimal totalEquity, BigDecimal available, BigDecimal unrealizedPnl) {
        this.asset = asset;
        this.totalEquity = totalEquity;
        this.available = available;
        this.unrealizedPnl = unrealizedPnl;
        this.timestamp = Instant.now();
    }

    public String getAsset() { return asset; }
    public BigDecimal getTotalEquity() { return totalEquity; }
    public BigDecimal getAvailable() { return available; }
    public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("AccountBalance{asset=%s, totalEq=%s, available=%s, upl=%s}",
                asset, totalEquity, available, unrealizedPnl);
    }
}
