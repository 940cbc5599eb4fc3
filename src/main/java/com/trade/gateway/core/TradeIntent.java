package com.trade.gateway.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.UUID;

/**
 * 交易意图（由决策层传入）
 * 数量以币或 USD 计，不使用合约张数
 */
public final class TradeIntent {
    private final Symbol symbol;
    private final Side side;
    private final BigDecimal notionalUsd;       // 二选一 ...
    private final BigDecimal quantityCoins;     // ... 或者这个
    private final BigDecimal referencePrice;    // 调用方行情中的最新价
    private final int leverage;                 // 0 = 不调整账户杠杆
    private final MarginMode marginMode;
    private final boolean reduceOnly;
    private final OrderType orderType;
    private final BigDecimal limitPrice;
    private final BigDecimal takeProfitPrice;
    private final BigDecimal stopLossPrice;
    private final PositionSide positionSide;
    private final String clientOrderId;

    private TradeIntent(Builder builder) {
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.notionalUsd = builder.notionalUsd;
        this.quantityCoins = builder.quantityCoins;
        this.referencePrice = builder.referencePrice;
        this.leverage = builder.leverage;
        this.marginMode = builder.marginMode;
        this.reduceOnly = builder.reduceOnly;
        this.orderType = builder.orderType;
        this.limitPrice = builder.limitPrice;
        this.takeProfitPrice = builder.takeProfitPrice;
        this.stopLossPrice = builder.stopLossPrice;
        this.positionSide = builder.positionSide != null
                ? builder.positionSide
                : builder.side.positionSide(builder.reduceOnly);
        this.clientOrderId = builder.clientOrderId != null
                ? builder.clientOrderId
                : newClientOrderId();
    }

    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getNotionalUsd() { return notionalUsd; }
    public BigDecimal getQuantityCoins() { return quantityCoins; }
    public BigDecimal getReferencePrice() { return referencePrice; }
    public int getLeverage() { return leverage; }
    public MarginMode getMarginMode() { return marginMode; }
    public boolean isReduceOnly() { return reduceOnly; }
    public OrderType getOrderType() { return orderType; }
    public BigDecimal getLimitPrice() { return limitPrice; }
    public BigDecimal getTakeProfitPrice() { return takeProfitPrice; }
    public BigDecimal getStopLossPrice() { return stopLossPrice; }
    public PositionSide getPositionSide() { return positionSide; }
    public String getClientOrderId() { return clientOrderId; }

    public boolean hasAttachedProtection() {
        return takeProfitPrice != null || stopLossPrice != null;
    }

    /**
     * 目标币数量；给定 USD 名义价值时除以参考价
     */
    public BigDecimal resolveQuantityCoins() {
        if (quantityCoins != null) {
            return quantityCoins;
        }
        return notionalUsd.divide(referencePrice, Decimal.DIVISION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 用于估算名义价值和手续费的价格
     */
    public BigDecimal pricingPrice() {
        return orderType == OrderType.LIMIT ? limitPrice : referencePrice;
    }

    /**
     * 仅字母数字，最多 32 位，两家交易所均可接受
     */
    public static String newClientOrderId() {
        return "gw" + UUID.randomUUID().toString().replace("-", "").substring(0, 30);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Symbol symbol;
        private Side side;
        private BigDecimal notionalUsd;
        private BigDecimal quantityCoins;
        private BigDecimal referencePrice;
        private int leverage;
        private MarginMode marginMode = MarginMode.CROSS;
        private boolean reduceOnly;
        private OrderType orderType = OrderType.MARKET;
        private BigDecimal limitPrice;
        private BigDecimal takeProfitPrice;
        private BigDecimal stopLossPrice;
        private PositionSide positionSide;
        private String clientOrderId;

        public Builder symbol(Symbol symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder notionalUsd(BigDecimal notionalUsd) {
            this.notionalUsd = notionalUsd;
            return this;
        }

        public Builder quantityCoins(BigDecimal quantityCoins) {
            this.quantityCoins = quantityCoins;
            return this;
        }

        public Builder referencePrice(BigDecimal referencePrice) {
            this.referencePrice = referencePrice;
            return this;
        }

        public Builder leverage(int leverage) {
            this.leverage = leverage;
            return this;
        }

        public Builder marginMode(MarginMode marginMode) {
            this.marginMode = marginMode;
            return this;
        }

        public Builder reduceOnly(boolean reduceOnly) {
            this.reduceOnly = reduceOnly;
            return this;
        }

        public Builder orderType(OrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder limitPrice(BigDecimal limitPrice) {
            this.limitPrice = limitPrice;
            return this;
        }

        public Builder takeProfitPrice(BigDecimal takeProfitPrice) {
            this.takeProfitPrice = takeProfitPrice;
            return this;
        }

        public Builder stopLossPrice(BigDecimal stopLossPrice) {
            this.stopLossPrice = stopLossPrice;
            return this;
        }

        public Builder positionSide(PositionSide positionSide) {
            this.positionSide = positionSide;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = sanitizeClientOrderId(clientOrderId);
            return this;
        }

        public TradeIntent build() {
            if (symbol == null || side == null || orderType == null || marginMode == null) {
                throw new IllegalStateException("symbol, side, orderType, marginMode 必须设置");
            }
            if ((notionalUsd == null) == (quantityCoins == null)) {
                throw new IllegalStateException("notionalUsd 和 quantityCoins 必须且只能设置一个");
            }
            if (notionalUsd != null && notionalUsd.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalStateException("notionalUsd 必须为正数");
            }
            if (quantityCoins != null && quantityCoins.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalStateException("quantityCoins 必须为正数");
            }
            if (referencePrice == null) {
                throw new IllegalStateException("referencePrice 必须设置");
            }
            if (orderType == OrderType.LIMIT && !Decimal.isPositive(limitPrice)) {
                throw new IllegalStateException("限价单必须设置正数 limitPrice");
            }
            if (leverage < 0) {
                throw new IllegalStateException("杠杆不能为负数");
            }
            return new TradeIntent(this);
        }

        private static String sanitizeClientOrderId(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String normalized = raw.replaceAll("[^A-Za-z0-9]", "");
            if (normalized.isBlank()) {
                normalized = "ord" + Integer.toUnsignedString(raw.hashCode(), 36);
            }
            return normalized.length() <= 32 ? normalized : normalized.substring(0, 32);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "TradeIntent{symbol=%s, side=%s, notionalUsd=%s, qtyCoins=%s, refPrice=%s, type=%s, lever=%d, mode=%s, reduceOnly=%s, clOrdId=%s}",
                symbol, side, notionalUsd, quantityCoins, referencePrice, orderType, leverage,
                marginMode, reduceOnly, clientOrderId);
    }
}
