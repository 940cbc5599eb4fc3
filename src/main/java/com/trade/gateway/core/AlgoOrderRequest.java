package com.trade.gateway.core;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * 交易所托管的止盈/止损条件单
 * 始终只减仓：只能减少持仓，不会开仓、反手或加仓。
 */
public final class AlgoOrderRequest {

    public enum TriggerPriceType {
        LAST,
        MARK,
        INDEX;

        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Symbol symbol;
    private final Side side;                    // 平仓单方向
    private final PositionSide positionSide;
    private final BigDecimal quantityCoins;
    private final BigDecimal takeProfitTrigger;
    private final BigDecimal takeProfitOrderPrice;  // null = 触发后市价
    private final BigDecimal stopLossTrigger;
    private final BigDecimal stopLossOrderPrice;    // null = 触发后市价
    private final MarginMode marginMode;
    private final TriggerPriceType triggerPriceType;
    private final String clientOrderId;

    private AlgoOrderRequest(Builder builder) {
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.positionSide = builder.positionSide != null ? builder.positionSide : builder.side.positionSide(true);
        this.quantityCoins = builder.quantityCoins;
        this.takeProfitTrigger = builder.takeProfitTrigger;
        this.takeProfitOrderPrice = builder.takeProfitOrderPrice;
        this.stopLossTrigger = builder.stopLossTrigger;
        this.stopLossOrderPrice = builder.stopLossOrderPrice;
        this.marginMode = builder.marginMode;
        this.triggerPriceType = builder.triggerPriceType;
        this.clientOrderId = builder.clientOrderId != null ? builder.clientOrderId : TradeIntent.newClientOrderId();
    }

    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public PositionSide getPositionSide() { return positionSide; }
    public BigDecimal getQuantityCoins() { return quantityCoins; }
    public BigDecimal getTakeProfitTrigger() { return takeProfitTrigger; }
    public BigDecimal getTakeProfitOrderPrice() { return takeProfitOrderPrice; }
    public BigDecimal getStopLossTrigger() { return stopLossTrigger; }
    public BigDecimal getStopLossOrderPrice() { return stopLossOrderPrice; }
    public MarginMode getMarginMode() { return marginMode; }
    public TriggerPriceType getTriggerPriceType() { return triggerPriceType; }
    public String getClientOrderId() { return clientOrderId; }

    public boolean hasTakeProfit() {
        return takeProfitTrigger != null;
    }

    public boolean hasStopLoss() {
        return stopLossTrigger != null;
    }

    public boolean isOneCancelsOther() {
        return hasTakeProfit() && hasStopLoss();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Symbol symbol;
        private Side side;
        private PositionSide positionSide;
        private BigDecimal quantityCoins;
        private BigDecimal takeProfitTrigger;
        private BigDecimal takeProfitOrderPrice;
        private BigDecimal stopLossTrigger;
        private BigDecimal stopLossOrderPrice;
        private MarginMode marginMode = MarginMode.CROSS;
        private TriggerPriceType triggerPriceType = TriggerPriceType.LAST;
        private String clientOrderId;

        public Builder symbol(Symbol symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder positionSide(PositionSide positionSide) {
            this.positionSide = positionSide;
            return this;
        }

        public Builder quantityCoins(BigDecimal quantityCoins) {
            this.quantityCoins = quantityCoins;
            return this;
        }

        public Builder takeProfit(BigDecimal trigger, BigDecimal orderPrice) {
            this.takeProfitTrigger = trigger;
            this.takeProfitOrderPrice = orderPrice;
            return this;
        }

        public Builder stopLoss(BigDecimal trigger, BigDecimal orderPrice) {
            this.stopLossTrigger = trigger;
            this.stopLossOrderPrice = orderPrice;
            return this;
        }

        public Builder marginMode(MarginMode marginMode) {
            this.marginMode = marginMode;
            return this;
        }

        public Builder triggerPriceType(TriggerPriceType triggerPriceType) {
            this.triggerPriceType = triggerPriceType;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public AlgoOrderRequest build() {
            if (symbol == null || side == null || marginMode == null || triggerPriceType == null) {
                throw new IllegalStateException("symbol, side, marginMode, triggerPriceType 必须设置");
            }
            if (!Decimal.isPositive(quantityCoins)) {
                throw new IllegalStateException("quantityCoins 必须为正数");
            }
            if (takeProfitTrigger == null && stopLossTrigger == null) {
                throw new IllegalStateException("止盈和止损至少设置一个");
            }
            return new AlgoOrderRequest(this);
        }
    }

    @Override
    public String toString() {
        return String.format("AlgoOrderRequest{symbol=%s, side=%s, qty=%s, tp=%s, sl=%s, clOrdId=%s}",
                symbol, side, quantityCoins, takeProfitTrigger, stopLossTrigger, clientOrderId);
    }
}
