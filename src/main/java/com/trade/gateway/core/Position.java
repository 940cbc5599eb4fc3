package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * 持仓
 * 以交易所为准，实例为只读快照
 */
public final class Position {
    private final Symbol symbol;
    private final PositionSide side;
    private final BigDecimal quantityCoins;
    private final BigDecimal leverage;
    private final BigDecimal averagePrice;
    private final BigDecimal unrealizedPnl;
    private final MarginMode marginMode;

    public Position(Symbol symbol,
                    PositionSide side,
                    BigDecimal quantityCoins,
                    BigDecimal leverage,
                    BigDecimal averagePrice,
                    BigDecimal unrealizedPnl,
                    MarginMode marginMode) {
        this.symbol = symbol;
        this.side = side;
        this.quantityCoins = quantityCoins;
        this.leverage = leverage;
        this.averagePrice = averagePrice;
        this.unrealizedPnl = unrealizedPnl;
        this.marginMode = marginMode;
    }

    public Symbol getSymbol() { return symbol; }
    public PositionSide getSide() { return side; }
    public BigDecimal getQuantityCoins() { return quantityCoins; }
    public BigDecimal getLeverage() { return leverage; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    public MarginMode getMarginMode() { return marginMode; }

    /**
     * 开仓名义价值（USDT）
     */
    public BigDecimal getValue() {
        return averagePrice.multiply(quantityCoins);
    }

    @Override
    public String toString() {
        return String.format("Position{symbol=%s, side=%s, qty=%s, avgPx=%s, lever=%s, upl=%s, mode=%s}",
                symbol, side, quantityCoins, averagePrice, leverage, unrealizedPnl, marginMode);
    }
}
