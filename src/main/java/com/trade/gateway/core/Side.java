package com.trade.gateway.core;

/**
 * 买卖方向
 */
public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * 该方向订单开仓（只减仓时为平仓）对应的持仓方向
     */
    public PositionSide positionSide(boolean reduceOnly) {
        if (reduceOnly) {
            return this == BUY ? PositionSide.SHORT : PositionSide.LONG;
        }
        return this == BUY ? PositionSide.LONG : PositionSide.SHORT;
    }
}
