package com.trade.gateway.exchange;

import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.Side;

import java.math.BigDecimal;

/**
 * A regular order already translated into exchange units: size in contracts,
 * prices snapped to tick size.
 */
public record OrderPayload(String instrumentId,
                           Side side,
                           PositionSide positionSide,
                           OrderType orderType,
                           BigDecimal contracts,
                           BigDecimal price,
                           MarginMode marginMode,
                           boolean reduceOnly,
                           String clientOrderId,
                           BigDecimal takeProfitTrigger,
                           BigDecimal stopLossTrigger) {

    public boolean hasAttachedProtection() {
        return takeProfitTrigger != null || stopLossTrigger != null;
    }
}
