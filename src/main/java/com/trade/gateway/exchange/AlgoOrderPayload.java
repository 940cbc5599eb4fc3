package com.trade.gateway.exchange;

import com.trade.gateway.core.AlgoOrderRequest;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.Side;

import java.math.BigDecimal;

/**
 * Exchange-held TP/SL in exchange units. A null order price means market on trigger.
 */
public record AlgoOrderPayload(String instrumentId,
                               Side side,
                               PositionSide positionSide,
                               BigDecimal contracts,
                               BigDecimal takeProfitTrigger,
                               BigDecimal takeProfitOrderPrice,
                               BigDecimal stopLossTrigger,
                               BigDecimal stopLossOrderPrice,
                               MarginMode marginMode,
                               AlgoOrderRequest.TriggerPriceType triggerPriceType,
                               String clientOrderId) {

    public boolean isOneCancelsOther() {
        return takeProfitTrigger != null && stopLossTrigger != null;
    }
}
