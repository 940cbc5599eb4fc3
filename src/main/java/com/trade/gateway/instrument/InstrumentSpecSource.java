package com.trade.gateway.instrument;

import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.exchange.ExchangeException;

/**
 * 缓存未命中时的合约规格来源
 */
@FunctionalInterface
public interface InstrumentSpecSource {

    InstrumentSpec fetch(Symbol symbol) throws ExchangeException;
}
