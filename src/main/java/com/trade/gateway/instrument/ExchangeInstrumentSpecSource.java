package com.trade.gateway.instrument;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.exchange.ExchangeAdapter;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeRestClient;

/**
 * 从交易所公共接口（无需签名）读取合约规格
 */
public class ExchangeInstrumentSpecSource implements InstrumentSpecSource {

    private final ExchangeRestClient client;

    public ExchangeInstrumentSpecSource(ExchangeRestClient client) {
        this.client = client;
    }

    @Override
    public InstrumentSpec fetch(Symbol symbol) throws ExchangeException {
        ExchangeAdapter adapter = client.getAdapter();
        JsonNode root = client.execute(adapter.instrumentSpecCall(symbol));
        return adapter.parseInstrumentSpec(symbol, root);
    }
}
