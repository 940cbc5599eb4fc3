package com.trade.gateway.account;

import com.trade.gateway.core.AccountBalance;
import com.trade.gateway.core.AccountConfig;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.PendingOrder;
import com.trade.gateway.core.Position;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.exchange.ExchangeAdapter;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeOrder;
import com.trade.gateway.exchange.ExchangePosition;
import com.trade.gateway.exchange.ExchangeRestClient;
import com.trade.gateway.instrument.InstrumentSpecCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 账户查询服务（只读）
 * 返回与交易所无关的结构，数量单位为币。除手续费率外均不缓存。
 */
public class AccountQueryService {

    private static final Logger logger = LoggerFactory.getLogger(AccountQueryService.class);

    private final ExchangeRestClient client;
    private final ExchangeAdapter adapter;
    private final InstrumentSpecCache specCache;
    private final FeeScheduleCache feeCache;

    public AccountQueryService(ExchangeRestClient client, InstrumentSpecCache specCache, FeeScheduleCache feeCache) {
        this.client = client;
        this.adapter = client.getAdapter();
        this.specCache = specCache;
        this.feeCache = feeCache;
    }

    public AccountBalance getBalance(String asset) throws ExchangeException {
        return adapter.parseBalance(asset, client.execute(adapter.balanceCall(asset)));
    }

    public List<Position> getOpenPositions() throws ExchangeException {
        List<ExchangePosition> raw = adapter.parsePositions(client.execute(adapter.positionsCall()));
        List<Position> positions = new ArrayList<>(raw.size());
        for (ExchangePosition p : raw) {
            Symbol symbol = toSymbol(p.instrumentId());
            if (symbol == null) {
                continue;
            }
            InstrumentSpec spec = specCache.getSpec(symbol);
            positions.add(new Position(
                    symbol,
                    p.side(),
                    InstrumentSpecCache.toCoins(spec, p.contracts()),
                    p.leverage(),
                    Decimal.scalePrice(p.averagePrice()),
                    Decimal.scalePrice(p.unrealizedPnl()),
                    p.marginMode()
            ));
        }
        return positions;
    }

    public List<PendingOrder> getPendingOrders() throws ExchangeException {
        return getPendingOrders(null);
    }

    /**
     * @param symbol 交易对，null 表示全部
     */
    public List<PendingOrder> getPendingOrders(Symbol symbol) throws ExchangeException {
        String instrumentId = symbol == null ? null : adapter.toInstrumentId(symbol);
        List<ExchangeOrder> raw = adapter.parsePendingOrders(client.execute(adapter.pendingOrdersCall(instrumentId)));
        List<PendingOrder> orders = new ArrayList<>(raw.size());
        for (ExchangeOrder o : raw) {
            Symbol orderSymbol = symbol != null ? symbol : toSymbol(o.instrumentId());
            if (orderSymbol == null) {
                continue;
            }
            InstrumentSpec spec = specCache.getSpec(orderSymbol);
            orders.add(new PendingOrder(
                    o.orderId(),
                    o.clientOrderId(),
                    orderSymbol,
                    o.side(),
                    o.orderType(),
                    o.price(),
                    InstrumentSpecCache.toCoins(spec, o.contracts()),
                    InstrumentSpecCache.toCoins(spec, o.filledContracts() == null ? BigDecimal.ZERO : o.filledContracts()),
                    o.state(),
                    o.reduceOnly()
            ));
        }
        return orders;
    }

    public AccountConfig getAccountConfig() throws ExchangeException {
        AccountConfig config = adapter.parseAccountConfig(client.execute(adapter.accountConfigCall()));
        if (!config.supportsDerivatives()) {
            logger.warn("{} 账户等级 {} 无法交易永续合约，请切换为单币种或跨币种保证金模式",
                    adapter.getName(), config.accountLevel());
        }
        return config;
    }

    public FeeSchedule getFeeSchedule() {
        return feeCache.get();
    }

    private Symbol toSymbol(String instrumentId) {
        try {
            return adapter.fromInstrumentId(instrumentId);
        } catch (IllegalArgumentException e) {
            logger.debug("跳过非 USDT 合约: {}", instrumentId);
            return null;
        }
    }
}
