package com.trade.gateway;

import com.trade.gateway.account.AccountQueryService;
import com.trade.gateway.account.FeeScheduleCache;
import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.exchange.ExchangeAdapter;
import com.trade.gateway.exchange.ExchangeFactory;
import com.trade.gateway.exchange.ExchangeRestClient;
import com.trade.gateway.execution.OrderExecutionService;
import com.trade.gateway.execution.PriceSanityChecker;
import com.trade.gateway.instrument.ExchangeInstrumentSpecSource;
import com.trade.gateway.instrument.InstrumentSpecCache;

/**
 * 单个交易所账户的执行层
 * 下单服务与账户查询共享同一个 REST 客户端、合约规格缓存和手续费率缓存。
 */
public class TradeGateway implements AutoCloseable {

    private final ExchangeRestClient client;
    private final InstrumentSpecCache specCache;
    private final FeeScheduleCache feeCache;
    private final OrderExecutionService execution;
    private final AccountQueryService account;

    public TradeGateway(ExchangeRestClient client,
                        InstrumentSpecCache specCache,
                        FeeScheduleCache feeCache,
                        PriceSanityChecker priceChecker) {
        this.client = client;
        this.specCache = specCache;
        this.feeCache = feeCache;
        this.execution = new OrderExecutionService(client, specCache, feeCache, priceChecker);
        this.account = new AccountQueryService(client, specCache, feeCache);
    }

    public static TradeGateway create() {
        return create(ConfigManager.getInstance());
    }

    public static TradeGateway create(ConfigManager config) {
        ExchangeRestClient client = ExchangeFactory.createRestClient(config);
        ExchangeAdapter adapter = client.getAdapter();
        InstrumentSpecCache specCache = new InstrumentSpecCache(
                new ExchangeInstrumentSpecSource(client), adapter.defaultInstrumentSpecs());
        FeeSchedule defaultFees = new FeeSchedule(
                config.getBigDecimalProperty("fee.maker", FeeSchedule.DEFAULT.makerRate()),
                config.getBigDecimalProperty("fee.taker", FeeSchedule.DEFAULT.takerRate()));
        FeeScheduleCache feeCache = new FeeScheduleCache(
                () -> adapter.parseFeeSchedule(client.execute(adapter.feeScheduleCall())), defaultFees);
        return new TradeGateway(client, specCache, feeCache, PriceSanityChecker.fromConfig(config));
    }

    public OrderExecutionService execution() {
        return execution;
    }

    public AccountQueryService account() {
        return account;
    }

    public InstrumentSpecCache specs() {
        return specCache;
    }

    public FeeScheduleCache fees() {
        return feeCache;
    }

    public ExchangeRestClient client() {
        return client;
    }

    @Override
    public void close() {
        execution.close();
    }
}
