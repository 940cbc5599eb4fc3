package com.trade.gateway.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.account.FeeScheduleCache;
import com.trade.gateway.core.AlgoOrderRequest;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderRef;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.SizeLimits;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.core.TradeIntent;
import com.trade.gateway.error.ErrorCodeTable;
import com.trade.gateway.exchange.AlgoOrderPayload;
import com.trade.gateway.exchange.ExchangeAdapter;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeOrder;
import com.trade.gateway.exchange.ExchangeResponse;
import com.trade.gateway.exchange.ExchangeRestClient;
import com.trade.gateway.exchange.OrderAck;
import com.trade.gateway.exchange.OrderPayload;
import com.trade.gateway.instrument.InstrumentSpecCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * 订单执行服务（与交易所无关）
 * 1. 参考价格合理性校验
 * 2. 按合约规格把币数量换算为张数
 * 3. 最大下单量 / 最大可用量预检
 * 4. 按保证金模式同步杠杆
 * 5. 提交订单
 * 6. 查询成交并估算手续费
 *
 * 交易所失败不会以异常抛出，每次调用都返回 {@link OrderResult}。
 * 同一交易对的并发意图不在此串行化。
 */
public class OrderExecutionService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OrderExecutionService.class);

    private static final int DEFAULT_ASYNC_THREADS = 4;

    private final ExchangeRestClient client;
    private final ExchangeAdapter adapter;
    private final ErrorCodeTable errorCodes;
    private final InstrumentSpecCache specCache;
    private final FeeScheduleCache feeCache;
    private final PriceSanityChecker priceChecker;
    private final ExecutorService executor;
    private final List<OrderListener> listeners = new CopyOnWriteArrayList<>();

    public OrderExecutionService(ExchangeRestClient client,
                                 InstrumentSpecCache specCache,
                                 FeeScheduleCache feeCache,
                                 PriceSanityChecker priceChecker) {
        this(client, specCache, feeCache, priceChecker, newDaemonPool(DEFAULT_ASYNC_THREADS));
    }

    public OrderExecutionService(ExchangeRestClient client,
                                 InstrumentSpecCache specCache,
                                 FeeScheduleCache feeCache,
                                 PriceSanityChecker priceChecker,
                                 ExecutorService executor) {
        this.client = client;
        this.adapter = client.getAdapter();
        this.errorCodes = adapter.getErrorCodes();
        this.specCache = specCache;
        this.feeCache = feeCache;
        this.priceChecker = priceChecker;
        this.executor = executor;
    }

    public void addListener(OrderListener listener) {
        listeners.add(listener);
    }

    public void removeListener(OrderListener listener) {
        listeners.remove(listener);
    }

    // ---- 单笔下单 ----

    public OrderResult execute(TradeIntent intent) {
        logger.info("执行下单: {}", intent);
        OrderResult result = doExecute(intent);
        if (result.isSuccess()) {
            logger.info("订单已提交: {} -> {}", intent.getClientOrderId(), result.getOrderId());
            notifyListeners(OrderListener::onOrderAccepted, intent, result);
        } else {
            logger.error("订单提交失败: {} - {}", intent.getClientOrderId(), result.getErrorMessage());
            notifyListeners(OrderListener::onOrderFailed, intent, result);
        }
        return result;
    }

    /**
     * 在工作线程池中执行 {@link #execute}。
     * 调用方放弃等待不会取消订单，本次尝试会执行完毕。
     */
    public CompletableFuture<OrderResult> executeAsync(TradeIntent intent) {
        return CompletableFuture.supplyAsync(() -> execute(intent), executor);
    }

    private OrderResult doExecute(TradeIntent intent) {
        String clOrdId = intent.getClientOrderId();
        Prepared prepared;
        try {
            prepared = prepare(intent);
        } catch (ExchangeException e) {
            return OrderResult.fromException(clOrdId, e);
        }

        try {
            checkSizeLimits(prepared);
        } catch (ExchangeException e) {
            if (e.getErrorCode() == ExchangeException.ErrorCode.AUTH_FAILED
                    || e.getErrorCode() == ExchangeException.ErrorCode.VALIDATION_FAILED) {
                return OrderResult.fromException(clOrdId, e);
            }
            logger.warn("查询下单上限失败: {}，跳过预检直接提交: {}",
                    prepared.instrumentId, e.describe());
        }

        try {
            syncLeverage(prepared.instrumentId, intent.getMarginMode(), intent.getPositionSide(), intent.getLeverage());
        } catch (ExchangeException e) {
            return OrderResult.fromException(clOrdId, e);
        }

        OrderAck ack;
        String rawResponse;
        try {
            ExchangeResponse response = client.call(adapter.placeOrderCall(prepared.payload));
            rawResponse = response.body();
            ack = adapter.parsePlaceOrders(List.of(prepared.payload), response.root()).get(0);
        } catch (ExchangeException e) {
            if (errorCodes.isDuplicateClientOrderId(e.getExchangeCode())) {
                return resolveDuplicate(prepared, e.getExchangeCode(), e.getMessage(), e.getResponseBody());
            }
            return OrderResult.fromException(clOrdId, e);
        }

        if (!ack.accepted()) {
            if (errorCodes.isDuplicateClientOrderId(ack.code())) {
                return resolveDuplicate(prepared, ack.code(), ack.message(), rawResponse);
            }
            return rejectedAck(clOrdId, ack, rawResponse);
        }
        return completeFill(prepared, ack.orderId(), rawResponse);
    }

    /**
     * 价格校验、规格查询、张数换算、价格按最小变动价位取整。不发签名请求。
     */
    private Prepared prepare(TradeIntent intent) throws ExchangeException {
        Symbol symbol = intent.getSymbol();
        if (!priceChecker.isPlausible(symbol, intent.getReferencePrice())) {
            throw new ExchangeException(ExchangeException.ErrorCode.VALIDATION_FAILED,
                    "价格异常: " + symbol + " 参考价 " + intent.getReferencePrice()
                            + " 不在合理区间 " + describeRange(symbol)
                            + "，行情数据可能属于其他币种");
        }
        if (intent.getTakeProfitPrice() != null && intent.getStopLossPrice() != null) {
            checkProtectionOrder(intent.getPositionSide(), intent.getTakeProfitPrice(), intent.getStopLossPrice());
        }

        InstrumentSpec spec = specCache.getSpec(symbol);
        BigDecimal coins = intent.resolveQuantityCoins();
        BigDecimal contracts = InstrumentSpecCache.toContracts(spec, coins);
        if (!Decimal.isPositive(contracts)) {
            throw new ExchangeException(ExchangeException.ErrorCode.VALIDATION_FAILED,
                    "数量 " + Decimal.plain(coins) + " " + symbol.getBase() + " 换算后不足一张合约");
        }
        if (specCache.isDegraded(symbol)) {
            logger.warn("{} 使用降级的合约规格计算数量: {}", intent.getClientOrderId(), spec);
        }

        BigDecimal price = null;
        if (intent.getOrderType() == OrderType.LIMIT) {
            price = spec.snapPrice(intent.getLimitPrice(), RoundingMode.HALF_UP);
        }
        String instrumentId = adapter.toInstrumentId(symbol);
        OrderPayload payload = new OrderPayload(
                instrumentId,
                intent.getSide(),
                intent.getPositionSide(),
                intent.getOrderType(),
                contracts,
                price,
                intent.getMarginMode(),
                intent.isReduceOnly(),
                intent.getClientOrderId(),
                snapOrNull(spec, intent.getTakeProfitPrice()),
                snapOrNull(spec, intent.getStopLossPrice())
        );
        logger.debug("{}: {} {} = {} 张 {}", intent.getClientOrderId(),
                Decimal.plain(coins), symbol.getBase(), Decimal.plain(contracts), instrumentId);
        return new Prepared(intent, spec, instrumentId, coins, payload);
    }

    private void checkSizeLimits(Prepared prepared) throws ExchangeException {
        if (!adapter.supportsSizeLimits()) {
            return;
        }
        TradeIntent intent = prepared.intent;
        MarginMode mode = intent.getMarginMode();
        JsonNode maxRoot = client.execute(adapter.maxOrderSizeCall(prepared.instrumentId, mode));
        JsonNode availRoot = intent.isReduceOnly()
                ? null
                : client.execute(adapter.maxAvailableSizeCall(prepared.instrumentId, mode));
        SizeLimits limits = adapter.parseSizeLimits(maxRoot, availRoot);

        BigDecimal contracts = prepared.payload.contracts();
        BigDecimal max = limits.maxFor(intent.getSide());
        if (max != null && contracts.compareTo(max) > 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.VALIDATION_FAILED,
                    "下单数量 " + Decimal.plain(contracts) + " 张超过最大下单量 " + Decimal.plain(max)
                            + " 张: " + prepared.instrumentId + " (" + mode.getWireValue() + ")");
        }
        BigDecimal available = intent.isReduceOnly() ? null : limits.availableFor(intent.getSide());
        if (available != null && contracts.compareTo(available) > 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.VALIDATION_FAILED,
                    "下单数量 " + Decimal.plain(contracts) + " 张超过可用数量 " + Decimal.plain(available)
                            + " 张: " + prepared.instrumentId
                            + "，请减小数量、降低杠杆或追加保证金");
        }
    }

    /**
     * 当前杠杆与目标不同时才设置。杠杆为 0 表示不调整。
     */
    private void syncLeverage(String instrumentId, MarginMode mode, PositionSide positionSide, int leverage)
            throws ExchangeException {
        if (leverage <= 0) {
            return;
        }
        try {
            Optional<Integer> current = adapter.parseLeverage(
                    client.execute(adapter.leverageInfoCall(instrumentId, mode)), positionSide);
            if (current.isPresent() && current.get() == leverage) {
                logger.debug("{} 杠杆已是 {}x ({})", instrumentId, leverage, mode.getWireValue());
                return;
            }
        } catch (ExchangeException e) {
            if (e.getErrorCode() == ExchangeException.ErrorCode.AUTH_FAILED) {
                throw e;
            }
            logger.warn("查询杠杆失败: {}，直接设置为 {}x: {}", instrumentId, leverage, e.describe());
        }

        try {
            client.execute(adapter.setLeverageCall(instrumentId, mode, positionSide, leverage));
            logger.info("{} 杠杆已设置为 {}x ({})", instrumentId, leverage, mode.getWireValue());
        } catch (ExchangeException e) {
            if (errorCodes.isLeverageUnchanged(e.getExchangeCode())) {
                logger.debug("{} 杠杆未变化: {}x", instrumentId, leverage);
                return;
            }
            throw new ExchangeException(e.getErrorCode(),
                    "设置杠杆失败: " + instrumentId + " " + leverage + "x - " + e.getMessage(),
                    e.getExchangeCode(), e.getHint(), e.getResponseBody(), e);
        }
    }

    /**
     * 客户端订单号重复说明之前的某次尝试已到达交易所。
     */
    private OrderResult resolveDuplicate(Prepared prepared, String code, String message, String rawResponse) {
        String clOrdId = prepared.intent.getClientOrderId();
        try {
            Optional<ExchangeOrder> existing = adapter.parseOrderDetail(client.execute(
                    adapter.orderDetailCall(prepared.instrumentId, OrderRef.clientOrderId(clOrdId))));
            if (existing.isPresent() && existing.get().orderId() != null) {
                logger.info("订单已存在，沿用: {} -> {}", clOrdId, existing.get().orderId());
                return toResult(prepared, existing.get(), rawResponse);
            }
        } catch (ExchangeException e) {
            logger.warn("查询重复订单失败: {} - {}", clOrdId, e.describe());
        }
        return OrderResult.failure(clOrdId, ExchangeException.ErrorCode.ORDER_REJECTED, code,
                withHint(message, code), rawResponse);
    }

    private OrderResult completeFill(Prepared prepared, String orderId, String rawResponse) {
        try {
            Optional<ExchangeOrder> detail = adapter.parseOrderDetail(client.execute(
                    adapter.orderDetailCall(prepared.instrumentId, OrderRef.orderId(orderId))));
            if (detail.isPresent()) {
                return toResult(prepared, detail.get(), rawResponse);
            }
        } catch (ExchangeException e) {
            logger.debug("查询成交失败: {} - {}", orderId, e.getMessage());
        }
        return toResult(prepared, orderId, null, null, rawResponse);
    }

    private OrderResult toResult(Prepared prepared, ExchangeOrder order, String rawResponse) {
        BigDecimal filledCoins = order.filledContracts() == null
                ? null
                : InstrumentSpecCache.toCoins(prepared.spec, order.filledContracts());
        BigDecimal avgPx = Decimal.isPositive(order.averagePrice()) ? order.averagePrice() : null;
        return toResult(prepared, order.orderId(), filledCoins, avgPx, rawResponse);
    }

    private OrderResult toResult(Prepared prepared,
                                 String orderId,
                                 BigDecimal filledCoins,
                                 BigDecimal averagePrice,
                                 String rawResponse) {
        TradeIntent intent = prepared.intent;
        BigDecimal feeQty = Decimal.isPositive(filledCoins) ? filledCoins : prepared.coins;
        BigDecimal feePx = averagePrice != null ? averagePrice : intent.pricingPrice();
        return OrderResult.success(orderId, intent.getClientOrderId(), prepared.coins,
                filledCoins, averagePrice, estimateFee(intent.getOrderType(), feeQty, feePx), rawResponse);
    }

    /**
     * 名义价值 x 费率（市价单用 taker，限价单用 maker）
     */
    private BigDecimal estimateFee(OrderType type, BigDecimal coins, BigDecimal price) {
        if (coins == null || price == null) {
            return null;
        }
        BigDecimal rate = feeCache.get().rateFor(type);
        return Decimal.scalePrice(coins.multiply(price).multiply(rate));
    }

    // ---- 批量下单 ----

    /**
     * 按交易所批量上限分组提交。每个意图按输入顺序各有一个结果，
     * 部分订单被拒不影响其他订单。
     */
    public List<OrderResult> executeBatch(List<TradeIntent> intents) {
        OrderResult[] results = new OrderResult[intents.size()];
        List<Integer> pending = new ArrayList<>();
        Map<Integer, Prepared> prepared = new HashMap<>();

        for (int i = 0; i < intents.size(); i++) {
            TradeIntent intent = intents.get(i);
            try {
                prepared.put(i, prepare(intent));
                pending.add(i);
            } catch (ExchangeException e) {
                results[i] = OrderResult.fromException(intent.getClientOrderId(), e);
            }
        }

        Map<LeverageKey, ExchangeException> leverageFailures = new HashMap<>();
        Set<LeverageKey> synced = new HashSet<>();
        List<Integer> ready = new ArrayList<>();
        for (Integer i : pending) {
            Prepared p = prepared.get(i);
            LeverageKey key = new LeverageKey(p.instrumentId, p.intent.getMarginMode(),
                    p.intent.getPositionSide(), p.intent.getLeverage());
            if (synced.add(key)) {
                try {
                    syncLeverage(key.instrumentId(), key.marginMode(), key.positionSide(), key.leverage());
                } catch (ExchangeException e) {
                    leverageFailures.put(key, e);
                }
            }
            ExchangeException failure = leverageFailures.get(key);
            if (failure != null) {
                results[i] = OrderResult.fromException(p.intent.getClientOrderId(), failure);
            } else {
                ready.add(i);
            }
        }

        int batchSize = Math.max(1, adapter.getMaxBatchSize());
        ExchangeException fatal = null;
        for (int start = 0; start < ready.size(); start += batchSize) {
            List<Integer> chunk = ready.subList(start, Math.min(start + batchSize, ready.size()));
            if (fatal != null) {
                for (Integer i : chunk) {
                    results[i] = OrderResult.fromException(intents.get(i).getClientOrderId(), fatal);
                }
                continue;
            }
            try {
                submitChunk(chunk, prepared, results);
            } catch (ExchangeException e) {
                logger.error("批量下单失败: {} 笔 - {}", chunk.size(), e.describe());
                for (Integer i : chunk) {
                    results[i] = OrderResult.fromException(intents.get(i).getClientOrderId(), e);
                }
                if (e.getErrorCode() == ExchangeException.ErrorCode.AUTH_FAILED) {
                    fatal = e;
                }
            }
        }

        int accepted = 0;
        for (int i = 0; i < results.length; i++) {
            if (results[i].isSuccess()) {
                accepted++;
                notifyListeners(OrderListener::onOrderAccepted, intents.get(i), results[i]);
            } else {
                notifyListeners(OrderListener::onOrderFailed, intents.get(i), results[i]);
            }
        }
        logger.info("批量下单完成: {}/{} 笔成功", accepted, results.length);
        return List.of(results);
    }

    private void submitChunk(List<Integer> chunk, Map<Integer, Prepared> prepared, OrderResult[] results)
            throws ExchangeException {
        List<OrderPayload> payloads = new ArrayList<>(chunk.size());
        for (Integer i : chunk) {
            payloads.add(prepared.get(i).payload);
        }
        ExchangeResponse response = client.call(payloads.size() == 1
                ? adapter.placeOrderCall(payloads.get(0))
                : adapter.batchPlaceOrderCall(payloads));
        List<OrderAck> acks = adapter.parsePlaceOrders(payloads, response.root());
        for (int k = 0; k < chunk.size(); k++) {
            int i = chunk.get(k);
            Prepared p = prepared.get(i);
            OrderAck ack = acks.get(k);
            if (ack.accepted()) {
                // 批量模式不逐笔查询成交，手续费按请求数量估算
                results[i] = toResult(p, ack.orderId(), null, null, response.body());
            } else if (errorCodes.isDuplicateClientOrderId(ack.code())) {
                results[i] = resolveDuplicate(p, ack.code(), ack.message(), response.body());
            } else {
                results[i] = rejectedAck(p.intent.getClientOrderId(), ack, response.body());
            }
        }
    }

    // ---- 条件单 ----

    /**
     * 交易所托管的止盈/止损单，始终只减仓
     */
    public OrderResult placeAlgoOrder(AlgoOrderRequest request) {
        String clOrdId = request.getClientOrderId();
        logger.info("提交条件单: {}", request);
        try {
            if (request.isOneCancelsOther()) {
                checkProtectionOrder(request.getPositionSide(),
                        request.getTakeProfitTrigger(), request.getStopLossTrigger());
            }
            InstrumentSpec spec = specCache.getSpec(request.getSymbol());
            BigDecimal contracts = InstrumentSpecCache.toContracts(spec, request.getQuantityCoins());
            AlgoOrderPayload payload = new AlgoOrderPayload(
                    adapter.toInstrumentId(request.getSymbol()),
                    request.getSide(),
                    request.getPositionSide(),
                    contracts,
                    snapOrNull(spec, request.getTakeProfitTrigger()),
                    snapOrNull(spec, request.getTakeProfitOrderPrice()),
                    snapOrNull(spec, request.getStopLossTrigger()),
                    snapOrNull(spec, request.getStopLossOrderPrice()),
                    request.getMarginMode(),
                    request.getTriggerPriceType(),
                    clOrdId
            );
            ExchangeResponse response = client.call(adapter.algoOrderCall(payload));
            OrderAck ack = adapter.parseAlgoOrder(payload, response.root());
            if (!ack.accepted()) {
                OrderResult result = rejectedAck(clOrdId, ack, response.body());
                logger.error("条件单提交失败: {} - {}", clOrdId, result.getErrorMessage());
                return result;
            }
            logger.info("条件单已提交: {} -> {}", clOrdId, ack.orderId());
            return OrderResult.success(ack.orderId(), clOrdId, request.getQuantityCoins(),
                    null, null, null, response.body());
        } catch (ExchangeException e) {
            logger.error("条件单提交失败: {} - {}", clOrdId, e.describe());
            return OrderResult.fromException(clOrdId, e);
        }
    }

    // ---- 撤单 ----

    public OrderResult cancelOrder(Symbol symbol, OrderRef ref) {
        String instrumentId = adapter.toInstrumentId(symbol);
        String clOrdId = ref.kind() == OrderRef.Kind.CLIENT_ORDER_ID ? ref.value() : null;
        try {
            ExchangeResponse response = client.call(adapter.cancelOrderCall(instrumentId, ref));
            OrderAck ack = adapter.parseCancel(ref, response.root());
            if (!ack.accepted()) {
                return rejectedAck(clOrdId, ack, response.body());
            }
            logger.info("订单已取消: {} {} ({})", ref.kind(), ref.value(), instrumentId);
            return OrderResult.success(ack.orderId(), clOrdId, null, null, null, null, response.body());
        } catch (ExchangeException e) {
            logger.error("取消订单失败: {} {} - {}", ref.kind(), ref.value(), e.describe());
            return OrderResult.fromException(clOrdId, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    // ---- 辅助方法 ----

    /**
     * 止盈价必须位于止损价的盈利一侧
     */
    private static void checkProtectionOrder(PositionSide positionSide, BigDecimal takeProfit, BigDecimal stopLoss)
            throws ExchangeException {
        boolean valid = positionSide == PositionSide.LONG
                ? takeProfit.compareTo(stopLoss) > 0
                : takeProfit.compareTo(stopLoss) < 0;
        if (!valid) {
            throw new ExchangeException(ExchangeException.ErrorCode.VALIDATION_FAILED,
                    positionSide + " 仓位的止盈止损不一致: 止盈 "
                            + Decimal.plain(takeProfit) + " / 止损 " + Decimal.plain(stopLoss));
        }
    }

    private OrderResult rejectedAck(String clOrdId, OrderAck ack, String rawResponse) {
        return OrderResult.failure(clOrdId, ExchangeException.ErrorCode.ORDER_REJECTED, ack.code(),
                withHint(ack.message(), ack.code()), rawResponse);
    }

    private String withHint(String message, String code) {
        String hint = client.getClassifier().remediationHint(code, 200);
        String base = message == null || message.isBlank() ? "订单被拒绝, code=" + code : message;
        return hint == null ? base : base + " (提示: " + hint + ")";
    }

    private String describeRange(Symbol symbol) {
        PriceSanityChecker.Range range = priceChecker.rangeFor(symbol);
        return range == null ? "(0, 1000000)" : "[" + range.min() + ", " + range.max() + "]";
    }

    private static BigDecimal snapOrNull(InstrumentSpec spec, BigDecimal price) {
        return price == null ? null : spec.snapPrice(price, RoundingMode.HALF_UP);
    }

    private void notifyListeners(BiConsumer<OrderListener, OrderResult> action, TradeIntent intent, OrderResult result) {
        for (OrderListener listener : listeners) {
            try {
                action.accept(listener, result);
            } catch (Exception e) {
                logger.error("监听器回调失败: {} - {}", intent.getClientOrderId(), e.getMessage());
            }
        }
    }

    private static ExecutorService newDaemonPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "order-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static final class Prepared {
        private final TradeIntent intent;
        private final InstrumentSpec spec;
        private final String instrumentId;
        private final BigDecimal coins;
        private final OrderPayload payload;

        private Prepared(TradeIntent intent, InstrumentSpec spec, String instrumentId, BigDecimal coins, OrderPayload payload) {
            this.intent = intent;
            this.spec = spec;
            this.instrumentId = instrumentId;
            this.coins = coins;
            this.payload = payload;
        }
    }

    private record LeverageKey(String instrumentId, MarginMode marginMode, PositionSide positionSide, int leverage) {
    }

    /**
     * 订单结果监听器。在执行线程上回调，异常只记录日志。
     */
    public interface OrderListener {
        default void onOrderAccepted(OrderResult result) {}
        default void onOrderFailed(OrderResult result) {}
    }
}
