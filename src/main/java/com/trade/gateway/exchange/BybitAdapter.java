package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.auth.SignatureScheme;
import com.trade.gateway.core.AccountBalance;
import com.trade.gateway.core.AccountConfig;
import com.trade.gateway.core.AlgoOrderRequest;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderRef;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.SizeLimits;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.error.ErrorCodeTable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bybit v5, linear (USDT-settled) perpetuals. Linear sizes are quoted in coins,
 * so every instrument has contract value 1.
 * <p>
 * Margin mode is an account-level setting on unified accounts and is not sent per order.
 * TP/SL goes through /v5/position/trading-stop, which returns no order id.
 */
public class BybitAdapter implements ExchangeAdapter {

    public static final String PROD_BASE_URL = "https://api.bybit.com";
    public static final String DEMO_BASE_URL = "https://api-demo.bybit.com";
    public static final int MAX_BATCH_SIZE = 10;

    private static final String CATEGORY = "linear";
    private static final String SETTLE_COIN = "USDT";
    private static final Map<Symbol, InstrumentSpec> DEFAULT_SPECS = buildDefaultSpecs();

    private final String baseUrl;
    private final boolean demo;
    private final boolean hedgeMode;
    private final ErrorCodeTable errorCodes = ErrorCodeTable.bybit();

    public BybitAdapter(String baseUrl, boolean demo, boolean hedgeMode) {
        String fallback = demo ? DEMO_BASE_URL : PROD_BASE_URL;
        String value = baseUrl == null || baseUrl.isBlank() ? fallback : baseUrl.trim();
        this.baseUrl = value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        this.demo = demo;
        this.hedgeMode = hedgeMode;
    }

    @Override
    public String getName() {
        return demo ? "Bybit-Demo" : "Bybit";
    }

    @Override
    public SignatureScheme getSignatureScheme() {
        return SignatureScheme.SORTED_PARAMS_HEX;
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public boolean isDemo() {
        return demo;
    }

    @Override
    public Map<String, String> extraHeaders() {
        return Map.of();
    }

    @Override
    public ErrorCodeTable getErrorCodes() {
        return errorCodes;
    }

    @Override
    public int getMaxBatchSize() {
        return MAX_BATCH_SIZE;
    }

    @Override
    public boolean supportsSizeLimits() {
        return false;
    }

    @Override
    public String toInstrumentId(Symbol symbol) {
        return symbol.toPairString();
    }

    @Override
    public Symbol fromInstrumentId(String instrumentId) {
        return Symbol.of(instrumentId);
    }

    @Override
    public EnvelopeStatus parseStatus(JsonNode root) {
        JsonNode codeNode = root.get("retCode");
        if (codeNode == null || codeNode.isNull()) {
            return EnvelopeStatus.UNPARSEABLE;
        }
        return new EnvelopeStatus(codeNode.asText(""), root.path("retMsg").asText(""));
    }

    @Override
    public Map<Symbol, InstrumentSpec> defaultInstrumentSpecs() {
        return DEFAULT_SPECS;
    }

    // ---- instrument metadata ----

    @Override
    public ExchangeCall instrumentSpecCall(Symbol symbol) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("category", CATEGORY);
        query.put("symbol", toInstrumentId(symbol));
        return ExchangeCall.publicGet("/v5/market/instruments-info", query);
    }

    @Override
    public InstrumentSpec parseInstrumentSpec(Symbol symbol, JsonNode root) throws ExchangeException {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL,
                    "Instrument not found on Bybit: " + toInstrumentId(symbol));
        }
        JsonNode node = list.get(0);
        JsonNode lot = node.path("lotSizeFilter");
        BigDecimal qtyStep = Decimal.parsePositive(lot.path("qtyStep").asText(), null);
        if (qtyStep == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "Instrument " + toInstrumentId(symbol) + " has no qtyStep: " + node);
        }
        BigDecimal minQty = Decimal.parsePositive(lot.path("minOrderQty").asText(), qtyStep);
        BigDecimal tickSize = Decimal.parsePositive(node.path("priceFilter").path("tickSize").asText(), null);
        return new InstrumentSpec(symbol, node.path("symbol").asText(toInstrumentId(symbol)),
                BigDecimal.ONE, minQty, qtyStep, tickSize);
    }

    // ---- trading ----

    @Override
    public ExchangeCall placeOrderCall(OrderPayload order) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.putAll(toOrderBody(order));
        return ExchangeCall.privatePost("/v5/order/create", body);
    }

    @Override
    public ExchangeCall batchPlaceOrderCall(List<OrderPayload> orders) {
        if (orders.isEmpty() || orders.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Bybit batch size must be 1.." + MAX_BATCH_SIZE + ", was " + orders.size());
        }
        List<Map<String, Object>> request = new ArrayList<>();
        for (OrderPayload order : orders) {
            request.add(toOrderBody(order));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("request", request);
        return ExchangeCall.privatePost("/v5/order/create-batch", body);
    }

    private Map<String, Object> toOrderBody(OrderPayload order) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", order.instrumentId());
        body.put("side", toWireSide(order.side()));
        body.put("orderType", order.orderType() == OrderType.LIMIT ? "Limit" : "Market");
        body.put("qty", Decimal.plain(order.contracts()));
        if (order.orderType() == OrderType.LIMIT) {
            body.put("price", Decimal.plain(order.price()));
            body.put("timeInForce", "GTC");
        }
        body.put("positionIdx", positionIdx(order.positionSide()));
        if (order.clientOrderId() != null) {
            body.put("orderLinkId", order.clientOrderId());
        }
        if (order.reduceOnly()) {
            body.put("reduceOnly", true);
        }
        if (order.takeProfitTrigger() != null) {
            body.put("takeProfit", Decimal.plain(order.takeProfitTrigger()));
        }
        if (order.stopLossTrigger() != null) {
            body.put("stopLoss", Decimal.plain(order.stopLossTrigger()));
        }
        return body;
    }

    /**
     * Single orders answer with result{orderId, orderLinkId}; batches with result.list
     * plus per-row codes in retExtInfo.list.
     */
    @Override
    public List<OrderAck> parsePlaceOrders(List<OrderPayload> submitted, JsonNode root) throws ExchangeException {
        JsonNode result = root.path("result");
        JsonNode list = result.path("list");
        if (!list.isArray()) {
            if (submitted.size() != 1) {
                throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                        "Batch order response has no result.list");
            }
            String orderId = result.path("orderId").asText("");
            String linkId = result.path("orderLinkId").asText(submitted.get(0).clientOrderId());
            if (orderId.isBlank()) {
                throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "Place order returned empty orderId");
            }
            return List.of(OrderAck.accepted(orderId, linkId));
        }

        JsonNode statuses = root.path("retExtInfo").path("list");
        List<OrderAck> acks = new ArrayList<>(submitted.size());
        for (int i = 0; i < submitted.size(); i++) {
            String linkId = submitted.get(i).clientOrderId();
            JsonNode row = i < list.size() ? list.get(i) : null;
            JsonNode status = statuses.isArray() && i < statuses.size() ? statuses.get(i) : null;
            String code = status == null ? errorCodes.getSuccessCode() : status.path("code").asText(errorCodes.getSuccessCode());
            if (row == null) {
                acks.add(OrderAck.rejected(linkId, null, "No acknowledgement for orderLinkId " + linkId));
            } else if (!errorCodes.isSuccess(code)) {
                acks.add(OrderAck.rejected(linkId, code, status.path("msg").asText("unknown")));
            } else {
                String orderId = row.path("orderId").asText("");
                acks.add(OrderAck.accepted(orderId.isBlank() ? null : orderId, row.path("orderLinkId").asText(linkId)));
            }
        }
        return acks;
    }

    @Override
    public ExchangeCall algoOrderCall(AlgoOrderPayload order) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("symbol", order.instrumentId());
        body.put("tpslMode", "Partial");
        body.put("positionIdx", positionIdx(order.positionSide()));
        String size = Decimal.plain(order.contracts());
        String triggerBy = toTriggerBy(order.triggerPriceType());
        if (order.takeProfitTrigger() != null) {
            body.put("takeProfit", Decimal.plain(order.takeProfitTrigger()));
            body.put("tpTriggerBy", triggerBy);
            body.put("tpSize", size);
            if (order.takeProfitOrderPrice() == null) {
                body.put("tpOrderType", "Market");
            } else {
                body.put("tpOrderType", "Limit");
                body.put("tpLimitPrice", Decimal.plain(order.takeProfitOrderPrice()));
            }
        }
        if (order.stopLossTrigger() != null) {
            body.put("stopLoss", Decimal.plain(order.stopLossTrigger()));
            body.put("slTriggerBy", triggerBy);
            body.put("slSize", size);
            if (order.stopLossOrderPrice() == null) {
                body.put("slOrderType", "Market");
            } else {
                body.put("slOrderType", "Limit");
                body.put("slLimitPrice", Decimal.plain(order.stopLossOrderPrice()));
            }
        }
        return ExchangeCall.privatePost("/v5/position/trading-stop", body);
    }

    @Override
    public OrderAck parseAlgoOrder(AlgoOrderPayload submitted, JsonNode root) {
        return OrderAck.accepted(null, submitted.clientOrderId());
    }

    @Override
    public ExchangeCall cancelOrderCall(String instrumentId, OrderRef ref) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("symbol", instrumentId);
        body.put(ref.kind() == OrderRef.Kind.CLIENT_ORDER_ID ? "orderLinkId" : "orderId", ref.value());
        return ExchangeCall.privatePost("/v5/order/cancel", body);
    }

    @Override
    public OrderAck parseCancel(OrderRef ref, JsonNode root) {
        JsonNode result = root.path("result");
        String orderId = result.path("orderId").asText("");
        String linkId = result.path("orderLinkId").asText("");
        return OrderAck.accepted(orderId.isBlank() ? ref.value() : orderId, linkId.isBlank() ? null : linkId);
    }

    @Override
    public ExchangeCall orderDetailCall(String instrumentId, OrderRef ref) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("category", CATEGORY);
        query.put("symbol", instrumentId);
        query.put(ref.kind() == OrderRef.Kind.CLIENT_ORDER_ID ? "orderLinkId" : "orderId", ref.value());
        return ExchangeCall.privateGet("/v5/order/realtime", query);
    }

    @Override
    public Optional<ExchangeOrder> parseOrderDetail(JsonNode root) {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toExchangeOrder(list.get(0)));
    }

    // ---- leverage and limits ----

    @Override
    public ExchangeCall leverageInfoCall(String instrumentId, MarginMode marginMode) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("category", CATEGORY);
        query.put("symbol", instrumentId);
        return ExchangeCall.privateGet("/v5/position/list", query);
    }

    @Override
    public Optional<Integer> parseLeverage(JsonNode root, PositionSide positionSide) {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            return Optional.empty();
        }
        JsonNode row = list.get(0);
        int wantedIdx = positionIdx(positionSide);
        for (JsonNode candidate : list) {
            if (candidate.path("positionIdx").asInt(0) == wantedIdx) {
                row = candidate;
                break;
            }
        }
        BigDecimal lever = Decimal.parsePositive(row.path("leverage").asText(), null);
        return lever == null ? Optional.empty() : Optional.of(lever.intValue());
    }

    @Override
    public ExchangeCall setLeverageCall(String instrumentId, MarginMode marginMode, PositionSide positionSide, int leverage) {
        // buy and sell leverage are set together, in both position modes
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", CATEGORY);
        body.put("symbol", instrumentId);
        body.put("buyLeverage", String.valueOf(leverage));
        body.put("sellLeverage", String.valueOf(leverage));
        return ExchangeCall.privatePost("/v5/position/set-leverage", body);
    }

    @Override
    public ExchangeCall maxOrderSizeCall(String instrumentId, MarginMode marginMode) {
        throw new UnsupportedOperationException("Bybit has no max-order-size query");
    }

    @Override
    public ExchangeCall maxAvailableSizeCall(String instrumentId, MarginMode marginMode) {
        throw new UnsupportedOperationException("Bybit has no max-available-size query");
    }

    @Override
    public SizeLimits parseSizeLimits(JsonNode maxSizeRoot, JsonNode maxAvailableRoot) {
        throw new UnsupportedOperationException("Bybit has no size limit queries");
    }

    // ---- account ----

    @Override
    public ExchangeCall balanceCall(String asset) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("accountType", "UNIFIED");
        query.put("coin", asset);
        return ExchangeCall.privateGet("/v5/account/wallet-balance", query);
    }

    @Override
    public AccountBalance parseBalance(String asset, JsonNode root) throws ExchangeException {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "Get wallet balance returned empty list");
        }
        JsonNode account = list.get(0);
        BigDecimal totalEquity = Decimal.parse(account.path("totalEquity").asText(""), BigDecimal.ZERO);
        BigDecimal available = Decimal.parse(account.path("totalAvailableBalance").asText(""), BigDecimal.ZERO);
        BigDecimal unrealized = Decimal.parse(account.path("totalPerpUPL").asText(""), BigDecimal.ZERO);

        JsonNode coins = account.path("coin");
        if (coins.isArray()) {
            for (JsonNode coin : coins) {
                if (!asset.equalsIgnoreCase(coin.path("coin").asText(""))) {
                    continue;
                }
                if (available.compareTo(BigDecimal.ZERO) <= 0) {
                    available = Decimal.firstPositive(
                            Decimal.parse(coin.path("availableToWithdraw").asText(""), BigDecimal.ZERO),
                            Decimal.parse(coin.path("walletBalance").asText(""), BigDecimal.ZERO)
                    );
                }
                BigDecimal coinUpl = Decimal.parse(coin.path("unrealisedPnl").asText(""), null);
                if (coinUpl != null) {
                    unrealized = coinUpl;
                }
                break;
            }
        }
        return new AccountBalance(asset.toUpperCase(Locale.ROOT),
                Decimal.scalePrice(totalEquity),
                Decimal.scalePrice(available),
                Decimal.scalePrice(unrealized));
    }

    @Override
    public ExchangeCall positionsCall() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("category", CATEGORY);
        query.put("settleCoin", SETTLE_COIN);
        return ExchangeCall.privateGet("/v5/position/list", query);
    }

    @Override
    public List<ExchangePosition> parsePositions(JsonNode root) {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray()) {
            return List.of();
        }
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode node : list) {
            BigDecimal size = Decimal.parse(node.path("size").asText("0"), BigDecimal.ZERO);
            String side = node.path("side").asText("");
            if (size.compareTo(BigDecimal.ZERO) == 0 || (!"Buy".equalsIgnoreCase(side) && !"Sell".equalsIgnoreCase(side))) {
                continue;
            }
            positions.add(new ExchangePosition(
                    node.path("symbol").asText(),
                    "Buy".equalsIgnoreCase(side) ? PositionSide.LONG : PositionSide.SHORT,
                    size.abs(),
                    Decimal.parsePositive(node.path("leverage").asText(), BigDecimal.ONE),
                    Decimal.parse(node.path("avgPrice").asText("0"), BigDecimal.ZERO),
                    Decimal.parse(node.path("unrealisedPnl").asText("0"), BigDecimal.ZERO),
                    node.path("tradeMode").asInt(0) == 1 ? MarginMode.ISOLATED : MarginMode.CROSS
            ));
        }
        return positions;
    }

    @Override
    public ExchangeCall pendingOrdersCall(String instrumentId) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("category", CATEGORY);
        if (instrumentId != null) {
            query.put("symbol", instrumentId);
        } else {
            query.put("settleCoin", SETTLE_COIN);
        }
        return ExchangeCall.privateGet("/v5/order/realtime", query);
    }

    @Override
    public List<ExchangeOrder> parsePendingOrders(JsonNode root) {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray()) {
            return List.of();
        }
        List<ExchangeOrder> orders = new ArrayList<>();
        for (JsonNode node : list) {
            orders.add(toExchangeOrder(node));
        }
        return orders;
    }

    @Override
    public ExchangeCall accountConfigCall() {
        return ExchangeCall.privateGet("/v5/account/info", null);
    }

    /**
     * unifiedMarginStatus: 1 classic account, 3..6 unified trading account. Both trade linear perpetuals.
     */
    @Override
    public AccountConfig parseAccountConfig(JsonNode root) throws ExchangeException {
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "Get account info returned no result");
        }
        return new AccountConfig(
                result.path("unifiedMarginStatus").asText(""),
                hedgeMode ? "BothSide" : "MergedSingle",
                null,
                true
        );
    }

    @Override
    public ExchangeCall feeScheduleCall() {
        return ExchangeCall.privateGet("/v5/account/fee-rate", Map.of("category", CATEGORY));
    }

    @Override
    public FeeSchedule parseFeeSchedule(JsonNode root) throws ExchangeException {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "Get fee rate returned empty list");
        }
        JsonNode node = list.get(0);
        BigDecimal maker = Decimal.parse(node.path("makerFeeRate").asText(""), null);
        BigDecimal taker = Decimal.parse(node.path("takerFeeRate").asText(""), null);
        if (maker == null || taker == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "Fee rate missing maker/taker: " + node);
        }
        return new FeeSchedule(maker.abs(), taker.abs());
    }

    // ---- helpers ----

    private ExchangeOrder toExchangeOrder(JsonNode node) {
        String linkId = node.path("orderLinkId").asText("");
        return new ExchangeOrder(
                node.path("orderId").asText(""),
                linkId.isBlank() ? null : linkId,
                node.path("symbol").asText(),
                "Buy".equalsIgnoreCase(node.path("side").asText()) ? Side.BUY : Side.SELL,
                node.path("orderType").asText("").toLowerCase(Locale.ROOT),
                Decimal.parsePositive(node.path("price").asText(""), null),
                Decimal.parse(node.path("qty").asText("0"), BigDecimal.ZERO),
                Decimal.parse(node.path("cumExecQty").asText("0"), BigDecimal.ZERO),
                Decimal.parsePositive(node.path("avgPrice").asText(""), null),
                node.path("orderStatus").asText(""),
                node.path("reduceOnly").asBoolean(false)
        );
    }

    private int positionIdx(PositionSide positionSide) {
        if (!hedgeMode || positionSide == null) {
            return 0;
        }
        return positionSide == PositionSide.LONG ? 1 : 2;
    }

    private static String toWireSide(Side side) {
        return side == Side.BUY ? "Buy" : "Sell";
    }

    private static String toTriggerBy(AlgoOrderRequest.TriggerPriceType type) {
        return switch (type) {
            case LAST -> "LastPrice";
            case MARK -> "MarkPrice";
            case INDEX -> "IndexPrice";
        };
    }

    private static Map<Symbol, InstrumentSpec> buildDefaultSpecs() {
        Map<Symbol, InstrumentSpec> specs = new LinkedHashMap<>();
        addDefault(specs, "BTC", "0.001", "0.001", "0.1");
        addDefault(specs, "ETH", "0.01", "0.01", "0.01");
        addDefault(specs, "SOL", "0.1", "0.1", "0.01");
        addDefault(specs, "BNB", "0.01", "0.01", "0.01");
        addDefault(specs, "XRP", "1", "1", "0.0001");
        addDefault(specs, "DOGE", "1", "1", "0.00001");
        addDefault(specs, "ADA", "1", "1", "0.0001");
        addDefault(specs, "AVAX", "0.1", "0.1", "0.001");
        addDefault(specs, "LINK", "0.1", "0.1", "0.001");
        addDefault(specs, "DOT", "0.1", "0.1", "0.0001");
        return Collections.unmodifiableMap(specs);
    }

    private static void addDefault(Map<Symbol, InstrumentSpec> specs,
                                   String base, String qtyStep, String minQty, String tickSize) {
        Symbol symbol = new Symbol(base, "USDT");
        specs.put(symbol, new InstrumentSpec(symbol, symbol.toPairString(),
                BigDecimal.ONE, new BigDecimal(minQty), new BigDecimal(qtyStep), new BigDecimal(tickSize)));
    }

    @Override
    public String toString() {
        return getName() + "{" + baseUrl + (hedgeMode ? ", hedge" : ", one-way") + "}";
    }
}
