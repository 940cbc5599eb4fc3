package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.trade.gateway.auth.SignatureScheme;
import com.trade.gateway.core.AccountBalance;
import com.trade.gateway.core.AccountConfig;
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
import java.util.StringJoiner;

/**
 * OKX v5, USDT-margined SWAP instruments.
 * Sizes (sz, pos, accFillSz) are contracts; one contract is ctVal coins.
 */
public class OkxAdapter implements ExchangeAdapter {

    public static final String PROD_BASE_URL = "https://www.okx.com";
    public static final int MAX_BATCH_SIZE = 20;

    private static final String INST_TYPE = "SWAP";
    private static final Map<Symbol, InstrumentSpec> DEFAULT_SPECS = buildDefaultSpecs();

    private final String baseUrl;
    private final boolean demo;
    private final boolean hedgeMode;
    private final ErrorCodeTable errorCodes = ErrorCodeTable.okx();

    public OkxAdapter(String baseUrl, boolean demo, boolean hedgeMode) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.demo = demo;
        this.hedgeMode = hedgeMode;
    }

    @Override
    public String getName() {
        return demo ? "OKX-Demo" : "OKX";
    }

    @Override
    public SignatureScheme getSignatureScheme() {
        return SignatureScheme.ISO_TIMESTAMP_BASE64;
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public boolean isDemo() {
        return demo;
    }

    public boolean isHedgeMode() {
        return hedgeMode;
    }

    @Override
    public Map<String, String> extraHeaders() {
        if (demo) {
            return Map.of("x-simulated-trading", "1");
        }
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
        return true;
    }

    @Override
    public String toInstrumentId(Symbol symbol) {
        return symbol.getBase() + "-" + symbol.getQuote() + "-SWAP";
    }

    @Override
    public Symbol fromInstrumentId(String instrumentId) {
        return Symbol.of(instrumentId);
    }

    /**
     * Trade endpoints answer code=1 (all failed) or code=2 (partial) with per-row
     * sCode/sMsg; those rows are the real result, so the envelope counts as accepted.
     */
    @Override
    public EnvelopeStatus parseStatus(JsonNode root) {
        JsonNode codeNode = root.get("code");
        if (codeNode == null || codeNode.isNull()) {
            return EnvelopeStatus.UNPARSEABLE;
        }
        String code = codeNode.asText("");
        String msg = root.path("msg").asText("");
        JsonNode data = root.path("data");
        if (("1".equals(code) || "2".equals(code)) && hasPerRowStatus(data)) {
            if (isAuthenticationRows(data)) {
                String rowCode = data.get(0).path("sCode").asText("");
                return new EnvelopeStatus(rowCode, data.get(0).path("sMsg").asText(msg));
            }
            return new EnvelopeStatus(errorCodes.getSuccessCode(), buildPerRowStatusDetail(data));
        }
        return new EnvelopeStatus(code, msg);
    }

    @Override
    public Map<Symbol, InstrumentSpec> defaultInstrumentSpecs() {
        return DEFAULT_SPECS;
    }

    // ---- instrument metadata ----

    @Override
    public ExchangeCall instrumentSpecCall(Symbol symbol) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", INST_TYPE);
        query.put("instId", toInstrumentId(symbol));
        return ExchangeCall.publicGet("/api/v5/public/instruments", query);
    }

    @Override
    public InstrumentSpec parseInstrumentSpec(Symbol symbol, JsonNode root) throws ExchangeException {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL,
                    "Instrument not found on OKX: " + toInstrumentId(symbol));
        }
        JsonNode node = data.get(0);
        BigDecimal ctVal = Decimal.parsePositive(node.path("ctVal").asText(), null);
        BigDecimal ctMult = Decimal.parsePositive(node.path("ctMult").asText(), BigDecimal.ONE);
        BigDecimal lotSz = Decimal.parsePositive(node.path("lotSz").asText(), null);
        if (ctVal == null || lotSz == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "Instrument " + toInstrumentId(symbol) + " has no ctVal/lotSz: " + node);
        }
        BigDecimal minSz = Decimal.parsePositive(node.path("minSz").asText(), lotSz);
        BigDecimal tickSz = Decimal.parsePositive(node.path("tickSz").asText(), null);
        return new InstrumentSpec(symbol, node.path("instId").asText(toInstrumentId(symbol)),
                ctVal.multiply(ctMult), minSz, lotSz, tickSz);
    }

    // ---- trading ----

    @Override
    public ExchangeCall placeOrderCall(OrderPayload order) {
        return ExchangeCall.privatePost("/api/v5/trade/order", toOrderBody(order));
    }

    @Override
    public ExchangeCall batchPlaceOrderCall(List<OrderPayload> orders) {
        if (orders.isEmpty() || orders.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("OKX batch size must be 1.." + MAX_BATCH_SIZE + ", was " + orders.size());
        }
        List<Map<String, Object>> body = new ArrayList<>();
        for (OrderPayload order : orders) {
            body.add(toOrderBody(order));
        }
        return ExchangeCall.privatePost("/api/v5/trade/batch-orders", body);
    }

    private Map<String, Object> toOrderBody(OrderPayload order) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", order.instrumentId());
        body.put("tdMode", order.marginMode().getWireValue());
        body.put("side", toWireSide(order.side()));
        if (hedgeMode && order.positionSide() != null) {
            body.put("posSide", toWirePositionSide(order.positionSide()));
        }
        body.put("ordType", order.orderType() == OrderType.LIMIT ? "limit" : "market");
        body.put("sz", Decimal.plain(order.contracts()));
        if (order.orderType() == OrderType.LIMIT) {
            body.put("px", Decimal.plain(order.price()));
        }
        if (order.clientOrderId() != null) {
            body.put("clOrdId", order.clientOrderId());
        }
        if (order.reduceOnly()) {
            body.put("reduceOnly", true);
        }
        if (order.hasAttachedProtection()) {
            Map<String, Object> attached = new LinkedHashMap<>();
            if (order.takeProfitTrigger() != null) {
                attached.put("tpTriggerPx", Decimal.plain(order.takeProfitTrigger()));
                attached.put("tpOrdPx", "-1");
            }
            if (order.stopLossTrigger() != null) {
                attached.put("slTriggerPx", Decimal.plain(order.stopLossTrigger()));
                attached.put("slOrdPx", "-1");
            }
            body.put("attachAlgoOrds", List.of(attached));
        }
        return body;
    }

    @Override
    public List<OrderAck> parsePlaceOrders(List<OrderPayload> submitted, JsonNode root) throws ExchangeException {
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "Place order returned no data array");
        }
        List<OrderAck> acks = new ArrayList<>(submitted.size());
        for (int i = 0; i < submitted.size(); i++) {
            String clOrdId = submitted.get(i).clientOrderId();
            JsonNode row = findRow(data, "clOrdId", clOrdId, i);
            if (row == null) {
                acks.add(OrderAck.rejected(clOrdId, null, "No acknowledgement for clOrdId " + clOrdId));
                continue;
            }
            acks.add(toAck(row, "ordId", clOrdId));
        }
        return acks;
    }

    @Override
    public ExchangeCall algoOrderCall(AlgoOrderPayload order) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", order.instrumentId());
        body.put("tdMode", order.marginMode().getWireValue());
        body.put("side", toWireSide(order.side()));
        if (hedgeMode && order.positionSide() != null) {
            body.put("posSide", toWirePositionSide(order.positionSide()));
        }
        body.put("ordType", order.isOneCancelsOther() ? "oco" : "conditional");
        body.put("sz", Decimal.plain(order.contracts()));
        body.put("reduceOnly", true);
        String triggerType = order.triggerPriceType().wireValue();
        if (order.takeProfitTrigger() != null) {
            body.put("tpTriggerPx", Decimal.plain(order.takeProfitTrigger()));
            body.put("tpOrdPx", order.takeProfitOrderPrice() == null ? "-1" : Decimal.plain(order.takeProfitOrderPrice()));
            body.put("tpTriggerPxType", triggerType);
        }
        if (order.stopLossTrigger() != null) {
            body.put("slTriggerPx", Decimal.plain(order.stopLossTrigger()));
            body.put("slOrdPx", order.stopLossOrderPrice() == null ? "-1" : Decimal.plain(order.stopLossOrderPrice()));
            body.put("slTriggerPxType", triggerType);
        }
        if (order.clientOrderId() != null) {
            body.put("algoClOrdId", order.clientOrderId());
        }
        return ExchangeCall.privatePost("/api/v5/trade/order-algo", body);
    }

    @Override
    public OrderAck parseAlgoOrder(AlgoOrderPayload submitted, JsonNode root) throws ExchangeException {
        JsonNode row = firstRow(root, "Place algo order");
        return toAck(row, "algoId", submitted.clientOrderId());
    }

    @Override
    public ExchangeCall cancelOrderCall(String instrumentId, OrderRef ref) {
        if (ref.kind() == OrderRef.Kind.ALGO_ID) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("algoId", ref.value());
            item.put("instId", instrumentId);
            return ExchangeCall.privatePost("/api/v5/trade/cancel-algos", List.of(item));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", instrumentId);
        body.put(ref.kind() == OrderRef.Kind.ORDER_ID ? "ordId" : "clOrdId", ref.value());
        return ExchangeCall.privatePost("/api/v5/trade/cancel-order", body);
    }

    @Override
    public OrderAck parseCancel(OrderRef ref, JsonNode root) throws ExchangeException {
        JsonNode row = firstRow(root, "Cancel order");
        String idField = ref.kind() == OrderRef.Kind.ALGO_ID ? "algoId" : "ordId";
        String clientId = ref.kind() == OrderRef.Kind.CLIENT_ORDER_ID ? ref.value() : null;
        OrderAck ack = toAck(row, idField, clientId);
        if (ack.accepted() && ack.orderId() == null) {
            return OrderAck.accepted(ref.value(), clientId);
        }
        return ack;
    }

    @Override
    public ExchangeCall orderDetailCall(String instrumentId, OrderRef ref) {
        Map<String, String> query = new LinkedHashMap<>();
        switch (ref.kind()) {
            case ALGO_ID -> {
                query.put("algoId", ref.value());
                return ExchangeCall.privateGet("/api/v5/trade/order-algo", query);
            }
            case ORDER_ID -> query.put("ordId", ref.value());
            case CLIENT_ORDER_ID -> query.put("clOrdId", ref.value());
            default -> throw new IllegalArgumentException("Unsupported order reference: " + ref);
        }
        query.put("instId", instrumentId);
        return ExchangeCall.privateGet("/api/v5/trade/order", query);
    }

    @Override
    public Optional<ExchangeOrder> parseOrderDetail(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toExchangeOrder(data.get(0)));
    }

    // ---- leverage and limits ----

    @Override
    public ExchangeCall leverageInfoCall(String instrumentId, MarginMode marginMode) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instId", instrumentId);
        query.put("mgnMode", marginMode.getWireValue());
        return ExchangeCall.privateGet("/api/v5/account/leverage-info", query);
    }

    @Override
    public Optional<Integer> parseLeverage(JsonNode root, PositionSide positionSide) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return Optional.empty();
        }
        // isolated long/short mode reports one row per side
        JsonNode row = data.get(0);
        if (hedgeMode && positionSide != null) {
            String wanted = toWirePositionSide(positionSide);
            for (JsonNode candidate : data) {
                if (wanted.equals(candidate.path("posSide").asText())) {
                    row = candidate;
                    break;
                }
            }
        }
        BigDecimal lever = Decimal.parsePositive(row.path("lever").asText(), null);
        return lever == null ? Optional.empty() : Optional.of(lever.intValue());
    }

    @Override
    public ExchangeCall setLeverageCall(String instrumentId, MarginMode marginMode, PositionSide positionSide, int leverage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", instrumentId);
        body.put("lever", String.valueOf(leverage));
        body.put("mgnMode", marginMode.getWireValue());
        if (hedgeMode && marginMode == MarginMode.ISOLATED && positionSide != null) {
            body.put("posSide", toWirePositionSide(positionSide));
        }
        return ExchangeCall.privatePost("/api/v5/account/set-leverage", body);
    }

    @Override
    public ExchangeCall maxOrderSizeCall(String instrumentId, MarginMode marginMode) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instId", instrumentId);
        query.put("tdMode", marginMode.getWireValue());
        return ExchangeCall.privateGet("/api/v5/account/max-size", query);
    }

    @Override
    public ExchangeCall maxAvailableSizeCall(String instrumentId, MarginMode marginMode) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instId", instrumentId);
        query.put("tdMode", marginMode.getWireValue());
        return ExchangeCall.privateGet("/api/v5/account/max-avail-size", query);
    }

    @Override
    public SizeLimits parseSizeLimits(JsonNode maxSizeRoot, JsonNode maxAvailableRoot) {
        JsonNode max = firstRowOrMissing(maxSizeRoot);
        JsonNode avail = firstRowOrMissing(maxAvailableRoot);
        return new SizeLimits(
                Decimal.parse(max.path("maxBuy").asText(null), null),
                Decimal.parse(max.path("maxSell").asText(null), null),
                Decimal.parse(avail.path("availBuy").asText(null), null),
                Decimal.parse(avail.path("availSell").asText(null), null)
        );
    }

    // ---- account ----

    @Override
    public ExchangeCall balanceCall(String asset) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("ccy", asset);
        return ExchangeCall.privateGet("/api/v5/account/balance", query);
    }

    @Override
    public AccountBalance parseBalance(String asset, JsonNode root) throws ExchangeException {
        JsonNode account = firstRow(root, "Get balance");
        BigDecimal totalEq = Decimal.parse(account.path("totalEq").asText("0"), BigDecimal.ZERO);
        BigDecimal available = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;

        JsonNode details = account.path("details");
        if (details.isArray()) {
            for (JsonNode detail : details) {
                if (!asset.equalsIgnoreCase(detail.path("ccy").asText(""))) {
                    continue;
                }
                available = Decimal.firstPositive(
                        Decimal.parse(detail.path("availEq").asText("0"), BigDecimal.ZERO),
                        Decimal.parse(detail.path("availBal").asText("0"), BigDecimal.ZERO),
                        Decimal.parse(detail.path("cashBal").asText("0"), BigDecimal.ZERO)
                );
                unrealized = Decimal.parse(detail.path("upl").asText("0"), BigDecimal.ZERO);
                break;
            }
        }
        return new AccountBalance(asset.toUpperCase(Locale.ROOT),
                Decimal.scalePrice(totalEq),
                Decimal.scalePrice(available),
                Decimal.scalePrice(unrealized));
    }

    @Override
    public ExchangeCall positionsCall() {
        return ExchangeCall.privateGet("/api/v5/account/positions", Map.of("instType", INST_TYPE));
    }

    @Override
    public List<ExchangePosition> parsePositions(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            return List.of();
        }
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode node : data) {
            BigDecimal pos = Decimal.parse(node.path("pos").asText("0"), BigDecimal.ZERO);
            if (pos.compareTo(BigDecimal.ZERO) == 0) {
                continue;
            }
            positions.add(new ExchangePosition(
                    node.path("instId").asText(),
                    parsePositionSide(node.path("posSide").asText(""), pos),
                    pos.abs(),
                    Decimal.parsePositive(node.path("lever").asText(), BigDecimal.ONE),
                    Decimal.parse(node.path("avgPx").asText("0"), BigDecimal.ZERO),
                    Decimal.parse(node.path("upl").asText("0"), BigDecimal.ZERO),
                    MarginMode.fromString(node.path("mgnMode").asText(), MarginMode.CROSS)
            ));
        }
        return positions;
    }

    @Override
    public ExchangeCall pendingOrdersCall(String instrumentId) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", INST_TYPE);
        if (instrumentId != null) {
            query.put("instId", instrumentId);
        }
        return ExchangeCall.privateGet("/api/v5/trade/orders-pending", query);
    }

    @Override
    public List<ExchangeOrder> parsePendingOrders(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            return List.of();
        }
        List<ExchangeOrder> orders = new ArrayList<>();
        for (JsonNode node : data) {
            orders.add(toExchangeOrder(node));
        }
        return orders;
    }

    @Override
    public ExchangeCall accountConfigCall() {
        return ExchangeCall.privateGet("/api/v5/account/config", null);
    }

    /**
     * acctLv: 1 simple (spot only), 2 single-currency margin, 3 multi-currency margin, 4 portfolio margin.
     */
    @Override
    public AccountConfig parseAccountConfig(JsonNode root) throws ExchangeException {
        JsonNode node = firstRow(root, "Get account config");
        String acctLv = node.path("acctLv").asText("");
        int level;
        try {
            level = Integer.parseInt(acctLv);
        } catch (NumberFormatException e) {
            level = 0;
        }
        return new AccountConfig(acctLv, node.path("posMode").asText(""), node.path("uid").asText(null), level >= 2);
    }

    @Override
    public ExchangeCall feeScheduleCall() {
        return ExchangeCall.privateGet("/api/v5/account/trade-fee", Map.of("instType", INST_TYPE));
    }

    /**
     * OKX reports fees as negative numbers (a rebate is positive); USDT-margined
     * contracts use makerU/takerU.
     */
    @Override
    public FeeSchedule parseFeeSchedule(JsonNode root) throws ExchangeException {
        JsonNode node = firstRow(root, "Get trade fee");
        BigDecimal maker = Decimal.parse(node.path("makerU").asText(""), null);
        BigDecimal taker = Decimal.parse(node.path("takerU").asText(""), null);
        if (maker == null || taker == null) {
            maker = Decimal.parse(node.path("maker").asText(""), null);
            taker = Decimal.parse(node.path("taker").asText(""), null);
        }
        if (maker == null || taker == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "Trade fee missing maker/taker: " + node);
        }
        return new FeeSchedule(maker.abs(), taker.abs());
    }

    // ---- helpers ----

    private ExchangeOrder toExchangeOrder(JsonNode node) {
        String orderId = node.path("ordId").asText("");
        if (orderId.isBlank()) {
            orderId = node.path("algoId").asText("");
        }
        String clOrdId = node.path("clOrdId").asText("");
        if (clOrdId.isBlank()) {
            clOrdId = node.path("algoClOrdId").asText("");
        }
        return new ExchangeOrder(
                orderId,
                clOrdId.isBlank() ? null : clOrdId,
                node.path("instId").asText(),
                "buy".equalsIgnoreCase(node.path("side").asText()) ? Side.BUY : Side.SELL,
                node.path("ordType").asText(""),
                Decimal.parse(node.path("px").asText(""), null),
                Decimal.parse(node.path("sz").asText("0"), BigDecimal.ZERO),
                Decimal.parse(node.path("accFillSz").asText("0"), BigDecimal.ZERO),
                Decimal.parse(node.path("avgPx").asText(""), null),
                node.path("state").asText(""),
                isTrue(node.path("reduceOnly"))
        );
    }

    private OrderAck toAck(JsonNode row, String idField, String fallbackClientId) {
        String sCode = row.path("sCode").asText(errorCodes.getSuccessCode());
        String id = row.path(idField).asText("");
        String clientId = firstNonBlank(row.path("clOrdId").asText(""), row.path("algoClOrdId").asText(""), fallbackClientId);
        if (!errorCodes.isSuccess(sCode)) {
            return OrderAck.rejected(clientId, sCode, row.path("sMsg").asText("unknown"));
        }
        return OrderAck.accepted(id.isBlank() ? null : id, clientId);
    }

    private static JsonNode findRow(JsonNode data, String field, String value, int index) {
        if (value != null) {
            for (JsonNode row : data) {
                if (value.equals(row.path(field).asText(null))) {
                    return row;
                }
            }
        }
        return index < data.size() ? data.get(index) : null;
    }

    private static JsonNode firstRow(JsonNode root, String what) throws ExchangeException {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, what + " returned empty data");
        }
        return data.get(0);
    }

    private static JsonNode firstRowOrMissing(JsonNode root) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return MissingNode.getInstance();
        }
        return data.get(0);
    }

    private static boolean hasPerRowStatus(JsonNode data) {
        if (!data.isArray() || data.isEmpty()) {
            return false;
        }
        JsonNode first = data.get(0);
        return first.has("sCode") || first.has("sMsg");
    }

    private boolean isAuthenticationRows(JsonNode data) {
        for (JsonNode row : data) {
            if (errorCodes.isAuthentication(row.path("sCode").asText(null))) {
                return true;
            }
        }
        return false;
    }

    private static String buildPerRowStatusDetail(JsonNode data) {
        StringJoiner joiner = new StringJoiner("; ");
        int count = Math.min(data.size(), 3);
        for (int i = 0; i < count; i++) {
            JsonNode row = data.get(i);
            String sCode = row.path("sCode").asText("");
            String sMsg = row.path("sMsg").asText("");
            if (!sCode.isBlank() || !sMsg.isBlank()) {
                joiner.add("sCode=" + sCode + ", sMsg=" + sMsg);
            }
        }
        return joiner.toString();
    }

    private static PositionSide parsePositionSide(String posSide, BigDecimal posContracts) {
        if ("long".equalsIgnoreCase(posSide)) {
            return PositionSide.LONG;
        }
        if ("short".equalsIgnoreCase(posSide)) {
            return PositionSide.SHORT;
        }
        // net mode: sign of pos gives the direction
        return posContracts.compareTo(BigDecimal.ZERO) >= 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    private static boolean isTrue(JsonNode node) {
        return node.isBoolean() ? node.asBoolean(false) : "true".equalsIgnoreCase(node.asText(""));
    }

    private static String toWireSide(Side side) {
        return side == Side.BUY ? "buy" : "sell";
    }

    private static String toWirePositionSide(PositionSide side) {
        return side == PositionSide.LONG ? "long" : "short";
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private static String normalizeBaseUrl(String baseUrl) {
        String value = baseUrl == null || baseUrl.isBlank() ? PROD_BASE_URL : baseUrl.trim();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static Map<Symbol, InstrumentSpec> buildDefaultSpecs() {
        Map<Symbol, InstrumentSpec> specs = new LinkedHashMap<>();
        addDefault(specs, "BTC", "0.01", "0.01", "0.01", "0.1");
        addDefault(specs, "ETH", "0.1", "0.01", "0.01", "0.01");
        addDefault(specs, "SOL", "1", "0.01", "0.01", "0.01");
        addDefault(specs, "BNB", "0.01", "1", "1", "0.01");
        addDefault(specs, "XRP", "100", "0.01", "0.01", "0.0001");
        addDefault(specs, "DOGE", "1000", "0.01", "0.01", "0.00001");
        addDefault(specs, "ADA", "100", "0.01", "0.01", "0.0001");
        addDefault(specs, "AVAX", "1", "1", "1", "0.001");
        addDefault(specs, "LINK", "1", "1", "1", "0.001");
        addDefault(specs, "DOT", "1", "1", "1", "0.001");
        return Collections.unmodifiableMap(specs);
    }

    private static void addDefault(Map<Symbol, InstrumentSpec> specs,
                                   String base, String ctVal, String lotSz, String minSz, String tickSz) {
        Symbol symbol = new Symbol(base, "USDT");
        specs.put(symbol, new InstrumentSpec(symbol, base + "-USDT-SWAP",
                new BigDecimal(ctVal), new BigDecimal(minSz), new BigDecimal(lotSz), new BigDecimal(tickSz)));
    }

    @Override
    public String toString() {
        return getName() + "{" + baseUrl + (hedgeMode ? ", long_short_mode" : ", net_mode") + "}";
    }
}
