package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.auth.SignatureScheme;
import com.trade.gateway.core.AlgoOrderRequest;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderRef;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.Symbol;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BybitAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Symbol ETH = new Symbol("ETH", "USDT");

    private final BybitAdapter oneWay = new BybitAdapter(null, false, false);
    private final BybitAdapter hedge = new BybitAdapter(null, false, true);

    private static OrderPayload limitSell(String linkId) {
        return new OrderPayload("ETHUSDT", Side.SELL, PositionSide.SHORT, OrderType.LIMIT,
                new BigDecimal("1.50"), new BigDecimal("2600.5"), MarginMode.CROSS, false, linkId,
                new BigDecimal("2400"), null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> bodyOf(ExchangeCall call) {
        return (Map<String, Object>) call.getBody();
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void testBaseUrlAndSigning() {
        assertEquals(BybitAdapter.PROD_BASE_URL, oneWay.getBaseUrl());
        assertEquals(BybitAdapter.DEMO_BASE_URL, new BybitAdapter("", true, false).getBaseUrl());
        assertEquals(SignatureScheme.SORTED_PARAMS_HEX, oneWay.getSignatureScheme());
        assertEquals("ETHUSDT", oneWay.toInstrumentId(ETH));
        assertEquals(ETH, oneWay.fromInstrumentId("ETHUSDT"));
    }

    @Test
    void testOneWayOrderUsesPositionIndexZero() {
        ExchangeCall call = oneWay.placeOrderCall(limitSell("l1"));
        Map<String, Object> body = bodyOf(call);

        assertEquals("/v5/order/create", call.getPath());
        assertEquals("linear", body.get("category"));
        assertEquals("ETHUSDT", body.get("symbol"));
        assertEquals("Sell", body.get("side"));
        assertEquals("Limit", body.get("orderType"));
        assertEquals("1.5", body.get("qty"));
        assertEquals("2600.5", body.get("price"));
        assertEquals("GTC", body.get("timeInForce"));
        assertEquals(0, body.get("positionIdx"));
        assertEquals("l1", body.get("orderLinkId"));
        assertEquals("2400", body.get("takeProfit"));
        assertFalse(body.containsKey("stopLoss"));
        assertFalse(body.containsKey("reduceOnly"));
    }

    @Test
    void testHedgeModeShortUsesPositionIndexTwo() {
        assertEquals(2, bodyOf(hedge.placeOrderCall(limitSell("l1"))).get("positionIdx"));
    }

    @Test
    void testBatchWrapsOrdersInRequestList() {
        ExchangeCall call = oneWay.batchPlaceOrderCall(List.of(limitSell("a"), limitSell("b")));
        Map<String, Object> body = bodyOf(call);

        assertEquals("/v5/order/create-batch", call.getPath());
        assertEquals("linear", body.get("category"));
        List<?> request = (List<?>) body.get("request");
        assertEquals(2, request.size());
        assertFalse(((Map<?, ?>) request.get(0)).containsKey("category"));
    }

    @Test
    void testBatchAcksUseExtInfoCodes() throws Exception {
        JsonNode root = json("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"list\":["
                + "{\"orderId\":\"x-1\",\"orderLinkId\":\"a\"},{\"orderId\":\"\",\"orderLinkId\":\"b\"}]},"
                + "\"retExtInfo\":{\"list\":[{\"code\":0,\"msg\":\"OK\"},{\"code\":110007,\"msg\":\"ab not enough for new order\"}]}}");

        List<OrderAck> acks = oneWay.parsePlaceOrders(List.of(limitSell("a"), limitSell("b")), root);

        assertTrue(acks.get(0).accepted());
        assertEquals("x-1", acks.get(0).orderId());
        assertFalse(acks.get(1).accepted());
        assertEquals("110007", acks.get(1).code());
    }

    @Test
    void testSingleAckRequiresOrderId() throws Exception {
        OrderAck ack = oneWay.parsePlaceOrders(List.of(limitSell("a")),
                json("{\"retCode\":0,\"result\":{\"orderId\":\"x-9\",\"orderLinkId\":\"a\"}}")).get(0);
        assertEquals("x-9", ack.orderId());

        assertThrows(ExchangeException.class, () -> oneWay.parsePlaceOrders(List.of(limitSell("a")),
                json("{\"retCode\":0,\"result\":{}}")));
    }

    @Test
    void testEnvelopeCodeIsNumeric() throws Exception {
        EnvelopeStatus status = oneWay.parseStatus(json("{\"retCode\":10004,\"retMsg\":\"error sign!\"}"));
        assertEquals("10004", status.code());
        assertEquals("error sign!", status.message());
        assertSame(EnvelopeStatus.UNPARSEABLE, oneWay.parseStatus(json("{\"code\":\"0\"}")));
    }

    @Test
    void testTradingStopCarriesPartialSizes() {
        AlgoOrderPayload order = new AlgoOrderPayload("ETHUSDT", Side.BUY, PositionSide.SHORT,
                new BigDecimal("0.5"), new BigDecimal("2300"), new BigDecimal("2301"),
                new BigDecimal("2700"), null, MarginMode.CROSS, AlgoOrderRequest.TriggerPriceType.MARK, "p1");

        ExchangeCall call = hedge.algoOrderCall(order);
        Map<String, Object> body = bodyOf(call);

        assertEquals("/v5/position/trading-stop", call.getPath());
        assertEquals("Partial", body.get("tpslMode"));
        assertEquals(2, body.get("positionIdx"));
        assertEquals("2300", body.get("takeProfit"));
        assertEquals("Limit", body.get("tpOrderType"));
        assertEquals("2301", body.get("tpLimitPrice"));
        assertEquals("0.5", body.get("tpSize"));
        assertEquals("MarkPrice", body.get("tpTriggerBy"));
        assertEquals("2700", body.get("stopLoss"));
        assertEquals("Market", body.get("slOrderType"));
        assertEquals("0.5", body.get("slSize"));

        OrderAck ack = hedge.parseAlgoOrder(order, null);
        assertTrue(ack.accepted());
        assertNull(ack.orderId());
    }

    @Test
    void testNoSizeLimitQueries() {
        assertFalse(oneWay.supportsSizeLimits());
        assertThrows(UnsupportedOperationException.class,
                () -> oneWay.maxOrderSizeCall("ETHUSDT", MarginMode.CROSS));
    }

    @Test
    void testParseInstrumentSpec() throws Exception {
        InstrumentSpec spec = oneWay.parseInstrumentSpec(ETH, json("{\"retCode\":0,\"result\":{\"list\":[{"
                + "\"symbol\":\"ETHUSDT\",\"lotSizeFilter\":{\"qtyStep\":\"0.01\",\"minOrderQty\":\"0.01\"},"
                + "\"priceFilter\":{\"tickSize\":\"0.05\"}}]}}"));

        assertEquals(0, BigDecimal.ONE.compareTo(spec.getContractValue()));
        assertEquals(0, new BigDecimal("0.01").compareTo(spec.getSizeIncrement()));
        assertEquals(0, new BigDecimal("0.05").compareTo(spec.getTickSize()));

        ExchangeException e = assertThrows(ExchangeException.class,
                () -> oneWay.parseInstrumentSpec(ETH, json("{\"retCode\":0,\"result\":{\"list\":[]}}")));
        assertEquals(ExchangeException.ErrorCode.INVALID_SYMBOL, e.getErrorCode());
    }

    @Test
    void testCancelByLinkIdAndDetailQuery() {
        Map<String, Object> cancel = bodyOf(oneWay.cancelOrderCall("ETHUSDT", OrderRef.clientOrderId("l1")));
        assertEquals("l1", cancel.get("orderLinkId"));
        assertFalse(cancel.containsKey("orderId"));

        ExchangeCall detail = oneWay.orderDetailCall("ETHUSDT", OrderRef.orderId("x-1"));
        assertEquals("GET", detail.getMethod());
        assertEquals("x-1", detail.getQuery().get("orderId"));
        assertEquals("linear", detail.getQuery().get("category"));
    }

    @Test
    void testLeverageFromPositionList() throws Exception {
        assertEquals(7, oneWay.parseLeverage(json("{\"retCode\":0,\"result\":{\"list\":[{\"leverage\":\"7\"}]}}"),
                PositionSide.LONG).orElseThrow().intValue());
        String hedgeRows = "{\"retCode\":0,\"result\":{\"list\":["
                + "{\"positionIdx\":1,\"leverage\":\"5\"},{\"positionIdx\":2,\"leverage\":\"8\"}]}}";
        assertEquals(8, hedge.parseLeverage(json(hedgeRows), PositionSide.SHORT).orElseThrow().intValue());
        assertEquals(5, hedge.parseLeverage(json(hedgeRows), PositionSide.LONG).orElseThrow().intValue());
        Map<String, Object> body = bodyOf(oneWay.setLeverageCall("ETHUSDT", MarginMode.CROSS, PositionSide.LONG, 7));
        assertEquals("7", body.get("buyLeverage"));
        assertEquals("7", body.get("sellLeverage"));
    }
}
