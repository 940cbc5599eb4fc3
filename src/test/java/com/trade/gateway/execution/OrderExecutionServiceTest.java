package com.trade.gateway.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.account.FeeScheduleCache;
import com.trade.gateway.auth.Credentials;
import com.trade.gateway.core.AlgoOrderRequest;
import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderRef;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.core.TradeIntent;
import com.trade.gateway.exchange.BybitAdapter;
import com.trade.gateway.exchange.ExchangeAdapter;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeRestClient;
import com.trade.gateway.exchange.OkxAdapter;
import com.trade.gateway.instrument.ExchangeInstrumentSpecSource;
import com.trade.gateway.instrument.InstrumentSpecCache;
import com.trade.gateway.instrument.InstrumentSpecSource;
import com.trade.gateway.transport.TransportAttempt;
import com.trade.gateway.transport.TransportChainConfig;
import com.trade.gateway.transport.TransportFallbackChain;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class OrderExecutionServiceTest {

    private static final Symbol BTC = new Symbol("BTC", "USDT");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SIZE_OK = "{\"code\":\"0\",\"data\":[{\"instId\":\"BTC-USDT-SWAP\",\"maxBuy\":\"500\",\"maxSell\":\"500\"}]}";
    private static final String AVAIL_OK = "{\"code\":\"0\",\"data\":[{\"instId\":\"BTC-USDT-SWAP\",\"availBuy\":\"300\",\"availSell\":\"300\"}]}";
    private static final String ORDER_ACCEPTED = "{\"code\":\"0\",\"msg\":\"\",\"data\":[{\"ordId\":\"1001\",\"clOrdId\":\"t1\",\"sCode\":\"0\",\"sMsg\":\"\"}]}";
    private static final String ORDER_FILLED = "{\"code\":\"0\",\"data\":[{\"ordId\":\"1001\",\"clOrdId\":\"t1\",\"instId\":\"BTC-USDT-SWAP\","
            + "\"side\":\"buy\",\"ordType\":\"market\",\"sz\":\"10\",\"accFillSz\":\"10\",\"avgPx\":\"43010\",\"state\":\"filled\"}]}";

    private MockWebServer server;
    private FakeExchange exchange;
    private OrderExecutionService service;
    private final List<OrderResult> accepted = new CopyOnWriteArrayList<>();
    private final List<OrderResult> failed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        exchange = new FakeExchange();
        server = new MockWebServer();
        server.setDispatcher(exchange);
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (service != null) {
            service.close();
        }
        server.shutdown();
    }

    private void useOkx() {
        useAdapter(new OkxAdapter(server.url("/").toString(), false, false));
    }

    private void useAdapter(ExchangeAdapter adapter) {
        useAdapter(adapter, false);
    }

    private void useAdapter(ExchangeAdapter adapter, boolean liveSpecs) {
        TransportFallbackChain chain = new TransportFallbackChain(new OkHttpClient(),
                new TransportChainConfig(List.of(TransportAttempt.direct("direct")), 0, 0, 0),
                millis -> {});
        ExchangeRestClient client = new ExchangeRestClient(adapter,
                new Credentials("test-key", "test-secret", "test-pass"), chain);
        // 默认使用内置规格表，这样看到的请求只有交易调用
        InstrumentSpecSource specSource = liveSpecs ? new ExchangeInstrumentSpecSource(client) : symbol -> {
            InstrumentSpec spec = adapter.defaultInstrumentSpecs().get(symbol);
            if (spec == null) {
                throw new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL, "unknown " + symbol);
            }
            return spec;
        };
        InstrumentSpecCache specs = new InstrumentSpecCache(specSource, Map.of());
        FeeScheduleCache fees = new FeeScheduleCache(
                () -> new FeeSchedule(new BigDecimal("0.0002"), new BigDecimal("0.0005")), FeeSchedule.DEFAULT);
        service = new OrderExecutionService(client, specs, fees, new PriceSanityChecker(),
                Executors.newSingleThreadExecutor());
        service.addListener(new OrderExecutionService.OrderListener() {
            @Override
            public void onOrderAccepted(OrderResult result) {
                accepted.add(result);
            }

            @Override
            public void onOrderFailed(OrderResult result) {
                failed.add(result);
            }
        });
    }

    private static TradeIntent.Builder btcBuy(String clOrdId) {
        return TradeIntent.builder()
                .symbol(BTC)
                .side(Side.BUY)
                .quantityCoins(new BigDecimal("0.1"))
                .referencePrice(new BigDecimal("43000"))
                .marginMode(MarginMode.CROSS)
                .clientOrderId(clOrdId);
    }

    private void routeSizeChecks() {
        exchange.on("GET /api/v5/account/max-size", SIZE_OK);
        exchange.on("GET /api/v5/account/max-avail-size", AVAIL_OK);
    }

    @Test
    void testMarketOrderSetsLeverageAndEstimatesFeeFromFill() throws Exception {
        useOkx();
        routeSizeChecks();
        exchange.on("GET /api/v5/account/leverage-info", "{\"code\":\"0\",\"data\":[{\"lever\":\"5\",\"mgnMode\":\"cross\"}]}");
        exchange.on("POST /api/v5/account/set-leverage", "{\"code\":\"0\",\"data\":[{\"lever\":\"10\"}]}");
        exchange.on("POST /api/v5/trade/order", ORDER_ACCEPTED);
        exchange.on("GET /api/v5/trade/order", ORDER_FILLED);

        OrderResult result = service.execute(btcBuy("t1").leverage(10).build());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("1001", result.getOrderId());
        assertEquals(0, new BigDecimal("0.1").compareTo(result.getRequestedQuantity()));
        assertEquals(0, new BigDecimal("0.1").compareTo(result.getFilledQuantity()));
        assertEquals(0, new BigDecimal("43010").compareTo(result.getAveragePrice()));
        // 0.1 BTC x 43010 x 0.05% taker
        assertEquals(0, new BigDecimal("2.1505").compareTo(result.getEstimatedFee()));

        assertEquals(List.of(
                "GET /api/v5/account/max-size",
                "GET /api/v5/account/max-avail-size",
                "GET /api/v5/account/leverage-info",
                "POST /api/v5/account/set-leverage",
                "POST /api/v5/trade/order",
                "GET /api/v5/trade/order"), exchange.routes());

        JsonNode leverage = exchange.body("POST /api/v5/account/set-leverage");
        assertEquals("10", leverage.path("lever").asText());
        assertEquals("cross", leverage.path("mgnMode").asText());

        JsonNode order = exchange.body("POST /api/v5/trade/order");
        assertEquals("BTC-USDT-SWAP", order.path("instId").asText());
        assertEquals("cross", order.path("tdMode").asText());
        assertEquals("buy", order.path("side").asText());
        assertEquals("market", order.path("ordType").asText());
        assertEquals("10", order.path("sz").asText());
        assertEquals("t1", order.path("clOrdId").asText());
        assertFalse(order.has("posSide"));
        assertEquals("test-key", exchange.first("POST /api/v5/trade/order").getHeader("OK-ACCESS-KEY"));

        assertEquals(1, accepted.size());
        assertTrue(failed.isEmpty());
    }

    @Test
    void testLeverageAlreadyMatchingIsNotSetAgain() {
        useOkx();
        routeSizeChecks();
        exchange.on("GET /api/v5/account/leverage-info", "{\"code\":\"0\",\"data\":[{\"lever\":\"10\",\"mgnMode\":\"cross\"}]}");
        exchange.on("POST /api/v5/trade/order", ORDER_ACCEPTED);
        exchange.on("GET /api/v5/trade/order", ORDER_FILLED);

        OrderResult result = service.execute(btcBuy("t1").leverage(10).build());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(0, exchange.count("POST /api/v5/account/set-leverage"));
    }

    @Test
    void testIsolatedHedgeModeSyncsLeverageForThePositionSide() throws Exception {
        useAdapter(new OkxAdapter(server.url("/").toString(), false, true));
        routeSizeChecks();
        exchange.on("GET /api/v5/account/leverage-info", "{\"code\":\"0\",\"data\":["
                + "{\"lever\":\"10\",\"mgnMode\":\"isolated\",\"posSide\":\"long\"},"
                + "{\"lever\":\"3\",\"mgnMode\":\"isolated\",\"posSide\":\"short\"}]}");
        exchange.on("POST /api/v5/account/set-leverage", "{\"code\":\"0\",\"data\":[{\"lever\":\"10\"}]}");
        exchange.on("POST /api/v5/trade/order", ORDER_ACCEPTED);
        exchange.on("GET /api/v5/trade/order", ORDER_FILLED);

        OrderResult result = service.execute(btcBuy("t1")
                .side(Side.SELL)
                .marginMode(MarginMode.ISOLATED)
                .leverage(10)
                .build());

        assertTrue(result.isSuccess(), result.toString());
        JsonNode leverage = exchange.body("POST /api/v5/account/set-leverage");
        assertEquals("short", leverage.path("posSide").asText());
        assertEquals("isolated", leverage.path("mgnMode").asText());
        assertEquals("10", leverage.path("lever").asText());
        assertEquals("short", exchange.body("POST /api/v5/trade/order").path("posSide").asText());
    }

    @Test
    void testLeverageNotModifiedCodeCountsAsSuccess() {
        useAdapter(new BybitAdapter(server.url("/").toString(), false, false));
        exchange.on("GET /v5/position/list", "{\"retCode\":0,\"result\":{\"list\":[{\"symbol\":\"BTCUSDT\",\"leverage\":\"5\"}]}}");
        exchange.on("POST /v5/position/set-leverage", "{\"retCode\":110043,\"retMsg\":\"leverage not modified\",\"result\":{}}");
        exchange.on("POST /v5/order/create", "{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"b-1\",\"orderLinkId\":\"t1\"}}");
        exchange.on("GET /v5/order/realtime", "{\"retCode\":0,\"result\":{\"list\":[{\"orderId\":\"b-1\",\"orderLinkId\":\"t1\","
                + "\"symbol\":\"BTCUSDT\",\"side\":\"Buy\",\"orderType\":\"Market\",\"qty\":\"0.1\",\"cumExecQty\":\"0.1\","
                + "\"avgPrice\":\"43000\",\"orderStatus\":\"Filled\"}]}}");

        OrderResult result = service.execute(btcBuy("t1").leverage(10).build());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("b-1", result.getOrderId());
        assertEquals(1, exchange.count("POST /v5/position/set-leverage"));
        assertEquals(1, exchange.count("POST /v5/order/create"));

        JsonNode order = exchange.body("POST /v5/order/create");
        assertEquals("linear", order.path("category").asText());
        assertEquals("0.1", order.path("qty").asText());
        assertEquals(0, order.path("positionIdx").asInt(-1));
    }

    @Test
    void testAuthenticationFailureStopsAfterOneRequest() {
        useOkx();
        exchange.on("GET /api/v5/account/max-size",
                r -> json(401, "{\"code\":\"50113\",\"msg\":\"Invalid Sign\",\"data\":[]}"));

        OrderResult result = service.execute(btcBuy("t1").leverage(10).build());

        assertFalse(result.isSuccess());
        assertEquals(ExchangeException.ErrorCode.AUTH_FAILED, result.getErrorKind());
        assertEquals("50113", result.getExchangeCode());
        assertEquals(1, exchange.routes().size());
        assertEquals(1, failed.size());
    }

    @Test
    void testAuthenticationFailureOnColdSpecCacheSendsOneSignedRequest() {
        useAdapter(new OkxAdapter(server.url("/").toString(), false, false), true);
        exchange.on("GET /api/v5/public/instruments", "{\"code\":\"0\",\"data\":[{\"instId\":\"BTC-USDT-SWAP\","
                + "\"ctVal\":\"0.01\",\"ctMult\":\"1\",\"lotSz\":\"1\",\"minSz\":\"1\",\"tickSz\":\"0.1\"}]}");
        exchange.on("GET /api/v5/account/max-size",
                r -> json(401, "{\"code\":\"50113\",\"msg\":\"Invalid Sign\",\"data\":[]}"));

        OrderResult result = service.execute(btcBuy("t1").leverage(10).build());

        assertEquals(ExchangeException.ErrorCode.AUTH_FAILED, result.getErrorKind());
        // 公共元数据请求不带凭证，只发出一次签名请求
        assertEquals(List.of("GET /api/v5/public/instruments", "GET /api/v5/account/max-size"), exchange.routes());
        assertNull(exchange.first("GET /api/v5/public/instruments").getHeader("OK-ACCESS-SIGN"));
        assertNotNull(exchange.first("GET /api/v5/account/max-size").getHeader("OK-ACCESS-SIGN"));
    }

    @Test
    void testOrderAboveAvailableSizeIsRejectedBeforeSubmission() {
        useOkx();
        exchange.on("GET /api/v5/account/max-size", SIZE_OK);
        exchange.on("GET /api/v5/account/max-avail-size",
                "{\"code\":\"0\",\"data\":[{\"availBuy\":\"5\",\"availSell\":\"5\"}]}");

        OrderResult result = service.execute(btcBuy("t1").leverage(10).build());

        assertFalse(result.isSuccess());
        assertEquals(ExchangeException.ErrorCode.VALIDATION_FAILED, result.getErrorKind());
        assertTrue(result.getErrorMessage().contains("可用数量 5"), result.getErrorMessage());
        assertEquals(0, exchange.count("POST /api/v5/trade/order"));
        assertEquals(0, exchange.count("GET /api/v5/account/leverage-info"));
    }

    @Test
    void testImplausiblePriceSendsNothing() {
        useOkx();

        OrderResult result = service.execute(TradeIntent.builder()
                .symbol(BTC)
                .side(Side.BUY)
                .notionalUsd(new BigDecimal("100"))
                .referencePrice(new BigDecimal("3.2"))
                .clientOrderId("t1")
                .build());

        assertFalse(result.isSuccess());
        assertEquals(ExchangeException.ErrorCode.VALIDATION_FAILED, result.getErrorKind());
        assertTrue(result.getErrorMessage().contains("BTC"));
        assertTrue(exchange.routes().isEmpty());
    }

    @Test
    void testDuplicateClientOrderIdReusesExistingOrder() {
        useOkx();
        routeSizeChecks();
        exchange.on("POST /api/v5/trade/order", "{\"code\":\"1\",\"msg\":\"All operations failed\","
                + "\"data\":[{\"ordId\":\"\",\"clOrdId\":\"t1\",\"sCode\":\"51016\",\"sMsg\":\"Duplicated clOrdId\"}]}");
        exchange.on("GET /api/v5/trade/order", "{\"code\":\"0\",\"data\":[{\"ordId\":\"999\",\"clOrdId\":\"t1\","
                + "\"instId\":\"BTC-USDT-SWAP\",\"side\":\"buy\",\"sz\":\"10\",\"accFillSz\":\"10\",\"avgPx\":\"43000\",\"state\":\"filled\"}]}");

        OrderResult result = service.execute(btcBuy("t1").build());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("999", result.getOrderId());
        assertEquals(1, exchange.count("POST /api/v5/trade/order"));
        String lookup = exchange.first("GET /api/v5/trade/order").getPath();
        assertTrue(lookup.contains("clOrdId=t1"), lookup);
    }

    @Test
    void testBusinessRejectionCarriesCodeAndHint() {
        useOkx();
        routeSizeChecks();
        exchange.on("POST /api/v5/trade/order", "{\"code\":\"1\",\"msg\":\"All operations failed\","
                + "\"data\":[{\"ordId\":\"\",\"clOrdId\":\"t1\",\"sCode\":\"51008\",\"sMsg\":\"Insufficient margin\"}]}");

        OrderResult result = service.execute(btcBuy("t1").build());

        assertFalse(result.isSuccess());
        assertEquals(ExchangeException.ErrorCode.ORDER_REJECTED, result.getErrorKind());
        assertEquals("51008", result.getExchangeCode());
        assertTrue(result.getErrorMessage().startsWith("Insufficient margin"));
        assertTrue(result.getErrorMessage().contains("提示:"));
        assertEquals(1, exchange.count("POST /api/v5/trade/order"));
        assertEquals(0, exchange.count("GET /api/v5/trade/order"));
    }

    @Test
    void testBatchPartialSuccessKeepsInputOrder() {
        useOkx();
        exchange.on("POST /api/v5/trade/batch-orders", r -> json(200, "{\"code\":\"2\",\"msg\":\"\",\"data\":["
                + "{\"ordId\":\"a-1\",\"clOrdId\":\"a\",\"sCode\":\"0\",\"sMsg\":\"\"},"
                + "{\"ordId\":\"\",\"clOrdId\":\"b\",\"sCode\":\"51008\",\"sMsg\":\"Insufficient margin\"},"
                + "{\"ordId\":\"c-1\",\"clOrdId\":\"c\",\"sCode\":\"0\",\"sMsg\":\"\"}]}"));

        List<OrderResult> results = service.executeBatch(List.of(
                btcBuy("a").build(), btcBuy("b").build(), btcBuy("c").build()));

        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals("a-1", results.get(0).getOrderId());
        assertFalse(results.get(1).isSuccess());
        assertEquals("51008", results.get(1).getExchangeCode());
        assertEquals("b", results.get(1).getClientOrderId());
        assertTrue(results.get(2).isSuccess());
        assertEquals("c-1", results.get(2).getOrderId());
        // 按请求数量和参考价估算: 0.1 x 43000 x 0.05%
        assertEquals(0, new BigDecimal("2.15").compareTo(results.get(0).getEstimatedFee()));

        assertEquals(1, exchange.count("POST /api/v5/trade/batch-orders"));
        assertEquals(3, exchange.body("POST /api/v5/trade/batch-orders").size());
        assertEquals(2, accepted.size());
        assertEquals(1, failed.size());
    }

    @Test
    void testBatchIsSplitIntoExchangeSizedChunks() {
        useOkx();
        exchange.on("POST /api/v5/trade/batch-orders", OrderExecutionServiceTest::acceptAll);
        exchange.on("POST /api/v5/trade/order", OrderExecutionServiceTest::acceptAll);

        List<TradeIntent> intents = new ArrayList<>();
        for (int i = 0; i < OkxAdapter.MAX_BATCH_SIZE + 1; i++) {
            intents.add(btcBuy("o" + i).build());
        }
        List<OrderResult> results = service.executeBatch(intents);

        assertEquals(intents.size(), results.size());
        for (int i = 0; i < results.size(); i++) {
            assertTrue(results.get(i).isSuccess(), results.get(i).toString());
            assertEquals("id-o" + i, results.get(i).getOrderId());
        }
        assertEquals(1, exchange.count("POST /api/v5/trade/batch-orders"));
        assertEquals(OkxAdapter.MAX_BATCH_SIZE, exchange.body("POST /api/v5/trade/batch-orders").size());
        assertEquals(1, exchange.count("POST /api/v5/trade/order"));
    }

    @Test
    void testBatchAuthFailureFailsLaterChunksWithoutSending() {
        useOkx();
        exchange.on("POST /api/v5/trade/batch-orders",
                r -> json(401, "{\"code\":\"50113\",\"msg\":\"Invalid Sign\",\"data\":[]}"));

        List<TradeIntent> intents = new ArrayList<>();
        for (int i = 0; i < OkxAdapter.MAX_BATCH_SIZE + 1; i++) {
            intents.add(btcBuy("o" + i).build());
        }
        List<OrderResult> results = service.executeBatch(intents);

        for (OrderResult result : results) {
            assertEquals(ExchangeException.ErrorCode.AUTH_FAILED, result.getErrorKind());
        }
        assertEquals(1, exchange.routes().size());
    }

    @Test
    void testAlgoOrderWithTakeProfitBelowStopLossIsRejectedForLong() {
        useOkx();

        OrderResult result = service.placeAlgoOrder(AlgoOrderRequest.builder()
                .symbol(BTC)
                .side(Side.SELL)
                .positionSide(PositionSide.LONG)
                .quantityCoins(new BigDecimal("0.05"))
                .takeProfit(new BigDecimal("40000"), null)
                .stopLoss(new BigDecimal("42000"), null)
                .clientOrderId("p1")
                .build());

        assertFalse(result.isSuccess());
        assertEquals(ExchangeException.ErrorCode.VALIDATION_FAILED, result.getErrorKind());
        assertTrue(exchange.routes().isEmpty());
    }

    @Test
    void testOcoAlgoOrderSnapsTriggersToTick() {
        useOkx();
        exchange.on("POST /api/v5/trade/order-algo",
                "{\"code\":\"0\",\"data\":[{\"algoId\":\"a-77\",\"algoClOrdId\":\"p1\",\"sCode\":\"0\",\"sMsg\":\"\"}]}");

        OrderResult result = service.placeAlgoOrder(AlgoOrderRequest.builder()
                .symbol(BTC)
                .side(Side.SELL)
                .positionSide(PositionSide.LONG)
                .quantityCoins(new BigDecimal("0.05"))
                .takeProfit(new BigDecimal("45000.04"), null)
                .stopLoss(new BigDecimal("41000.06"), null)
                .clientOrderId("p1")
                .build());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("a-77", result.getOrderId());

        JsonNode body = exchange.body("POST /api/v5/trade/order-algo");
        assertEquals("oco", body.path("ordType").asText());
        assertEquals("5", body.path("sz").asText());
        assertTrue(body.path("reduceOnly").asBoolean());
        assertEquals("45000", body.path("tpTriggerPx").asText());
        assertEquals("41000.1", body.path("slTriggerPx").asText());
        assertEquals("-1", body.path("tpOrdPx").asText());
        assertEquals("p1", body.path("algoClOrdId").asText());
    }

    @Test
    void testCancelByClientOrderId() {
        useOkx();
        exchange.on("POST /api/v5/trade/cancel-order",
                "{\"code\":\"0\",\"data\":[{\"ordId\":\"1001\",\"clOrdId\":\"t1\",\"sCode\":\"0\",\"sMsg\":\"\"}]}");

        OrderResult result = service.cancelOrder(BTC, OrderRef.clientOrderId("t1"));

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("1001", result.getOrderId());
        JsonNode body = exchange.body("POST /api/v5/trade/cancel-order");
        assertEquals("BTC-USDT-SWAP", body.path("instId").asText());
        assertEquals("t1", body.path("clOrdId").asText());
    }

    @Test
    void testExecuteAsyncCompletesOnWorkerThread() throws Exception {
        useOkx();
        routeSizeChecks();
        exchange.on("POST /api/v5/trade/order", ORDER_ACCEPTED);
        exchange.on("GET /api/v5/trade/order", ORDER_FILLED);

        OrderResult result = service.executeAsync(btcBuy("t1").build()).get(10, TimeUnit.SECONDS);

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("1001", result.getOrderId());
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    /**
     * 接受请求中的所有订单，ordId = "id-" + clOrdId
     */
    private static MockResponse acceptAll(RecordedRequest request) {
        try {
            JsonNode body = MAPPER.readTree(request.getBody().clone().readUtf8());
            StringBuilder rows = new StringBuilder();
            for (JsonNode order : body.isArray() ? body : MAPPER.createArrayNode().add(body)) {
                String clOrdId = order.path("clOrdId").asText();
                if (rows.length() > 0) {
                    rows.append(',');
                }
                rows.append("{\"ordId\":\"id-").append(clOrdId).append("\",\"clOrdId\":\"").append(clOrdId)
                        .append("\",\"sCode\":\"0\",\"sMsg\":\"\"}");
            }
            return json(200, "{\"code\":\"0\",\"msg\":\"\",\"data\":[" + rows + "]}");
        } catch (IOException e) {
            return json(400, "{\"code\":\"51000\",\"msg\":\"bad body\"}");
        }
    }

    /**
     * 按 "METHOD /path" 路由（忽略查询参数），并记录收到的请求
     */
    private static final class FakeExchange extends Dispatcher {
        private final Map<String, Function<RecordedRequest, MockResponse>> handlers = new ConcurrentHashMap<>();
        private final List<String> seen = new CopyOnWriteArrayList<>();
        private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

        void on(String route, String body) {
            handlers.put(route, r -> json(200, body));
        }

        void on(String route, Function<RecordedRequest, MockResponse> handler) {
            handlers.put(route, handler);
        }

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String route = routeOf(request);
            seen.add(route);
            requests.add(request);
            Function<RecordedRequest, MockResponse> handler = handlers.get(route);
            if (handler == null) {
                return json(404, "{\"code\":\"404\",\"msg\":\"no route for " + route + "\"}");
            }
            return handler.apply(request);
        }

        List<String> routes() {
            return List.copyOf(seen);
        }

        long count(String route) {
            return seen.stream().filter(route::equals).count();
        }

        RecordedRequest first(String route) {
            for (RecordedRequest request : requests) {
                if (route.equals(routeOf(request))) {
                    return request;
                }
            }
            throw new AssertionError("No request for " + route + ", saw " + seen);
        }

        JsonNode body(String route) {
            try {
                return MAPPER.readTree(first(route).getBody().clone().readUtf8());
            } catch (IOException e) {
                throw new AssertionError("Unreadable body for " + route, e);
            }
        }

        private static String routeOf(RecordedRequest request) {
            String path = request.getPath();
            int q = path.indexOf('?');
            return request.getMethod() + " " + (q < 0 ? path : path.substring(0, q));
        }
    }
}
