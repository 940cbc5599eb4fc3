package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.auth.SignatureScheme;
import com.trade.gateway.core.AccountBalance;
import com.trade.gateway.core.AccountConfig;
import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderRef;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.SizeLimits;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.error.ErrorCodeTable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 交易所适配器接口
 * 封装各交易所的差异：签名方式、交易对格式、字段名、响应外层结构和错误码。
 * 实现只做映射，I/O 由 {@link ExchangeRestClient} 负责。
 * <p>
 * 本接口中的数量单位均为合约张数。parse* 方法接收外层已判定成功的完整响应，
 * 内容与调用不符时抛出 {@link ExchangeException}。
 */
public interface ExchangeAdapter {

    String getName();

    SignatureScheme getSignatureScheme();

    String getBaseUrl();

    boolean isDemo();

    /**
     * 每个请求（无论是否签名）都附带的请求头
     */
    Map<String, String> extraHeaders();

    ErrorCodeTable getErrorCodes();

    /**
     * 批量下单单次最多订单数
     */
    int getMaxBatchSize();

    /**
     * 是否支持最大下单量 / 最大可用量查询
     */
    boolean supportsSizeLimits();

    String toInstrumentId(Symbol symbol);

    Symbol fromInstrumentId(String instrumentId);

    EnvelopeStatus parseStatus(JsonNode root);

    /**
     * 元数据接口不可达时使用的内置规格
     */
    Map<Symbol, InstrumentSpec> defaultInstrumentSpecs();

    // ---- 合约元数据（无需签名） ----

    ExchangeCall instrumentSpecCall(Symbol symbol);

    InstrumentSpec parseInstrumentSpec(Symbol symbol, JsonNode root) throws ExchangeException;

    // ---- 交易 ----

    ExchangeCall placeOrderCall(OrderPayload order);

    ExchangeCall batchPlaceOrderCall(List<OrderPayload> orders);

    /**
     * 每笔提交的订单对应一个回执，顺序与提交顺序一致
     */
    List<OrderAck> parsePlaceOrders(List<OrderPayload> submitted, JsonNode root) throws ExchangeException;

    ExchangeCall algoOrderCall(AlgoOrderPayload order);

    OrderAck parseAlgoOrder(AlgoOrderPayload submitted, JsonNode root) throws ExchangeException;

    ExchangeCall cancelOrderCall(String instrumentId, OrderRef ref);

    OrderAck parseCancel(OrderRef ref, JsonNode root) throws ExchangeException;

    ExchangeCall orderDetailCall(String instrumentId, OrderRef ref);

    Optional<ExchangeOrder> parseOrderDetail(JsonNode root) throws ExchangeException;

    // ---- 杠杆与下单上限 ----

    ExchangeCall leverageInfoCall(String instrumentId, MarginMode marginMode);

    /**
     * 当前杠杆，交易所没有该合约的记录时为空
     * 双向持仓模式下取对应持仓方向的那一行
     */
    Optional<Integer> parseLeverage(JsonNode root, PositionSide positionSide) throws ExchangeException;

    ExchangeCall setLeverageCall(String instrumentId, MarginMode marginMode, PositionSide positionSide, int leverage);

    ExchangeCall maxOrderSizeCall(String instrumentId, MarginMode marginMode);

    ExchangeCall maxAvailableSizeCall(String instrumentId, MarginMode marginMode);

    SizeLimits parseSizeLimits(JsonNode maxSizeRoot, JsonNode maxAvailableRoot) throws ExchangeException;

    // ---- 账户 ----

    ExchangeCall balanceCall(String asset);

    AccountBalance parseBalance(String asset, JsonNode root) throws ExchangeException;

    ExchangeCall positionsCall();

    List<ExchangePosition> parsePositions(JsonNode root) throws ExchangeException;

    /**
     * @param instrumentId 合约ID，null 表示全部
     */
    ExchangeCall pendingOrdersCall(String instrumentId);

    List<ExchangeOrder> parsePendingOrders(JsonNode root) throws ExchangeException;

    ExchangeCall accountConfigCall();

    AccountConfig parseAccountConfig(JsonNode root) throws ExchangeException;

    ExchangeCall feeScheduleCall();

    FeeSchedule parseFeeSchedule(JsonNode root) throws ExchangeException;
}
