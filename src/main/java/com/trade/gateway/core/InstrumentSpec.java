package com.trade.gateway.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 合约规格
 * 数量（minOrderSize、sizeIncrement）以合约张数计，一张合约等于 contractValue 个币。
 */
public final class InstrumentSpec {
    private final Symbol symbol;
    private final String instrumentId;
    private final BigDecimal contractValue;
    private final BigDecimal minOrderSize;
    private final BigDecimal sizeIncrement;
    private final BigDecimal tickSize;

    public InstrumentSpec(Symbol symbol,
                          String instrumentId,
                          BigDecimal contractValue,
                          BigDecimal minOrderSize,
                          BigDecimal sizeIncrement,
                          BigDecimal tickSize) {
        if (!Decimal.isPositive(contractValue) || !Decimal.isPositive(sizeIncrement)) {
            throw new IllegalArgumentException("contractValue 和 sizeIncrement 必须为正数: " + symbol);
        }
        this.symbol = symbol;
        this.instrumentId = instrumentId;
        this.contractValue = contractValue;
        this.minOrderSize = minOrderSize == null ? sizeIncrement : minOrderSize;
        this.sizeIncrement = sizeIncrement;
        this.tickSize = tickSize;
    }

    public Symbol getSymbol() { return symbol; }
    public String getInstrumentId() { return instrumentId; }
    public BigDecimal getContractValue() { return contractValue; }
    public BigDecimal getMinOrderSize() { return minOrderSize; }
    public BigDecimal getSizeIncrement() { return sizeIncrement; }
    public BigDecimal getTickSize() { return tickSize; }

    /**
     * 按最小变动价位取整，未知时原样返回
     */
    public BigDecimal snapPrice(BigDecimal price, RoundingMode mode) {
        if (tickSize == null || !Decimal.isPositive(tickSize)) {
            return price;
        }
        return Decimal.snapToStep(price, tickSize, mode);
    }

    @Override
    public String toString() {
        return String.format("InstrumentSpec{%s, ctVal=%s, minSz=%s, lotSz=%s, tickSz=%s}",
                instrumentId, contractValue, minOrderSize, sizeIncrement, tickSize);
    }
}
