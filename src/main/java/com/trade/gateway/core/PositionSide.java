package com.trade.gateway.core;

/**
 * 持仓方向
 */
public enum PositionSide {
    LONG,
    SHORT
}
