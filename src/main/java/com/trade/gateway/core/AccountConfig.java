package com.trade.gateway.core;

/**
 * 与下单相关的账户配置
 *
 * @param accountLevel        交易所返回的账户模式，如 "2"（单币种保证金）
 * @param positionMode        "net_mode" / "long_short_mode" 或交易所对应的值
 * @param userId              交易所用户ID，用于诊断
 * @param supportsDerivatives 账户模式无法交易永续合约时为 false
 */
public record AccountConfig(String accountLevel,
                            String positionMode,
                            String userId,
                            boolean supportsDerivatives) {

    public boolean isHedgeMode() {
        return "long_short_mode".equalsIgnoreCase(positionMode)
                || "BothSide".equalsIgnoreCase(positionMode);
    }
}
