package com.trade.gateway.account;

import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.exchange.ExchangeException;

@FunctionalInterface
public interface FeeScheduleSource {

    FeeSchedule fetch() throws ExchangeException;
}
