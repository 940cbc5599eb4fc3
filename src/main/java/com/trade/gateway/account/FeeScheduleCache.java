package com.trade.gateway.account;

import com.trade.gateway.core.FeeSchedule;
import com.trade.gateway.exchange.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 手续费率缓存（maker/taker），每小时刷新
 * 不会失败：交易所不可达时使用最近一次的费率或配置的默认值。
 * 同一时间只有一个调用方刷新，其他并发调用方直接拿到最近的费率（或默认值），不等待刷新。
 */
public class FeeScheduleCache {

    private static final Logger logger = LoggerFactory.getLogger(FeeScheduleCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofMinutes(5);

    private final FeeScheduleSource source;
    private final FeeSchedule defaultSchedule;
    private final Duration ttl;
    private final Duration retryAfter;
    private final Clock clock;

    private final AtomicBoolean refreshing = new AtomicBoolean();
    private volatile Entry entry;

    public FeeScheduleCache(FeeScheduleSource source, FeeSchedule defaultSchedule) {
        this(source, defaultSchedule, DEFAULT_TTL, DEFAULT_RETRY_AFTER, Clock.systemUTC());
    }

    public FeeScheduleCache(FeeScheduleSource source,
                            FeeSchedule defaultSchedule,
                            Duration ttl,
                            Duration retryAfter,
                            Clock clock) {
        this.source = source;
        this.defaultSchedule = defaultSchedule == null ? FeeSchedule.DEFAULT : defaultSchedule;
        this.ttl = ttl;
        this.retryAfter = retryAfter;
        this.clock = clock;
    }

    public FeeSchedule get() {
        Instant now = clock.instant();
        Entry snapshot = entry;
        if (snapshot != null && now.isBefore(snapshot.expiresAt())) {
            return snapshot.schedule();
        }
        if (!refreshing.compareAndSet(false, true)) {
            return snapshot != null ? snapshot.schedule() : defaultSchedule;
        }
        try {
            return refresh(now, snapshot);
        } finally {
            refreshing.set(false);
        }
    }

    private FeeSchedule refresh(Instant now, Entry previous) {
        try {
            FeeSchedule fetched = source.fetch();
            entry = new Entry(fetched, now.plus(ttl));
            logger.debug("手续费率已刷新: maker={}, taker={}", fetched.makerRate(), fetched.takerRate());
            return fetched;
        } catch (ExchangeException e) {
            FeeSchedule fallback = previous != null ? previous.schedule() : defaultSchedule;
            entry = new Entry(fallback, now.plus(retryAfter));
            logger.warn("刷新手续费率失败，使用 maker={}, taker={}: {}",
                    fallback.makerRate(), fallback.takerRate(), e.describe());
            return fallback;
        }
    }

    private record Entry(FeeSchedule schedule, Instant expiresAt) {
    }
}
