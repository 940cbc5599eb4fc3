package com.trade.gateway.instrument;

import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.exchange.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 合约规格缓存（按交易对，带 TTL）
 * <p>
 * 不同交易对的查询互不等待：未命中时只锁住本交易对。
 * 刷新失败时先返回旧条目（无论多旧），其次使用内置默认值；
 * 降级结果保留 {@code retryAfter} 后再尝试刷新。
 */
public class InstrumentSpecCache {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentSpecCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofMinutes(5);

    private final InstrumentSpecSource source;
    private final Map<Symbol, InstrumentSpec> defaults;
    private final Duration ttl;
    private final Duration retryAfter;
    private final Clock clock;
    private final Map<Symbol, Entry> entries = new ConcurrentHashMap<>();
    private final Map<Symbol, Object> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        private final InstrumentSpec spec;
        private final Instant expiresAt;
        private final boolean degraded;

        private Entry(InstrumentSpec spec, Instant expiresAt, boolean degraded) {
            this.spec = spec;
            this.expiresAt = expiresAt;
            this.degraded = degraded;
        }
    }

    public InstrumentSpecCache(InstrumentSpecSource source, Map<Symbol, InstrumentSpec> defaults) {
        this(source, defaults, DEFAULT_TTL, DEFAULT_RETRY_AFTER, Clock.systemUTC());
    }

    public InstrumentSpecCache(InstrumentSpecSource source,
                               Map<Symbol, InstrumentSpec> defaults,
                               Duration ttl,
                               Duration retryAfter,
                               Clock clock) {
        this.source = source;
        this.defaults = defaults == null ? Map.of() : Map.copyOf(defaults);
        this.ttl = ttl;
        this.retryAfter = retryAfter;
        this.clock = clock;
    }

    public InstrumentSpec getSpec(Symbol symbol) throws ExchangeException {
        Entry cached = entries.get(symbol);
        if (cached != null && isFresh(cached)) {
            return cached.spec;
        }

        Object lock = locks.computeIfAbsent(symbol, k -> new Object());
        synchronized (lock) {
            cached = entries.get(symbol);
            if (cached != null && isFresh(cached)) {
                return cached.spec;
            }
            try {
                InstrumentSpec fresh = source.fetch(symbol);
                entries.put(symbol, new Entry(fresh, clock.instant().plus(ttl), false));
                logger.debug("已加载合约规格: {}", fresh);
                return fresh;
            } catch (ExchangeException e) {
                return fallback(symbol, cached, e);
            }
        }
    }

    /**
     * 当前是否由过期条目或内置默认值提供
     */
    public boolean isDegraded(Symbol symbol) {
        Entry entry = entries.get(symbol);
        return entry != null && entry.degraded;
    }

    public void invalidate(Symbol symbol) {
        entries.remove(symbol);
    }

    /**
     * 按缓存的规格把币数量换算为张数
     */
    public BigDecimal toContracts(Symbol symbol, BigDecimal coinQuantity) throws ExchangeException {
        return toContracts(getSpec(symbol), coinQuantity);
    }

    /**
     * 张数 = 币数量 / 合约面值，然后：
     * <ul>
     *   <li>不足一个数量步长：原样返回不取整，小额订单不会被舍成 0；</li>
     *   <li>否则按步长四舍五入，低于最小下单量时提升到最小下单量。</li>
     * </ul>
     */
    public static BigDecimal toContracts(InstrumentSpec spec, BigDecimal coinQuantity) {
        if (!Decimal.isPositive(coinQuantity)) {
            throw new IllegalArgumentException("币数量必须为正数: " + coinQuantity);
        }
        BigDecimal raw = coinQuantity.divide(spec.getContractValue(), Decimal.DIVISION_SCALE, RoundingMode.HALF_UP);
        if (raw.compareTo(spec.getSizeIncrement()) < 0) {
            return raw.stripTrailingZeros();
        }
        BigDecimal rounded = Decimal.snapToStep(raw, spec.getSizeIncrement(), RoundingMode.HALF_UP);
        if (rounded.compareTo(spec.getMinOrderSize()) < 0) {
            return spec.getMinOrderSize();
        }
        return rounded;
    }

    public static BigDecimal toCoins(InstrumentSpec spec, BigDecimal contracts) {
        return contracts.multiply(spec.getContractValue());
    }

    private InstrumentSpec fallback(Symbol symbol, Entry previous, ExchangeException cause) throws ExchangeException {
        Instant retryAt = clock.instant().plus(retryAfter);
        if (previous != null) {
            logger.warn("刷新合约规格失败: {}，使用缓存条目: {}", symbol, cause.getMessage());
            entries.put(symbol, new Entry(previous.spec, retryAt, true));
            return previous.spec;
        }
        InstrumentSpec fallback = defaults.get(symbol);
        if (fallback != null) {
            logger.warn("无法获取合约规格: {}，使用内置默认值 {}: {}",
                    symbol, fallback, cause.getMessage());
            entries.put(symbol, new Entry(fallback, retryAt, true));
            return fallback;
        }
        throw new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL,
                "无合约规格: " + symbol + " - " + cause.getMessage(),
                cause.getExchangeCode(), cause.getHint(), cause);
    }

    private boolean isFresh(Entry entry) {
        return clock.instant().isBefore(entry.expiresAt);
    }
}
