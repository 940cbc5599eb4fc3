package com.trade.gateway.execution;

import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 价格合理性校验
 * 参考价超出该币种的合理区间时拒绝，通常意味着调用方混用了其他币种的行情。
 */
public class PriceSanityChecker {

    private static final Logger logger = LoggerFactory.getLogger(PriceSanityChecker.class);

    private static final BigDecimal GENERIC_MAX = new BigDecimal("1000000");

    private final Map<String, Range> ranges;

    public record Range(BigDecimal min, BigDecimal max) {
        public boolean contains(BigDecimal price) {
            return price.compareTo(min) >= 0 && price.compareTo(max) <= 0;
        }
    }

    public PriceSanityChecker() {
        this(defaultRanges());
    }

    public PriceSanityChecker(Map<String, Range> ranges) {
        this.ranges = Map.copyOf(ranges);
    }

    /**
     * 内置区间表，{@code price.range.<BASE>=min,max} 配置项优先
     */
    public static PriceSanityChecker fromConfig(ConfigManager config) {
        Map<String, Range> ranges = new HashMap<>(defaultRanges());
        for (String key : config.propertyNames("price.range.")) {
            String base = key.substring("price.range.".length()).toUpperCase(Locale.ROOT);
            String[] parts = config.getProperty(key, "").split(",");
            if (parts.length != 2) {
                logger.warn("忽略配置 {}: 格式应为 min,max", key);
                continue;
            }
            try {
                ranges.put(base, new Range(new BigDecimal(parts[0].trim()), new BigDecimal(parts[1].trim())));
            } catch (NumberFormatException e) {
                logger.warn("忽略配置 {}: {}", key, e.getMessage());
            }
        }
        return new PriceSanityChecker(ranges);
    }

    public static Map<String, Range> defaultRanges() {
        Map<String, Range> ranges = new HashMap<>();
        ranges.put("BTC", range("1000", "200000"));
        ranges.put("ETH", range("100", "10000"));
        ranges.put("BNB", range("10", "2000"));
        ranges.put("SOL", range("1", "500"));
        ranges.put("XRP", range("0.01", "10"));
        ranges.put("DOGE", range("0.001", "1"));
        ranges.put("ADA", range("0.01", "10"));
        ranges.put("AVAX", range("1", "200"));
        ranges.put("LINK", range("1", "100"));
        ranges.put("DOT", range("0.1", "100"));
        return ranges;
    }

    public boolean isPlausible(Symbol symbol, BigDecimal price) {
        if (price == null) {
            return false;
        }
        Range range = ranges.get(symbol.getBase());
        if (range == null) {
            return price.signum() > 0 && price.compareTo(GENERIC_MAX) < 0;
        }
        return range.contains(price);
    }

    public Range rangeFor(Symbol symbol) {
        return ranges.get(symbol.getBase());
    }

    private static Range range(String min, String max) {
        return new Range(new BigDecimal(min), new BigDecimal(max));
    }
}
