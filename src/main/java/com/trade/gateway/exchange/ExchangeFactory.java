package com.trade.gateway.exchange;

import com.trade.gateway.auth.Credentials;
import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.transport.TransportChainConfig;
import com.trade.gateway.transport.TransportFallbackChain;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 交易所工厂
 * 根据配置创建适配器和 REST 客户端
 */
public final class ExchangeFactory {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeFactory.class);

    private ExchangeFactory() {}

    /**
     * @param exchangeName 交易所名称（okx、bybit）
     */
    public static ExchangeAdapter createAdapter(String exchangeName, ConfigManager config) {
        String name = exchangeName == null ? "" : exchangeName.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "okx" -> new OkxAdapter(
                    config.getProperty("okx.base.url", OkxAdapter.PROD_BASE_URL),
                    config.getBooleanProperty("okx.demo", false),
                    config.getBooleanProperty("okx.hedge.mode", false));
            case "bybit" -> {
                boolean demo = config.getBooleanProperty("bybit.demo", false);
                yield new BybitAdapter(
                        config.getProperty("bybit.base.url", demo ? BybitAdapter.DEMO_BASE_URL : BybitAdapter.PROD_BASE_URL),
                        demo,
                        config.getBooleanProperty("bybit.hedge.mode", false));
            }
            default -> throw new IllegalArgumentException("不支持的交易所: " + exchangeName);
        };
    }

    /**
     * 按 gateway.exchange 配置创建适配器、凭证和传输通道
     */
    public static ExchangeRestClient createRestClient(ConfigManager config) {
        String exchangeName = config.getProperty("gateway.exchange", "okx");
        ExchangeAdapter adapter = createAdapter(exchangeName, config);
        String prefix = exchangeName.trim().toLowerCase(Locale.ROOT);
        Credentials credentials = config.hasProperty(prefix + ".api.key")
                ? Credentials.fromConfig(config, prefix)
                : null;
        if (credentials == null) {
            logger.warn("{} 未配置 API 凭证，只能访问公共接口", adapter.getName());
        } else {
            logger.info("{} 凭证已加载: {}", adapter.getName(), credentials);
        }
        TransportFallbackChain chain = new TransportFallbackChain(createHttpClient(), TransportChainConfig.fromConfig(config));
        logger.info("交易所适配器: {}", adapter);
        return new ExchangeRestClient(adapter, credentials, chain);
    }

    public static OkHttpClient createHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }
}
