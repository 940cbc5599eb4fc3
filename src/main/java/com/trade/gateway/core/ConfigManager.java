package com.trade.gateway.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * 配置管理器
 * 配置来源（后者覆盖前者）:
 * 1. classpath 下的 gateway.properties（随 jar 发布的默认值）
 * 2. 工作目录下的 config.properties（运维覆盖）
 * 3. 环境变量，键 "okx.api.key" 对应 OKX_API_KEY
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private static final String DEFAULTS_RESOURCE = "gateway.properties";
    private static final String CONFIG_FILE = "config.properties";
    private static ConfigManager instance;

    private final Properties properties;
    private final Map<String, String> environment;

    private ConfigManager(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) {
            instance = new ConfigManager(loadConfiguration(), System.getenv());
        }
        return instance;
    }

    /**
     * 独立实例，不读取文件和环境变量
     */
    public static ConfigManager fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ConfigManager(copy, Map.of());
    }

    private static Properties loadConfiguration() {
        Properties loaded = new Properties();
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                loaded.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IllegalStateException("无法加载 " + DEFAULTS_RESOURCE, e);
        }

        Path configPath = Paths.get(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStreamReader reader = new InputStreamReader(
                    new FileInputStream(configPath.toFile()),
                    StandardCharsets.UTF_8
            )) {
                loaded.load(reader);
                logger.info("已加载配置文件: {}", configPath.toAbsolutePath());
            } catch (IOException e) {
                throw new IllegalStateException("无法加载 " + CONFIG_FILE, e);
            }
        }
        return loaded;
    }

    public String getProperty(String key, String defaultValue) {
        String envValue = environment.get(toEnvName(key));
        if (envValue != null && !envValue.isBlank()) {
            return envValue.trim();
        }
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * 读取必填配置
     */
    public String getProperty(String key) {
        String value = getProperty(key, null);
        if (value == null) {
            throw new IllegalStateException("缺少配置: " + key);
        }
        return value;
    }

    /**
     * 配置项有实际值时返回 true（非空且不是 YOUR_... 占位符）
     */
    public boolean hasProperty(String key) {
        String value = getProperty(key, null);
        return value != null && !value.isEmpty() && !value.startsWith("YOUR_");
    }

    public int getIntProperty(String key, int defaultValue) {
        try {
            return Integer.parseInt(getProperty(key, String.valueOf(defaultValue)));
        } catch (NumberFormatException e) {
            logger.warn("配置 {} 不是有效整数，使用默认值 {}", key, defaultValue);
            return defaultValue;
        }
    }

    public long getLongProperty(String key, long defaultValue) {
        try {
            return Long.parseLong(getProperty(key, String.valueOf(defaultValue)));
        } catch (NumberFormatException e) {
            logger.warn("配置 {} 不是有效长整数，使用默认值 {}", key, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key, null);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    public BigDecimal getBigDecimalProperty(String key, BigDecimal defaultValue) {
        return Decimal.parse(getProperty(key, null), defaultValue);
    }

    /**
     * 配置文件中以 prefix 开头的键（排序）。仅存在于环境变量中的键不列出。
     */
    public Set<String> propertyNames(String prefix) {
        Set<String> names = new TreeSet<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                names.add(name);
            }
        }
        return names;
    }

    static String toEnvName(String key) {
        return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
