package org.lupenghan.docdb.config;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.plan.models.PersistenceMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 从 classpath 上的 docdb.properties 读取配置，同名的 JVM 系统属性优先。
 * 非法值会被忽略并使用默认值
 */
@Slf4j
public class DocDbConfigLoader {
    public static final String RESOURCE = "docdb.properties";

    public static final String DATABASE_PATH = "docdb.database.path";
    public static final String PERSISTENCE_MODE = "docdb.persistence.mode";
    public static final String SUPERUSER_ROLE = "docdb.superuser.role";
    public static final String HISTORY_PATH = "docdb.history.path";
    public static final String HISTORY_LIMIT = "docdb.history.limit";
    public static final String DIGEST_SAMPLE_ROWS = "docdb.digest.sample-rows";
    public static final String LOCK_FILE_ENABLED = "docdb.lock-file.enabled";

    private DocDbConfigLoader() {
    }

    public static DocDbConfig load() {
        Properties properties = loadProperties(RESOURCE);
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("docdb.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    /**
     * 读取 classpath 资源，不存在时返回空的 Properties
     */
    public static Properties loadProperties(String resource) {
        Properties properties = new Properties();
        try (InputStream is = DocDbConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                properties.load(is);
                log.debug("已加载配置文件 {}", resource);
            } else {
                log.debug("未找到配置文件 {}，使用默认配置", resource);
            }
        } catch (IOException e) {
            log.warn("读取配置文件 {} 失败，使用默认配置: {}", resource, e.getMessage());
        }
        return properties;
    }

    public static DocDbConfig fromProperties(Properties properties) {
        DocDbConfig defaults = DocDbConfig.defaults();
        DocDbConfig.DocDbConfigBuilder builder = defaults.toBuilder();

        String databasePath = properties.getProperty(DATABASE_PATH);
        if (databasePath != null && !databasePath.isBlank()) {
            builder.databasePath(Paths.get(databasePath.trim()));
        }

        String mode = properties.getProperty(PERSISTENCE_MODE);
        if (mode != null && !mode.isBlank()) {
            try {
                builder.persistenceMode(PersistenceMode.fromValue(mode));
            } catch (IllegalArgumentException e) {
                log.warn("配置 {}={} 非法，使用默认值 {}", PERSISTENCE_MODE, mode, defaults.getPersistenceMode());
            }
        }

        String superuser = properties.getProperty(SUPERUSER_ROLE);
        if (superuser != null && !superuser.isBlank()) {
            builder.superuserRole(superuser.trim());
        }

        if (properties.containsKey(HISTORY_PATH)) {
            String historyPath = properties.getProperty(HISTORY_PATH);
            builder.historyPath(historyPath == null || historyPath.isBlank() ? null : Paths.get(historyPath.trim()));
        }

        builder.historyLimit(positiveInt(properties, HISTORY_LIMIT, defaults.getHistoryLimit()));
        builder.digestSampleRows(nonNegativeInt(properties, DIGEST_SAMPLE_ROWS, defaults.getDigestSampleRows()));

        String lockFile = properties.getProperty(LOCK_FILE_ENABLED);
        if (lockFile != null && !lockFile.isBlank()) {
            String normalized = lockFile.trim();
            if ("true".equalsIgnoreCase(normalized) || "false".equalsIgnoreCase(normalized)) {
                builder.lockFileEnabled(Boolean.parseBoolean(normalized));
            } else {
                log.warn("配置 {}={} 非法，使用默认值 {}", LOCK_FILE_ENABLED, lockFile, defaults.isLockFileEnabled());
            }
        }
        return builder.build();
    }

    private static int positiveInt(Properties properties, String key, int defaultValue) {
        int value = nonNegativeInt(properties, key, defaultValue);
        if (value == 0) {
            log.warn("配置 {} 必须大于 0，使用默认值 {}", key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static int nonNegativeInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                log.warn("配置 {}={} 不能为负数，使用默认值 {}", key, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("配置 {}={} 不是整数，使用默认值 {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
