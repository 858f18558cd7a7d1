package common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * 轻量应用配置加载器：
 * - 优先读取系统属性（-Dkey=value）
 * - 其次读取 classpath: application.properties
 */
public final class AppConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final Properties PROPS = new Properties();

    static {
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null) {
                PROPS.load(in);
                logger.info("已加载 application.properties，共 {} 项", PROPS.size());
            } else {
                logger.info("未找到 application.properties，使用内置默认与系统属性");
            }
        } catch (IOException e) {
            logger.warn("加载 application.properties 失败: {}", e.getMessage());
        }
    }

    private AppConfig() {}

    public static String getString(String key, String defaultValue) {
        String sysVal = System.getProperty(key);
        if (sysVal != null && !sysVal.isEmpty()) return sysVal;
        String val = PROPS.getProperty(key);
        return val != null ? val : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String str = getString(key, null);
        if (str == null) return defaultValue;
        try {
            return Integer.parseInt(str.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * 读取逗号分隔的整数列表，非数字项被跳过
     */
    public static List<Integer> getIntList(String key, List<Integer> defaultValue) {
        String str = getString(key, null);
        if (str == null) return defaultValue;
        return parseIntList(str);
    }

    static List<Integer> parseIntList(String str) {
        if (str.isBlank()) return Collections.emptyList();
        List<Integer> values = new ArrayList<>();
        for (String part : str.split(",")) {
            try {
                values.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                logger.warn("忽略非法的整数配置项: '{}'", part);
            }
        }
        return Collections.unmodifiableList(values);
    }
}
