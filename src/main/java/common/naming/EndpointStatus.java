package common.naming;

import java.util.Locale;

/**
 * 服务节点健康状态
 */
public enum EndpointStatus {
    HEALTHY,
    UNHEALTHY,
    ISOLATED;

    /**
     * 解析注册中心节点数据中的状态，无法识别时视为健康
     */
    public static EndpointStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return HEALTHY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return HEALTHY;
        }
    }
}
