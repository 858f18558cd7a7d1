package common.naming;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.io.Serializable;

/**
 * 一个可调用的服务节点。实例不可变，节点列表更新时整体替换。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Endpoint implements Serializable {
    private final String host;
    private final int port;
    private final EndpointStatus status;

    public Endpoint(@NonNull String host, int port, @NonNull EndpointStatus status) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("端口超出范围: " + port);
        }
        this.host = host;
        this.port = port;
        this.status = status;
    }

    public static Endpoint healthy(String host, int port) {
        return new Endpoint(host, port, EndpointStatus.HEALTHY);
    }

    /**
     * 比较 (host, port, status) 三元组，用于判断节点列表是否变化
     */
    public boolean sameAs(Endpoint other) {
        return other != null
                && host.equals(other.host)
                && port == other.port
                && status == other.status;
    }
}
