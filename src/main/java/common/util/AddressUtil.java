package common.util;

import common.naming.Endpoint;
import common.naming.EndpointStatus;

import java.net.InetSocketAddress;

public class AddressUtil {
    private AddressUtil() {} // 私有构造函数，防止实例化

    public static String toString(InetSocketAddress address) {
        // 使用getHostString()而不是getHostName()，避免反向 DNS 解析阻塞
        return address.getHostString() + ":" + address.getPort();
    }

    public static String toString(Endpoint endpoint) {
        return endpoint.getHost() + ":" + endpoint.getPort();
    }

    public static InetSocketAddress fromString(String address) {
        String[] parts = split(address);
        return new InetSocketAddress(parts[0], Integer.parseInt(parts[1]));
    }

    /**
     * 将注册中心中 "host:port" 格式的节点名转换为服务节点
     */
    public static Endpoint toEndpoint(String address, EndpointStatus status) {
        String[] parts = split(address);
        return new Endpoint(parts[0], Integer.parseInt(parts[1].trim()), status);
    }

    /**
     * 建立连接前转换为未解析的地址，由网络层负责解析
     */
    public static InetSocketAddress toSocketAddress(Endpoint endpoint) {
        return InetSocketAddress.createUnresolved(endpoint.getHost(), endpoint.getPort());
    }

    private static String[] split(String address) {
        int idx = address == null ? -1 : address.lastIndexOf(':');
        if (idx <= 0 || idx == address.length() - 1) {
            throw new IllegalArgumentException("非法的地址格式: " + address);
        }
        return new String[]{address.substring(0, idx), address.substring(idx + 1)};
    }
}
