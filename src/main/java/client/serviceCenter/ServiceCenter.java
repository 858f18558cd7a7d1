package client.serviceCenter;

import common.naming.Endpoint;
import common.result.Result;

/**
 * 服务发现中心接口
 */
public interface ServiceCenter extends AutoCloseable {
    /**
     * 服务发现
     * @param serviceName 服务名称
     * @return 本次调用应使用的服务节点
     */
    Result<Endpoint> serviceDiscovery(String serviceName);

    @Override
    void close();
}
