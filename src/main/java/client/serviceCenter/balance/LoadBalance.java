package client.serviceCenter.balance;

import common.naming.Endpoint;
import common.result.Result;

/**
 * 负载均衡接口
 */
public interface LoadBalance {
    /**
     * 负载均衡算法类型
     */
    public enum BalanceType {
        MODULO_HASH,
    }
    public BalanceType getType();

    /**
     * 更新服务的可用节点列表，由服务发现在节点变化时推送
     * @param info 服务路由属性与最新节点列表
     * @return 更新结果，参数缺失时返回 INVALID_INPUT
     */
    Result<Void> update(LoadBalanceInfo info);

    /**
     * 为一次调用选择一个服务节点
     * @param serviceName 服务名称
     * @return 选中的节点；无路由信息返回 NOT_FOUND，节点为空返回 EMPTY_SET
     */
    Result<Endpoint> next(String serviceName);
}
