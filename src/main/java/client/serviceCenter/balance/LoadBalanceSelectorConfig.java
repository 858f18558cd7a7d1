package client.serviceCenter.balance;

import client.serviceCenter.balance.hash.HashFunction;
import common.util.AppConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * 取模哈希负载均衡的扩展配置
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadBalanceSelectorConfig {
    private static final String PREFIX = "rpc.loadbalance.modulohash.";

    /**
     * 参与哈希键拼接的路由属性下标，按顺序拼接
     */
    @Builder.Default
    private List<Integer> hashArgs = Collections.emptyList();

    /**
     * 哈希算法名称，未知名称回退到默认算法
     */
    @Builder.Default
    private String hashFunc = HashFunction.DEFAULT.getFuncName();

    /**
     * 读取服务级配置，未配置时回退到全局配置
     */
    public static LoadBalanceSelectorConfig fromAppConfig(String serviceName) {
        List<Integer> globalArgs = AppConfig.getIntList(PREFIX + "hash_args", Collections.emptyList());
        String globalFunc = AppConfig.getString(PREFIX + "hash_func", HashFunction.DEFAULT.getFuncName());
        return new LoadBalanceSelectorConfig(
                AppConfig.getIntList(PREFIX + serviceName + ".hash_args", globalArgs),
                AppConfig.getString(PREFIX + serviceName + ".hash_func", globalFunc));
    }
}
