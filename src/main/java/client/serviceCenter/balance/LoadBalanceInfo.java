package client.serviceCenter.balance;

import common.naming.Endpoint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 服务发现推送给负载均衡的一次节点列表更新
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadBalanceInfo {
    private SelectorInfo info;
    private List<Endpoint> endpoints;
}
