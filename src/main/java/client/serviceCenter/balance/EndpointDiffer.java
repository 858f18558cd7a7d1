package client.serviceCenter.balance;

import common.naming.Endpoint;

import java.util.List;

/**
 * 判断新推送的节点列表与缓存列表是否不同。
 * 逐个位置比较 host、port、status，比重新计算哈希种子更轻量；顺序变化同样视为变化。
 */
public final class EndpointDiffer {

    private EndpointDiffer() {}

    /**
     * @param cached   当前缓存的节点列表，服务尚无路由信息时为 null
     * @param observed 新推送的节点列表
     * @return 需要重新建立路由信息时返回 true
     */
    public static boolean isDifferent(List<Endpoint> cached, List<Endpoint> observed) {
        if (cached == null) {
            return true;
        }
        if (cached.size() != observed.size()) {
            return true;
        }
        for (int i = 0; i < cached.size(); i++) {
            if (!cached.get(i).sameAs(observed.get(i))) {
                return true;
            }
        }
        return false;
    }
}
