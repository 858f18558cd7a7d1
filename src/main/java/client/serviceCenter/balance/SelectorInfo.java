package client.serviceCenter.balance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次服务调用的路由属性，可按下标参与哈希键的拼接：
 * 0 服务名，1 选择策略，2 选择数量，3 负载均衡名，4 是否来自工作流
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SelectorInfo {
    private String name;
    @Builder.Default
    private SelectorPolicy policy = SelectorPolicy.ONE;
    @Builder.Default
    private int selectNum = 1;
    private String loadBalanceName;
    private boolean fromWorkflow;

    /**
     * 扩展选择配置，目前识别 {@link LoadBalanceSelectorConfig}
     */
    private Object extendSelectInfo;
}
