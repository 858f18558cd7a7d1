package client.serviceCenter.balance;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 调用方的节点选择策略，参与哈希时使用其数值编码
 */
@Getter
@AllArgsConstructor
public enum SelectorPolicy {
    ONE(0),
    ALL(1),
    MULTIPLE(2),
    IDC_ALL(3);

    private final int code;
}
