package client.serviceCenter.balance.hash;

import client.serviceCenter.balance.SelectorInfo;

import java.util.List;

/**
 * 按配置的下标顺序拼接路由属性，生成哈希键。
 * 字段之间不加分隔符，不同属性组合可能得到相同的键，只用于确定轮询起点。
 */
public final class HashKeyGenerator {
    public static final int SERVICE_NAME = 0;
    public static final int POLICY = 1;
    public static final int SELECT_NUM = 2;
    public static final int LOAD_BALANCE_NAME = 3;
    public static final int FROM_WORKFLOW = 4;

    private HashKeyGenerator() {}

    public static String generate(SelectorInfo info, List<Integer> indexes) {
        if (info == null || indexes == null || indexes.isEmpty()) {
            return "";
        }
        StringBuilder key = new StringBuilder();
        for (Integer index : indexes) {
            if (index == null) {
                continue;
            }
            switch (index) {
                case SERVICE_NAME:
                    appendIfPresent(key, info.getName());
                    break;
                case POLICY:
                    if (info.getPolicy() != null) {
                        key.append(info.getPolicy().getCode());
                    }
                    break;
                case SELECT_NUM:
                    key.append(info.getSelectNum());
                    break;
                case LOAD_BALANCE_NAME:
                    appendIfPresent(key, info.getLoadBalanceName());
                    break;
                case FROM_WORKFLOW:
                    key.append(info.isFromWorkflow() ? '1' : '0');
                    break;
                default:
                    // 超出范围的下标忽略
                    break;
            }
        }
        return key.toString();
    }

    private static void appendIfPresent(StringBuilder key, String value) {
        if (value != null) {
            key.append(value);
        }
    }
}
