package client.serviceCenter;

import client.serviceCenter.balance.LoadBalance;
import client.serviceCenter.balance.LoadBalanceInfo;
import client.serviceCenter.balance.LoadBalanceSelectorConfig;
import client.serviceCenter.balance.SelectorInfo;
import client.serviceCenter.balance.impl.ModuloHashLoadBalance;
import common.naming.Endpoint;
import common.naming.EndpointStatus;
import common.result.ErrorCode;
import common.result.Result;
import common.util.AddressUtil;
import common.util.AppConfig;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.recipes.cache.CuratorCache;
import org.apache.curator.framework.recipes.cache.CuratorCacheListener;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 ZooKeeper 的服务发现。
 * 服务节点以 "host:port" 子节点注册在 /服务名 下，节点数据可选地写入状态（UNHEALTHY / ISOLATED）。
 * 每次节点变化都把完整列表推送给负载均衡，是否需要重建路由由负载均衡自行判断。
 */
public class ZKServiceCenter implements ServiceCenter {
    private static final Logger logger = LoggerFactory.getLogger(ZKServiceCenter.class);
    private static final String ROOT_PATH = AppConfig.getString("rpc.zk.namespace", "MY_RPC");

    private final CuratorFramework client;
    private final LoadBalance loadBalance;

    // 用于管理和关闭 CuratorCache 实例，防止资源泄露
    private final Map<String, CuratorCache> watcherMap = new ConcurrentHashMap<>();

    public ZKServiceCenter() {
        this(new ModuloHashLoadBalance());
    }

    public ZKServiceCenter(LoadBalance loadBalance) {
        this(buildClient(), loadBalance);
        logger.info("Zookeeper 连接成功");
    }

    /**
     * 使用已启动的客户端
     */
    public ZKServiceCenter(CuratorFramework client, LoadBalance loadBalance) {
        this.client = client;
        this.loadBalance = loadBalance;
    }

    private static CuratorFramework buildClient() {
        RetryPolicy policy = new ExponentialBackoffRetry(1000, 3);
        CuratorFramework client = CuratorFrameworkFactory.builder()
                .connectString(AppConfig.getString("rpc.zk.connect", "127.0.0.1:2181"))
                .sessionTimeoutMs(AppConfig.getInt("rpc.zk.sessionTimeoutMs", 40000))
                .retryPolicy(policy)
                .namespace(ROOT_PATH)
                .build();
        client.start();
        return client;
    }

    @Override
    public Result<Endpoint> serviceDiscovery(String serviceName) {
        Result<Endpoint> result = loadBalance.next(serviceName);
        if (result.isSuccess() || result.errorCode() != ErrorCode.NOT_FOUND) {
            return result;
        }

        // 首次调用该服务：从 ZK 拉取节点并注册监听器
        try {
            if (client.checkExists().forPath("/" + serviceName) == null) {
                logger.warn("服务 {} 未在 Zookeeper 中注册", serviceName);
                return Result.fail(ErrorCode.NOT_FOUND, "服务[" + serviceName + "]未注册");
            }
            List<String> addressList = client.getChildren().forPath("/" + serviceName);
            logger.info("首次发现服务 {}，节点: {}", serviceName, addressList);
            Result<Void> updated = refresh(serviceName, addressList);
            if (!updated.isSuccess()) {
                logger.warn("服务 {} 没有可用的服务节点", serviceName);
                return Result.fail(ErrorCode.EMPTY_SET, "服务[" + serviceName + "]没有可用的服务节点");
            }
            registerWatcher(serviceName);
        } catch (Exception e) {
            logger.error("服务发现失败: {}", e.getMessage(), e);
            return Result.fail(ErrorCode.NOT_FOUND, "服务发现失败: " + e.getMessage());
        }
        return loadBalance.next(serviceName);
    }

    /**
     * 将服务的最新节点列表推送给负载均衡
     */
    Result<Void> refresh(String serviceName, List<String> addressList) {
        // ZK 不保证子节点顺序，排序后再推送，避免顺序抖动导致重建路由
        List<String> sorted = new ArrayList<>(addressList);
        Collections.sort(sorted);
        List<Endpoint> endpoints = new ArrayList<>(sorted.size());
        for (String address : sorted) {
            try {
                endpoints.add(AddressUtil.toEndpoint(address, readStatus(serviceName, address)));
            } catch (IllegalArgumentException e) {
                logger.warn("忽略服务 {} 下格式非法的节点 {}", serviceName, address);
            }
        }
        SelectorInfo selectorInfo = SelectorInfo.builder()
                .name(serviceName)
                .loadBalanceName(loadBalance.getType().name())
                .extendSelectInfo(LoadBalanceSelectorConfig.fromAppConfig(serviceName))
                .build();
        return loadBalance.update(new LoadBalanceInfo(selectorInfo, endpoints));
    }

    private EndpointStatus readStatus(String serviceName, String address) {
        try {
            byte[] data = client.getData().forPath("/" + serviceName + "/" + address);
            return data == null ? EndpointStatus.HEALTHY : EndpointStatus.parse(new String(data, StandardCharsets.UTF_8));
        } catch (Exception e) {
            logger.debug("读取节点 {} 状态失败，视为健康: {}", address, e.getMessage());
            return EndpointStatus.HEALTHY;
        }
    }

    /**
     * 注册监听器，当服务节点发生变化时重新推送节点列表。
     * 使用 computeIfAbsent 确保每个服务只注册一个监听器。
     */
    protected void registerWatcher(String serviceName) {
        watcherMap.computeIfAbsent(serviceName, s -> {
            try {
                CuratorCache cache = CuratorCache.build(client, "/" + s);
                CuratorCacheListener listener = CuratorCacheListener.builder()
                        .forAll((type, oldData, data) -> onServiceChanged(s))
                        .build();
                cache.listenable().addListener(listener);
                cache.start();
                logger.info("已为服务 {} 注册 ZK 节点监听器", s);
                return cache;
            } catch (Exception e) {
                logger.error("为服务 {} 注册监听器失败", s, e);
                return null; // 返回null，下次调用时会重试
            }
        });
    }

    private void onServiceChanged(String serviceName) {
        try {
            List<String> addressList = client.getChildren().forPath("/" + serviceName);
            Result<Void> result = refresh(serviceName, addressList);
            if (result.isSuccess()) {
                logger.info("服务 {} 的节点已通过监听器更新: {}", serviceName, addressList);
            } else {
                // 节点全部下线时保留最后一次的路由信息
                logger.warn("服务 {} 的节点更新被拒绝: {}", serviceName, result.getMessage());
            }
        } catch (Exception e) {
            logger.error("通过监听器更新节点失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        logger.info("正在关闭 ZKServiceCenter...");
        watcherMap.values().forEach(CuratorCache::close);
        watcherMap.clear();
        if (client != null) {
            client.close();
        }
        logger.info("ZKServiceCenter 已成功关闭。");
    }
}
