package client.serviceCenter.balance.impl;

import client.serviceCenter.balance.EndpointDiffer;
import client.serviceCenter.balance.LoadBalance;
import client.serviceCenter.balance.LoadBalanceInfo;
import client.serviceCenter.balance.LoadBalanceSelectorConfig;
import client.serviceCenter.balance.SelectorInfo;
import client.serviceCenter.balance.hash.HashFunction;
import client.serviceCenter.balance.hash.HashKeyGenerator;
import common.naming.Endpoint;
import common.result.ErrorCode;
import common.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 取模哈希负载均衡。
 * <p>
 * 节点列表变化时，用路由属性拼接出的键计算哈希，对节点数取模作为轮询起点；
 * 之后每次调用对计数器原子加一，再对节点数取模得到下标。
 * <p>
 * 路由表由一把读写锁保护：更新持有写锁完成比较与整体替换，选择只持有读锁，
 * 计数器本身是原子变量，多个读者可以并发推进。
 */
public class ModuloHashLoadBalance implements LoadBalance {
    private static final Logger logger = LoggerFactory.getLogger(ModuloHashLoadBalance.class);

    // key 是服务名称
    private final Map<String, RouterEntry> routerTable = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();

    @Override
    public Result<Void> update(LoadBalanceInfo info) {
        if (info == null || info.getInfo() == null || info.getEndpoints() == null
                || info.getEndpoints().isEmpty()) {
            logger.error("服务节点信息为空，忽略本次更新");
            return Result.fail(ErrorCode.INVALID_INPUT, "服务节点信息为空");
        }
        SelectorInfo selectorInfo = info.getInfo();
        String serviceName = selectorInfo.getName();
        if (serviceName == null || serviceName.isBlank()) {
            logger.error("服务名称为空，忽略本次更新");
            return Result.fail(ErrorCode.INVALID_INPUT, "服务名称为空");
        }
        List<Endpoint> observed = info.getEndpoints();
        if (observed.stream().anyMatch(Objects::isNull)) {
            logger.error("服务[{}]的节点列表包含空节点，忽略本次更新", serviceName);
            return Result.fail(ErrorCode.INVALID_INPUT, "节点列表包含空节点");
        }

        LoadBalanceSelectorConfig config = selectorConfigOf(selectorInfo);

        writeLock.lock();
        try {
            RouterEntry cached = routerTable.get(serviceName);
            if (!EndpointDiffer.isDifferent(cached == null ? null : cached.endpoints, observed)) {
                logger.debug("服务[{}]节点列表未变化，保留当前轮询位置", serviceName);
                return Result.success();
            }

            HashFunction hashFunction = HashFunction.of(config.getHashFunc());
            String key = HashKeyGenerator.generate(selectorInfo, config.getHashArgs());
            long seed = Long.remainderUnsigned(hashFunction.hash(key), observed.size());
            routerTable.put(serviceName, new RouterEntry(observed, seed));
            logger.info("服务[{}]节点列表发生变化或首次建立，节点数 {}，哈希算法 {}，轮询起点 {}",
                    serviceName, observed.size(), hashFunction.getFuncName(), seed);
            return Result.success();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Result<Endpoint> next(String serviceName) {
        if (serviceName == null) {
            return Result.fail(ErrorCode.INVALID_INPUT, "服务名称为空");
        }

        readLock.lock();
        try {
            RouterEntry entry = routerTable.get(serviceName);
            if (entry == null) {
                logger.error("服务[{}]的路由信息不存在", serviceName);
                return Result.fail(ErrorCode.NOT_FOUND, "服务[" + serviceName + "]的路由信息不存在");
            }
            int size = entry.endpoints.size();
            if (size < 1) {
                logger.error("服务[{}]的节点列表为空", serviceName);
                return Result.fail(ErrorCode.EMPTY_SET, "服务[" + serviceName + "]的节点列表为空");
            }
            long id = entry.counter.getAndIncrement();
            int index = (int) Long.remainderUnsigned(id, size);
            return Result.success(entry.endpoints.get(index));
        } finally {
            readLock.unlock();
        }
    }

    private static LoadBalanceSelectorConfig selectorConfigOf(SelectorInfo selectorInfo) {
        Object extend = selectorInfo.getExtendSelectInfo();
        if (extend instanceof LoadBalanceSelectorConfig) {
            return (LoadBalanceSelectorConfig) extend;
        }
        return LoadBalanceSelectorConfig.builder().build();
    }

    @Override
    public BalanceType getType() {
        return BalanceType.MODULO_HASH;
    }

    /**
     * 单个服务的路由信息。节点列表整体替换，只有计数器会被原地修改。
     */
    private static class RouterEntry {
        private final List<Endpoint> endpoints;
        private final AtomicLong counter;

        RouterEntry(List<Endpoint> endpoints, long seed) {
            this.endpoints = List.copyOf(endpoints);
            this.counter = new AtomicLong(seed);
        }
    }
}
