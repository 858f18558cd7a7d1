package performance;

import client.serviceCenter.balance.LoadBalance;
import client.serviceCenter.balance.LoadBalanceInfo;
import client.serviceCenter.balance.LoadBalanceSelectorConfig;
import client.serviceCenter.balance.SelectorInfo;
import client.serviceCenter.balance.impl.ModuloHashLoadBalance;
import common.naming.Endpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("LoadBalance Performance Test")
class LoadBalancePerformanceTest {

    private static final int ADDRESS_COUNT = 100;
    private static final int THREAD_COUNT = 10;
    private static final int REQUESTS_PER_THREAD = 100_000;
    private static final int TOTAL_REQUESTS = THREAD_COUNT * REQUESTS_PER_THREAD;

    private List<Endpoint> endpoints;
    private String serviceName = "com.test.PerformanceService";

    @BeforeEach
    void setUp() {
        endpoints = new ArrayList<>();
        for (int i = 0; i < ADDRESS_COUNT; i++) {
            endpoints.add(Endpoint.healthy("192.168.0." + i, 8080));
        }
    }

    @Test
    @DisplayName("ModuloHashLoadBalance Performance")
    void testModuloHashLoadBalance() throws InterruptedException {
        LoadBalance loadBalance = new ModuloHashLoadBalance();
        loadBalance.update(info(endpoints));
        runPerformanceTest("ModuloHashLoadBalance", loadBalance, false);
    }

    @Test
    @DisplayName("ModuloHashLoadBalance Performance With Concurrent Updates")
    void testModuloHashLoadBalanceWithUpdates() throws InterruptedException {
        LoadBalance loadBalance = new ModuloHashLoadBalance();
        loadBalance.update(info(endpoints));
        runPerformanceTest("ModuloHashLoadBalance+Update", loadBalance, true);
    }

    private void runPerformanceTest(String name, LoadBalance loadBalance, boolean withUpdates) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch latch = new CountDownLatch(THREAD_COUNT);
        AtomicLong totalTimeNs = new AtomicLong(0);
        Map<Endpoint, Integer> distribution = new ConcurrentHashMap<>();

        System.out.println("Starting performance test for: " + name);
        long startTime = System.nanoTime();

        for (int i = 0; i < THREAD_COUNT; i++) {
            final boolean updater = withUpdates && i == 0;
            executor.submit(() -> {
                long threadTotalTime = 0;
                try {
                    for (int j = 0; j < REQUESTS_PER_THREAD; j++) {
                        if (updater && j % 10_000 == 0) {
                            // 推送内容相同的新列表，走未变化分支
                            loadBalance.update(info(new ArrayList<>(endpoints)));
                        }
                        long start = System.nanoTime();
                        Endpoint endpoint = loadBalance.next(serviceName).getData();
                        long end = System.nanoTime();
                        threadTotalTime += (end - start);

                        distribution.merge(endpoint, 1, Integer::sum);
                    }
                } finally {
                    totalTimeNs.addAndGet(threadTotalTime);
                    latch.countDown();
                }
            });
        }

        latch.await();
        long endTime = System.nanoTime();
        long durationMs = Math.max(1, (endTime - startTime) / 1_000_000);

        double avgLatencyNs = (double) totalTimeNs.get() / TOTAL_REQUESTS;
        double tps = (double) TOTAL_REQUESTS / durationMs * 1000;

        System.out.printf("[%s] Total Requests: %d%n", name, TOTAL_REQUESTS);
        System.out.printf("[%s] Total Time: %d ms%n", name, durationMs);
        System.out.printf("[%s] TPS: %.2f%n", name, tps);
        System.out.printf("[%s] Avg Latency: %.2f ns%n", name, avgLatencyNs);

        double mean = (double) TOTAL_REQUESTS / ADDRESS_COUNT;
        double variance = distribution.values().stream()
                .mapToDouble(count -> Math.pow(count - mean, 2))
                .sum() / ADDRESS_COUNT;
        double stdDev = Math.sqrt(variance);

        System.out.printf("[%s] Distribution StdDev: %.2f (Lower is better)%n", name, stdDev);
        System.out.println("--------------------------------------------------");

        // 轮询没有丢失计数时，总请求数是节点数的整数倍，分布完全均匀
        assertEquals(0.0, stdDev, 1e-9, "轮询分布应完全均匀");

        executor.shutdown();
    }

    private LoadBalanceInfo info(List<Endpoint> list) {
        SelectorInfo selectorInfo = SelectorInfo.builder()
                .name(serviceName)
                .extendSelectInfo(LoadBalanceSelectorConfig.builder().hashArgs(List.of(0)).build())
                .build();
        return new LoadBalanceInfo(selectorInfo, list);
    }
}
