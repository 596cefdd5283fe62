/**
 * leader 存活看门狗
 *
 * @date 2026/10/15
 */
package com.minidisc.core.election;

import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.core.discovery.RegistryClient;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * delegate 周期性探测同主机 leader 的 /ping
 * 探测失败时完成 {@link #leaderLost()}，由控制器决定如何处理
 */
public class LeaderWatchdog {

    private final RegistryClient registryClient;
    private final AddrPort leader;
    private final Duration probeInterval;
    private final ScheduledExecutorService scheduler;
    private final RegistryLogger logger;

    private final CompletableFuture<Void> leaderLost = new CompletableFuture<>();
    private ScheduledFuture<?> tick;

    public LeaderWatchdog(RegistryClient registryClient, AddrPort leader, Duration probeInterval,
                          ScheduledExecutorService scheduler, RegistryLogger logger) {
        this.registryClient = registryClient;
        this.leader = leader;
        this.probeInterval = probeInterval;
        this.scheduler = scheduler;
        this.logger = logger;
    }

    /**
     * 开始周期探测
     *
     * @return leader 丢失时完成的 future
     */
    public synchronized CompletableFuture<Void> start() {
        if (tick == null) {
            long intervalMs = probeInterval.toMillis();
            tick = scheduler.scheduleWithFixedDelay(this::probe, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        return leaderLost;
    }

    public CompletableFuture<Void> leaderLost() {
        return leaderLost;
    }

    /**
     * 停止探测，不会完成 leaderLost
     */
    public synchronized void cancel() {
        if (tick != null) {
            tick.cancel(false);
        }
    }

    void probe() {
        if (leaderLost.isDone()) {
            return;
        }
        if (!registryClient.ping(leader)) {
            logger.info("leader 不可达: {}", leader);
            leaderLost.complete(null);
            cancel();
        }
    }
}
