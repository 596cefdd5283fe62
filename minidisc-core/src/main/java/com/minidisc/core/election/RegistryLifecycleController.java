/**
 * 注册表选举与生命周期控制器
 *
 * @date 2026/10/15
 */
package com.minidisc.core.election;

import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.common.exception.RegistryBindException;
import com.minidisc.common.exception.RegistryProtocolException;
import com.minidisc.common.exception.RegistryUnreachableException;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.core.discovery.RegistryClient;
import com.minidisc.core.registry.RegistryServer;
import com.minidisc.core.registry.RegistryServerFactory;
import com.minidisc.core.registry.ServiceDirectory;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.BindException;
import java.net.Inet4Address;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 决定本节点是 leader 还是 delegate，并在故障后自动恢复
 *
 * 谁能绑定发现端口谁就是 leader，端口本身就是主机级的互斥锁，不需要选举消息：
 * <ol>
 *   <li>绑定发现端口成功：成为 leader，一直服务下去</li>
 *   <li>绑定失败：在任意端口上启动 delegate 服务器，并向同主机的 leader 注册</li>
 *   <li>注册失败：关闭 delegate 服务器，等待退避时间后重试</li>
 *   <li>注册成功：周期探测 leader，leader 消失时优雅关闭 delegate 并重新竞争</li>
 *   <li>连任意端口都无法绑定：环境错误，不再重试</li>
 * </ol>
 */
public class RegistryLifecycleController implements AutoCloseable {

    private static final long CLOSE_TIMEOUT_MS = 10000;

    private final ServiceDirectory directory;
    private final Inet4Address localAddress;
    private final RegistryServerFactory serverFactory;
    private final RegistryClient registryClient;
    private final MinidiscConfig config;
    private final Sleeper sleeper;
    private final RegistryLogger logger;

    private final ExecutorService electionExecutor;
    private final ScheduledExecutorService watchdogScheduler;

    private final Object stateMonitor = new Object();
    private RegistryState state = RegistryState.UNBOUND;

    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopping = false;
    private volatile RegistryServer currentServer;

    public RegistryLifecycleController(ServiceDirectory directory, RegistryServerFactory serverFactory,
                                       RegistryClient registryClient, MinidiscConfig config,
                                       Sleeper sleeper, RegistryLogger logger) {
        this.directory = directory;
        this.localAddress = directory.getLocalAddress();
        this.serverFactory = serverFactory;
        this.registryClient = registryClient;
        this.config = config;
        this.sleeper = sleeper;
        this.logger = logger;
        this.electionExecutor = Executors.newSingleThreadExecutor(new DefaultThreadFactory("minidisc-election", true));
        this.watchdogScheduler = Executors.newSingleThreadScheduledExecutor(
            new DefaultThreadFactory("minidisc-watchdog", true));
    }

    /**
     * 在后台线程上启动选举循环
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            electionExecutor.execute(this::runElectionLoop);
        }
    }

    public RegistryState state() {
        synchronized (stateMonitor) {
            return state;
        }
    }

    /**
     * 等待进入指定状态
     *
     * @param target 目标状态
     * @param timeout 最长等待时间
     * @return 是否进入了目标状态；进入其它终止状态时提前返回 false
     */
    public boolean awaitState(RegistryState target, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateMonitor) {
            while (state != target) {
                if (state.isTerminal()) {
                    return false;
                }
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                stateMonitor.wait(remainingMs);
            }
            return true;
        }
    }

    /**
     * 选举循环结束时完成；无法绑定任何端口时以 {@link RegistryBindException} 异常完成
     */
    public CompletableFuture<Void> terminationFuture() {
        return termination;
    }

    private void runElectionLoop() {
        try {
            while (!stopping) {
                runOnce();
            }
        } catch (InterruptedException e) {
            if (!stopping) {
                logger.warn("选举循环被中断");
            }
            Thread.currentThread().interrupt();
        } catch (RegistryBindException e) {
            logger.error("无法绑定任何端口，注册表无法参与服务发现: {}", e.getMessage());
            finish(RegistryState.FAILED, e);
            return;
        } catch (RuntimeException e) {
            logger.error("选举循环异常退出", e);
            finish(RegistryState.FAILED, e);
            return;
        }
        finish(RegistryState.STOPPED, null);
    }

    private void finish(RegistryState finalState, Throwable failure) {
        RegistryServer server = currentServer;
        if (server != null) {
            server.shutdownGracefully();
            currentServer = null;
        }
        watchdogScheduler.shutdownNow();
        electionExecutor.shutdown();
        transition(finalState);
        if (failure == null) {
            termination.complete(null);
        } else {
            termination.completeExceptionally(failure);
        }
    }

    private void runOnce() throws InterruptedException {
        transition(RegistryState.UNBOUND);
        AddrPort leaderAddress = new AddrPort(localAddress, config.getDiscoveryPort());

        RegistryServer leaderServer = null;
        try {
            leaderServer = serverFactory.bind(leaderAddress.toSocketAddress());
        } catch (BindException e) {
            logger.debug("发现端口已被占用 {}: {}", leaderAddress, e.getMessage());
        }
        if (leaderServer != null) {
            runLeader(leaderServer);
            return;
        }

        RegistryServer delegateServer;
        try {
            delegateServer = serverFactory.bind(new InetSocketAddress(localAddress, 0));
        } catch (BindException e) {
            throw new RegistryBindException("Couldn't bind to any port on " + localAddress.getHostAddress(), e);
        }
        if (!runDelegate(delegateServer, leaderAddress) && !stopping) {
            logger.info("{} 秒后重启注册表", config.getRestartBackoff().getSeconds());
            sleeper.sleep(config.getRestartBackoff());
        }
    }

    private void runLeader(RegistryServer server) throws InterruptedException {
        if (!adopt(server)) {
            return;
        }
        transition(RegistryState.LEADER);
        logger.info("注册表以 leader 身份启动: {}", server.getBoundAddress());
        try {
            awaitAny(server.closeFuture());
        } finally {
            release(server);
            // 不再是 leader，旧的 delegate 会向新 leader 重新注册
            int dropped = directory.clearDelegates();
            if (dropped > 0) {
                logger.info("卸任 leader，清除 {} 个 delegate", dropped);
            }
        }
        if (!stopping) {
            logger.info("leader 服务器已退出，重新竞争发现端口");
        }
    }

    /**
     * @return true 表示正常结束（被看门狗或所有者关闭），false 表示需要退避后重试
     */
    private boolean runDelegate(RegistryServer server, AddrPort leaderAddress) throws InterruptedException {
        if (!adopt(server)) {
            return true;
        }
        transition(RegistryState.DELEGATE_ATTEMPT);
        AddrPort self = server.getBoundAddress();
        logger.info("发现端口已被占用，以 delegate 身份在 {} 上启动", self);

        try {
            registryClient.registerDelegate(leaderAddress, self);
        } catch (RegistryUnreachableException | RegistryProtocolException e) {
            logger.info("向 leader 注册失败: {}", e.getMessage());
            release(server);
            return false;
        }

        transition(RegistryState.DELEGATE_SERVING);
        logger.info("已注册为 leader {} 的 delegate", leaderAddress);
        LeaderWatchdog watchdog = new LeaderWatchdog(registryClient, leaderAddress,
            config.getProbeInterval(), watchdogScheduler, logger);
        try {
            CompletableFuture<Void> leaderLost = watchdog.start();
            awaitAny(leaderLost, server.closeFuture());
            if (leaderLost.isDone()) {
                logger.info("leader 不可达，停止 delegate: {}", self);
                return true;
            }
            if (stopping) {
                return true;
            }
            logger.warn("delegate 服务器意外退出: {}", self);
            return false;
        } finally {
            watchdog.cancel();
            // 等待处理中的请求完成后再释放监听 socket
            release(server);
        }
    }

    private boolean adopt(RegistryServer server) {
        currentServer = server;
        if (stopping) {
            release(server);
            return false;
        }
        return true;
    }

    private void release(RegistryServer server) {
        server.shutdownGracefully();
        if (currentServer == server) {
            currentServer = null;
        }
    }

    private static void awaitAny(CompletableFuture<?>... futures) throws InterruptedException {
        try {
            CompletableFuture.anyOf(futures).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected failure while serving", e.getCause());
        }
    }

    private void transition(RegistryState next) {
        RegistryState previous;
        synchronized (stateMonitor) {
            previous = state;
            if (previous == next) {
                return;
            }
            state = next;
            stateMonitor.notifyAll();
        }
        logger.debug("注册表状态变化: {} -> {}", previous, next);
    }

    /**
     * 停止选举循环，优雅关闭当前服务器
     */
    @Override
    public void close() {
        stopping = true;
        RegistryServer server = currentServer;
        if (server != null) {
            server.shutdownGracefully();
        }
        if (!started.get()) {
            finish(RegistryState.STOPPED, null);
            return;
        }
        electionExecutor.shutdownNow();
        try {
            termination.get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.debug("注册表已因错误终止: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            logger.warn("等待注册表关闭超时");
        }
    }
}
