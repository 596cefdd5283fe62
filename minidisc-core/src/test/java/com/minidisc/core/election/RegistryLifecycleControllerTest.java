/**
 * 注册表选举与生命周期测试
 *
 * @date 2026/10/17
 */
package com.minidisc.core.election;

import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.common.exception.RegistryBindException;
import com.minidisc.common.exception.RegistryUnreachableException;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Ipv4Prefix;
import com.minidisc.common.model.Service;
import com.minidisc.core.discovery.RegistryClient;
import com.minidisc.core.registry.RegistryHttpHandler;
import com.minidisc.core.registry.RegistryServer;
import com.minidisc.core.registry.RegistryServerFactory;
import com.minidisc.core.registry.ServiceDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.BindException;
import java.net.Inet4Address;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * 在真实的回环地址上运行 leader 和 delegate
 */
class RegistryLifecycleControllerTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);
    private static final Inet4Address HOST = AddrPort.parseAddress("127.0.0.2");

    private MinidiscConfig config;
    private RegistryClient registryClient;
    private final List<AutoCloseable> cleanup = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        config = new MinidiscConfig();
        config.setDiscoveryPort(freePort());
        config.setProbeInterval(Duration.ofMillis(100));
        config.setPingTimeout(Duration.ofMillis(200));
        config.setRestartBackoff(Duration.ofMillis(100));
        config.setMemberNetwork("127.0.0.0/8");
        registryClient = new RegistryClient(config);
    }

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable closeable : cleanup) {
            closeable.close();
        }
        registryClient.close();
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private ServiceDirectory newDirectory() {
        return new ServiceDirectory(HOST, Ipv4Prefix.parse(config.getMemberNetwork()), RegistryLogger.noop());
    }

    private RegistryLifecycleController startController(ServiceDirectory directory) {
        RegistryHttpHandler handler = new RegistryHttpHandler(directory, registryClient, RegistryLogger.noop());
        RegistryLifecycleController controller = new RegistryLifecycleController(directory,
            address -> RegistryServer.bind(address, handler, config),
            registryClient, config, Sleeper.SYSTEM, RegistryLogger.noop());
        cleanup.add(controller);
        controller.start();
        return controller;
    }

    private AddrPort leaderAddress() {
        return new AddrPort(HOST, config.getDiscoveryPort());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + AWAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("条件未在 " + AWAIT + " 内满足");
            }
            Thread.sleep(20);
        }
    }

    /**
     * 发现端口总是被占用，delegate 服务器绑定到真实的随机端口并记录下来
     */
    private RegistryServerFactory occupiedDiscoveryPort(RegistryHttpHandler handler, List<RegistryServer> servers) {
        return address -> {
            if (address.getPort() == config.getDiscoveryPort()) {
                throw new BindException("Address already in use");
            }
            RegistryServer server = RegistryServer.bind(address, handler, config);
            servers.add(server);
            return server;
        };
    }

    private static List<String> names(List<Service> services) {
        return services.stream().map(Service::getName).toList();
    }

    @Test
    void testFirstRegistryBecomesLeader() throws Exception {
        ServiceDirectory directory = newDirectory();
        directory.advertise(42, "foo", null);

        RegistryLifecycleController controller = startController(directory);

        assertTrue(controller.awaitState(RegistryState.LEADER, AWAIT));
        assertTrue(registryClient.ping(leaderAddress()));
        assertEquals(List.of("foo"), names(registryClient.fetchServices(leaderAddress())));
    }

    @Test
    void testSecondRegistryBecomesDelegate() throws Exception {
        // Given
        ServiceDirectory leaderDirectory = newDirectory();
        leaderDirectory.advertise(42, "foo", null);
        RegistryLifecycleController leader = startController(leaderDirectory);
        assertTrue(leader.awaitState(RegistryState.LEADER, AWAIT));

        // When
        ServiceDirectory delegateDirectory = newDirectory();
        delegateDirectory.advertise(43, "bar", null);
        RegistryLifecycleController delegate = startController(delegateDirectory);

        // Then
        assertTrue(delegate.awaitState(RegistryState.DELEGATE_SERVING, AWAIT));
        assertEquals(1, leaderDirectory.delegates().size());
        assertEquals(List.of("foo", "bar"), names(registryClient.fetchServices(leaderAddress())));
    }

    @Test
    void testDelegateTakesOverWhenLeaderStops() throws Exception {
        // Given
        ServiceDirectory leaderDirectory = newDirectory();
        leaderDirectory.advertise(42, "foo", null);
        RegistryLifecycleController leader = startController(leaderDirectory);
        assertTrue(leader.awaitState(RegistryState.LEADER, AWAIT));

        ServiceDirectory delegateDirectory = newDirectory();
        delegateDirectory.advertise(43, "bar", null);
        RegistryLifecycleController delegate = startController(delegateDirectory);
        assertTrue(delegate.awaitState(RegistryState.DELEGATE_SERVING, AWAIT));

        // When
        leader.close();

        // Then
        assertEquals(RegistryState.STOPPED, leader.state());
        assertTrue(delegate.awaitState(RegistryState.LEADER, AWAIT));
        assertEquals(List.of("bar"), names(registryClient.fetchServices(leaderAddress())));
    }

    @Test
    void testStoppedDelegateIsDroppedByLeader() throws Exception {
        // Given
        ServiceDirectory leaderDirectory = newDirectory();
        leaderDirectory.advertise(42, "foo", null);
        RegistryLifecycleController leader = startController(leaderDirectory);
        assertTrue(leader.awaitState(RegistryState.LEADER, AWAIT));

        ServiceDirectory delegateDirectory = newDirectory();
        delegateDirectory.advertise(43, "bar", null);
        RegistryLifecycleController delegate = startController(delegateDirectory);
        assertTrue(delegate.awaitState(RegistryState.DELEGATE_SERVING, AWAIT));

        // When
        delegate.close();

        // Then: 下一次查询时 leader 发现 delegate 不可达并移除
        assertEquals(List.of("foo"), names(registryClient.fetchServices(leaderAddress())));
        assertTrue(leaderDirectory.delegates().isEmpty());
    }

    @Test
    void testDirectoryChangesAreVisibleImmediately() throws Exception {
        ServiceDirectory directory = newDirectory();
        RegistryLifecycleController controller = startController(directory);
        assertTrue(controller.awaitState(RegistryState.LEADER, AWAIT));

        directory.advertise(42, "foo", null);
        assertEquals(List.of("foo"), names(registryClient.fetchServices(leaderAddress())));

        directory.unlist(42);
        assertTrue(registryClient.fetchServices(leaderAddress()).isEmpty());
    }

    @Test
    void testFailsWhenNoPortCanBeBound() {
        RegistryServerFactory unbindable = address -> {
            throw new BindException("Address already in use");
        };
        RegistryLifecycleController controller = new RegistryLifecycleController(newDirectory(), unbindable,
            registryClient, config, Sleeper.SYSTEM, RegistryLogger.noop());
        cleanup.add(controller);

        controller.start();

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> controller.terminationFuture().get(10, TimeUnit.SECONDS));
        assertInstanceOf(RegistryBindException.class, e.getCause());
        assertEquals(RegistryState.FAILED, controller.state());
    }

    @Test
    void testBacksOffWhenRegistrationFails() throws Exception {
        // Given: 发现端口被占用，且 leader 无法注册
        RegistryClient failingClient = mock(RegistryClient.class);
        doThrow(new RegistryUnreachableException("connection refused"))
            .when(failingClient).registerDelegate(any(), any());
        RegistryHttpHandler handler = new RegistryHttpHandler(newDirectory(), failingClient, RegistryLogger.noop());
        List<RegistryServer> delegateServers = new ArrayList<>();
        RegistryServerFactory factory = address -> {
            if (address.getPort() == config.getDiscoveryPort()) {
                throw new BindException("Address already in use");
            }
            RegistryServer server = RegistryServer.bind(address, handler, config);
            delegateServers.add(server);
            return server;
        };
        BlockingQueue<Duration> sleeps = new LinkedBlockingQueue<>();
        Sleeper recording = duration -> {
            sleeps.add(duration);
            Thread.sleep(60_000);
        };
        RegistryLifecycleController controller = new RegistryLifecycleController(newDirectory(), factory,
            failingClient, config, recording, RegistryLogger.noop());
        cleanup.add(controller);

        // When
        controller.start();

        // Then
        assertEquals(config.getRestartBackoff(), sleeps.poll(10, TimeUnit.SECONDS));
        assertEquals(RegistryState.DELEGATE_ATTEMPT, controller.state());
        assertEquals(1, delegateServers.size());
        assertTrue(delegateServers.get(0).isShutdown());
        verify(failingClient).registerDelegate(any(), any());

        // close 会中断退避等待
        controller.close();
        assertEquals(RegistryState.STOPPED, controller.state());
        assertTrue(controller.terminationFuture().isDone());
    }

    @Test
    void testCloseBeforeStart() {
        RegistryLifecycleController controller = new RegistryLifecycleController(newDirectory(),
            address -> {
                throw new BindException("unused");
            },
            registryClient, config, Sleeper.SYSTEM, RegistryLogger.noop());

        controller.close();

        assertEquals(RegistryState.STOPPED, controller.state());
        assertTrue(controller.terminationFuture().isDone());
    }

    @Test
    void testBindToDelegatePortUsesLocalAddress() throws Exception {
        ServiceDirectory directory = newDirectory();
        List<InetSocketAddress> requested = new ArrayList<>();
        RegistryHttpHandler handler = new RegistryHttpHandler(directory, registryClient, RegistryLogger.noop());
        RegistryLifecycleController controller = new RegistryLifecycleController(directory,
            address -> {
                requested.add(address);
                return RegistryServer.bind(address, handler, config);
            },
            registryClient, config, Sleeper.SYSTEM, RegistryLogger.noop());
        cleanup.add(controller);

        controller.start();

        assertTrue(controller.awaitState(RegistryState.LEADER, AWAIT));
        assertEquals(new InetSocketAddress(HOST, config.getDiscoveryPort()), requested.get(0));
    }

    @Test
    void testInFlightRequestCompletesWhenDelegateStops() throws Exception {
        // Given
        ServiceDirectory leaderDirectory = newDirectory();
        RegistryLifecycleController leader = startController(leaderDirectory);
        assertTrue(leader.awaitState(RegistryState.LEADER, AWAIT));

        ServiceDirectory delegateDirectory = newDirectory();
        delegateDirectory.advertise(43, "bar", null);
        RegistryLifecycleController delegate = startController(delegateDirectory);
        assertTrue(delegate.awaitState(RegistryState.DELEGATE_SERVING, AWAIT));
        AddrPort delegateAddress = leaderDirectory.delegates().get(0);

        MinidiscConfig patient = new MinidiscConfig();
        patient.setFetchTimeout(Duration.ofSeconds(10));
        // 只接受连接从不响应的下级 delegate，让 /services 请求持续约 fetchTimeout
        try (ServerSocket hung = new ServerSocket(0, 50, HOST);
             RegistryClient patientClient = new RegistryClient(patient)) {
            delegateDirectory.addDelegate(new AddrPort(HOST, hung.getLocalPort()));
            CompletableFuture<List<Service>> inFlight =
                CompletableFuture.supplyAsync(() -> patientClient.fetchServices(delegateAddress));
            Thread.sleep(300);

            // When: leader 消失，看门狗关闭 delegate 服务器
            leader.close();

            // Then: 处理中的请求仍然得到完整响应
            assertEquals(List.of("bar"), names(inFlight.get(10, TimeUnit.SECONDS)));
            assertTrue(delegate.awaitState(RegistryState.LEADER, AWAIT));
        }
    }

    @Test
    void testDelegateServerExitBacksOff() throws Exception {
        // Given
        RegistryClient healthyLeader = mock(RegistryClient.class);
        when(healthyLeader.ping(any())).thenReturn(true);
        ServiceDirectory directory = newDirectory();
        RegistryHttpHandler handler = new RegistryHttpHandler(directory, healthyLeader, RegistryLogger.noop());
        List<RegistryServer> servers = new CopyOnWriteArrayList<>();
        BlockingQueue<Duration> sleeps = new LinkedBlockingQueue<>();
        Sleeper recording = duration -> {
            sleeps.add(duration);
            Thread.sleep(60_000);
        };
        RegistryLifecycleController controller = new RegistryLifecycleController(directory,
            occupiedDiscoveryPort(handler, servers), healthyLeader, config, recording, RegistryLogger.noop());
        cleanup.add(controller);
        controller.start();
        assertTrue(controller.awaitState(RegistryState.DELEGATE_SERVING, AWAIT));

        // When: delegate 服务器自行退出
        servers.get(0).shutdownGracefully();

        // Then
        assertEquals(config.getRestartBackoff(), sleeps.poll(10, TimeUnit.SECONDS));
        assertEquals(1, servers.size());
    }

    @Test
    void testLeaderLossRetriesWithoutBackoff() throws Exception {
        // Given: leader 注册成功但随后 ping 失败
        RegistryClient vanishingLeader = mock(RegistryClient.class);
        when(vanishingLeader.ping(any())).thenReturn(false);
        ServiceDirectory directory = newDirectory();
        RegistryHttpHandler handler = new RegistryHttpHandler(directory, vanishingLeader, RegistryLogger.noop());
        List<RegistryServer> servers = new CopyOnWriteArrayList<>();
        BlockingQueue<Duration> sleeps = new LinkedBlockingQueue<>();
        Sleeper recording = sleeps::add;
        RegistryLifecycleController controller = new RegistryLifecycleController(directory,
            occupiedDiscoveryPort(handler, servers), vanishingLeader, config, recording, RegistryLogger.noop());
        cleanup.add(controller);

        // When
        controller.start();

        // Then: 立即重新竞争，不经过退避
        awaitCondition(() -> servers.size() >= 2);
        assertTrue(sleeps.isEmpty());
        assertTrue(servers.get(0).isShutdown());
    }

    @Test
    void testLeaderForgetsDelegatesWhenServerDies() throws Exception {
        // Given
        ServiceDirectory directory = newDirectory();
        RegistryHttpHandler handler = new RegistryHttpHandler(directory, registryClient, RegistryLogger.noop());
        List<RegistryServer> servers = new CopyOnWriteArrayList<>();
        RegistryLifecycleController controller = new RegistryLifecycleController(directory,
            address -> {
                RegistryServer server = RegistryServer.bind(address, handler, config);
                servers.add(server);
                return server;
            },
            registryClient, config, Sleeper.SYSTEM, RegistryLogger.noop());
        cleanup.add(controller);
        controller.start();
        assertTrue(controller.awaitState(RegistryState.LEADER, AWAIT));
        directory.addDelegate(new AddrPort(HOST, 40001));

        // When: leader 服务器意外退出
        servers.get(0).shutdownGracefully();

        // Then: 重新成为 leader，旧的 delegate 不再保留
        awaitCondition(() -> servers.size() == 2 && controller.state() == RegistryState.LEADER);
        assertTrue(directory.delegates().isEmpty());
    }
}
