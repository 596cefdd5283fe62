/**
 * Minidisc 入口
 *
 * @date 2026/10/15
 */
package com.minidisc.core;

import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Ipv4Prefix;
import com.minidisc.common.model.Service;
import com.minidisc.common.source.AddressSource;
import com.minidisc.core.discovery.DiscoveryClient;
import com.minidisc.core.discovery.RegistryClient;
import com.minidisc.core.election.RegistryLifecycleController;
import com.minidisc.core.election.Sleeper;
import com.minidisc.core.registry.RegistryHttpHandler;
import com.minidisc.core.registry.RegistryServer;
import com.minidisc.core.registry.ServiceDirectory;

import java.net.Inet4Address;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 零配置服务发现
 *
 * 消费者只需要 {@link #listServices()} / {@link #findService(String, Map)}；
 * 提供者通过 {@link #startRegistry()} 启动本地注册表并广播服务。
 * <pre>
 * try (Minidisc minidisc = new Minidisc(config, addressSource, logger)) {
 *     Registry registry = minidisc.startRegistry();
 *     registry.advertise(8080, "api", Map.of("env", "prod"));
 *     AddrPort api = minidisc.findService("api", Map.of("env", "prod"));
 * }
 * </pre>
 */
public class Minidisc implements AutoCloseable {

    private final MinidiscConfig config;
    private final AddressSource addressSource;
    private final RegistryLogger logger;
    private final RegistryClient registryClient;
    private final DiscoveryClient discoveryClient;
    private final List<Registry> registries = new CopyOnWriteArrayList<>();

    public Minidisc(MinidiscConfig config, AddressSource addressSource, RegistryLogger logger) {
        this.config = config;
        this.addressSource = addressSource;
        this.logger = logger;
        this.registryClient = new RegistryClient(config);
        this.discoveryClient = new DiscoveryClient(config, addressSource, registryClient, logger);
    }

    public Minidisc(MinidiscConfig config, AddressSource addressSource) {
        this(config, addressSource, RegistryLogger.noop());
    }

    public List<Service> listServices() {
        return discoveryClient.listServices();
    }

    public AddrPort findService(String name, Map<String, String> labelFilter) {
        return discoveryClient.findService(name, labelFilter);
    }

    public DiscoveryClient getDiscoveryClient() {
        return discoveryClient;
    }

    /**
     * 启动本地注册表，立即返回；选举在后台线程中进行
     *
     * 本机地址只在此时读取一次。
     */
    public Registry startRegistry() {
        Inet4Address localAddress = addressSource.status().getLocalAddress();
        ServiceDirectory directory = new ServiceDirectory(localAddress,
            Ipv4Prefix.parse(config.getMemberNetwork()), logger);
        RegistryHttpHandler handler = new RegistryHttpHandler(directory, registryClient, logger);
        RegistryLifecycleController controller = new RegistryLifecycleController(directory,
            address -> RegistryServer.bind(address, handler, config),
            registryClient, config, Sleeper.SYSTEM, logger);
        Registry registry = new Registry(directory, controller);
        registries.add(registry);
        // 注册表被调用方单独关闭或因错误终止后不再持有
        controller.terminationFuture().whenComplete((ignored, error) -> registries.remove(registry));
        controller.start();
        return registry;
    }

    int activeRegistries() {
        return registries.size();
    }

    @Override
    public void close() {
        for (Registry registry : registries) {
            registry.close();
        }
        registries.clear();
        discoveryClient.close();
        registryClient.close();
    }
}
