/**
 * 服务发现客户端
 *
 * @date 2026/10/14
 */
package com.minidisc.core.discovery;

import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.common.exception.AddressSourceException;
import com.minidisc.common.exception.NoMatchingServiceException;
import com.minidisc.common.exception.RegistryProtocolException;
import com.minidisc.common.exception.RegistryUnreachableException;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Service;
import com.minidisc.common.source.AddressSource;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 分散-聚集查询网络上所有注册表
 *
 * 对每个在线地址并发请求一次 /services（各自受超时约束），
 * 结果按地址枚举顺序合并，与完成顺序无关。
 */
public class DiscoveryClient implements AutoCloseable {

    private final AddressSource addressSource;
    private final RegistryClient registryClient;
    private final int discoveryPort;
    private final RegistryLogger logger;
    private final ExecutorService fetchExecutor;

    public DiscoveryClient(MinidiscConfig config, AddressSource addressSource,
                           RegistryClient registryClient, RegistryLogger logger) {
        this.addressSource = addressSource;
        this.registryClient = registryClient;
        this.discoveryPort = config.getDiscoveryPort();
        this.logger = logger;
        this.fetchExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("minidisc-discovery", true));
    }

    /**
     * 查询并合并网络上所有注册表广播的服务
     *
     * 单个对端失败只会被跳过，只有地址枚举失败才会让整个查询失败。
     *
     * @return 合并后的服务列表
     * @throws AddressSourceException 无法获取在线地址
     */
    public List<Service> listServices() {
        List<Inet4Address> addresses = addressSource.status().allAddresses();

        List<CompletableFuture<List<Service>>> fetches = new ArrayList<>(addresses.size());
        for (Inet4Address address : addresses) {
            AddrPort registry = new AddrPort(address, discoveryPort);
            fetches.add(CompletableFuture.supplyAsync(() -> fetchOrSkip(registry), fetchExecutor));
        }

        // 等待全部完成后按地址顺序拼接
        CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0])).join();
        List<Service> results = new ArrayList<>();
        for (CompletableFuture<List<Service>> fetch : fetches) {
            results.addAll(fetch.join());
        }
        return results;
    }

    /**
     * 按合并顺序返回第一个名称相同且标签为其子集的服务地址
     *
     * @param name 服务名称
     * @param labelFilter 需要匹配的标签，可为null
     * @return 服务地址
     * @throws NoMatchingServiceException 没有匹配的服务
     */
    public AddrPort findService(String name, Map<String, String> labelFilter) {
        for (Service service : listServices()) {
            if (ServiceMatcher.matches(service, name, labelFilter)) {
                return service.getAddrPort();
            }
        }
        throw new NoMatchingServiceException("No matching service found: name=" + name + ", labels="
            + (labelFilter == null ? Collections.emptyMap() : labelFilter));
    }

    private List<Service> fetchOrSkip(AddrPort registry) {
        try {
            return registryClient.fetchServices(registry);
        } catch (RegistryUnreachableException e) {
            logger.debug("连接注册表失败 {}: {}", registry, e.getMessage());
        } catch (RegistryProtocolException e) {
            logger.warn("获取注册表服务列表出错 {}: {}", registry, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("获取注册表服务列表时发生异常 {}", registry, e);
        }
        return Collections.emptyList();
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }
}
