/**
 * gRPC 名称解析器提供者
 *
 * @date 2026/10/17
 */
package com.minidisc.grpc;

import com.minidisc.core.discovery.DiscoveryClient;
import io.grpc.NameResolver;
import io.grpc.NameResolverProvider;
import io.grpc.NameResolverRegistry;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 支持 minidisc://name 和 minidisc://name?label1=value1&amp;label2=value2 形式的目标
 * 不再使用时调用 {@link #close()} 注销并释放后台线程
 *
 * <pre>
 * MinidiscNameResolverProvider provider = MinidiscNameResolverProvider.register(minidisc.getDiscoveryClient());
 * ManagedChannel channel = ManagedChannelBuilder.forTarget("minidisc://api?env=prod")
 *     .usePlaintext()
 *     .build();
 * ...
 * channel.shutdown();
 * provider.close();
 * </pre>
 */
public class MinidiscNameResolverProvider extends NameResolverProvider implements AutoCloseable {

    public static final String SCHEME = "minidisc";

    private static final int PRIORITY = 5;

    private final DiscoveryClient discoveryClient;

    // 通道未提供 offload executor 时使用
    private final ExecutorService fallbackExecutor;

    public MinidiscNameResolverProvider(DiscoveryClient discoveryClient) {
        this.discoveryClient = discoveryClient;
        this.fallbackExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("minidisc-resolver", true));
    }

    /**
     * 注册到默认的 NameResolverRegistry，需在创建任何 gRPC 通道之前调用
     */
    public static MinidiscNameResolverProvider register(DiscoveryClient discoveryClient) {
        MinidiscNameResolverProvider provider = new MinidiscNameResolverProvider(discoveryClient);
        NameResolverRegistry.getDefaultRegistry().register(provider);
        return provider;
    }

    @Override
    public NameResolver newNameResolver(URI targetUri, NameResolver.Args args) {
        if (!SCHEME.equals(targetUri.getScheme())) {
            return null;
        }
        String name = targetUri.getAuthority();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Missing service name in target " + targetUri);
        }
        Executor executor = args.getOffloadExecutor() != null ? args.getOffloadExecutor() : fallbackExecutor;
        return new MinidiscNameResolver(discoveryClient, name, parseLabels(targetUri.getRawQuery()), executor);
    }

    static Map<String, String> parseLabels(String rawQuery) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return labels;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            // 重复的键以第一次出现为准
            labels.putIfAbsent(key, value);
        }
        return labels;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    @Override
    public String getDefaultScheme() {
        return SCHEME;
    }

    @Override
    protected boolean isAvailable() {
        return true;
    }

    @Override
    protected int priority() {
        return PRIORITY;
    }

    /**
     * 从默认 NameResolverRegistry 注销，并停止后台解析线程
     */
    @Override
    public void close() {
        NameResolverRegistry.getDefaultRegistry().deregister(this);
        fallbackExecutor.shutdownNow();
    }
}
