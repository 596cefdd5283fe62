/**
 * gRPC 名称解析器
 *
 * @date 2026/10/17
 */
package com.minidisc.grpc;

import com.minidisc.common.model.AddrPort;
import com.minidisc.core.discovery.DiscoveryClient;
import io.grpc.EquivalentAddressGroup;
import io.grpc.NameResolver;
import io.grpc.Status;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 把 minidisc://name?label=value 解析为一个服务地址
 *
 * 每次 start/refresh 都在后台执行一次完整的服务发现，同一时刻最多只有一次在进行。
 */
public class MinidiscNameResolver extends NameResolver {

    private final DiscoveryClient discoveryClient;
    private final String serviceName;
    private final Map<String, String> labelFilter;
    private final Executor executor;

    private final AtomicBoolean resolving = new AtomicBoolean(false);
    private volatile boolean shutdown;
    private volatile Listener2 listener;

    MinidiscNameResolver(DiscoveryClient discoveryClient, String serviceName,
                         Map<String, String> labelFilter, Executor executor) {
        this.discoveryClient = discoveryClient;
        this.serviceName = serviceName;
        this.labelFilter = Collections.unmodifiableMap(labelFilter);
        this.executor = executor;
    }

    @Override
    public String getServiceAuthority() {
        return serviceName;
    }

    Map<String, String> getLabelFilter() {
        return labelFilter;
    }

    @Override
    public void start(Listener2 listener) {
        if (this.listener != null) {
            throw new IllegalStateException("Resolver already started");
        }
        this.listener = listener;
        resolve();
    }

    @Override
    public void refresh() {
        if (listener == null) {
            throw new IllegalStateException("Resolver not started");
        }
        resolve();
    }

    private void resolve() {
        if (shutdown || !resolving.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::doResolve);
        } catch (RejectedExecutionException e) {
            resolving.set(false);
            reportError(e);
        }
    }

    private void doResolve() {
        try {
            AddrPort address = discoveryClient.findService(serviceName, labelFilter);
            if (shutdown) {
                return;
            }
            listener.onResult(ResolutionResult.newBuilder()
                .setAddresses(Collections.singletonList(new EquivalentAddressGroup(address.toSocketAddress())))
                .build());
        } catch (RuntimeException e) {
            // 包括发现客户端关闭后的 RejectedExecutionException，通道不能一直等待结果
            reportError(e);
        } finally {
            resolving.set(false);
        }
    }

    private void reportError(Throwable cause) {
        if (!shutdown) {
            listener.onError(Status.UNAVAILABLE
                .withDescription("Cannot resolve minidisc service " + serviceName + ": " + cause.getMessage())
                .withCause(cause));
        }
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }
}
