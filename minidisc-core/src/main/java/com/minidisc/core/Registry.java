/**
 * 注册表句柄
 *
 * @date 2026/10/15
 */
package com.minidisc.core;

import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Service;
import com.minidisc.core.election.RegistryLifecycleController;
import com.minidisc.core.election.RegistryState;
import com.minidisc.core.registry.ServiceDirectory;

import java.net.Inet4Address;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 运行中的本地注册表
 *
 * 目录修改立即生效，与当前是 leader 还是 delegate 无关；
 * 角色切换期间目录内容保持不变。
 */
public class Registry implements AutoCloseable {

    private final ServiceDirectory directory;
    private final RegistryLifecycleController controller;

    Registry(ServiceDirectory directory, RegistryLifecycleController controller) {
        this.directory = directory;
        this.controller = controller;
    }

    /**
     * 启动时读取的本机私有网络地址
     */
    public Inet4Address getLocalAddress() {
        return directory.getLocalAddress();
    }

    public void advertise(int port, String name, Map<String, String> labels) {
        directory.advertise(port, name, labels);
    }

    public void advertiseRemote(AddrPort addrPort, String name, Map<String, String> labels) {
        directory.advertiseRemote(addrPort, name, labels);
    }

    public void unlist(int port) {
        directory.unlist(port);
    }

    public void unlistRemote(AddrPort addrPort) {
        directory.unlistRemote(addrPort);
    }

    /**
     * 本注册表直接持有的服务（不含 delegate 的服务）
     */
    public List<Service> services() {
        return directory.services();
    }

    public RegistryState state() {
        return controller.state();
    }

    public boolean awaitState(RegistryState target, Duration timeout) throws InterruptedException {
        return controller.awaitState(target, timeout);
    }

    public CompletableFuture<Void> terminationFuture() {
        return controller.terminationFuture();
    }

    @Override
    public void close() {
        controller.close();
    }
}
