package com.minidisc.core.registry;

import java.net.BindException;
import java.net.InetSocketAddress;

/**
 * 在指定地址上启动注册表服务器
 */
@FunctionalInterface
public interface RegistryServerFactory {

    /**
     * 绑定并开始服务
     *
     * @param address 监听地址，端口为0时由系统分配
     * @return 已在服务的服务器
     * @throws BindException 端口已被占用或无法绑定
     */
    RegistryServer bind(InetSocketAddress address) throws BindException;
}
