/**
 * Minidisc配置
 *
 * @date 2026/10/12
 */
package com.minidisc.common.config;

import lombok.Data;

import java.time.Duration;

/**
 * 服务发现的基础配置
 * Spring Boot 应用通过子类绑定 application.yml 中的 minidisc 前缀
 */
@Data
public class MinidiscConfig {

    /**
     * 默认的发现端口
     */
    public static final int DEFAULT_DISCOVERY_PORT = 28004;

    /**
     * 每台主机上竞争的固定发现端口
     */
    private int discoveryPort = DEFAULT_DISCOVERY_PORT;

    /**
     * 单个对端 /services 请求的超时时间
     */
    private Duration fetchTimeout = Duration.ofSeconds(2);

    /**
     * leader 存活探测超时时间
     */
    private Duration pingTimeout = Duration.ofSeconds(1);

    /**
     * delegate 注册请求超时时间
     */
    private Duration registerTimeout = Duration.ofSeconds(2);

    /**
     * delegate 探测 leader 的间隔
     */
    private Duration probeInterval = Duration.ofSeconds(5);

    /**
     * delegate 注册失败后的重试等待时间
     */
    private Duration restartBackoff = Duration.ofSeconds(10);

    /**
     * 私有网络地址段（CGNAT）
     */
    private String memberNetwork = "100.64.0.0/10";

    /**
     * 每个注册表服务器的IO线程数
     */
    private int ioThreads = 2;

    /**
     * 执行协议处理器的线程数，/services 会在这些线程上串行请求 delegate
     */
    private int handlerThreads = 4;
}
