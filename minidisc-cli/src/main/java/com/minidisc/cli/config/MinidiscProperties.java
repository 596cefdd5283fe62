/**
 * Minidisc配置属性
 *
 * @date 2026/10/17
 */
package com.minidisc.cli.config;

import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.core.tailscale.TailscaleAddressSource;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Minidisc配置属性 - Spring Boot配置绑定
 * 继承MinidiscConfig复用注册表和发现相关配置，额外增加地址源的选择
 */
@Data
@EqualsAndHashCode(callSuper = true)
@Component
@ConfigurationProperties(prefix = "minidisc")
public class MinidiscProperties extends MinidiscConfig {

    /**
     * 在线地址的来源
     */
    private AddressSourceType addressSource = AddressSourceType.TAILSCALE;

    private Tailscale tailscale = new Tailscale();

    private Static staticSource = new Static();

    public enum AddressSourceType {
        TAILSCALE,
        STATIC
    }

    @Data
    public static class Tailscale {

        /**
         * tailscaled 本地 API 的 unix socket
         */
        private String socketPath = TailscaleAddressSource.DEFAULT_SOCKET_PATH;
    }

    @Data
    public static class Static {

        /**
         * 本节点地址
         */
        private String localAddress;

        /**
         * 在线对端地址，按查询顺序排列
         */
        private List<String> peerAddresses = new ArrayList<>();
    }
}
