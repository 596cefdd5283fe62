/**
 * 命令行工具Bean配置
 *
 * @date 2026/10/17
 */
package com.minidisc.cli.config;

import com.minidisc.cli.command.MdCommandRunner;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.logging.Slf4jRegistryLogger;
import com.minidisc.common.source.AddressSource;
import com.minidisc.common.source.StaticAddressSource;
import com.minidisc.core.Minidisc;
import com.minidisc.core.tailscale.TailscaleAddressSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 创建 Minidisc 及其依赖
 */
@Slf4j
@Configuration
public class MinidiscCliConfiguration {

    @Bean
    public RegistryLogger registryLogger() {
        return new Slf4jRegistryLogger("com.minidisc");
    }

    /**
     * 按配置选择地址源
     */
    @Bean
    public AddressSource addressSource(MinidiscProperties properties) {
        if (properties.getAddressSource() == MinidiscProperties.AddressSourceType.STATIC) {
            MinidiscProperties.Static source = properties.getStaticSource();
            if (source.getLocalAddress() == null) {
                throw new IllegalStateException("minidisc.static-source.local-address is required");
            }
            log.debug("使用静态地址源: local={}, peers={}", source.getLocalAddress(), source.getPeerAddresses());
            return StaticAddressSource.of(source.getLocalAddress(),
                source.getPeerAddresses().toArray(new String[0]));
        }
        log.debug("使用 Tailscale 地址源: {}", properties.getTailscale().getSocketPath());
        return new TailscaleAddressSource(Path.of(properties.getTailscale().getSocketPath()));
    }

    @Bean(destroyMethod = "close")
    public Minidisc minidisc(MinidiscProperties properties, AddressSource addressSource, RegistryLogger registryLogger) {
        return new Minidisc(properties, addressSource, registryLogger);
    }

    @Bean
    public MdCommandRunner mdCommandRunner(Minidisc minidisc) {
        return new MdCommandRunner(minidisc, System.out, System.err);
    }
}
