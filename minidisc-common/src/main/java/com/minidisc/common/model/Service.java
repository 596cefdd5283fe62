/**
 * 可发现的服务
 *
 * @date 2026/10/12
 */
package com.minidisc.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 网络上的一个服务端点
 * 创建后不可变，缺失的labels统一为空映射
 */
@Getter
@EqualsAndHashCode
public final class Service {

    private final String name;
    private final Map<String, String> labels;
    private final AddrPort addrPort;

    @JsonCreator
    public Service(@JsonProperty("name") String name,
                   @JsonProperty("labels") Map<String, String> labels,
                   @JsonProperty("addrPort") AddrPort addrPort) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (addrPort == null) {
            throw new IllegalArgumentException("addrPort must not be null");
        }
        this.name = name;
        this.labels = labels == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        this.addrPort = addrPort;
    }

    @Override
    public String toString() {
        return "Service{name='" + name + "', labels=" + labels + ", addrPort=" + addrPort + '}';
    }
}
