/**
 * 注册表线路协议JSON编解码器
 *
 * @date 2026/10/13
 */
package com.minidisc.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.minidisc.common.exception.RegistryProtocolException;
import com.minidisc.common.model.AddDelegateRequest;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于Jackson的线路格式编解码
 * 服务列表为 [{"name", "labels", "addrPort"}]，注册请求为 {"addrPort"}
 */
public final class ServiceJsonCodec {

    private static final ObjectMapper OBJECT_MAPPER;

    private static final TypeReference<List<Service>> SERVICE_LIST = new TypeReference<>() {
    };

    static {
        OBJECT_MAPPER = new ObjectMapper();

        // 忽略未知字段，兼容新版本对端
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        OBJECT_MAPPER.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    private ServiceJsonCodec() {
    }

    /**
     * 编码服务列表
     *
     * @param services 服务列表
     * @return UTF-8 JSON
     * @throws RegistryProtocolException 编码失败
     */
    public static byte[] encodeServices(List<Service> services) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(services);
        } catch (JsonProcessingException e) {
            throw new RegistryProtocolException("Failed to encode services", e);
        }
    }

    /**
     * 解码服务列表，JSON null 视为空列表
     *
     * @param body 响应体
     * @return 服务列表
     * @throws RegistryProtocolException 格式错误
     */
    public static List<Service> decodeServices(byte[] body) {
        List<Service> services;
        try {
            services = OBJECT_MAPPER.readValue(body, SERVICE_LIST);
        } catch (IOException | IllegalArgumentException e) {
            throw new RegistryProtocolException("Malformed service list: " + e.getMessage(), e);
        }
        if (services == null) {
            return Collections.emptyList();
        }
        if (services.contains(null)) {
            throw new RegistryProtocolException("Malformed service list: null entry");
        }
        return new ArrayList<>(services);
    }

    public static byte[] encodeAddDelegate(AddrPort addrPort) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(new AddDelegateRequest(addrPort));
        } catch (JsonProcessingException e) {
            throw new RegistryProtocolException("Failed to encode add-delegate request", e);
        }
    }

    /**
     * 解码 add-delegate 请求体
     *
     * @param body 请求体
     * @return delegate 地址
     * @throws RegistryProtocolException 格式错误或缺少 addrPort
     */
    public static AddrPort decodeAddDelegate(byte[] body) {
        AddDelegateRequest request;
        try {
            request = OBJECT_MAPPER.readValue(body, AddDelegateRequest.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new RegistryProtocolException("Malformed add-delegate request: " + e.getMessage(), e);
        }
        if (request == null || request.getAddrPort() == null) {
            throw new RegistryProtocolException("Malformed add-delegate request: missing addrPort");
        }
        return request.getAddrPort();
    }
}
