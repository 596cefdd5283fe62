/**
 * 注册表HTTP客户端
 *
 * @date 2026/10/13
 */
package com.minidisc.core.discovery;

import com.minidisc.common.codec.ServiceJsonCodec;
import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.common.exception.RegistryProtocolException;
import com.minidisc.common.exception.RegistryUnreachableException;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Service;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.Proxy;
import java.util.List;

/**
 * 基于 OkHttp 访问其他注册表的线路协议
 *
 * 连接失败和超时统一抛出 {@link RegistryUnreachableException}，
 * 非 2xx 响应或无法解析的响应体抛出 {@link RegistryProtocolException}。
 */
public class RegistryClient implements AutoCloseable {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient fetchClient;
    private final OkHttpClient pingClient;
    private final OkHttpClient registerClient;

    public RegistryClient(MinidiscConfig config) {
        // 私有网络内直连，不走系统代理
        OkHttpClient base = new OkHttpClient.Builder()
            .proxy(Proxy.NO_PROXY)
            .followRedirects(false)
            .build();
        this.fetchClient = base.newBuilder().callTimeout(config.getFetchTimeout()).build();
        this.pingClient = base.newBuilder().callTimeout(config.getPingTimeout()).build();
        this.registerClient = base.newBuilder().callTimeout(config.getRegisterTimeout()).build();
    }

    /**
     * GET /services
     *
     * @param registry 注册表地址
     * @return 对端广播的服务（包含其 delegate 的服务）
     */
    public List<Service> fetchServices(AddrPort registry) {
        Request request = new Request.Builder()
            .url(url(registry, "/services"))
            .get()
            .build();
        try (Response response = fetchClient.newCall(request).execute()) {
            byte[] body = readBody(registry, response);
            return ServiceJsonCodec.decodeServices(body);
        } catch (IOException e) {
            throw new RegistryUnreachableException("Cannot fetch services from " + registry + ": " + e.getMessage(), e);
        }
    }

    /**
     * POST /add-delegate，向同主机的 leader 注册自己
     *
     * @param leader leader 地址（发现端口）
     * @param delegate 自己的监听地址
     */
    public void registerDelegate(AddrPort leader, AddrPort delegate) {
        Request request = new Request.Builder()
            .url(url(leader, "/add-delegate"))
            .post(RequestBody.create(ServiceJsonCodec.encodeAddDelegate(delegate), JSON))
            .build();
        try (Response response = registerClient.newCall(request).execute()) {
            readBody(leader, response);
        } catch (IOException e) {
            throw new RegistryUnreachableException("Cannot contact leader at " + leader + ": " + e.getMessage(), e);
        }
    }

    /**
     * GET /ping，只要收到任何HTTP响应就认为对端存活
     *
     * @param registry 注册表地址
     * @return 是否存活
     */
    public boolean ping(AddrPort registry) {
        Request request = new Request.Builder()
            .url(url(registry, "/ping"))
            .get()
            .build();
        try (Response ignored = pingClient.newCall(request).execute()) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static byte[] readBody(AddrPort registry, Response response) throws IOException {
        ResponseBody body = response.body();
        byte[] bytes = body != null ? body.bytes() : new byte[0];
        if (!response.isSuccessful()) {
            throw new RegistryProtocolException("HTTP " + response.code() + " from " + registry);
        }
        return bytes;
    }

    private static String url(AddrPort registry, String path) {
        return "http://" + registry + path;
    }

    @Override
    public void close() {
        fetchClient.dispatcher().executorService().shutdown();
        fetchClient.connectionPool().evictAll();
    }
}
