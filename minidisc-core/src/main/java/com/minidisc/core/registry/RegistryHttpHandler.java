/**
 * 注册表协议处理器
 *
 * @date 2026/10/14
 */
package com.minidisc.core.registry;

import com.minidisc.common.codec.ServiceJsonCodec;
import com.minidisc.common.exception.NonLocalDelegateException;
import com.minidisc.common.exception.RegistryProtocolException;
import com.minidisc.common.exception.RegistryUnreachableException;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Service;
import com.minidisc.core.discovery.RegistryClient;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.ArrayList;
import java.util.List;

/**
 * 注册表之间的HTTP线路协议
 *
 * <ul>
 *   <li>GET /services：本地服务加上每个 delegate 的服务</li>
 *   <li>POST /add-delegate：同主机的 delegate 注册</li>
 *   <li>GET /ping：存活探测</li>
 * </ul>
 *
 * 该处理器会发起阻塞的网络请求，必须运行在独立的 EventExecutorGroup 上而不是IO线程。
 */
@ChannelHandler.Sharable
public class RegistryHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String SERVICES_PATH = "/services";
    public static final String ADD_DELEGATE_PATH = "/add-delegate";
    public static final String PING_PATH = "/ping";

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    private final ServiceDirectory directory;
    private final RegistryClient registryClient;
    private final RegistryLogger logger;

    public RegistryHttpHandler(ServiceDirectory directory, RegistryClient registryClient, RegistryLogger logger) {
        this.directory = directory;
        this.registryClient = registryClient;
        this.logger = logger;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!request.decoderResult().isSuccess()) {
            respond(ctx, HttpResponseStatus.BAD_REQUEST);
            return;
        }
        String path = new QueryStringDecoder(request.uri()).path();
        switch (path) {
            case SERVICES_PATH:
                handleGetServices(ctx, request);
                break;
            case ADD_DELEGATE_PATH:
                handlePostAddDelegate(ctx, request);
                break;
            case PING_PATH:
                respond(ctx, HttpResponseStatus.OK);
                break;
            default:
                respond(ctx, HttpResponseStatus.NOT_FOUND);
        }
    }

    private void handleGetServices(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!HttpMethod.GET.equals(request.method())) {
            respond(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED);
            return;
        }

        // 先取本地快照，网络请求在锁外进行
        List<Service> services = new ArrayList<>(directory.services());
        List<AddrPort> delegates = directory.delegates();

        // delegate 很少，串行请求即可
        for (AddrPort delegate : delegates) {
            try {
                services.addAll(registryClient.fetchServices(delegate));
            } catch (RegistryUnreachableException e) {
                logger.info("delegate 已不可达，移除: {}", delegate);
                directory.removeDelegate(delegate);
            } catch (RegistryProtocolException e) {
                logger.warn("delegate 返回了无法解析的服务列表 {}: {}", delegate, e.getMessage());
            }
        }

        byte[] body;
        try {
            body = ServiceJsonCodec.encodeServices(services);
        } catch (RegistryProtocolException e) {
            logger.error("生成JSON失败", e);
            respond(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR);
            return;
        }
        FullHttpResponse response = new DefaultFullHttpResponse(
            HttpVersion.HTTP_1_1, HttpResponseStatus.OK, Unpooled.wrappedBuffer(body));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, JSON_CONTENT_TYPE);
        send(ctx, response);
    }

    private void handlePostAddDelegate(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!HttpMethod.POST.equals(request.method())) {
            respond(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED);
            return;
        }
        AddrPort delegate;
        try {
            delegate = ServiceJsonCodec.decodeAddDelegate(ByteBufUtil.getBytes(request.content()));
        } catch (RegistryProtocolException e) {
            logger.warn("add-delegate 请求格式错误: {}", e.getMessage());
            respond(ctx, HttpResponseStatus.BAD_REQUEST);
            return;
        }
        try {
            if (directory.addDelegate(delegate)) {
                logger.info("添加 delegate: {}", delegate);
            }
        } catch (NonLocalDelegateException e) {
            logger.warn("拒绝非本机地址的 add-delegate 请求: {}", delegate);
            respond(ctx, HttpResponseStatus.FORBIDDEN);
            return;
        }
        respond(ctx, HttpResponseStatus.OK);
    }

    private static void respond(ChannelHandlerContext ctx, HttpResponseStatus status) {
        send(ctx, new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.EMPTY_BUFFER));
    }

    private static void send(ChannelHandlerContext ctx, FullHttpResponse response) {
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("处理注册表请求失败: {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
