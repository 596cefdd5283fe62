/**
 * Tailscale 地址源
 *
 * @date 2026/10/16
 */
package com.minidisc.core.tailscale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minidisc.common.exception.AddressSourceException;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.TailnetStatus;
import com.minidisc.common.source.AddressSource;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.net.Inet4Address;
import java.nio.channels.ClosedChannelException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 通过 tailscaled 本地 API 获取本节点和在线对端的地址
 *
 * 请求经 unix domain socket 发送（Linux 上使用 Netty 的 epoll 传输），每次调用都重新查询，结果不缓存。
 */
public class TailscaleAddressSource implements AddressSource, AutoCloseable {

    public static final String DEFAULT_SOCKET_PATH = "/var/run/tailscale/tailscaled.sock";

    static final String STATUS_PATH = "/localapi/v0/status";
    static final String LOCAL_API_HOST = "local-tailscaled.sock";

    private static final Duration QUERY_TIMEOUT = Duration.ofMillis(500);

    private static final int MAX_STATUS_LENGTH = 4 * 1024 * 1024;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path socketPath;
    private final Duration timeout;

    private EventLoopGroup group;

    public TailscaleAddressSource() {
        this(Path.of(DEFAULT_SOCKET_PATH));
    }

    public TailscaleAddressSource(Path socketPath) {
        this(socketPath, QUERY_TIMEOUT);
    }

    TailscaleAddressSource(Path socketPath, Duration timeout) {
        this.socketPath = socketPath;
        this.timeout = timeout;
    }

    private synchronized EventLoopGroup group() {
        if (!Epoll.isAvailable()) {
            throw new AddressSourceException("Unix domain sockets are not available on this platform",
                Epoll.unavailabilityCause());
        }
        if (group == null) {
            group = new EpollEventLoopGroup(1, new DefaultThreadFactory("minidisc-tailscale", true));
        }
        return group;
    }

    @Override
    public TailnetStatus status() {
        CompletableFuture<byte[]> body = new CompletableFuture<>();
        long timeoutMs = timeout.toMillis();

        Bootstrap bootstrap = new Bootstrap()
            .group(group())
            .channel(EpollDomainSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMs)
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ch.pipeline()
                        .addLast("read-timeout", new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addLast("http-codec", new HttpClientCodec())
                        .addLast("http-aggregator", new HttpObjectAggregator(MAX_STATUS_LENGTH))
                        .addLast("status", new StatusResponseHandler(body));
                }
            });

        ChannelFuture connect = bootstrap.connect(new DomainSocketAddress(socketPath.toString()));
        connect.addListener(f -> {
            if (!f.isSuccess()) {
                body.completeExceptionally(f.cause());
                return;
            }
            connect.channel().writeAndFlush(statusRequest()).addListener(w -> {
                if (!w.isSuccess()) {
                    body.completeExceptionally(w.cause());
                }
            });
        });

        try {
            return parseStatus(body.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            throw new AddressSourceException("Tailscale status query timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AddressSourceException) {
                throw (AddressSourceException) cause;
            }
            throw new AddressSourceException("Failed to query tailscaled at " + socketPath + ": " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AddressSourceException("Interrupted while querying Tailscale status", e);
        } finally {
            connect.channel().close();
        }
    }

    private static FullHttpRequest statusRequest() {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, STATUS_PATH,
            Unpooled.EMPTY_BUFFER);
        request.headers().set(HttpHeaderNames.HOST, LOCAL_API_HOST);
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return request;
    }

    /**
     * 状态码必须为 200，聚合后的消息体交给调用方解析
     */
    private static final class StatusResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final CompletableFuture<byte[]> body;

        StatusResponseHandler(CompletableFuture<byte[]> body) {
            this.body = body;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            if (!response.decoderResult().isSuccess()) {
                body.completeExceptionally(new AddressSourceException(
                    "Malformed response from tailscaled", response.decoderResult().cause()));
            } else if (!HttpResponseStatus.OK.equals(response.status())) {
                body.completeExceptionally(new AddressSourceException(
                    "Unexpected tailscaled response: " + response.status()));
            } else {
                body.complete(ByteBufUtil.getBytes(response.content()));
            }
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            body.completeExceptionally(new ClosedChannelException());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            body.completeExceptionally(cause);
            ctx.close();
        }
    }

    /**
     * 解析 /localapi/v0/status 的 JSON：取本节点和每个在线对端的第一个 IPv4 地址
     */
    static TailnetStatus parseStatus(byte[] body) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(body);
        } catch (IOException e) {
            throw new AddressSourceException("Undecodable tailscaled status", e);
        }
        if (root == null || !root.isObject()) {
            throw new AddressSourceException("Undecodable tailscaled status");
        }
        Inet4Address local = firstIpv4(root.path("TailscaleIPs"));
        if (local == null) {
            throw new AddressSourceException("Local node has no IPv4 tailnet address");
        }

        List<Inet4Address> peers = new ArrayList<>();
        Iterator<JsonNode> it = root.path("Peer").elements();
        while (it.hasNext()) {
            JsonNode peer = it.next();
            if (!peer.path("Online").asBoolean(false)) {
                continue;
            }
            Inet4Address address = firstIpv4(peer.path("TailscaleIPs"));
            if (address != null) {
                peers.add(address);
            }
        }
        return new TailnetStatus(local, peers);
    }

    private static Inet4Address firstIpv4(JsonNode ips) {
        for (JsonNode ip : ips) {
            String text = ip.asText();
            // IPv6 地址含冒号
            if (text.indexOf(':') >= 0) {
                continue;
            }
            try {
                return AddrPort.parseAddress(text);
            } catch (IllegalArgumentException e) {
                throw new AddressSourceException("Invalid tailnet address: " + text, e);
            }
        }
        return null;
    }

    @Override
    public synchronized void close() {
        if (group != null) {
            group.shutdownGracefully(0, 1000, TimeUnit.MILLISECONDS);
            group = null;
        }
    }
}
