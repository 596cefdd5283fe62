/**
 * 注册表Netty服务器
 *
 * @date 2026/10/14
 */
package com.minidisc.core.registry;

import com.minidisc.common.config.MinidiscConfig;
import com.minidisc.common.model.AddrPort;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 在单个监听地址上提供注册表协议的HTTP服务器
 * leader 使用固定发现端口，delegate 使用系统分配的端口
 */
public class RegistryServer {

    private static final int BACKLOG = 128;
    private static final long QUIET_PERIOD_MS = 50;
    private static final long DRAIN_TIMEOUT_MS = 5000;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventExecutorGroup handlerGroup;
    private final Channel serverChannel;
    private final AddrPort boundAddress;

    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private RegistryServer(EventLoopGroup bossGroup, EventLoopGroup workerGroup,
                           EventExecutorGroup handlerGroup, Channel serverChannel) {
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
        this.handlerGroup = handlerGroup;
        this.serverChannel = serverChannel;
        this.boundAddress = AddrPort.of((InetSocketAddress) serverChannel.localAddress());
        serverChannel.closeFuture().addListener(f -> closed.complete(null));
    }

    /**
     * 绑定地址并开始接受请求
     *
     * @param address 监听地址
     * @param handler 协议处理器
     * @param config 线程配置
     * @return 运行中的服务器
     * @throws BindException 无法绑定
     */
    public static RegistryServer bind(InetSocketAddress address, RegistryHttpHandler handler,
                                      MinidiscConfig config) throws BindException {
        EventLoopGroup bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("minidisc-boss", true));
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.getIoThreads(),
            new DefaultThreadFactory("minidisc-worker", true));
        EventExecutorGroup handlerGroup = new DefaultEventExecutorGroup(config.getHandlerThreads(),
            new DefaultThreadFactory("minidisc-handler", true));

        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new RegistryChannelInitializer(handler, handlerGroup))
            .option(ChannelOption.SO_BACKLOG, BACKLOG)
            // 允许刚关闭的 leader 端口立即被重新绑定；同一端口仍只能有一个监听者
            .option(ChannelOption.SO_REUSEADDR, true)
            .childOption(ChannelOption.TCP_NODELAY, true);

        ChannelFuture future = bootstrap.bind(address).awaitUninterruptibly();
        if (!future.isSuccess()) {
            bossGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            workerGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            handlerGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw toBindException(address, future.cause());
        }
        return new RegistryServer(bossGroup, workerGroup, handlerGroup, future.channel());
    }

    private static BindException toBindException(InetSocketAddress address, Throwable cause) {
        if (cause instanceof BindException) {
            return (BindException) cause;
        }
        BindException bindException = new BindException("Cannot bind " + address + ": " + cause);
        bindException.initCause(cause);
        return bindException;
    }

    /**
     * 实际监听的地址（端口为0时为系统分配的端口）
     */
    public AddrPort getBoundAddress() {
        return boundAddress;
    }

    /**
     * 监听 socket 关闭时完成，无论是主动关闭还是异常关闭
     */
    public CompletableFuture<Void> closeFuture() {
        return closed;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * 优雅关闭：先停止接受新连接，等待处理中的请求完成后再释放线程
     */
    public void shutdownGracefully() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        serverChannel.close().syncUninterruptibly();
        handlerGroup.shutdownGracefully(0, DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        workerGroup.shutdownGracefully(QUIET_PERIOD_MS, DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        bossGroup.shutdownGracefully(0, DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
    }
}
