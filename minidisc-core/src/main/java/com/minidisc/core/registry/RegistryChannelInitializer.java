package com.minidisc.core.registry;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.concurrent.TimeUnit;

/**
 * 注册表 Channel Pipeline 初始化器
 */
public class RegistryChannelInitializer extends ChannelInitializer<SocketChannel> {

    /**
     * 请求体上限，add-delegate 请求只有几十字节
     */
    static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private static final int READ_TIMEOUT_SECONDS = 30;

    private final RegistryHttpHandler handler;
    private final EventExecutorGroup handlerGroup;

    public RegistryChannelInitializer(RegistryHttpHandler handler, EventExecutorGroup handlerGroup) {
        this.handler = handler;
        this.handlerGroup = handlerGroup;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        // 1. 读超时，防止半开连接占用资源
        pipeline.addLast("read-timeout", new ReadTimeoutHandler(READ_TIMEOUT_SECONDS, TimeUnit.SECONDS));

        // 2. HTTP编解码与聚合
        pipeline.addLast("http-codec", new HttpServerCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));

        // 3. 协议处理器，运行在独立线程组上
        pipeline.addLast(handlerGroup, "registry", handler);
    }
}
