package com.bit.bchpool.server;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.server.handler.StratumWebSocketHandler;
import com.bit.bchpool.stratum.StratumSessionManager;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * stratum WebSocket 服务：一帧一条 JSON
 */
@Slf4j
@Component
@Order(1)
public class StratumWebSocketServer {

    private static final int MAX_HTTP_CONTENT = 64 * 1024;

    private final PoolConfig.Stratum settings;
    private final StratumSessionManager sessionManager;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile int boundPort = -1;

    @Autowired
    public StratumWebSocketServer(PoolConfig config, StratumSessionManager sessionManager) {
        this.settings = config.getStratum();
        this.sessionManager = sessionManager;
    }

    @PostConstruct
    public void start() throws InterruptedException {
        if (!settings.isWebsocketEnabled()) {
            log.info("stratum WebSocket服务未启用");
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 1024)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT));
                        pipeline.addLast(new WebSocketServerProtocolHandler(settings.getWebsocketPath(), null, true,
                                settings.getMaxLineLength()));
                        pipeline.addLast(new StratumWebSocketHandler(sessionManager));
                    }
                });

        serverChannel = bootstrap.bind(settings.getHost(), settings.getWebsocketPort()).sync().channel();
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("stratum WebSocket服务已启动，监听 {}:{}{}", settings.getHost(), boundPort, settings.getWebsocketPath());
    }

    public int getBoundPort() {
        return boundPort;
    }

    @PreDestroy
    public void shutdown() {
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
                log.info("stratum WebSocket服务Channel已关闭");
            } catch (InterruptedException e) {
                log.warn("关闭WebSocket Channel时线程中断", e);
                Thread.currentThread().interrupt();
            } finally {
                serverChannel = null;
            }
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(1, 5, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(1, 5, TimeUnit.SECONDS)
                    .addListener(future -> log.info("stratum WebSocket EventLoopGroup已关闭"));
            bossGroup = null;
        }
    }
}
