package com.bit.bchpool.server;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.server.handler.StratumTcpHandler;
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
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * stratum TCP 服务：按行分隔的 JSON
 */
@Slf4j
@Component
@Order(1)
public class StratumTcpServer {

    private final PoolConfig.Stratum settings;
    private final StratumSessionManager sessionManager;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile int boundPort = -1;

    @Autowired
    public StratumTcpServer(PoolConfig config, StratumSessionManager sessionManager) {
        this.settings = config.getStratum();
        this.sessionManager = sessionManager;
    }

    @PostConstruct
    public void start() throws InterruptedException {
        if (!settings.isTcpEnabled()) {
            log.info("stratum TCP服务未启用");
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
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new LineBasedFrameDecoder(settings.getMaxLineLength(), true, true));
                        pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        pipeline.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        pipeline.addLast(new StratumTcpHandler(sessionManager));
                    }
                });

        serverChannel = bootstrap.bind(settings.getHost(), settings.getTcpPort()).sync().channel();
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("stratum TCP服务已启动，监听 {}:{}", settings.getHost(), boundPort);
    }

    /**
     * 实际监听端口（配置为0时由系统分配），未启动返回-1
     */
    public int getBoundPort() {
        return boundPort;
    }

    @PreDestroy
    public void shutdown() {
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
                log.info("stratum TCP服务Channel已关闭");
            } catch (InterruptedException e) {
                log.warn("关闭TCP Channel时线程中断", e);
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
                    .addListener(future -> log.info("stratum TCP EventLoopGroup已关闭"));
            bossGroup = null;
        }
    }
}
