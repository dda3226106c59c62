package com.bit.bchpool.server.handler;

import com.bit.bchpool.stratum.MinerSession;
import com.bit.bchpool.stratum.StratumSessionManager;
import com.bit.bchpool.stratum.TransportType;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import lombok.extern.slf4j.Slf4j;

/**
 * TCP 行协议：每行一个JSON对象，前面需有 LineBasedFrameDecoder + StringDecoder
 */
@Slf4j
public class StratumTcpHandler extends SimpleChannelInboundHandler<String> {

    private final StratumSessionManager sessionManager;
    private MinerSession session;

    public StratumTcpHandler(StratumSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        session = sessionManager.openSession(ctx.channel(), TransportType.TCP);
        if (session == null) {
            ctx.close();
            return;
        }
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        String message = line.trim();
        if (session == null || message.isEmpty()) {
            return;
        }
        sessionManager.handleMessage(session, message);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            sessionManager.closeSession(session);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            log.warn("报文超长，关闭连接: {}", ctx.channel().remoteAddress());
        } else {
            log.error("TCP连接异常: {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
