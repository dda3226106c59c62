package com.bit.bchpool.server.handler;

import com.bit.bchpool.stratum.MinerSession;
import com.bit.bchpool.stratum.StratumSessionManager;
import com.bit.bchpool.stratum.TransportType;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * WebSocket 文本帧，每帧一个JSON对象；握手完成后才建立会话
 */
@Slf4j
public class StratumWebSocketHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final StratumSessionManager sessionManager;
    private MinerSession session;

    public StratumWebSocketHandler(StratumSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            WebSocketServerProtocolHandler.HandshakeComplete handshake =
                    (WebSocketServerProtocolHandler.HandshakeComplete) evt;
            log.debug("WebSocket握手完成: {}, uri={}", ctx.channel().remoteAddress(), handshake.requestUri());
            session = sessionManager.openSession(ctx.channel(), TransportType.WEBSOCKET);
            if (session == null) {
                ctx.close();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        String message = frame.text().trim();
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
        log.error("WebSocket连接异常: {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
