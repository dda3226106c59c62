package com.bit.bchpool.stratum;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 单个矿工连接的会话状态
 */
@Slf4j
@Getter
public class MinerSession {

    private final String sessionId;
    private final TransportType transport;
    private final Channel channel;
    private final long connectedAt;
    // 本会话下发过的任务
    private final Set<String> jobIds = ConcurrentHashMap.newKeySet();
    private final LongAdder acceptedShares = new LongAdder();
    private final LongAdder rejectedShares = new LongAdder();

    @Setter private volatile SessionState state = SessionState.CONNECTED;
    @Setter private volatile String extraNonce1;
    @Setter private volatile String minerAddress;
    @Setter private volatile String workerName;
    @Setter private volatile String userAgent;
    @Setter private volatile long lastActivity;

    public MinerSession(String sessionId, TransportType transport, Channel channel) {
        this.sessionId = sessionId;
        this.transport = transport;
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
        this.lastActivity = connectedAt;
    }

    /**
     * 写出一条JSON报文：TCP按行，WebSocket为文本帧
     */
    public ChannelFuture send(String json) {
        if (transport == TransportType.WEBSOCKET) {
            return channel.writeAndFlush(new TextWebSocketFrame(json));
        }
        return channel.writeAndFlush(json + "\n");
    }

    public boolean isActive() {
        return state != SessionState.CLOSED && channel.isActive();
    }

    public void addJob(String jobId) {
        jobIds.add(jobId);
    }

    public String getRemoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }

    @Override
    public String toString() {
        return "MinerSession{" + sessionId + ", " + transport + ", " + state
                + (minerAddress == null ? "" : ", " + minerAddress + "." + workerName) + "}";
    }
}
