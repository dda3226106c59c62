package com.bit.bchpool.stratum;

import io.netty.channel.Channel;

import java.util.Collection;
import java.util.Map;

/**
 * stratum 会话状态机，两种传输共用
 */
public interface StratumSessionManager {

    /**
     * 新连接建立
     * @return 超过连接上限时返回null，调用方应关闭连接
     */
    MinerSession openSession(Channel channel, TransportType transport);

    /**
     * 处理一条客户端报文；握手阶段收到无法解析的报文时关闭该连接
     */
    void handleMessage(MinerSession session, String message);

    /**
     * 连接断开：释放extraNonce1，移除个人任务
     */
    void closeSession(MinerSession session);

    /**
     * 拉取最新模板，为每个会话生成新任务并推送
     * @return 推送的会话数
     */
    int broadcastNewJobs();

    /**
     * 向所有会话推送 mining.set_difficulty
     */
    int broadcastDifficulty(double difficulty);

    MinerSession getSession(String sessionId);

    Collection<MinerSession> getSessions();

    int getActiveConnections();

    Map<String, Object> getStats();
}
