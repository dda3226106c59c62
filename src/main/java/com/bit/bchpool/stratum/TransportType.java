package com.bit.bchpool.stratum;

public enum TransportType {
    // 按行分隔的 TCP 流
    TCP,
    // WebSocket 文本帧
    WEBSOCKET
}
