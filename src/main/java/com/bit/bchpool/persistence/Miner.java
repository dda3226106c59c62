package com.bit.bchpool.persistence;

import lombok.Data;

@Data
public class Miner {
    private long id;
    private String address;
    private String workerName;
    private boolean active = true;
    // 毫秒时间戳
    private long createdAt;
    private long lastSeen;
    private long acceptedShares;
    private long blocksFound;
}
