package com.bit.bchpool.persistence;

import lombok.Data;

/**
 * 份额记录，写入后不再修改
 */
@Data
public class ShareRecord {
    private String minerAddress;
    private String workerName;
    private String jobId;
    private String extraNonce2;
    private String ntime;
    private String nonce;
    private String hash;
    private double difficulty;
    private boolean accepted;
    private String rejectReason;
    private long createdAt;
}
