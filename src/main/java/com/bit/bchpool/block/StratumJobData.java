package com.bit.bchpool.block;

import lombok.Data;

import java.util.List;

/**
 * mining.notify 所需的线上字段
 */
@Data
public class StratumJobData {
    private String prevHash;            // 按stratum惯例逐4字节翻转
    private String coinb1;
    private String coinb2;
    private List<String> merkleBranch;  // 内部字节序
    private String version;
    private String nbits;
    private String ntime;
    private String extraNonce1;
}
