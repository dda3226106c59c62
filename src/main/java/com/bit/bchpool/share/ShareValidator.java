package com.bit.bchpool.share;

import java.util.Map;

/**
 * 份额校验，失败以结果返回，不抛异常
 */
public interface ShareValidator {

    /**
     * 使用当前矿池难度校验
     * @param extraNonce1 提交会话的extraNonce1，为空时使用任务自带的
     */
    ShareResult validate(String jobId, String extraNonce1, String extraNonce2, String ntime, String nonce,
                         String minerAddress);

    ShareResult validate(String jobId, String extraNonce1, String extraNonce2, String ntime, String nonce,
                         String minerAddress, double difficulty);

    long getAcceptedCount();

    long getRejectedCount();

    Map<String, Object> getStats();
}
