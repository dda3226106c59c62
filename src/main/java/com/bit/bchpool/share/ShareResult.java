package com.bit.bchpool.share;

import com.bit.bchpool.job.Job;
import lombok.Data;

/**
 * 份额校验结果
 */
@Data
public class ShareResult {
    private boolean accepted;
    private RejectReason reason;
    // 拒绝详情（字段名/异常信息/任务id）
    private String detail;
    // 区块头哈希，显示顺序hex
    private String hash;
    private byte[] header;
    private byte[] coinbase;
    private Job job;
    // 是否同时达到网络目标
    private boolean meetsNetwork;

    public static ShareResult accepted(Job job, byte[] header, byte[] coinbase, String hash, boolean meetsNetwork) {
        ShareResult result = new ShareResult();
        result.setAccepted(true);
        result.setJob(job);
        result.setHeader(header);
        result.setCoinbase(coinbase);
        result.setHash(hash);
        result.setMeetsNetwork(meetsNetwork);
        return result;
    }

    public static ShareResult rejected(RejectReason reason, String detail) {
        ShareResult result = new ShareResult();
        result.setAccepted(false);
        result.setReason(reason);
        result.setDetail(detail);
        return result;
    }

    /**
     * 返回给矿工的错误信息
     */
    public String errorMessage() {
        if (accepted) {
            return null;
        }
        switch (reason) {
            case JOB_NOT_FOUND:
                return "Job " + detail + " not found";
            case INVALID_FORMAT:
                return "Invalid " + detail;
            case INTERNAL_ERROR:
                return reason.getMessage() + ": " + detail;
            default:
                return reason.getMessage();
        }
    }
}
