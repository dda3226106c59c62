package com.bit.bchpool.share;

/**
 * 份额拒绝原因及对应的 stratum 错误码
 */
public enum RejectReason {
    JOB_NOT_FOUND(21, "Job not found"),
    INVALID_FORMAT(20, "Invalid format"),
    STALE_TIME(20, "ntime out of range"),
    DUPLICATE_NONCE(22, "Duplicate share"),
    BELOW_TARGET(23, "Low difficulty share"),
    INTERNAL_ERROR(20, "Internal error");

    private final int code;
    private final String message;

    RejectReason(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
