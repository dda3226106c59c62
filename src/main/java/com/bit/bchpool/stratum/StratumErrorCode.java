package com.bit.bchpool.stratum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * stratum 错误码，线上格式 [code, message, null]
 */
public enum StratumErrorCode {
    OTHER(20, "Other/Unknown"),
    JOB_NOT_FOUND(21, "Job not found"),
    DUPLICATE_SHARE(22, "Duplicate share"),
    LOW_DIFFICULTY(23, "Low difficulty share"),
    UNAUTHORIZED(24, "Unauthorized worker"),
    NOT_SUBSCRIBED(25, "Not subscribed");

    private final int code;
    private final String message;

    StratumErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public List<Object> toError() {
        return toError(code, message);
    }

    public List<Object> toError(String detail) {
        return toError(code, detail);
    }

    public static List<Object> toError(int code, String message) {
        return new ArrayList<>(Arrays.asList(code, message, null));
    }
}
