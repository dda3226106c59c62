package com.bit.bchpool.exception;

/**
 * 矿池统一异常：封装异常类型与错误信息，便于按类型处理
 */
public class PoolException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    public PoolException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    // 带cause异常（链式追踪）
    public PoolException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
