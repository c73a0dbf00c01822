package com.bit.gauge.exception;

/**
 * 引擎统一异常：封装错误类型与错误信息，抛出即代表整个操作被拒绝且无状态变更
 */
public class GaugeException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    public GaugeException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    // 带cause异常（链式追踪）
    public GaugeException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
