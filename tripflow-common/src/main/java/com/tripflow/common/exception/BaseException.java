package com.tripflow.common.exception;

import com.tripflow.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为友好的错误响应。
 * <p>用于表示“业务规则不通过”等预期内错误，而不是系统级故障。</p>
 */
public class BaseException extends RuntimeException {

    /**
     * 业务错误码；未指定时使用通用错误码兜底。
     */
    private final ErrorCode errorCode;

    public BaseException(String message) {
        super(message);
        this.errorCode = ErrorCode.COMMON_ERROR;
    }

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.errorCode = errorCode;
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Integer getCode() {
        return errorCode.getCode();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
