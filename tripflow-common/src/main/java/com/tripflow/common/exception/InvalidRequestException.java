package com.tripflow.common.exception;

import com.tripflow.common.result.ErrorCode;

/**
 * 必要槽位缺失或请求不合法，不可重试。
 */
public class InvalidRequestException extends BaseException {

    public InvalidRequestException() {
        super(ErrorCode.INVALID_REQUEST);
    }

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
