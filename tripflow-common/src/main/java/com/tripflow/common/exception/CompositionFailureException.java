package com.tripflow.common.exception;

import com.tripflow.common.result.ErrorCode;

/**
 * 行程编排失败且没有可用的模板行程，可重试。
 */
public class CompositionFailureException extends BaseException {

    public CompositionFailureException() {
        super(ErrorCode.COMPOSITION_FAILURE);
    }

    public CompositionFailureException(String message) {
        super(ErrorCode.COMPOSITION_FAILURE, message);
    }
}
