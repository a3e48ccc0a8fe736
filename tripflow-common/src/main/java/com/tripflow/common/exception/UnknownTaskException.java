package com.tripflow.common.exception;

import com.tripflow.common.result.ErrorCode;

public class UnknownTaskException extends BaseException {

    public UnknownTaskException() {
        super(ErrorCode.UNKNOWN_TASK);
    }

    public UnknownTaskException(String message) {
        super(ErrorCode.UNKNOWN_TASK, message);
    }
}
