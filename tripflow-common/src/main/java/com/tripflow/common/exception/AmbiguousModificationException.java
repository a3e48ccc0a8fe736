package com.tripflow.common.exception;

import com.tripflow.common.result.ErrorCode;

/**
 * 修改请求无法映射到具体的天/活动，需要用户澄清。
 */
public class AmbiguousModificationException extends BaseException {

    public AmbiguousModificationException() {
        super(ErrorCode.AMBIGUOUS_MODIFICATION);
    }

    public AmbiguousModificationException(String message) {
        super(ErrorCode.AMBIGUOUS_MODIFICATION, message);
    }
}
