package com.tripflow.common.exception;

import com.tripflow.common.result.ErrorCode;

/**
 * Redis / 数据库读写失败，总是可重试。
 * 上下文写入失败时同步抛给调用方，不允许静默丢弃槽位数据。
 */
public class StorageUnavailableException extends BaseException {

    public StorageUnavailableException(String message) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
