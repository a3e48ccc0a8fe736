package com.tripflow.server.handler;

import com.tripflow.common.exception.AmbiguousModificationException;
import com.tripflow.common.exception.BaseException;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.common.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 需要用户澄清的修改请求，不算错误，用 info 级别记录。
     */
    @ExceptionHandler(AmbiguousModificationException.class)
    public Result<Void> handleAmbiguousModification(AmbiguousModificationException ex) {
        log.info("修改请求需要澄清: {}", ex.getMessage());
        return Result.error(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(BaseException.class)
    public Result<Void> handleBaseException(BaseException ex) {
        log.warn("业务异常: code={}, retryable={}, msg={}", ex.getCode(), ex.isRetryable(), ex.getMessage());
        return Result.error(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public Result<Void> handleDataAccessException(DataAccessException ex) {
        log.error("存储异常: {}", ex.getMessage());
        return Result.error(ErrorCode.STORAGE_UNAVAILABLE);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Void> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("请求体解析失败: {}", ex.getMessage());
        return Result.error(ErrorCode.INVALID_REQUEST, "请求体格式不正确");
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleOtherException(Exception ex) {
        log.error("系统异常", ex);
        return Result.error(ErrorCode.INTERNAL_ERROR);
    }
}
