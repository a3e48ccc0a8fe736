package com.tripflow.server.provider;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 数据源失败分类，作为降级原因记录在 SourceResult 上。
 */
public enum FailureType {

    RATE_LIMIT("rate_limit", 60),
    TIMEOUT("timeout", 30),
    AUTHENTICATION("authentication", 0),
    SERVICE_UNAVAILABLE("service_unavailable", 45),
    NETWORK_ERROR("network_error", 15),
    INVALID_RESPONSE("invalid_response", 0),
    UNSUPPORTED("unsupported", 0),
    UNKNOWN("unknown", 0);

    private final String code;

    /** 建议的重试等待秒数，0 表示重试无意义 */
    private final int retryAfterSeconds;

    FailureType(String code, int retryAfterSeconds) {
        this.code = code;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getCode() {
        return code;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public static FailureType ofHttpStatus(int status) {
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status / 100 == 5) {
            return SERVICE_UNAVAILABLE;
        }
        return INVALID_RESPONSE;
    }

    /**
     * 把任意异常（包括 CompletableFuture 包装过的）归类。
     */
    public static FailureType classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof ProviderException) {
            return ((ProviderException) t).getFailureType();
        }
        if (t instanceof TimeoutException || t instanceof HttpTimeoutException) {
            return TIMEOUT;
        }
        if (t instanceof JsonProcessingException) {
            return INVALID_RESPONSE;
        }
        if (t instanceof ConnectException || t instanceof IOException) {
            return NETWORK_ERROR;
        }
        return UNKNOWN;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
