package com.tripflow.server.provider;

import com.tripflow.pojo.model.source.ProviderType;

/**
 * 适配器内部故障统一转换成的类型化失败，只通过 CompletableFuture 传递，不会同步抛给采集协调器。
 */
public class ProviderException extends RuntimeException {

    private final ProviderType provider;

    private final FailureType failureType;

    public ProviderException(ProviderType provider, FailureType failureType, String message) {
        super(message);
        this.provider = provider;
        this.failureType = failureType;
    }

    public ProviderException(ProviderType provider, FailureType failureType, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.failureType = failureType;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public FailureType getFailureType() {
        return failureType;
    }
}
