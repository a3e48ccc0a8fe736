package com.tripflow.server.provider;

import com.tripflow.pojo.model.payload.ProviderPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 外部数据源适配器，每种能力一个实现。
 * fetch 永远不同步抛异常，任何故障都以 {@link ProviderException} 完成返回的 future。
 */
public interface ProviderAdapter {

    ProviderType type();

    /**
     * 是否启用且凭证齐全；未配置的数据源不会被调用，直接记为 missing。
     */
    boolean isConfigured();

    /**
     * 单次调用超时。
     */
    Duration timeout();

    CompletableFuture<ProviderPayload> fetch(GatherRequest request, Duration timeout);
}
