package com.tripflow.pojo.model.source;

import com.tripflow.pojo.model.payload.ProviderPayload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 一次数据采集的合并结果：每个被请求的数据源恰好一条 SourceResult。
 */
public class GatherResult {

    private final Map<ProviderType, SourceResult> results;

    private final boolean degraded;

    public GatherResult(Map<ProviderType, SourceResult> results) {
        EnumMap<ProviderType, SourceResult> copy = new EnumMap<>(ProviderType.class);
        copy.putAll(results);
        this.results = Collections.unmodifiableMap(copy);
        this.degraded = copy.values().stream().anyMatch(r -> r.getOutcome() != SourceOutcome.OK);
    }

    public Map<ProviderType, SourceResult> getResults() {
        return results;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public SourceResult get(ProviderType provider) {
        return results.get(provider);
    }

    /**
     * 取某个数据源的数据（真实或估算），没有数据或类型不符时返回 null。
     */
    public <T extends ProviderPayload> T payload(ProviderType provider, Class<T> type) {
        SourceResult r = results.get(provider);
        if (r == null || r.getPayload() == null || !type.isInstance(r.getPayload())) {
            return null;
        }
        return type.cast(r.getPayload());
    }

    public List<SourceStatus> sourceStatuses() {
        List<SourceStatus> statuses = new ArrayList<>();
        for (SourceResult r : results.values()) {
            statuses.add(SourceStatus.of(r));
        }
        return statuses;
    }
}
