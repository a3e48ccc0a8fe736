package com.tripflow.pojo.model.source;

import com.tripflow.pojo.model.payload.ProviderPayload;
import lombok.Value;
import lombok.With;

/**
 * 一次数据源调用的结果，只属于产生它的那次采集。
 */
@Value
public class SourceResult {

    ProviderType provider;

    SourceOutcome outcome;

    /** ok / fallback 时非空 */
    ProviderPayload payload;

    /** fallback / error / missing 的原因 */
    String reason;

    @With
    long latencyMs;

    public static SourceResult ok(ProviderType provider, ProviderPayload payload, long latencyMs) {
        return new SourceResult(provider, SourceOutcome.OK, payload, null, latencyMs);
    }

    public static SourceResult fallback(ProviderType provider, ProviderPayload payload, String reason) {
        return new SourceResult(provider, SourceOutcome.FALLBACK, payload, reason, 0L);
    }

    public static SourceResult error(ProviderType provider, String reason, long latencyMs) {
        return new SourceResult(provider, SourceOutcome.ERROR, null, reason, latencyMs);
    }

    public static SourceResult missing(ProviderType provider, String reason) {
        return new SourceResult(provider, SourceOutcome.MISSING, null, reason, 0L);
    }

    public boolean isSynthesized() {
        return outcome == SourceOutcome.FALLBACK;
    }
}
