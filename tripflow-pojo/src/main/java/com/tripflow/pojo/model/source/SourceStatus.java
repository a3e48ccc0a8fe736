package com.tripflow.pojo.model.source;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务快照 / 行程版本中展示的单个数据源状态，客户端据此渲染“估算”角标。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceStatus {

    private ProviderType provider;

    private SourceState status;

    /** degraded / missing 时的原因，例如 timeout、not_configured */
    private String reason;

    public static SourceStatus of(SourceResult result) {
        switch (result.getOutcome()) {
            case OK:
                return new SourceStatus(result.getProvider(), SourceState.ACTIVE, null);
            case MISSING:
                return new SourceStatus(result.getProvider(), SourceState.MISSING, result.getReason());
            default:
                return new SourceStatus(result.getProvider(), SourceState.DEGRADED, result.getReason());
        }
    }
}
