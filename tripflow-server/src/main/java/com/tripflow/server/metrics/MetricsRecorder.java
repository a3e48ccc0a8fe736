package com.tripflow.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer；
 * - 未接入 Prometheus 等外部监控时只在本地内存维护统计值，不影响业务逻辑；
 * - 指标命名参考「组件.业务.动作」，记录失败只打 debug 日志，绝不向上抛出。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录行程版本缓存的命中/未命中情况。
     */
    public void recordVersionCacheHit(boolean hit) {
        try {
            String outcome = hit ? "hit" : "miss";
            meterRegistry.counter("tripflow.version.cache", "outcome", outcome).increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录单个数据源调用结果（ok / fallback / missing）。
     */
    public void recordProviderCall(String provider, String outcome, String reason) {
        try {
            meterRegistry.counter("tripflow.provider.call",
                    "provider", safe(provider),
                    "outcome", safe(outcome),
                    "reason", safe(reason)).increment();
        } catch (Exception e) {
            log.debug("记录数据源调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录单个数据源调用耗时。
     */
    public void recordProviderLatencyMs(String provider, String outcome, long latencyMs) {
        try {
            meterRegistry.timer("tripflow.provider.latency",
                    "provider", safe(provider),
                    "outcome", safe(outcome))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录数据源耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录任务进入终态（completed / failed / cancelled）。
     */
    public void recordTaskTerminal(String kind, String status, String errorCode) {
        try {
            meterRegistry.counter("tripflow.task.terminal",
                    "kind", safe(kind),
                    "status", safe(status),
                    "errorCode", safe(errorCode)).increment();
        } catch (Exception e) {
            log.debug("记录任务终态指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录任务端到端耗时。
     */
    public void recordTaskDurationMs(String kind, String status, long durationMs) {
        try {
            meterRegistry.timer("tripflow.task.duration",
                    "kind", safe(kind),
                    "status", safe(status))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录任务耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录任务快照持久化失败（推送仍会继续）。
     */
    public void recordSnapshotPersistFailure() {
        try {
            meterRegistry.counter("tripflow.task.snapshot.persist_failure").increment();
        } catch (Exception e) {
            log.debug("记录快照持久化失败指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用结果（成功/失败/跳过）。
     */
    public void recordAiChatCall(String outcome, String reason, String model) {
        try {
            meterRegistry.counter("tripflow.ai.chat.call",
                    "outcome", safe(outcome),
                    "reason", safe(reason),
                    "model", safe(model)).increment();
        } catch (Exception e) {
            log.debug("记录 AI 调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用耗时。
     */
    public void recordAiChatLatencyMs(long latencyMs, String outcome, String model) {
        try {
            meterRegistry.timer("tripflow.ai.chat.latency",
                    "outcome", safe(outcome),
                    "model", safe(model))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录 AI 耗时指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
