package com.tripflow.server.gather;

import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.pojo.model.payload.ProviderPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.pojo.model.source.SourceResult;
import com.tripflow.server.fallback.FallbackSynthesizer;
import com.tripflow.server.metrics.MetricsRecorder;
import com.tripflow.server.provider.FailureType;
import com.tripflow.server.provider.ProviderAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 数据采集协调器：并发调用各数据源，单个数据源的失败只影响它自己。
 * <p>
 * 同时在途的调用数不超过 maxConcurrentProviders，每个调用完成后再派发下一个；
 * 返回的 future 在全部数据源都有结果（ok / fallback / error / missing）后才完成，且从不异常完成。
 */
@Slf4j
@Component
public class DataGatheringCoordinator {

    public static final String REASON_NOT_CONFIGURED = "not_configured";
    public static final String REASON_CANCELLED = "cancelled";

    private final Map<ProviderType, ProviderAdapter> adapters = new EnumMap<>(ProviderType.class);
    private final FallbackSynthesizer fallbackSynthesizer;
    private final PlannerProperties plannerProperties;
    private final MetricsRecorder metricsRecorder;

    public DataGatheringCoordinator(List<ProviderAdapter> adapters,
                                    FallbackSynthesizer fallbackSynthesizer,
                                    PlannerProperties plannerProperties,
                                    MetricsRecorder metricsRecorder) {
        for (ProviderAdapter adapter : adapters) {
            this.adapters.put(adapter.type(), adapter);
        }
        this.fallbackSynthesizer = fallbackSynthesizer;
        this.plannerProperties = plannerProperties;
        this.metricsRecorder = metricsRecorder;
    }

    public CompletableFuture<GatherResult> gather(GatherRequest request,
                                                  CancellationSignal cancellation,
                                                  GatherProgressListener listener) {
        GatherRun run = new GatherRun(request,
                cancellation == null ? CancellationSignal.NONE : cancellation,
                listener == null ? GatherProgressListener.NOOP : listener);
        run.dispatchNext();
        return run.done;
    }

    private CompletableFuture<SourceResult> call(ProviderType type, ProviderAdapter adapter, GatherRequest request) {
        Duration timeout = adapter.timeout();
        long begin = System.nanoTime();
        CompletableFuture<ProviderPayload> future;
        try {
            future = adapter.fetch(request, timeout);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((payload, error) -> {
                    long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);
                    if (error == null && payload != null) {
                        return SourceResult.ok(type, payload, latency);
                    }
                    String reason = error == null ? FailureType.INVALID_RESPONSE.getCode() : FailureType.classify(error).getCode();
                    log.warn("数据源调用失败，改用估算数据: provider={}, reason={}, latencyMs={}, error={}",
                            type.getCode(), reason, latency, error == null ? "null payload" : FailureType.unwrap(error).getMessage());
                    try {
                        return fallbackSynthesizer.synthesize(type, request, reason).withLatencyMs(latency);
                    } catch (RuntimeException e) {
                        log.error("估算数据生成失败: provider={}", type.getCode(), e);
                        return SourceResult.error(type, reason, latency);
                    }
                });
    }

    private void record(SourceResult result) {
        metricsRecorder.recordProviderCall(result.getProvider().getCode(), result.getOutcome().getCode(), result.getReason());
        if (result.getLatencyMs() > 0) {
            metricsRecorder.recordProviderLatencyMs(result.getProvider().getCode(), result.getOutcome().getCode(), result.getLatencyMs());
        }
    }

    /**
     * 单次采集的状态，所有字段都在 this 锁内修改。
     */
    private final class GatherRun {

        private final GatherRequest request;
        private final CancellationSignal cancellation;
        private final GatherProgressListener listener;
        private final Deque<ProviderType> queue;
        private final Map<ProviderType, SourceResult> results = new EnumMap<>(ProviderType.class);
        private final int total;
        private final int maxInFlight;
        private final CompletableFuture<GatherResult> done = new CompletableFuture<>();
        private int inFlight;

        GatherRun(GatherRequest request, CancellationSignal cancellation, GatherProgressListener listener) {
            this.request = request;
            this.cancellation = cancellation;
            this.listener = listener;
            this.queue = new ArrayDeque<>(request.requestedProviders());
            this.total = queue.size();
            this.maxInFlight = Math.max(1, plannerProperties.getMaxConcurrentProviders());
        }

        synchronized void dispatchNext() {
            while (inFlight < maxInFlight && !queue.isEmpty()) {
                ProviderType type = queue.poll();
                if (cancellation.isCancelled()) {
                    resolve(SourceResult.missing(type, REASON_CANCELLED));
                    continue;
                }
                ProviderAdapter adapter = adapters.get(type);
                if (adapter == null || !adapter.isConfigured()) {
                    resolve(SourceResult.missing(type, REASON_NOT_CONFIGURED));
                    continue;
                }
                inFlight++;
                call(type, adapter, request).whenComplete((result, error) -> {
                    synchronized (this) {
                        inFlight--;
                        resolve(result != null ? result : SourceResult.error(type, FailureType.UNKNOWN.getCode(), 0L));
                        dispatchNext();
                    }
                });
            }
        }

        private void resolve(SourceResult result) {
            if (results.containsKey(result.getProvider())) {
                return;
            }
            results.put(result.getProvider(), result);
            record(result);
            try {
                listener.onSourceResolved(result, results.size(), total);
            } catch (RuntimeException e) {
                log.warn("采集进度回调异常: provider={}", result.getProvider().getCode(), e);
            }
            if (results.size() == total) {
                GatherResult gathered = new GatherResult(results);
                log.info("数据采集完成: destination={}, degraded={}, sources={}",
                        request.getDestination(), gathered.isDegraded(), gathered.sourceStatuses().size());
                done.complete(gathered);
            }
        }
    }
}
