package com.tripflow.server.gather;

import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.pojo.model.payload.ProviderPayload;
import com.tripflow.pojo.model.payload.WeatherPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.pojo.model.source.SourceOutcome;
import com.tripflow.pojo.model.source.SourceResult;
import com.tripflow.server.fallback.FallbackSynthesizer;
import com.tripflow.server.metrics.MetricsRecorder;
import com.tripflow.server.provider.FailureType;
import com.tripflow.server.provider.ProviderAdapter;
import com.tripflow.server.provider.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * DataGatheringCoordinator 单元测试：
 * - 每个被请求的数据源恰好一条结果；
 * - 超时、异常、未配置分别落到 fallback / missing；
 * - 同时在途调用数不超过上限；
 * - 取消后尚未派发的数据源不再调用。
 */
@ExtendWith(MockitoExtension.class)
class DataGatheringCoordinatorTest {

    @Mock
    private MetricsRecorder metricsRecorder;

    private PlannerProperties properties;

    private final GatherRequest request = GatherRequest.builder()
            .destination("Phuket")
            .startDate(LocalDate.of(2026, 6, 1))
            .endDate(LocalDate.of(2026, 6, 3))
            .build();

    @BeforeEach
    void setUp() {
        properties = new PlannerProperties();
    }

    @Test
    void weatherTimeoutFallsBackWhileOthersSucceed() {
        List<ProviderAdapter> adapters = new ArrayList<>();
        adapters.add(new FakeAdapter(ProviderType.WEATHER, Duration.ofMillis(50), CompletableFuture::new));
        for (ProviderType type : EnumSet.complementOf(EnumSet.of(ProviderType.WEATHER))) {
            adapters.add(FakeAdapter.succeeding(type));
        }

        GatherResult result = coordinator(adapters).gather(request, null, null).join();

        assertEquals(ProviderType.values().length, result.getResults().size());
        SourceResult weather = result.get(ProviderType.WEATHER);
        assertEquals(SourceOutcome.FALLBACK, weather.getOutcome());
        assertEquals(FailureType.TIMEOUT.getCode(), weather.getReason());
        assertTrue(weather.getPayload().isEstimated());
        assertEquals(SourceOutcome.OK, result.get(ProviderType.FLIGHTS).getOutcome());
        assertTrue(result.isDegraded());
    }

    @Test
    void allProvidersFailingStillCompletes() {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            adapters.add(new FakeAdapter(type, Duration.ofSeconds(1), () -> CompletableFuture.failedFuture(
                    new ProviderException(type, FailureType.SERVICE_UNAVAILABLE, "503"))));
        }

        GatherResult result = coordinator(adapters).gather(request, null, null).join();

        assertEquals(ProviderType.values().length, result.getResults().size());
        result.getResults().values().forEach(r -> {
            assertEquals(SourceOutcome.FALLBACK, r.getOutcome());
            assertEquals(FailureType.SERVICE_UNAVAILABLE.getCode(), r.getReason());
        });
    }

    @Test
    void unconfiguredAndAbsentProvidersAreMissing() {
        FakeAdapter weather = FakeAdapter.succeeding(ProviderType.WEATHER);
        FakeAdapter hotels = FakeAdapter.succeeding(ProviderType.HOTELS);
        hotels.configured = false;

        GatherResult result = coordinator(List.of(weather, hotels)).gather(request, null, null).join();

        assertEquals(ProviderType.values().length, result.getResults().size());
        assertEquals(SourceOutcome.OK, result.get(ProviderType.WEATHER).getOutcome());
        assertEquals(SourceOutcome.MISSING, result.get(ProviderType.HOTELS).getOutcome());
        assertEquals(DataGatheringCoordinator.REASON_NOT_CONFIGURED, result.get(ProviderType.FLIGHTS).getReason());
        assertEquals(0, hotels.calls.get());
    }

    @Test
    void onlyRequestedProvidersAreQueried() {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            adapters.add(FakeAdapter.succeeding(type));
        }
        GatherRequest hotelsOnly = request.toBuilder().providers(EnumSet.of(ProviderType.HOTELS)).build();
        List<Integer> resolved = Collections.synchronizedList(new ArrayList<>());

        GatherResult result = coordinator(adapters)
                .gather(hotelsOnly, null, (r, n, total) -> resolved.add(total))
                .join();

        assertEquals(1, result.getResults().size());
        assertFalse(result.isDegraded());
        assertEquals(List.of(1), resolved);
    }

    @Test
    void inFlightCallsNeverExceedLimit() {
        properties.setMaxConcurrentProviders(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            adapters.add(new FakeAdapter(type, Duration.ofSeconds(2), () -> {
                peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    inFlight.decrementAndGet();
                    return (ProviderPayload) new WeatherPayload();
                }, CompletableFuture.delayedExecutor(30, TimeUnit.MILLISECONDS));
            }));
        }

        GatherResult result = coordinator(adapters).gather(request, null, null).join();

        assertEquals(ProviderType.values().length, result.getResults().size());
        assertTrue(peak.get() <= 2, "peak in-flight " + peak.get());
    }

    @Test
    void cancellationSkipsUndispatchedProviders() {
        properties.setMaxConcurrentProviders(1);
        AtomicInteger calls = new AtomicInteger();
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            adapters.add(new FakeAdapter(type, Duration.ofSeconds(1), () -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(new WeatherPayload());
            }));
        }

        // 第一个数据源返回后即取消
        GatherResult result = coordinator(adapters)
                .gather(request, () -> calls.get() >= 1, null)
                .join();

        assertEquals(1, calls.get());
        assertEquals(ProviderType.values().length, result.getResults().size());
        long cancelled = result.getResults().values().stream()
                .filter(r -> DataGatheringCoordinator.REASON_CANCELLED.equals(r.getReason()))
                .count();
        assertEquals(ProviderType.values().length - 1, cancelled);
    }

    private DataGatheringCoordinator coordinator(List<ProviderAdapter> adapters) {
        return new DataGatheringCoordinator(adapters, new FallbackSynthesizer(), properties, metricsRecorder);
    }

    private static final class FakeAdapter implements ProviderAdapter {

        private final ProviderType type;
        private final Duration timeout;
        private final Supplier<CompletableFuture<ProviderPayload>> behaviour;
        private final AtomicInteger calls = new AtomicInteger();
        private boolean configured = true;

        FakeAdapter(ProviderType type, Duration timeout, Supplier<CompletableFuture<ProviderPayload>> behaviour) {
            this.type = type;
            this.timeout = timeout;
            this.behaviour = behaviour;
        }

        static FakeAdapter succeeding(ProviderType type) {
            return new FakeAdapter(type, Duration.ofSeconds(1), () -> CompletableFuture.completedFuture(new WeatherPayload()));
        }

        @Override
        public ProviderType type() {
            return type;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public Duration timeout() {
            return timeout;
        }

        @Override
        public CompletableFuture<ProviderPayload> fetch(GatherRequest request, Duration timeout) {
            calls.incrementAndGet();
            return behaviour.get();
        }
    }
}
