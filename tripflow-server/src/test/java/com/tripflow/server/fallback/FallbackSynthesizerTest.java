package com.tripflow.server.fallback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.payload.TransitPayload;
import com.tripflow.pojo.model.payload.WeatherPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.pojo.model.source.SourceOutcome;
import com.tripflow.pojo.model.source.SourceResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * FallbackSynthesizer 单元测试：
 * - 相同输入生成相同数据；
 * - 所有估算数据都带 estimated 标记与 fallback 来源。
 */
class FallbackSynthesizerTest {

    private final FallbackSynthesizer synthesizer = new FallbackSynthesizer();
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private final GatherRequest phuket = GatherRequest.builder()
            .destination("Phuket")
            .startDate(LocalDate.of(2026, 6, 1))
            .endDate(LocalDate.of(2026, 6, 5))
            .budget(30000L)
            .currency("thb")
            .build();

    @Test
    void sameInputProducesSamePayload() throws Exception {
        for (ProviderType type : ProviderType.values()) {
            SourceResult first = synthesizer.synthesize(type, phuket, "timeout");
            SourceResult second = synthesizer.synthesize(type, phuket, "timeout");
            assertEquals(objectMapper.writeValueAsString(first.getPayload()),
                    objectMapper.writeValueAsString(second.getPayload()), type.getCode());
        }
    }

    @Test
    void differentDestinationChangesSeed() {
        GatherRequest bangkok = phuket.toBuilder().destination("Bangkok").build();
        assertNotEquals(FallbackSynthesizer.seed(ProviderType.WEATHER, phuket),
                FallbackSynthesizer.seed(ProviderType.WEATHER, bangkok));
        // 目的地大小写与首尾空白不影响结果
        GatherRequest sameCity = phuket.toBuilder().destination("  PHUKET ").build();
        assertEquals(FallbackSynthesizer.seed(ProviderType.WEATHER, phuket),
                FallbackSynthesizer.seed(ProviderType.WEATHER, sameCity));
    }

    @Test
    void everyPayloadIsLabelledEstimated() {
        for (ProviderType type : ProviderType.values()) {
            SourceResult result = synthesizer.synthesize(type, phuket, "unavailable");
            assertEquals(SourceOutcome.FALLBACK, result.getOutcome());
            assertEquals("unavailable", result.getReason());
            assertTrue(result.getPayload().isEstimated(), type.getCode());
            assertEquals(FallbackSynthesizer.SOURCE, result.getPayload().getSource());
            assertTrue(result.getPayload().isFullyLabelled(), type.getCode());
        }
    }

    @Test
    void weatherCoversEveryTripDay() {
        WeatherPayload weather = (WeatherPayload) synthesizer.synthesize(ProviderType.WEATHER, phuket, "timeout").getPayload();
        assertEquals(5, weather.getDays().size());
        assertEquals(LocalDate.of(2026, 6, 1), weather.getDays().get(0).getDate());
        weather.getDays().forEach(d -> assertTrue(d.getLowC() < d.getHighC()));
    }

    @Test
    void hotelPriceFollowsBudget() {
        HotelPayload hotels = (HotelPayload) synthesizer.synthesize(ProviderType.HOTELS, phuket, "timeout").getPayload();
        // 30000 * 40% / 4 晚
        assertEquals(3000L, hotels.getHotels().get(1).getPricePerNight());
        assertEquals("THB", hotels.getHotels().get(1).getCurrency());
        assertEquals(3, hotels.getHotels().size());
    }

    @Test
    void transitWithoutPlacesEstimatesAirportTransfer() {
        TransitPayload transit = (TransitPayload) synthesizer.synthesize(ProviderType.TRANSIT, phuket, "timeout").getPayload();
        assertEquals(1, transit.getLegs().size());
        assertEquals("Phuket airport", transit.getLegs().get(0).getFrom());

        GatherRequest withPlaces = phuket.toBuilder().place("Old Town").place("Patong Beach").place("Big Buddha").build();
        TransitPayload legs = (TransitPayload) synthesizer.synthesize(ProviderType.TRANSIT, withPlaces, "timeout").getPayload();
        assertEquals(2, legs.getLegs().size());
        assertEquals("Patong Beach", legs.getLegs().get(1).getFrom());
    }
}
