package com.tripflow.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.ProviderProperties;
import com.tripflow.pojo.model.payload.HotelOption;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hotellook 缓存报价接口，priceAvg 为整段入住总价，这里折算成每晚价格。
 */
@Component
public class HotelProviderAdapter extends AbstractHttpProviderAdapter {

    private static final int MAX_HOTELS = 6;

    public HotelProviderAdapter(@Qualifier("providerHttpClient") HttpClient httpClient,
                                ObjectMapper objectMapper,
                                ProviderProperties providerProperties) {
        super(httpClient, objectMapper, providerProperties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.HOTELS;
    }

    @Override
    protected ProviderProperties.Settings settings() {
        return providerProperties.getHotels();
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://engine.hotellook.com/api/v2";
    }

    @Override
    protected String sourceName() {
        return "hotellook";
    }

    @Override
    protected CompletableFuture<HotelPayload> doFetch(GatherRequest request, Duration timeout) {
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new ProviderException(type(), FailureType.UNSUPPORTED, "缺少入住日期");
        }
        String currency = request.getCurrency() == null ? "thb" : request.getCurrency().toLowerCase();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("location", request.getDestination());
        params.put("checkIn", request.getStartDate().toString());
        params.put("checkOut", request.getEndDate().toString());
        params.put("adults", String.valueOf(Math.max(1, request.getTravelers())));
        params.put("currency", currency);
        params.put("limit", String.valueOf(MAX_HOTELS));
        params.put("token", settings().getApiKey());
        URI uri = URI.create(baseUrl() + "/cache.json?" + query(params));
        int nights = request.nights();
        return getJson(uri, timeout, null).thenApply(root -> parse(root, nights, currency.toUpperCase()));
    }

    HotelPayload parse(JsonNode root, int nights, String currency) {
        if (!root.isArray()) {
            throw new ProviderException(type(), FailureType.INVALID_RESPONSE, "hotel list missing");
        }
        HotelPayload payload = new HotelPayload();
        for (JsonNode item : root) {
            if (payload.getHotels().size() >= MAX_HOTELS) {
                break;
            }
            int stars = item.path("stars").asInt(0);
            long total = Math.round(item.path("priceAvg").asDouble(item.path("priceFrom").asDouble()));
            payload.getHotels().add(new HotelOption(
                    item.path("hotelName").asText("unknown"),
                    tierOf(stars),
                    total / Math.max(1, nights),
                    currency,
                    stars,
                    false));
        }
        return payload;
    }

    static String tierOf(int stars) {
        if (stars >= 5) {
            return "premium";
        }
        return stars >= 3 ? "mid" : "budget";
    }
}
