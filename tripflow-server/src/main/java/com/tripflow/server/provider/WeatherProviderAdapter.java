package com.tripflow.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.ProviderProperties;
import com.tripflow.pojo.model.payload.DailyWeather;
import com.tripflow.pojo.model.payload.WeatherPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * OpenWeatherMap 5 天 / 3 小时预报，按当地日期聚合成日天气。
 * 预报范围之外的日期不返回，由行程组装按缺失处理。
 */
@Component
public class WeatherProviderAdapter extends AbstractHttpProviderAdapter {

    public WeatherProviderAdapter(@Qualifier("providerHttpClient") HttpClient httpClient,
                                  ObjectMapper objectMapper,
                                  ProviderProperties providerProperties) {
        super(httpClient, objectMapper, providerProperties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.WEATHER;
    }

    @Override
    protected ProviderProperties.Settings settings() {
        return providerProperties.getWeather();
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.openweathermap.org/data/2.5";
    }

    @Override
    protected String sourceName() {
        return "openweathermap";
    }

    @Override
    protected CompletableFuture<WeatherPayload> doFetch(GatherRequest request, Duration timeout) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", request.getDestination());
        params.put("units", "metric");
        params.put("appid", settings().getApiKey());
        URI uri = URI.create(baseUrl() + "/forecast?" + query(params));
        return getJson(uri, timeout, null).thenApply(root -> parse(root, request));
    }

    WeatherPayload parse(JsonNode root, GatherRequest request) {
        JsonNode list = root.path("list");
        if (!list.isArray()) {
            throw new ProviderException(type(), FailureType.INVALID_RESPONSE, "forecast list missing");
        }
        ZoneOffset offset = ZoneOffset.ofTotalSeconds(root.path("city").path("timezone").asInt(0));
        Map<LocalDate, Aggregate> byDate = new TreeMap<>();
        for (JsonNode entry : list) {
            LocalDate date = Instant.ofEpochSecond(entry.path("dt").asLong()).atOffset(offset).toLocalDate();
            if (request.getStartDate() != null && date.isBefore(request.getStartDate())) {
                continue;
            }
            if (request.getEndDate() != null && date.isAfter(request.getEndDate())) {
                continue;
            }
            Aggregate agg = byDate.computeIfAbsent(date, d -> new Aggregate());
            JsonNode main = entry.path("main");
            agg.high = Math.max(agg.high, main.path("temp_max").asDouble(main.path("temp").asDouble()));
            agg.low = Math.min(agg.low, main.path("temp_min").asDouble(main.path("temp").asDouble()));
            agg.pop = Math.max(agg.pop, entry.path("pop").asDouble(0));
            String condition = entry.path("weather").path(0).path("main").asText("");
            if (!condition.isEmpty()) {
                agg.conditions.merge(condition.toLowerCase(), 1, Integer::sum);
            }
        }
        WeatherPayload payload = new WeatherPayload();
        byDate.forEach((date, agg) -> payload.getDays().add(new DailyWeather(
                date, agg.dominantCondition(), round(agg.high), round(agg.low),
                (int) Math.round(agg.pop * 100), false)));
        return payload;
    }

    private static double round(double v) {
        return Math.round(v * 10) / 10.0;
    }

    private static final class Aggregate {
        double high = -Double.MAX_VALUE;
        double low = Double.MAX_VALUE;
        double pop;
        final Map<String, Integer> conditions = new HashMap<>();

        String dominantCondition() {
            return conditions.entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .orElse("unknown");
        }
    }
}
