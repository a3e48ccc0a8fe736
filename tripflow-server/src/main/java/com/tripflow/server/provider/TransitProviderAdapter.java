package com.tripflow.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.ProviderProperties;
import com.tripflow.pojo.model.payload.TransitLeg;
import com.tripflow.pojo.model.payload.TransitPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Google Directions 公共交通路线，places 中相邻两点组成一段。
 * 没有途经点时查询机场到市中心。
 */
@Component
public class TransitProviderAdapter extends AbstractHttpProviderAdapter {

    private static final int MAX_LEGS = 8;

    public TransitProviderAdapter(@Qualifier("providerHttpClient") HttpClient httpClient,
                                  ObjectMapper objectMapper,
                                  ProviderProperties providerProperties) {
        super(httpClient, objectMapper, providerProperties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.TRANSIT;
    }

    @Override
    protected ProviderProperties.Settings settings() {
        return providerProperties.getTransit();
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://maps.googleapis.com/maps/api";
    }

    @Override
    protected String sourceName() {
        return "google-directions";
    }

    @Override
    protected CompletableFuture<TransitPayload> doFetch(GatherRequest request, Duration timeout) {
        List<String[]> pairs = legPairs(request);
        List<CompletableFuture<TransitLeg>> calls = new ArrayList<>();
        for (String[] pair : pairs) {
            calls.add(fetchLeg(pair[0], pair[1], timeout));
        }
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).thenApply(v -> {
            TransitPayload payload = new TransitPayload();
            for (CompletableFuture<TransitLeg> call : calls) {
                payload.getLegs().add(call.join());
            }
            return payload;
        });
    }

    static List<String[]> legPairs(GatherRequest request) {
        List<String> places = request.getPlaces();
        List<String[]> pairs = new ArrayList<>();
        if (places == null || places.size() < 2) {
            String destination = request.getDestination();
            pairs.add(new String[]{destination + " airport", destination + " city center"});
            return pairs;
        }
        for (int i = 0; i + 1 < places.size() && pairs.size() < MAX_LEGS; i++) {
            pairs.add(new String[]{places.get(i), places.get(i + 1)});
        }
        return pairs;
    }

    private CompletableFuture<TransitLeg> fetchLeg(String from, String to, Duration timeout) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("origin", from);
        params.put("destination", to);
        params.put("mode", option("mode", "transit"));
        params.put("key", settings().getApiKey());
        URI uri = URI.create(baseUrl() + "/directions/json?" + query(params));
        return getJson(uri, timeout, null).thenApply(root -> parseLeg(root, from, to));
    }

    TransitLeg parseLeg(JsonNode root, String from, String to) {
        String status = root.path("status").asText();
        if (!"OK".equals(status)) {
            FailureType failure = "OVER_QUERY_LIMIT".equals(status) ? FailureType.RATE_LIMIT
                    : "REQUEST_DENIED".equals(status) ? FailureType.AUTHENTICATION
                    : FailureType.INVALID_RESPONSE;
            throw new ProviderException(type(), failure, "directions status " + status);
        }
        JsonNode leg = root.path("routes").path(0).path("legs").path(0);
        int seconds = leg.path("duration").path("value").asInt();
        int meters = leg.path("distance").path("value").asInt();
        return new TransitLeg(from, to, option("mode", "transit"), Math.max(1, seconds / 60), meters, false);
    }
}
