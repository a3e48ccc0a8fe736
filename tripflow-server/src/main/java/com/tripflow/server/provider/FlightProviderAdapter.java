package com.tripflow.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.ProviderProperties;
import com.tripflow.pojo.model.payload.FlightOption;
import com.tripflow.pojo.model.payload.FlightPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.server.intent.Destination;
import com.tripflow.server.intent.DestinationGazetteer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Travelpayouts 机票缓存价格接口。
 * 出发地不在内置目的地表中时使用 options.defaultOrigin。
 */
@Component
public class FlightProviderAdapter extends AbstractHttpProviderAdapter {

    private static final DateTimeFormatter MONTH_START = DateTimeFormatter.ofPattern("yyyy-MM-01");

    private static final int MAX_OFFERS = 5;

    public FlightProviderAdapter(@Qualifier("providerHttpClient") HttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 ProviderProperties providerProperties) {
        super(httpClient, objectMapper, providerProperties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.FLIGHTS;
    }

    @Override
    protected ProviderProperties.Settings settings() {
        return providerProperties.getFlights();
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.travelpayouts.com";
    }

    @Override
    protected String sourceName() {
        return "travelpayouts";
    }

    @Override
    protected CompletableFuture<FlightPayload> doFetch(GatherRequest request, Duration timeout) {
        String destinationCode = airportCode(request.getDestination(), null);
        if (destinationCode == null) {
            throw new ProviderException(type(), FailureType.UNSUPPORTED, "目的地没有机场代码: " + request.getDestination());
        }
        String originCode = airportCode(request.getOrigin(), option("defaultOrigin", "BKK"));
        String currency = request.getCurrency() == null ? "thb" : request.getCurrency().toLowerCase();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("origin", originCode);
        params.put("destination", destinationCode);
        if (request.getStartDate() != null) {
            params.put("beginning_of_period", request.getStartDate().format(MONTH_START));
            params.put("period_type", "month");
        }
        params.put("currency", currency);
        params.put("limit", String.valueOf(MAX_OFFERS));
        params.put("sorting", "price");
        URI uri = URI.create(baseUrl() + "/v2/prices/latest?" + query(params));
        Map<String, String> headers = Map.of("X-Access-Token", settings().getApiKey());
        return getJson(uri, timeout, headers).thenApply(root -> parse(root, currency.toUpperCase()));
    }

    FlightPayload parse(JsonNode root, String currency) {
        if (!root.path("success").asBoolean(true) || !root.path("data").isArray()) {
            throw new ProviderException(type(), FailureType.INVALID_RESPONSE, "prices data missing");
        }
        FlightPayload payload = new FlightPayload();
        for (JsonNode item : root.path("data")) {
            if (payload.getOffers().size() >= MAX_OFFERS) {
                break;
            }
            payload.getOffers().add(new FlightOption(
                    item.path("gate").asText("unknown"),
                    item.path("origin").asText(),
                    item.path("destination").asText(),
                    item.path("depart_date").asText(),
                    item.path("number_of_changes").asInt(0),
                    item.path("duration").asInt(0),
                    item.path("value").asLong(),
                    currency,
                    false));
        }
        return payload;
    }

    private static String airportCode(String place, String defaultCode) {
        if (place == null) {
            return defaultCode;
        }
        if (place.matches("[A-Z]{3}")) {
            return place;
        }
        Destination d = DestinationGazetteer.lookup(place);
        return d == null ? defaultCode : d.getAirportCode();
    }
}
