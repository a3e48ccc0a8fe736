package com.tripflow.server.fallback;

import com.tripflow.pojo.model.payload.DailyWeather;
import com.tripflow.pojo.model.payload.FlightOption;
import com.tripflow.pojo.model.payload.FlightPayload;
import com.tripflow.pojo.model.payload.HotelOption;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.payload.ImagePayload;
import com.tripflow.pojo.model.payload.ImageRef;
import com.tripflow.pojo.model.payload.ProviderPayload;
import com.tripflow.pojo.model.payload.TransitLeg;
import com.tripflow.pojo.model.payload.TransitPayload;
import com.tripflow.pojo.model.payload.WeatherPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.pojo.model.source.SourceResult;
import com.tripflow.server.intent.ClimateZone;
import com.tripflow.server.intent.Destination;
import com.tripflow.server.intent.DestinationGazetteer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * 数据源失败时的本地估算数据。
 * <p>
 * 同一个 (目的地, 日期范围, 数据源) 总是生成相同的数据；
 * 整份 payload 和其中每条记录都标记 estimated=true，source 固定为 fallback。
 */
@Slf4j
@Component
public class FallbackSynthesizer {

    public static final String SOURCE = "fallback";

    private static final String[] WEATHER_CONDITIONS = {"clear", "clouds", "rain"};

    private static final String IMAGE_BASE = "https://placehold.co/800x600?text=";

    public SourceResult synthesize(ProviderType provider, GatherRequest request, String reason) {
        Random random = new Random(seed(provider, request));
        ProviderPayload payload;
        switch (provider) {
            case WEATHER:
                payload = weather(request, random);
                break;
            case FLIGHTS:
                payload = flights(request, random);
                break;
            case HOTELS:
                payload = hotels(request, random);
                break;
            case TRANSIT:
                payload = transit(request, random);
                break;
            case IMAGES:
                payload = images(request);
                break;
            default:
                throw new IllegalArgumentException("unsupported provider " + provider);
        }
        payload.setEstimated(true);
        payload.setSource(SOURCE);
        payload.setConfidence(confidenceOf(provider));
        log.info("使用估算数据: provider={}, destination={}, reason={}",
                provider.getCode(), request.getDestination(), reason);
        return SourceResult.fallback(provider, payload, reason);
    }

    static long seed(ProviderType provider, GatherRequest request) {
        String destination = request.getDestination() == null ? "" : request.getDestination().trim().toLowerCase(Locale.ROOT);
        return Objects.hash(destination, String.valueOf(request.getStartDate()),
                String.valueOf(request.getEndDate()), provider.name());
    }

    private static double confidenceOf(ProviderType provider) {
        switch (provider) {
            case WEATHER:
                return 0.5;
            case TRANSIT:
                return 0.4;
            case IMAGES:
                return 0.2;
            default:
                return 0.3;
        }
    }

    private WeatherPayload weather(GatherRequest request, Random random) {
        Destination destination = DestinationGazetteer.lookup(request.getDestination());
        ClimateZone zone = destination == null ? ClimateZone.TEMPERATE : destination.getClimate();
        boolean southern = destination != null && destination.isSouthernHemisphere();
        WeatherPayload payload = new WeatherPayload();
        LocalDate start = request.getStartDate() == null ? LocalDate.now() : request.getStartDate();
        for (int i = 0; i < request.days(); i++) {
            LocalDate date = start.plusDays(i);
            int month = date.getMonthValue();
            double high = zone.averageHigh(month, southern) + jitter(random, 2.0);
            double low = Math.min(high - 3, zone.averageLow(month, southern) + jitter(random, 2.0));
            int precipitation = Math.max(0, Math.min(100, zone.precipitationChance(month, southern) + random.nextInt(11) - 5));
            String condition = precipitation >= 60 ? WEATHER_CONDITIONS[2]
                    : precipitation >= 30 ? WEATHER_CONDITIONS[1] : WEATHER_CONDITIONS[0];
            payload.getDays().add(new DailyWeather(date, condition, round(high), round(low), precipitation, true));
        }
        return payload;
    }

    private FlightPayload flights(GatherRequest request, Random random) {
        Destination destination = DestinationGazetteer.lookup(request.getDestination());
        Destination origin = DestinationGazetteer.lookup(request.getOrigin());
        String to = destination == null ? request.getDestination() : destination.getAirportCode();
        String from = origin == null ? (request.getOrigin() == null ? "BKK" : request.getOrigin()) : origin.getAirportCode();
        String currency = currency(request);
        String departDate = request.getStartDate() == null ? null : request.getStartDate().toString();
        long base = 3000 + random.nextInt(4000);
        FlightPayload payload = new FlightPayload();
        payload.getOffers().add(new FlightOption("direct", from, to, departDate, 0, 90 + random.nextInt(120), base * 13 / 10, currency, true));
        payload.getOffers().add(new FlightOption("one-stop", from, to, departDate, 1, 240 + random.nextInt(180), base, currency, true));
        payload.getOffers().add(new FlightOption("budget", from, to, departDate, 1, 300 + random.nextInt(240), base * 8 / 10, currency, true));
        return payload;
    }

    private HotelPayload hotels(GatherRequest request, Random random) {
        String currency = currency(request);
        long perNight;
        if (request.getBudget() != null && request.getBudget() > 0) {
            // 预算的 40% 用于住宿
            perNight = Math.max(500, request.getBudget() * 4 / 10 / request.nights());
        } else {
            perNight = 1500 + random.nextInt(1000);
        }
        String city = request.getDestination();
        HotelPayload payload = new HotelPayload();
        payload.getHotels().add(new HotelOption(city + " budget stay", "budget", perNight * 6 / 10, currency, 3.0, true));
        payload.getHotels().add(new HotelOption(city + " central hotel", "mid", perNight, currency, 4.0, true));
        payload.getHotels().add(new HotelOption(city + " resort", "premium", perNight * 2, currency, 4.5, true));
        return payload;
    }

    private TransitPayload transit(GatherRequest request, Random random) {
        TransitPayload payload = new TransitPayload();
        List<String> places = request.getPlaces();
        if (places == null || places.size() < 2) {
            String city = request.getDestination();
            payload.getLegs().add(new TransitLeg(city + " airport", city + " city center", "driving",
                    40 + random.nextInt(20), 25000, true));
            return payload;
        }
        for (int i = 0; i + 1 < places.size(); i++) {
            payload.getLegs().add(new TransitLeg(places.get(i), places.get(i + 1), "transit", 30, 5000, true));
        }
        return payload;
    }

    private ImagePayload images(GatherRequest request) {
        ImagePayload payload = new ImagePayload();
        payload.getImages().add(placeholder(request.getDestination()));
        if (request.getPlaces() != null) {
            for (String place : request.getPlaces()) {
                payload.getImages().add(placeholder(place));
            }
        }
        return payload;
    }

    private static ImageRef placeholder(String subject) {
        return new ImageRef(subject, IMAGE_BASE + URLEncoder.encode(subject == null ? "" : subject, StandardCharsets.UTF_8), true);
    }

    private static String currency(GatherRequest request) {
        return request.getCurrency() == null ? "THB" : request.getCurrency().toUpperCase(Locale.ROOT);
    }

    private static double jitter(Random random, double amplitude) {
        return (random.nextDouble() * 2 - 1) * amplitude;
    }

    private static double round(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
