package com.tripflow.server.pipeline;

import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.itinerary.Activity;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.payload.DailyWeather;
import com.tripflow.pojo.model.payload.FlightPayload;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.payload.ImagePayload;
import com.tripflow.pojo.model.payload.ImageRef;
import com.tripflow.pojo.model.payload.TransitLeg;
import com.tripflow.pojo.model.payload.TransitPayload;
import com.tripflow.pojo.model.payload.WeatherPayload;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.source.ProviderType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 把编排草稿与采集数据合并成最终的 DayPlan / ItineraryVersion。
 * 来自估算数据的天气、图片、交通都带上对应的 estimated 标记。
 */
@Component
public class ItineraryAssembler {

    public List<DayPlan> decorate(List<DayPlan> drafts, ResolvedTrip trip, GatherResult gathered, boolean templatePlan) {
        List<DayPlan> days = new ArrayList<>();
        for (DayPlan draft : drafts) {
            days.add(decorate(draft, trip, gathered, templatePlan));
        }
        return days;
    }

    public DayPlan decorate(DayPlan draft, ResolvedTrip trip, GatherResult gathered, boolean templatePlan) {
        int dayNumber = draft.getDayNumber();
        DayPlan.DayPlanBuilder day = draft.toBuilder()
                .date(trip.dateOf(dayNumber))
                .templatePlan(templatePlan || draft.isTemplatePlan())
                .clearActivities();

        WeatherPayload weather = gathered.payload(ProviderType.WEATHER, WeatherPayload.class);
        DailyWeather w = findWeather(weather, trip.dateOf(dayNumber).toString());
        if (w != null) {
            day.weatherSummary(String.format(Locale.ROOT, "%s %.0f/%.0f°C, rain %d%%",
                    w.getCondition(), w.getHighC(), w.getLowC(), w.getPrecipitationChance()));
            day.weatherEstimated(w.isEstimated() || weather.isEstimated());
        } else {
            day.weatherSummary(null).weatherEstimated(false);
        }

        ImagePayload images = gathered.payload(ProviderType.IMAGES, ImagePayload.class);
        TransitPayload transit = gathered.payload(ProviderType.TRANSIT, TransitPayload.class);
        List<Activity> activities = draft.getActivities();
        for (int i = 0; i < activities.size(); i++) {
            Activity a = activities.get(i);
            Activity.ActivityBuilder b = a.toBuilder()
                    .activityId(activityId(dayNumber, i + 1, a.getTitle()));
            ImageRef image = findImage(images, a, dayNumber + i);
            if (image != null) {
                b.imageUrl(image.getUrl()).imageEstimated(image.isEstimated() || images.isEstimated());
            }
            if (i > 0 && transit != null && !transit.getLegs().isEmpty()) {
                TransitLeg leg = findLeg(transit, activities.get(i - 1).getLocation(), a.getLocation());
                if (leg != null) {
                    b.transitMinutes(leg.getDurationMinutes()).transitEstimated(leg.isEstimated() || transit.isEstimated());
                } else {
                    // 没有对应路段时用平均耗时，视为估算
                    b.transitMinutes(averageMinutes(transit)).transitEstimated(true);
                }
            }
            day.activity(b.build());
        }
        return day.build();
    }

    public ItineraryVersion buildVersion(String conversationKey, ResolvedTrip trip, List<DayPlan> days,
                                         GatherResult gathered, boolean templatePlan) {
        ItineraryVersion.ItineraryVersionBuilder version = ItineraryVersion.builder()
                .conversationKey(conversationKey)
                .destination(trip.getDestination())
                .startDate(trip.getStartDate())
                .endDate(trip.getEndDate())
                .days(days)
                .sources(gathered.sourceStatuses())
                .degraded(gathered.isDegraded())
                .templatePlan(templatePlan)
                .versionNumber(1);
        FlightPayload flights = gathered.payload(ProviderType.FLIGHTS, FlightPayload.class);
        if (flights != null) {
            version.flights(flights.getOffers());
        }
        HotelPayload hotels = gathered.payload(ProviderType.HOTELS, HotelPayload.class);
        if (hotels != null) {
            version.hotels(hotels.getHotels());
        }
        return version.build();
    }

    public static String activityId(int dayNumber, int index, String title) {
        int hash = Objects.hash(dayNumber, index, title) & 0xffff;
        return "d" + dayNumber + "-a" + index + "-" + Integer.toHexString(hash);
    }

    private static DailyWeather findWeather(WeatherPayload weather, String date) {
        if (weather == null) {
            return null;
        }
        for (DailyWeather d : weather.getDays()) {
            if (d.getDate() != null && date.equals(d.getDate().toString())) {
                return d;
            }
        }
        return null;
    }

    private static ImageRef findImage(ImagePayload images, Activity activity, int rotation) {
        if (images == null || images.getImages().isEmpty()) {
            return null;
        }
        for (ImageRef ref : images.getImages()) {
            String subject = ref.getSubject() == null ? "" : ref.getSubject().toLowerCase(Locale.ROOT);
            if (matches(subject, activity.getLocation()) || matches(subject, activity.getTitle())) {
                return ref;
            }
        }
        return images.getImages().get(Math.floorMod(rotation, images.getImages().size()));
    }

    private static boolean matches(String subject, String text) {
        return text != null && !subject.isEmpty() && subject.equalsIgnoreCase(text.trim());
    }

    private static TransitLeg findLeg(TransitPayload transit, String from, String to) {
        for (TransitLeg leg : transit.getLegs()) {
            if (leg.getFrom() != null && leg.getFrom().equalsIgnoreCase(from)
                    && leg.getTo() != null && leg.getTo().equalsIgnoreCase(to)) {
                return leg;
            }
        }
        return null;
    }

    private static int averageMinutes(TransitPayload transit) {
        int total = 0;
        for (TransitLeg leg : transit.getLegs()) {
            total += leg.getDurationMinutes();
        }
        return Math.max(1, total / transit.getLegs().size());
    }
}
