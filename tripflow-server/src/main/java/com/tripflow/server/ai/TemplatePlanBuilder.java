package com.tripflow.server.ai;

import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.itinerary.Activity;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.payload.DailyWeather;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板行程：LLM 不可用时的确定性兜底，每天上午景点、午餐、下午活动三段。
 * 生成的天都标记 templatePlan=true。
 */
@Component
public class TemplatePlanBuilder implements PlanComposer {

    private static final int RAINY_PRECIPITATION = 60;

    @Override
    public List<DayPlan> compose(ComposeRequest request) {
        ResolvedTrip trip = request.getTrip();
        List<String> interests = trip.getInterests();
        String destination = trip.getDestination();
        List<DayPlan> days = new ArrayList<>();
        for (Integer dayNumber : request.getDayNumbers()) {
            DailyWeather weather = request.weatherOn(trip.dateOf(dayNumber));
            boolean rainy = weather != null && weather.getPrecipitationChance() >= RAINY_PRECIPITATION;
            String interest = interests.isEmpty() ? "sightseeing" : interests.get((dayNumber - 1) % interests.size());

            DayPlan.DayPlanBuilder day = DayPlan.builder()
                    .dayNumber(dayNumber)
                    .title(dayTitle(destination, dayNumber, interest, trip.days()))
                    .templatePlan(true);
            if (rainy) {
                day.activity(activity("09:00", "12:00", destination + " 博物馆与室内景点",
                        "雨天备选：室内参观", destination, "culture"));
            } else {
                day.activity(activity("09:00", "12:00", destination + " " + interest,
                        "上午围绕 " + interest + " 安排", destination, categoryOf(interest)));
            }
            day.activity(activity("12:30", "14:00", "当地特色午餐", "品尝 " + destination + " 本地菜", destination, "food"));
            if (dayNumber == trip.days() && trip.days() > 1) {
                day.activity(activity("14:30", "18:00", "自由活动与返程准备", "购买伴手礼、整理行李", destination, "shopping"));
            } else {
                day.activity(activity("14:30", "18:00", destination + " 城市漫步",
                        rainy ? "视天气调整为商场或市场" : "下午自由探索", destination, rainy ? "shopping" : "sightseeing"));
            }
            days.add(day.build());
        }
        return days;
    }

    private static String dayTitle(String destination, int dayNumber, String interest, int totalDays) {
        if (dayNumber == 1) {
            return "抵达 " + destination;
        }
        if (dayNumber == totalDays) {
            return destination + " 最后一天";
        }
        return destination + " 第" + dayNumber + "天：" + interest;
    }

    private static Activity activity(String start, String end, String title, String description,
                                     String location, String category) {
        return Activity.builder()
                .startTime(start)
                .endTime(end)
                .title(title)
                .description(description)
                .location(location)
                .category(category)
                .build();
    }

    private static String categoryOf(String interest) {
        return switch (interest) {
            case "beach", "nature", "diving" -> "nature";
            case "food" -> "food";
            case "shopping" -> "shopping";
            case "nightlife" -> "nightlife";
            case "culture", "museum" -> "culture";
            default -> "sightseeing";
        };
    }
}
