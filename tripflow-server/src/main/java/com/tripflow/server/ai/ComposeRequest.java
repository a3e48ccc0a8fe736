package com.tripflow.server.ai;

import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.payload.DailyWeather;
import com.tripflow.pojo.model.payload.WeatherPayload;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.source.ProviderType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 一次编排的输入：需要生成的天、采集到的数据，重规划时还有保留不变的天与修改说明。
 */
@Value
@Builder
public class ComposeRequest {

    ResolvedTrip trip;

    GatherResult gathered;

    @Singular
    List<Integer> dayNumbers;

    /** 重规划时不需要重新生成的天，只作为上下文 */
    @Singular
    List<DayPlan> keptDays;

    String instruction;

    public DailyWeather weatherOn(LocalDate date) {
        WeatherPayload weather = gathered == null ? null : gathered.payload(ProviderType.WEATHER, WeatherPayload.class);
        if (weather == null) {
            return null;
        }
        for (DailyWeather day : weather.getDays()) {
            if (date.equals(day.getDate())) {
                return day;
            }
        }
        return null;
    }
}
