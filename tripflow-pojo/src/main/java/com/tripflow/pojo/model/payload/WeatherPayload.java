package com.tripflow.pojo.model.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class WeatherPayload extends ProviderPayload {

    private List<DailyWeather> days = new ArrayList<>();

    @Override
    public boolean isFullyLabelled() {
        return isEstimated() && days.stream().allMatch(DailyWeather::isEstimated);
    }
}
