package com.tripflow.pojo.model.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class HotelPayload extends ProviderPayload {

    private List<HotelOption> hotels = new ArrayList<>();

    @Override
    public boolean isFullyLabelled() {
        return isEstimated() && hotels.stream().allMatch(HotelOption::isEstimated);
    }
}
