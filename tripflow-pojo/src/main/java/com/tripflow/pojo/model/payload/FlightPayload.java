package com.tripflow.pojo.model.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class FlightPayload extends ProviderPayload {

    private List<FlightOption> offers = new ArrayList<>();

    @Override
    public boolean isFullyLabelled() {
        return isEstimated() && offers.stream().allMatch(FlightOption::isEstimated);
    }
}
