package com.tripflow.pojo.model.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class TransitPayload extends ProviderPayload {

    private List<TransitLeg> legs = new ArrayList<>();

    @Override
    public boolean isFullyLabelled() {
        return isEstimated() && legs.stream().allMatch(TransitLeg::isEstimated);
    }
}
