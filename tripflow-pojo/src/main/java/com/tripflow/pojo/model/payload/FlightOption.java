package com.tripflow.pojo.model.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlightOption {

    /** 航司或报价渠道 */
    private String carrier;

    private String origin;

    private String destination;

    private String departDate;

    private int stops;

    private int durationMinutes;

    private long price;

    private String currency;

    private boolean estimated;
}
