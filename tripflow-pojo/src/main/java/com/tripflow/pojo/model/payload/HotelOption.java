package com.tripflow.pojo.model.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HotelOption {

    private String name;

    /** budget / mid / premium */
    private String tier;

    private long pricePerNight;

    private String currency;

    private double rating;

    private boolean estimated;
}
