package com.tripflow.pojo.model.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransitLeg {

    private String from;

    private String to;

    /** transit / driving / walking */
    private String mode;

    private int durationMinutes;

    private int distanceMeters;

    private boolean estimated;
}
