package com.tripflow.pojo.model.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DailyWeather {

    private LocalDate date;

    private String condition;

    private double highC;

    private double lowC;

    /** 降水概率 0-100 */
    private int precipitationChance;

    private boolean estimated;
}
