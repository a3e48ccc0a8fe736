package com.tripflow.pojo.model.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 由会话槽位解析出的完整出行参数，生成流水线的输入。
 */
@Value
@Builder(toBuilder = true)
public class ResolvedTrip {

    String destination;

    String origin;

    LocalDate startDate;

    LocalDate endDate;

    /** 总预算，未知时为 null */
    Long budget;

    String currency;

    int travelers;

    /** solo / couple / family / friends / business */
    String travelerType;

    @Singular
    List<String> interests;

    public int days() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public LocalDate dateOf(int dayNumber) {
        return startDate.plusDays(dayNumber - 1L);
    }
}
