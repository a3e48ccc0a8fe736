package com.tripflow.pojo.model.source;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 一次数据采集的输入。providers 为空时查询全部数据源。
 */
@Value
@Builder(toBuilder = true)
public class GatherRequest {

    String destination;

    String origin;

    LocalDate startDate;

    LocalDate endDate;

    @Singular
    List<String> interests;

    /** 总预算金额，可能为空 */
    Long budget;

    String currency;

    @Builder.Default
    int travelers = 1;

    /** 交通路线途经点，按顺序两两组成路段 */
    @Singular
    List<String> places;

    Set<ProviderType> providers;

    public Set<ProviderType> requestedProviders() {
        if (providers == null || providers.isEmpty()) {
            return EnumSet.allOf(ProviderType.class);
        }
        return EnumSet.copyOf(providers);
    }

    public int days() {
        if (startDate == null || endDate == null) {
            return 1;
        }
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public int nights() {
        return Math.max(1, days() - 1);
    }
}
