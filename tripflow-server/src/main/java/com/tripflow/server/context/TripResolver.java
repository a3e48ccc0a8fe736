package com.tripflow.server.context;

import com.tripflow.common.exception.InvalidRequestException;
import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.SlotValue;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 把槽位解析成 {@link ResolvedTrip}：结束日期优先取 end_date，否则由 start_date + duration_days 推算。
 */
public final class TripResolver {

    public static final int MAX_TRIP_DAYS = 30;

    private TripResolver() {
    }

    /**
     * @throws InvalidRequestException 必要槽位缺失或取值不合法
     */
    public static ResolvedTrip resolve(Map<SlotName, SlotValue> slots, String defaultCurrency) {
        List<SlotName> missing = RequiredSlots.missing(slots);
        if (!missing.isEmpty()) {
            throw new InvalidRequestException("缺少必要信息: " + missing);
        }
        LocalDate start = parseDate(value(slots, SlotName.START_DATE));
        LocalDate end;
        String endValue = value(slots, SlotName.END_DATE);
        if (endValue != null) {
            end = parseDate(endValue);
        } else {
            int days = parseInt(value(slots, SlotName.DURATION_DAYS), SlotName.DURATION_DAYS);
            end = start.plusDays(days - 1L);
        }
        if (end.isBefore(start)) {
            throw new InvalidRequestException("结束日期早于出发日期");
        }
        if (ChronoUnit.DAYS.between(start, end) + 1 > MAX_TRIP_DAYS) {
            throw new InvalidRequestException("行程不能超过 " + MAX_TRIP_DAYS + " 天");
        }

        ResolvedTrip.ResolvedTripBuilder builder = ResolvedTrip.builder()
                .destination(value(slots, SlotName.DESTINATION))
                .origin(value(slots, SlotName.ORIGIN))
                .startDate(start)
                .endDate(end)
                .currency(defaultCurrency)
                .travelerType(value(slots, SlotName.TRAVELER_TYPE))
                .travelers(1);
        String budget = value(slots, SlotName.BUDGET);
        if (budget != null) {
            builder.budget(parseAmount(budget));
        }
        String travelers = value(slots, SlotName.TRAVELERS_COUNT);
        if (travelers != null) {
            builder.travelers(Math.max(1, parseInt(travelers, SlotName.TRAVELERS_COUNT)));
        }
        String interests = value(slots, SlotName.INTERESTS);
        if (interests != null) {
            Arrays.stream(interests.split("[,，]"))
                    .map(String::trim)
                    .filter(StringUtils::hasText)
                    .distinct()
                    .forEach(builder::interest);
        }
        return builder.build();
    }

    private static String value(Map<SlotName, SlotValue> slots, SlotName name) {
        SlotValue v = slots.get(name);
        return v == null || !StringUtils.hasText(v.getValue()) ? null : v.getValue().trim();
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("日期格式不正确: " + value);
        }
    }

    private static int parseInt(String value, SlotName name) {
        long parsed = parseNumber(value, name);
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            throw new InvalidRequestException(name.getCode() + " 取值超出范围: " + value);
        }
        return (int) parsed;
    }

    /**
     * 预算按 long 解析，不做 int 截断。
     */
    static long parseAmount(String value) {
        long amount = parseNumber(value, SlotName.BUDGET);
        if (amount < 0) {
            throw new InvalidRequestException(SlotName.BUDGET.getCode() + " 不能为负数: " + value);
        }
        return amount;
    }

    private static long parseNumber(String value, SlotName name) {
        try {
            return Math.round(Double.parseDouble(value.replace(",", "")));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(name.getCode() + " 取值不正确: " + value);
        }
    }
}
