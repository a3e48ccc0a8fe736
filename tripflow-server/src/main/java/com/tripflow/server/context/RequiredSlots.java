package com.tripflow.server.context;

import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.SlotValue;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 生成行程前必须具备的槽位：目的地、出发日期，以及结束日期或天数之一。
 */
public final class RequiredSlots {

    private RequiredSlots() {
    }

    public static List<SlotName> missing(Map<SlotName, SlotValue> slots) {
        List<SlotName> missing = new ArrayList<>();
        if (!present(slots, SlotName.DESTINATION)) {
            missing.add(SlotName.DESTINATION);
        }
        if (!present(slots, SlotName.START_DATE)) {
            missing.add(SlotName.START_DATE);
        }
        if (!present(slots, SlotName.END_DATE) && !present(slots, SlotName.DURATION_DAYS)) {
            missing.add(SlotName.DURATION_DAYS);
        }
        return missing;
    }

    private static boolean present(Map<SlotName, SlotValue> slots, SlotName name) {
        SlotValue v = slots == null ? null : slots.get(name);
        return v != null && StringUtils.hasText(v.getValue());
    }
}
