package com.tripflow.server.replan;

import com.tripflow.pojo.model.itinerary.ReplanKind;
import lombok.Value;

import java.util.Set;
import java.util.SortedSet;

/**
 * 解析后的修改范围。HOTEL_CHANGE 的 days 为空。
 */
@Value
public class ReplanScope {

    ReplanKind kind;

    SortedSet<Integer> days;

    /** ACTIVITY_SWAP 时要替换的活动 */
    Set<String> activityIds;

    String instruction;

    public String summary() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase());
        if (!days.isEmpty()) {
            sb.append(" days=").append(days);
        }
        if (!activityIds.isEmpty()) {
            sb.append(" activities=").append(activityIds);
        }
        if (instruction != null && !instruction.isBlank()) {
            sb.append(": ").append(instruction.trim());
        }
        return sb.toString();
    }
}
