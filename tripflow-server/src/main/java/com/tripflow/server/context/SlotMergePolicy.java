package com.tripflow.server.context;

import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.pojo.model.context.ExtractedSlot;
import com.tripflow.pojo.model.context.SlotValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 槽位覆盖规则：
 * - 槽位为空时直接写入；
 * - 已有值置信度达到阈值时，只有显式指向该槽位的新抽取才能覆盖；
 * - 低置信度的旧值可以被任何新抽取覆盖。
 */
@Component
@RequiredArgsConstructor
public class SlotMergePolicy {

    private final PlannerProperties plannerProperties;

    public boolean shouldOverwrite(SlotValue existing, ExtractedSlot incoming) {
        if (incoming == null || !StringUtils.hasText(incoming.getValue())) {
            return false;
        }
        if (existing == null) {
            return true;
        }
        if (existing.getConfidence() >= plannerProperties.getSlotConfidenceThreshold()) {
            return incoming.isExplicit();
        }
        return true;
    }
}
