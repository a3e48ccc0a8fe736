package com.tripflow.server.replan;

import com.tripflow.common.exception.BaseException;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.context.Turn;
import com.tripflow.pojo.model.context.TurnRole;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.server.context.ConversationContextStore;
import com.tripflow.server.service.ItineraryVersionService;
import com.tripflow.server.service.PlanningService;
import com.tripflow.server.task.TaskRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.UUID;

/**
 * 重规划入口：同步校验父版本与修改范围，再以 REPLAN 任务异步执行。
 * 范围无法确定时直接抛出 AmbiguousModificationException，不创建任务。
 * 修改说明作为一轮用户对话记入父版本所属的会话。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplanCoordinator {

    private final ItineraryVersionService itineraryVersionService;
    private final ReplanPlanner replanPlanner;
    private final PlanningService planningService;
    private final ConversationContextStore conversationContextStore;
    private final Clock clock;

    public Long replan(Long versionId, ReplanRequestDTO modification) {
        ItineraryVersion parent = itineraryVersionService.loadVersion(versionId);
        if (parent == null) {
            throw new BaseException(ErrorCode.UNKNOWN_VERSION, "行程版本不存在: " + versionId);
        }
        ReplanScope scope = replanPlanner.resolveScope(parent, modification);
        log.info("重规划范围: versionId={}, scope={}", versionId, scope.summary());
        recordTurn(parent.getConversationKey(), modification);

        // 把解析出的范围写回请求，执行端不再依赖自由文本
        ReplanRequestDTO resolved = new ReplanRequestDTO();
        resolved.setKind(scope.getKind());
        resolved.setDayNumbers(new ArrayList<>(scope.getDays()));
        resolved.setActivityIds(new ArrayList<>(scope.getActivityIds()));
        resolved.setInstruction(modification.getInstruction());
        resolved.setRequestId(modification.getRequestId());

        return planningService.start(TaskRequest.builder()
                .kind(TaskKind.REPLAN)
                .conversationKey(parent.getConversationKey())
                .requestId(modification.getRequestId())
                .parentVersionId(parent.getVersionId())
                .modification(resolved)
                .build());
    }

    /**
     * 聊天入口已经用同一个 turnId 记过这一轮，这里重复写入是空操作。
     */
    private void recordTurn(String conversationKey, ReplanRequestDTO modification) {
        if (conversationKey == null || !StringUtils.hasText(modification.getInstruction())) {
            return;
        }
        String turnId = StringUtils.hasText(modification.getRequestId())
                ? modification.getRequestId() : "replan:" + UUID.randomUUID();
        Turn turn = new Turn(turnId, TurnRole.USER, modification.getInstruction(), new ArrayList<>(), clock.millis());
        try {
            conversationContextStore.applyTurn(conversationKey, turn, null);
        } catch (BaseException e) {
            log.warn("记录修改说明失败，继续重规划: conversationKey={}, msg={}", conversationKey, e.getMessage());
        }
    }
}
