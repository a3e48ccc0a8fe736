package com.tripflow.server.service.impl;

import com.tripflow.common.exception.AmbiguousModificationException;
import com.tripflow.common.exception.InvalidRequestException;
import com.tripflow.pojo.dto.ChatTurnRequestDTO;
import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.ExtractedSlot;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.Turn;
import com.tripflow.pojo.model.context.TurnRole;
import com.tripflow.pojo.model.itinerary.ReplanKind;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.pojo.vo.ChatTurnVO;
import com.tripflow.server.context.ConversationContextStore;
import com.tripflow.server.context.RequiredSlots;
import com.tripflow.server.filter.TraceLoggingFilter;
import com.tripflow.server.intent.IntentExtractor;
import com.tripflow.server.replan.ModificationDetector;
import com.tripflow.server.replan.ReplanCoordinator;
import com.tripflow.server.service.ConversationService;
import com.tripflow.server.service.PlanningService;
import com.tripflow.server.task.TaskRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationServiceImpl implements ConversationService {

    /** 表示“现在就生成”的关键词 */
    private static final List<String> PLAN_KEYWORDS = Arrays.asList(
            "plan", "generate", "itinerary", "schedule", "规划", "生成", "安排", "行程");

    private final IntentExtractor intentExtractor;
    private final ConversationContextStore conversationContextStore;
    private final PlanningService planningService;
    private final ReplanCoordinator replanCoordinator;
    private final Clock clock;

    @Override
    public ChatTurnVO handleTurn(ChatTurnRequestDTO request) {
        if (request == null || !StringUtils.hasText(request.getMessage())) {
            throw new InvalidRequestException("消息不能为空");
        }
        String key = StringUtils.hasText(request.getConversationKey())
                ? request.getConversationKey() : UUID.randomUUID().toString().replace("-", "");
        String turnId = StringUtils.hasText(request.getTurnId()) ? request.getTurnId() : UUID.randomUUID().toString();
        MDC.put(TraceLoggingFilter.CONVERSATION_KEY, key);
        try {
            ConversationContext before = conversationContextStore.getOrCreate(key);
            if (before.hasTurn(turnId)) {
                log.info("重复的对话轮次: turnId={}", turnId);
                return buildVo(key, turnId, before, "这条消息已处理过", null, true, false);
            }
            List<SlotName> missingBefore = RequiredSlots.missing(before.getSlots());

            List<ExtractedSlot> extracted = intentExtractor.extract(request.getMessage(), before);
            Turn userTurn = new Turn(turnId, TurnRole.USER, request.getMessage(), extracted, clock.millis());
            ConversationContext after = conversationContextStore.applyTurn(key, userTurn, extracted);
            List<SlotName> missing = RequiredSlots.missing(after.getSlots());
            log.info("槽位合并完成: extracted={}, missing={}", extracted.size(), missing);

            // 已有行程时，提到某天、某个活动或酒店的消息按修改处理
            ReplanKind modification = after.getLastVersionId() == null
                    ? null : ModificationDetector.detect(request.getMessage(), !extracted.isEmpty());

            Long taskId = null;
            boolean clarification = false;
            String reply;
            if (!missing.isEmpty()) {
                reply = followUpQuestion(missing.get(0));
            } else if (modification != null) {
                try {
                    taskId = replanCoordinator.replan(after.getLastVersionId(),
                            modificationOf(modification, request.getMessage(), turnId));
                    reply = "好的，正在按你的要求调整行程";
                } catch (AmbiguousModificationException e) {
                    log.info("修改范围不明确，请用户澄清: versionId={}, kind={}", after.getLastVersionId(), modification);
                    reply = e.getMessage();
                    clarification = true;
                }
            } else if (wantsPlan(request) || !missingBefore.isEmpty()) {
                taskId = planningService.start(TaskRequest.builder()
                        .kind(TaskKind.GENERATE)
                        .conversationKey(key)
                        .requestId(turnId)
                        .build());
                reply = "好的，正在为你规划 " + after.slotValue(SlotName.DESTINATION) + " 的行程";
            } else {
                reply = "已更新你的出行信息，需要重新生成行程时告诉我";
            }

            Turn assistantTurn = new Turn(turnId + ":reply", TurnRole.ASSISTANT, reply, new ArrayList<>(), clock.millis());
            ConversationContext latest = conversationContextStore.applyTurn(key, assistantTurn, null);
            return buildVo(key, turnId, latest, reply, taskId, false, clarification);
        } finally {
            MDC.remove(TraceLoggingFilter.CONVERSATION_KEY);
        }
    }

    private static boolean wantsPlan(ChatTurnRequestDTO request) {
        if (Boolean.TRUE.equals(request.getGenerate())) {
            return true;
        }
        String lower = request.getMessage().toLowerCase(Locale.ROOT);
        return PLAN_KEYWORDS.stream().anyMatch(lower::contains);
    }

    static String followUpQuestion(SlotName missing) {
        return switch (missing) {
            case DESTINATION -> "你想去哪里旅行？";
            case START_DATE -> "打算哪天出发？";
            case DURATION_DAYS, END_DATE -> "计划玩几天？";
            default -> "还有什么需要补充的吗？";
        };
    }

    private static ReplanRequestDTO modificationOf(ReplanKind kind, String message, String turnId) {
        ReplanRequestDTO dto = new ReplanRequestDTO();
        dto.setKind(kind);
        dto.setInstruction(message);
        dto.setRequestId(turnId);
        return dto;
    }

    private static ChatTurnVO buildVo(String key, String turnId, ConversationContext ctx,
                                      String reply, Long taskId, boolean duplicate, boolean clarification) {
        ChatTurnVO vo = new ChatTurnVO();
        vo.setConversationKey(key);
        vo.setTurnId(turnId);
        Map<SlotName, String> slots = ctx.slotValues();
        vo.setSlots(slots);
        vo.setMissingSlots(RequiredSlots.missing(ctx.getSlots()));
        vo.setReply(reply);
        vo.setTaskId(taskId);
        vo.setDuplicate(duplicate);
        vo.setNeedsClarification(clarification);
        return vo;
    }
}
