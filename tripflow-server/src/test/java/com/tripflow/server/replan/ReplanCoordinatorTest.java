package com.tripflow.server.replan;

import com.tripflow.common.exception.AmbiguousModificationException;
import com.tripflow.common.exception.BaseException;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.context.Turn;
import com.tripflow.pojo.model.context.TurnRole;
import com.tripflow.pojo.model.itinerary.Activity;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.itinerary.ReplanKind;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.server.context.ConversationContextStore;
import com.tripflow.server.service.ItineraryVersionService;
import com.tripflow.server.service.PlanningService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ReplanCoordinator 单元测试：
 * - 父版本不存在时返回 UNKNOWN_VERSION；
 * - 解析出的范围写入 REPLAN 任务，修改说明记入会话历史；
 * - 范围不明确时不创建任务。
 */
@ExtendWith(MockitoExtension.class)
class ReplanCoordinatorTest {

    @Mock
    private ItineraryVersionService itineraryVersionService;

    @Mock
    private PlanningService planningService;

    @Mock
    private ConversationContextStore conversationContextStore;

    private ReplanCoordinator replanCoordinator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-07T02:00:00Z"), ZoneOffset.UTC);
        replanCoordinator = new ReplanCoordinator(itineraryVersionService, new ReplanPlanner(), planningService,
                conversationContextStore, clock);
    }

    @Test
    void missingVersionIsUnknownVersion() {
        when(itineraryVersionService.loadVersion(404L)).thenReturn(null);

        BaseException ex = assertThrows(BaseException.class,
                () -> replanCoordinator.replan(404L, modification(ReplanKind.DAY_REPLAN, "day 2", "r1")));

        assertEquals(ErrorCode.UNKNOWN_VERSION, ex.getErrorCode());
        verifyNoInteractions(planningService, conversationContextStore);
    }

    @Test
    void resolvedScopeStartsReplanAndRecordsTurn() {
        when(itineraryVersionService.loadVersion(10L)).thenReturn(parentVersion());
        when(planningService.start(any())).thenReturn(300L);

        Long taskId = replanCoordinator.replan(10L, modification(ReplanKind.DAY_REPLAN, "第二天重新安排", "r2"));

        assertEquals(300L, taskId);
        verify(planningService).start(argThat(r -> r.getKind() == TaskKind.REPLAN
                && Long.valueOf(10L).equals(r.getParentVersionId())
                && "r2".equals(r.getRequestId())
                && List.of(2).equals(r.getModification().getDayNumbers())));
        verify(conversationContextStore).applyTurn(eq("c1"),
                argThat((Turn t) -> "r2".equals(t.getTurnId()) && t.getRole() == TurnRole.USER
                        && "第二天重新安排".equals(t.getText())), isNull());
    }

    @Test
    void ambiguousModificationStartsNothing() {
        when(itineraryVersionService.loadVersion(10L)).thenReturn(parentVersion());

        assertThrows(AmbiguousModificationException.class,
                () -> replanCoordinator.replan(10L, modification(ReplanKind.DAY_REPLAN, "make it more fun", "r3")));

        verify(planningService, never()).start(any());
        verify(conversationContextStore, never()).applyTurn(anyString(), any(), any());
    }

    private static ReplanRequestDTO modification(ReplanKind kind, String instruction, String requestId) {
        ReplanRequestDTO dto = new ReplanRequestDTO();
        dto.setKind(kind);
        dto.setInstruction(instruction);
        dto.setRequestId(requestId);
        return dto;
    }

    private static ItineraryVersion parentVersion() {
        return ItineraryVersion.builder()
                .versionId(10L)
                .itineraryId(1L)
                .versionNumber(1)
                .conversationKey("c1")
                .destination("Phuket")
                .startDate(LocalDate.of(2026, 2, 1))
                .endDate(LocalDate.of(2026, 2, 2))
                .day(day(1, "Old Town Walk"))
                .day(day(2, "Patong Beach"))
                .build();
    }

    private static DayPlan day(int n, String title) {
        return DayPlan.builder()
                .dayNumber(n)
                .date(LocalDate.of(2026, 2, n))
                .title("Day " + n)
                .activity(Activity.builder().activityId("d" + n + "-a1").title(title).location("Phuket")
                        .startTime("09:00").endTime("12:00").category("sightseeing").build())
                .build();
    }
}
