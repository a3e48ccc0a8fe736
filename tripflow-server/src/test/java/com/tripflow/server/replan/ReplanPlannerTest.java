package com.tripflow.server.replan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.exception.AmbiguousModificationException;
import com.tripflow.common.exception.InvalidRequestException;
import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.itinerary.Activity;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.itinerary.ReplanKind;
import com.tripflow.pojo.model.payload.HotelOption;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.pojo.model.source.SourceResult;
import com.tripflow.pojo.model.source.SourceState;
import com.tripflow.pojo.model.source.SourceStatus;
import com.tripflow.server.pipeline.ItineraryAssembler;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * ReplanPlanner 单元测试：
 * - 修改范围解析（显式 id、自由文本、无法确定）；
 * - 合并后未受影响的天与父版本逐字节一致。
 */
class ReplanPlannerTest {

    private final ReplanPlanner planner = new ReplanPlanner();
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private final ItineraryVersion parent = parentVersion();

    @Test
    void daysMentionedUnderstandsSeveralForms() {
        assertEquals(Set.of(2), ReplanPlanner.daysMentioned("swap something on day 2", 4));
        assertEquals(Set.of(3), ReplanPlanner.daysMentioned("第三天换成海边活动", 4));
        assertEquals(Set.of(4), ReplanPlanner.daysMentioned("最后一天轻松一点", 4));
        assertEquals(Set.of(1, 4), ReplanPlanner.daysMentioned("first day and last day", 4));
        assertTrue(ReplanPlanner.daysMentioned("day 9 please", 4).isEmpty());
    }

    @Test
    void vagueInstructionIsAmbiguous() {
        ReplanRequestDTO dto = request(ReplanKind.DAY_REPLAN, "make it more fun");
        assertThrows(AmbiguousModificationException.class, () -> planner.resolveScope(parent, dto));
    }

    @Test
    void unknownActivityIsRejected() {
        ReplanRequestDTO dto = request(ReplanKind.ACTIVITY_SWAP, null);
        dto.setActivityIds(List.of("d9-a1-ffff"));
        assertThrows(InvalidRequestException.class, () -> planner.resolveScope(parent, dto));
    }

    @Test
    void activitySwapResolvedFromTitle() {
        ReplanScope scope = planner.resolveScope(parent, request(ReplanKind.ACTIVITY_SWAP,
                "on day 2 replace Night Market with something quieter"));

        assertEquals(new TreeSet<>(Set.of(2)), scope.getDays());
        assertEquals(Set.of(id(2, 2, "Night Market")), scope.getActivityIds());
    }

    @Test
    void activitySwapWithoutTargetIsAmbiguous() {
        ReplanRequestDTO dto = request(ReplanKind.ACTIVITY_SWAP, "change something on day 2");
        assertThrows(AmbiguousModificationException.class, () -> planner.resolveScope(parent, dto));
    }

    @Test
    void dayReplanKeepsOtherDaysIdentical() throws Exception {
        ReplanScope scope = planner.resolveScope(parent, request(ReplanKind.DAY_REPLAN, "第二天重新安排"));
        DayPlan newDay = day(2, "Island Hopping", "Phi Phi Pier");
        GatherResult gathered = new GatherResult(Map.of(ProviderType.WEATHER,
                SourceResult.missing(ProviderType.WEATHER, "not_configured")));

        ItineraryVersion merged = planner.merge(parent, scope, Map.of(2, newDay), gathered);

        assertEquals(parent.getDays().size(), merged.getDays().size());
        for (int i = 0; i < parent.getDays().size(); i++) {
            DayPlan before = parent.getDays().get(i);
            DayPlan after = merged.getDays().get(i);
            if (before.getDayNumber() == 2) {
                assertSame(newDay, after);
            } else {
                assertSame(before, after);
                assertEquals(objectMapper.writeValueAsString(before), objectMapper.writeValueAsString(after));
            }
        }
        assertEquals(parent.getVersionId(), merged.getParentVersionId());
        assertTrue(merged.getModificationSummary().startsWith("day_replan"));
        assertTrue(merged.isDegraded());
    }

    @Test
    void activitySwapReplacesOnlyTarget() {
        String target = id(2, 2, "Night Market");
        ReplanRequestDTO dto = request(ReplanKind.ACTIVITY_SWAP, null);
        dto.setActivityIds(List.of(target));
        ReplanScope scope = planner.resolveScope(parent, dto);
        DayPlan composed = DayPlan.builder().dayNumber(2)
                .activity(Activity.builder().title("Spa Afternoon").location("Kata").startTime("10:00").endTime("11:00").build())
                .build();

        ItineraryVersion merged = planner.merge(parent, scope, Map.of(2, composed), new GatherResult(Collections.emptyMap()));

        DayPlan original = parent.dayByNumber(2);
        DayPlan swapped = merged.dayByNumber(2);
        assertEquals(original.getActivities().get(0), swapped.getActivities().get(0));
        Activity replaced = swapped.getActivities().get(1);
        assertEquals("Spa Afternoon", replaced.getTitle());
        assertEquals(original.getActivities().get(1).getStartTime(), replaced.getStartTime());
        assertEquals(original.getActivities().get(1).getEndTime(), replaced.getEndTime());
        assertNotEquals(target, replaced.getActivityId());
        assertSame(parent.dayByNumber(1), merged.dayByNumber(1));
    }

    @Test
    void hotelChangeKeepsDaysAndSwapsHotels() {
        ReplanScope scope = planner.resolveScope(parent, request(ReplanKind.HOTEL_CHANGE, "cheaper hotel"));
        HotelPayload hotels = new HotelPayload();
        hotels.getHotels().add(new HotelOption("Kata Guesthouse", "budget", 900, "THB", 3.5, false));
        GatherResult gathered = new GatherResult(Map.of(ProviderType.HOTELS, SourceResult.ok(ProviderType.HOTELS, hotels, 20)));

        ItineraryVersion merged = planner.merge(parent, scope, Collections.emptyMap(), gathered);

        assertTrue(scope.getDays().isEmpty());
        assertEquals(parent.getDays(), merged.getDays());
        assertEquals(1, merged.getHotels().size());
        assertEquals("Kata Guesthouse", merged.getHotels().get(0).getName());
        assertFalse(merged.isDegraded());
    }

    @Test
    void relevantSourcesDependOnKind() {
        assertEquals(Set.of(ProviderType.HOTELS), planner.relevantSources(ReplanKind.HOTEL_CHANGE));
        assertTrue(planner.relevantSources(ReplanKind.DAY_REPLAN).contains(ProviderType.WEATHER));
        assertFalse(planner.relevantSources(ReplanKind.ACTIVITY_SWAP).contains(ProviderType.FLIGHTS));
    }

    private static ReplanRequestDTO request(ReplanKind kind, String instruction) {
        ReplanRequestDTO dto = new ReplanRequestDTO();
        dto.setKind(kind);
        dto.setInstruction(instruction);
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
                .endDate(LocalDate.of(2026, 2, 3))
                .day(day(1, "Old Town Walk", "Old Town"))
                .day(day(2, "Patong Beach", "Patong"))
                .day(day(3, "Big Buddha", "Chalong"))
                .source(new SourceStatus(ProviderType.WEATHER, SourceState.ACTIVE, null))
                .source(new SourceStatus(ProviderType.HOTELS, SourceState.ACTIVE, null))
                .build();
    }

    private static DayPlan day(int n, String morning, String location) {
        return DayPlan.builder()
                .dayNumber(n)
                .date(LocalDate.of(2026, 2, n))
                .title("Day " + n)
                .activity(Activity.builder().activityId(id(n, 1, morning)).title(morning).location(location)
                        .startTime("09:00").endTime("12:00").category("sightseeing").build())
                .activity(Activity.builder().activityId(id(n, 2, "Night Market")).title("Night Market").location(location)
                        .startTime("18:00").endTime("21:00").category("food").build())
                .build();
    }

    private static String id(int day, int index, String title) {
        return ItineraryAssembler.activityId(day, index, title);
    }
}
