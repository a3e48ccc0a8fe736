package com.tripflow.server.service.impl;

import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.pojo.dto.ChatTurnRequestDTO;
import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.pojo.model.task.TaskStatus;
import com.tripflow.pojo.model.task.TaskStep;
import com.tripflow.pojo.vo.ChatTurnVO;
import com.tripflow.server.ai.LlmPlanComposer;
import com.tripflow.server.ai.TemplatePlanBuilder;
import com.tripflow.server.context.ConversationContextRepository;
import com.tripflow.server.context.ConversationContextStore;
import com.tripflow.server.context.SlotMergePolicy;
import com.tripflow.server.fallback.FallbackSynthesizer;
import com.tripflow.server.gather.DataGatheringCoordinator;
import com.tripflow.server.intent.RuleBasedIntentExtractor;
import com.tripflow.server.limit.SimpleRateLimiter;
import com.tripflow.server.metrics.MetricsRecorder;
import com.tripflow.server.pipeline.ItineraryAssembler;
import com.tripflow.server.pipeline.ItineraryPipeline;
import com.tripflow.server.progress.InMemoryTaskSnapshotRepository;
import com.tripflow.server.progress.ProgressPublisher;
import com.tripflow.server.progress.ProgressSubscription;
import com.tripflow.server.replan.ReplanCoordinator;
import com.tripflow.server.replan.ReplanPlanner;
import com.tripflow.server.service.ItineraryVersionService;
import com.tripflow.server.task.TaskCommand;
import com.tripflow.server.task.TaskDispatcher;
import com.tripflow.server.task.TaskStateMachine;
import com.tripflow.server.utils.RedisIdWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * 多轮对话到行程生成的串联测试，意图抽取、上下文合并、状态机与流水线都用真实实现：
 * - 第一轮抽取目的地、预算、天数，追问出发日期；
 * - 第二轮“next week”补齐出发日期，之前的槽位保留，并发起生成任务；
 * - 任务完成 intent_extraction 后走完全部步骤，生成的版本绑定回会话。
 */
@ExtendWith(MockitoExtension.class)
class ConversationFlowTest {

    private static final String KEY = "flow-1";

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    @Mock
    private RedisIdWorker redisIdWorker;

    @Mock
    private MetricsRecorder metricsRecorder;

    @Mock
    private SimpleRateLimiter simpleRateLimiter;

    @Mock
    private TaskDispatcher taskDispatcher;

    @Mock
    private ReplanCoordinator replanCoordinator;

    @Mock
    private LlmPlanComposer llmPlanComposer;

    @Mock
    private ItineraryVersionService itineraryVersionService;

    private PlannerProperties properties;
    private ConversationContextStore contextStore;
    private ProgressPublisher publisher;
    private TaskStateMachine stateMachine;
    private ConversationServiceImpl conversationService;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(redissonClient.getLock(anyString())).thenReturn(lock);
        lenient().when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(true);
        lenient().when(lock.isHeldByCurrentThread()).thenReturn(true);
        lenient().when(redisIdWorker.nextId(anyString())).thenReturn(9001L);
        lenient().when(simpleRateLimiter.tryAcquire(anyString(), anyString(), anyLong(), anyLong())).thenReturn(true);
        lenient().when(llmPlanComposer.isAvailable()).thenReturn(false);
        lenient().when(itineraryVersionService.saveVersion(any())).thenAnswer(inv -> {
            ItineraryVersion draft = inv.getArgument(0);
            return draft.toBuilder().versionId(88L).itineraryId(80L).build();
        });

        Clock clock = Clock.fixed(Instant.parse("2026-01-07T03:00:00Z"), ZoneOffset.UTC);
        properties = new PlannerProperties();
        contextStore = new ConversationContextStore(new MapContextRepository(), new SlotMergePolicy(properties),
                redissonClient, properties, clock);
        publisher = new ProgressPublisher(new InMemoryTaskSnapshotRepository(), metricsRecorder);
        stateMachine = new TaskStateMachine(contextStore, publisher, redisIdWorker, metricsRecorder, clock);
        PlanningServiceImpl planningService = new PlanningServiceImpl(stateMachine, taskDispatcher, publisher,
                simpleRateLimiter, properties);
        conversationService = new ConversationServiceImpl(new RuleBasedIntentExtractor(clock), contextStore,
                planningService, replanCoordinator, clock);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void twoTurnsFillSlotsAndGenerateItinerary() throws Exception {
        ChatTurnVO first = conversationService.handleTurn(request("t1", "budget 20000, 3 days, Phuket"));

        assertEquals("Phuket", first.getSlots().get(SlotName.DESTINATION));
        assertEquals("20000", first.getSlots().get(SlotName.BUDGET));
        assertEquals("3", first.getSlots().get(SlotName.DURATION_DAYS));
        assertEquals(List.of(SlotName.START_DATE), first.getMissingSlots());
        assertEquals(ConversationServiceImpl.followUpQuestion(SlotName.START_DATE), first.getReply());
        assertNull(first.getTaskId());

        ChatTurnVO second = conversationService.handleTurn(request("t2", "next week"));

        assertEquals("2026-01-12", second.getSlots().get(SlotName.START_DATE));
        assertEquals("Phuket", second.getSlots().get(SlotName.DESTINATION));
        assertEquals("20000", second.getSlots().get(SlotName.BUDGET));
        assertEquals("3", second.getSlots().get(SlotName.DURATION_DAYS));
        assertTrue(second.getMissingSlots().isEmpty());
        assertNotNull(second.getTaskId());
        verifyNoInteractions(replanCoordinator);

        ArgumentCaptor<TaskCommand> dispatched = ArgumentCaptor.forClass(TaskCommand.class);
        verify(taskDispatcher).dispatch(dispatched.capture());
        TaskCommand command = dispatched.getValue();
        assertEquals(second.getTaskId(), command.getTaskId());
        assertEquals(TaskKind.GENERATE, command.getKind());

        ProgressSubscription sub = publisher.subscribe(command.getTaskId());
        pipeline().run(command).join();

        List<TaskSnapshot> seen = new ArrayList<>();
        TaskSnapshot next;
        while ((next = sub.next(100, TimeUnit.MILLISECONDS)) != null) {
            seen.add(next);
        }
        int intentDone = TaskStep.INTENT_EXTRACTION.progressAt(1);
        assertTrue(seen.stream().anyMatch(s -> s.getStep() == TaskStep.INTENT_EXTRACTION
                && s.getProgress() == intentDone), "intent_extraction 未完成");
        TaskSnapshot last = seen.get(seen.size() - 1);
        assertEquals(TaskStatus.COMPLETED, last.getStatus());
        assertEquals(88L, last.getResultVersionId());
        assertTrue(sub.isFinished());

        ConversationContext ctx = contextStore.getOrCreate(KEY);
        assertEquals(88L, ctx.getLastVersionId());
        assertEquals(4, ctx.getTurns().size());
    }

    private ItineraryPipeline pipeline() {
        DataGatheringCoordinator coordinator = new DataGatheringCoordinator(List.of(), new FallbackSynthesizer(),
                properties, metricsRecorder);
        return new ItineraryPipeline(stateMachine, contextStore, coordinator, llmPlanComposer,
                new TemplatePlanBuilder(), new ItineraryAssembler(), new ReplanPlanner(), itineraryVersionService,
                properties, executor);
    }

    private static ChatTurnRequestDTO request(String turnId, String message) {
        ChatTurnRequestDTO dto = new ChatTurnRequestDTO();
        dto.setConversationKey(KEY);
        dto.setTurnId(turnId);
        dto.setMessage(message);
        return dto;
    }

    private static class MapContextRepository implements ConversationContextRepository {

        private final Map<String, ConversationContext> data = new ConcurrentHashMap<>();

        @Override
        public ConversationContext load(String key) {
            return data.get(key);
        }

        @Override
        public void save(ConversationContext context) {
            data.put(context.getKey(), context);
        }
    }
}
