package com.tripflow.server.pipeline;

import com.tripflow.common.exception.BaseException;
import com.tripflow.common.exception.CompositionFailureException;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.SlotValue;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.itinerary.ReplanKind;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.pojo.model.task.TaskStep;
import com.tripflow.server.ai.ComposeRequest;
import com.tripflow.server.ai.LlmPlanComposer;
import com.tripflow.server.ai.TemplatePlanBuilder;
import com.tripflow.server.context.ConversationContextStore;
import com.tripflow.server.context.TripResolver;
import com.tripflow.server.filter.TraceLoggingFilter;
import com.tripflow.server.gather.DataGatheringCoordinator;
import com.tripflow.server.provider.FailureType;
import com.tripflow.server.replan.ReplanPlanner;
import com.tripflow.server.replan.ReplanScope;
import com.tripflow.server.service.ItineraryVersionService;
import com.tripflow.server.task.TaskCancelledException;
import com.tripflow.server.task.TaskCommand;
import com.tripflow.server.task.TaskStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 行程生成流水线：intent_extraction -> data_gathering -> plan_composition -> finalization。
 * <p>
 * 步骤在 plannerExecutor 上以 CompletableFuture 串联执行，每个步骤开始前检查取消标记；
 * 整个任务受 taskTimeoutMs 上限约束，超时以 TASK_TIMEOUT（可重试）失败。
 */
@Slf4j
@Component
public class ItineraryPipeline {

    public static final String TASK_ID_KEY = "taskId";

    private final TaskStateMachine taskStateMachine;
    private final ConversationContextStore conversationContextStore;
    private final DataGatheringCoordinator dataGatheringCoordinator;
    private final LlmPlanComposer llmPlanComposer;
    private final TemplatePlanBuilder templatePlanBuilder;
    private final ItineraryAssembler itineraryAssembler;
    private final ReplanPlanner replanPlanner;
    private final ItineraryVersionService itineraryVersionService;
    private final PlannerProperties plannerProperties;
    private final Executor plannerExecutor;

    public ItineraryPipeline(TaskStateMachine taskStateMachine,
                             ConversationContextStore conversationContextStore,
                             DataGatheringCoordinator dataGatheringCoordinator,
                             LlmPlanComposer llmPlanComposer,
                             TemplatePlanBuilder templatePlanBuilder,
                             ItineraryAssembler itineraryAssembler,
                             ReplanPlanner replanPlanner,
                             ItineraryVersionService itineraryVersionService,
                             PlannerProperties plannerProperties,
                             @Qualifier("plannerExecutor") Executor plannerExecutor) {
        this.taskStateMachine = taskStateMachine;
        this.conversationContextStore = conversationContextStore;
        this.dataGatheringCoordinator = dataGatheringCoordinator;
        this.llmPlanComposer = llmPlanComposer;
        this.templatePlanBuilder = templatePlanBuilder;
        this.itineraryAssembler = itineraryAssembler;
        this.replanPlanner = replanPlanner;
        this.itineraryVersionService = itineraryVersionService;
        this.plannerProperties = plannerProperties;
        this.plannerExecutor = plannerExecutor;
    }

    /**
     * 执行一个任务。返回的 future 在任务进入终态后完成，从不异常完成。
     */
    public CompletableFuture<Void> run(TaskCommand command) {
        Long taskId = command.getTaskId();
        Run run = new Run(command);
        return CompletableFuture
                .supplyAsync(() -> step(taskId, run, this::extractIntent), plannerExecutor)
                .thenCompose(this::gather)
                .thenApplyAsync(r -> step(taskId, r, this::compose), plannerExecutor)
                .thenApplyAsync(r -> step(taskId, r, this::finish), plannerExecutor)
                .orTimeout(plannerProperties.getTaskTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((r, error) -> {
                    if (error != null) {
                        onError(taskId, error);
                    }
                    return null;
                });
    }

    private Run step(Long taskId, Run run, Function<Run, Run> body) {
        String previous = MDC.get(TASK_ID_KEY);
        MDC.put(TASK_ID_KEY, String.valueOf(taskId));
        if (run.command.getConversationKey() != null) {
            MDC.put(TraceLoggingFilter.CONVERSATION_KEY, run.command.getConversationKey());
        }
        try {
            taskStateMachine.checkpoint(taskId);
            return body.apply(run);
        } finally {
            if (previous == null) {
                MDC.remove(TASK_ID_KEY);
            } else {
                MDC.put(TASK_ID_KEY, previous);
            }
        }
    }

    private Run extractIntent(Run run) {
        Long taskId = run.command.getTaskId();
        taskStateMachine.advance(taskId, TaskStep.INTENT_EXTRACTION, 0, "正在解析出行需求");
        String currency = plannerProperties.getDefaultCurrency();
        GatherRequest.GatherRequestBuilder gather;
        if (run.command.getKind() == TaskKind.REPLAN) {
            ItineraryVersion parent = itineraryVersionService.loadVersion(run.command.getParentVersionId());
            if (parent == null) {
                throw new BaseException(ErrorCode.UNKNOWN_VERSION, "行程版本不存在: " + run.command.getParentVersionId());
            }
            run.parent = parent;
            run.scope = replanPlanner.resolveScope(parent, run.command.getModification());
            run.trip = replanPlanner.tripOf(parent, slotsQuietly(parent.getConversationKey()), currency);
            gather = gatherRequestOf(run.trip)
                    .providers(replanPlanner.relevantSources(run.scope.getKind()))
                    .places(replanPlanner.placesOf(parent, run.scope));
        } else {
            run.trip = TripResolver.resolve(conversationContextStore.getSlots(run.command.getConversationKey()), currency);
            gather = gatherRequestOf(run.trip);
        }
        run.gatherRequest = gather.build();
        taskStateMachine.advance(taskId, TaskStep.INTENT_EXTRACTION, 1, "出行需求已确认：" + run.trip.getDestination());
        return run;
    }

    private CompletableFuture<Run> gather(Run run) {
        Long taskId = run.command.getTaskId();
        taskStateMachine.checkpoint(taskId);
        taskStateMachine.advance(taskId, TaskStep.DATA_GATHERING, 0, "正在获取天气、交通、住宿等数据");
        return dataGatheringCoordinator.gather(
                        run.gatherRequest,
                        () -> taskStateMachine.isCancellationRequested(taskId),
                        (result, resolved, total) -> {
                            if (!taskStateMachine.isCancellationRequested(taskId)) {
                                taskStateMachine.advance(taskId, TaskStep.DATA_GATHERING,
                                        (double) resolved / total, "已获取 " + result.getProvider().getCode());
                            }
                        })
                .thenApply(gathered -> {
                    // 采集期间被取消时不再推进进度，也不挂数据源状态
                    taskStateMachine.checkpoint(taskId);
                    run.gathered = gathered;
                    taskStateMachine.advance(taskId, TaskStep.DATA_GATHERING, 1,
                            gathered.isDegraded() ? "部分数据使用估算值" : "数据获取完成", gathered.sourceStatuses());
                    return run;
                });
    }

    private Run compose(Run run) {
        Long taskId = run.command.getTaskId();
        taskStateMachine.advance(taskId, TaskStep.PLAN_COMPOSITION, 0, "正在编排行程");
        List<Integer> dayNumbers = new ArrayList<>();
        List<DayPlan> keptDays = new ArrayList<>();
        if (run.scope == null) {
            for (int d = 1; d <= run.trip.days(); d++) {
                dayNumbers.add(d);
            }
        } else if (run.scope.getKind() != ReplanKind.HOTEL_CHANGE) {
            dayNumbers.addAll(run.scope.getDays());
            for (DayPlan day : run.parent.getDays()) {
                if (!run.scope.getDays().contains(day.getDayNumber())) {
                    keptDays.add(day);
                }
            }
        }
        if (dayNumbers.isEmpty()) {
            run.days = new ArrayList<>();
        } else {
            ComposeRequest request = ComposeRequest.builder()
                    .trip(run.trip)
                    .gathered(run.gathered)
                    .dayNumbers(dayNumbers)
                    .keptDays(keptDays)
                    .instruction(run.scope == null ? null : run.scope.getInstruction())
                    .build();
            List<DayPlan> drafts = composeDrafts(request, run);
            taskStateMachine.checkpoint(taskId);
            run.days = itineraryAssembler.decorate(drafts, run.trip, run.gathered, run.templatePlan);
        }
        taskStateMachine.advance(taskId, TaskStep.PLAN_COMPOSITION, 1,
                run.templatePlan ? "已生成模板行程" : "行程编排完成");
        return run;
    }

    private List<DayPlan> composeDrafts(ComposeRequest request, Run run) {
        if (llmPlanComposer.isAvailable()) {
            try {
                return llmPlanComposer.compose(request);
            } catch (CompositionFailureException e) {
                if (!plannerProperties.isAllowTemplatePlan()) {
                    throw e;
                }
                log.warn("LLM 编排失败，改用模板行程: {}", e.getMessage());
            }
        } else if (!plannerProperties.isAllowTemplatePlan()) {
            throw new CompositionFailureException("LLM 未配置且未开启模板行程");
        }
        run.templatePlan = true;
        return templatePlanBuilder.compose(request);
    }

    private Run finish(Run run) {
        Long taskId = run.command.getTaskId();
        taskStateMachine.advance(taskId, TaskStep.FINALIZATION, 0, "正在保存行程");
        ItineraryVersion draft;
        if (run.parent == null) {
            draft = itineraryAssembler.buildVersion(run.command.getConversationKey(), run.trip, run.days,
                    run.gathered, run.templatePlan);
        } else {
            Map<Integer, DayPlan> composed = new HashMap<>();
            for (DayPlan day : run.days) {
                composed.put(day.getDayNumber(), day);
            }
            draft = replanPlanner.merge(run.parent, run.scope, composed, run.gathered);
        }
        ItineraryVersion saved = itineraryVersionService.saveVersion(draft);
        try {
            conversationContextStore.bindVersion(saved.getConversationKey(), saved.getVersionId());
        } catch (BaseException e) {
            log.warn("绑定会话最新版本失败: conversationKey={}, versionId={}", saved.getConversationKey(), saved.getVersionId(), e);
        }
        taskStateMachine.complete(taskId, saved.getVersionId());
        return run;
    }

    private void onError(Long taskId, Throwable error) {
        Throwable cause = FailureType.unwrap(error);
        MDC.put(TASK_ID_KEY, String.valueOf(taskId));
        try {
            if (cause instanceof TaskCancelledException) {
                taskStateMachine.confirmCancelled(taskId);
            } else if (cause instanceof TimeoutException) {
                log.warn("任务超过整体时限: taskId={}, timeoutMs={}", taskId, plannerProperties.getTaskTimeoutMs());
                taskStateMachine.fail(taskId, ErrorCode.TASK_TIMEOUT, true, null);
            } else if (cause instanceof BaseException) {
                BaseException be = (BaseException) cause;
                log.warn("任务失败: taskId={}, code={}, msg={}", taskId, be.getErrorCode(), be.getMessage());
                taskStateMachine.fail(taskId, be.getErrorCode(), be.isRetryable(), be.getMessage());
            } else {
                log.error("任务执行异常: taskId={}", taskId, cause);
                taskStateMachine.fail(taskId, ErrorCode.INTERNAL_ERROR, false, null);
            }
        } catch (RuntimeException e) {
            log.error("记录任务失败状态异常: taskId={}", taskId, e);
        } finally {
            MDC.remove(TASK_ID_KEY);
        }
    }

    private Map<SlotName, SlotValue> slotsQuietly(String conversationKey) {
        if (conversationKey == null) {
            return null;
        }
        try {
            return conversationContextStore.getSlots(conversationKey);
        } catch (BaseException e) {
            log.warn("读取会话槽位失败，仅使用版本信息: {}", e.getMessage());
            return null;
        }
    }

    private static GatherRequest.GatherRequestBuilder gatherRequestOf(ResolvedTrip trip) {
        return GatherRequest.builder()
                .destination(trip.getDestination())
                .origin(trip.getOrigin())
                .startDate(trip.getStartDate())
                .endDate(trip.getEndDate())
                .interests(trip.getInterests())
                .budget(trip.getBudget())
                .currency(trip.getCurrency())
                .travelers(trip.getTravelers());
    }

    /**
     * 单个任务在各步骤之间传递的中间结果。
     */
    private static final class Run {

        private final TaskCommand command;
        private ResolvedTrip trip;
        private ItineraryVersion parent;
        private ReplanScope scope;
        private GatherRequest gatherRequest;
        private GatherResult gathered;
        private List<DayPlan> days;
        private boolean templatePlan;

        Run(TaskCommand command) {
            this.command = command;
        }
    }
}
