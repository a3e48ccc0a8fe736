package com.tripflow.server.controller.user;

import com.tripflow.common.exception.InvalidRequestException;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.common.result.Result;
import com.tripflow.pojo.dto.StartTaskRequestDTO;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.server.progress.ProgressListener;
import com.tripflow.server.progress.ProgressPublisher;
import com.tripflow.server.service.PlanningService;
import com.tripflow.server.task.TaskRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 生成任务：发起、轮询、取消，以及 SSE 进度推送。
 */
@RestController
@RequestMapping("/user/task")
@Slf4j
@RequiredArgsConstructor
public class TaskController {

    /** SSE 连接比任务整体时限多留的时间 */
    private static final long SSE_GRACE_MS = 30_000L;

    private final PlanningService planningService;
    private final ProgressPublisher progressPublisher;
    private final PlannerProperties plannerProperties;

    @PostMapping("/start")
    public Result<Long> start(@RequestBody StartTaskRequestDTO dto) {
        if (dto == null || !StringUtils.hasText(dto.getConversationKey())) {
            throw new InvalidRequestException("conversationKey 不能为空");
        }
        Long taskId = planningService.start(TaskRequest.builder()
                .kind(TaskKind.GENERATE)
                .conversationKey(dto.getConversationKey())
                .requestId(dto.getRequestId())
                .build());
        return Result.success(taskId);
    }

    @GetMapping("/{taskId}")
    public Result<TaskSnapshot> poll(@PathVariable("taskId") Long taskId) {
        return Result.success(planningService.poll(taskId));
    }

    @PostMapping("/{taskId}/cancel")
    public Result<TaskSnapshot> cancel(@PathVariable("taskId") Long taskId) {
        return Result.success(planningService.cancel(taskId));
    }

    /**
     * 进度推送：先推当前快照，之后每次变化推一条 progress 事件，任务结束后关闭连接。
     */
    @GetMapping(value = "/{taskId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("taskId") Long taskId) {
        SseEmitter emitter = new SseEmitter(plannerProperties.getTaskTimeoutMs() + SSE_GRACE_MS);
        SseProgressListener listener = new SseProgressListener(emitter);
        emitter.onCompletion(() -> progressPublisher.unsubscribe(taskId, listener));
        emitter.onTimeout(() -> {
            progressPublisher.unsubscribe(taskId, listener);
            emitter.complete();
        });
        progressPublisher.subscribe(taskId, listener);
        return emitter;
    }

    private static final class SseProgressListener implements ProgressListener {

        private final SseEmitter emitter;

        SseProgressListener(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void onSnapshot(TaskSnapshot snapshot) {
            try {
                emitter.send(SseEmitter.event()
                        .name("progress")
                        .id(snapshot.getTaskId() + "-" + snapshot.getUpdatedAt())
                        .data(snapshot, MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                // 客户端已断开，抛出后发布方会移除该订阅者
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void onClose() {
            emitter.complete();
        }
    }
}
