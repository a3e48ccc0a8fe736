package com.tripflow.pojo.model.task;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.tripflow.pojo.model.source.SourceStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 任务快照：轮询接口与推送流看到的同一份结构，持久化在 Redis 中以便进程重启后仍可查询。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSnapshot {

    private Long taskId;

    private TaskKind kind;

    private String conversationKey;

    private TaskStatus status;

    private TaskStep step;

    /** 0-100，单调不减 */
    private int progress;

    private String message;

    private List<SourceStatus> sources = new ArrayList<>();

    /** 失败时的错误码名称，例如 COMPOSITION_FAILURE */
    private String errorCode;

    private boolean retryable;

    private String errorMessage;

    private Long resultVersionId;

    private long createdAt;

    private long updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public TaskSnapshot copy() {
        TaskSnapshot c = new TaskSnapshot();
        c.taskId = taskId;
        c.kind = kind;
        c.conversationKey = conversationKey;
        c.status = status;
        c.step = step;
        c.progress = progress;
        c.message = message;
        List<SourceStatus> copiedSources = new ArrayList<>();
        if (sources != null) {
            for (SourceStatus s : sources) {
                copiedSources.add(new SourceStatus(s.getProvider(), s.getStatus(), s.getReason()));
            }
        }
        c.sources = copiedSources;
        c.errorCode = errorCode;
        c.retryable = retryable;
        c.errorMessage = errorMessage;
        c.resultVersionId = resultVersionId;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
