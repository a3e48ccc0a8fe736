package com.tripflow.server.task;

import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.task.TaskKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交给执行端的任务命令，mq 模式下以 JSON 形式投递。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskCommand {

    private Long taskId;

    private TaskKind kind;

    private String conversationKey;

    private Long parentVersionId;

    private ReplanRequestDTO modification;

    public static TaskCommand of(Long taskId, TaskRequest request) {
        return new TaskCommand(taskId, request.getKind(), request.getConversationKey(),
                request.getParentVersionId(), request.getModification());
    }
}
