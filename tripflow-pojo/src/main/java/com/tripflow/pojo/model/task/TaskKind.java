package com.tripflow.pojo.model.task;

public enum TaskKind {
    /** 新生成行程 */
    GENERATE,
    /** 基于已有版本重规划 */
    REPLAN
}
