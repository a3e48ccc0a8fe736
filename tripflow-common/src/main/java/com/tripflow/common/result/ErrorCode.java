package com.tripflow.common.result;

/**
 * 错误码枚举。
 * <p>retryable 表示调用方（传输层）是否可以对同一请求自动重试。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok", false),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error", false),

    /** 必要槽位缺失或请求不合法 */
    INVALID_REQUEST(2001, "请求信息不完整，请补充目的地与出行日期", false),

    /** 修改请求无法定位到具体的天/活动，需要用户澄清 */
    AMBIGUOUS_MODIFICATION(2002, "无法确定要修改的天数或活动，请说明具体是第几天或哪个活动", false),

    /** 单个数据源降级，只记录在数据源状态中，不会作为任务失败 */
    PROVIDER_DEGRADED(2003, "部分数据源不可用，已使用估算数据", false),

    /** LLM 行程编排失败且不允许使用模板行程 */
    COMPOSITION_FAILURE(2004, "行程生成失败，请稍后重试", true),

    /** Redis / 数据库不可用 */
    STORAGE_UNAVAILABLE(2005, "存储服务暂不可用，请稍后重试", true),

    /** 任务已取消（终态，不是错误） */
    CANCELLED(2006, "任务已取消", false),

    /** 任务不存在 */
    UNKNOWN_TASK(2007, "任务不存在或已过期", false),

    /** 任务整体超时 */
    TASK_TIMEOUT(2008, "行程生成超时，请稍后重试", true),

    /** 请求过于频繁 */
    RATE_LIMITED(2009, "请求过于频繁，请稍后再试", true),

    /** 行程版本不存在 */
    UNKNOWN_VERSION(2010, "行程版本不存在", false),

    /** 编排过程中的意外异常 */
    INTERNAL_ERROR(2099, "服务器内部错误，请稍后重试", false);

    private final int code;
    private final String msg;
    private final boolean retryable;

    ErrorCode(int code, String msg, boolean retryable) {
        this.code = code;
        this.msg = msg;
        this.retryable = retryable;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
