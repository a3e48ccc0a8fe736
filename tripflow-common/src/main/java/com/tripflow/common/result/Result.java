package com.tripflow.common.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result<T> {

    /** 0 表示成功，非 0 表示失败 */
    private Integer code;

    /** 提示信息 */
    private String msg;

    /** 业务数据 */
    private T data;

    /** 失败时是否建议客户端重试 */
    private Boolean retryable;

    public static <T> Result<T> success(T data) {
        Result<T> r = new Result<>();
        r.setCode(ErrorCode.SUCCESS.getCode());
        r.setMsg(ErrorCode.SUCCESS.getMsg());
        r.setData(data);
        return r;
    }

    public static <T> Result<T> error(String msg) {
        return error(ErrorCode.COMMON_ERROR.getCode(), msg);
    }

    public static <T> Result<T> error(ErrorCode errorCode) {
        Result<T> r = error(errorCode.getCode(), errorCode.getMsg());
        r.setRetryable(errorCode.isRetryable());
        return r;
    }

    public static <T> Result<T> error(ErrorCode errorCode, String msg) {
        Result<T> r = error(errorCode.getCode(), msg);
        r.setRetryable(errorCode.isRetryable());
        return r;
    }

    public static <T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<>();
        r.setCode(code);
        r.setMsg(msg);
        r.setData(null);
        r.setRetryable(Boolean.FALSE);
        return r;
    }
}
