package com.genesisgate.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一 HTTP 返回对象。
 *
 * <p>字段约定：</p>
 * <ul>
 *   <li>success：业务是否成功（不是 HTTP 状态码）。</li>
 *   <li>code：业务错误码。成功固定为 0。</li>
 *   <li>error：失败时给调用方看的简短原因；成功时不输出。</li>
 *   <li>data：成功时的数据。</li>
 *   <li>ts：服务端响应时间戳（毫秒）。</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean success,
        int code,
        String error,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, null, data, System.currentTimeMillis());
    }

    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, null, null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String error) {
        return new Result<>(false, code, error, null, System.currentTimeMillis());
    }
}
