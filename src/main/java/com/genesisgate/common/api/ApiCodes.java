package com.genesisgate.common.api;

/**
 * 统一错误码定义。
 *
 * <p>按 HTTP 状态码 * 100 划分区间，后续按模块扩展。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** accessToken 已过期，客户端应走 refresh */
    public static final int TOKEN_EXPIRED = 40101;

    /** refresh 失败（过期/无效/已撤销/未知，不区分） */
    public static final int REFRESH_FAILED = 40102;

    /** 已登录但角色不满足 */
    public static final int FORBIDDEN = 40300;

    public static final int NOT_FOUND = 40400;

    /** 触发限流 */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 依赖（Redis）不可用，可重试 */
    public static final int SERVICE_UNAVAILABLE = 50300;
}
