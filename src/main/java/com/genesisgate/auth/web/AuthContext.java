package com.genesisgate.auth.web;

import com.genesisgate.auth.token.Identity;

/**
 * 请求级别的“当前身份”上下文。
 *
 * <p>ThreadLocal 一定要在请求结束时清理，否则线程复用时会串号；
 * {@link AccessTokenInterceptor#afterCompletion} 负责 clear。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Identity> IDENTITY = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void set(Identity identity) {
        IDENTITY.set(identity);
    }

    public static Identity get() {
        return IDENTITY.get();
    }

    /**
     * 受保护接口里调用；拦截器没放行的请求到不了这里，拿不到说明路由没配进 protected-paths。
     */
    public static Identity require() {
        Identity identity = IDENTITY.get();
        if (identity == null) {
            throw new IllegalStateException("no authenticated identity bound to this request");
        }
        return identity;
    }

    public static void clear() {
        IDENTITY.remove();
    }
}
