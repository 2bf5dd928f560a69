package com.genesisgate.common.ratelimit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 为接口指定限流策略；没有标注的接口在 include-paths 内使用 {@link #DEFAULT}。
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    String DEFAULT = "default";

    /** 登录、refresh、重置密码等敏感操作 */
    String STRICT = "strict";

    String policy() default DEFAULT;
}
