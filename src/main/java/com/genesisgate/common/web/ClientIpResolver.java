package com.genesisgate.common.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 解析客户端 IP：限流的 key 和 refresh 台账的审计字段都用它。
 *
 * <p>只有部署在可信反向代理之后才应打开 trust-forwarded-headers，否则客户端可以伪造 X-Forwarded-For 绕过限流。</p>
 */
@Component
public class ClientIpResolver {

    private final boolean trustForwardedHeaders;

    public ClientIpResolver(@Value("${gate.ratelimit.trust-forwarded-headers:false}") boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public String resolve(HttpServletRequest req) {
        if (req == null) {
            return null;
        }
        if (trustForwardedHeaders) {
            String xff = req.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isBlank()) {
                    return first;
                }
            }
            String xri = req.getHeader("X-Real-IP");
            if (xri != null && !xri.isBlank()) {
                return xri.trim();
            }
        }
        return req.getRemoteAddr();
    }
}
