package com.genesisgate.common.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genesisgate.common.api.Result;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 拦截器里直接中断请求时，用它输出统一的 Result JSON，避免默认空响应/HTML。
 */
@Slf4j
@Component
public class JsonResponseWriter {

    private final ObjectMapper objectMapper;

    public JsonResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, int httpStatus, Result<?> body) {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(httpStatus);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
        try {
            response.getWriter().write(objectMapper.writeValueAsString(body));
        } catch (Exception e) {
            log.debug("write json response failed: status={}, err={}", httpStatus, e.toString());
        }
    }
}
