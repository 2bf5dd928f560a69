package com.genesisgate.auth.token;

/**
 * 已通过校验的请求身份；role 是后续鉴权的唯一输入。
 */
public record Identity(
        String userId,
        String email,
        String username,
        String role
) {
    public boolean hasRole(String expected) {
        return role != null && role.equals(expected);
    }
}
