package com.genesisgate.auth.token;

/**
 * 签发 refreshToken 时记录的请求来源，用于审计和按设备撤销。
 */
public record RequestMetadata(String ip, String userAgent) {

    public static final RequestMetadata UNKNOWN = new RequestMetadata(null, null);
}
