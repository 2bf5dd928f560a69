package com.genesisgate.auth.web;

import com.genesisgate.auth.token.TokenErrorKind;
import com.genesisgate.auth.token.TokenException;

/**
 * refresh 失败对外只暴露一个错误码，原始的 {@link TokenErrorKind} 留在这里给日志用。
 */
public class RefreshFailedException extends RuntimeException {

    private final TokenErrorKind kind;

    public RefreshFailedException(TokenException cause) {
        super("refresh_failed", cause);
        this.kind = cause.kind();
    }

    public TokenErrorKind kind() {
        return kind;
    }
}
