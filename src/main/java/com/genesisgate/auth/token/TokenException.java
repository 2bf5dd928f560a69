package com.genesisgate.auth.token;

/**
 * token 校验/生命周期失败。
 *
 * <p>message 只放简短的机器可读原因（例如 {@code token_expired}），不拼 token 原文。</p>
 */
public class TokenException extends RuntimeException {

    private final TokenErrorKind kind;

    public TokenException(TokenErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TokenException(TokenErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TokenErrorKind kind() {
        return kind;
    }
}
