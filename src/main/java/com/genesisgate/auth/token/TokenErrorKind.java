package com.genesisgate.auth.token;

public enum TokenErrorKind {

    /** 不是可解析的 JWT（结构、header、必需 claim 缺失/类型不对、issuer/typ 不匹配）。 */
    MALFORMED,

    SIGNATURE_INVALID,

    /** header.alg 不是期望的 HS256（包括 none / RS256 / HS512）。 */
    ALGORITHM_MISMATCH,

    EXPIRED,

    /** refreshToken 在台账中存在，但已被撤销（轮换、登出、管理员撤销）。 */
    REVOKED,

    /** refreshToken 签名有效，但台账里找不到。 */
    UNKNOWN,

    /** Redis 不可用或超时。 */
    DEPENDENCY_UNAVAILABLE
}
