package com.genesisgate.auth.token;

/**
 * ROTATED：正常轮换后旧 token 作废；再次提交被视为重放。
 * DISCARDED：轮换时先写入的新记录，因旧记录没能成功作废而被丢弃（从未下发给客户端）。
 */
public enum RevokeReason { ROTATED, LOGOUT, REUSE_DETECTED, ADMIN, DISCARDED }
