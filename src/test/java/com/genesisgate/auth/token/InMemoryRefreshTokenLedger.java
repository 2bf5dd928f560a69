package com.genesisgate.auth.token;

import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 内存版台账，语义与 {@link RedisRefreshTokenLedger} 一致：撤销时从用户/会话索引里移除。
 * {@link #setDown(boolean)} 模拟 Redis 故障，{@link #failNextSaves(int)} 模拟写入瞬时失败。
 */
public class InMemoryRefreshTokenLedger implements RefreshTokenLedger {

    private final Map<String, RefreshRecord> records = new HashMap<>();
    private final Map<String, Set<String>> byUser = new HashMap<>();
    private final Map<String, Set<String>> bySession = new HashMap<>();
    private volatile boolean down;
    private int failingSaves;

    public void setDown(boolean down) {
        this.down = down;
    }

    public synchronized void failNextSaves(int n) {
        this.failingSaves = n;
    }

    public synchronized Set<String> activeOfUser(String userId) {
        return Set.copyOf(byUser.getOrDefault(userId, Set.of()));
    }

    @Override
    public synchronized void save(RefreshRecord record) {
        checkUp();
        if (failingSaves > 0) {
            failingSaves--;
            throw new RedisConnectionFailureException("save failed (test)");
        }
        records.put(record.tokenHash(), record);
        byUser.computeIfAbsent(record.userId(), k -> new LinkedHashSet<>()).add(record.tokenHash());
        bySession.computeIfAbsent(record.sessionId(), k -> new LinkedHashSet<>()).add(record.tokenHash());
    }

    @Override
    public synchronized Optional<RefreshRecord> find(String tokenHash) {
        checkUp();
        return Optional.ofNullable(records.get(tokenHash));
    }

    @Override
    public synchronized RevokeResult revoke(String tokenHash, RevokeReason reason, Instant now) {
        checkUp();
        RefreshRecord record = records.get(tokenHash);
        if (record == null) {
            return RevokeResult.notFound();
        }
        if (record.revoked()) {
            return new RevokeResult(Outcome.ALREADY_REVOKED, record);
        }
        RefreshRecord revoked = record.revoke(reason, now);
        records.put(tokenHash, revoked);
        byUser.getOrDefault(record.userId(), new LinkedHashSet<>()).remove(tokenHash);
        bySession.getOrDefault(record.sessionId(), new LinkedHashSet<>()).remove(tokenHash);
        return new RevokeResult(Outcome.REVOKED_NOW, revoked);
    }

    @Override
    public synchronized int revokeSession(String sessionId, RevokeReason reason, Instant now) {
        checkUp();
        return revokeAll(bySession.getOrDefault(sessionId, Set.of()), reason, now);
    }

    @Override
    public synchronized int revokeAllForUser(String userId, RevokeReason reason, Instant now) {
        checkUp();
        return revokeAll(byUser.getOrDefault(userId, Set.of()), reason, now);
    }

    private int revokeAll(Set<String> hashes, RevokeReason reason, Instant now) {
        int n = 0;
        for (String hash : List.copyOf(hashes)) {
            if (revoke(hash, reason, now).outcome() == Outcome.REVOKED_NOW) {
                n++;
            }
        }
        return n;
    }

    private void checkUp() {
        if (down) {
            throw new RedisConnectionFailureException("redis down (test)");
        }
    }
}
