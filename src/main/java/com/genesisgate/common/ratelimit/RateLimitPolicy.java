package com.genesisgate.common.ratelimit;

public record RateLimitPolicy(
        String name,
        long windowSeconds,
        long maxRequests,
        String message
) {
    public RateLimitPolicy {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("rate limit policy name must not be blank");
        }
        if (windowSeconds <= 0) {
            throw new IllegalStateException("gate.ratelimit.policies." + name + ".window-seconds must be > 0");
        }
        if (maxRequests <= 0) {
            throw new IllegalStateException("gate.ratelimit.policies." + name + ".max-requests must be > 0");
        }
        if (message == null || message.isBlank()) {
            message = "Too many requests, please try again later";
        }
    }
}
