package admission.core.model;

public record RateLimitResult(
    Decision decision,
    long retryAfterNanos
) {
    private static final RateLimitResult ALLOWED = new RateLimitResult(Decision.ALLOW, 0L);

    public static RateLimitResult allow() {
        return ALLOWED;
    }

    public static RateLimitResult reject(long retryAfterNanos) {
        return new RateLimitResult(Decision.REJECT, Math.max(0L, retryAfterNanos));
    }

    public static RateLimitResult blocked(long retryAfterNanos) {
        return new RateLimitResult(Decision.BLOCKED, Math.max(0L, retryAfterNanos));
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }
}
