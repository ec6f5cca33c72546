package dao.fhe.csl.service;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Last submission and last settlement-request time per actor, in unix seconds.
 */
public class CooldownLedger {

    private final Map<String, Long> lastSubmission = new HashMap<>();
    private final Map<String, Long> lastSettlementRequest = new HashMap<>();

    public OptionalLong last(String actor, GuardedAction.Cooldown kind) {
        Long v = table(kind).get(actor);
        return v == null ? OptionalLong.empty() : OptionalLong.of(v);
    }

    /**
     * Seconds the actor still has to wait, 0 if the action is allowed now.
     */
    public long remaining(String actor, GuardedAction.Cooldown kind, long now, long cooldownSeconds) {
        if (kind == GuardedAction.Cooldown.NONE) return 0L;
        OptionalLong last = last(actor, kind);
        if (last.isEmpty()) return 0L;
        // elapsed time is compared, last + cooldown may not fit in a long
        long elapsed = Math.max(0L, now - last.getAsLong());
        return elapsed >= cooldownSeconds ? 0L : cooldownSeconds - elapsed;
    }

    public void stamp(String actor, GuardedAction.Cooldown kind, long now) {
        if (kind == GuardedAction.Cooldown.NONE) return;
        table(kind).put(actor, now);
    }

    private Map<String, Long> table(GuardedAction.Cooldown kind) {
        switch (kind) {
            case SUBMISSION:
                return lastSubmission;
            case SETTLEMENT:
                return lastSettlementRequest;
            default:
                throw new IllegalArgumentException("No cooldown table for " + kind);
        }
    }
}
