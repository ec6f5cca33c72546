package dao.fhe.csl.event;

/**
 * Administrative change to the actor registry.
 *
 * @param change  what changed
 * @param subject affected actor, or the new value rendered as text (pause flag, cooldown seconds)
 */
public record RegistryChangedEvent(Change change, String subject, String changedBy, long timestamp) implements LedgerEvent {

    public enum Change {
        PROVIDER_AUTHORIZED,
        PROVIDER_REVOKED,
        PAUSED_SET,
        COOLDOWN_SET,
        ADMIN_TRANSFERRED
    }
}
