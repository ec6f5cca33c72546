package dao.fhe.csl.event;

/**
 * Notification emitted after a mutating operation has been applied.
 * Journaled in order and never retracted.
 */
public interface LedgerEvent {

    /** Unix seconds at which the change was applied. */
    long timestamp();

    default String type() {
        return getClass().getSimpleName();
    }
}
