package dao.fhe.csl.service;

/**
 * What a guarded entry point needs from its caller.
 */
public enum GuardedAction {

    /** Registry administration. Allowed while paused so the admin can always unpause. */
    ADMINISTER(Role.ADMIN, false, Cooldown.NONE),
    /** Opening and closing batches. */
    MANAGE_BATCH(Role.ADMIN, true, Cooldown.NONE),
    SUBMIT_CONTRIBUTION(Role.PROVIDER, true, Cooldown.SUBMISSION),
    REQUEST_SETTLEMENT(Role.ANYONE, true, Cooldown.SETTLEMENT),
    DELIVER_RESULT(Role.ORACLE, true, Cooldown.NONE);

    public enum Role { ADMIN, PROVIDER, ORACLE, ANYONE }

    public enum Cooldown { NONE, SUBMISSION, SETTLEMENT }

    private final Role role;
    private final boolean pausable;
    private final Cooldown cooldown;

    GuardedAction(Role role, boolean pausable, Cooldown cooldown) {
        this.role = role;
        this.pausable = pausable;
        this.cooldown = cooldown;
    }

    public Role role() {
        return role;
    }

    public boolean pausable() {
        return pausable;
    }

    public Cooldown cooldown() {
        return cooldown;
    }
}
