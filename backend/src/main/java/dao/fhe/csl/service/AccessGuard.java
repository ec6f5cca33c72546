package dao.fhe.csl.service;

import dao.fhe.csl.config.GuardProperties;
import dao.fhe.csl.config.OracleProperties;
import dao.fhe.csl.event.EventJournal;
import dao.fhe.csl.event.RegistryChangedEvent;
import dao.fhe.csl.model.RegistrySnapshot;
import dao.fhe.csl.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Roles, pause flag and per-actor cooldowns.
 * <p>
 * Every mutating entry point runs through {@link #guard}: the caller is checked (role, pause,
 * cooldown) before the operation runs, and the caller's cooldown is stamped only after the
 * operation returned normally. A rejected check or a failing operation leaves no trace.
 * <p>
 * Not thread-safe on its own; {@link SettlementCoordinator} serializes all calls.
 */
@Slf4j
@Service
public class AccessGuard {

    /**
     * Body of a guarded operation. Receives the normalized caller and the time of the call.
     */
    @FunctionalInterface
    public interface GuardedOperation<T> {
        T apply(String actor, long now);
    }

    private final Clock clock;
    private final EventJournal journal;
    private final CooldownLedger cooldowns = new CooldownLedger();
    private final Set<String> providers = new LinkedHashSet<>();
    private final Set<String> relayers = new LinkedHashSet<>();
    private String admin;
    private boolean paused;
    private long cooldownSeconds;

    public AccessGuard(GuardProperties guardProps, OracleProperties oracleProps, Clock clock, EventJournal journal) {
        this.clock = clock;
        this.journal = journal;
        this.admin = HexUtil.normalizeActor(guardProps.getAdmin());
        if (admin == null) {
            throw new IllegalStateException("guard.admin is not configured");
        }
        if (guardProps.getCooldownSeconds() < 0) {
            throw new IllegalStateException("guard.cooldown-seconds must not be negative");
        }
        this.providers.addAll(HexUtil.normalizeActors(guardProps.getProviders()));
        this.relayers.addAll(HexUtil.normalizeActors(oracleProps.getRelayers()));
        this.paused = guardProps.isPaused();
        this.cooldownSeconds = guardProps.getCooldownSeconds();

        log.info("AccessGuard initialized: admin={}, providers={}, relayers={}, cooldownSeconds={}, paused={}",
                admin, providers.size(), relayers.size(), cooldownSeconds, paused);
    }

    public <T> T guard(String caller, GuardedAction action, GuardedOperation<T> operation) {
        long now = clock.instant().getEpochSecond();
        String actor = check(caller, action, now);
        T result = operation.apply(actor, now);
        cooldowns.stamp(actor, action.cooldown(), now);
        return result;
    }

    public void authorizeProvider(String caller, String provider) {
        guard(caller, GuardedAction.ADMINISTER, (actor, now) -> {
            String p = requireActor(provider);
            if (providers.add(p)) {
                journal.append(new RegistryChangedEvent(RegistryChangedEvent.Change.PROVIDER_AUTHORIZED, p, actor, now));
            }
            return null;
        });
    }

    public void revokeProvider(String caller, String provider) {
        guard(caller, GuardedAction.ADMINISTER, (actor, now) -> {
            String p = requireActor(provider);
            if (providers.remove(p)) {
                journal.append(new RegistryChangedEvent(RegistryChangedEvent.Change.PROVIDER_REVOKED, p, actor, now));
            }
            return null;
        });
    }

    public void setPaused(String caller, boolean value) {
        guard(caller, GuardedAction.ADMINISTER, (actor, now) -> {
            if (paused != value) {
                paused = value;
                journal.append(new RegistryChangedEvent(RegistryChangedEvent.Change.PAUSED_SET, String.valueOf(value), actor, now));
            }
            return null;
        });
    }

    public void setCooldown(String caller, long seconds) {
        guard(caller, GuardedAction.ADMINISTER, (actor, now) -> {
            if (seconds < 0) {
                throw new SettlementException(ErrorKind.INVALID_INPUT, "Cooldown must not be negative: " + seconds);
            }
            cooldownSeconds = seconds;
            journal.append(new RegistryChangedEvent(RegistryChangedEvent.Change.COOLDOWN_SET, String.valueOf(seconds), actor, now));
            return null;
        });
    }

    public void transferAdmin(String caller, String newAdmin) {
        guard(caller, GuardedAction.ADMINISTER, (actor, now) -> {
            String next = requireActor(newAdmin);
            if (next.equals(admin)) {
                throw new SettlementException(ErrorKind.INVALID_INPUT, "Already administrator: " + next);
            }
            admin = next;
            journal.append(new RegistryChangedEvent(RegistryChangedEvent.Change.ADMIN_TRANSFERRED, next, actor, now));
            return null;
        });
    }

    public RegistrySnapshot snapshot() {
        return new RegistrySnapshot(admin, new ArrayList<>(providers), new ArrayList<>(relayers), paused, cooldownSeconds);
    }

    public boolean isPaused() {
        return paused;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    private String check(String caller, GuardedAction action, long now) {
        String actor = HexUtil.normalizeActor(caller);
        if (actor == null) {
            throw denied(ErrorKind.UNAUTHORIZED, "Caller identity missing for " + action);
        }
        if (!hasRole(actor, action.role())) {
            throw denied(ErrorKind.UNAUTHORIZED, actor + " lacks role " + action.role() + " for " + action);
        }
        if (action.pausable() && paused) {
            throw denied(ErrorKind.PAUSED_STATE, "System is paused, " + action + " rejected");
        }
        long wait = cooldowns.remaining(actor, action.cooldown(), now, cooldownSeconds);
        if (wait > 0) {
            throw denied(ErrorKind.COOLDOWN_ACTIVE, actor + " must wait " + wait + "s before " + action);
        }
        return actor;
    }

    private boolean hasRole(String actor, GuardedAction.Role role) {
        switch (role) {
            case ADMIN:
                return actor.equals(admin);
            case PROVIDER:
                return providers.contains(actor);
            case ORACLE:
                return relayers.contains(actor);
            case ANYONE:
                return true;
            default:
                return false;
        }
    }

    private static String requireActor(String value) {
        String actor = HexUtil.normalizeActor(value);
        if (actor == null) {
            throw new SettlementException(ErrorKind.INVALID_INPUT, "Actor identity is blank");
        }
        return actor;
    }

    private static SettlementException denied(ErrorKind kind, String message) {
        log.debug("Guard denied: {}", message);
        return new SettlementException(kind, message);
    }
}
