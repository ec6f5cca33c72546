package dao.fhe.csl.service;

import dao.fhe.csl.event.RegistryChangedEvent;
import dao.fhe.csl.model.RegistrySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static dao.fhe.csl.service.LedgerFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class AccessGuardTest {

    private LedgerFixture f;
    private AccessGuard guard;

    @BeforeEach
    void setUp() {
        f = new LedgerFixture(60, 10);
        guard = f.guard;
    }

    @Test
    void rolesAreLoadedFromConfiguration() {
        RegistrySnapshot snapshot = guard.snapshot();
        assertEquals(ADMIN, snapshot.admin());
        assertTrue(snapshot.providers().contains(PROVIDER_A));
        assertTrue(snapshot.providers().contains(PROVIDER_B));
        assertEquals(1, snapshot.relayers().size());
        assertFalse(snapshot.paused());
        assertEquals(60L, snapshot.cooldownSeconds());
    }

    @Test
    void callerIdentityIsNormalized() {
        String upper = "0X" + PROVIDER_A.substring(2).toUpperCase();
        String actor = guard.guard(upper, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> a);
        assertEquals(PROVIDER_A, actor);
    }

    @Test
    void operationDoesNotRunWhenRejected() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(SettlementException.class,
                () -> guard.guard(OUTSIDER, GuardedAction.MANAGE_BATCH, (a, now) -> calls.incrementAndGet()));
        guard.setPaused(ADMIN, true);
        assertThrows(SettlementException.class,
                () -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> calls.incrementAndGet()));
        assertEquals(0, calls.get());
    }

    @Test
    void roleIsCheckedBeforePause() {
        guard.setPaused(ADMIN, true);
        SettlementException e = assertThrows(SettlementException.class,
                () -> guard.guard(OUTSIDER, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null));
        assertEquals(ErrorKind.UNAUTHORIZED, e.getKind());
    }

    @Test
    void pauseIsCheckedBeforeCooldown() {
        guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null);
        guard.setPaused(ADMIN, true);
        SettlementException e = assertThrows(SettlementException.class,
                () -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null));
        assertEquals(ErrorKind.PAUSED_STATE, e.getKind());
    }

    @Test
    void cooldownBoundaryIsInclusive() {
        guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null);
        f.clock.advanceSeconds(59);
        assertEquals(ErrorKind.COOLDOWN_ACTIVE, assertThrows(SettlementException.class,
                () -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null)).getKind());
        f.clock.advanceSeconds(1);
        assertDoesNotThrow(() -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null));
    }

    @Test
    void submissionAndSettlementCooldownsAreIndependent() {
        guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null);
        assertDoesNotThrow(() -> guard.guard(PROVIDER_A, GuardedAction.REQUEST_SETTLEMENT, (a, now) -> null));
        assertThrows(SettlementException.class,
                () -> guard.guard(PROVIDER_A, GuardedAction.REQUEST_SETTLEMENT, (a, now) -> null));
    }

    @Test
    void failingOperationLeavesNoCooldown() {
        assertThrows(IllegalStateException.class,
                () -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> {
                    throw new IllegalStateException("boom");
                }));
        assertDoesNotThrow(() -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null));
    }

    @Test
    void cooldownChangeAppliesToExistingStamps() {
        guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null);
        guard.setCooldown(ADMIN, 10);
        f.clock.advanceSeconds(10);
        assertDoesNotThrow(() -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null));
        assertEquals(ErrorKind.INVALID_INPUT,
                assertThrows(SettlementException.class, () -> guard.setCooldown(ADMIN, -1)).getKind());
        assertEquals(10L, guard.getCooldownSeconds());
    }

    @Test
    void adminCanRevokeAndAuthorizeProviders() {
        guard.revokeProvider(ADMIN, PROVIDER_A);
        assertEquals(ErrorKind.UNAUTHORIZED, assertThrows(SettlementException.class,
                () -> guard.guard(PROVIDER_A, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null)).getKind());

        guard.authorizeProvider(ADMIN, OUTSIDER);
        assertDoesNotThrow(() -> guard.guard(OUTSIDER, GuardedAction.SUBMIT_CONTRIBUTION, (a, now) -> null));

        long registryEvents = f.journal.getEvents().stream().filter(e -> e instanceof RegistryChangedEvent).count();
        assertEquals(2L, registryEvents);
    }

    @Test
    void onlyAdminAdministers() {
        assertEquals(ErrorKind.UNAUTHORIZED,
                assertThrows(SettlementException.class, () -> guard.setPaused(PROVIDER_A, true)).getKind());
        assertEquals(ErrorKind.UNAUTHORIZED,
                assertThrows(SettlementException.class, () -> guard.authorizeProvider(OUTSIDER, OUTSIDER)).getKind());
        assertFalse(guard.isPaused());
    }

    @Test
    void adminOperationsWorkWhilePaused() {
        guard.setPaused(ADMIN, true);
        assertDoesNotThrow(() -> guard.authorizeProvider(ADMIN, OUTSIDER));
        guard.setPaused(ADMIN, false);
        assertFalse(guard.isPaused());
    }

    @Test
    void transferAdminHandsOverTheRole() {
        guard.transferAdmin(ADMIN, PROVIDER_B);
        assertEquals(PROVIDER_B, guard.snapshot().admin());
        assertThrows(SettlementException.class, () -> guard.setPaused(ADMIN, true));
        assertDoesNotThrow(() -> guard.setPaused(PROVIDER_B, true));

        assertEquals(ErrorKind.INVALID_INPUT,
                assertThrows(SettlementException.class, () -> guard.transferAdmin(PROVIDER_B, PROVIDER_B)).getKind());
        assertEquals(ErrorKind.INVALID_INPUT,
                assertThrows(SettlementException.class, () -> guard.transferAdmin(PROVIDER_B, " ")).getKind());
    }

    @Test
    void anyoneMayRequestSettlementButOnlyRelayersDeliver() {
        assertDoesNotThrow(() -> guard.guard(OUTSIDER, GuardedAction.REQUEST_SETTLEMENT, (a, now) -> null));
        assertEquals(ErrorKind.UNAUTHORIZED, assertThrows(SettlementException.class,
                () -> guard.guard(ADMIN, GuardedAction.DELIVER_RESULT, (a, now) -> null)).getKind());
        assertDoesNotThrow(() -> guard.guard(RELAYER, GuardedAction.DELIVER_RESULT, (a, now) -> null));
        // deliveries carry no cooldown
        assertDoesNotThrow(() -> guard.guard(RELAYER, GuardedAction.DELIVER_RESULT, (a, now) -> null));
    }
}
