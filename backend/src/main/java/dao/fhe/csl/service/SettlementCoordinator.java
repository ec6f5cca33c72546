package dao.fhe.csl.service;

import dao.fhe.csl.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for every operation on the settlement ledger.
 * <p>
 * All methods are serialized on this instance, so each call observes and mutates the ledger as
 * one transaction. Mutating calls run inside {@link AccessGuard#guard}. Batches and requests
 * leave this class only as snapshots, so nothing outside the lock reads or changes live state.
 */
@Slf4j
@Service
public class SettlementCoordinator {

    private final AccessGuard guard;
    private final BatchService batchService;
    private final SettlementService settlementService;

    public SettlementCoordinator(AccessGuard guard,
                                 BatchService batchService,
                                 SettlementService settlementService) {
        this.guard = guard;
        this.batchService = batchService;
        this.settlementService = settlementService;
    }

    // ---- batch ledger ----

    public synchronized BatchSnapshot openBatch(String caller) {
        return BatchSnapshot.of(guard.guard(caller, GuardedAction.MANAGE_BATCH, batchService::openBatch));
    }

    public synchronized BatchSnapshot closeBatch(String caller) {
        return BatchSnapshot.of(guard.guard(caller, GuardedAction.MANAGE_BATCH, batchService::closeBatch));
    }

    public synchronized Contribution submitContribution(String caller, long cost, long budget, String handleHex) {
        return guard.guard(caller, GuardedAction.SUBMIT_CONTRIBUTION, (actor, now) ->
                batchService.submitContribution(actor, now, cost, budget, parseHandle(handleHex)));
    }

    // ---- settlement protocol ----

    public synchronized SettlementRequestSnapshot requestSettlement(String caller, long batchId) {
        SettlementRequest request = guard.guard(caller, GuardedAction.REQUEST_SETTLEMENT, (actor, now) ->
                settlementService.requestSettlement(actor, now, batchId));
        log.info("Settlement requested: batchId={}, token={}, stateHash={}",
                batchId, request.getToken(), request.getStateHash());
        return SettlementRequestSnapshot.of(request);
    }

    public synchronized SettlementResult onDecryptionResult(String caller, String token, BigInteger cleartext, String proof) {
        SettlementResult result = guard.guard(caller, GuardedAction.DELIVER_RESULT, (actor, now) ->
                settlementService.onDecryptionResult(now, token, cleartext, proof));
        log.info("Settlement finalized: token={}, decryptedTotal={}, revenue={}, profit={}",
                token, result.decryptedTotal(), result.revenue(), result.profit());
        return result;
    }

    // ---- administration ----

    public synchronized void authorizeProvider(String caller, String provider) {
        guard.authorizeProvider(caller, provider);
    }

    public synchronized void revokeProvider(String caller, String provider) {
        guard.revokeProvider(caller, provider);
    }

    public synchronized void setPaused(String caller, boolean paused) {
        guard.setPaused(caller, paused);
    }

    public synchronized void setCooldown(String caller, long seconds) {
        guard.setCooldown(caller, seconds);
    }

    public synchronized void transferAdmin(String caller, String newAdmin) {
        guard.transferAdmin(caller, newAdmin);
    }

    // ---- queries ----

    public synchronized RegistrySnapshot getRegistry() {
        return guard.snapshot();
    }

    public synchronized List<BatchSnapshot> getBatches() {
        List<BatchSnapshot> out = new ArrayList<>();
        for (ContributionBatch batch : batchService.getBatches()) {
            out.add(BatchSnapshot.of(batch));
        }
        return out;
    }

    public synchronized BatchSnapshot getBatch(long batchId) {
        return BatchSnapshot.of(batchService.getBatch(batchId));
    }

    public synchronized SettlementRequestSnapshot getSettlementRequest(String token) {
        return SettlementRequestSnapshot.of(settlementService.getRequest(token));
    }

    public synchronized List<SettlementRequestSnapshot> getSettlementRequests() {
        List<SettlementRequestSnapshot> out = new ArrayList<>();
        for (SettlementRequest request : settlementService.getRequests()) {
            out.add(SettlementRequestSnapshot.of(request));
        }
        return out;
    }

    private static CiphertextHandle parseHandle(String handleHex) {
        try {
            return CiphertextHandle.fromHex(handleHex);
        } catch (IllegalArgumentException e) {
            throw new SettlementException(ErrorKind.INVALID_INPUT, "Invalid ciphertext handle: " + e.getMessage(), e);
        }
    }
}
