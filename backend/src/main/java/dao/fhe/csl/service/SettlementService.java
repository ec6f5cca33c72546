package dao.fhe.csl.service;

import dao.fhe.csl.config.SettlementProperties;
import dao.fhe.csl.event.EventJournal;
import dao.fhe.csl.event.SettlementFinalizedEvent;
import dao.fhe.csl.event.SettlementRejectedEvent;
import dao.fhe.csl.event.SettlementRequestedEvent;
import dao.fhe.csl.model.*;
import dao.fhe.csl.repository.BatchRepository;
import dao.fhe.csl.repository.SettlementRequestRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Settlement of closed batches through the asynchronous decryption oracle.
 * <p>
 * {@link #requestSettlement} commits to the batch's handles, asks the oracle to decrypt the
 * aggregate and returns without waiting. {@link #onDecryptionResult} is the one-shot completion:
 * it finalizes a request at most once, and only if the batch still matches the commitment
 * taken at request time and the oracle's proof checks out. A request whose batch no longer
 * matches, or whose batch was settled through another token, ends REJECTED.
 */
@Slf4j
@Service
public class SettlementService {

    private final BatchRepository batchRepository;
    private final SettlementRequestRepository requestRepository;
    private final AggregationService aggregationService;
    private final CommitmentService commitmentService;
    private final DecryptionOracleClient oracle;
    private final EventJournal journal;
    private final long revenueMultiplier;

    public SettlementService(BatchRepository batchRepository,
                             SettlementRequestRepository requestRepository,
                             AggregationService aggregationService,
                             CommitmentService commitmentService,
                             DecryptionOracleClient oracle,
                             EventJournal journal,
                             SettlementProperties props) {
        this.batchRepository = batchRepository;
        this.requestRepository = requestRepository;
        this.aggregationService = aggregationService;
        this.commitmentService = commitmentService;
        this.oracle = oracle;
        this.journal = journal;
        this.revenueMultiplier = props.getRevenueMultiplier();
    }

    public SettlementRequest requestSettlement(String actor, long now, long batchId) {
        ContributionBatch batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new SettlementException(ErrorKind.BATCH_NOT_FOUND, "Batch not found: " + batchId));
        if (batch.getStatus() != BatchStatus.CLOSED) {
            throw new SettlementException(ErrorKind.BATCH_NOT_CLOSED, "Batch " + batchId + " is not closed");
        }
        if (batch.getContributionCount() == 0) {
            throw new SettlementException(ErrorKind.EMPTY_BATCH, "Batch " + batchId + " has no contributions");
        }
        if (batch.isSettled()) {
            throw new SettlementException(ErrorKind.ALREADY_SETTLED,
                    "Batch " + batchId + " already settled by token " + batch.getSettlement().token());
        }

        List<Contribution> contributions = batch.getContributions();
        CiphertextHandle aggregate;
        String stateHash;
        try {
            aggregate = aggregationService.aggregate(contributions);
            stateHash = commitmentService.stateHashOf(contributions);
        } catch (IllegalStateException e) {
            throw new SettlementException(ErrorKind.INTEGRITY_MISMATCH,
                    "Batch " + batchId + " contributions are inconsistent: " + e.getMessage(), e);
        }

        String token = oracle.requestDecryption(List.of(aggregate));
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Decryption oracle returned no token for batch " + batchId);
        }
        if (requestRepository.findByToken(token).isPresent()) {
            throw new IllegalStateException("Decryption oracle reused token " + token);
        }

        SettlementRequest request = new SettlementRequest(
                token, batchId, stateHash, aggregate, contributions.size(), actor, now);
        requestRepository.save(request);

        journal.append(new SettlementRequestedEvent(batchId, token, stateHash, actor, now));
        return request;
    }

    /**
     * Checks run in this order: unknown token, replay, malformed cleartext, integrity, proof.
     * Integrity failures and callbacks for a batch settled through another token reject the
     * request for good; every other failure leaves it untouched.
     */
    public SettlementResult onDecryptionResult(long now, String token, BigInteger cleartext, String proof) {
        SettlementRequest request = requestRepository.findByToken(token)
                .orElseThrow(() -> reject(ErrorKind.UNKNOWN_TOKEN, "Unknown settlement token: " + token));
        if (request.isProcessed()) {
            throw reject(ErrorKind.REPLAY_REJECTED, "Settlement token " + token + " already " + request.getStatus());
        }
        if (cleartext == null || cleartext.signum() < 0) {
            throw reject(ErrorKind.INVALID_INPUT, "Cleartext must be a non-negative integer");
        }

        ContributionBatch batch = batchRepository.findById(request.getBatchId()).orElse(null);
        if (batch == null) {
            throw rejectRequest(request, now, ErrorKind.INTEGRITY_MISMATCH,
                    "Batch " + request.getBatchId() + " referenced by token " + token + " no longer exists");
        }
        if (batch.isSettled()) {
            throw rejectRequest(request, now, ErrorKind.REPLAY_REJECTED,
                    "Batch " + batch.getId() + " already settled by token " + batch.getSettlement().token());
        }
        String mismatch = commitmentMismatch(request, batch);
        if (mismatch != null) {
            throw rejectRequest(request, now, ErrorKind.INTEGRITY_MISMATCH, mismatch);
        }

        if (!oracle.verifyAuthenticity(token, cleartext, proof)) {
            throw reject(ErrorKind.INVALID_AUTHENTICITY_PROOF, "Invalid authenticity proof for token " + token);
        }

        long revenue;
        long profit;
        try {
            revenue = Math.multiplyExact(revenueMultiplier, batch.getTotalBudget());
            profit = Math.subtractExact(revenue, batch.getTotalCost());
        } catch (ArithmeticException e) {
            throw new SettlementException(ErrorKind.INVALID_INPUT, "Settlement figures overflow for batch " + batch.getId(), e);
        }
        SettlementResult result = new SettlementResult(
                token, cleartext, batch.getTotalCost(), batch.getTotalBudget(), revenue, profit, now);

        request.markFinalized();
        batch.setSettlement(result);
        requestRepository.save(request);
        batchRepository.save(batch);
        journal.append(new SettlementFinalizedEvent(batch.getId(), token, cleartext, revenue, profit, now));

        // other tokens for this batch can never finalize now
        for (SettlementRequest other : requestRepository.findByBatchId(batch.getId())) {
            if (!other.isProcessed()) {
                markRejected(other, now, "Batch " + batch.getId() + " settled by token " + token);
            }
        }
        return result;
    }

    public SettlementRequest getRequest(String token) {
        return requestRepository.findByToken(token)
                .orElseThrow(() -> new SettlementException(ErrorKind.UNKNOWN_TOKEN, "Unknown settlement token: " + token));
    }

    public List<SettlementRequest> getRequests() {
        return requestRepository.findAll();
    }

    /**
     * Re-derive aggregate and commitment from the batch as it is now and compare with what was
     * recorded at request time. Returns the mismatch description, or null if both match.
     */
    private String commitmentMismatch(SettlementRequest request, ContributionBatch batch) {
        List<Contribution> contributions = batch.getContributions();
        if (contributions.isEmpty()) {
            return "Batch " + batch.getId() + " has no contributions at callback time";
        }
        String stateHash;
        CiphertextHandle aggregate;
        try {
            stateHash = commitmentService.stateHashOf(contributions);
            aggregate = aggregationService.aggregate(contributions);
        } catch (IllegalStateException e) {
            return "Batch " + batch.getId() + " contributions are inconsistent: " + e.getMessage();
        }
        if (!stateHash.equalsIgnoreCase(request.getStateHash())) {
            return "State hash mismatch for token " + request.getToken()
                    + ": committed=" + request.getStateHash() + ", current=" + stateHash;
        }
        if (!aggregate.equals(request.getAggregateHandle())) {
            return "Aggregate mismatch for token " + request.getToken()
                    + ": committed=" + request.getAggregateHandle() + ", current=" + aggregate;
        }
        return null;
    }

    private SettlementException rejectRequest(SettlementRequest request, long now, ErrorKind kind, String message) {
        markRejected(request, now, message);
        return reject(kind, message);
    }

    private void markRejected(SettlementRequest request, long now, String reason) {
        request.markRejected(reason);
        requestRepository.save(request);
        journal.append(new SettlementRejectedEvent(request.getBatchId(), request.getToken(), reason, now));
    }

    private static SettlementException reject(ErrorKind kind, String message) {
        log.warn("Decryption result rejected [{}]: {}", kind, message);
        return new SettlementException(kind, message);
    }
}
