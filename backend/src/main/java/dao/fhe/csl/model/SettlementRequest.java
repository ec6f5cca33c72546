package dao.fhe.csl.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A pending, finalized or rejected decryption request for one closed batch.
 * <p>
 * Everything except {@code status} is fixed at creation; {@code status} leaves REQUESTED at
 * most once. Only the settlement service holds instances; callers see
 * {@link SettlementRequestSnapshot}s.
 */
@Getter
@ToString
public class SettlementRequest {

    private final String token;
    private final long batchId;
    private final String stateHash;
    private final CiphertextHandle aggregateHandle;
    private final int contributionCount;
    private final String requestedBy;
    private final long requestedAt; // unix seconds
    private SettlementStatus status = SettlementStatus.REQUESTED;
    private String rejectionReason;

    public SettlementRequest(String token,
                             long batchId,
                             String stateHash,
                             CiphertextHandle aggregateHandle,
                             int contributionCount,
                             String requestedBy,
                             long requestedAt) {
        this.token = token;
        this.batchId = batchId;
        this.stateHash = stateHash;
        this.aggregateHandle = aggregateHandle;
        this.contributionCount = contributionCount;
        this.requestedBy = requestedBy;
        this.requestedAt = requestedAt;
    }

    /** True once the request is finalized or rejected. */
    public boolean isProcessed() {
        return status != SettlementStatus.REQUESTED;
    }

    public void markFinalized() {
        transition(SettlementStatus.FINALIZED);
    }

    public void markRejected(String reason) {
        transition(SettlementStatus.REJECTED);
        this.rejectionReason = reason;
    }

    private void transition(SettlementStatus next) {
        if (isProcessed()) {
            throw new IllegalStateException("Settlement request " + token + " already " + status);
        }
        this.status = next;
    }
}
