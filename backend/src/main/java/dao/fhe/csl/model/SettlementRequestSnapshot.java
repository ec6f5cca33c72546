package dao.fhe.csl.model;

import lombok.Value;

/**
 * Read-only copy of a {@link SettlementRequest} as it was when the query ran.
 */
@Value
public class SettlementRequestSnapshot {

    String token;
    long batchId;
    String stateHash;
    CiphertextHandle aggregateHandle;
    int contributionCount;
    String requestedBy;
    long requestedAt;
    SettlementStatus status;
    String rejectionReason;

    public static SettlementRequestSnapshot of(SettlementRequest r) {
        return new SettlementRequestSnapshot(r.getToken(), r.getBatchId(), r.getStateHash(), r.getAggregateHandle(),
                r.getContributionCount(), r.getRequestedBy(), r.getRequestedAt(), r.getStatus(), r.getRejectionReason());
    }

    public boolean isProcessed() {
        return status != SettlementStatus.REQUESTED;
    }
}
