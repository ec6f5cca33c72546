package dao.fhe.csl.model;

import lombok.Value;

import java.util.List;

/**
 * Read-only copy of a {@link ContributionBatch}. Contributions are immutable, so copying the
 * list is enough to detach the snapshot from the ledger.
 */
@Value
public class BatchSnapshot {

    long id;
    BatchStatus status;
    List<Contribution> contributions;
    long totalCost;
    long totalBudget;
    CiphertextHandle runningAggregate;
    long openedAt;
    long closedAt;
    SettlementResult settlement;

    public static BatchSnapshot of(ContributionBatch batch) {
        return new BatchSnapshot(batch.getId(), batch.getStatus(), List.copyOf(batch.getContributions()),
                batch.getTotalCost(), batch.getTotalBudget(), batch.getRunningAggregate(),
                batch.getOpenedAt(), batch.getClosedAt(), batch.getSettlement());
    }

    public int getContributionCount() {
        return contributions.size();
    }

    public boolean isSettled() {
        return settlement != null;
    }
}
