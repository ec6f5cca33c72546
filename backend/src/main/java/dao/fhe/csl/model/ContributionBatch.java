package dao.fhe.csl.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ContributionBatch {

    private long id;
    private BatchStatus status;
    private List<Contribution> contributions = new ArrayList<>();
    private long totalCost;
    private long totalBudget;
    /**
     * Running homomorphic sum of all contribution handles, in index order.
     * Informational only: settlement always re-derives the aggregate from {@link #contributions}.
     */
    private CiphertextHandle runningAggregate;
    private long openedAt;  // unix seconds
    private long closedAt;  // unix seconds, 0 while open
    /** Figures of the one finalized settlement of this batch, null until then. */
    private SettlementResult settlement;

    public int getContributionCount() {
        return contributions.size();
    }

    public boolean isSettled() {
        return settlement != null;
    }
}
