package dao.fhe.csl.controller;

import dao.fhe.csl.model.BatchSnapshot;
import dao.fhe.csl.model.Contribution;
import dao.fhe.csl.model.SettlementRequestSnapshot;
import dao.fhe.csl.model.SettlementResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON views of ledger objects.
 */
final class BatchViews {
    private BatchViews() {}

    static Map<String, Object> batchInfo(BatchSnapshot batch) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("batchId", batch.getId());
        info.put("status", batch.getStatus() != null ? batch.getStatus().toString() : "UNKNOWN");
        info.put("openedAt", batch.getOpenedAt());
        info.put("closedAt", batch.getClosedAt());
        info.put("contributionCount", batch.getContributionCount());
        info.put("totalCost", batch.getTotalCost());
        info.put("totalBudget", batch.getTotalBudget());
        info.put("runningAggregate", batch.getRunningAggregate() != null ? batch.getRunningAggregate().toHex() : null);

        List<Map<String, Object>> contributions = new ArrayList<>();
        for (Contribution c : batch.getContributions()) {
            contributions.add(contributionInfo(c));
        }
        info.put("contributions", contributions);
        info.put("settlement", batch.isSettled() ? resultInfo(batch.getSettlement()) : null);
        return info;
    }

    static Map<String, Object> contributionInfo(Contribution c) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("batchId", c.getBatchId());
        info.put("index", c.getIndex());
        info.put("provider", c.getProvider());
        info.put("handle", c.getHandle().toHex());
        info.put("cost", c.getCost());
        info.put("budget", c.getBudget());
        info.put("submittedAt", c.getSubmittedAt());
        return info;
    }

    static Map<String, Object> requestInfo(SettlementRequestSnapshot r) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("token", r.getToken());
        info.put("batchId", r.getBatchId());
        info.put("stateHash", r.getStateHash());
        info.put("aggregateHandle", r.getAggregateHandle().toHex());
        info.put("contributionCount", r.getContributionCount());
        info.put("requestedBy", r.getRequestedBy());
        info.put("requestedAt", r.getRequestedAt());
        info.put("processed", r.isProcessed());
        info.put("settlementStatus", r.getStatus().toString());
        info.put("rejectionReason", r.getRejectionReason());
        return info;
    }

    static Map<String, Object> resultInfo(SettlementResult result) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("token", result.token());
        info.put("decryptedTotal", result.decryptedTotal());
        info.put("totalCost", result.totalCost());
        info.put("totalBudget", result.totalBudget());
        info.put("revenue", result.revenue());
        info.put("profit", result.profit());
        info.put("finalizedAt", result.finalizedAt());
        return info;
    }
}
