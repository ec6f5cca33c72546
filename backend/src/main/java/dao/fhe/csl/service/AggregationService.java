package dao.fhe.csl.service;

import dao.fhe.csl.model.CiphertextHandle;
import dao.fhe.csl.model.Contribution;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Homomorphic accumulation of contribution handles. Never decrypts.
 */
@Service
public class AggregationService {

    private final HomomorphicEvaluator evaluator;

    public AggregationService(HomomorphicEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * One step of the running sum. {@code running == null} means nothing accumulated yet.
     */
    public CiphertextHandle accumulate(CiphertextHandle running, CiphertextHandle next) {
        if (next == null) {
            throw new IllegalArgumentException("Cannot accumulate a null handle");
        }
        return running == null ? next : evaluator.add(running, next);
    }

    /**
     * Re-derive the aggregate of a batch from scratch by folding its contributions in index
     * order. Produces the same handle as the running sum built while the batch was open.
     */
    public CiphertextHandle aggregate(List<Contribution> contributions) {
        if (contributions == null || contributions.isEmpty()) {
            throw new IllegalArgumentException("No contributions to aggregate");
        }
        CiphertextHandle acc = null;
        for (int i = 0; i < contributions.size(); i++) {
            Contribution c = contributions.get(i);
            if (c.getIndex() != i) {
                throw new IllegalStateException("Contribution index gap: expected " + i + ", got " + c.getIndex());
            }
            acc = accumulate(acc, c.getHandle());
        }
        return acc;
    }
}
