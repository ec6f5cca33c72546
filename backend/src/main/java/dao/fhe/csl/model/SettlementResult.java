package dao.fhe.csl.model;

import java.math.BigInteger;

/**
 * Figures derived when a settlement is finalized.
 */
public record SettlementResult(
        String token,
        BigInteger decryptedTotal,
        long totalCost,
        long totalBudget,
        long revenue,
        long profit,
        long finalizedAt
) {}
