package dao.fhe.csl.event;

import java.math.BigInteger;

public record SettlementFinalizedEvent(
        long batchId,
        String token,
        BigInteger decryptedTotal,
        long revenue,
        long profit,
        long timestamp
) implements LedgerEvent {}
