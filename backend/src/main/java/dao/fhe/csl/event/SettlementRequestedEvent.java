package dao.fhe.csl.event;

public record SettlementRequestedEvent(
        long batchId,
        String token,
        String stateHash,
        String requestedBy,
        long timestamp
) implements LedgerEvent {}
