package dao.fhe.csl.event;

public record SettlementRejectedEvent(
        long batchId,
        String token,
        String reason,
        long timestamp
) implements LedgerEvent {}
