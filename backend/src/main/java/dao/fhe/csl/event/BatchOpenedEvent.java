package dao.fhe.csl.event;

public record BatchOpenedEvent(long batchId, String openedBy, long timestamp) implements LedgerEvent {}
