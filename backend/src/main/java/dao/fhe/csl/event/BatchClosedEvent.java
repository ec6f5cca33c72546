package dao.fhe.csl.event;

public record BatchClosedEvent(long batchId, int contributionCount, String closedBy, long timestamp) implements LedgerEvent {}
